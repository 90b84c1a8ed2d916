package org.stianloader.picomodule.repo;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URLConnection;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.util.concurrent.TimeUnit;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picomodule.FailureKind;
import org.stianloader.picomodule.ModuleException;
import org.stianloader.picomodule.integrity.Digests;
import org.stianloader.picomodule.internal.BoundedInputStream;
import org.stianloader.picomodule.logging.LoggingAdapter;

/**
 * Blocking fetches over {@link URLConnection} with an overall deadline and an incremental byte ceiling.
 *
 * <p>The connect and read timeouts of the connection are derived from the time left until the deadline,
 * and the deadline is checked again after every read. A server that trickles bytes therefore cannot keep
 * a fetch alive for longer than the deadline plus a single read timeout. The byte ceiling is checked against
 * the declared {@code Content-Length} before the body is read and against the observed byte count while it
 * is read, so an oversized body is never buffered or written beyond the ceiling.
 *
 * <p>Any non-{@code http(s)} URL supported by {@link URLConnection}, such as {@code file:}, works as well.
 * Methods of this class block and are meant to be run through the executor of the calling operation.
 */
public class HttpTransport {

    @NotNull
    private static final String USER_AGENT = "picomodule/1.0";

    @NotNull
    private final String userAgent;

    public HttpTransport() {
        this(HttpTransport.USER_AGENT);
    }

    public HttpTransport(@NotNull String userAgent) {
        this.userAgent = userAgent;
    }

    /**
     * Fetch a resource into memory.
     *
     * @param uri The resource to fetch
     * @param maxBytes The maximum size of the body
     * @param timeoutMillis The overall deadline of the fetch
     * @param description What is fetched, used in log and exception messages
     * @return The body
     * @throws ModuleException With {@link FailureKind#TIMEOUT}, {@link FailureKind#PAYLOAD_TOO_LARGE} or
     * {@link FailureKind#DOWNLOAD_FAILED}
     */
    public byte @NotNull[] fetchBytes(@NotNull URI uri, long maxBytes, long timeoutMillis, @NotNull String description) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        this.transfer(uri, out, maxBytes, timeoutMillis, description, null);
        return out.toByteArray();
    }

    /**
     * Stream a resource into a file while hashing it. The file is deleted again if the transfer fails.
     *
     * @param uri The resource to fetch
     * @param target The file to write, replaced if it exists
     * @param maxBytes The maximum size of the body
     * @param timeoutMillis The overall deadline of the fetch
     * @param description What is fetched, used in log and exception messages
     * @return The written file along with its size and sha256 digest
     * @throws ModuleException With {@link FailureKind#TIMEOUT}, {@link FailureKind#PAYLOAD_TOO_LARGE},
     * {@link FailureKind#DOWNLOAD_FAILED} or {@link FailureKind#IO_FAILURE}
     */
    @NotNull
    public DownloadedFile download(@NotNull URI uri, @NotNull Path target, long maxBytes, long timeoutMillis, @NotNull String description) {
        MessageDigest digest = Digests.newSha256();
        boolean success = false;
        try {
            long size;
            try (OutputStream out = Files.newOutputStream(target)) {
                size = this.transfer(uri, out, maxBytes, timeoutMillis, description, digest);
            } catch (IOException e) {
                throw new ModuleException(FailureKind.IO_FAILURE, "Unable to write " + description + " to " + target + ": " + e.getMessage(), e);
            }
            success = true;
            return new DownloadedFile(target, size, Digests.toHex(digest.digest()));
        } finally {
            if (!success) {
                try {
                    Files.deleteIfExists(target);
                } catch (IOException e) {
                    LoggingAdapter.getDefaultLogger().warn(HttpTransport.class, "Unable to delete partial download {}", target, e);
                }
            }
        }
    }

    private long transfer(@NotNull URI uri, @NotNull OutputStream out, long maxBytes, long timeoutMillis,
            @NotNull String description, @Nullable MessageDigest digest) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        LoggingAdapter.getDefaultLogger().debug(HttpTransport.class, "Fetching {} from {}", description, uri);
        URLConnection connection = null;
        try {
            connection = uri.toURL().openConnection();
            int timeout = HttpTransport.remainingMillis(deadline, uri, timeoutMillis, description);
            connection.setConnectTimeout(timeout);
            connection.setReadTimeout(timeout);
            connection.setUseCaches(false);
            connection.setRequestProperty("User-Agent", this.userAgent);
            connection.connect();

            if (connection instanceof HttpURLConnection) {
                HttpURLConnection httpUrlConn = (HttpURLConnection) connection;
                int status = httpUrlConn.getResponseCode();
                if ((status / 100) != 2) {
                    throw new ModuleException(FailureKind.DOWNLOAD_FAILED, "Query for " + uri + " returned with a response code of " + status + " (" + httpUrlConn.getResponseMessage() + ")");
                }
            }

            long declared = connection.getContentLengthLong();
            if (declared > maxBytes) {
                throw ModuleException.mismatch(FailureKind.PAYLOAD_TOO_LARGE, description + " too large: declared " + declared + " bytes, limit is " + maxBytes + " bytes",
                        String.valueOf(maxBytes), String.valueOf(declared));
            }

            HttpTransport.remainingMillis(deadline, uri, timeoutMillis, description);
            try (InputStream raw = connection.getInputStream()) {
                InputStream in = new BoundedInputStream(raw, maxBytes, FailureKind.PAYLOAD_TOO_LARGE, description + " from " + uri);
                if (digest != null) {
                    in = new DigestInputStream(in, digest);
                }
                byte[] buffer = new byte[8192];
                long total = 0;
                for (int read = in.read(buffer); read != -1; read = in.read(buffer)) {
                    out.write(buffer, 0, read);
                    total += read;
                    HttpTransport.remainingMillis(deadline, uri, timeoutMillis, description);
                }
                return total;
            }
        } catch (SocketTimeoutException e) {
            throw new ModuleException(FailureKind.TIMEOUT, "Timed out fetching " + description + " from " + uri + " (limit " + timeoutMillis + " ms)", e);
        } catch (IOException e) {
            throw new ModuleException(FailureKind.DOWNLOAD_FAILED, "Unable to fetch " + description + " from " + uri + ": " + e, e);
        } catch (IllegalArgumentException e) {
            // URI is not absolute
            throw new ModuleException(FailureKind.DOWNLOAD_FAILED, "Unable to fetch " + description + " from " + uri + ": " + e.getMessage(), e);
        } finally {
            if (connection instanceof HttpURLConnection) {
                ((HttpURLConnection) connection).disconnect();
            }
        }
    }

    private static int remainingMillis(long deadline, @NotNull URI uri, long timeoutMillis, @NotNull String description) {
        long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
        if (remaining <= 0) {
            throw new ModuleException(FailureKind.TIMEOUT, "Timed out fetching " + description + " from " + uri + " (limit " + timeoutMillis + " ms)");
        }
        return (int) Math.min(Integer.MAX_VALUE, remaining);
    }
}
