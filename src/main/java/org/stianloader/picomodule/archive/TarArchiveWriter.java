package org.stianloader.picomodule.archive;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPOutputStream;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Writer for reproducible ustar archives. Every member is a regular file with mode 0644, uid and gid 0,
 * owner and group "root" and a fixed modification time, so that equal inputs always produce equal bytes.
 * Member names longer than 100 bytes are carried in a PAX {@code path} record.
 *
 * <p>The writer never sorts: callers decide the member order.
 */
public final class TarArchiveWriter implements Closeable {

    private static final int MODE = 0644;
    private static final int MAX_PLAIN_NAME = 100;

    @NotNull
    private final OutputStream out;
    private final long mtime;
    private boolean closed;

    public TarArchiveWriter(@NotNull OutputStream out) {
        this(out, 0L);
    }

    public TarArchiveWriter(@NotNull OutputStream out, long mtime) {
        this.out = out;
        this.mtime = mtime;
    }

    /**
     * Create a writer that gzip compresses its output. The gzip header written by {@link GZIPOutputStream}
     * has a modification time of 0 and carries no file name, so the compressed bytes are reproducible as well.
     *
     * @param out The sink for the compressed archive, closed when the writer is closed
     * @return The writer
     * @throws IOException If the gzip header cannot be written
     */
    @NotNull
    @Contract("_ -> new")
    public static TarArchiveWriter gzip(@NotNull OutputStream out) throws IOException {
        return new TarArchiveWriter(new GZIPOutputStream(out, 8192));
    }

    public void addFile(@NotNull String name, @NotNull Path source) throws IOException {
        long size = Files.size(source);
        this.writeHeaders(name, size);
        long copied;
        try (InputStream in = Files.newInputStream(source)) {
            copied = in.transferTo(this.out);
        }
        if (copied != size) {
            throw new IOException("File " + source + " changed size while being archived (expected " + size + " bytes, copied " + copied + ")");
        }
        this.pad(size);
    }

    public void addFile(@NotNull String name, byte @NotNull[] content) throws IOException {
        this.writeHeaders(name, content.length);
        this.out.write(content);
        this.pad(content.length);
    }

    private void writeHeaders(@NotNull String name, long size) throws IOException {
        if (this.closed) {
            throw new IllegalStateException("Writer already closed");
        }
        byte[] nameBytes = name.getBytes(StandardCharsets.UTF_8);
        if (nameBytes.length <= MAX_PLAIN_NAME) {
            this.out.write(TarHeader.write(name, size, MODE, this.mtime, TarHeader.TYPE_FILE));
            return;
        }

        byte[] record = TarArchiveWriter.paxRecord("path", name);
        String truncated = TarArchiveWriter.truncate(name, MAX_PLAIN_NAME - "PaxHeaders/".length());
        this.out.write(TarHeader.write("PaxHeaders/" + truncated, record.length, MODE, this.mtime, TarHeader.TYPE_PAX));
        this.out.write(record);
        this.pad(record.length);
        this.out.write(TarHeader.write(TarArchiveWriter.truncate(name, MAX_PLAIN_NAME), size, MODE, this.mtime, TarHeader.TYPE_FILE));
    }

    /**
     * Build a {@code "<len> <key>=<value>\n"} record. The length prefix counts its own digits.
     */
    static byte @NotNull[] paxRecord(@NotNull String key, @NotNull String value) {
        int body = (" " + key + "=" + value + "\n").getBytes(StandardCharsets.UTF_8).length;
        int length = body + Integer.toString(body).length();
        if (Integer.toString(length).length() != Integer.toString(body).length()) {
            length++;
        }
        return (length + " " + key + "=" + value + "\n").getBytes(StandardCharsets.UTF_8);
    }

    @NotNull
    private static String truncate(@NotNull String name, int maxBytes) {
        StringBuilder builder = new StringBuilder();
        int bytes = 0;
        for (int i = 0; i < name.length(); i = name.offsetByCodePoints(i, 1)) {
            int codePoint = name.codePointAt(i);
            int width = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8).length;
            if (bytes + width > maxBytes) {
                break;
            }
            builder.appendCodePoint(codePoint);
            bytes += width;
        }
        return builder.toString();
    }

    private void pad(long size) throws IOException {
        int remainder = (int) (size % TarHeader.BLOCK_SIZE);
        if (remainder != 0) {
            this.out.write(new byte[TarHeader.BLOCK_SIZE - remainder]);
        }
    }

    @Override
    public void close() throws IOException {
        if (this.closed) {
            return;
        }
        this.closed = true;
        try {
            this.out.write(new byte[TarHeader.BLOCK_SIZE * 2]);
        } finally {
            this.out.close();
        }
    }
}
