package org.stianloader.picomodule.archive;

import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.zip.GZIPInputStream;
import java.util.zip.ZipException;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picomodule.FailureKind;
import org.stianloader.picomodule.ModuleException;
import org.stianloader.picomodule.internal.BoundedInputStream;
import org.stianloader.picomodule.internal.FileUtil;
import org.stianloader.picomodule.logging.LoggingAdapter;

/**
 * Streaming extractor for untrusted POSIX ustar archives.
 *
 * <p>Only regular files and directories are ever created. Hard links, symbolic links, devices and
 * every other entry type are rejected, as are names that would resolve outside of the destination directory.
 * All quotas of the supplied {@link ExtractionLimits} are checked before the payload of an entry is written,
 * and the decompressed stream itself is bounded while it is read so that a decompression bomb is cut off early.
 *
 * <p>Extraction is all or nothing: if the archive is rejected at any point, every file and directory created
 * by the call is deleted again before the {@link ModuleException} propagates.
 */
public final class TarExtractor {

    /**
     * Upper bound for the payload of PAX and GNU long name metadata records.
     */
    public static final int MAX_METADATA_BYTES = 1 << 20;

    private static final Pattern DRIVE_LETTER = Pattern.compile("^[a-zA-Z]:/.*");

    private TarExtractor() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Extract a decompressed tar stream into a directory.
     *
     * @param tar The decompressed tar stream, it is not closed by this method
     * @param destRoot The destination directory, created if absent
     * @param limits The quotas to enforce
     * @return The relative '/'-separated names of all extracted regular files, in archive order
     * @throws IOException If the destination cannot be written to
     * @throws ModuleException If the archive is malformed, unsafe or exceeds a quota
     */
    @NotNull
    public static List<String> extract(@NotNull InputStream tar, @NotNull Path destRoot, @NotNull ExtractionLimits limits) throws IOException {
        return TarExtractor.process(tar, destRoot, limits);
    }

    @NotNull
    public static List<String> extractGzip(@NotNull InputStream gzip, @NotNull Path destRoot, @NotNull ExtractionLimits limits) throws IOException {
        try {
            return TarExtractor.process(new GZIPInputStream(gzip), destRoot, limits);
        } catch (ZipException | EOFException e) {
            throw new ModuleException(FailureKind.MALFORMED_ARCHIVE, "Corrupt gzip stream: " + e.getMessage(), e);
        }
    }

    @NotNull
    public static List<String> extractGzip(@NotNull Path archive, @NotNull Path destRoot, @NotNull ExtractionLimits limits) throws IOException {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(archive))) {
            return TarExtractor.extractGzip(in, destRoot, limits);
        }
    }

    /**
     * Run every check {@link #extract(InputStream, Path, ExtractionLimits)} performs without writing anything.
     *
     * @param tar The decompressed tar stream, it is not closed by this method
     * @param limits The quotas to enforce
     * @return The relative names of all regular files, in archive order
     * @throws IOException If the stream cannot be read
     * @throws ModuleException If the archive would be rejected by the extractor
     */
    @NotNull
    public static List<String> inspect(@NotNull InputStream tar, @NotNull ExtractionLimits limits) throws IOException {
        return TarExtractor.process(tar, null, limits);
    }

    @NotNull
    public static List<String> inspectGzip(@NotNull Path archive, @NotNull ExtractionLimits limits) throws IOException {
        try (InputStream in = new GZIPInputStream(new BufferedInputStream(Files.newInputStream(archive)))) {
            return TarExtractor.process(in, null, limits);
        } catch (ZipException | EOFException e) {
            throw new ModuleException(FailureKind.MALFORMED_ARCHIVE, "Corrupt gzip stream: " + e.getMessage(), e);
        }
    }

    @NotNull
    private static List<String> process(@NotNull InputStream raw, @Nullable Path destRoot, @NotNull ExtractionLimits limits) throws IOException {
        BoundedInputStream in = new BoundedInputStream(raw, limits.maxTarBytes(), FailureKind.ARCHIVE_QUOTA_EXCEEDED, "Decompressed tar stream");
        // Inspection still needs a root for the lexical containment check
        Path root = (destRoot == null ? Paths.get("inspect") : destRoot).toAbsolutePath().normalize();
        List<Path> created = new ArrayList<>();
        Set<String> written = new LinkedHashSet<>();
        boolean success = false;

        try {
            if (destRoot != null) {
                TarExtractor.createDirectories(root, root, created);
            }

            byte[] block = new byte[TarHeader.BLOCK_SIZE];
            String pendingPaxPath = null;
            String pendingLongName = null;
            int entries = 0;
            long totalBytes = 0;

            while (true) {
                int read = TarExtractor.readFully(in, block, block.length);
                if (read == 0) {
                    // Missing end of archive marker, tolerated at a header boundary
                    break;
                } else if (read != block.length) {
                    throw new ModuleException(FailureKind.MALFORMED_ARCHIVE, "Unexpected end of tar stream (truncated header)");
                } else if (TarHeader.isZeroBlock(block)) {
                    break;
                }

                TarHeader header = TarHeader.parse(block);
                char type = header.typeflag;

                if (type == TarHeader.TYPE_PAX || type == TarHeader.TYPE_PAX_GLOBAL || type == TarHeader.TYPE_GNU_LONG_NAME) {
                    byte[] payload = TarExtractor.readMetadata(in, header);
                    if (type == TarHeader.TYPE_PAX) {
                        String path = TarExtractor.parsePaxPath(payload);
                        if (path != null) {
                            pendingPaxPath = path;
                        }
                    } else if (type == TarHeader.TYPE_GNU_LONG_NAME) {
                        String longName = new String(payload, StandardCharsets.UTF_8).replace("\0", "").trim();
                        if (!longName.isEmpty()) {
                            pendingLongName = longName;
                        }
                    }
                    continue;
                }

                String entryName = header.name;
                if (pendingLongName != null) {
                    entryName = pendingLongName;
                    pendingLongName = null;
                }
                if (pendingPaxPath != null) {
                    entryName = pendingPaxPath;
                    pendingPaxPath = null;
                }

                if (type == TarHeader.TYPE_HARD_LINK || type == TarHeader.TYPE_SYMLINK) {
                    throw ModuleException.forEntry(FailureKind.UNSAFE_ARCHIVE_ENTRY, "Refusing to extract link entry: " + entryName, entryName);
                } else if (type != TarHeader.TYPE_FILE && type != TarHeader.TYPE_FILE_OLD && type != TarHeader.TYPE_DIRECTORY) {
                    throw ModuleException.forEntry(FailureKind.UNSAFE_ARCHIVE_ENTRY, "Unsupported tar entry type '" + type + "' for " + entryName, entryName);
                }

                String rel = TarExtractor.normalizeEntryName(entryName);
                Path target = root.resolve(rel).normalize();
                if (target.equals(root) || !FileUtil.isWithinRoot(root, target)) {
                    throw ModuleException.forEntry(FailureKind.PATH_TRAVERSAL, "Unsafe tar entry (outside of the destination): " + rel, entryName);
                }

                if (++entries > limits.maxFiles()) {
                    throw ModuleException.forEntry(FailureKind.ARCHIVE_QUOTA_EXCEEDED, "Tar contains too many entries (max " + limits.maxFiles() + ")", entryName);
                }

                if (type == TarHeader.TYPE_DIRECTORY) {
                    if (destRoot != null) {
                        TarExtractor.createDirectories(root, target, created);
                    }
                    // Directories should not carry a payload, skip it if they do anyways
                    TarExtractor.discard(in, TarExtractor.padded(header.size));
                    continue;
                }

                if (header.size > limits.maxSingleFileBytes()) {
                    throw new ModuleException(FailureKind.ARCHIVE_QUOTA_EXCEEDED, "Tar entry too large: " + rel + " (" + header.size + " bytes, max " + limits.maxSingleFileBytes() + ")",
                            entryName, String.valueOf(limits.maxSingleFileBytes()), String.valueOf(header.size), null);
                }
                totalBytes += header.size;
                if (totalBytes > limits.maxTotalBytes()) {
                    throw ModuleException.forEntry(FailureKind.ARCHIVE_QUOTA_EXCEEDED, "Tar extracted content too large (max " + limits.maxTotalBytes() + " bytes)", entryName);
                }

                if (destRoot == null) {
                    TarExtractor.discard(in, header.size);
                } else {
                    Path parent = target.getParent();
                    if (parent != null) {
                        TarExtractor.createDirectories(root, parent, created);
                    }
                    TarExtractor.writeFile(in, target, header.size, created);
                }
                TarExtractor.discard(in, TarExtractor.padded(header.size) - header.size);
                written.add(rel);
            }

            success = true;
            return Collections.unmodifiableList(new ArrayList<>(written));
        } finally {
            if (!success) {
                TarExtractor.rollback(created);
            }
        }
    }

    @NotNull
    static String normalizeEntryName(@NotNull String entryName) {
        String name = entryName.replace('\\', '/');
        if (name.isEmpty() || name.indexOf('\0') != -1) {
            throw ModuleException.forEntry(FailureKind.UNSAFE_ARCHIVE_ENTRY, "Unsafe tar entry (empty or NUL)", entryName);
        }
        if (name.startsWith("/") || TarExtractor.DRIVE_LETTER.matcher(name).matches()) {
            throw ModuleException.forEntry(FailureKind.PATH_TRAVERSAL, "Unsafe tar entry (absolute path): " + entryName, entryName);
        }
        StringBuilder collapsed = new StringBuilder();
        for (String segment : name.split("/")) {
            if (segment.equals("..")) {
                throw ModuleException.forEntry(FailureKind.PATH_TRAVERSAL, "Unsafe tar entry (path traversal): " + entryName, entryName);
            } else if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (collapsed.length() != 0) {
                collapsed.append('/');
            }
            collapsed.append(segment);
        }
        if (collapsed.length() == 0) {
            throw ModuleException.forEntry(FailureKind.UNSAFE_ARCHIVE_ENTRY, "Unsafe tar entry (empty after normalization): " + entryName, entryName);
        }
        return collapsed.toString();
    }

    /**
     * Extract the {@code path} record of a PAX extended header. Records have the form {@code "<len> <key>=<value>\n"}
     * where {@code len} counts the bytes of the whole record.
     */
    @Nullable
    static String parsePaxPath(byte @NotNull[] payload) {
        String path = null;
        int i = 0;
        while (i < payload.length) {
            int space = i;
            while (space < payload.length && payload[space] != ' ') {
                space++;
            }
            if (space == payload.length) {
                break;
            }
            int length;
            try {
                length = Integer.parseInt(new String(payload, i, space - i, StandardCharsets.US_ASCII));
            } catch (NumberFormatException e) {
                throw new ModuleException(FailureKind.MALFORMED_ARCHIVE, "Malformed PAX record length", e);
            }
            if (length <= 0 || i + length > payload.length || space + 1 > i + length) {
                throw new ModuleException(FailureKind.MALFORMED_ARCHIVE, "Malformed PAX record length: " + length);
            }
            int end = i + length;
            if (payload[end - 1] == '\n') {
                end--;
            }
            String record = new String(payload, space + 1, end - space - 1, StandardCharsets.UTF_8);
            int eq = record.indexOf('=');
            if (eq != -1 && record.substring(0, eq).equals("path")) {
                path = record.substring(eq + 1);
            }
            i += length;
        }
        return path;
    }

    private static byte @NotNull[] readMetadata(@NotNull InputStream in, @NotNull TarHeader header) throws IOException {
        if (header.size > TarExtractor.MAX_METADATA_BYTES) {
            throw new ModuleException(FailureKind.ARCHIVE_QUOTA_EXCEEDED, "Tar metadata entry too large (max " + TarExtractor.MAX_METADATA_BYTES + " bytes)");
        }
        byte[] payload = new byte[(int) header.size];
        if (TarExtractor.readFully(in, payload, payload.length) != payload.length) {
            throw new ModuleException(FailureKind.MALFORMED_ARCHIVE, "Unexpected end of tar stream (truncated metadata record)");
        }
        TarExtractor.discard(in, TarExtractor.padded(header.size) - header.size);
        return payload;
    }

    private static void writeFile(@NotNull InputStream in, @NotNull Path target, long size, @NotNull List<Path> created) throws IOException {
        if (Files.isSymbolicLink(target)) {
            throw ModuleException.forEntry(FailureKind.PATH_TRAVERSAL, "Refusing to write through a symbolic link: " + target, target.toString());
        }
        if (!Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            created.add(target);
        }
        byte[] buffer = new byte[8192];
        long remaining = size;
        try (OutputStream out = Files.newOutputStream(target, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE, LinkOption.NOFOLLOW_LINKS)) {
            while (remaining > 0) {
                int read = in.read(buffer, 0, (int) Math.min(buffer.length, remaining));
                if (read < 0) {
                    throw new ModuleException(FailureKind.MALFORMED_ARCHIVE, "Unexpected end of tar stream (truncated archive)");
                }
                out.write(buffer, 0, read);
                remaining -= read;
            }
        }
    }

    private static void createDirectories(@NotNull Path root, @NotNull Path dir, @NotNull List<Path> created) throws IOException {
        if (Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        if (Files.isSymbolicLink(dir)) {
            throw ModuleException.forEntry(FailureKind.PATH_TRAVERSAL, "Refusing to extract through a symbolic link: " + dir, dir.toString());
        }
        Path parent = dir.getParent();
        if (parent != null && !dir.equals(root)) {
            TarExtractor.createDirectories(root, parent, created);
        } else if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.createDirectory(dir);
        created.add(dir);
    }

    private static void rollback(@NotNull List<Path> created) {
        for (int i = created.size() - 1; i >= 0; i--) {
            Path path = created.get(i);
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                LoggingAdapter.getDefaultLogger().warn(TarExtractor.class, "Unable to remove partially extracted path {}", path, e);
            }
        }
    }

    private static long padded(long size) {
        long remainder = size % TarHeader.BLOCK_SIZE;
        return remainder == 0 ? size : size + TarHeader.BLOCK_SIZE - remainder;
    }

    private static int readFully(@NotNull InputStream in, byte @NotNull[] buffer, int length) throws IOException {
        int total = 0;
        while (total < length) {
            int read = in.read(buffer, total, length - total);
            if (read < 0) {
                break;
            }
            total += read;
        }
        return total;
    }

    private static void discard(@NotNull InputStream in, long amount) throws IOException {
        byte[] buffer = new byte[8192];
        long remaining = amount;
        while (remaining > 0) {
            int read = in.read(buffer, 0, (int) Math.min(buffer.length, remaining));
            if (read < 0) {
                throw new ModuleException(FailureKind.MALFORMED_ARCHIVE, "Unexpected end of tar stream (truncated archive)");
            }
            remaining -= read;
        }
    }
}
