package org.stianloader.picomodule.archive;

import java.nio.charset.StandardCharsets;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picomodule.FailureKind;
import org.stianloader.picomodule.ModuleException;

/**
 * A single 512 byte ustar header block, shared between {@link TarExtractor} and {@link TarArchiveWriter}.
 */
final class TarHeader {

    static final int BLOCK_SIZE = 512;

    static final char TYPE_FILE = '0';
    static final char TYPE_FILE_OLD = '\0';
    static final char TYPE_HARD_LINK = '1';
    static final char TYPE_SYMLINK = '2';
    static final char TYPE_DIRECTORY = '5';
    static final char TYPE_PAX = 'x';
    static final char TYPE_PAX_GLOBAL = 'g';
    static final char TYPE_GNU_LONG_NAME = 'L';

    private static final int OFFSET_NAME = 0;
    private static final int LENGTH_NAME = 100;
    private static final int OFFSET_MODE = 100;
    private static final int OFFSET_UID = 108;
    private static final int OFFSET_GID = 116;
    private static final int OFFSET_SIZE = 124;
    private static final int OFFSET_MTIME = 136;
    private static final int OFFSET_CHECKSUM = 148;
    private static final int OFFSET_TYPEFLAG = 156;
    private static final int OFFSET_MAGIC = 257;
    private static final int OFFSET_VERSION = 263;
    private static final int OFFSET_UNAME = 265;
    private static final int OFFSET_GNAME = 297;
    private static final int OFFSET_PREFIX = 345;
    private static final int LENGTH_PREFIX = 155;

    @NotNull
    final String name;
    final long size;
    final char typeflag;

    private TarHeader(@NotNull String name, long size, char typeflag) {
        this.name = name;
        this.size = size;
        this.typeflag = typeflag;
    }

    @Contract(pure = true)
    static boolean isZeroBlock(byte @NotNull[] block) {
        for (byte b : block) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Parse a header block. The block must not be an all-zero end of archive marker.
     *
     * @param block The 512 bytes of the header
     * @return The parsed header
     * @throws ModuleException With {@link FailureKind#MALFORMED_ARCHIVE} if the block is not a valid ustar header
     */
    @NotNull
    static TarHeader parse(byte @NotNull[] block) {
        if (!TarHeader.hasUstarMagic(block)) {
            throw new ModuleException(FailureKind.MALFORMED_ARCHIVE, "Archive is not a POSIX ustar archive (missing 'ustar' magic)");
        }

        long storedChecksum = TarHeader.parseNumeric(block, OFFSET_CHECKSUM, 8, "checksum");
        long unsigned = 0;
        long signed = 0;
        for (int i = 0; i < BLOCK_SIZE; i++) {
            if (i >= OFFSET_CHECKSUM && i < OFFSET_CHECKSUM + 8) {
                unsigned += ' ';
                signed += ' ';
            } else {
                unsigned += block[i] & 0xFF;
                signed += block[i];
            }
        }
        if (storedChecksum != unsigned && storedChecksum != signed) {
            throw new ModuleException(FailureKind.MALFORMED_ARCHIVE, "Tar header checksum mismatch: stored " + storedChecksum + ", computed " + unsigned);
        }

        char typeflag = (char) (block[OFFSET_TYPEFLAG] & 0xFF);
        long size = TarHeader.parseNumeric(block, OFFSET_SIZE, 12, "size");
        if (size < 0) {
            throw new ModuleException(FailureKind.MALFORMED_ARCHIVE, "Negative tar entry size: " + size);
        }

        String name = TarHeader.readString(block, OFFSET_NAME, LENGTH_NAME);
        // GNU tar reuses the prefix area for other fields, only POSIX ustar ("ustar\0") carries a prefix
        if (block[OFFSET_MAGIC + 5] == 0) {
            String prefix = TarHeader.readString(block, OFFSET_PREFIX, LENGTH_PREFIX);
            if (!prefix.isEmpty()) {
                name = prefix + '/' + name;
            }
        }

        return new TarHeader(name, size, typeflag);
    }

    @Contract(pure = true)
    private static boolean hasUstarMagic(byte @NotNull[] block) {
        return block[OFFSET_MAGIC] == 'u'
                && block[OFFSET_MAGIC + 1] == 's'
                && block[OFFSET_MAGIC + 2] == 't'
                && block[OFFSET_MAGIC + 3] == 'a'
                && block[OFFSET_MAGIC + 4] == 'r';
    }

    @NotNull
    private static String readString(byte @NotNull[] block, int offset, int length) {
        int end = offset;
        while (end < offset + length && block[end] != 0) {
            end++;
        }
        return new String(block, offset, end - offset, StandardCharsets.UTF_8);
    }

    /**
     * Parse an octal numeric field, or a GNU base-256 field if the high bit of the first byte is set.
     */
    static long parseNumeric(byte @NotNull[] block, int offset, int length, @NotNull String field) {
        if ((block[offset] & 0x80) != 0) {
            if (length > 9 && block[offset + 1] != 0) {
                // Leading byte beyond the 63 value bits of a long
                throw new ModuleException(FailureKind.MALFORMED_ARCHIVE, "Tar header field '" + field + "' is out of range");
            }
            long value = block[offset] & 0x7F;
            for (int i = 1; i < length; i++) {
                if (value > (Long.MAX_VALUE >> 8)) {
                    throw new ModuleException(FailureKind.MALFORMED_ARCHIVE, "Tar header field '" + field + "' is out of range");
                }
                value = (value << 8) | (block[offset + i] & 0xFF);
            }
            return value;
        }

        long value = 0;
        boolean seenDigit = false;
        for (int i = offset; i < offset + length; i++) {
            byte b = block[i];
            if (b == 0 || b == ' ') {
                if (seenDigit) {
                    break;
                }
                continue;
            }
            if (b < '0' || b > '7') {
                throw new ModuleException(FailureKind.MALFORMED_ARCHIVE, "Tar header field '" + field + "' is not octal");
            }
            seenDigit = true;
            value = (value << 3) | (b - '0');
        }
        return value;
    }

    /**
     * Write a deterministic ustar header: uid/gid 0, owner and group "root", no prefix.
     *
     * @param name The member name, at most 100 UTF-8 bytes
     * @param size The payload size
     * @param mode The permission bits
     * @param mtime The modification time in seconds since the epoch
     * @param typeflag The entry type
     * @return The header block
     */
    static byte @NotNull[] write(@NotNull String name, long size, int mode, long mtime, char typeflag) {
        byte[] block = new byte[BLOCK_SIZE];
        byte[] nameBytes = name.getBytes(StandardCharsets.UTF_8);
        if (nameBytes.length > LENGTH_NAME) {
            throw new IllegalArgumentException("Name too long for a plain ustar header: " + name);
        }
        System.arraycopy(nameBytes, 0, block, OFFSET_NAME, nameBytes.length);
        TarHeader.writeOctal(block, OFFSET_MODE, 8, mode);
        TarHeader.writeOctal(block, OFFSET_UID, 8, 0);
        TarHeader.writeOctal(block, OFFSET_GID, 8, 0);
        TarHeader.writeOctal(block, OFFSET_SIZE, 12, size);
        TarHeader.writeOctal(block, OFFSET_MTIME, 12, mtime);
        block[OFFSET_TYPEFLAG] = (byte) typeflag;
        System.arraycopy("ustar\0".getBytes(StandardCharsets.US_ASCII), 0, block, OFFSET_MAGIC, 6);
        block[OFFSET_VERSION] = '0';
        block[OFFSET_VERSION + 1] = '0';
        byte[] root = "root".getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(root, 0, block, OFFSET_UNAME, root.length);
        System.arraycopy(root, 0, block, OFFSET_GNAME, root.length);

        for (int i = OFFSET_CHECKSUM; i < OFFSET_CHECKSUM + 8; i++) {
            block[i] = ' ';
        }
        long checksum = 0;
        for (byte b : block) {
            checksum += b & 0xFF;
        }
        // Six octal digits, NUL, space
        TarHeader.writeOctal(block, OFFSET_CHECKSUM, 7, checksum);
        block[OFFSET_CHECKSUM + 7] = ' ';
        return block;
    }

    private static void writeOctal(byte @NotNull[] block, int offset, int length, long value) {
        String octal = Long.toOctalString(value);
        int digits = length - 1;
        if (octal.length() > digits) {
            throw new IllegalArgumentException("Value " + value + " does not fit into " + digits + " octal digits");
        }
        int pad = digits - octal.length();
        for (int i = 0; i < pad; i++) {
            block[offset + i] = '0';
        }
        for (int i = 0; i < octal.length(); i++) {
            block[offset + pad + i] = (byte) octal.charAt(i);
        }
        block[offset + digits] = 0;
    }
}
