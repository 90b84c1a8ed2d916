package org.stianloader.picomodule.archive;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Quotas enforced by {@link TarExtractor} while reading an archive.
 *
 * @param maxFiles The maximum amount of file and directory entries
 * @param maxTotalBytes The maximum sum of all regular file sizes
 * @param maxSingleFileBytes The maximum size of a single regular file
 * @param maxTarBytes The maximum amount of decompressed tar bytes read from the stream, headers and padding included
 */
public final record ExtractionLimits(int maxFiles, long maxTotalBytes, long maxSingleFileBytes, long maxTarBytes) {

    /**
     * 5 000 files, 50 MiB in total, 20 MiB per file and 100 MiB of decompressed tar stream.
     */
    @NotNull
    public static final ExtractionLimits DEFAULT = new ExtractionLimits(5_000, 50L << 20, 20L << 20, 100L << 20);

    public ExtractionLimits {
        if (maxFiles < 1 || maxTotalBytes < 0 || maxSingleFileBytes < 0 || maxTarBytes < 0) {
            throw new IllegalArgumentException("Extraction limits must be positive: " + maxFiles + "/" + maxTotalBytes + "/" + maxSingleFileBytes + "/" + maxTarBytes);
        }
    }

    @NotNull
    @Contract(pure = true)
    public ExtractionLimits withMaxFiles(int maxFiles) {
        return new ExtractionLimits(maxFiles, this.maxTotalBytes, this.maxSingleFileBytes, this.maxTarBytes);
    }

    @NotNull
    @Contract(pure = true)
    public ExtractionLimits withMaxTotalBytes(long maxTotalBytes) {
        return new ExtractionLimits(this.maxFiles, maxTotalBytes, this.maxSingleFileBytes, this.maxTarBytes);
    }

    @NotNull
    @Contract(pure = true)
    public ExtractionLimits withMaxSingleFileBytes(long maxSingleFileBytes) {
        return new ExtractionLimits(this.maxFiles, this.maxTotalBytes, maxSingleFileBytes, this.maxTarBytes);
    }

    @NotNull
    @Contract(pure = true)
    public ExtractionLimits withMaxTarBytes(long maxTarBytes) {
        return new ExtractionLimits(this.maxFiles, this.maxTotalBytes, this.maxSingleFileBytes, maxTarBytes);
    }
}
