package org.stianloader.picomodule.integrity;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picomodule.FailureKind;
import org.stianloader.picomodule.ModuleException;
import org.stianloader.picomodule.archive.ExtractionLimits;
import org.stianloader.picomodule.internal.FileUtil;

/**
 * Per-file digests of an installed module, as recorded in its provenance record.
 *
 * <p>Each file digest is the sha256 of the file content followed by {@code "\nsize:<n>\n"}, which makes
 * truncated files stand out even to a reader that only compares digests. The provenance file itself,
 * symbolic links and {@code .DS_Store}/{@code __MACOSX} entries are not covered.
 *
 * @param algorithm Always {@code sha256}
 * @param maxFiles The file count limit the digests were computed under
 * @param maxTotalBytes The total size limit the digests were computed under
 * @param maxSingleFileBytes The per-file size limit the digests were computed under
 * @param totalBytes The sum of the sizes of all covered files
 * @param files Relative '/'-separated path to hex digest, sorted by path
 */
public final record ModuleIntegrity(@NotNull String algorithm, int maxFiles, long maxTotalBytes, long maxSingleFileBytes,
        long totalBytes, @NotNull Map<String, String> files) {

    @NotNull
    public static final String ALGORITHM = "sha256";

    @NotNull
    public static final String PROVENANCE_FILE_NAME = "provenance.json";

    public ModuleIntegrity {
        files = Collections.unmodifiableMap(new TreeMap<>(files));
    }

    @NotNull
    public static ModuleIntegrity compute(@NotNull Path moduleDir) throws IOException {
        return ModuleIntegrity.compute(moduleDir, ExtractionLimits.DEFAULT.maxFiles(), ExtractionLimits.DEFAULT.maxTotalBytes(), ExtractionLimits.DEFAULT.maxSingleFileBytes());
    }

    @NotNull
    public static ModuleIntegrity compute(@NotNull Path moduleDir, int maxFiles, long maxTotalBytes, long maxSingleFileBytes) throws IOException {
        List<String> relFiles = new ArrayList<>(FileUtil.listRegularFiles(moduleDir, false));
        relFiles.remove(ModuleIntegrity.PROVENANCE_FILE_NAME);
        if (relFiles.size() > maxFiles) {
            throw new ModuleException(FailureKind.ARCHIVE_QUOTA_EXCEEDED, "Module has too many files to hash (max " + maxFiles + "): " + relFiles.size());
        }

        Map<String, String> files = new TreeMap<>();
        long totalBytes = 0;
        for (String rel : relFiles) {
            Path file = moduleDir.resolve(rel);
            long size = Files.size(file);
            if (size > maxSingleFileBytes) {
                throw ModuleException.forEntry(FailureKind.ARCHIVE_QUOTA_EXCEEDED, "Module file too large for integrity hashing (max " + maxSingleFileBytes + " bytes): " + rel, rel);
            }
            totalBytes += size;
            if (totalBytes > maxTotalBytes) {
                throw new ModuleException(FailureKind.ARCHIVE_QUOTA_EXCEEDED, "Module too large for integrity hashing (max " + maxTotalBytes + " bytes)");
            }
            files.put(rel, ModuleIntegrity.hashFile(file));
        }

        return new ModuleIntegrity(ModuleIntegrity.ALGORITHM, maxFiles, maxTotalBytes, maxSingleFileBytes, totalBytes, files);
    }

    @NotNull
    static String hashFile(@NotNull Path file) throws IOException {
        MessageDigest digest = Digests.newSha256();
        long size;
        try (InputStream in = Files.newInputStream(file)) {
            size = Digests.update(digest, in);
        }
        digest.update(("\nsize:" + size + "\n").getBytes(StandardCharsets.UTF_8));
        return Digests.toHex(digest.digest());
    }

    /**
     * Recompute the digests of a module directory under the limits recorded in this instance and compare them.
     *
     * @param moduleDir The directory of the installed module
     * @throws IOException If the directory cannot be read
     * @throws ModuleException With {@link FailureKind#CHECKSUM_MISMATCH} if the file list or any digest changed
     */
    public void verify(@NotNull Path moduleDir) throws IOException {
        if (this.files.isEmpty()) {
            throw new ModuleException(FailureKind.CHECKSUM_MISMATCH, "Recorded integrity file list is empty");
        }
        if (!ModuleIntegrity.ALGORITHM.equals(this.algorithm)) {
            throw new ModuleException(FailureKind.INVALID_CHECKSUM_FORMAT, "Unsupported integrity algorithm: " + this.algorithm);
        }
        ModuleIntegrity computed = ModuleIntegrity.compute(moduleDir, this.maxFiles, this.maxTotalBytes, this.maxSingleFileBytes);
        if (!this.files.keySet().equals(computed.files.keySet())) {
            List<String> added = new ArrayList<>(computed.files.keySet());
            added.removeAll(this.files.keySet());
            List<String> removed = new ArrayList<>(this.files.keySet());
            removed.removeAll(computed.files.keySet());
            throw new ModuleException(FailureKind.CHECKSUM_MISMATCH, "Integrity file list changed (added: " + added + ", removed: " + removed + ")");
        }
        for (Map.Entry<String, String> entry : this.files.entrySet()) {
            String actual = computed.files.get(entry.getKey());
            if (!entry.getValue().equals(actual)) {
                throw new ModuleException(FailureKind.CHECKSUM_MISMATCH, "Integrity mismatch for " + entry.getKey(), entry.getKey(), entry.getValue(), actual, null);
            }
        }
    }
}
