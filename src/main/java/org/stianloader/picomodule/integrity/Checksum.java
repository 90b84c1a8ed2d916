package org.stianloader.picomodule.integrity;

import java.util.Locale;
import java.util.regex.Pattern;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picomodule.FailureKind;
import org.stianloader.picomodule.ModuleException;

/**
 * A parsed {@code sha256:<64 lowercase hex>} checksum as found in the distribution descriptor of a registry entry.
 *
 * @param hex The 64 lowercase hexadecimal characters of the digest
 */
public final record Checksum(@NotNull String hex) {

    @NotNull
    public static final String PREFIX = "sha256:";

    private static final Pattern HEX_DIGEST = Pattern.compile("[0-9a-f]{64}");

    public Checksum {
        if (!Checksum.HEX_DIGEST.matcher(hex).matches()) {
            throw new ModuleException(FailureKind.INVALID_CHECKSUM_FORMAT, "Not a lowercase hexadecimal sha256 digest: " + hex);
        }
    }

    /**
     * Parse a checksum string. The algorithm prefix must be exactly {@code sha256:} and the digest must consist of
     * 64 lowercase hexadecimal characters. No normalization is applied, a registry that publishes uppercase digests
     * publishes invalid checksums.
     *
     * @param checksum The checksum string, may be null
     * @return The parsed checksum
     * @throws ModuleException With {@link FailureKind#MISSING_CHECKSUM} if the string is null or blank,
     * or with {@link FailureKind#INVALID_CHECKSUM_FORMAT} if it is malformed
     */
    @NotNull
    public static Checksum parse(@Nullable String checksum) {
        if (checksum == null || checksum.isBlank()) {
            throw new ModuleException(FailureKind.MISSING_CHECKSUM, "No checksum given");
        }
        if (!checksum.startsWith(Checksum.PREFIX)) {
            int colon = checksum.indexOf(':');
            String algorithm = colon == -1 ? "<none>" : checksum.substring(0, colon).toLowerCase(Locale.ROOT);
            throw new ModuleException(FailureKind.INVALID_CHECKSUM_FORMAT, "Unsupported checksum algorithm '" + algorithm + "', expected 'sha256:<64 hex>'");
        }
        return new Checksum(checksum.substring(Checksum.PREFIX.length()));
    }

    @Contract(pure = true)
    public boolean matches(@NotNull String actualHex) {
        return this.hex.equals(actualHex);
    }

    /**
     * Throw a {@link FailureKind#CHECKSUM_MISMATCH} exception carrying both digests if the actual digest differs.
     *
     * @param actualHex The observed digest
     * @param subject What was hashed, used in the exception message
     */
    public void verify(@NotNull String actualHex, @NotNull String subject) {
        if (!this.matches(actualHex)) {
            throw ModuleException.mismatch(FailureKind.CHECKSUM_MISMATCH, "Checksum mismatch for " + subject, this.toString(), Checksum.PREFIX + actualHex);
        }
    }

    @Override
    @NotNull
    public String toString() {
        return Checksum.PREFIX + this.hex;
    }
}
