package org.stianloader.picomodule.integrity;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import org.jetbrains.annotations.NotNull;

public final class Digests {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private Digests() {
        throw new UnsupportedOperationException("Utility class");
    }

    @NotNull
    public static MessageDigest newSha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // Every JRE is required to ship SHA-256
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    @NotNull
    public static String toHex(byte @NotNull[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            out[i * 2] = Digests.HEX[(bytes[i] >> 4) & 0x0F];
            out[i * 2 + 1] = Digests.HEX[bytes[i] & 0x0F];
        }
        return new String(out);
    }

    @NotNull
    public static String sha256Hex(byte @NotNull[] data) {
        return Digests.toHex(Digests.newSha256().digest(data));
    }

    @NotNull
    public static String sha256Hex(@NotNull Path file) throws IOException {
        MessageDigest digest = Digests.newSha256();
        try (InputStream in = Files.newInputStream(file)) {
            Digests.update(digest, in);
        }
        return Digests.toHex(digest.digest());
    }

    static long update(@NotNull MessageDigest digest, @NotNull InputStream in) throws IOException {
        byte[] buffer = new byte[8192];
        long total = 0;
        for (int read = in.read(buffer); read != -1; read = in.read(buffer)) {
            digest.update(buffer, 0, read);
            total += read;
        }
        return total;
    }
}
