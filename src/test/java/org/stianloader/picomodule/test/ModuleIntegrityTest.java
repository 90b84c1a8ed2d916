package org.stianloader.picomodule.test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stianloader.picomodule.FailureKind;
import org.stianloader.picomodule.ModuleException;
import org.stianloader.picomodule.integrity.ModuleIntegrity;
import org.stianloader.picomodule.manifest.ProvenanceRecord;
import org.stianloader.picomodule.manifest.ProvenanceStore;

public class ModuleIntegrityTest {

    @TempDir
    Path temp;

    private Path module() throws IOException {
        Path dir = this.temp.resolve("demo");
        TarFixtures.writeModule(dir, "demo", "1.0.0");
        Files.createDirectories(dir.resolve("sub"));
        Files.write(dir.resolve("sub/data.txt"), "data".getBytes(StandardCharsets.UTF_8));
        Files.write(dir.resolve(".DS_Store"), new byte[] {1, 2, 3});
        return dir;
    }

    @Test
    public void testComputeCoversRegularFilesOnly() throws IOException {
        Path dir = this.module();
        Files.write(ProvenanceStore.provenanceFile(dir), "{}".getBytes(StandardCharsets.UTF_8));

        ModuleIntegrity integrity = ModuleIntegrity.compute(dir);
        assertEquals(List.of("module.yaml", "prompt.md", "sub/data.txt"), List.copyOf(integrity.files().keySet()));
        assertEquals(ModuleIntegrity.ALGORITHM, integrity.algorithm());
        long expected = Files.size(dir.resolve("module.yaml")) + Files.size(dir.resolve("prompt.md")) + 4;
        assertEquals(expected, integrity.totalBytes());
        assertDoesNotThrow(() -> integrity.verify(dir));
    }

    @Test
    public void testDigestCoversSize() throws IOException {
        Path a = this.temp.resolve("a");
        Path b = this.temp.resolve("b");
        Files.createDirectories(a);
        Files.createDirectories(b);
        Files.write(a.resolve("f"), new byte[0]);
        Files.write(b.resolve("f"), new byte[] {0});
        assertNotEquals(ModuleIntegrity.compute(a).files().get("f"), ModuleIntegrity.compute(b).files().get("f"));
    }

    @Test
    public void testVerifyDetectsChanges() throws IOException {
        Path dir = this.module();
        ModuleIntegrity integrity = ModuleIntegrity.compute(dir);

        Files.write(dir.resolve("sub/data.txt"), "DATA".getBytes(StandardCharsets.UTF_8));
        ModuleException e = assertThrows(ModuleException.class, () -> integrity.verify(dir));
        assertEquals(FailureKind.CHECKSUM_MISMATCH, e.getKind());
        assertEquals("sub/data.txt", e.getOffendingPath());
        assertEquals(integrity.files().get("sub/data.txt"), e.getExpected());

        Files.write(dir.resolve("sub/data.txt"), "data".getBytes(StandardCharsets.UTF_8));
        Files.write(dir.resolve("extra.txt"), "extra".getBytes(StandardCharsets.UTF_8));
        e = assertThrows(ModuleException.class, () -> integrity.verify(dir));
        assertTrue(e.getMessage().contains("extra.txt"), e.getMessage());

        ModuleIntegrity empty = new ModuleIntegrity(ModuleIntegrity.ALGORITHM, 1, 1, 1, 0, Map.of());
        assertEquals(FailureKind.CHECKSUM_MISMATCH, assertThrows(ModuleException.class, () -> empty.verify(dir)).getKind());
        ModuleIntegrity md5 = new ModuleIntegrity("md5", 10, 1000, 1000, 0, Map.of("a", "b"));
        assertEquals(FailureKind.INVALID_CHECKSUM_FORMAT, assertThrows(ModuleException.class, () -> md5.verify(dir)).getKind());
    }

    @Test
    public void testLimits() throws IOException {
        Path dir = this.module();
        assertEquals(FailureKind.ARCHIVE_QUOTA_EXCEEDED, assertThrows(ModuleException.class, () -> ModuleIntegrity.compute(dir, 2, 1 << 20, 1 << 20)).getKind());
        assertEquals(FailureKind.ARCHIVE_QUOTA_EXCEEDED, assertThrows(ModuleException.class, () -> ModuleIntegrity.compute(dir, 10, 1 << 20, 2)).getKind());
        assertEquals(FailureKind.ARCHIVE_QUOTA_EXCEEDED, assertThrows(ModuleException.class, () -> ModuleIntegrity.compute(dir, 10, 10, 1 << 20)).getKind());
    }

    @Test
    public void testProvenanceRoundTrip() throws IOException {
        Path dir = this.module();
        ProvenanceRecord record = new ProvenanceRecord(ProvenanceRecord.SPEC, "2024-01-01T00:00:00Z",
                new ProvenanceRecord.RegistrySource("https://registry.example/index.json", "demo", null, "1.0.0",
                        "https://registry.example/demo-1.0.0.tar.gz", "sha256:" + "ab".repeat(32), "ab".repeat(32),
                        new ProvenanceRecord.Quality(Boolean.TRUE, 2, "2.2")),
                ModuleIntegrity.compute(dir));
        ProvenanceStore.write(dir, record);

        assertEquals(record, ProvenanceStore.read(dir));
        // Writing the provenance file does not change the covered file set
        assertDoesNotThrow(() -> ProvenanceStore.read(dir).integrity().verify(dir));
    }

    @Test
    public void testBrokenProvenance() throws IOException {
        Path dir = this.module();
        assertNull(ProvenanceStore.read(dir));

        Files.write(ProvenanceStore.provenanceFile(dir), "{\"spec\": \"other/v9\"}".getBytes(StandardCharsets.UTF_8));
        assertEquals(FailureKind.POLICY_VIOLATION, assertThrows(ModuleException.class, () -> ProvenanceStore.read(dir)).getKind());
        assertNull(ProvenanceStore.readQuietly(dir));

        Files.write(ProvenanceStore.provenanceFile(dir), ("{\"spec\": \"" + ProvenanceRecord.SPEC + "\", \"source\": {\"type\": \"ftp\"}, \"integrity\": {}}").getBytes(StandardCharsets.UTF_8));
        assertEquals(FailureKind.POLICY_VIOLATION, assertThrows(ModuleException.class, () -> ProvenanceStore.read(dir)).getKind());

        Files.write(ProvenanceStore.provenanceFile(dir), "not json at all {".getBytes(StandardCharsets.UTF_8));
        assertEquals(FailureKind.POLICY_VIOLATION, assertThrows(ModuleException.class, () -> ProvenanceStore.read(dir)).getKind());
    }
}
