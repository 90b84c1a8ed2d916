package org.stianloader.picomodule.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stianloader.picomodule.FailureKind;
import org.stianloader.picomodule.ModuleException;
import org.stianloader.picomodule.manifest.InstallManifest;
import org.stianloader.picomodule.manifest.InstallManifestEntry;

public class InstallManifestTest {

    @TempDir
    Path temp;

    @Test
    public void testMissingFileIsEmpty() {
        InstallManifest manifest = InstallManifest.load(this.temp.resolve("nope/installed.json"));
        assertTrue(manifest.getNames().isEmpty());
        assertNull(manifest.get("anything"));
    }

    @Test
    public void testSaveAndReload() throws IOException {
        Path file = this.temp.resolve("state/installed.json");
        InstallManifest manifest = InstallManifest.load(file);
        manifest.put("zeta", new InstallManifestEntry("https://github.com/a/b", "/modules/zeta", "https://github.com/a/b", "modules/zeta",
                "main", "1.0.0", null, null, "2024-01-01T00:00:00Z"));
        manifest.put("alpha", new InstallManifestEntry("https://registry.example/alpha.tar.gz", "/modules/alpha", null, null,
                null, "2.0.0", "alpha", "https://registry.example/index.json", "2024-01-02T00:00:00Z"));
        manifest.save();

        try (Stream<Path> siblings = Files.list(file.getParent())) {
            assertEquals(List.of("installed.json"), siblings.map((p) -> p.getFileName().toString()).collect(Collectors.toList()));
        }

        InstallManifest reloaded = InstallManifest.load(file);
        assertEquals(Set.of("alpha", "zeta"), reloaded.getNames());
        InstallManifestEntry alpha = reloaded.get("alpha");
        assertNotNull(alpha);
        assertTrue(alpha.isFromRegistry());
        assertEquals(manifest.get("alpha"), alpha);
        assertEquals(manifest.get("zeta"), reloaded.get("zeta"));

        assertEquals(manifest.get("zeta"), reloaded.remove("zeta"));
        reloaded.save();
        assertEquals(Set.of("alpha"), InstallManifest.load(file).getNames());
    }

    @Test
    public void testOlderFieldNamesAndMalformedEntries() throws IOException {
        Path file = this.temp.resolve("installed.json");
        Files.write(file, ("{\n"
                + "  \"old\": {\"source\": \"https://github.com/a/b\", \"installedAt\": \"/modules/old\", \"githubUrl\": \"https://github.com/a/b\", \"tag\": \"v1\"},\n"
                + "  \"branch\": {\"source\": \"https://github.com/a/b\", \"location\": \"/modules/branch\", \"branch\": \"dev\"},\n"
                + "  \"broken\": {\"location\": \"/modules/broken\"},\n"
                + "  \"scalar\": 5\n"
                + "}").getBytes(StandardCharsets.UTF_8));

        InstallManifest manifest = InstallManifest.load(file);
        assertEquals(Set.of("branch", "old"), manifest.getNames());
        InstallManifestEntry old = manifest.get("old");
        assertEquals("/modules/old", old.location());
        assertEquals("https://github.com/a/b", old.repositoryUrl());
        assertEquals("v1", old.ref());
        assertEquals("", old.installedTime());
        assertEquals("dev", manifest.get("branch").ref());
    }

    @Test
    public void testUnreadableManifest() throws IOException {
        Path file = this.temp.resolve("installed.json");
        Files.write(file, "[1, 2]".getBytes(StandardCharsets.UTF_8));
        assertEquals(FailureKind.IO_FAILURE, assertThrows(ModuleException.class, () -> InstallManifest.load(file)).getKind());
        Files.write(file, "{ nope".getBytes(StandardCharsets.UTF_8));
        assertEquals(FailureKind.IO_FAILURE, assertThrows(ModuleException.class, () -> InstallManifest.load(file)).getKind());
    }
}
