package org.stianloader.picomodule.test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stianloader.picomodule.FailureKind;
import org.stianloader.picomodule.ModuleException;
import org.stianloader.picomodule.archive.ExtractionLimits;
import org.stianloader.picomodule.archive.TarExtractor;
import org.stianloader.picomodule.integrity.Digests;
import org.stianloader.picomodule.publish.AssetBuilder;
import org.stianloader.picomodule.publish.BuildOptions;
import org.stianloader.picomodule.publish.BuildResult;
import org.stianloader.picomodule.registry.RegistryEntry;
import org.stianloader.picomodule.registry.RegistryIndex;

import com.google.gson.JsonObject;

public class AssetBuilderTest {

    static final String TIMESTAMP = "2024-01-01T00:00:00Z";

    @TempDir
    Path temp;

    @Test
    public void testBuildSingleModule() throws IOException {
        Path modules = this.temp.resolve("modules");
        TarFixtures.writeModule(modules.resolve("demo"), "demo", "1.0.0");
        Files.createDirectories(modules.resolve("not-a-module"));
        Files.write(modules.resolve("README.md"), "stray".getBytes(StandardCharsets.UTF_8));
        Path out = this.temp.resolve("dist");

        BuildResult result = AssetBuilder.build(new BuildOptions(modules, out).setTimestamp(AssetBuilderTest.TIMESTAMP));

        assertEquals(out.resolve(BuildOptions.DEFAULT_REGISTRY_FILE_NAME).toAbsolutePath(), result.registryOut());
        assertEquals(1, result.modules().size());
        BuildResult.BuiltModule built = result.modules().get(0);
        assertEquals("demo-1.0.0.tar.gz", built.file());
        Path tarball = out.resolve(built.file());
        assertEquals(Digests.sha256Hex(tarball), built.sha256());
        assertEquals(Files.size(tarball), built.sizeBytes());

        RegistryIndex index = RegistryIndex.parse(Files.readAllBytes(result.registryOut()));
        assertEquals(AssetBuilder.INDEX_FORMAT_VERSION, index.getFormatVersion());
        assertEquals(AssetBuilderTest.TIMESTAMP, index.getUpdated());
        assertEquals(List.of("demo"), index.getFeatured());
        assertEquals(1L, index.getTotalModulesStat());

        RegistryEntry.Current entry = (RegistryEntry.Current) index.getEntry("demo");
        assertEquals("demo-1.0.0.tar.gz", entry.getTarball());
        assertEquals("sha256:" + built.sha256(), entry.getChecksum());
        assertEquals(built.sizeBytes(), entry.getSizeBytes());
        assertEquals(List.of("module.yaml", "prompt.md"), entry.getFiles());
        assertEquals("Decides things", entry.toModuleInfo().description());
        assertEquals("unknown", entry.toModuleInfo().author());
        assertEquals("decision", entry.toModuleInfo().tier());

        List<String> extracted = TarExtractor.extractGzip(tarball, this.temp.resolve("check"), ExtractionLimits.DEFAULT);
        assertEquals(List.of("demo/module.yaml", "demo/prompt.md"), extracted);
    }

    @Test
    public void testBuildIsReproducible() throws IOException {
        Path modules = this.temp.resolve("modules");
        TarFixtures.writeModule(modules.resolve("alpha"), "alpha", "0.1.0");
        TarFixtures.writeModule(modules.resolve("beta"), "beta", "2.0.0");
        Files.createDirectories(modules.resolve("beta/nested/dir"));
        Files.write(modules.resolve("beta/nested/dir/data.json"), "{}".getBytes(StandardCharsets.UTF_8));

        BuildResult first = AssetBuilder.build(new BuildOptions(modules, this.temp.resolve("a")).setTimestamp(AssetBuilderTest.TIMESTAMP));
        BuildResult second = AssetBuilder.build(new BuildOptions(modules, this.temp.resolve("b")).setTimestamp(AssetBuilderTest.TIMESTAMP));

        assertEquals(first.modules(), second.modules());
        for (BuildResult.BuiltModule module : first.modules()) {
            assertArrayEquals(Files.readAllBytes(first.outDir().resolve(module.file())), Files.readAllBytes(second.outDir().resolve(module.file())));
        }
        assertArrayEquals(Files.readAllBytes(first.registryOut()), Files.readAllBytes(second.registryOut()));
        assertEquals(List.of("alpha", "beta"), List.copyOf(first.index().getAsJsonObject("modules").keySet()));
    }

    @Test
    public void testLongPathsAreKept() throws IOException {
        Path modules = this.temp.resolve("modules");
        Path module = modules.resolve("deep");
        TarFixtures.writeModule(module, "deep", "1.0.0");
        StringBuilder rel = new StringBuilder();
        for (int i = 0; i < 10; i++) {
            rel.append("segment-number-").append(i).append('/');
        }
        Path file = module.resolve(rel.toString()).resolve("leaf.txt");
        Files.createDirectories(file.getParent());
        Files.write(file, "leaf".getBytes(StandardCharsets.UTF_8));

        BuildResult result = AssetBuilder.build(new BuildOptions(modules, this.temp.resolve("dist")).setTimestamp(AssetBuilderTest.TIMESTAMP));
        Path tarball = result.outDir().resolve(result.modules().get(0).file());
        Path check = this.temp.resolve("check");
        List<String> extracted = TarExtractor.extractGzip(tarball, check, ExtractionLimits.DEFAULT);

        assertTrue(extracted.contains("deep/" + rel + "leaf.txt"));
        assertEquals("leaf", new String(Files.readAllBytes(check.resolve("deep").resolve(rel.toString()).resolve("leaf.txt")), StandardCharsets.UTF_8));
    }

    @Test
    public void testLegacyMetadataAndTag() throws IOException {
        Path modules = this.temp.resolve("modules");
        TarFixtures.writeModule(modules.resolve("demo"), "demo", "1.0.0");
        TarFixtures.writeModule(modules.resolve("other"), "other", "1.0.0");
        Path legacy = this.temp.resolve("cognitive-registry.json");
        Files.write(legacy, ("{\"modules\": {\"demo\": {\"description\": \"Legacy description\", \"author\": \"someone\", \"tags\": [\"a\", \"b\"]}},"
                + "\"categories\": {\"core\": {\"name\": \"Core\", \"modules\": [\"demo\"]}}}").getBytes(StandardCharsets.UTF_8));
        Path registryOut = this.temp.resolve("elsewhere/registry.json");

        BuildResult result = AssetBuilder.build(new BuildOptions(modules, this.temp.resolve("dist"))
                .setLegacyIndex(legacy)
                .setRegistryOut(registryOut)
                .setTag("v1.0.0")
                .setOnly("demo")
                .setTimestamp(AssetBuilderTest.TIMESTAMP));

        assertEquals(registryOut.toAbsolutePath(), result.registryOut());
        assertFalse(Files.exists(result.outDir().resolve("other-1.0.0.tar.gz")));
        RegistryIndex index = RegistryIndex.parse(Files.readAllBytes(registryOut));
        assertEquals(List.of("demo"), List.copyOf(index.getEntries().keySet()));
        assertEquals("Core", index.getCategories().get("core").name());

        RegistryEntry.Current entry = (RegistryEntry.Current) index.getEntry("demo");
        assertEquals("https://github.com/Cognary/cognitive/releases/download/v1.0.0/demo-1.0.0.tar.gz", entry.getTarball());
        assertEquals("Legacy description", entry.toModuleInfo().description());
        assertEquals("someone", entry.toModuleInfo().author());
        assertEquals(List.of("a", "b"), entry.toModuleInfo().keywords());

        JsonObject raw = entry.toJson();
        assertEquals(AssetBuilder.ENTRY_SCHEMA, raw.get("$schema").getAsString());
        assertTrue(raw.getAsJsonObject("timestamps").get("deprecated_at").isJsonNull());
    }

    @Test
    public void testExplicitTarballBaseUrl() throws IOException {
        Path modules = this.temp.resolve("modules");
        TarFixtures.writeModule(modules.resolve("demo"), "demo", "1.0.0");
        BuildResult result = AssetBuilder.build(new BuildOptions(modules, this.temp.resolve("dist"))
                .setTarballBaseUrl("https://cdn.example/assets")
                .setTag("ignored")
                .setTimestamp(AssetBuilderTest.TIMESTAMP));
        RegistryEntry.Current entry = (RegistryEntry.Current) RegistryIndex.parse(Files.readAllBytes(result.registryOut())).getEntry("demo");
        assertEquals("https://cdn.example/assets/demo-1.0.0.tar.gz", entry.getTarball());
    }

    @Test
    public void testIncompleteModuleYaml() throws IOException {
        Path modules = this.temp.resolve("modules");
        Files.createDirectories(modules.resolve("broken"));
        Files.write(modules.resolve("broken/module.yaml"), "name: broken\nversion: 1.0.0\n".getBytes(StandardCharsets.UTF_8));

        ModuleException e = assertThrows(ModuleException.class, () -> AssetBuilder.build(new BuildOptions(modules, this.temp.resolve("dist"))));
        assertEquals(FailureKind.MODULE_NOT_FOUND, e.getKind());
        assertTrue(e.getMessage().contains("responsibility"), e.getMessage());
    }

    @Test
    public void testMalformedLegacyIndex() throws IOException {
        Path modules = this.temp.resolve("modules");
        TarFixtures.writeModule(modules.resolve("demo"), "demo", "1.0.0");
        Path legacy = this.temp.resolve("legacy.json");
        Files.write(legacy, "{".getBytes(StandardCharsets.UTF_8));

        ModuleException e = assertThrows(ModuleException.class, () -> AssetBuilder.build(new BuildOptions(modules, this.temp.resolve("dist")).setLegacyIndex(legacy)));
        assertEquals(FailureKind.MALFORMED_INDEX, e.getKind());
    }
}
