package org.stianloader.picomodule.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stianloader.picomodule.FailureKind;
import org.stianloader.picomodule.integrity.Digests;
import org.stianloader.picomodule.publish.AssetBuilder;
import org.stianloader.picomodule.publish.AssetVerifier;
import org.stianloader.picomodule.publish.BuildOptions;
import org.stianloader.picomodule.publish.BuildResult;
import org.stianloader.picomodule.publish.VerifyFailure;
import org.stianloader.picomodule.publish.VerifyOptions;
import org.stianloader.picomodule.publish.VerifyPhase;
import org.stianloader.picomodule.publish.VerifyResult;
import org.stianloader.picomodule.registry.FetchLimits;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

public class AssetVerifierTest {

    @TempDir
    Path temp;

    private BuildResult buildModules(String... names) throws IOException {
        Path modules = this.temp.resolve("modules");
        for (String name : names) {
            TarFixtures.writeModule(modules.resolve(name), name, "1.0.0");
        }
        return AssetBuilder.build(new BuildOptions(modules, this.temp.resolve("dist")).setTimestamp(AssetBuilderTest.TIMESTAMP));
    }

    private static JsonObject readIndex(Path file) throws IOException {
        return JsonParser.parseString(new String(Files.readAllBytes(file), StandardCharsets.UTF_8)).getAsJsonObject();
    }

    private static void writeIndex(Path file, JsonObject index) throws IOException {
        Files.write(file, index.toString().getBytes(StandardCharsets.UTF_8));
    }

    private static JsonObject distribution(JsonObject index, String module) {
        return index.getAsJsonObject("modules").getAsJsonObject(module).getAsJsonObject("distribution");
    }

    private static VerifyResult verifyLocal(BuildResult build) {
        VerifyOptions options = new VerifyOptions(build.registryOut().toString()).setAssetsDir(build.outDir());
        return new AssetVerifier().verify(options, Runnable::run).join();
    }

    @Test
    public void testFreshBuildPasses() throws IOException {
        BuildResult build = this.buildModules("alpha", "beta");
        VerifyResult result = AssetVerifierTest.verifyLocal(build);
        assertTrue(result.ok(), result.toString());
        assertEquals(2, result.checked());
        assertEquals(2, result.passed());
        assertEquals(0, result.failed());
        assertNull(result.indexFailure());
    }

    @Test
    public void testMutatedTarballFailsChecksumAndRerunIsStable() throws IOException {
        BuildResult build = this.buildModules("alpha", "beta");
        Path tarball = build.outDir().resolve("beta-1.0.0.tar.gz");
        byte[] data = Files.readAllBytes(tarball);
        data[data.length / 2] ^= 0x01;
        Files.write(tarball, data);

        VerifyResult first = AssetVerifierTest.verifyLocal(build);
        assertFalse(first.ok());
        assertEquals(1, first.passed());
        assertEquals(1, first.failed());
        VerifyFailure failure = first.failures().get(0);
        assertEquals("beta", failure.module());
        assertEquals(VerifyPhase.CHECKSUM, failure.phase());
        assertEquals("checksum", failure.phase().getReportName());
        assertEquals(FailureKind.CHECKSUM_MISMATCH, failure.kind());
        assertEquals("beta-1.0.0.tar.gz", failure.tarballRef());

        VerifyResult second = AssetVerifierTest.verifyLocal(build);
        assertEquals(first, second);
    }

    @Test
    public void testSizeMismatchIsAChecksumFailure() throws IOException {
        BuildResult build = this.buildModules("demo");
        JsonObject index = AssetVerifierTest.readIndex(build.registryOut());
        AssetVerifierTest.distribution(index, "demo").addProperty("size_bytes", 1);
        AssetVerifierTest.writeIndex(build.registryOut(), index);

        VerifyFailure failure = AssetVerifierTest.verifyLocal(build).failures().get(0);
        assertEquals(VerifyPhase.CHECKSUM, failure.phase());
        assertEquals(FailureKind.CHECKSUM_MISMATCH, failure.kind());
    }

    @Test
    public void testPhases() throws IOException {
        BuildResult build = this.buildModules("files", "identity", "missing", "nochecksum");
        JsonObject index = AssetVerifierTest.readIndex(build.registryOut());

        JsonArray files = new JsonArray();
        files.add("module.yaml");
        AssetVerifierTest.distribution(index, "files").add("files", files);
        index.getAsJsonObject("modules").getAsJsonObject("identity").getAsJsonObject("identity").addProperty("version", "9.9.9");
        Files.delete(build.outDir().resolve("missing-1.0.0.tar.gz"));
        AssetVerifierTest.distribution(index, "nochecksum").remove("checksum");
        JsonObject legacy = new JsonObject();
        legacy.addProperty("version", "1.0.0");
        legacy.addProperty("source", "github:owner/repo");
        index.getAsJsonObject("modules").add("legacy", legacy);
        AssetVerifierTest.writeIndex(build.registryOut(), index);

        VerifyResult result = AssetVerifierTest.verifyLocal(build);
        assertEquals(5, result.checked());
        assertEquals(0, result.passed());
        Map<String, VerifyFailure> byModule = result.failures().stream().collect(Collectors.toMap(VerifyFailure::module, (f) -> f));

        assertEquals(VerifyPhase.EXTRACT, byModule.get("files").phase());
        assertEquals(FailureKind.CHECKSUM_MISMATCH, byModule.get("files").kind());
        assertEquals(VerifyPhase.EXTRACT, byModule.get("identity").phase());
        assertEquals(FailureKind.MALFORMED_INDEX, byModule.get("identity").kind());
        assertEquals(VerifyPhase.DOWNLOAD, byModule.get("missing").phase());
        assertEquals(FailureKind.DOWNLOAD_FAILED, byModule.get("missing").kind());
        assertEquals(VerifyPhase.CHECKSUM, byModule.get("nochecksum").phase());
        assertEquals(FailureKind.MISSING_CHECKSUM, byModule.get("nochecksum").kind());
        assertEquals(VerifyPhase.DOWNLOAD, byModule.get("legacy").phase());
        assertEquals(FailureKind.MALFORMED_INDEX, byModule.get("legacy").kind());

        assertEquals(List.of("files", "identity", "missing", "nochecksum", "legacy"),
                result.failures().stream().map(VerifyFailure::module).collect(Collectors.toList()));
    }

    @Test
    public void testIndexFailures() throws IOException {
        Path broken = this.temp.resolve("broken.json");
        Files.write(broken, "{\"modules\": [".getBytes(StandardCharsets.UTF_8));
        VerifyResult result = new AssetVerifier().verify(new VerifyOptions(broken.toString()).setAssetsDir(this.temp), Runnable::run).join();
        assertFalse(result.ok());
        assertEquals(0, result.checked());
        assertNotNull(result.indexFailure());
        assertEquals(FailureKind.MALFORMED_INDEX, result.indexFailure().kind());

        assertThrows(IllegalArgumentException.class, () -> new AssetVerifier().verify(new VerifyOptions(broken.toString()), Runnable::run));
    }

    @Test
    public void testRemoteVerification() throws IOException {
        BuildResult build = this.buildModules("a1", "a2", "a3", "a4", "a5", "a6");
        JsonObject index = AssetVerifierTest.readIndex(build.registryOut());
        // Two modules share a basename in different directories
        AssetVerifierTest.distribution(index, "a1").addProperty("tarball", "one/module.tar.gz");
        AssetVerifierTest.distribution(index, "a2").addProperty("tarball", "two/module.tar.gz");
        AssetVerifierTest.distribution(index, "a4").addProperty("checksum", "sha256:" + Digests.sha256Hex(new byte[0]));

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try (TestHttpServer server = new TestHttpServer()) {
            server.serve("/registry/index.json", index.toString().getBytes(StandardCharsets.UTF_8));
            server.serve("/registry/one/module.tar.gz", Files.readAllBytes(build.outDir().resolve("a1-1.0.0.tar.gz")));
            server.serve("/registry/two/module.tar.gz", Files.readAllBytes(build.outDir().resolve("a2-1.0.0.tar.gz")));
            for (String name : new String[] {"a3", "a4", "a5"}) {
                server.serve("/registry/" + name + "-1.0.0.tar.gz", Files.readAllBytes(build.outDir().resolve(name + "-1.0.0.tar.gz")));
            }
            server.serveStatus("/registry/a6-1.0.0.tar.gz", 404);

            VerifyOptions options = new VerifyOptions(server.uri("/registry/index.json").toString()).setConcurrency(4).setScratchDir(this.temp.resolve("scratch"));
            assertTrue(options.isRemote());
            VerifyResult result = new AssetVerifier().verify(options, executor).join();

            assertEquals(6, result.checked());
            assertEquals(4, result.passed());
            assertEquals(List.of("a4", "a6"), result.failures().stream().map(VerifyFailure::module).collect(Collectors.toList()));
            assertEquals(VerifyPhase.CHECKSUM, result.failures().get(0).phase());
            assertEquals(VerifyPhase.DOWNLOAD, result.failures().get(1).phase());
            assertEquals(server.uri("/registry/a6-1.0.0.tar.gz").toString(), result.failures().get(1).tarballResolved());
            assertEquals(1, server.getHits("/registry/one/module.tar.gz"));
            assertEquals(1, server.getHits("/registry/two/module.tar.gz"));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testConcurrencyIsolation() throws IOException {
        BuildResult build = this.buildModules("b1", "b2", "b3", "b4", "b5", "b6");
        JsonObject index = AssetVerifierTest.readIndex(build.registryOut());
        AssetVerifierTest.distribution(index, "b1").addProperty("tarball", "one/module.tar.gz");
        AssetVerifierTest.distribution(index, "b2").addProperty("tarball", "two/module.tar.gz");
        AssetVerifierTest.distribution(index, "b3").addProperty("checksum", "sha256:" + Digests.sha256Hex(new byte[0]));

        ExecutorService executor = Executors.newFixedThreadPool(6);
        try (TestHttpServer server = new TestHttpServer()) {
            server.serve("/registry/index.json", index.toString().getBytes(StandardCharsets.UTF_8));
            server.serve("/registry/one/module.tar.gz", Files.readAllBytes(build.outDir().resolve("b1-1.0.0.tar.gz")));
            server.serve("/registry/two/module.tar.gz", Files.readAllBytes(build.outDir().resolve("b2-1.0.0.tar.gz")));
            for (String name : new String[] {"b3", "b4", "b6"}) {
                server.serve("/registry/" + name + "-1.0.0.tar.gz", Files.readAllBytes(build.outDir().resolve(name + "-1.0.0.tar.gz")));
            }
            server.serveStatus("/registry/b5-1.0.0.tar.gz", 404);

            VerifyResult two = new AssetVerifier().verify(new VerifyOptions(server.uri("/registry/index.json").toString())
                    .setConcurrency(2).setScratchDir(this.temp.resolve("scratch-2")), executor).join();
            VerifyResult six = new AssetVerifier().verify(new VerifyOptions(server.uri("/registry/index.json").toString())
                    .setConcurrency(6).setScratchDir(this.temp.resolve("scratch-6")), executor).join();

            assertEquals(6, two.checked());
            assertEquals(4, two.passed());
            assertEquals(two.passed(), six.passed());
            assertEquals(two.failed(), six.failed());
            assertEquals(two.failures(), six.failures());
            assertEquals(List.of("b3", "b5"), six.failures().stream().map(VerifyFailure::module).collect(Collectors.toList()));
            assertEquals(2, server.getHits("/registry/one/module.tar.gz"));
            assertEquals(2, server.getHits("/registry/two/module.tar.gz"));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testTarballTimeoutIsSeparateFromIndexLimits() throws IOException {
        BuildResult build = this.buildModules("slow");
        try (TestHttpServer server = new TestHttpServer()) {
            server.serve("/registry/index.json", Files.readAllBytes(build.registryOut()));
            server.serveDelayed("/registry/slow-1.0.0.tar.gz", Files.readAllBytes(build.outDir().resolve("slow-1.0.0.tar.gz")), 2_000L);

            VerifyOptions options = new VerifyOptions(server.uri("/registry/index.json").toString())
                    .setIndexLimits(new FetchLimits(30_000L, 1L << 20))
                    .setTarballTimeoutMillis(200L)
                    .setScratchDir(this.temp.resolve("scratch"));
            assertEquals(200L, options.getTarballTimeoutMillis());
            VerifyResult result = new AssetVerifier().verify(options, Runnable::run).join();

            assertNull(result.indexFailure());
            assertEquals(1, result.failed());
            assertEquals(VerifyPhase.DOWNLOAD, result.failures().get(0).phase());
            assertEquals(FailureKind.TIMEOUT, result.failures().get(0).kind());
        }
        assertEquals(VerifyOptions.DEFAULT_TARBALL_TIMEOUT_MILLIS, new VerifyOptions("index.json").getTarballTimeoutMillis());
        assertThrows(IllegalArgumentException.class, () -> new VerifyOptions("index.json").setTarballTimeoutMillis(0));
    }

    @Test
    public void testLenientIndexSyntaxIsRejected() throws IOException {
        Path index = this.temp.resolve("lenient.json");
        Files.write(index, "{modules: {demo: {version: '1.0.0', source: 'github:a/b'}}}".getBytes(StandardCharsets.UTF_8));
        VerifyResult result = new AssetVerifier().verify(new VerifyOptions(index.toString()).setAssetsDir(this.temp), Runnable::run).join();
        assertEquals(0, result.checked());
        assertEquals(FailureKind.MALFORMED_INDEX, result.indexFailure().kind());
    }

    @Test
    public void testConcurrencyDefaults() {
        assertEquals(4, new VerifyOptions("https://registry.example/index.json").getEffectiveConcurrency());
        assertEquals(1, new VerifyOptions("index.json").getEffectiveConcurrency());
        assertEquals(VerifyOptions.MAX_CONCURRENCY, new VerifyOptions("index.json").setConcurrency(64).getEffectiveConcurrency());
        assertEquals(1, new VerifyOptions("index.json").setConcurrency(0).getEffectiveConcurrency());
    }
}
