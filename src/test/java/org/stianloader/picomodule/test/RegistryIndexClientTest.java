package org.stianloader.picomodule.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stianloader.picomodule.FailureKind;
import org.stianloader.picomodule.ModuleException;
import org.stianloader.picomodule.registry.Category;
import org.stianloader.picomodule.registry.FetchLimits;
import org.stianloader.picomodule.registry.ModuleInfo;
import org.stianloader.picomodule.registry.RegistryIndex;
import org.stianloader.picomodule.registry.RegistryIndexClient;
import org.stianloader.picomodule.registry.SearchResult;

public class RegistryIndexClientTest {

    @TempDir
    Path temp;

    @Test
    public void testMemoryAndDiskCache() throws Exception {
        try (TestHttpServer server = new TestHttpServer()) {
            server.serve("/index.json", RegistryIndexTest.LEGACY_INDEX.getBytes(StandardCharsets.UTF_8));
            Path cache = this.temp.resolve("cache");

            RegistryIndexClient client = new RegistryIndexClient(server.uri("/index.json"), cache);
            RegistryIndex first = client.fetchIndex(false, Runnable::run).join();
            RegistryIndex second = client.fetchIndex(false, Runnable::run).join();
            assertSame(first, second);
            assertEquals(1, server.getHits("/index.json"));
            assertTrue(Files.isRegularFile(client.getCacheFile(cache)));
            assertTrue(client.getCacheFile(cache).getFileName().toString().matches("registry-[0-9a-f]{16}\\.json"));

            RegistryIndexClient fresh = new RegistryIndexClient(server.uri("/index.json"), cache);
            assertEquals(3, fresh.fetchIndex0(false).getEntries().size());
            assertEquals(1, server.getHits("/index.json"));

            fresh.fetchIndex0(true);
            assertEquals(2, server.getHits("/index.json"));

            RegistryIndexClient uncached = new RegistryIndexClient(server.uri("/index.json"), cache).setCacheTtl(0);
            uncached.fetchIndex0(false);
            uncached.fetchIndex0(false);
            assertEquals(4, server.getHits("/index.json"));
        }
    }

    @Test
    public void testCorruptDiskCacheIsIgnored() throws Exception {
        try (TestHttpServer server = new TestHttpServer()) {
            server.serve("/index.json", RegistryIndexTest.LEGACY_INDEX.getBytes(StandardCharsets.UTF_8));
            Path cache = this.temp.resolve("cache");
            RegistryIndexClient client = new RegistryIndexClient(server.uri("/index.json"), cache);
            Files.createDirectories(cache);
            Files.write(client.getCacheFile(cache), "{ corrupt".getBytes(StandardCharsets.UTF_8));

            assertEquals(3, client.fetchIndex0(false).getEntries().size());
            assertEquals(1, server.getHits("/index.json"));
        }
    }

    @Test
    public void testQueries() throws Exception {
        try (TestHttpServer server = new TestHttpServer()) {
            server.serve("/index.json", RegistryIndexTest.LEGACY_INDEX.getBytes(StandardCharsets.UTF_8));
            RegistryIndexClient client = new RegistryIndexClient(server.uri("/index.json"), null);

            Optional<ModuleInfo> module = client.getModule("code-reviewer", Runnable::run).join();
            assertTrue(module.isPresent());
            assertEquals("cognary", module.get().author());
            assertTrue(!client.getModule("nope", Runnable::run).join().isPresent());

            List<ModuleInfo> modules = client.listModules(Runnable::run).join();
            assertEquals(3, modules.size());

            Map<String, Category> categories = client.getCategories(Runnable::run).join();
            assertNotNull(categories.get("quality"));

            List<SearchResult> inCategory = client.search("", "quality", Runnable::run).join();
            assertEquals(1, inCategory.size());
            assertEquals("code-reviewer", inCategory.get(0).name());
            assertTrue(client.search("code", "no-such-category", Runnable::run).join().isEmpty());
            assertEquals("code-reviewer", client.search("review", Runnable::run).join().get(0).name());
        }
    }

    @Test
    public void testPayloadLimits() {
        byte[] large = new byte[4096];
        Arrays.fill(large, (byte) ' ');
        try (TestHttpServer server = new TestHttpServer()) {
            server.serve("/declared.json", large);
            server.serveChunked("/observed.json", large);
            FetchLimits limits = new FetchLimits(5_000L, 1024);

            RegistryIndexClient declared = new RegistryIndexClient(server.uri("/declared.json"), null).setFetchLimits(limits);
            ModuleException e = assertThrows(ModuleException.class, () -> declared.fetchIndex0(false));
            assertEquals(FailureKind.PAYLOAD_TOO_LARGE, e.getKind());
            assertEquals("1024", e.getExpected());
            assertEquals("4096", e.getActual());

            RegistryIndexClient observed = new RegistryIndexClient(server.uri("/observed.json"), null).setFetchLimits(limits);
            e = assertThrows(ModuleException.class, () -> observed.fetchIndex0(false));
            assertEquals(FailureKind.PAYLOAD_TOO_LARGE, e.getKind());
        }
    }

    @Test
    public void testTimeoutAndHttpErrors() {
        try (TestHttpServer server = new TestHttpServer()) {
            server.serveDelayed("/slow.json", RegistryIndexTest.LEGACY_INDEX.getBytes(StandardCharsets.UTF_8), 2_000L);
            server.serveStatus("/broken.json", 500);

            RegistryIndexClient slow = new RegistryIndexClient(server.uri("/slow.json"), null).setFetchLimits(new FetchLimits(200L, 1L << 20));
            assertEquals(FailureKind.TIMEOUT, assertThrows(ModuleException.class, () -> slow.fetchIndex0(false)).getKind());

            RegistryIndexClient broken = new RegistryIndexClient(server.uri("/broken.json"), null);
            assertEquals(FailureKind.DOWNLOAD_FAILED, assertThrows(ModuleException.class, () -> broken.fetchIndex0(false)).getKind());

            RegistryIndexClient missing = new RegistryIndexClient(server.uri("/missing.json"), null);
            CompletionException wrapped = assertThrows(CompletionException.class, () -> missing.fetchIndex(false, Runnable::run).join());
            assertEquals(FailureKind.DOWNLOAD_FAILED, ModuleException.unwrap(wrapped).getKind());
        }
    }

    @Test
    public void testMalformedIndexIsNotCached() throws Exception {
        try (TestHttpServer server = new TestHttpServer()) {
            server.serve("/index.json", "{\"modules\": 5}".getBytes(StandardCharsets.UTF_8));
            Path cache = this.temp.resolve("cache");
            RegistryIndexClient client = new RegistryIndexClient(server.uri("/index.json"), cache);
            assertEquals(FailureKind.MALFORMED_INDEX, assertThrows(ModuleException.class, () -> client.fetchIndex0(false)).getKind());
            assertTrue(!Files.exists(client.getCacheFile(cache)));

            server.serve("/lenient.json", "{modules: {demo: {version: '1.0.0', source: 'github:a/b'}}}".getBytes(StandardCharsets.UTF_8));
            RegistryIndexClient lenient = new RegistryIndexClient(server.uri("/lenient.json"), cache);
            assertEquals(FailureKind.MALFORMED_INDEX, assertThrows(ModuleException.class, () -> lenient.fetchIndex0(false)).getKind());
            assertTrue(!Files.exists(lenient.getCacheFile(cache)));
        }
    }
}
