package org.stianloader.picomodule.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stianloader.picomodule.FailureKind;
import org.stianloader.picomodule.ModuleException;
import org.stianloader.picomodule.archive.ArchiveLayout;
import org.stianloader.picomodule.archive.ExtractionLimits;
import org.stianloader.picomodule.archive.TarExtractor;

public class TarExtractorTest {

    @TempDir
    Path temp;

    private static boolean isEmpty(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return true;
        }
        try (Stream<Path> children = Files.list(dir)) {
            return !children.findAny().isPresent();
        }
    }

    @Test
    public void testExtractsFilesAndDirectories() throws IOException {
        byte[] tar = TarFixtures.tar()
                .directory("demo/")
                .file("demo/module.yaml", "name: demo\n")
                .file("demo/./docs//readme.md", "hi")
                .build();
        Path dest = this.temp.resolve("out");
        List<String> files = TarExtractor.extract(new ByteArrayInputStream(tar), dest, ExtractionLimits.DEFAULT);

        assertEquals(Arrays.asList("demo/module.yaml", "demo/docs/readme.md"), files);
        assertEquals("name: demo\n", new String(Files.readAllBytes(dest.resolve("demo/module.yaml")), StandardCharsets.UTF_8));
        assertEquals("hi", new String(Files.readAllBytes(dest.resolve("demo/docs/readme.md")), StandardCharsets.UTF_8));
        assertEquals(dest.resolve("demo"), ArchiveLayout.singleRoot(dest));
    }

    @Test
    public void testTraversalRollsBackEarlierEntries() throws IOException {
        byte[] tar = TarFixtures.tar()
                .file("demo/ok.txt", "fine")
                .file("demo/../../escape.txt", "evil")
                .build();
        Path dest = this.temp.resolve("out");
        ModuleException e = assertThrows(ModuleException.class, () -> TarExtractor.extract(new ByteArrayInputStream(tar), dest, ExtractionLimits.DEFAULT));

        assertEquals(FailureKind.PATH_TRAVERSAL, e.getKind());
        assertEquals("demo/../../escape.txt", e.getOffendingPath());
        assertFalse(Files.exists(this.temp.resolve("escape.txt")));
        assertTrue(TarExtractorTest.isEmpty(dest));
    }

    @Test
    public void testAbsoluteNamesAreRejected() {
        for (String name : new String[] {"/etc/passwd", "C:/Windows/evil.dll", "\\abs\\evil"}) {
            byte[] tar = TarFixtures.tar().file(name, "x").build();
            ModuleException e = assertThrows(ModuleException.class, () -> TarExtractor.inspect(new ByteArrayInputStream(tar), ExtractionLimits.DEFAULT));
            assertEquals(FailureKind.PATH_TRAVERSAL, e.getKind(), name);
        }
    }

    @Test
    public void testLinksAreRejected() throws IOException {
        byte[] symlink = TarFixtures.tar()
                .file("demo/a.txt", "a")
                .symlink("demo/link", "/etc/passwd")
                .build();
        Path dest = this.temp.resolve("sym");
        ModuleException e = assertThrows(ModuleException.class, () -> TarExtractor.extract(new ByteArrayInputStream(symlink), dest, ExtractionLimits.DEFAULT));
        assertEquals(FailureKind.UNSAFE_ARCHIVE_ENTRY, e.getKind());
        assertEquals("demo/link", e.getOffendingPath());
        assertTrue(TarExtractorTest.isEmpty(dest));

        byte[] hardlink = TarFixtures.tar().entry("demo/hard", '1', new byte[0]).build();
        e = assertThrows(ModuleException.class, () -> TarExtractor.inspect(new ByteArrayInputStream(hardlink), ExtractionLimits.DEFAULT));
        assertEquals(FailureKind.UNSAFE_ARCHIVE_ENTRY, e.getKind());

        byte[] device = TarFixtures.tar().entry("demo/dev", '3', new byte[0]).build();
        e = assertThrows(ModuleException.class, () -> TarExtractor.inspect(new ByteArrayInputStream(device), ExtractionLimits.DEFAULT));
        assertEquals(FailureKind.UNSAFE_ARCHIVE_ENTRY, e.getKind());
    }

    @Test
    public void testQuotas() {
        byte[] many = TarFixtures.tar()
                .file("demo/1", "1")
                .file("demo/2", "2")
                .file("demo/3", "3")
                .build();
        ModuleException e = assertThrows(ModuleException.class, () -> TarExtractor.inspect(new ByteArrayInputStream(many), ExtractionLimits.DEFAULT.withMaxFiles(2)));
        assertEquals(FailureKind.ARCHIVE_QUOTA_EXCEEDED, e.getKind());

        byte[] big = TarFixtures.tar().sparseFile("demo/big.bin", 4096).build();
        e = assertThrows(ModuleException.class, () -> TarExtractor.inspect(new ByteArrayInputStream(big), ExtractionLimits.DEFAULT.withMaxSingleFileBytes(1024)));
        assertEquals(FailureKind.ARCHIVE_QUOTA_EXCEEDED, e.getKind());
        assertEquals("1024", e.getExpected());
        assertEquals("4096", e.getActual());

        byte[] total = TarFixtures.tar()
                .sparseFile("demo/a.bin", 600)
                .sparseFile("demo/b.bin", 600)
                .build();
        e = assertThrows(ModuleException.class, () -> TarExtractor.inspect(new ByteArrayInputStream(total), ExtractionLimits.DEFAULT.withMaxTotalBytes(1000)));
        assertEquals(FailureKind.ARCHIVE_QUOTA_EXCEEDED, e.getKind());
    }

    @Test
    public void testDecompressionBombIsCutOff() throws IOException {
        // 8 MiB of zeros compresses to a few KiB
        byte[] bomb = TarFixtures.gzip(TarFixtures.tar().sparseFile("demo/zeros.bin", 8L << 20).build());
        assertTrue(bomb.length < 64 * 1024);
        Path dest = this.temp.resolve("bomb");
        ExtractionLimits limits = ExtractionLimits.DEFAULT.withMaxTarBytes(1L << 20);
        ModuleException e = assertThrows(ModuleException.class, () -> TarExtractor.extractGzip(new ByteArrayInputStream(bomb), dest, limits));
        assertEquals(FailureKind.ARCHIVE_QUOTA_EXCEEDED, e.getKind());
        assertTrue(TarExtractorTest.isEmpty(dest));
    }

    @Test
    public void testMalformedArchives() {
        byte[] header = TarFixtures.header("demo/a.txt", 1, '0');
        header[0] ^= 1;
        byte[] badChecksum = TarFixtures.tar().raw(header).raw(new byte[512]).build();
        ModuleException e = assertThrows(ModuleException.class, () -> TarExtractor.inspect(new ByteArrayInputStream(badChecksum), ExtractionLimits.DEFAULT));
        assertEquals(FailureKind.MALFORMED_ARCHIVE, e.getKind());

        byte[] noMagic = TarFixtures.header("demo/a.txt", 0, '0');
        Arrays.fill(noMagic, 257, 263, (byte) 0);
        e = assertThrows(ModuleException.class, () -> TarExtractor.inspect(new ByteArrayInputStream(TarFixtures.tar().raw(noMagic).build()), ExtractionLimits.DEFAULT));
        assertEquals(FailureKind.MALFORMED_ARCHIVE, e.getKind());

        byte[] truncated = Arrays.copyOf(TarFixtures.tar().file("demo/a.txt", "abc").buildWithoutEndMarker(), 300);
        e = assertThrows(ModuleException.class, () -> TarExtractor.inspect(new ByteArrayInputStream(truncated), ExtractionLimits.DEFAULT));
        assertEquals(FailureKind.MALFORMED_ARCHIVE, e.getKind());

        e = assertThrows(ModuleException.class, () -> TarExtractor.extractGzip(new ByteArrayInputStream("not gzip".getBytes(StandardCharsets.UTF_8)),
                this.temp.resolve("gz"), ExtractionLimits.DEFAULT));
        assertEquals(FailureKind.MALFORMED_ARCHIVE, e.getKind());
    }

    @Test
    public void testMissingEndMarkerIsTolerated() throws IOException {
        byte[] tar = TarFixtures.tar().file("demo/a.txt", "abc").buildWithoutEndMarker();
        assertEquals(List.of("demo/a.txt"), TarExtractor.inspect(new ByteArrayInputStream(tar), ExtractionLimits.DEFAULT));
    }

    @Test
    public void testLongNamesRoundTrip() throws IOException {
        StringBuilder deep = new StringBuilder();
        for (int i = 0; i < 12; i++) {
            deep.append("directory-").append(i).append('/');
        }
        deep.append("file.txt");
        Map<String, String> files = new LinkedHashMap<>();
        files.put("module.yaml", "name: demo\n");
        files.put(deep.toString(), "deep");
        byte[] tarball = TarFixtures.moduleTarball("demo", files);

        Path dest = this.temp.resolve("long");
        List<String> extracted = TarExtractor.extractGzip(new ByteArrayInputStream(tarball), dest, ExtractionLimits.DEFAULT);
        assertEquals(List.of("demo/module.yaml", "demo/" + deep), extracted);
        assertEquals("deep", new String(Files.readAllBytes(dest.resolve("demo").resolve(deep.toString())), StandardCharsets.UTF_8));
    }

    @Test
    public void testAmbiguousLayouts() throws IOException {
        Path dest = this.temp.resolve("two");
        TarExtractor.extract(new ByteArrayInputStream(TarFixtures.tar().file("a/x", "1").file("b/y", "2").build()), dest, ExtractionLimits.DEFAULT);
        ModuleException e = assertThrows(ModuleException.class, () -> ArchiveLayout.singleRoot(dest));
        assertEquals(FailureKind.AMBIGUOUS_ARCHIVE_LAYOUT, e.getKind());

        Path file = this.temp.resolve("file");
        TarExtractor.extract(new ByteArrayInputStream(TarFixtures.tar().file("lonely.txt", "1").file("__MACOSX/junk", "2").build()), file, ExtractionLimits.DEFAULT);
        e = assertThrows(ModuleException.class, () -> ArchiveLayout.singleRoot(file));
        assertEquals(FailureKind.AMBIGUOUS_ARCHIVE_LAYOUT, e.getKind());
    }
}
