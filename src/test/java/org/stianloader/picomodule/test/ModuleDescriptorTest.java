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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stianloader.picomodule.FailureKind;
import org.stianloader.picomodule.ModuleDescriptor;
import org.stianloader.picomodule.ModuleException;

public class ModuleDescriptorTest {

    @TempDir
    Path temp;

    private static void write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testModuleYamlWins() throws IOException {
        Path dir = this.temp.resolve("demo");
        ModuleDescriptorTest.write(dir.resolve("module.yaml"), "name: demo\nversion: 1.0\nkeywords: [a, b]\n");
        ModuleDescriptorTest.write(dir.resolve("MODULE.md"), "---\nname: other\n---\n# Other\n");

        assertTrue(ModuleDescriptor.isModuleDirectory(dir));
        ModuleDescriptor descriptor = ModuleDescriptor.read(dir);
        assertNotNull(descriptor);
        assertEquals(dir.resolve("module.yaml"), descriptor.getFile());
        assertEquals("demo", descriptor.getName());
        assertEquals("1.0", descriptor.getVersion());
        assertNull(descriptor.getString("keywords"));
    }

    @Test
    public void testMarkdownFrontMatter() throws IOException {
        Path dir = this.temp.resolve("md");
        ModuleDescriptorTest.write(dir.resolve("module.md"), "---\nname: md-module\nversion: \"2.0.0\"\n---\n# Body\n");
        ModuleDescriptor descriptor = ModuleDescriptor.read(dir);
        assertEquals("md-module", descriptor.getName());
        assertEquals("2.0.0", descriptor.getVersion());

        Path plain = this.temp.resolve("plain");
        ModuleDescriptorTest.write(plain.resolve("MODULE.md"), "# No front matter\n");
        ModuleDescriptor empty = ModuleDescriptor.read(plain);
        assertNotNull(empty);
        assertNull(empty.getName());
    }

    @Test
    public void testNotAModule() throws IOException {
        Files.createDirectories(this.temp.resolve("empty"));
        assertFalse(ModuleDescriptor.isModuleDirectory(this.temp.resolve("empty")));
        assertNull(ModuleDescriptor.read(this.temp.resolve("empty")));
    }

    @Test
    public void testInvalidYaml() throws IOException {
        Path list = this.temp.resolve("list");
        ModuleDescriptorTest.write(list.resolve("module.yaml"), "- a\n- b\n");
        assertEquals(FailureKind.MODULE_NOT_FOUND, assertThrows(ModuleException.class, () -> ModuleDescriptor.read(list)).getKind());

        Path broken = this.temp.resolve("broken");
        ModuleDescriptorTest.write(broken.resolve("module.yaml"), "name: [unclosed\n");
        assertEquals(FailureKind.MODULE_NOT_FOUND, assertThrows(ModuleException.class, () -> ModuleDescriptor.read(broken)).getKind());

        // Arbitrary type tags are refused by the safe loader
        Path tagged = this.temp.resolve("tagged");
        ModuleDescriptorTest.write(tagged.resolve("module.yaml"), "name: !!java.io.File [\"/tmp\"]\n");
        assertEquals(FailureKind.MODULE_NOT_FOUND, assertThrows(ModuleException.class, () -> ModuleDescriptor.read(tagged)).getKind());
    }

    @Test
    public void testRequiredKeys() throws IOException {
        Path dir = this.temp.resolve("demo");
        ModuleDescriptorTest.write(dir.resolve("module.yaml"), "name: demo\nversion: \"\"\n");
        ModuleException e = assertThrows(ModuleException.class, () -> ModuleDescriptor.readModuleYaml(dir, "name", "version", "tier"));
        assertEquals(FailureKind.MODULE_NOT_FOUND, e.getKind());
        assertTrue(e.getMessage().contains("[version, tier]"), e.getMessage());
        assertEquals("demo", ModuleDescriptor.readModuleYaml(dir, "name").getName());

        Path md = this.temp.resolve("md");
        ModuleDescriptorTest.write(md.resolve("MODULE.md"), "---\nname: md\n---\n");
        assertEquals(FailureKind.MODULE_NOT_FOUND, assertThrows(ModuleException.class, () -> ModuleDescriptor.readModuleYaml(md, "name")).getKind());
    }
}
