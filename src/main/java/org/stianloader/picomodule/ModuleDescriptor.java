package org.stianloader.picomodule;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * The descriptor that makes a directory a module: {@code module.yaml}, or the YAML front matter of
 * {@code MODULE.md} / {@code module.md}. Only the top level scalar fields are of interest here.
 */
public final class ModuleDescriptor {

    @NotNull
    public static final String MODULE_YAML = "module.yaml";

    /**
     * Descriptor file names in lookup order.
     */
    @NotNull
    public static final List<String> FILE_NAMES = List.of(ModuleDescriptor.MODULE_YAML, "MODULE.md", "module.md");

    @NotNull
    private final Path file;
    @NotNull
    private final Map<String, Object> fields;

    private ModuleDescriptor(@NotNull Path file, @NotNull Map<String, Object> fields) {
        this.file = file;
        this.fields = Collections.unmodifiableMap(fields);
    }

    @Contract(pure = true)
    public static boolean isModuleDirectory(@NotNull Path dir) {
        return ModuleDescriptor.findDescriptorFile(dir) != null;
    }

    @Nullable
    public static Path findDescriptorFile(@NotNull Path dir) {
        for (String name : ModuleDescriptor.FILE_NAMES) {
            Path candidate = dir.resolve(name);
            if (Files.isRegularFile(candidate, LinkOption.NOFOLLOW_LINKS)) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Read the descriptor of a module directory.
     *
     * @param dir The module directory
     * @return The descriptor, or null if the directory holds no descriptor file
     * @throws IOException If the descriptor file cannot be read
     * @throws ModuleException With {@link FailureKind#MODULE_NOT_FOUND} if the descriptor is not valid YAML
     * or its top level is not a mapping
     */
    @Nullable
    public static ModuleDescriptor read(@NotNull Path dir) throws IOException {
        Path file = ModuleDescriptor.findDescriptorFile(dir);
        if (file == null) {
            return null;
        }
        String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        String yaml;
        if (file.getFileName().toString().equals(ModuleDescriptor.MODULE_YAML)) {
            yaml = content;
        } else {
            yaml = ModuleDescriptor.frontMatter(content);
            if (yaml == null) {
                return new ModuleDescriptor(file, Collections.emptyMap());
            }
        }
        return new ModuleDescriptor(file, ModuleDescriptor.parse(yaml, file));
    }

    /**
     * Read the {@code module.yaml} of a directory and require a set of non-blank keys.
     *
     * @param dir The module directory
     * @param requiredKeys The keys that must be present
     * @return The descriptor
     * @throws IOException If the file cannot be read
     * @throws ModuleException With {@link FailureKind#MODULE_NOT_FOUND} if there is no {@code module.yaml},
     * it cannot be parsed or it lacks a required key
     */
    @NotNull
    public static ModuleDescriptor readModuleYaml(@NotNull Path dir, @NotNull String... requiredKeys) throws IOException {
        Path file = dir.resolve(ModuleDescriptor.MODULE_YAML);
        if (!Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)) {
            throw new ModuleException(FailureKind.MODULE_NOT_FOUND, "No " + ModuleDescriptor.MODULE_YAML + " in " + dir);
        }
        ModuleDescriptor descriptor = new ModuleDescriptor(file, ModuleDescriptor.parse(new String(Files.readAllBytes(file), StandardCharsets.UTF_8), file));
        List<String> missing = new ArrayList<>();
        for (String key : requiredKeys) {
            if (descriptor.getString(key) == null) {
                missing.add(key);
            }
        }
        if (!missing.isEmpty()) {
            throw new ModuleException(FailureKind.MODULE_NOT_FOUND, ModuleDescriptor.MODULE_YAML + " missing required keys " + missing + ": " + file);
        }
        return descriptor;
    }

    @Nullable
    private static String frontMatter(@NotNull String content) {
        if (!content.startsWith("---")) {
            return null;
        }
        int end = content.indexOf("---", 3);
        if (end == -1) {
            return null;
        }
        return content.substring(3, end);
    }

    @NotNull
    private static Map<String, Object> parse(@NotNull String yaml, @NotNull Path file) {
        Object document;
        try {
            document = new Yaml(new SafeConstructor(new LoaderOptions())).load(yaml);
        } catch (YAMLException e) {
            throw new ModuleException(FailureKind.MODULE_NOT_FOUND, "Failed to parse module descriptor " + file + ": " + e.getMessage(), e);
        }
        if (document == null) {
            return Collections.emptyMap();
        }
        if (!(document instanceof Map)) {
            throw new ModuleException(FailureKind.MODULE_NOT_FOUND, "Module descriptor " + file + " is not a mapping");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) document).entrySet()) {
            if (entry.getKey() instanceof String) {
                fields.put((String) entry.getKey(), entry.getValue());
            }
        }
        return fields;
    }

    /**
     * Obtain a scalar field as trimmed string. YAML numbers such as {@code version: 1.0} are returned
     * in their textual form.
     *
     * @param key The field name
     * @return The value, or null if the field is absent, blank or not a scalar
     */
    @Nullable
    public String getString(@NotNull String key) {
        Object value = this.fields.get(key);
        if (value == null || value instanceof Map || value instanceof Iterable) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    @Nullable
    public String getName() {
        return this.getString("name");
    }

    @Nullable
    public String getVersion() {
        return this.getString("version");
    }

    @NotNull
    public Path getFile() {
        return this.file;
    }
}
