package org.stianloader.picomodule.publish;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picomodule.FailureKind;
import org.stianloader.picomodule.ModuleDescriptor;
import org.stianloader.picomodule.ModuleException;
import org.stianloader.picomodule.archive.TarArchiveWriter;
import org.stianloader.picomodule.integrity.Digests;
import org.stianloader.picomodule.internal.FileUtil;
import org.stianloader.picomodule.internal.JsonUtil;
import org.stianloader.picomodule.logging.LoggingAdapter;
import org.stianloader.picomodule.registry.RegistryEntry;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

/**
 * Packages a directory of modules into reproducible release tarballs and writes the registry index describing them.
 *
 * <p>Two builds of the same input with the same {@link BuildOptions#setTimestamp(String) timestamp} produce
 * byte-identical tarballs and an identical index.
 */
public final class AssetBuilder {

    @NotNull
    public static final String INDEX_SCHEMA = "https://cognitive-modules.dev/schema/registry-v2.json";
    @NotNull
    public static final String ENTRY_SCHEMA = "https://cognitive-modules.dev/schema/registry-entry-v1.json";
    @NotNull
    public static final String INDEX_FORMAT_VERSION = "2.0.0";
    @NotNull
    public static final String MODULE_SPEC_VERSION = "2.2";

    private AssetBuilder() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Build the release assets.
     *
     * @param options The build options
     * @return What was built
     * @throws IOException If reading the modules or writing the output fails
     * @throws ModuleException With {@link FailureKind#MODULE_NOT_FOUND} if a {@code module.yaml} lacks a required key,
     * {@link FailureKind#UNSAFE_ARCHIVE_ENTRY} if a module contains a symbolic link or {@link FailureKind#MALFORMED_INDEX}
     * if the legacy index cannot be parsed
     */
    @NotNull
    public static BuildResult build(@NotNull BuildOptions options) throws IOException {
        JsonObject legacy = AssetBuilder.loadLegacyIndex(options.getLegacyIndex());
        JsonObject legacyModules = JsonUtil.optObject(legacy, "modules");
        String updated = options.getTimestamp() == null || options.getTimestamp().trim().isEmpty()
                ? Instant.now().truncatedTo(ChronoUnit.SECONDS).toString()
                : options.getTimestamp().trim();
        String tarballBaseUrl = AssetBuilder.tarballBaseUrl(options);
        Path outDir = options.getOutDir().toAbsolutePath();
        Files.createDirectories(outDir);

        List<Path> moduleDirs = new ArrayList<>();
        try (DirectoryStream<Path> children = Files.newDirectoryStream(options.getModulesDir())) {
            for (Path child : children) {
                if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)
                        && Files.isRegularFile(child.resolve(ModuleDescriptor.MODULE_YAML), LinkOption.NOFOLLOW_LINKS)) {
                    moduleDirs.add(child);
                }
            }
        }
        Collections.sort(moduleDirs);

        JsonObject modules = new JsonObject();
        List<BuildResult.BuiltModule> built = new ArrayList<>();
        for (Path moduleDir : moduleDirs) {
            ModuleDescriptor descriptor = ModuleDescriptor.readModuleYaml(moduleDir, "name", "version", "tier", "responsibility");
            String name = Objects.requireNonNull(descriptor.getName(), "name");
            String version = Objects.requireNonNull(descriptor.getVersion(), "version");
            if (!options.getOnly().isEmpty() && !options.getOnly().contains(name)) {
                continue;
            }
            List<String> files = FileUtil.listRegularFiles(moduleDir, true);
            String fileName = name + "-" + version + ".tar.gz";
            Path tarball = outDir.resolve(fileName);
            LoggingAdapter.getDefaultLogger().debug(AssetBuilder.class, "Packaging module '{}' ({} files) into {}", name, files.size(), tarball);
            AssetBuilder.writeTarball(moduleDir, name, files, tarball);
            String sha256 = Digests.sha256Hex(tarball);
            long size = Files.size(tarball);

            JsonObject legacyInfo = JsonUtil.optObject(legacyModules, name);
            String description = JsonUtil.optString(legacyInfo, "description");
            if (description == null) {
                description = descriptor.getString("responsibility");
            }
            String author = JsonUtil.optString(legacyInfo, "author");
            JsonObject entry = AssetBuilder.entry(options, name, version, descriptor.getString("tier"), description, author == null ? "unknown" : author,
                    JsonUtil.stringList(legacyInfo, "tags"), tarballBaseUrl == null ? fileName : tarballBaseUrl + "/" + fileName,
                    sha256, size, files, updated);
            modules.add(name, RegistryEntry.parse(name, entry).toJson());
            built.add(new BuildResult.BuiltModule(name, version, fileName, sha256, size));
        }

        JsonObject index = new JsonObject();
        index.addProperty("$schema", AssetBuilder.INDEX_SCHEMA);
        index.addProperty("version", AssetBuilder.INDEX_FORMAT_VERSION);
        index.addProperty("updated", updated);
        index.add("modules", modules);
        JsonObject categories = JsonUtil.optObject(legacy, "categories");
        index.add("categories", categories == null ? new JsonObject() : categories.deepCopy());
        index.add("featured", JsonUtil.toArray(modules.keySet()));
        JsonObject stats = new JsonObject();
        stats.addProperty("total_modules", modules.size());
        stats.addProperty("total_downloads", 0);
        stats.addProperty("last_updated", updated);
        index.add("stats", stats);

        Path registryOut = options.getRegistryOut().toAbsolutePath();
        Files.createDirectories(registryOut.getParent());
        Files.write(registryOut, JsonUtil.toAsciiJson(index).getBytes(StandardCharsets.UTF_8));
        LoggingAdapter.getDefaultLogger().info(AssetBuilder.class, "Wrote registry index with {} modules to {}", built.size(), registryOut);
        return new BuildResult(index, registryOut, outDir, updated, built);
    }

    @NotNull
    private static JsonObject entry(@NotNull BuildOptions options, @NotNull String name, @NotNull String version, @Nullable String tier,
            @Nullable String description, @NotNull String author, @NotNull List<String> keywords, @NotNull String tarball,
            @NotNull String sha256, long size, @NotNull List<String> files, @NotNull String updated) {
        JsonObject identity = new JsonObject();
        identity.addProperty("name", name);
        identity.addProperty("namespace", options.getNamespace());
        identity.addProperty("version", version);
        identity.addProperty("spec_version", AssetBuilder.MODULE_SPEC_VERSION);

        JsonObject metadata = new JsonObject();
        metadata.addProperty("description", description);
        metadata.addProperty("description_zh", description);
        metadata.addProperty("author", author);
        metadata.addProperty("tier", tier);
        metadata.addProperty("license", options.getLicense());
        metadata.addProperty("repository", options.getRepository());
        metadata.addProperty("homepage", options.getHomepage());
        metadata.add("keywords", JsonUtil.toArray(keywords));

        JsonObject dependencies = new JsonObject();
        dependencies.addProperty("runtime_min", options.getRuntimeMin());
        dependencies.add("modules", new JsonArray());

        JsonObject distribution = new JsonObject();
        distribution.addProperty("tarball", tarball);
        distribution.addProperty("checksum", "sha256:" + sha256);
        distribution.addProperty("size_bytes", size);
        distribution.add("files", JsonUtil.toArray(files));

        JsonObject timestamps = new JsonObject();
        timestamps.addProperty("created_at", updated);
        timestamps.addProperty("updated_at", updated);
        timestamps.add("deprecated_at", JsonNull.INSTANCE);

        JsonObject entry = new JsonObject();
        entry.addProperty("$schema", AssetBuilder.ENTRY_SCHEMA);
        entry.add("identity", identity);
        entry.add("metadata", metadata);
        entry.add("dependencies", dependencies);
        entry.add("distribution", distribution);
        entry.add("timestamps", timestamps);
        return entry;
    }

    private static void writeTarball(@NotNull Path moduleDir, @NotNull String name, @NotNull List<String> files, @NotNull Path tarball) throws IOException {
        Path temp = tarball.resolveSibling(tarball.getFileName() + ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(temp);
                    TarArchiveWriter writer = TarArchiveWriter.gzip(out)) {
                for (String file : files) {
                    writer.addFile(name + "/" + file, moduleDir.resolve(file));
                }
            }
            Files.move(temp, tarball, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @Nullable
    private static String tarballBaseUrl(@NotNull BuildOptions options) {
        if (options.getTarballBaseUrl() != null && !options.getTarballBaseUrl().isEmpty()) {
            return options.getTarballBaseUrl();
        }
        String tag = options.getTag() == null ? "" : options.getTag().trim();
        if (tag.isEmpty()) {
            return null;
        }
        String repository = options.getRepository();
        while (repository.endsWith("/")) {
            repository = repository.substring(0, repository.length() - 1);
        }
        return repository + "/releases/download/" + tag;
    }

    @Nullable
    private static JsonObject loadLegacyIndex(@Nullable Path legacyIndex) throws IOException {
        if (legacyIndex == null) {
            return null;
        }
        JsonElement root;
        try {
            root = JsonUtil.parseStrict(new String(Files.readAllBytes(legacyIndex), StandardCharsets.UTF_8));
        } catch (JsonParseException e) {
            throw new ModuleException(FailureKind.MALFORMED_INDEX, "Legacy index " + legacyIndex + " is not valid JSON: " + e.getMessage(), e);
        }
        if (!root.isJsonObject()) {
            throw new ModuleException(FailureKind.MALFORMED_INDEX, "Legacy index " + legacyIndex + " is not a JSON object");
        }
        return root.getAsJsonObject();
    }
}
