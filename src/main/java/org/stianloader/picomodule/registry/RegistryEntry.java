package org.stianloader.picomodule.registry;

import java.util.List;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picomodule.FailureKind;
import org.stianloader.picomodule.ModuleException;
import org.stianloader.picomodule.internal.JsonUtil;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * A single module of a registry index, in one of the two wire formats the index may use.
 *
 * <p>The format is decided exactly once, by {@link #parse(String, JsonElement)}: an entry with an
 * {@code identity} object is a {@link Current} entry, an entry with a {@code source} string is a {@link Legacy}
 * entry. Everything downstream works on the normalized {@link ModuleInfo}.
 */
public abstract class RegistryEntry {

    @NotNull
    protected final String key;

    protected RegistryEntry(@NotNull String key) {
        this.key = key;
    }

    /**
     * Parse an entry of the {@code modules} object of a registry index.
     *
     * @param key The key of the entry
     * @param element The entry
     * @return The parsed entry
     * @throws ModuleException With {@link FailureKind#MALFORMED_INDEX} if the entry matches neither format
     */
    @NotNull
    public static RegistryEntry parse(@NotNull String key, @NotNull JsonElement element) {
        if (!element.isJsonObject()) {
            throw new ModuleException(FailureKind.MALFORMED_INDEX, "Registry entry '" + key + "' is not an object");
        }
        JsonObject object = element.getAsJsonObject();
        if (object.has("identity")) {
            return Current.parse(key, object);
        }
        return Legacy.parse(key, object);
    }

    /**
     * The key under which the entry is stored in the index, which is also the name it is looked up by.
     *
     * @return The key
     */
    @NotNull
    @Contract(pure = true)
    public String getKey() {
        return this.key;
    }

    @NotNull
    public abstract ModuleInfo toModuleInfo();

    @NotNull
    public abstract JsonObject toJson();

    /**
     * {@code {description, version, source, tags, author}} entries. The source is either
     * {@code github:owner/repo[/path][@ref]} or an absolute tarball URL; legacy entries carry no checksum.
     */
    public static final class Legacy extends RegistryEntry {
        @NotNull
        private final String version;
        @NotNull
        private final String source;
        @NotNull
        private final String description;
        @NotNull
        private final String author;
        @NotNull
        private final List<String> tags;

        public Legacy(@NotNull String key, @NotNull String version, @NotNull String source, @NotNull String description,
                @NotNull String author, @NotNull List<String> tags) {
            super(key);
            this.version = version;
            this.source = source;
            this.description = description;
            this.author = author;
            this.tags = List.copyOf(tags);
        }

        @NotNull
        static Legacy parse(@NotNull String key, @NotNull JsonObject object) {
            String version = JsonUtil.optString(object, "version");
            String source = JsonUtil.optString(object, "source");
            if (version == null || source == null) {
                throw new ModuleException(FailureKind.MALFORMED_INDEX, "Registry entry '" + key + "' has neither an identity nor a version and source");
            }
            String description = JsonUtil.optString(object, "description");
            String author = JsonUtil.optString(object, "author");
            return new Legacy(key, version, source, description == null ? "" : description, author == null ? "" : author,
                    JsonUtil.stringList(object, "tags"));
        }

        @NotNull
        public String getSource() {
            return this.source;
        }

        @Override
        @NotNull
        public ModuleInfo toModuleInfo() {
            String tarball = this.source.startsWith("http://") || this.source.startsWith("https://") ? this.source : null;
            return new ModuleInfo(this.key, this.version, this.description, this.author, this.source, tarball, null, this.tags,
                    null, null, null, null, null, null, null, null, null);
        }

        @Override
        @NotNull
        public JsonObject toJson() {
            JsonObject object = new JsonObject();
            object.addProperty("description", this.description);
            object.addProperty("version", this.version);
            object.addProperty("source", this.source);
            object.add("tags", JsonUtil.toArray(this.tags));
            object.addProperty("author", this.author);
            return object;
        }
    }

    /**
     * {@code {identity, metadata, quality?, dependencies, distribution}} entries, distributed as checksum
     * addressed tarballs.
     */
    public static final class Current extends RegistryEntry {
        @NotNull
        private final JsonObject raw;
        @NotNull
        private final String name;
        @NotNull
        private final String version;
        @NotNull
        private final String tarball;
        @Nullable
        private final String checksum;
        @Nullable
        private final Long sizeBytes;
        @Nullable
        private final List<String> files;

        private Current(@NotNull String key, @NotNull JsonObject raw, @NotNull String name, @NotNull String version,
                @NotNull String tarball, @Nullable String checksum, @Nullable Long sizeBytes, @Nullable List<String> files) {
            super(key);
            this.raw = raw;
            this.name = name;
            this.version = version;
            this.tarball = tarball;
            this.checksum = checksum;
            this.sizeBytes = sizeBytes;
            this.files = files;
        }

        @NotNull
        static Current parse(@NotNull String key, @NotNull JsonObject object) {
            JsonObject identity = JsonUtil.optObject(object, "identity");
            JsonObject distribution = JsonUtil.optObject(object, "distribution");
            String name = JsonUtil.optString(identity, "name");
            String version = JsonUtil.optString(identity, "version");
            String tarball = JsonUtil.optString(distribution, "tarball");
            if (identity == null || name == null || version == null) {
                throw new ModuleException(FailureKind.MALFORMED_INDEX, "Registry entry '" + key + "' has a malformed identity");
            }
            if (tarball == null || tarball.isEmpty()) {
                throw new ModuleException(FailureKind.MALFORMED_INDEX, "Registry entry '" + key + "' has no distribution tarball");
            }
            List<String> files = null;
            if (distribution != null && distribution.has("files")) {
                files = JsonUtil.stringList(distribution, "files");
            }
            return new Current(key, object.deepCopy(), name, version, tarball, JsonUtil.optString(distribution, "checksum"),
                    JsonUtil.optLong(distribution, "size_bytes"), files);
        }

        @NotNull
        public String getName() {
            return this.name;
        }

        @NotNull
        public String getVersion() {
            return this.version;
        }

        @NotNull
        public String getTarball() {
            return this.tarball;
        }

        @Nullable
        public String getChecksum() {
            return this.checksum;
        }

        @Nullable
        public Long getSizeBytes() {
            return this.sizeBytes;
        }

        /**
         * The file list of the distribution descriptor, relative to the module root directory.
         *
         * @return The declared files, or null if the descriptor declares none
         */
        @Nullable
        public List<String> getFiles() {
            return this.files;
        }

        @Override
        @NotNull
        public ModuleInfo toModuleInfo() {
            JsonObject identity = JsonUtil.optObject(this.raw, "identity");
            JsonObject metadata = JsonUtil.optObject(this.raw, "metadata");
            JsonObject quality = JsonUtil.optObject(this.raw, "quality");
            String description = JsonUtil.optString(metadata, "description");
            String author = JsonUtil.optString(metadata, "author");
            return new ModuleInfo(this.name, this.version, description == null ? "" : description, author == null ? "" : author,
                    this.tarball, this.tarball, this.checksum, JsonUtil.stringList(metadata, "keywords"),
                    JsonUtil.optString(metadata, "tier"), JsonUtil.optBoolean(quality, "deprecated"),
                    JsonUtil.optString(identity, "namespace"), JsonUtil.optString(metadata, "license"),
                    JsonUtil.optString(metadata, "repository"), JsonUtil.optInt(quality, "conformance_level"),
                    JsonUtil.optBoolean(quality, "verified"), JsonUtil.optString(identity, "spec_version"), this.sizeBytes);
        }

        @Override
        @NotNull
        public JsonObject toJson() {
            return this.raw.deepCopy();
        }
    }
}
