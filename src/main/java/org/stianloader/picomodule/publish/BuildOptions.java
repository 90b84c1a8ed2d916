package org.stianloader.picomodule.publish;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Options of {@link AssetBuilder#build(BuildOptions)}. Only the modules directory and the output directory are
 * mandatory, everything else has a default.
 */
public class BuildOptions {

    @NotNull
    public static final String DEFAULT_REGISTRY_FILE_NAME = "cognitive-registry.v2.json";

    @NotNull
    private final Path modulesDir;
    @NotNull
    private final Path outDir;
    @Nullable
    private Path registryOut;
    @Nullable
    private Path legacyIndex;
    @NotNull
    private String namespace = "official";
    @NotNull
    private String runtimeMin = "2.2.0";
    @NotNull
    private String repository = "https://github.com/Cognary/cognitive";
    @NotNull
    private String homepage = "https://cognary.github.io/cognitive/";
    @NotNull
    private String license = "MIT";
    @Nullable
    private String tag;
    @Nullable
    private String tarballBaseUrl;
    @Nullable
    private String timestamp;
    @NotNull
    private Set<String> only = Collections.emptySet();

    public BuildOptions(@NotNull Path modulesDir, @NotNull Path outDir) {
        this.modulesDir = Objects.requireNonNull(modulesDir, "modulesDir may not be null");
        this.outDir = Objects.requireNonNull(outDir, "outDir may not be null");
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public BuildOptions setRegistryOut(@Nullable Path registryOut) {
        this.registryOut = registryOut;
        return this;
    }

    /**
     * Set the legacy index that descriptions, authors, keywords and categories are taken from.
     *
     * @param legacyIndex The legacy index file, or null to use the module descriptors only
     * @return The current {@link BuildOptions} instance, for chaining
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public BuildOptions setLegacyIndex(@Nullable Path legacyIndex) {
        this.legacyIndex = legacyIndex;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public BuildOptions setNamespace(@NotNull String namespace) {
        this.namespace = Objects.requireNonNull(namespace, "namespace may not be null");
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public BuildOptions setRuntimeMin(@NotNull String runtimeMin) {
        this.runtimeMin = Objects.requireNonNull(runtimeMin, "runtimeMin may not be null");
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public BuildOptions setRepository(@NotNull String repository) {
        this.repository = Objects.requireNonNull(repository, "repository may not be null");
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public BuildOptions setHomepage(@NotNull String homepage) {
        this.homepage = Objects.requireNonNull(homepage, "homepage may not be null");
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public BuildOptions setLicense(@NotNull String license) {
        this.license = Objects.requireNonNull(license, "license may not be null");
        return this;
    }

    /**
     * Set the release tag. Without an explicit tarball base URL, tarballs are referenced as
     * {@code <repository>/releases/download/<tag>/<file>}.
     *
     * @param tag The tag, or null
     * @return The current {@link BuildOptions} instance, for chaining
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public BuildOptions setTag(@Nullable String tag) {
        this.tag = tag;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public BuildOptions setTarballBaseUrl(@Nullable String tarballBaseUrl) {
        this.tarballBaseUrl = tarballBaseUrl;
        return this;
    }

    /**
     * Set the timestamp written into the index. A fixed timestamp makes the whole output reproducible.
     *
     * @param timestamp The ISO-8601 timestamp, or null for the current time
     * @return The current {@link BuildOptions} instance, for chaining
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public BuildOptions setTimestamp(@Nullable String timestamp) {
        this.timestamp = timestamp;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public BuildOptions setOnly(@NotNull String @NotNull... names) {
        Set<String> set = new LinkedHashSet<>();
        for (String name : Arrays.asList(names)) {
            if (!name.trim().isEmpty()) {
                set.add(name.trim());
            }
        }
        this.only = Collections.unmodifiableSet(set);
        return this;
    }

    @NotNull
    public Path getModulesDir() {
        return this.modulesDir;
    }

    @NotNull
    public Path getOutDir() {
        return this.outDir;
    }

    @NotNull
    public Path getRegistryOut() {
        return this.registryOut == null ? this.outDir.resolve(BuildOptions.DEFAULT_REGISTRY_FILE_NAME) : this.registryOut;
    }

    @Nullable
    public Path getLegacyIndex() {
        return this.legacyIndex;
    }

    @NotNull
    public String getNamespace() {
        return this.namespace;
    }

    @NotNull
    public String getRuntimeMin() {
        return this.runtimeMin;
    }

    @NotNull
    public String getRepository() {
        return this.repository;
    }

    @NotNull
    public String getHomepage() {
        return this.homepage;
    }

    @NotNull
    public String getLicense() {
        return this.license;
    }

    @Nullable
    public String getTag() {
        return this.tag;
    }

    @Nullable
    public String getTarballBaseUrl() {
        return this.tarballBaseUrl;
    }

    @Nullable
    public String getTimestamp() {
        return this.timestamp;
    }

    @NotNull
    public Set<String> getOnly() {
        return this.only;
    }
}
