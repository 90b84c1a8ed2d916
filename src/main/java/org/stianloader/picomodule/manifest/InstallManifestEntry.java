package org.stianloader.picomodule.manifest;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picomodule.internal.JsonUtil;

import com.google.gson.JsonObject;

/**
 * What is known about an installed module.
 *
 * @param source Where the module was installed from: the tarball URL for registry tarballs, the repository URL otherwise
 * @param location The absolute path of the installed module directory
 * @param repositoryUrl The URL of the repository the module came from, if it came from a repository
 * @param modulePath The path of the module within its repository
 * @param ref The branch, tag or commit the repository was fetched at
 * @param version The version declared by the module descriptor
 * @param registryModule The registry name the module was requested under, if it was installed through a registry
 * @param registryUrl The URL of that registry
 * @param installedTime ISO-8601 timestamp of the installation
 */
public final record InstallManifestEntry(@NotNull String source, @NotNull String location, @Nullable String repositoryUrl,
        @Nullable String modulePath, @Nullable String ref, @Nullable String version, @Nullable String registryModule,
        @Nullable String registryUrl, @NotNull String installedTime) {

    @Contract(pure = true)
    public boolean isFromRegistry() {
        return this.registryModule != null;
    }

    @NotNull
    JsonObject toJson() {
        JsonObject object = new JsonObject();
        object.addProperty("source", this.source);
        object.addProperty("location", this.location);
        InstallManifestEntry.addOptional(object, "repositoryUrl", this.repositoryUrl);
        InstallManifestEntry.addOptional(object, "modulePath", this.modulePath);
        InstallManifestEntry.addOptional(object, "ref", this.ref);
        InstallManifestEntry.addOptional(object, "version", this.version);
        InstallManifestEntry.addOptional(object, "registryModule", this.registryModule);
        InstallManifestEntry.addOptional(object, "registryUrl", this.registryUrl);
        object.addProperty("installedTime", this.installedTime);
        return object;
    }

    private static void addOptional(@NotNull JsonObject object, @NotNull String key, @Nullable String value) {
        if (value != null) {
            object.addProperty(key, value);
        }
    }

    @Nullable
    static InstallManifestEntry fromJson(@NotNull JsonObject object) {
        String source = JsonUtil.optString(object, "source");
        String location = JsonUtil.optString(object, "location");
        if (location == null) {
            // Older manifests named the field after the installation directory
            location = JsonUtil.optString(object, "installedAt");
        }
        String installedTime = JsonUtil.optString(object, "installedTime");
        if (source == null || location == null) {
            return null;
        }
        String repositoryUrl = JsonUtil.optString(object, "repositoryUrl");
        if (repositoryUrl == null) {
            repositoryUrl = JsonUtil.optString(object, "githubUrl");
        }
        String ref = JsonUtil.optString(object, "ref");
        if (ref == null) {
            ref = JsonUtil.optString(object, "tag");
        }
        if (ref == null) {
            ref = JsonUtil.optString(object, "branch");
        }
        return new InstallManifestEntry(source, location, repositoryUrl, JsonUtil.optString(object, "modulePath"), ref,
                JsonUtil.optString(object, "version"), JsonUtil.optString(object, "registryModule"),
                JsonUtil.optString(object, "registryUrl"), installedTime == null ? "" : installedTime);
    }
}
