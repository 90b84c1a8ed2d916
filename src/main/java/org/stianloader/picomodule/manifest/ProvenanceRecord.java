package org.stianloader.picomodule.manifest;

import java.util.Map;
import java.util.TreeMap;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picomodule.FailureKind;
import org.stianloader.picomodule.ModuleException;
import org.stianloader.picomodule.integrity.ModuleIntegrity;
import org.stianloader.picomodule.internal.JsonUtil;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * The {@code provenance.json} document stored inside an installed module: where the module came from and
 * what its files looked like at installation time.
 *
 * @param spec The document format, {@link #SPEC}
 * @param createdAt ISO-8601 creation timestamp
 * @param source The origin of the module
 * @param integrity The per-file digests at installation time
 */
public final record ProvenanceRecord(@NotNull String spec, @NotNull String createdAt, @NotNull Source source, @NotNull ModuleIntegrity integrity) {

    @NotNull
    public static final String SPEC = "cognitive.module.provenance/v1";

    public interface Source {
        @NotNull
        String type();

        @NotNull
        JsonObject toJson();
    }

    /**
     * Quality attestations copied from the registry entry at installation time.
     */
    public static final record Quality(@Nullable Boolean verified, @Nullable Integer conformanceLevel, @Nullable String specVersion) {
    }

    public static final record RegistrySource(@Nullable String registryUrl, @NotNull String moduleName, @Nullable String requestedVersion,
            @Nullable String resolvedVersion, @NotNull String tarballUrl, @NotNull String checksum, @NotNull String sha256,
            @Nullable Quality quality) implements Source {

        @NotNull
        public static final String TYPE = "registry";

        @Override
        @NotNull
        public String type() {
            return RegistrySource.TYPE;
        }

        @Override
        @NotNull
        public JsonObject toJson() {
            JsonObject object = new JsonObject();
            object.addProperty("type", RegistrySource.TYPE);
            object.addProperty("registryUrl", this.registryUrl);
            object.addProperty("moduleName", this.moduleName);
            object.addProperty("requestedVersion", this.requestedVersion);
            object.addProperty("resolvedVersion", this.resolvedVersion);
            object.addProperty("tarballUrl", this.tarballUrl);
            object.addProperty("checksum", this.checksum);
            object.addProperty("sha256", this.sha256);
            if (this.quality != null) {
                JsonObject quality = new JsonObject();
                quality.addProperty("verified", this.quality.verified());
                quality.addProperty("conformance_level", this.quality.conformanceLevel());
                quality.addProperty("spec_version", this.quality.specVersion());
                object.add("quality", quality);
            }
            return object;
        }
    }

    public static final record RepositorySource(@NotNull String repoUrl, @Nullable String ref, @Nullable String modulePath) implements Source {

        @NotNull
        public static final String TYPE = "github";

        @Override
        @NotNull
        public String type() {
            return RepositorySource.TYPE;
        }

        @Override
        @NotNull
        public JsonObject toJson() {
            JsonObject object = new JsonObject();
            object.addProperty("type", RepositorySource.TYPE);
            object.addProperty("repoUrl", this.repoUrl);
            object.addProperty("ref", this.ref);
            object.addProperty("modulePath", this.modulePath);
            return object;
        }
    }

    @NotNull
    public JsonObject toJson() {
        JsonObject integrity = new JsonObject();
        integrity.addProperty("algorithm", this.integrity.algorithm());
        integrity.addProperty("maxFiles", this.integrity.maxFiles());
        integrity.addProperty("maxTotalBytes", this.integrity.maxTotalBytes());
        integrity.addProperty("maxSingleFileBytes", this.integrity.maxSingleFileBytes());
        integrity.addProperty("totalBytes", this.integrity.totalBytes());
        JsonObject files = new JsonObject();
        for (Map.Entry<String, String> file : this.integrity.files().entrySet()) {
            files.addProperty(file.getKey(), file.getValue());
        }
        integrity.add("files", files);

        JsonObject object = new JsonObject();
        object.addProperty("spec", this.spec);
        object.addProperty("createdAt", this.createdAt);
        object.add("source", this.source.toJson());
        object.add("integrity", integrity);
        return object;
    }

    /**
     * Read a provenance document.
     *
     * @param object The document
     * @return The record
     * @throws ModuleException With {@link FailureKind#POLICY_VIOLATION} if the document is not a provenance record
     * of a known format
     */
    @NotNull
    public static ProvenanceRecord fromJson(@NotNull JsonObject object) {
        String spec = JsonUtil.optString(object, "spec");
        if (!ProvenanceRecord.SPEC.equals(spec)) {
            throw new ModuleException(FailureKind.POLICY_VIOLATION, "Unknown provenance format: " + spec);
        }
        JsonObject sourceObject = JsonUtil.optObject(object, "source");
        JsonObject integrityObject = JsonUtil.optObject(object, "integrity");
        if (sourceObject == null || integrityObject == null) {
            throw new ModuleException(FailureKind.POLICY_VIOLATION, "Provenance record lacks a source or integrity section");
        }

        Source source;
        String type = JsonUtil.optString(sourceObject, "type");
        if (RegistrySource.TYPE.equals(type)) {
            String moduleName = JsonUtil.optString(sourceObject, "moduleName");
            String tarballUrl = JsonUtil.optString(sourceObject, "tarballUrl");
            String checksum = JsonUtil.optString(sourceObject, "checksum");
            String sha256 = JsonUtil.optString(sourceObject, "sha256");
            if (moduleName == null || tarballUrl == null || checksum == null || sha256 == null) {
                throw new ModuleException(FailureKind.POLICY_VIOLATION, "Registry provenance lacks the module name, tarball URL or digests");
            }
            JsonObject qualityObject = JsonUtil.optObject(sourceObject, "quality");
            Quality quality = qualityObject == null ? null : new Quality(JsonUtil.optBoolean(qualityObject, "verified"),
                    JsonUtil.optInt(qualityObject, "conformance_level"), JsonUtil.optString(qualityObject, "spec_version"));
            source = new RegistrySource(JsonUtil.optString(sourceObject, "registryUrl"), moduleName, JsonUtil.optString(sourceObject, "requestedVersion"),
                    JsonUtil.optString(sourceObject, "resolvedVersion"), tarballUrl, checksum, sha256, quality);
        } else if (RepositorySource.TYPE.equals(type)) {
            String repoUrl = JsonUtil.optString(sourceObject, "repoUrl");
            if (repoUrl == null) {
                throw new ModuleException(FailureKind.POLICY_VIOLATION, "Repository provenance lacks the repository URL");
            }
            source = new RepositorySource(repoUrl, JsonUtil.optString(sourceObject, "ref"), JsonUtil.optString(sourceObject, "modulePath"));
        } else {
            throw new ModuleException(FailureKind.POLICY_VIOLATION, "Unknown provenance source type: " + type);
        }

        Map<String, String> files = new TreeMap<>();
        JsonObject filesObject = JsonUtil.optObject(integrityObject, "files");
        if (filesObject != null) {
            for (Map.Entry<String, JsonElement> file : filesObject.entrySet()) {
                if (file.getValue().isJsonPrimitive()) {
                    files.put(file.getKey(), file.getValue().getAsString());
                }
            }
        }
        Integer maxFiles = JsonUtil.optInt(integrityObject, "maxFiles");
        Long maxTotalBytes = JsonUtil.optLong(integrityObject, "maxTotalBytes");
        Long maxSingleFileBytes = JsonUtil.optLong(integrityObject, "maxSingleFileBytes");
        Long totalBytes = JsonUtil.optLong(integrityObject, "totalBytes");
        String algorithm = JsonUtil.optString(integrityObject, "algorithm");
        if (maxFiles == null || maxTotalBytes == null || maxSingleFileBytes == null || algorithm == null) {
            throw new ModuleException(FailureKind.POLICY_VIOLATION, "Provenance integrity section lacks its algorithm or limits");
        }
        ModuleIntegrity integrity = new ModuleIntegrity(algorithm, maxFiles, maxTotalBytes, maxSingleFileBytes,
                totalBytes == null ? 0L : totalBytes, files);

        String createdAt = JsonUtil.optString(object, "createdAt");
        return new ProvenanceRecord(spec, createdAt == null ? "" : createdAt, source, integrity);
    }
}
