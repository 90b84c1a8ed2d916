package org.stianloader.picomodule.publish;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picomodule.FailureKind;
import org.stianloader.picomodule.ModuleDescriptor;
import org.stianloader.picomodule.ModuleException;
import org.stianloader.picomodule.archive.ArchiveLayout;
import org.stianloader.picomodule.archive.TarExtractor;
import org.stianloader.picomodule.integrity.Checksum;
import org.stianloader.picomodule.integrity.Digests;
import org.stianloader.picomodule.internal.ConcurrencyUtil;
import org.stianloader.picomodule.internal.FileUtil;
import org.stianloader.picomodule.internal.JsonUtil;
import org.stianloader.picomodule.logging.LoggingAdapter;
import org.stianloader.picomodule.registry.RegistryEntry;
import org.stianloader.picomodule.registry.RegistryIndexClient;
import org.stianloader.picomodule.repo.DownloadedFile;
import org.stianloader.picomodule.repo.HttpTransport;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

/**
 * Checks that every module of a registry index is downloadable, matches its declared size and checksum,
 * extracts safely and matches its declared identity and file list. Used by release automation after
 * {@link AssetBuilder} and after the assets have been uploaded.
 */
public class AssetVerifier {

    @NotNull
    private final HttpTransport transport;

    public AssetVerifier() {
        this(new HttpTransport());
    }

    public AssetVerifier(@NotNull HttpTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport may not be null");
    }

    /**
     * Verify the modules of a registry index. Modules are isolated from each other: a failing module is recorded
     * and verification continues with the next one.
     *
     * @param options The verification options
     * @param executor The executor to run the verification on; remote verification submits up to
     * {@link VerifyOptions#getEffectiveConcurrency()} tasks to it at once
     * @return A future completing with the result, never exceptionally because of a failed module or index
     * @throws IllegalArgumentException If local verification is requested without an assets directory
     */
    @NotNull
    public CompletableFuture<VerifyResult> verify(@NotNull VerifyOptions options, @NotNull Executor executor) {
        boolean remote = options.isRemote();
        if (!remote && options.getAssetsDir() == null) {
            throw new IllegalArgumentException("Local verification requires an assets directory containing the tarballs");
        }

        return ConcurrencyUtil.schedule(() -> this.loadModules(options, remote), executor).thenCompose((modules) -> {
            Path scratch;
            try {
                scratch = options.getScratchDir() == null ? Files.createTempDirectory("picomodule-verify-")
                        : Files.createTempDirectory(Files.createDirectories(options.getScratchDir()), "verify-");
            } catch (IOException e) {
                throw new ModuleException(FailureKind.IO_FAILURE, "Unable to create a scratch directory for verification: " + e.getMessage(), e);
            }

            List<Map.Entry<String, JsonElement>> entries = new ArrayList<>(modules.entrySet());
            AtomicReferenceArray<VerifyFailure> failures = new AtomicReferenceArray<>(entries.size());
            AtomicInteger passed = new AtomicInteger();
            int concurrency = options.getEffectiveConcurrency();
            LoggingAdapter.getDefaultLogger().debug(AssetVerifier.class, "Verifying {} modules ({} mode, concurrency {})", entries.size(), remote ? "remote" : "local", concurrency);

            return ConcurrencyUtil.runBounded(entries.size(), concurrency, (i) -> {
                Map.Entry<String, JsonElement> entry = entries.get(i);
                Path moduleScratch = scratch.resolve("module-" + i);
                try {
                    VerifyFailure failure = this.verifyModule(options, remote, entry.getKey(), entry.getValue(), moduleScratch);
                    if (failure == null) {
                        passed.incrementAndGet();
                    } else {
                        LoggingAdapter.getDefaultLogger().warn(AssetVerifier.class, "Module '{}' failed verification in phase {}: {}",
                                failure.module(), failure.phase().getReportName(), failure.message());
                        failures.set(i, failure);
                    }
                } finally {
                    FileUtil.deleteScratch(moduleScratch);
                }
            }, executor).handle((ignored, t) -> {
                FileUtil.deleteScratch(scratch);
                if (t != null) {
                    throw ModuleException.unwrap(t);
                }
                List<VerifyFailure> ordered = new ArrayList<>();
                for (int i = 0; i < failures.length(); i++) {
                    VerifyFailure failure = failures.get(i);
                    if (failure != null) {
                        ordered.add(failure);
                    }
                }
                return new VerifyResult(ordered.isEmpty(), entries.size(), passed.get(), ordered.size(), ordered, null);
            });
        }).exceptionally((t) -> VerifyResult.ofIndexFailure(ModuleException.unwrap(t).toFailure()));
    }

    @NotNull
    private JsonObject loadModules(@NotNull VerifyOptions options, boolean remote) throws IOException {
        String location = options.getRegistryIndex();
        byte[] data;
        if (remote) {
            if (!AssetVerifier.isHttpUrl(location)) {
                throw new ModuleException(FailureKind.INVALID_REFERENCE, "Remote verification requires an http(s) registry index URL, got: " + location);
            }
            data = this.transport.fetchBytes(URI.create(location), options.getIndexLimits().maxBytes(), options.getIndexLimits().timeoutMillis(), "registry index");
        } else {
            data = Files.readAllBytes(Paths.get(location));
        }

        JsonElement root;
        try {
            root = JsonUtil.parseStrict(new String(data, StandardCharsets.UTF_8));
        } catch (JsonParseException e) {
            throw new ModuleException(FailureKind.MALFORMED_INDEX, "Invalid registry JSON: " + e.getMessage(), e);
        }
        JsonObject modules = root.isJsonObject() ? JsonUtil.optObject(root.getAsJsonObject(), "modules") : null;
        if (modules == null) {
            throw new ModuleException(FailureKind.MALFORMED_INDEX, "Registry index " + location + " has no 'modules' object");
        }
        return modules;
    }

    @Nullable
    private VerifyFailure verifyModule(@NotNull VerifyOptions options, boolean remote, @NotNull String name, @NotNull JsonElement element, @NotNull Path scratch) {
        VerifyPhase phase = VerifyPhase.DOWNLOAD;
        String tarballRef = null;
        String tarballResolved = null;
        try {
            RegistryEntry parsed = RegistryEntry.parse(name, element);
            if (!(parsed instanceof RegistryEntry.Current)) {
                throw new ModuleException(FailureKind.MALFORMED_INDEX, "Entry has no distribution descriptor");
            }
            RegistryEntry.Current entry = (RegistryEntry.Current) parsed;
            tarballRef = entry.getTarball();
            Files.createDirectories(scratch);

            Path tarball;
            String actualSha256;
            if (remote) {
                URI uri = RegistryIndexClient.resolveTarball(URI.create(options.getRegistryIndex()), tarballRef, name);
                tarballResolved = uri.toString();
                if (!AssetVerifier.isHttpUrl(tarballResolved)) {
                    throw new ModuleException(FailureKind.INVALID_REFERENCE, "Remote verification requires an http(s) or relative tarball reference, got: " + tarballRef);
                }
                tarball = scratch.resolve(AssetVerifier.tarballFileName(tarballResolved));
                DownloadedFile downloaded = this.transport.download(uri, tarball, options.getMaxTarballBytes(), options.getTarballTimeoutMillis(), "tarball of module " + name);
                actualSha256 = downloaded.sha256();
            } else {
                tarball = Objects.requireNonNull(options.getAssetsDir(), "assetsDir").resolve(AssetVerifier.tarballFileName(tarballRef));
                tarballResolved = tarball.toString();
                if (!Files.isRegularFile(tarball, LinkOption.NOFOLLOW_LINKS)) {
                    throw new ModuleException(FailureKind.DOWNLOAD_FAILED, "Tarball not found in the assets directory: " + tarball);
                }
                actualSha256 = null;
            }

            phase = VerifyPhase.CHECKSUM;
            long size = Files.size(tarball);
            Long expectedSize = entry.getSizeBytes();
            if (expectedSize != null && expectedSize != size) {
                throw ModuleException.mismatch(FailureKind.CHECKSUM_MISMATCH, "Size mismatch: expected " + expectedSize + ", got " + size,
                        Long.toString(expectedSize), Long.toString(size));
            }
            Checksum checksum = Checksum.parse(entry.getChecksum());
            checksum.verify(actualSha256 == null ? Digests.sha256Hex(tarball) : actualSha256, tarballResolved);

            phase = VerifyPhase.EXTRACT;
            Path extracted = scratch.resolve("extracted");
            Files.createDirectories(extracted);
            TarExtractor.extractGzip(tarball, extracted, options.getExtractionLimits());
            Path moduleRoot = ArchiveLayout.singleRoot(extracted);
            if (!ModuleDescriptor.isModuleDirectory(moduleRoot)) {
                throw new ModuleException(FailureKind.AMBIGUOUS_ARCHIVE_LAYOUT, "Root directory '" + moduleRoot.getFileName() + "' is not a module");
            }
            AssetVerifier.checkFiles(entry, moduleRoot);
            AssetVerifier.checkIdentity(entry, moduleRoot);
            LoggingAdapter.getDefaultLogger().debug(AssetVerifier.class, "Module '{}' passed verification", name);
            return null;
        } catch (ModuleException e) {
            return new VerifyFailure(name, phase, tarballRef, tarballResolved, String.valueOf(e.getMessage()), e.getKind());
        } catch (IOException | RuntimeException e) {
            ModuleException cause = ModuleException.unwrap(e);
            return new VerifyFailure(name, phase, tarballRef, tarballResolved, String.valueOf(cause.getMessage()), cause.getKind());
        }
    }

    private static void checkFiles(RegistryEntry.@NotNull Current entry, @NotNull Path moduleRoot) throws IOException {
        List<String> declared = entry.getFiles();
        if (declared == null || declared.isEmpty()) {
            return;
        }
        List<String> expected = new ArrayList<>(declared);
        Collections.sort(expected);
        List<String> actual = FileUtil.listRegularFiles(moduleRoot, false);
        if (expected.size() != actual.size()) {
            throw ModuleException.mismatch(FailureKind.CHECKSUM_MISMATCH, "File list mismatch: expected " + expected.size() + " files, got " + actual.size(),
                    Integer.toString(expected.size()), Integer.toString(actual.size()));
        }
        for (int i = 0; i < expected.size(); i++) {
            if (!expected.get(i).equals(actual.get(i))) {
                throw ModuleException.mismatch(FailureKind.CHECKSUM_MISMATCH, "File list mismatch at " + i + ": expected " + expected.get(i) + ", got " + actual.get(i),
                        expected.get(i), actual.get(i));
            }
        }
    }

    private static void checkIdentity(RegistryEntry.@NotNull Current entry, @NotNull Path moduleRoot) throws IOException {
        if (!Files.isRegularFile(moduleRoot.resolve(ModuleDescriptor.MODULE_YAML), LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        ModuleDescriptor descriptor;
        try {
            descriptor = ModuleDescriptor.readModuleYaml(moduleRoot, "name", "version");
        } catch (ModuleException e) {
            // Incomplete descriptors are not an identity mismatch
            LoggingAdapter.getDefaultLogger().debug(AssetVerifier.class, "Skipping identity check of '{}': {}", entry.getKey(), e.getMessage());
            return;
        }
        if (!entry.getVersion().equals(descriptor.getVersion())) {
            throw ModuleException.mismatch(FailureKind.MALFORMED_INDEX, "module.yaml version mismatch: registry=" + entry.getVersion() + ", module.yaml="
                    + descriptor.getVersion(), entry.getVersion(), String.valueOf(descriptor.getVersion()));
        }
        if (!entry.getName().equals(descriptor.getName())) {
            throw ModuleException.mismatch(FailureKind.MALFORMED_INDEX, "module.yaml name mismatch: registry=" + entry.getName() + ", module.yaml="
                    + descriptor.getName(), entry.getName(), String.valueOf(descriptor.getName()));
        }
    }

    static boolean isHttpUrl(@NotNull String location) {
        try {
            URI uri = new URI(location);
            String scheme = uri.getScheme();
            return uri.getHost() != null && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
        } catch (URISyntaxException e) {
            return false;
        }
    }

    /**
     * The file name a tarball reference points to. Query and fragment of URLs are ignored.
     *
     * @param tarballRef The tarball reference, a URL or a path
     * @return The last path segment
     */
    @NotNull
    static String tarballFileName(@NotNull String tarballRef) {
        String path = tarballRef;
        if (AssetVerifier.isHttpUrl(tarballRef)) {
            path = URI.create(tarballRef).getPath();
        }
        path = path.replace('\\', '/');
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        String name = path.substring(path.lastIndexOf('/') + 1);
        if (name.isEmpty() || name.equals(".") || name.equals("..")) {
            throw new ModuleException(FailureKind.MALFORMED_INDEX, "Tarball reference names no file: " + tarballRef);
        }
        return name;
    }
}
