package org.stianloader.picomodule;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;
import java.util.regex.Pattern;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picomodule.archive.ArchiveLayout;
import org.stianloader.picomodule.archive.ExtractionLimits;
import org.stianloader.picomodule.archive.TarExtractor;
import org.stianloader.picomodule.integrity.Checksum;
import org.stianloader.picomodule.internal.ConcurrencyUtil;
import org.stianloader.picomodule.internal.FileUtil;
import org.stianloader.picomodule.logging.LoggingAdapter;
import org.stianloader.picomodule.manifest.InstallManifest;
import org.stianloader.picomodule.manifest.InstallManifestEntry;
import org.stianloader.picomodule.manifest.ProvenanceRecord;
import org.stianloader.picomodule.registry.ModuleInfo;
import org.stianloader.picomodule.registry.RegistryIndex;
import org.stianloader.picomodule.registry.RegistryIndexClient;
import org.stianloader.picomodule.registry.RepositorySource;
import org.stianloader.picomodule.registry.ResolvedDownload;
import org.stianloader.picomodule.repo.DownloadedFile;
import org.stianloader.picomodule.repo.GitHubRepositoryHost;
import org.stianloader.picomodule.repo.HttpTransport;
import org.stianloader.picomodule.repo.RepositoryHost;

/**
 * Installs, updates and removes modules.
 *
 * <p>All public operations run on the {@link Executor} passed to them and never complete exceptionally
 * because of a failed operation: failures are reported through the {@link Failure} of the returned result.
 * The returned futures may be cancelled, in which case the operation stops at its next phase boundary without
 * materializing or registering anything.
 */
public class ModuleInstaller {

    @NotNull
    public static final String DEFAULT_REF = "main";

    /**
     * Default byte ceiling of registry tarballs.
     */
    public static final long DEFAULT_MAX_TARBALL_BYTES = 20L * 1024 * 1024;

    /**
     * Default byte ceiling of compressed repository snapshots.
     */
    public static final long DEFAULT_MAX_REPOSITORY_ARCHIVE_BYTES = 100L * 1024 * 1024;

    public static final long DEFAULT_TARBALL_TIMEOUT_MILLIS = 10_000L;
    public static final long DEFAULT_REPOSITORY_TIMEOUT_MILLIS = 60_000L;

    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9_][A-Za-z0-9_.-]*");

    @NotNull
    private final InstallLayout layout;
    @NotNull
    private final InstallManifest manifest;
    @NotNull
    private final RegistryIndexClient registry;
    @NotNull
    private final RepositoryHost host;
    @NotNull
    private final HttpTransport transport;
    @NotNull
    private ProvenancePolicy provenancePolicy = ProvenancePolicy.BEST_EFFORT;
    @NotNull
    private ExtractionLimits extractionLimits = ExtractionLimits.DEFAULT;
    private long maxTarballBytes = ModuleInstaller.DEFAULT_MAX_TARBALL_BYTES;
    private long maxRepositoryArchiveBytes = ModuleInstaller.DEFAULT_MAX_REPOSITORY_ARCHIVE_BYTES;
    private long tarballTimeoutMillis = ModuleInstaller.DEFAULT_TARBALL_TIMEOUT_MILLIS;
    private long repositoryTimeoutMillis = ModuleInstaller.DEFAULT_REPOSITORY_TIMEOUT_MILLIS;

    public ModuleInstaller(@NotNull InstallLayout layout, @NotNull InstallManifest manifest) {
        this(layout, manifest, new HttpTransport());
    }

    private ModuleInstaller(@NotNull InstallLayout layout, @NotNull InstallManifest manifest, @NotNull HttpTransport transport) {
        this(layout, manifest, new RegistryIndexClient(RegistryIndexClient.DEFAULT_REGISTRY_URL, layout.cacheDir(), transport), new GitHubRepositoryHost(), transport);
    }

    public ModuleInstaller(@NotNull InstallLayout layout, @NotNull InstallManifest manifest, @NotNull RegistryIndexClient registry,
            @NotNull RepositoryHost host, @NotNull HttpTransport transport) {
        this.layout = Objects.requireNonNull(layout, "layout may not be null");
        this.manifest = Objects.requireNonNull(manifest, "manifest may not be null");
        this.registry = Objects.requireNonNull(registry, "registry may not be null");
        this.host = Objects.requireNonNull(host, "host may not be null");
        this.transport = Objects.requireNonNull(transport, "transport may not be null");
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public ModuleInstaller setProvenancePolicy(@NotNull ProvenancePolicy policy) {
        this.provenancePolicy = Objects.requireNonNull(policy, "policy may not be null");
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public ModuleInstaller setExtractionLimits(@NotNull ExtractionLimits limits) {
        this.extractionLimits = Objects.requireNonNull(limits, "limits may not be null");
        return this;
    }

    /**
     * Set the byte ceiling and the overall deadline of registry tarball downloads.
     *
     * @param maxBytes The maximum size of a tarball in bytes
     * @param timeoutMillis The overall deadline of a single download in milliseconds
     * @return The current {@link ModuleInstaller} instance, for chaining
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "_, _ -> this")
    public ModuleInstaller setTarballLimits(long maxBytes, long timeoutMillis) {
        if (maxBytes <= 0 || timeoutMillis <= 0) {
            throw new IllegalArgumentException("Tarball limits must be positive");
        }
        this.maxTarballBytes = maxBytes;
        this.tarballTimeoutMillis = timeoutMillis;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_, _ -> this")
    public ModuleInstaller setRepositoryArchiveLimits(long maxBytes, long timeoutMillis) {
        if (maxBytes <= 0 || timeoutMillis <= 0) {
            throw new IllegalArgumentException("Repository archive limits must be positive");
        }
        this.maxRepositoryArchiveBytes = maxBytes;
        this.repositoryTimeoutMillis = timeoutMillis;
        return this;
    }

    @NotNull
    @Contract(pure = true)
    public ProvenancePolicy getProvenancePolicy() {
        return this.provenancePolicy;
    }

    @NotNull
    @Contract(pure = true)
    public InstallLayout getLayout() {
        return this.layout;
    }

    @NotNull
    @Contract(pure = true)
    public InstallManifest getManifest() {
        return this.manifest;
    }

    /**
     * Install a module.
     *
     * @param reference The module reference, see {@link ModuleReference} for the accepted forms
     * @param options Per-call options
     * @param executor The executor to run the installation on
     * @return A future completing with the result of the installation
     */
    @NotNull
    public CompletableFuture<InstallResult> install(@NotNull String reference, @NotNull InstallOptions options, @NotNull Executor executor) {
        return ConcurrencyUtil.scheduleCancellable((cancelled) -> {
            try {
                InstallResult result = this.install0(reference, options, this.registry, cancelled);
                this.manifest.save();
                return result;
            } catch (CancellationException e) {
                throw e;
            } catch (Exception e) {
                ModuleException cause = ModuleException.unwrap(e);
                LoggingAdapter.getDefaultLogger().warn(ModuleInstaller.class, "Unable to install '{}': {}", reference, cause.getMessage());
                String location = options.getRenameTo() == null ? "" : this.layout.modulesDir().resolve(options.getRenameTo()).toString();
                return InstallResult.failed(options.getRenameTo() == null ? reference : options.getRenameTo(), location, reference, cause.toFailure());
            }
        }, executor);
    }

    /**
     * Re-install a module from the source recorded in the install manifest. Modules installed through a registry
     * are re-resolved from that registry, all other modules are fetched again from their repository.
     *
     * @param name The local name of the module
     * @param options Per-call options
     * @param executor The executor to run the update on
     * @return A future completing with the result of the update
     */
    @NotNull
    public CompletableFuture<UpdateResult> update(@NotNull String name, @NotNull UpdateOptions options, @NotNull Executor executor) {
        return ConcurrencyUtil.scheduleCancellable((cancelled) -> {
            String oldVersion = null;
            try {
                String safeName = ModuleInstaller.requireSafeName(name);
                InstallManifestEntry entry = this.manifest.get(safeName);
                if (entry == null) {
                    throw new ModuleException(FailureKind.MANIFEST_NOT_FOUND, "Module '" + safeName + "' has no install manifest entry; only installed modules can be updated");
                }
                oldVersion = this.installedVersion(safeName, entry);
                UpdateResult result = this.update0(safeName, entry, oldVersion, options, cancelled);
                this.manifest.save();
                return result;
            } catch (CancellationException e) {
                throw e;
            } catch (Exception e) {
                ModuleException cause = ModuleException.unwrap(e);
                LoggingAdapter.getDefaultLogger().warn(ModuleInstaller.class, "Unable to update '{}': {}", name, cause.getMessage());
                return UpdateResult.failed(oldVersion, cause.toFailure());
            }
        }, executor);
    }

    /**
     * Remove an installed module: its directory and its manifest entry.
     *
     * @param name The local name of the module
     * @param executor The executor to run the removal on
     * @return A future completing with the result of the removal
     */
    @NotNull
    public CompletableFuture<RemoveResult> remove(@NotNull String name, @NotNull Executor executor) {
        return ConcurrencyUtil.scheduleCancellable((cancelled) -> {
            try {
                Path target = this.resolveTarget(ModuleInstaller.requireSafeName(name));
                boolean present = Files.exists(target, LinkOption.NOFOLLOW_LINKS);
                if (!present && this.manifest.get(name) == null) {
                    throw new ModuleException(FailureKind.MODULE_NOT_FOUND, "Module is not installed: " + name);
                }
                ModuleInstaller.checkpoint(cancelled);
                if (present) {
                    FileUtil.deleteRecursively(target);
                }
                if (this.manifest.remove(name) != null) {
                    this.manifest.save();
                }
                LoggingAdapter.getDefaultLogger().debug(ModuleInstaller.class, "Removed module '{}' from {}", name, target);
                return new RemoveResult(true, null);
            } catch (CancellationException e) {
                throw e;
            } catch (Exception e) {
                ModuleException cause = ModuleException.unwrap(e);
                LoggingAdapter.getDefaultLogger().warn(ModuleInstaller.class, "Unable to remove '{}': {}", name, cause.getMessage());
                return new RemoveResult(false, cause.toFailure());
            }
        }, executor);
    }

    @NotNull
    private InstallResult install0(@NotNull String input, @NotNull InstallOptions options, @NotNull RegistryIndexClient registry,
            @NotNull BooleanSupplier cancelled) throws IOException {
        ModuleReference reference = ModuleReference.parse(input, this.host);
        LoggingAdapter.getDefaultLogger().debug(ModuleInstaller.class, "Installing {}", reference);
        if (options.getRenameTo() != null) {
            ModuleInstaller.requireSafeName(options.getRenameTo());
        }

        RepositorySource repository = reference.getRepository();
        if (repository != null) {
            if (options.getPinnedRef() != null) {
                repository = repository.withRef(options.getPinnedRef());
            }
            if (options.getModulePath() != null) {
                repository = repository.withPath(options.getModulePath());
            }
            return this.installFromRepository(repository, options.getRenameTo(), null, null, cancelled);
        }

        String name = Objects.requireNonNull(reference.getRegistryName(), "registryName");
        RegistryIndex index = registry.fetchIndex0(false);
        ModuleInstaller.checkpoint(cancelled);
        ResolvedDownload download = registry.resolveDownload(index, name);
        ModuleInfo info = download.module();
        String requestedVersion = reference.getVersion();

        if (info.isDeprecated()) {
            LoggingAdapter.getDefaultLogger().warn(ModuleInstaller.class, "Module '{}' is deprecated", name);
        }

        if (download.repository() != null) {
            if (this.provenancePolicy == ProvenancePolicy.REQUIRED) {
                throw new ModuleException(FailureKind.POLICY_VIOLATION, "Registry entry '" + name + "' resolves to a repository source, "
                        + "which carries no checksum; only registry tarballs are accepted under the " + ProvenancePolicy.REQUIRED + " provenance policy");
            }
            RepositorySource source = download.repository();
            if (requestedVersion != null) {
                source = source.withRef(requestedVersion);
            }
            if (options.getPinnedRef() != null) {
                source = source.withRef(options.getPinnedRef());
            }
            if (options.getModulePath() != null) {
                source = source.withPath(options.getModulePath());
            }
            String installName = options.getRenameTo() == null ? name : options.getRenameTo();
            return this.installFromRepository(source, installName, name, registry.getIndexUri().toString(), cancelled);
        }

        if (requestedVersion != null && !requestedVersion.equals(info.version())) {
            throw new ModuleException(FailureKind.MODULE_NOT_FOUND, "Registry only provides version " + info.version() + " of '" + name + "', requested " + requestedVersion);
        }

        URI tarball = Objects.requireNonNull(download.tarball(), "tarball");
        return this.installFromTarball(info, tarball, download.checksum(), requestedVersion, options.getRenameTo(), registry.getIndexUri().toString(), cancelled);
    }

    @NotNull
    private InstallResult installFromRepository(@NotNull RepositorySource source, @Nullable String installName,
            @Nullable String registryModule, @Nullable String registryUrl, @NotNull BooleanSupplier cancelled) throws IOException {
        if (this.provenancePolicy == ProvenancePolicy.REQUIRED) {
            throw new ModuleException(FailureKind.POLICY_VIOLATION, "Repository sources carry no checksum; only registry tarballs are accepted under the "
                    + ProvenancePolicy.REQUIRED + " provenance policy");
        }

        String ref = source.ref() == null ? ModuleInstaller.DEFAULT_REF : source.ref();
        URI archiveUri = this.host.archiveUri(source.owner(), source.repository(), ref);
        String repositoryUrl = this.host.repositoryUrl(source.owner(), source.repository());
        String name = installName;
        if (name == null) {
            String path = source.path();
            name = path == null ? source.repository() : path.substring(path.lastIndexOf('/') + 1);
        }
        Path target = this.resolveTarget(ModuleInstaller.requireSafeName(name));

        Path scratch = this.createScratch();
        try {
            LoggingAdapter.getDefaultLogger().debug(ModuleInstaller.class, "Downloading repository snapshot {}", archiveUri);
            Path archive = scratch.resolve("repository.tar.gz");
            this.transport.download(archiveUri, archive, this.maxRepositoryArchiveBytes, this.repositoryTimeoutMillis, "repository archive " + source);
            ModuleInstaller.checkpoint(cancelled);

            TarExtractor.inspectGzip(archive, this.extractionLimits);
            Path extracted = scratch.resolve("extracted");
            Files.createDirectories(extracted);
            TarExtractor.extractGzip(archive, extracted, this.extractionLimits);
            Path repositoryRoot = ArchiveLayout.singleRoot(extracted);
            Path moduleRoot = ModuleInstaller.locateModule(repositoryRoot, source.path());
            ModuleInstaller.checkpoint(cancelled);

            ModuleDescriptor descriptor = ModuleDescriptor.read(moduleRoot);
            String version = descriptor == null ? null : descriptor.getVersion();
            LoggingAdapter.getDefaultLogger().debug(ModuleInstaller.class, "Materializing {} into {}", moduleRoot, target);
            ProvenanceRecord.Source provenance = new ProvenanceRecord.RepositorySource(repositoryUrl, ref, source.path());
            ModuleMaterializer.Outcome outcome = new ModuleMaterializer(this.extractionLimits).materialize(moduleRoot, target, provenance, false);

            this.manifest.put(name, new InstallManifestEntry(repositoryUrl, target.toString(), repositoryUrl, source.path(), ref, version,
                    registryModule, registryUrl, Instant.now().toString()));
            return new InstallResult(true, name, version, target.toString(), repositoryUrl, outcome, null);
        } finally {
            FileUtil.deleteScratch(scratch);
        }
    }

    @NotNull
    private InstallResult installFromTarball(@NotNull ModuleInfo info, @NotNull URI tarball, @Nullable String checksumString,
            @Nullable String requestedVersion, @Nullable String installName, @NotNull String registryUrl,
            @NotNull BooleanSupplier cancelled) throws IOException {
        Checksum checksum = Checksum.parse(checksumString);
        String name = installName == null ? info.name() : installName;
        Path target = this.resolveTarget(ModuleInstaller.requireSafeName(name));

        Path scratch = this.createScratch();
        try {
            LoggingAdapter.getDefaultLogger().debug(ModuleInstaller.class, "Downloading tarball {} of module '{}'", tarball, info.name());
            Path archive = scratch.resolve("module.tar.gz");
            DownloadedFile downloaded = this.transport.download(tarball, archive, this.maxTarballBytes, this.tarballTimeoutMillis, "tarball of module " + info.name());
            checksum.verify(downloaded.sha256(), tarball.toString());
            ModuleInstaller.checkpoint(cancelled);

            Path extracted = scratch.resolve("extracted");
            Files.createDirectories(extracted);
            TarExtractor.extractGzip(archive, extracted, this.extractionLimits);
            Path moduleRoot = ArchiveLayout.singleRoot(extracted);
            if (!ModuleDescriptor.isModuleDirectory(moduleRoot)) {
                throw new ModuleException(FailureKind.AMBIGUOUS_ARCHIVE_LAYOUT, "Root directory '" + moduleRoot.getFileName() + "' of the tarball of module '"
                        + info.name() + "' is not a module");
            }
            if (!moduleRoot.getFileName().toString().equals(info.name())) {
                LoggingAdapter.getDefaultLogger().warn(ModuleInstaller.class, "Tarball root directory '{}' differs from the registry name '{}'; installing as '{}'",
                        moduleRoot.getFileName(), info.name(), name);
            }
            ModuleInstaller.checkpoint(cancelled);

            ModuleDescriptor descriptor = ModuleDescriptor.read(moduleRoot);
            String version = descriptor == null ? null : descriptor.getVersion();
            ProvenanceRecord.Quality quality = new ProvenanceRecord.Quality(info.verified(), info.conformanceLevel(), info.specVersion());
            ProvenanceRecord.Source provenance = new ProvenanceRecord.RegistrySource(registryUrl, info.name(), requestedVersion, version,
                    tarball.toString(), checksum.toString(), downloaded.sha256(), quality);
            LoggingAdapter.getDefaultLogger().debug(ModuleInstaller.class, "Materializing {} into {}", moduleRoot, target);
            ModuleMaterializer.Outcome outcome = new ModuleMaterializer(this.extractionLimits).materialize(moduleRoot, target, provenance, this.provenancePolicy == ProvenancePolicy.REQUIRED);

            this.manifest.put(name, new InstallManifestEntry(tarball.toString(), target.toString(), info.repository(), null, null, version,
                    info.name(), registryUrl, Instant.now().toString()));
            return new InstallResult(true, name, version, target.toString(), tarball.toString(), outcome, null);
        } finally {
            FileUtil.deleteScratch(scratch);
        }
    }

    @NotNull
    private UpdateResult update0(@NotNull String name, @NotNull InstallManifestEntry entry, @Nullable String oldVersion,
            @NotNull UpdateOptions options, @NotNull BooleanSupplier cancelled) throws IOException {
        InstallResult result;
        String registryModule = entry.registryModule();
        if (registryModule != null) {
            RegistryIndexClient registry = this.registry;
            if (entry.registryUrl() != null && !entry.registryUrl().equals(this.registry.getIndexUri().toString())) {
                registry = new RegistryIndexClient(URI.create(entry.registryUrl()), this.layout.cacheDir(), this.transport)
                        .setFetchLimits(this.registry.getFetchLimits());
            }
            ModuleInfo info = registry.resolveDownload(registry.fetchIndex0(false), registryModule).module();
            if (options.getTag() == null && oldVersion != null && oldVersion.equals(info.version())) {
                LoggingAdapter.getDefaultLogger().debug(ModuleInstaller.class, "Module '{}' is up to date at version {}", name, oldVersion);
                return new UpdateResult(true, oldVersion, oldVersion, true, null);
            }
            ModuleInstaller.checkpoint(cancelled);
            String reference = options.getTag() == null ? registryModule : registryModule + "@" + options.getTag();
            result = this.install0(reference, new InstallOptions().setRenameTo(name), registry, cancelled);
        } else {
            String repositoryUrl = entry.repositoryUrl();
            if (repositoryUrl == null) {
                throw new ModuleException(FailureKind.INVALID_REFERENCE, "Module '" + name + "' was installed from neither a registry nor a repository");
            }
            RepositorySource source = ModuleReference.parse(repositoryUrl, this.host).getRepository();
            if (source == null) {
                throw new ModuleException(FailureKind.INVALID_REFERENCE, "Recorded repository of module '" + name + "' is not a repository URL: " + repositoryUrl);
            }
            String ref = options.getTag() != null ? options.getTag() : entry.ref();
            result = this.installFromRepository(source.withPath(entry.modulePath()).withRef(ref), name, null, null, cancelled);
        }

        String newVersion = result.version();
        boolean upToDate = oldVersion != null && oldVersion.equals(newVersion);
        return new UpdateResult(true, oldVersion, newVersion, upToDate, null);
    }

    @Nullable
    private String installedVersion(@NotNull String name, @NotNull InstallManifestEntry entry) {
        try {
            ModuleDescriptor descriptor = ModuleDescriptor.read(this.resolveTarget(name));
            if (descriptor != null && descriptor.getVersion() != null) {
                return descriptor.getVersion();
            }
        } catch (IOException | ModuleException e) {
            LoggingAdapter.getDefaultLogger().debug(ModuleInstaller.class, "Unable to read the installed descriptor of '{}'", name, e);
        }
        return entry.version();
    }

    /**
     * Find the module directory inside an extracted repository snapshot.
     *
     * @param repositoryRoot The root directory of the snapshot
     * @param modulePath The module path within the repository, or null for the repository root
     * @return The module directory
     * @throws ModuleException With {@link FailureKind#MODULE_NOT_FOUND} if no candidate location holds a descriptor,
     * or {@link FailureKind#PATH_TRAVERSAL} if every candidate lies outside the repository
     */
    @NotNull
    static Path locateModule(@NotNull Path repositoryRoot, @Nullable String modulePath) {
        if (modulePath == null) {
            if (!ModuleDescriptor.isModuleDirectory(repositoryRoot)) {
                throw new ModuleException(FailureKind.MODULE_NOT_FOUND, "Repository root is not a module; a module path is required");
            }
            return repositoryRoot;
        }
        Path[] candidates = {
                repositoryRoot.resolve(modulePath),
                repositoryRoot.resolve("cognitive").resolve("modules").resolve(modulePath),
                repositoryRoot.resolve("modules").resolve(modulePath)
        };
        boolean anyInside = false;
        for (Path candidate : candidates) {
            if (!FileUtil.isWithinRoot(repositoryRoot, candidate)) {
                continue;
            }
            anyInside = true;
            if (Files.isDirectory(candidate, LinkOption.NOFOLLOW_LINKS) && ModuleDescriptor.isModuleDirectory(candidate)) {
                return candidate;
            }
        }
        if (!anyInside) {
            throw ModuleException.forEntry(FailureKind.PATH_TRAVERSAL, "Module path leaves the repository: " + modulePath, modulePath);
        }
        throw new ModuleException(FailureKind.MODULE_NOT_FOUND, "No module at '" + modulePath + "' (searched " + modulePath + ", cognitive/modules/"
                + modulePath + ", modules/" + modulePath + ")");
    }

    @NotNull
    private Path resolveTarget(@NotNull String safeName) {
        Path target = this.layout.modulesDir().resolve(safeName);
        if (!FileUtil.isWithinRoot(this.layout.modulesDir(), target) || target.normalize().equals(this.layout.modulesDir().normalize())) {
            throw new ModuleException(FailureKind.INVALID_REFERENCE, "Module name escapes the modules directory: " + safeName);
        }
        return target;
    }

    @NotNull
    private Path createScratch() throws IOException {
        Path scratch = this.layout.scratchDir().resolve("install-" + UUID.randomUUID());
        Files.createDirectories(scratch);
        return scratch;
    }

    /**
     * Check that a local module name is a single path segment that cannot escape the modules directory.
     *
     * @param name The name
     * @return The name
     * @throws ModuleException With {@link FailureKind#INVALID_REFERENCE} if the name is unsafe
     */
    @NotNull
    static String requireSafeName(@NotNull String name) {
        if (!ModuleInstaller.SAFE_NAME.matcher(name).matches() || name.contains("..")) {
            throw new ModuleException(FailureKind.INVALID_REFERENCE, "Invalid module name: '" + name + "'");
        }
        return name;
    }

    private static void checkpoint(@NotNull BooleanSupplier cancelled) {
        if (cancelled.getAsBoolean()) {
            throw new CancellationException("Operation was cancelled");
        }
    }
}
