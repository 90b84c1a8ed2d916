package org.stianloader.picomodule.publish;

import java.nio.file.Path;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picomodule.archive.ExtractionLimits;
import org.stianloader.picomodule.registry.FetchLimits;

/**
 * Options of {@link AssetVerifier#verify(VerifyOptions, java.util.concurrent.Executor)}.
 *
 * <p>In local mode the index is a file and every tarball is looked up by its file name in the
 * {@link #setAssetsDir(Path) assets directory}. In remote mode the index is fetched from an http(s) URL and
 * every tarball is downloaded, relative tarball references being resolved against the index URL. Remote mode is
 * implied by an http(s) index location.
 */
public class VerifyOptions {

    public static final long DEFAULT_MAX_TARBALL_BYTES = 25L * 1024 * 1024;
    public static final long DEFAULT_TARBALL_TIMEOUT_MILLIS = 15_000L;
    public static final int MAX_CONCURRENCY = 8;

    @NotNull
    private final String registryIndex;
    @Nullable
    private Path assetsDir;
    private boolean remote;
    @NotNull
    private FetchLimits indexLimits = FetchLimits.VERIFIER_INDEX;
    private long maxTarballBytes = VerifyOptions.DEFAULT_MAX_TARBALL_BYTES;
    private long tarballTimeoutMillis = VerifyOptions.DEFAULT_TARBALL_TIMEOUT_MILLIS;
    @Nullable
    private Integer concurrency;
    @NotNull
    private ExtractionLimits extractionLimits = ExtractionLimits.DEFAULT;
    @Nullable
    private Path scratchDir;

    /**
     * Create verification options.
     *
     * @param registryIndex The registry index, either a file path or an http(s) URL
     */
    public VerifyOptions(@NotNull String registryIndex) {
        this.registryIndex = Objects.requireNonNull(registryIndex, "registryIndex may not be null");
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public VerifyOptions setAssetsDir(@Nullable Path assetsDir) {
        this.assetsDir = assetsDir;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public VerifyOptions setRemote(boolean remote) {
        this.remote = remote;
        return this;
    }

    /**
     * Set the limits of the index fetch in remote mode. Tarball downloads have their own limits, see
     * {@link #setMaxTarballBytes(long)} and {@link #setTarballTimeoutMillis(long)}.
     *
     * @param indexLimits The limits
     * @return The current {@link VerifyOptions} instance, for chaining
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public VerifyOptions setIndexLimits(@NotNull FetchLimits indexLimits) {
        this.indexLimits = Objects.requireNonNull(indexLimits, "indexLimits may not be null");
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public VerifyOptions setMaxTarballBytes(long maxTarballBytes) {
        if (maxTarballBytes <= 0) {
            throw new IllegalArgumentException("maxTarballBytes must be positive, got " + maxTarballBytes);
        }
        this.maxTarballBytes = maxTarballBytes;
        return this;
    }

    /**
     * Set the overall deadline of every single tarball download in remote mode.
     *
     * @param tarballTimeoutMillis The deadline in milliseconds
     * @return The current {@link VerifyOptions} instance, for chaining
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public VerifyOptions setTarballTimeoutMillis(long tarballTimeoutMillis) {
        if (tarballTimeoutMillis <= 0) {
            throw new IllegalArgumentException("tarballTimeoutMillis must be positive, got " + tarballTimeoutMillis);
        }
        this.tarballTimeoutMillis = tarballTimeoutMillis;
        return this;
    }

    /**
     * Set how many modules are verified at the same time. The value is clamped to {@code [1, 8]}.
     *
     * @param concurrency The amount of concurrently verified modules, or null for the default of 4 in remote and 1 in local mode
     * @return The current {@link VerifyOptions} instance, for chaining
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public VerifyOptions setConcurrency(@Nullable Integer concurrency) {
        this.concurrency = concurrency;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public VerifyOptions setExtractionLimits(@NotNull ExtractionLimits extractionLimits) {
        this.extractionLimits = Objects.requireNonNull(extractionLimits, "extractionLimits may not be null");
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public VerifyOptions setScratchDir(@Nullable Path scratchDir) {
        this.scratchDir = scratchDir;
        return this;
    }

    @NotNull
    public String getRegistryIndex() {
        return this.registryIndex;
    }

    @Nullable
    public Path getAssetsDir() {
        return this.assetsDir;
    }

    public boolean isRemote() {
        return this.remote || AssetVerifier.isHttpUrl(this.registryIndex);
    }

    @NotNull
    public FetchLimits getIndexLimits() {
        return this.indexLimits;
    }

    public long getMaxTarballBytes() {
        return this.maxTarballBytes;
    }

    public long getTarballTimeoutMillis() {
        return this.tarballTimeoutMillis;
    }

    public int getEffectiveConcurrency() {
        int desired = this.concurrency == null ? (this.isRemote() ? 4 : 1) : this.concurrency;
        return Math.max(1, Math.min(VerifyOptions.MAX_CONCURRENCY, desired));
    }

    @NotNull
    public ExtractionLimits getExtractionLimits() {
        return this.extractionLimits;
    }

    @Nullable
    public Path getScratchDir() {
        return this.scratchDir;
    }
}
