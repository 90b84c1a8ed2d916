package org.stianloader.picomodule.registry;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picomodule.FailureKind;
import org.stianloader.picomodule.ModuleException;
import org.stianloader.picomodule.integrity.Digests;
import org.stianloader.picomodule.internal.ConcurrencyUtil;
import org.stianloader.picomodule.logging.LoggingAdapter;
import org.stianloader.picomodule.repo.HttpTransport;

/**
 * Client for a single registry index.
 *
 * <p>Fetched indices are cached in memory and, if a cache directory is set, on disk under
 * {@code registry-<first 16 hex characters of sha256(url)>.json}. Both caches are considered fresh for
 * {@link #DEFAULT_CACHE_TTL_MILLIS} unless configured otherwise. Cache read and write errors are logged
 * and otherwise ignored, they never fail a lookup.
 */
public class RegistryIndexClient {

    @NotNull
    public static final URI DEFAULT_REGISTRY_URL = URI.create("https://raw.githubusercontent.com/Cognary/cognitive/main/cognitive-registry.v2.json");

    public static final long DEFAULT_CACHE_TTL_MILLIS = 5 * 60 * 1000L;

    private static final class CachedIndex {
        @NotNull
        private final RegistryIndex index;
        private final long timestamp;

        private CachedIndex(@NotNull RegistryIndex index, long timestamp) {
            this.index = index;
            this.timestamp = timestamp;
        }
    }

    @NotNull
    private final URI indexUri;
    @Nullable
    private final Path cacheDir;
    @NotNull
    private final HttpTransport transport;
    @NotNull
    private FetchLimits limits = FetchLimits.REGISTRY_INDEX;
    private long cacheTtlMillis = RegistryIndexClient.DEFAULT_CACHE_TTL_MILLIS;
    @Nullable
    private volatile CachedIndex cached;

    public RegistryIndexClient(@NotNull URI indexUri, @Nullable Path cacheDir) {
        this(indexUri, cacheDir, new HttpTransport());
    }

    public RegistryIndexClient(@NotNull URI indexUri, @Nullable Path cacheDir, @NotNull HttpTransport transport) {
        this.indexUri = Objects.requireNonNull(indexUri, "indexUri may not be null");
        this.cacheDir = cacheDir;
        this.transport = Objects.requireNonNull(transport, "transport may not be null");
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public RegistryIndexClient setFetchLimits(@NotNull FetchLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits may not be null");
        return this;
    }

    /**
     * Set for how long a fetched index is reused before it is fetched again. A value of 0 disables both caches
     * for reading, fetched indices are still written to the disk cache.
     *
     * @param cacheTtlMillis The freshness window in milliseconds
     * @return The current instance
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public RegistryIndexClient setCacheTtl(long cacheTtlMillis) {
        if (cacheTtlMillis < 0) {
            throw new IllegalArgumentException("cacheTtlMillis may not be negative");
        }
        this.cacheTtlMillis = cacheTtlMillis;
        return this;
    }

    @NotNull
    @Contract(pure = true)
    public URI getIndexUri() {
        return this.indexUri;
    }

    @NotNull
    @Contract(pure = true)
    public FetchLimits getFetchLimits() {
        return this.limits;
    }

    @NotNull
    @Contract(pure = true)
    public Path getCacheFile(@NotNull Path cacheDir) {
        String hash = Digests.sha256Hex(this.indexUri.toString().getBytes(StandardCharsets.UTF_8)).substring(0, 16);
        return cacheDir.resolve("registry-" + hash + ".json");
    }

    @NotNull
    public CompletableFuture<RegistryIndex> fetchIndex(boolean forceRefresh, @NotNull Executor executor) {
        return ConcurrencyUtil.schedule(() -> this.fetchIndex0(forceRefresh), executor);
    }

    /**
     * Blocking variant of {@link #fetchIndex(boolean, Executor)}, for callers that already run on their executor.
     *
     * @param forceRefresh Whether both caches should be bypassed
     * @return The index
     */
    @NotNull
    public RegistryIndex fetchIndex0(boolean forceRefresh) {
        long now = System.currentTimeMillis();
        CachedIndex memory = this.cached;
        if (!forceRefresh && memory != null && (now - memory.timestamp) < this.cacheTtlMillis) {
            return memory.index;
        }

        Path cacheFile = this.cacheDir == null ? null : this.getCacheFile(this.cacheDir);
        if (!forceRefresh && cacheFile != null && Files.isRegularFile(cacheFile)) {
            try {
                long modified = Files.getLastModifiedTime(cacheFile).toMillis();
                if ((now - modified) < this.cacheTtlMillis) {
                    RegistryIndex index = RegistryIndex.parse(Files.readAllBytes(cacheFile));
                    this.cached = new CachedIndex(index, now);
                    LoggingAdapter.getDefaultLogger().debug(RegistryIndexClient.class, "Using cached registry index {} for {}", cacheFile, this.indexUri);
                    return index;
                }
            } catch (IOException | ModuleException e) {
                LoggingAdapter.getDefaultLogger().warn(RegistryIndexClient.class, "Ignoring unreadable registry cache {}", cacheFile, e);
            }
        }

        byte[] data = this.transport.fetchBytes(this.indexUri, this.limits.maxBytes(), this.limits.timeoutMillis(), "registry index");
        RegistryIndex index = RegistryIndex.parse(data);
        this.cached = new CachedIndex(index, now);

        if (cacheFile != null) {
            try {
                Files.createDirectories(cacheFile.getParent());
                Files.write(cacheFile, data);
            } catch (IOException e) {
                LoggingAdapter.getDefaultLogger().warn(RegistryIndexClient.class, "Unable to write registry cache {}", cacheFile, e);
            }
        }
        return index;
    }

    @NotNull
    public CompletableFuture<Optional<ModuleInfo>> getModule(@NotNull String name, @NotNull Executor executor) {
        return this.fetchIndex(false, executor).thenApply(index -> {
            RegistryEntry entry = index.getEntry(name);
            return entry == null ? Optional.empty() : Optional.of(entry.toModuleInfo());
        });
    }

    @NotNull
    public CompletableFuture<List<ModuleInfo>> listModules(@NotNull Executor executor) {
        return this.fetchIndex(false, executor).thenApply(RegistryIndex::listModules);
    }

    @NotNull
    public CompletableFuture<Map<String, Category>> getCategories(@NotNull Executor executor) {
        return this.fetchIndex(false, executor).thenApply(RegistryIndex::getCategories);
    }

    @NotNull
    public CompletableFuture<List<SearchResult>> search(@NotNull String query, @NotNull Executor executor) {
        return this.fetchIndex(false, executor).thenApply(index -> RegistryIndexClient.search(index.listModules(), query));
    }

    /**
     * Search the modules of a single category. An unknown category yields no results.
     *
     * @param query The query, blank to list every module of the category
     * @param category The key of the category
     * @param executor The executor to fetch the index on
     * @return The results
     */
    @NotNull
    public CompletableFuture<List<SearchResult>> search(@NotNull String query, @NotNull String category, @NotNull Executor executor) {
        return this.fetchIndex(false, executor).thenApply(index -> {
            Category cat = index.getCategories().get(category);
            if (cat == null) {
                return Collections.emptyList();
            }
            Set<String> members = new HashSet<>(cat.modules());
            List<ModuleInfo> modules = new ArrayList<>();
            for (Map.Entry<String, RegistryEntry> entry : index.getEntries().entrySet()) {
                if (members.contains(entry.getKey())) {
                    modules.add(entry.getValue().toModuleInfo());
                }
            }
            return RegistryIndexClient.search(modules, query);
        });
    }

    /**
     * Score modules against a query: +10 if the name contains the query, +5 more on an exact name match,
     * +3 for every query term found in the description and +2 for every keyword and term where one contains
     * the other. All comparisons are case insensitive. Modules without a score are dropped; the rest is sorted
     * by score, descending, then by name. A blank query returns every module, sorted by name.
     *
     * @param modules The modules to search
     * @param query The query
     * @return The results
     */
    @NotNull
    public static List<SearchResult> search(@NotNull List<ModuleInfo> modules, @NotNull String query) {
        List<SearchResult> results = new ArrayList<>();
        String queryLower = query.trim().toLowerCase(Locale.ROOT);

        if (queryLower.isEmpty()) {
            for (ModuleInfo module : modules) {
                results.add(new SearchResult(module.name(), module.description(), module.version(), 1, module.keywords()));
            }
            results.sort(Comparator.comparing(SearchResult::name));
            return results;
        }

        String[] terms = queryLower.split("\\s+");
        for (ModuleInfo module : modules) {
            int score = 0;
            String nameLower = module.name().toLowerCase(Locale.ROOT);
            if (nameLower.contains(queryLower)) {
                score += 10;
                if (nameLower.equals(queryLower)) {
                    score += 5;
                }
            }
            String descriptionLower = module.description().toLowerCase(Locale.ROOT);
            for (String term : terms) {
                if (descriptionLower.contains(term)) {
                    score += 3;
                }
            }
            for (String keyword : module.keywords()) {
                String keywordLower = keyword.toLowerCase(Locale.ROOT);
                for (String term : terms) {
                    if (keywordLower.contains(term) || term.contains(keywordLower)) {
                        score += 2;
                    }
                }
            }
            if (score > 0) {
                results.add(new SearchResult(module.name(), module.description(), module.version(), score, module.keywords()));
            }
        }

        results.sort(Comparator.comparingInt(SearchResult::score).reversed().thenComparing(SearchResult::name));
        return results;
    }

    @NotNull
    public CompletableFuture<ResolvedDownload> resolveDownload(@NotNull String name, @NotNull Executor executor) {
        return this.fetchIndex(false, executor).thenApply(index -> this.resolveDownload(index, name));
    }

    /**
     * Work out where the content of a module comes from.
     *
     * @param index The index to look the module up in
     * @param name The key of the module
     * @return The download location
     * @throws ModuleException With {@link FailureKind#MODULE_NOT_FOUND} if the index has no such module, or with
     * {@link FailureKind#MALFORMED_INDEX} if its source is neither a {@code github:} source nor a tarball reference
     */
    @NotNull
    public ResolvedDownload resolveDownload(@NotNull RegistryIndex index, @NotNull String name) {
        RegistryEntry entry = index.getEntry(name);
        if (entry == null) {
            throw new ModuleException(FailureKind.MODULE_NOT_FOUND, "Module not found in registry: " + name);
        }
        ModuleInfo info = entry.toModuleInfo();

        if (entry instanceof RegistryEntry.Legacy) {
            RepositorySource repository;
            try {
                repository = RepositorySource.parseGitHubSource(info.source());
            } catch (ModuleException e) {
                throw new ModuleException(FailureKind.MALFORMED_INDEX, "Registry entry '" + name + "' has a malformed source: " + info.source(), e);
            }
            if (repository != null) {
                return new ResolvedDownload(info, repository, null, null);
            }
            if (info.source().startsWith("http://") || info.source().startsWith("https://")) {
                return new ResolvedDownload(info, null, RegistryIndexClient.resolveTarball(this.indexUri, info.source(), name), null);
            }
            throw new ModuleException(FailureKind.MALFORMED_INDEX, "Unknown source format for registry entry '" + name + "': " + info.source());
        }

        String tarball = Objects.requireNonNull(info.tarball(), "tarball");
        return new ResolvedDownload(info, null, RegistryIndexClient.resolveTarball(this.indexUri, tarball, name), info.checksum());
    }

    /**
     * Resolve a tarball reference against the URL of the index that declared it.
     *
     * @param indexUri The location of the index
     * @param tarball The tarball reference, absolute or relative
     * @param name The module the reference belongs to, used in the exception message
     * @return The absolute tarball location
     */
    @NotNull
    public static URI resolveTarball(@NotNull URI indexUri, @NotNull String tarball, @NotNull String name) {
        try {
            URI ref = new URI(tarball);
            return ref.isAbsolute() ? ref : indexUri.resolve(ref);
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new ModuleException(FailureKind.MALFORMED_INDEX, "Registry entry '" + name + "' has an invalid tarball reference: " + tarball, e);
        }
    }
}
