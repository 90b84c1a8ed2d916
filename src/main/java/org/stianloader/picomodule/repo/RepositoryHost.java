package org.stianloader.picomodule.repo;

import java.net.URI;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A host of version-controlled repositories that serves gzip compressed snapshots of a repository at a given ref.
 *
 * <p>The host is what turns an {@code owner/repo} pair into actual URLs. Implementations must not perform any IO,
 * the archive itself is fetched by the installer through its {@link HttpTransport}.
 */
public interface RepositoryHost {

    /**
     * Obtain the location of the gzip compressed tar snapshot of a repository.
     *
     * @param owner The owner of the repository
     * @param repository The name of the repository, without any {@code .git} suffix
     * @param ref The branch, tag or commit
     * @return The URI of the snapshot archive
     */
    @NotNull
    @Contract(pure = true)
    URI archiveUri(@NotNull String owner, @NotNull String repository, @NotNull String ref);

    /**
     * Obtain the human facing URL of a repository, as recorded in the install manifest and in provenance records.
     *
     * @param owner The owner of the repository
     * @param repository The name of the repository
     * @return The repository URL
     */
    @NotNull
    @Contract(pure = true)
    String repositoryUrl(@NotNull String owner, @NotNull String repository);

    /**
     * Obtain the part of an explicit repository URL given by the user that names the repository,
     * that is the path below the root of the host.
     *
     * @param url The URL as given by the user
     * @return The path below the host root without leading slash, or null if the URL does not belong to this host
     */
    @Nullable
    @Contract(pure = true)
    String repositoryPath(@NotNull URI url);
}
