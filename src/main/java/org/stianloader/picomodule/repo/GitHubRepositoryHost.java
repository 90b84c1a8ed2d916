package org.stianloader.picomodule.repo;

import java.net.URI;
import java.util.Locale;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * GitHub, or any server that lays out repository snapshots the way GitHub does:
 * {@code <base>/<owner>/<repo>/archive/<ref>.tar.gz}.
 */
public class GitHubRepositoryHost implements RepositoryHost {

    @NotNull
    public static final URI DEFAULT_BASE = URI.create("https://github.com/");

    @NotNull
    private final URI base;

    public GitHubRepositoryHost() {
        this(GitHubRepositoryHost.DEFAULT_BASE);
    }

    public GitHubRepositoryHost(@NotNull URI base) {
        if (base.getPath() == null || base.getPath().isEmpty()) {
            base = base.resolve("/");
        } else if (!base.getPath().endsWith("/")) {
            base = base.resolve(base.getPath() + "/");
        }
        this.base = base;
    }

    @Override
    @NotNull
    @Contract(pure = true)
    public URI archiveUri(@NotNull String owner, @NotNull String repository, @NotNull String ref) {
        return this.base.resolve(owner + "/" + repository + "/archive/" + ref + ".tar.gz");
    }

    @Override
    @NotNull
    @Contract(pure = true)
    public String repositoryUrl(@NotNull String owner, @NotNull String repository) {
        return this.base.resolve(owner + "/" + repository).toString();
    }

    @Override
    @Nullable
    @Contract(pure = true)
    public String repositoryPath(@NotNull URI url) {
        String host = url.getHost();
        String path = url.getPath() == null ? "" : url.getPath();
        if (host == null) {
            return null;
        }
        host = host.toLowerCase(Locale.ROOT);
        if (host.equals("github.com") || host.equals("www.github.com")) {
            return GitHubRepositoryHost.stripLeadingSlashes(path);
        }
        if (!host.equalsIgnoreCase(this.base.getHost()) || url.getPort() != this.base.getPort()) {
            return null;
        }
        String basePath = this.base.getPath();
        if (!(path + "/").startsWith(basePath)) {
            return null;
        }
        return GitHubRepositoryHost.stripLeadingSlashes(path.length() < basePath.length() ? "" : path.substring(basePath.length()));
    }

    @NotNull
    private static String stripLeadingSlashes(@NotNull String path) {
        int i = 0;
        while (i < path.length() && path.charAt(i) == '/') {
            i++;
        }
        return path.substring(i);
    }

    @NotNull
    @Contract(pure = true)
    public URI getBase() {
        return this.base;
    }

    @Override
    public String toString() {
        return "GitHubRepositoryHost[" + this.base + "]";
    }
}
