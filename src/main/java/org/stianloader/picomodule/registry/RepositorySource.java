package org.stianloader.picomodule.registry;

import java.util.Arrays;
import java.util.regex.Pattern;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picomodule.FailureKind;
import org.stianloader.picomodule.ModuleException;

/**
 * A module stored in a version-controlled repository: {@code owner/repo[/path][@ref]}.
 *
 * @param owner The owner of the repository
 * @param repository The repository name, never ending in {@code .git}
 * @param path The '/'-separated path of the module within the repository, or null for the repository root
 * @param ref The branch, tag or commit, or null for the default branch
 */
public final record RepositorySource(@NotNull String owner, @NotNull String repository, @Nullable String path, @Nullable String ref) {

    @NotNull
    public static final String GITHUB_PREFIX = "github:";

    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z0-9_.-]+");
    private static final Pattern REF = Pattern.compile("[A-Za-z0-9_./+-]+");

    public RepositorySource {
        RepositorySource.checkSegment(owner, "owner");
        if (repository.endsWith(".git")) {
            repository = repository.substring(0, repository.length() - 4);
        }
        RepositorySource.checkSegment(repository, "repository");
        if (path != null) {
            if (path.isEmpty()) {
                path = null;
            } else {
                for (String segment : path.split("/", -1)) {
                    RepositorySource.checkSegment(segment, "module path");
                }
            }
        }
        if (ref != null && (!RepositorySource.REF.matcher(ref).matches() || ref.contains("..") || ref.startsWith("/") || ref.endsWith("/"))) {
            throw new ModuleException(FailureKind.INVALID_REFERENCE, "Invalid repository ref: '" + ref + "'");
        }
    }

    private static void checkSegment(@NotNull String segment, @NotNull String what) {
        if (!RepositorySource.SEGMENT.matcher(segment).matches() || segment.equals(".") || segment.equals("..")) {
            throw new ModuleException(FailureKind.INVALID_REFERENCE, "Invalid " + what + " segment: '" + segment + "'");
        }
    }

    /**
     * Parse the {@code owner/repo[/path][@ref]} shorthand. A leading {@code github:} is not accepted here.
     *
     * @param shorthand The shorthand
     * @return The parsed source
     * @throws ModuleException With {@link FailureKind#INVALID_REFERENCE} if the shorthand is malformed
     */
    @NotNull
    public static RepositorySource parseShorthand(@NotNull String shorthand) {
        String pathPart = shorthand;
        String ref = null;
        int at = shorthand.indexOf('@');
        if (at != -1) {
            if (shorthand.indexOf('@', at + 1) != -1) {
                throw new ModuleException(FailureKind.INVALID_REFERENCE, "Multiple '@' in repository reference: '" + shorthand + "'");
            }
            pathPart = shorthand.substring(0, at);
            ref = shorthand.substring(at + 1);
            if (ref.isEmpty()) {
                throw new ModuleException(FailureKind.INVALID_REFERENCE, "Empty ref in repository reference: '" + shorthand + "'");
            }
        }
        String[] parts = pathPart.split("/", -1);
        if (parts.length < 2) {
            throw new ModuleException(FailureKind.INVALID_REFERENCE, "Repository reference must have the form owner/repo[/path][@ref]: '" + shorthand + "'");
        }
        String path = parts.length > 2 ? String.join("/", Arrays.copyOfRange(parts, 2, parts.length)) : null;
        if (path != null && path.isEmpty()) {
            throw new ModuleException(FailureKind.INVALID_REFERENCE, "Empty module path in repository reference: '" + shorthand + "'");
        }
        return new RepositorySource(parts[0], parts[1], path, ref);
    }

    /**
     * Parse a registry source string of the form {@code github:owner/repo[/path][@ref]}.
     *
     * @param source The source string
     * @return The parsed source, or null if the string does not start with {@code github:}
     * @throws ModuleException With {@link FailureKind#INVALID_REFERENCE} if the part after the prefix is malformed
     */
    @Nullable
    public static RepositorySource parseGitHubSource(@NotNull String source) {
        if (!source.startsWith(RepositorySource.GITHUB_PREFIX)) {
            return null;
        }
        return RepositorySource.parseShorthand(source.substring(RepositorySource.GITHUB_PREFIX.length()));
    }

    @NotNull
    @Contract(pure = true)
    public RepositorySource withRef(@Nullable String ref) {
        return new RepositorySource(this.owner, this.repository, this.path, ref);
    }

    @NotNull
    @Contract(pure = true)
    public RepositorySource withPath(@Nullable String path) {
        return new RepositorySource(this.owner, this.repository, path, this.ref);
    }

    @Override
    @NotNull
    public String toString() {
        StringBuilder builder = new StringBuilder(RepositorySource.GITHUB_PREFIX).append(this.owner).append('/').append(this.repository);
        if (this.path != null) {
            builder.append('/').append(this.path);
        }
        if (this.ref != null) {
            builder.append('@').append(this.ref);
        }
        return builder.toString();
    }
}
