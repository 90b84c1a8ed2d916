package org.stianloader.picomodule;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;
import java.util.regex.Pattern;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picomodule.registry.RepositorySource;
import org.stianloader.picomodule.repo.RepositoryHost;

/**
 * A classified module reference as typed by a user.
 *
 * <p>Classification is total: every input is either a {@link Kind#REPOSITORY_SHORTHAND repository shorthand},
 * an {@link Kind#REPOSITORY_URL explicit repository URL}, a {@link Kind#REGISTRY_NAME registry name} or
 * rejected with {@link FailureKind#INVALID_REFERENCE}.
 */
public final class ModuleReference {

    public enum Kind {
        /**
         * {@code owner/repo[/path][@ref]}, optionally prefixed with {@code github:}.
         */
        REPOSITORY_SHORTHAND,

        /**
         * {@code http(s)://host/owner/repo[.git][/tree/<ref>[/path]]}.
         */
        REPOSITORY_URL,

        /**
         * {@code name[@version]}, looked up in the registry.
         */
        REGISTRY_NAME;
    }

    private static final Pattern REGISTRY_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]*");
    private static final Pattern VERSION = Pattern.compile("[A-Za-z0-9_.+-]+");

    @NotNull
    private final String input;
    @NotNull
    private final Kind kind;
    @Nullable
    private final RepositorySource repository;
    @Nullable
    private final String registryName;
    @Nullable
    private final String version;

    private ModuleReference(@NotNull String input, @NotNull Kind kind, @Nullable RepositorySource repository, @Nullable String registryName, @Nullable String version) {
        this.input = input;
        this.kind = kind;
        this.repository = repository;
        this.registryName = registryName;
        this.version = version;
    }

    /**
     * Classify a module reference.
     *
     * @param input The user input
     * @param host The repository host that explicit URLs must belong to
     * @return The classified reference
     * @throws ModuleException With {@link FailureKind#INVALID_REFERENCE} if the input fits no accepted form
     */
    @NotNull
    public static ModuleReference parse(@NotNull String input, @NotNull RepositoryHost host) {
        Objects.requireNonNull(input, "input may not be null");
        if (input.isEmpty()) {
            throw new ModuleException(FailureKind.INVALID_REFERENCE, "Empty module reference");
        }
        for (int i = 0; i < input.length(); i++) {
            if (Character.isWhitespace(input.charAt(i)) || Character.isISOControl(input.charAt(i))) {
                throw new ModuleException(FailureKind.INVALID_REFERENCE, "Module reference may not contain whitespace: '" + input + "'");
            }
        }

        if (input.startsWith("https://") || input.startsWith("http://")) {
            return new ModuleReference(input, Kind.REPOSITORY_URL, ModuleReference.parseUrl(input, host), null, null);
        } else if (input.startsWith("github.com/")) {
            return new ModuleReference(input, Kind.REPOSITORY_URL, ModuleReference.parseUrl("https://" + input, host), null, null);
        } else if (input.startsWith(RepositorySource.GITHUB_PREFIX)) {
            return new ModuleReference(input, Kind.REPOSITORY_SHORTHAND, RepositorySource.parseGitHubSource(input), null, null);
        } else if (input.indexOf('/') != -1) {
            return new ModuleReference(input, Kind.REPOSITORY_SHORTHAND, RepositorySource.parseShorthand(input), null, null);
        }

        String name = input;
        String version = null;
        int at = input.indexOf('@');
        if (at != -1) {
            if (input.indexOf('@', at + 1) != -1) {
                throw new ModuleException(FailureKind.INVALID_REFERENCE, "Multiple '@' in module reference: '" + input + "'");
            }
            name = input.substring(0, at);
            version = input.substring(at + 1);
            if (!ModuleReference.VERSION.matcher(version).matches()) {
                throw new ModuleException(FailureKind.INVALID_REFERENCE, "Invalid version in module reference: '" + input + "'");
            }
        }
        if (!ModuleReference.REGISTRY_NAME.matcher(name).matches() || name.contains("..")) {
            throw new ModuleException(FailureKind.INVALID_REFERENCE, "Invalid module name: '" + input + "'");
        }
        return new ModuleReference(input, Kind.REGISTRY_NAME, null, name, version);
    }

    @NotNull
    private static RepositorySource parseUrl(@NotNull String input, @NotNull RepositoryHost host) {
        URI uri;
        try {
            uri = new URI(input);
        } catch (URISyntaxException e) {
            throw new ModuleException(FailureKind.INVALID_REFERENCE, "Malformed repository URL: '" + input + "'", e);
        }
        if (uri.getHost() == null || uri.getRawQuery() != null || uri.getRawFragment() != null) {
            throw new ModuleException(FailureKind.INVALID_REFERENCE, "Unsupported repository URL: '" + input + "'");
        }
        String path = host.repositoryPath(uri);
        if (path == null) {
            throw new ModuleException(FailureKind.INVALID_REFERENCE, "Repository URL does not point to " + host + ": '" + input + "'");
        }
        if (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }

        String[] parts = path.split("/", -1);
        if (parts.length < 2) {
            throw new ModuleException(FailureKind.INVALID_REFERENCE, "Repository URL must name an owner and a repository: '" + input + "'");
        }
        if (parts.length == 2) {
            return new RepositorySource(parts[0], parts[1], null, null);
        }
        if (!parts[2].equals("tree") || parts.length < 4 || parts[1].endsWith(".git")) {
            throw new ModuleException(FailureKind.INVALID_REFERENCE, "Unsupported repository URL layout: '" + input + "'");
        }
        String modulePath = null;
        if (parts.length > 4) {
            StringBuilder builder = new StringBuilder();
            for (int i = 4; i < parts.length; i++) {
                if (i != 4) {
                    builder.append('/');
                }
                builder.append(parts[i]);
            }
            modulePath = builder.toString();
        }
        return new RepositorySource(parts[0], parts[1], modulePath, parts[3]);
    }

    @NotNull
    @Contract(pure = true)
    public Kind getKind() {
        return this.kind;
    }

    @NotNull
    @Contract(pure = true)
    public String getInput() {
        return this.input;
    }

    /**
     * Obtain the repository location of a {@link Kind#REPOSITORY_SHORTHAND} or {@link Kind#REPOSITORY_URL} reference.
     *
     * @return The repository, or null for registry names
     */
    @Nullable
    @Contract(pure = true)
    public RepositorySource getRepository() {
        return this.repository;
    }

    @Nullable
    @Contract(pure = true)
    public String getRegistryName() {
        return this.registryName;
    }

    @Nullable
    @Contract(pure = true)
    public String getVersion() {
        return this.version;
    }

    @Contract(pure = true)
    public boolean isRepository() {
        return this.repository != null;
    }

    @Override
    public String toString() {
        return this.kind + "[" + this.input + "]";
    }
}
