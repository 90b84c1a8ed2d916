package org.stianloader.picomodule.registry;

import java.net.URI;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Where the content of a registry module can be obtained from. Exactly one of {@code repository} and
 * {@code tarball} is non-null.
 *
 * @param module The normalized registry entry
 * @param repository The repository holding the module, for {@code github:} sources
 * @param tarball The absolute tarball location, relative references already resolved against the index URL
 * @param checksum The unvalidated checksum string of the tarball, null if the entry gives none
 */
public final record ResolvedDownload(@NotNull ModuleInfo module, @Nullable RepositorySource repository, @Nullable URI tarball, @Nullable String checksum) {

    public boolean isRepository() {
        return this.repository != null;
    }
}
