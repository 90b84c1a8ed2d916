package org.stianloader.picomodule;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The outcome of an installation.
 *
 * @param success Whether the module was installed
 * @param moduleName The local name of the module, or the reference as given if installation failed before a name was known
 * @param version The version declared by the installed module, if any
 * @param location The directory the module was installed to, or would have been installed to
 * @param source Where the module was fetched from
 * @param outcome Whether a new directory was created or an existing installation replaced, null on failure
 * @param failure Why the installation failed, null on success
 */
public final record InstallResult(boolean success, @NotNull String moduleName, @Nullable String version, @NotNull String location,
        @NotNull String source, ModuleMaterializer.@Nullable Outcome outcome, @Nullable Failure failure) {

    @Contract(pure = true)
    public boolean replacedExisting() {
        return this.outcome == ModuleMaterializer.Outcome.REPLACED_EXISTING;
    }

    @NotNull
    static InstallResult failed(@NotNull String moduleName, @NotNull String location, @NotNull String source, @NotNull Failure failure) {
        return new InstallResult(false, moduleName, null, location, source, null, failure);
    }
}
