package org.stianloader.picomodule;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Per-call options of {@link ModuleInstaller#install(String, InstallOptions, java.util.concurrent.Executor)}.
 */
public class InstallOptions {

    @Nullable
    private String renameTo;
    @Nullable
    private String pinnedRef;
    @Nullable
    private String modulePath;

    /**
     * Install the module under a different local name than the one it is published under.
     * The name must be a single safe path segment.
     *
     * @param renameTo The local name, or null to use the published name
     * @return The current {@link InstallOptions} instance, for chaining
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public InstallOptions setRenameTo(@Nullable String renameTo) {
        this.renameTo = renameTo;
        return this;
    }

    /**
     * Fetch repository sources at the given branch, tag or commit, taking precedence over any ref in the reference itself.
     *
     * @param pinnedRef The ref, or null
     * @return The current {@link InstallOptions} instance, for chaining
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public InstallOptions setPinnedRef(@Nullable String pinnedRef) {
        this.pinnedRef = pinnedRef;
        return this;
    }

    /**
     * Look for the module at the given path within a repository instead of at the path given in the reference.
     *
     * @param modulePath The '/'-separated path, or null
     * @return The current {@link InstallOptions} instance, for chaining
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public InstallOptions setModulePath(@Nullable String modulePath) {
        this.modulePath = modulePath;
        return this;
    }

    @Nullable
    @Contract(pure = true)
    public String getRenameTo() {
        return this.renameTo;
    }

    @Nullable
    @Contract(pure = true)
    public String getPinnedRef() {
        return this.pinnedRef;
    }

    @Nullable
    @Contract(pure = true)
    public String getModulePath() {
        return this.modulePath;
    }
}
