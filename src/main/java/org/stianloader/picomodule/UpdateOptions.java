package org.stianloader.picomodule;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public class UpdateOptions {

    @Nullable
    private String tag;

    /**
     * Update to the given tag (or version, for registry installed modules) instead of the latest one.
     *
     * @param tag The tag, or null for the latest
     * @return The current {@link UpdateOptions} instance, for chaining
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public UpdateOptions setTag(@Nullable String tag) {
        this.tag = tag;
        return this;
    }

    @Nullable
    @Contract(pure = true)
    public String getTag() {
        return this.tag;
    }
}
