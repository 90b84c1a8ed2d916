package org.stianloader.picomodule.registry;

import java.util.List;

import org.jetbrains.annotations.NotNull;

/**
 * A named group of modules declared by the registry index.
 *
 * @param key The key of the category within the index
 * @param name The display name
 * @param description The description, empty if none is given
 * @param modules The names of the modules in the category
 */
public final record Category(@NotNull String key, @NotNull String name, @NotNull String description, @NotNull List<String> modules) {

    public Category {
        modules = List.copyOf(modules);
    }
}
