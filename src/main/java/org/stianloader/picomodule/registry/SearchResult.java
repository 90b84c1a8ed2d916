package org.stianloader.picomodule.registry;

import java.util.List;

import org.jetbrains.annotations.NotNull;

public final record SearchResult(@NotNull String name, @NotNull String description, @NotNull String version, int score, @NotNull List<String> keywords) {
}
