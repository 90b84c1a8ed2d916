package org.stianloader.picomodule.registry;

import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A registry entry normalized into a single shape, regardless of which index format it was read from.
 * Fields that the legacy format does not know about are null.
 *
 * @param name The name of the module
 * @param version The published version
 * @param description A short description, empty if the registry gives none
 * @param author The author, empty if the registry gives none
 * @param source Either a {@code github:owner/repo[/path][@ref]} source or the tarball reference
 * @param tarball The tarball reference of the distribution descriptor, possibly relative to the index, or the URL source of a legacy entry
 * @param checksum The checksum string of the distribution descriptor, unvalidated
 * @param keywords Keywords (tags in the legacy format)
 * @param tier The tier of the module
 * @param deprecated Whether the registry marked the module as deprecated
 * @param namespace The namespace of the module
 * @param license The license identifier
 * @param repository The source repository of the module
 * @param conformanceLevel The conformance level the registry attests
 * @param verified Whether the registry verified the module
 * @param specVersion The module specification version the module targets
 * @param sizeBytes The declared tarball size
 */
public final record ModuleInfo(@NotNull String name, @NotNull String version, @NotNull String description, @NotNull String author,
        @NotNull String source, @Nullable String tarball, @Nullable String checksum, @NotNull List<String> keywords,
        @Nullable String tier, @Nullable Boolean deprecated, @Nullable String namespace, @Nullable String license,
        @Nullable String repository, @Nullable Integer conformanceLevel, @Nullable Boolean verified,
        @Nullable String specVersion, @Nullable Long sizeBytes) {

    public ModuleInfo {
        keywords = List.copyOf(keywords);
    }

    public boolean isDeprecated() {
        return Boolean.TRUE.equals(this.deprecated);
    }
}
