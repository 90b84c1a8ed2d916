package org.stianloader.picomodule.publish;

import java.nio.file.Path;
import java.util.List;

import org.jetbrains.annotations.NotNull;

import com.google.gson.JsonObject;

/**
 * What {@link AssetBuilder#build(BuildOptions)} produced.
 *
 * @param index The registry index document that was written
 * @param registryOut The file the index was written to
 * @param outDir The directory the tarballs were written to
 * @param updated The timestamp recorded in the index
 * @param modules The packaged modules, in index order
 */
public final record BuildResult(@NotNull JsonObject index, @NotNull Path registryOut, @NotNull Path outDir, @NotNull String updated,
        @NotNull List<BuiltModule> modules) {

    public BuildResult {
        modules = List.copyOf(modules);
    }

    /**
     * A single packaged module.
     *
     * @param name The module name
     * @param version The module version
     * @param file The file name of the tarball within the output directory
     * @param sha256 The hex digest of the tarball
     * @param sizeBytes The size of the tarball
     */
    public static final record BuiltModule(@NotNull String name, @NotNull String version, @NotNull String file, @NotNull String sha256, long sizeBytes) {
    }
}
