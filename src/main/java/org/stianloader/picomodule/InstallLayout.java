package org.stianloader.picomodule;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.jetbrains.annotations.NotNull;

/**
 * Where installed modules and the state that belongs to them live on disk.
 *
 * @param modulesDir The directory holding one subdirectory per installed module
 * @param manifestFile The install manifest
 * @param cacheDir The directory of the registry index cache
 * @param scratchDir The directory temporary downloads and extractions are placed in
 */
public final record InstallLayout(@NotNull Path modulesDir, @NotNull Path manifestFile, @NotNull Path cacheDir, @NotNull Path scratchDir) {

    @NotNull
    public static final String MANIFEST_FILE_NAME = "installed.json";

    @NotNull
    public static InstallLayout ofHome(@NotNull Path home) {
        return new InstallLayout(home.resolve("modules"), home.resolve(InstallLayout.MANIFEST_FILE_NAME), home.resolve("cache"), home.resolve("tmp"));
    }

    /**
     * The layout below {@code ~/.cognitive}.
     *
     * @return The default layout of the current user
     */
    @NotNull
    public static InstallLayout userDefault() {
        return InstallLayout.ofHome(Paths.get(System.getProperty("user.home"), ".cognitive"));
    }
}
