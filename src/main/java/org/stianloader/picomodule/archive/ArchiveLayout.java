package org.stianloader.picomodule.archive;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picomodule.FailureKind;
import org.stianloader.picomodule.ModuleException;
import org.stianloader.picomodule.internal.FileUtil;

public final class ArchiveLayout {

    private ArchiveLayout() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Obtain the single top-level directory of an extracted archive. {@code __MACOSX} and {@code .DS_Store}
     * entries are ignored.
     *
     * @param extractionRoot The directory the archive was extracted into
     * @return The only top-level directory
     * @throws IOException If the directory cannot be listed
     * @throws ModuleException With {@link FailureKind#AMBIGUOUS_ARCHIVE_LAYOUT} if there are no or several
     * top-level entries, or if the only entry is not a directory
     */
    @NotNull
    public static Path singleRoot(@NotNull Path extractionRoot) throws IOException {
        List<Path> children = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(extractionRoot)) {
            for (Path child : stream) {
                if (!FileUtil.JUNK_NAMES.contains(child.getFileName().toString())) {
                    children.add(child);
                }
            }
        }
        if (children.size() != 1) {
            throw new ModuleException(FailureKind.AMBIGUOUS_ARCHIVE_LAYOUT, "Expected exactly one top-level directory in the archive, found " + children.size() + " entries");
        }
        Path root = children.get(0);
        if (!Files.isDirectory(root, LinkOption.NOFOLLOW_LINKS)) {
            throw ModuleException.forEntry(FailureKind.AMBIGUOUS_ARCHIVE_LAYOUT, "The only top-level archive entry is not a directory: " + root.getFileName(), root.getFileName().toString());
        }
        return root;
    }
}
