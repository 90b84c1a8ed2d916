package org.stianloader.picomodule.internal;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picomodule.FailureKind;
import org.stianloader.picomodule.ModuleException;
import org.stianloader.picomodule.logging.LoggingAdapter;

public class FileUtil {

    /**
     * File names that archive tools and desktop environments leave behind and that are never part of a module.
     */
    @NotNull
    public static final Set<String> JUNK_NAMES = Set.of(".DS_Store", "__MACOSX");

    /**
     * Lexical containment check: whether {@code target} is {@code root} or lies below it once both
     * paths are made absolute and normalized. The filesystem is not consulted.
     */
    @Contract(pure = true)
    public static boolean isWithinRoot(@NotNull Path root, @NotNull Path target) {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path normalizedTarget = target.toAbsolutePath().normalize();
        return normalizedTarget.startsWith(normalizedRoot);
    }

    public static void deleteRecursively(@NotNull Path path) throws IOException {
        if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        if (!Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
            Files.deleteIfExists(path);
            return;
        }
        Files.walkFileTree(path, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.deleteIfExists(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                if (exc instanceof NoSuchFileException) {
                    return FileVisitResult.CONTINUE;
                }
                throw exc;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, @Nullable IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.deleteIfExists(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * Best-effort variant of {@link #deleteRecursively(Path)} for scratch directories. Failures are logged, not thrown.
     *
     * @param path The file or directory to remove, may be null
     */
    public static void deleteScratch(@Nullable Path path) {
        if (path == null) {
            return;
        }
        try {
            FileUtil.deleteRecursively(path);
        } catch (IOException | UncheckedIOException e) {
            LoggingAdapter.getDefaultLogger().warn(FileUtil.class, "Unable to clean up scratch location {}", path, e);
        }
    }

    /**
     * Copy a directory tree. Symbolic links anywhere in the source tree are refused, as a module
     * must never point outside of itself.
     *
     * @param source The directory to copy
     * @param destination The directory to create, must not exist yet
     * @throws IOException If the copy fails
     */
    public static void copyTree(@NotNull Path source, @NotNull Path destination) throws IOException {
        Files.createDirectories(destination);
        try (DirectoryStream<Path> children = Files.newDirectoryStream(source)) {
            for (Path child : children) {
                Path target = destination.resolve(child.getFileName().toString());
                if (Files.isSymbolicLink(child)) {
                    throw ModuleException.forEntry(FailureKind.UNSAFE_ARCHIVE_ENTRY, "Refusing to copy a module containing a symbolic link: " + child, child.toString());
                } else if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                    FileUtil.copyTree(child, target);
                } else {
                    Files.copy(child, target, StandardCopyOption.COPY_ATTRIBUTES, LinkOption.NOFOLLOW_LINKS);
                }
            }
        }
    }

    /**
     * List all regular files below a directory as '/'-separated relative paths, sorted by their natural
     * string order. Entries listed in {@link #JUNK_NAMES} are skipped.
     *
     * @param root The directory to list
     * @param refuseSymlinks Whether symbolic links should fail the listing instead of being skipped
     * @return The sorted relative paths
     * @throws IOException If the directory cannot be read
     */
    @NotNull
    public static List<String> listRegularFiles(@NotNull Path root, boolean refuseSymlinks) throws IOException {
        List<String> out = new ArrayList<>();
        FileUtil.listRegularFiles0(root, "", refuseSymlinks, out);
        Collections.sort(out);
        return out;
    }

    private static void listRegularFiles0(@NotNull Path dir, @NotNull String prefix, boolean refuseSymlinks, @NotNull List<String> out) throws IOException {
        try (DirectoryStream<Path> children = Files.newDirectoryStream(dir)) {
            for (Path child : children) {
                String name = child.getFileName().toString();
                if (FileUtil.JUNK_NAMES.contains(name)) {
                    continue;
                }
                String relative = prefix.isEmpty() ? name : prefix + '/' + name;
                if (Files.isSymbolicLink(child)) {
                    if (refuseSymlinks) {
                        throw ModuleException.forEntry(FailureKind.UNSAFE_ARCHIVE_ENTRY, "Refusing to package symbolic link: " + child, relative);
                    }
                    continue;
                }
                if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                    FileUtil.listRegularFiles0(child, relative, refuseSymlinks, out);
                } else if (Files.isRegularFile(child, LinkOption.NOFOLLOW_LINKS)) {
                    out.add(relative);
                }
            }
        }
    }
}
