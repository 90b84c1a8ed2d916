package org.stianloader.picomodule.manifest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picomodule.FailureKind;
import org.stianloader.picomodule.ModuleException;
import org.stianloader.picomodule.internal.JsonUtil;
import org.stianloader.picomodule.logging.LoggingAdapter;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

/**
 * The install manifest: a single JSON document mapping local module names to {@link InstallManifestEntry entries}.
 *
 * <p>An instance is a handle on the manifest file. It is loaded once and written back explicitly through
 * {@link #save()}; all accessors are thread safe within the process. There is no cross-process locking, two
 * processes saving the same manifest race and the last writer wins.
 */
public class InstallManifest {

    @NotNull
    private final Path file;
    @NotNull
    private final Map<String, InstallManifestEntry> entries;

    private InstallManifest(@NotNull Path file, @NotNull Map<String, InstallManifestEntry> entries) {
        this.file = file;
        this.entries = entries;
    }

    /**
     * Load a manifest. A missing file yields an empty manifest; entries that cannot be understood are dropped with a warning.
     *
     * @param file The manifest file
     * @return The loaded manifest
     * @throws ModuleException With {@link FailureKind#IO_FAILURE} if the file exists but is not a JSON object or cannot be read
     */
    @NotNull
    public static InstallManifest load(@NotNull Path file) {
        Map<String, InstallManifestEntry> entries = new TreeMap<>();
        String content;
        try {
            content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return new InstallManifest(file, entries);
        } catch (IOException e) {
            throw new ModuleException(FailureKind.IO_FAILURE, "Unable to read install manifest " + file + ": " + e.getMessage(), e);
        }

        if (content.trim().isEmpty()) {
            return new InstallManifest(file, entries);
        }

        JsonElement root;
        try {
            root = JsonUtil.parseStrict(content);
        } catch (JsonParseException e) {
            throw new ModuleException(FailureKind.IO_FAILURE, "Install manifest " + file + " is not valid JSON: " + e.getMessage(), e);
        }
        if (root.isJsonNull()) {
            return new InstallManifest(file, entries);
        } else if (!root.isJsonObject()) {
            throw new ModuleException(FailureKind.IO_FAILURE, "Install manifest " + file + " is not a JSON object");
        }

        for (Map.Entry<String, JsonElement> e : root.getAsJsonObject().entrySet()) {
            InstallManifestEntry entry = e.getValue().isJsonObject() ? InstallManifestEntry.fromJson(e.getValue().getAsJsonObject()) : null;
            if (entry == null) {
                LoggingAdapter.getDefaultLogger().warn(InstallManifest.class, "Dropping malformed install manifest entry '{}' of {}", e.getKey(), file);
                continue;
            }
            entries.put(e.getKey(), entry);
        }
        return new InstallManifest(file, entries);
    }

    @NotNull
    @Contract(pure = true)
    public Path getFile() {
        return this.file;
    }

    @Nullable
    public synchronized InstallManifestEntry get(@NotNull String name) {
        return this.entries.get(name);
    }

    @NotNull
    public synchronized Set<String> getNames() {
        return Collections.unmodifiableSet(new TreeSet<>(this.entries.keySet()));
    }

    @Contract(mutates = "this", pure = false)
    public synchronized void put(@NotNull String name, @NotNull InstallManifestEntry entry) {
        this.entries.put(Objects.requireNonNull(name, "name may not be null"), Objects.requireNonNull(entry, "entry may not be null"));
    }

    @Nullable
    @Contract(mutates = "this", pure = false)
    public synchronized InstallManifestEntry remove(@NotNull String name) {
        return this.entries.remove(name);
    }

    /**
     * Write the manifest back to disk. The document is written to a temporary sibling first and then moved over
     * the manifest, so a reader never observes a half written file.
     *
     * @throws ModuleException With {@link FailureKind#IO_FAILURE} if the manifest cannot be written
     */
    public synchronized void save() {
        JsonObject root = new JsonObject();
        for (Map.Entry<String, InstallManifestEntry> entry : this.entries.entrySet()) {
            root.add(entry.getKey(), entry.getValue().toJson());
        }
        byte[] data = (JsonUtil.PRETTY_GSON.toJson(root) + "\n").getBytes(StandardCharsets.UTF_8);
        Path parent = this.file.toAbsolutePath().getParent();
        Path temp = null;
        try {
            Files.createDirectories(parent);
            temp = Files.createTempFile(parent, this.file.getFileName().toString(), ".tmp");
            Files.write(temp, data);
            try {
                Files.move(temp, this.file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, this.file, StandardCopyOption.REPLACE_EXISTING);
            }
            temp = null;
        } catch (IOException e) {
            throw new ModuleException(FailureKind.IO_FAILURE, "Unable to write install manifest " + this.file + ": " + e.getMessage(), e);
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    LoggingAdapter.getDefaultLogger().warn(InstallManifest.class, "Unable to delete temporary manifest {}", temp, e);
                }
            }
        }
    }
}
