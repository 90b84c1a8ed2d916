package org.stianloader.picomodule.manifest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picomodule.FailureKind;
import org.stianloader.picomodule.ModuleException;
import org.stianloader.picomodule.integrity.ModuleIntegrity;
import org.stianloader.picomodule.internal.JsonUtil;
import org.stianloader.picomodule.logging.LoggingAdapter;

import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;

/**
 * Reads and writes the {@code provenance.json} file of installed modules.
 */
public final class ProvenanceStore {

    private ProvenanceStore() {
        throw new UnsupportedOperationException("Utility class");
    }

    @NotNull
    public static Path provenanceFile(@NotNull Path moduleDir) {
        return moduleDir.resolve(ModuleIntegrity.PROVENANCE_FILE_NAME);
    }

    public static void write(@NotNull Path moduleDir, @NotNull ProvenanceRecord record) throws IOException {
        Files.write(ProvenanceStore.provenanceFile(moduleDir), JsonUtil.toAsciiJson(record.toJson()).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Read the provenance record of a module.
     *
     * @param moduleDir The directory of the installed module
     * @return The record, or null if the module has no provenance file
     * @throws IOException If the file exists but cannot be read
     * @throws ModuleException With {@link FailureKind#POLICY_VIOLATION} if the file is not a valid provenance record
     */
    @Nullable
    public static ProvenanceRecord read(@NotNull Path moduleDir) throws IOException {
        Path file = ProvenanceStore.provenanceFile(moduleDir);
        String content;
        try {
            content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return null;
        }
        JsonElement root;
        try {
            root = JsonUtil.parseStrict(content);
        } catch (JsonParseException e) {
            throw new ModuleException(FailureKind.POLICY_VIOLATION, "Provenance file " + file + " is not valid JSON: " + e.getMessage(), e);
        }
        if (!root.isJsonObject()) {
            throw new ModuleException(FailureKind.POLICY_VIOLATION, "Provenance file " + file + " is not a JSON object");
        }
        return ProvenanceRecord.fromJson(root.getAsJsonObject());
    }

    /**
     * Variant of {@link #read(Path)} for informational callers: any problem is logged at debug level and
     * yields null.
     *
     * @param moduleDir The directory of the installed module
     * @return The record, or null if there is no readable record
     */
    @Nullable
    public static ProvenanceRecord readQuietly(@NotNull Path moduleDir) {
        try {
            return ProvenanceStore.read(moduleDir);
        } catch (IOException | ModuleException e) {
            LoggingAdapter.getDefaultLogger().debug(ProvenanceStore.class, "No usable provenance record in {}", moduleDir, e);
            return null;
        }
    }
}
