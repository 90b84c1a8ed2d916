package org.stianloader.picomodule.registry;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picomodule.FailureKind;
import org.stianloader.picomodule.ModuleException;
import org.stianloader.picomodule.internal.JsonUtil;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

/**
 * A parsed registry index document. Entries keep the order of the document.
 */
public class RegistryIndex {

    @NotNull
    private final JsonObject document;
    @NotNull
    private final Map<String, RegistryEntry> entries;
    @NotNull
    private final Map<String, Category> categories;

    private RegistryIndex(@NotNull JsonObject document, @NotNull Map<String, RegistryEntry> entries, @NotNull Map<String, Category> categories) {
        this.document = document;
        this.entries = Collections.unmodifiableMap(entries);
        this.categories = Collections.unmodifiableMap(categories);
    }

    @NotNull
    public static RegistryIndex parse(byte @NotNull[] data) {
        return RegistryIndex.parse(new String(data, StandardCharsets.UTF_8));
    }

    /**
     * Parse a registry index document.
     *
     * @param json The document
     * @return The parsed index
     * @throws ModuleException With {@link FailureKind#MALFORMED_INDEX} if the document is not valid JSON, has no
     * {@code modules} object or contains an entry that matches neither entry format
     */
    @NotNull
    public static RegistryIndex parse(@NotNull String json) {
        JsonElement root;
        try {
            root = JsonUtil.parseStrict(json);
        } catch (JsonParseException e) {
            throw new ModuleException(FailureKind.MALFORMED_INDEX, "Invalid registry JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isJsonObject()) {
            throw new ModuleException(FailureKind.MALFORMED_INDEX, "Registry index is not a JSON object");
        }
        JsonObject document = root.getAsJsonObject();
        JsonObject modules = JsonUtil.optObject(document, "modules");
        if (modules == null) {
            throw new ModuleException(FailureKind.MALFORMED_INDEX, "Registry index has no 'modules' object");
        }

        Map<String, RegistryEntry> entries = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : modules.entrySet()) {
            entries.put(entry.getKey(), RegistryEntry.parse(entry.getKey(), entry.getValue()));
        }

        Map<String, Category> categories = new LinkedHashMap<>();
        JsonObject categoryObject = JsonUtil.optObject(document, "categories");
        if (categoryObject != null) {
            for (Map.Entry<String, JsonElement> entry : categoryObject.entrySet()) {
                if (!entry.getValue().isJsonObject()) {
                    continue;
                }
                JsonObject category = entry.getValue().getAsJsonObject();
                String name = JsonUtil.optString(category, "name");
                String description = JsonUtil.optString(category, "description");
                categories.put(entry.getKey(), new Category(entry.getKey(), name == null ? entry.getKey() : name,
                        description == null ? "" : description, JsonUtil.stringList(category, "modules")));
            }
        }

        return new RegistryIndex(document, entries, categories);
    }

    @Nullable
    @Contract(pure = true)
    public RegistryEntry getEntry(@NotNull String name) {
        return this.entries.get(name);
    }

    @NotNull
    @Contract(pure = true)
    public Map<String, RegistryEntry> getEntries() {
        return this.entries;
    }

    @NotNull
    @Contract(pure = true)
    public Map<String, Category> getCategories() {
        return this.categories;
    }

    @NotNull
    @Contract(pure = true)
    public List<String> getFeatured() {
        return JsonUtil.stringList(this.document, "featured");
    }

    @Nullable
    @Contract(pure = true)
    public String getUpdated() {
        return JsonUtil.optString(this.document, "updated");
    }

    @Nullable
    @Contract(pure = true)
    public String getFormatVersion() {
        return JsonUtil.optString(this.document, "version");
    }

    @Nullable
    @Contract(pure = true)
    public Long getTotalModulesStat() {
        return JsonUtil.optLong(JsonUtil.optObject(this.document, "stats"), "total_modules");
    }

    @NotNull
    public List<ModuleInfo> listModules() {
        List<ModuleInfo> out = new ArrayList<>(this.entries.size());
        for (RegistryEntry entry : this.entries.values()) {
            out.add(entry.toModuleInfo());
        }
        return out;
    }
}
