package org.stianloader.picomodule.internal;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

/**
 * Lenient accessors for the Gson tree model. Registry documents are written by third parties, so
 * an absent or wrongly typed optional member is treated as absent rather than as an error.
 */
public class JsonUtil {

    @NotNull
    public static final Gson PRETTY_GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeNulls()
            .create();

    @NotNull
    private static final TypeAdapter<JsonElement> ELEMENT_ADAPTER = new Gson().getAdapter(JsonElement.class);

    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    /**
     * Parse a complete JSON document under RFC 8259 rules. Unlike {@link com.google.gson.JsonParser#parseString(String)},
     * comments, unquoted or single-quoted strings, '=' and ';' separators, non-finite numbers and trailing content are rejected.
     *
     * @param json The document
     * @return The root element
     * @throws JsonParseException If the document is empty or not valid JSON
     */
    @NotNull
    public static JsonElement parseStrict(@NotNull String json) {
        JsonReader reader = new JsonReader(new StringReader(json));
        reader.setLenient(false);
        try {
            JsonElement root = JsonUtil.ELEMENT_ADAPTER.read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new JsonParseException("Trailing content after the JSON document at " + reader.getPath());
            }
            return root;
        } catch (IOException | IllegalStateException | NumberFormatException e) {
            throw new JsonParseException(e.getMessage(), e);
        }
    }

    @Nullable
    @Contract(pure = true)
    public static JsonObject optObject(@Nullable JsonObject object, @NotNull String key) {
        if (object == null) {
            return null;
        }
        JsonElement element = object.get(key);
        return element != null && element.isJsonObject() ? element.getAsJsonObject() : null;
    }

    @Nullable
    @Contract(pure = true)
    public static String optString(@Nullable JsonObject object, @NotNull String key) {
        JsonPrimitive primitive = JsonUtil.optPrimitive(object, key);
        if (primitive == null || primitive.isBoolean()) {
            return null;
        }
        return primitive.getAsString();
    }

    @Nullable
    @Contract(pure = true)
    public static Long optLong(@Nullable JsonObject object, @NotNull String key) {
        JsonPrimitive primitive = JsonUtil.optPrimitive(object, key);
        if (primitive == null || !primitive.isNumber()) {
            return null;
        }
        BigDecimal value;
        try {
            value = primitive.getAsBigDecimal();
        } catch (NumberFormatException e) {
            return null;
        }
        if (value.compareTo(JsonUtil.LONG_MIN) < 0 || value.compareTo(JsonUtil.LONG_MAX) > 0) {
            return null;
        }
        try {
            return value.longValueExact();
        } catch (ArithmeticException e) {
            // Fractional
            return null;
        }
    }

    @Nullable
    @Contract(pure = true)
    public static Integer optInt(@Nullable JsonObject object, @NotNull String key) {
        Long value = JsonUtil.optLong(object, key);
        if (value == null || value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            return null;
        }
        return value.intValue();
    }

    @Nullable
    @Contract(pure = true)
    public static Boolean optBoolean(@Nullable JsonObject object, @NotNull String key) {
        JsonPrimitive primitive = JsonUtil.optPrimitive(object, key);
        if (primitive == null || !primitive.isBoolean()) {
            return null;
        }
        return primitive.getAsBoolean();
    }

    @NotNull
    @Contract(pure = true)
    public static List<String> stringList(@Nullable JsonObject object, @NotNull String key) {
        if (object == null) {
            return Collections.emptyList();
        }
        JsonElement element = object.get(key);
        if (element == null || !element.isJsonArray()) {
            return Collections.emptyList();
        }
        List<String> out = new ArrayList<>();
        for (JsonElement child : element.getAsJsonArray()) {
            if (child.isJsonPrimitive() && !child.getAsJsonPrimitive().isBoolean()) {
                out.add(child.getAsString());
            }
        }
        return Collections.unmodifiableList(out);
    }

    @NotNull
    public static JsonArray toArray(@NotNull Iterable<String> values) {
        JsonArray array = new JsonArray();
        for (String value : values) {
            array.add(value);
        }
        return array;
    }

    @Nullable
    private static JsonPrimitive optPrimitive(@Nullable JsonObject object, @NotNull String key) {
        if (object == null) {
            return null;
        }
        JsonElement element = object.get(key);
        return element != null && element.isJsonPrimitive() ? element.getAsJsonPrimitive() : null;
    }

    /**
     * Serialize a tree with two space indentation and a trailing newline, escaping every non-ASCII
     * character so that the document is ASCII-only and diffs stay stable across platforms.
     *
     * @param element The element to serialize
     * @return The ASCII-only JSON document
     */
    @NotNull
    public static String toAsciiJson(@NotNull JsonElement element) {
        String json = JsonUtil.PRETTY_GSON.toJson(element);
        StringBuilder out = new StringBuilder(json.length() + 1);
        for (int i = 0; i < json.length(); i++) {
            char c = json.charAt(i);
            if (c < 0x80) {
                out.append(c);
            } else {
                out.append(String.format("\\u%04x", (int) c));
            }
        }
        return out.append('\n').toString();
    }
}
