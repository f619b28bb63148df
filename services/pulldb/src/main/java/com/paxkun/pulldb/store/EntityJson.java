package com.paxkun.pulldb.store;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.gson.ToNumberPolicy;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.time.LocalDate;
import java.util.Comparator;

/**
 * Gson setup shared by the store implementations, plus the filter and ordering rules they both follow.
 * Dates are written as ISO strings so lexical and chronological order agree.
 */
public final class EntityJson {

    private static final Gson GSON = new GsonBuilder()
            .registerTypeAdapter(LocalDate.class, new LocalDateAdapter().nullSafe())
            .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
            .create();

    private EntityJson() {
    }

    public static Gson gson() {
        return GSON;
    }

    public static JsonObject toTree(StoredEntity entity) {
        return GSON.toJsonTree(entity).getAsJsonObject();
    }

    public static <T> T fromTree(JsonElement tree, Class<T> type) {
        return GSON.fromJson(tree, type);
    }

    /**
     * Converts a filter value into the JSON form records are stored in.
     */
    public static JsonElement toValue(Object value) {
        if (value instanceof Enum<?> constant) {
            return new JsonPrimitive(constant.name());
        }
        return GSON.toJsonTree(value);
    }

    public static boolean matches(JsonObject document, QueryFilter filter) {
        JsonElement actual = document.get(filter.field());
        if (actual == null || actual.isJsonNull()) {
            return false;
        }
        JsonElement expected = toValue(filter.value());
        if (filter.operator() == QueryFilter.Operator.EQ) {
            if (actual.isJsonArray()) {
                JsonArray array = actual.getAsJsonArray();
                for (JsonElement element : array) {
                    if (compare(element, expected) == 0) {
                        return true;
                    }
                }
                return false;
            }
            return compare(actual, expected) == 0;
        }
        return !actual.isJsonArray() && compare(actual, expected) > 0;
    }

    /**
     * Orders two documents by one field, missing values first.
     */
    public static Comparator<JsonObject> fieldOrder(String field) {
        return (left, right) -> {
            JsonElement a = left.get(field);
            JsonElement b = right.get(field);
            boolean aMissing = a == null || a.isJsonNull();
            boolean bMissing = b == null || b.isJsonNull();
            if (aMissing || bMissing) {
                return Boolean.compare(!aMissing, !bMissing);
            }
            return compare(a, b);
        };
    }

    static int compare(JsonElement a, JsonElement b) {
        if (!a.isJsonPrimitive() || !b.isJsonPrimitive()) {
            return a.equals(b) ? 0 : a.toString().compareTo(b.toString());
        }
        JsonPrimitive left = a.getAsJsonPrimitive();
        JsonPrimitive right = b.getAsJsonPrimitive();
        if (left.isNumber() && right.isNumber()) {
            return Double.compare(left.getAsDouble(), right.getAsDouble());
        }
        if (left.isBoolean() && right.isBoolean()) {
            return Boolean.compare(left.getAsBoolean(), right.getAsBoolean());
        }
        return left.getAsString().compareTo(right.getAsString());
    }

    private static final class LocalDateAdapter extends TypeAdapter<LocalDate> {

        @Override
        public void write(JsonWriter out, LocalDate value) throws IOException {
            out.value(value.toString());
        }

        @Override
        public LocalDate read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            return LocalDate.parse(in.nextString());
        }
    }
}
