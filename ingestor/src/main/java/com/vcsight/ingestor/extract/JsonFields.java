package com.vcsight.ingestor.extract;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Locale;

/**
 * Alias resolution over loosely-shaped JSON objects.
 *
 * An alias is tried as a literal key first ({@code "runtime.powerState"} is a
 * real key in some exports) and then as a dotted path into nested objects.
 * Null, missing and empty-text values count as absent, so resolution falls
 * through to the next alias.
 */
final class JsonFields {

    private JsonFields() {}

    /** First present value among the aliases, or null. */
    static JsonNode first(JsonNode obj, List<String> aliases) {
        for (String alias : aliases) {
            JsonNode value = lookup(obj, alias);
            if (isPresent(value)) return value;
        }
        return null;
    }

    /** First present value among the aliases as text, or {@code fallback}. */
    static String text(JsonNode obj, List<String> aliases, String fallback) {
        JsonNode value = first(obj, aliases);
        if (value == null || value.isContainerNode()) return fallback;
        return value.asText();
    }

    static String lowerText(JsonNode obj, List<String> aliases, String fallback) {
        String value = text(obj, aliases, null);
        return value != null ? value.toLowerCase(Locale.ROOT) : fallback;
    }

    static boolean hasAny(JsonNode obj, List<String> keys) {
        return keys.stream().anyMatch(obj::has);
    }

    static boolean isPresent(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) return false;
        return !(value.isTextual() && value.asText().isEmpty());
    }

    private static JsonNode lookup(JsonNode obj, String alias) {
        JsonNode direct = obj.get(alias);
        if (direct != null || alias.indexOf('.') < 0) return direct;

        JsonNode cursor = obj;
        for (String part : alias.split("\\.")) {
            if (cursor == null || !cursor.isObject()) return null;
            cursor = cursor.get(part);
        }
        return cursor;
    }
}
