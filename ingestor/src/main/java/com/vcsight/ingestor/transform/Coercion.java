package com.vcsight.ingestor.transform;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Coerce-or-default for raw numeric values.
 *
 * Numbers pass through, numeric text is parsed, everything else (missing,
 * null, booleans, garbage, NaN, infinities) becomes the supplied default.
 * None of these methods throw.
 */
public final class Coercion {

    private Coercion() {}

    public static double toDouble(JsonNode value, double fallback) {
        if (value == null || value.isNull() || value.isMissingNode()) return fallback;
        double d;
        if (value.isNumber()) {
            d = value.doubleValue();
        } else if (value.isTextual()) {
            try {
                d = Double.parseDouble(value.asText().strip());
            } catch (NumberFormatException e) {
                return fallback;
            }
        } else {
            return fallback;
        }
        return Double.isFinite(d) ? d : fallback;
    }

    /** Truncates toward zero, so "4.0" and 4.7 both become 4. */
    public static int toInt(JsonNode value, int fallback) {
        double d = toDouble(value, Double.NaN);
        if (Double.isNaN(d) || d > Integer.MAX_VALUE || d < Integer.MIN_VALUE) return fallback;
        return (int) d;
    }

    public static long toLong(JsonNode value, long fallback) {
        double d = toDouble(value, Double.NaN);
        if (Double.isNaN(d) || d > Long.MAX_VALUE || d < Long.MIN_VALUE) return fallback;
        return (long) d;
    }

    public static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    /** Half-up rounding to two decimals, as shown in the exported columns. */
    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
