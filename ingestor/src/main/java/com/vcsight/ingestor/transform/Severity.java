package com.vcsight.ingestor.transform;

import java.util.Locale;

/**
 * Normalized alarm severity and its priority score.
 *
 * {@link #normalize(String)} is total: any input, including null, maps to
 * exactly one constant.
 */
public enum Severity {
    CRITICAL("Critical", 5),
    WARNING("Warning", 3),
    INFORMATION("Information", 1),
    NORMAL("Normal", 0),
    UNKNOWN("Unknown", 2);

    private final String label;
    private final int priority;

    Severity(String label, int priority) {
        this.label = label;
        this.priority = priority;
    }

    public String label()  { return label; }
    public int priority()  { return priority; }

    public static Severity normalize(String raw) {
        if (raw == null) return UNKNOWN;
        return switch (raw.strip().toLowerCase(Locale.ROOT)) {
            case "critical", "error"     -> CRITICAL;
            case "warning"               -> WARNING;
            case "info", "information"   -> INFORMATION;
            case "normal"                -> NORMAL;
            default                      -> UNKNOWN;
        };
    }
}
