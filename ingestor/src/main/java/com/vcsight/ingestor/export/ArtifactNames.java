package com.vcsight.ingestor.export;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;

/** Collision-resistant artifact base names: {@code {kind}_{client}_{environment}_{timestamp}}. */
final class ArtifactNames {

    static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneOffset.UTC);

    private static final Pattern UNSAFE = Pattern.compile("[\\\\/:*?\"<>|\\s]+");

    private ArtifactNames() {}

    static String timestamp(Instant instant) {
        return TIMESTAMP.format(instant);
    }

    static String of(String kind, String client, String environment, String timestamp) {
        return kind + "_" + sanitize(client) + "_" + sanitize(environment) + "_" + timestamp;
    }

    static String of(String kind, String timestamp) {
        return kind + "_" + timestamp;
    }

    static String sanitize(String segment) {
        if (segment == null || segment.isBlank()) return "unknown";
        return UNSAFE.matcher(segment.strip()).replaceAll("_");
    }
}
