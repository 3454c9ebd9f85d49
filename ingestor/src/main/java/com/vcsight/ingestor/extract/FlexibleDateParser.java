package com.vcsight.ingestor.extract;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Best-effort timestamp parsing for alarm trigger times.
 *
 * Exports carry every format imaginable. Values without a zone are read as
 * UTC; all-digit values are epoch seconds (or milliseconds when large).
 * Anything unrecognised yields {@code Optional.empty()}; this parser never
 * throws.
 */
public final class FlexibleDateParser {

    // Epoch values above this are taken as milliseconds.
    private static final long MILLIS_THRESHOLD = 100_000_000_000L;

    private static final DateTimeFormatter FRACTION = new DateTimeFormatterBuilder()
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .toFormatter();

    private static final List<Function<String, Instant>> PARSERS = new ArrayList<>();

    static {
        PARSERS.add(Instant::parse);

        for (DateTimeFormatter f : List.of(
                DateTimeFormatter.ISO_OFFSET_DATE_TIME,
                DateTimeFormatter.ISO_ZONED_DATE_TIME,
                DateTimeFormatter.RFC_1123_DATE_TIME,
                spaced("+HH:MM"),
                spaced("+HHMM"))) {
            PARSERS.add(text -> ZonedDateTime.parse(text, f).toInstant());
        }

        for (DateTimeFormatter f : List.of(
                DateTimeFormatter.ISO_LOCAL_DATE_TIME,
                new DateTimeFormatterBuilder().appendPattern("yyyy-MM-dd HH:mm:ss").append(FRACTION).toFormatter(),
                new DateTimeFormatterBuilder().appendPattern("yyyy/MM/dd HH:mm:ss").append(FRACTION).toFormatter(),
                DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
                DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm:ss"),
                DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm:ss"))) {
            PARSERS.add(text -> LocalDateTime.parse(text, f).toInstant(ZoneOffset.UTC));
        }

        for (DateTimeFormatter f : List.of(
                DateTimeFormatter.ISO_LOCAL_DATE,
                DateTimeFormatter.ofPattern("yyyy/MM/dd"),
                DateTimeFormatter.ofPattern("MM/dd/yyyy"))) {
            PARSERS.add(text -> LocalDate.parse(text, f).atStartOfDay().toInstant(ZoneOffset.UTC));
        }
    }

    private FlexibleDateParser() {}

    public static Optional<Instant> parse(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) return Optional.empty();
        if (value.isNumber()) return fromEpoch(value.asLong());
        if (value.isTextual()) return parse(value.asText());
        return Optional.empty();
    }

    public static Optional<Instant> parse(String raw) {
        if (raw == null) return Optional.empty();
        String text = raw.strip();
        if (text.isEmpty()) return Optional.empty();

        if (text.length() >= 9 && text.length() <= 18 && text.chars().allMatch(Character::isDigit)) {
            return fromEpoch(Long.parseLong(text));
        }
        for (Function<String, Instant> parser : PARSERS) {
            Optional<Instant> parsed = attempt(parser, text);
            if (parsed.isPresent()) return parsed;
        }
        return Optional.empty();
    }

    private static Optional<Instant> attempt(Function<String, Instant> parser, String text) {
        try {
            return Optional.of(parser.apply(text));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> fromEpoch(long value) {
        if (value <= 0) return Optional.empty();
        return Optional.of(value > MILLIS_THRESHOLD
                ? Instant.ofEpochMilli(value)
                : Instant.ofEpochSecond(value));
    }

    // "2024-01-15 10:30:00+02:00" and "2024-01-15 10:30:00 +0200"
    private static DateTimeFormatter spaced(String offsetPattern) {
        return new DateTimeFormatterBuilder()
                .appendPattern("yyyy-MM-dd HH:mm:ss").append(FRACTION)
                .optionalStart().appendLiteral(' ').optionalEnd()
                .appendOffset(offsetPattern, "Z")
                .toFormatter();
    }
}
