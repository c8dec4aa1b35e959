package com.rfpanalytics.domain.time;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Normalizes the timestamp encodings found across the source feeds.
 *
 * Supported shapes:
 * - ISO-8601 text (instant, offset, zoned, local date-time, local date)
 * - epoch milliseconds as a number
 * - objects carrying integer seconds under "_seconds" or "seconds"
 *   (nanoseconds optional under "_nanoseconds" or "nanoseconds")
 * - values with a zero-argument conversion: Date, temporal values, Supplier
 *
 * Never throws; an unusable value yields an empty Optional.
 */
@Slf4j
public class TimestampParser {

    private static final List<String> SECONDS_FIELDS = List.of("_seconds", "seconds");
    private static final List<String> NANOS_FIELDS = List.of("_nanoseconds", "nanoseconds");

    // Audit-log timestamps are 100ns ticks since the epoch
    private static final int TICK_DIGITS = 17;
    private static final long TICKS_PER_MILLI = 10_000L;

    private final ZoneId zone;
    private final List<Function<String, Instant>> textParsers;

    public TimestampParser(ZoneId zone) {
        this.zone = zone;
        this.textParsers = List.of(
                Instant::parse,
                text -> OffsetDateTime.parse(text).toInstant(),
                text -> ZonedDateTime.parse(text).toInstant(),
                text -> LocalDateTime.parse(text).atZone(zone).toInstant(),
                text -> LocalDate.parse(text).atStartOfDay(zone).toInstant()
        );
    }

    public Optional<Instant> parse(Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        if (raw instanceof JsonNode) {
            return parseNode((JsonNode) raw);
        }
        if (raw instanceof CharSequence) {
            return parseText(raw.toString());
        }
        if (raw instanceof Number) {
            return fromEpochMillis(((Number) raw).doubleValue());
        }
        if (raw instanceof Instant) {
            return Optional.of((Instant) raw);
        }
        if (raw instanceof Date) {
            return Optional.of(((Date) raw).toInstant());
        }
        if (raw instanceof TemporalAccessor) {
            return fromTemporal((TemporalAccessor) raw);
        }
        if (raw instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) raw;
            return fromSecondsObject(field -> map.get(field) instanceof Number ? (Number) map.get(field) : null);
        }
        if (raw instanceof Supplier) {
            return fromSupplier((Supplier<?>) raw);
        }
        return Optional.empty();
    }

    public Optional<Instant> parseNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Optional.empty();
        }
        if (node.isTextual()) {
            return parseText(node.asText());
        }
        if (node.isNumber()) {
            return fromEpochMillis(node.asDouble());
        }
        if (node.isObject()) {
            return fromSecondsObject(field -> {
                JsonNode value = node.get(field);
                return value != null && value.isNumber() ? value.numberValue() : null;
            });
        }
        return Optional.empty();
    }

    public Optional<Instant> parseText(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        for (Function<String, Instant> parser : textParsers) {
            try {
                return Optional.of(parser.apply(trimmed));
            } catch (DateTimeParseException e) {
                // try the next layout
            }
        }
        return Optional.empty();
    }

    /**
     * Parses an audit-log timestamp. Long digit strings are 100ns ticks,
     * shorter ones epoch millis; anything else is treated as ISO text.
     */
    public Optional<Instant> parseEpochTicks(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        if (!trimmed.chars().allMatch(Character::isDigit)) {
            return parseText(trimmed);
        }
        try {
            long value = Long.parseLong(trimmed);
            if (trimmed.length() >= TICK_DIGITS) {
                return fromEpochMillis(Math.round((double) value / TICKS_PER_MILLI));
            }
            return fromEpochMillis(value);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public Optional<Instant> fromEpochMillis(double millis) {
        if (Double.isNaN(millis) || Double.isInfinite(millis)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.ofEpochMilli((long) millis));
        } catch (DateTimeException | ArithmeticException e) {
            return Optional.empty();
        }
    }

    private Optional<Instant> fromSecondsObject(Function<String, Number> field) {
        Number seconds = first(field, SECONDS_FIELDS);
        if (seconds == null) {
            return Optional.empty();
        }
        Number nanos = first(field, NANOS_FIELDS);
        try {
            return Optional.of(Instant.ofEpochSecond(seconds.longValue(), nanos != null ? nanos.longValue() : 0L));
        } catch (DateTimeException | ArithmeticException e) {
            return Optional.empty();
        }
    }

    private Optional<Instant> fromTemporal(TemporalAccessor temporal) {
        try {
            return Optional.of(Instant.from(temporal));
        } catch (DateTimeException e) {
            // no offset information; fall through to local interpretations
        }
        if (temporal instanceof LocalDateTime) {
            return Optional.of(((LocalDateTime) temporal).atZone(zone).toInstant());
        }
        if (temporal instanceof LocalDate) {
            return Optional.of(((LocalDate) temporal).atStartOfDay(zone).toInstant());
        }
        return Optional.empty();
    }

    private Optional<Instant> fromSupplier(Supplier<?> supplier) {
        Object converted;
        try {
            converted = supplier.get();
        } catch (RuntimeException e) {
            log.debug("Timestamp conversion failed: {}", e.getMessage());
            return Optional.empty();
        }
        if (converted instanceof Supplier<?>) {
            return Optional.empty();
        }
        return parse(converted);
    }

    private static Number first(Function<String, Number> field, List<String> names) {
        for (String name : names) {
            Number value = field.apply(name);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
