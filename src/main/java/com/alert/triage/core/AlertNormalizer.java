package com.alert.triage.core;

import com.alert.triage.api.AlertValidationException;
import com.alert.triage.domain.Alert;
import com.alert.triage.domain.RawAlert;
import com.alert.triage.domain.Severity;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Validates raw alerts and turns them into canonical {@link Alert}s. Pure: no state, no I/O.
 */
@Component
public class AlertNormalizer {

    /** Epoch values at or above this are milliseconds (year 1973 in ms, year 5138 in s). */
    private static final long EPOCH_MILLIS_FLOOR = 100_000_000_000L;

    /**
     * ISO date-times with 'T' or a space between date and time (warehouse exports use the latter),
     * with an optional offset; zone-less values are UTC.
     */
    private static final DateTimeFormatter FLEXIBLE_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffsetId().optionalEnd()
            .parseDefaulting(ChronoField.OFFSET_SECONDS, 0)
            .toFormatter();

    public Alert normalize(RawAlert raw) {
        if (raw == null) {
            throw new AlertValidationException(Map.of("alert", "alert body is required"));
        }
        Map<String, String> errors = new LinkedHashMap<>();

        String id = trimToEmpty(raw.getId());
        if (id.isEmpty()) {
            errors.put("id", "id is required");
        }

        Instant timestamp = null;
        if (isBlank(raw.getTimestamp())) {
            errors.put("timestamp", "timestamp is required");
        } else {
            Optional<Instant> parsed = parseInstant(raw.getTimestamp());
            if (parsed.isEmpty()) {
                errors.put("timestamp", "unparsable timestamp: " + raw.getTimestamp());
            } else {
                timestamp = parsed.get();
            }
        }

        Optional<Severity> severity = Severity.parse(raw.getSeverity());
        if (severity.isEmpty()) {
            errors.put("severity", isBlank(raw.getSeverity())
                    ? "severity is required"
                    : "unknown severity: " + raw.getSeverity());
        }

        Instant resolvedAt = null;
        if (!isBlank(raw.getResolvedAt())) {
            Optional<Instant> parsed = parseInstant(raw.getResolvedAt());
            if (parsed.isEmpty()) {
                errors.put("resolvedAt", "unparsable timestamp: " + raw.getResolvedAt());
            } else {
                resolvedAt = parsed.get();
            }
        }

        if (!errors.isEmpty()) {
            throw new AlertValidationException(errors);
        }

        return Alert.builder()
                .id(id)
                .host(trimToEmpty(raw.getHost()))
                .title(trimToEmpty(raw.getTitle()))
                .severity(severity.get())
                .description(trimToEmpty(raw.getDescription()))
                .category(trimToEmpty(raw.getCategory()))
                .source(trimToEmpty(raw.getSource()))
                .status(trimToEmpty(raw.getStatus()))
                .timestamp(timestamp)
                .resolvedAt(resolvedAt)
                .build();
    }

    /**
     * Accepts ISO instants, ISO offset or local date-times, space-separated date-times and
     * numeric epoch seconds/millis.
     */
    static Optional<Instant> parseInstant(String value) {
        String text = value.trim();
        try {
            if (text.chars().allMatch(Character::isDigit)) {
                long epoch = Long.parseLong(text);
                return Optional.of(epoch >= EPOCH_MILLIS_FLOOR ? Instant.ofEpochMilli(epoch) : Instant.ofEpochSecond(epoch));
            }
            return Optional.of(FLEXIBLE_DATE_TIME.parse(text, OffsetDateTime::from).toInstant());
        } catch (DateTimeParseException | NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
