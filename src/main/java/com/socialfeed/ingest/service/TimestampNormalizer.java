package com.socialfeed.ingest.service;

import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses the timestamp shapes returned by scraping actors into UTC instants.
 *
 * Tries a strict ISO-8601 parse first ({@code Z} or numeric offset), then a list of looser
 * layouts (RFC-2822-like tweet dates, RFC-1123, space-separated ISO, bare dates, epoch numbers).
 * A value without an offset is taken as UTC.
 */
@Component
public class TimestampNormalizer {

    private static final List<DateTimeFormatter> ZONED_FORMATS = List.of(
            // Fri Nov 24 17:49:36 +0000 2023
            DateTimeFormatter.ofPattern("EEE MMM dd HH:mm:ss Z yyyy", Locale.ENGLISH),
            DateTimeFormatter.RFC_1123_DATE_TIME,
            new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .append(DateTimeFormatter.ISO_LOCAL_DATE)
                    .appendLiteral(' ')
                    .append(DateTimeFormatter.ISO_LOCAL_TIME)
                    .optionalStart().appendLiteral(' ').optionalEnd()
                    .appendOffset("+HH:MM", "Z")
                    .toFormatter(Locale.ENGLISH),
            new DateTimeFormatterBuilder()
                    .append(DateTimeFormatter.ISO_LOCAL_DATE)
                    .appendLiteral(' ')
                    .append(DateTimeFormatter.ISO_LOCAL_TIME)
                    .optionalStart().appendLiteral(' ').optionalEnd()
                    .appendOffset("+HHMM", "Z")
                    .toFormatter(Locale.ENGLISH),
            // 2023-11-24T17:49:36.000+0000
            new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .append(DateTimeFormatter.ISO_LOCAL_DATE)
                    .appendLiteral('T')
                    .append(DateTimeFormatter.ISO_LOCAL_TIME)
                    .appendOffset("+HHMM", "Z")
                    .toFormatter(Locale.ENGLISH),
            DateTimeFormatter.ISO_ZONED_DATE_TIME
    );

    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            new DateTimeFormatterBuilder()
                    .append(DateTimeFormatter.ISO_LOCAL_DATE)
                    .appendLiteral(' ')
                    .append(DateTimeFormatter.ISO_LOCAL_TIME)
                    .toFormatter(Locale.ENGLISH),
            DateTimeFormatter.ofPattern("EEE MMM dd HH:mm:ss yyyy", Locale.ENGLISH),
            new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .appendPattern("MMMM d, yyyy")
                    .optionalStart().appendPattern(" h:mm a").optionalEnd()
                    .parseDefaulting(ChronoField.HOUR_OF_AMPM, 0)
                    .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
                    .parseDefaulting(ChronoField.AMPM_OF_DAY, 0)
                    .toFormatter(Locale.ENGLISH)
    );

    // Epoch values above this are milliseconds.
    private static final long EPOCH_MILLIS_THRESHOLD = 100_000_000_000L;

    /**
     * @param raw timestamp as found in a dataset item, may be null
     * @return the instant, or empty when the value is blank or matches no known layout
     */
    public Optional<Instant> normalize(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim();
        if (value.isEmpty()) {
            return Optional.empty();
        }

        Optional<Instant> iso = parseIso(value);
        if (iso.isPresent()) {
            return iso;
        }
        return parseLenient(value);
    }

    private Optional<Instant> parseIso(String value) {
        String candidate = value.endsWith("Z") || value.endsWith("z")
                ? value.substring(0, value.length() - 1) + "+00:00"
                : value;
        try {
            return Optional.of(OffsetDateTime.parse(candidate, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant());
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private Optional<Instant> parseLenient(String value) {
        if (value.chars().allMatch(Character::isDigit) && value.length() >= 9) {
            return parseEpoch(value);
        }
        for (DateTimeFormatter formatter : ZONED_FORMATS) {
            try {
                TemporalAccessor parsed = formatter.parse(value);
                return Optional.of(ZonedDateTime.from(parsed).toInstant());
            } catch (DateTimeException ignored) {
                // next layout
            }
        }
        for (DateTimeFormatter formatter : LOCAL_FORMATS) {
            try {
                return Optional.of(LocalDateTime.parse(value, formatter).toInstant(ZoneOffset.UTC));
            } catch (DateTimeException ignored) {
                // next layout
            }
        }
        try {
            return Optional.of(LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant());
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private Optional<Instant> parseEpoch(String digits) {
        try {
            long epoch = Long.parseLong(digits);
            return Optional.of(epoch >= EPOCH_MILLIS_THRESHOLD
                    ? Instant.ofEpochMilli(epoch)
                    : Instant.ofEpochSecond(epoch));
        } catch (NumberFormatException | DateTimeException e) {
            return Optional.empty();
        }
    }
}
