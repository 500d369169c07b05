package com.fraud.scoring.risk.features;

import com.fraud.scoring.api.InvalidInputException;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;

/**
 * Parses caller timestamps into timezone-naive wall-clock times. Offsets and zones are dropped,
 * not converted: the models were trained on local transaction times.
 * Accepts {@code 2025-12-21T22:41}, {@code 2020-12-22 23:13:39}, {@code 2025-12-21T22:41:00+05:00}
 * and a bare date (midnight).
 */
final class TimestampParser {

    private static final DateTimeFormatter FORMAT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffsetId().optionalEnd()
            .optionalStart().appendLiteral('[').parseCaseSensitive().appendZoneRegionId().appendLiteral(']').optionalEnd()
            .optionalEnd()
            .toFormatter();

    private TimestampParser() {
    }

    static LocalDateTime parseDateTime(String raw, String field) {
        String value = raw.trim();
        if (value.length() > 10 && value.charAt(10) == ' ') {
            value = value.substring(0, 10) + 'T' + value.substring(11).trim();
        }
        try {
            TemporalAccessor parsed = FORMAT.parse(value);
            LocalTime time = parsed.isSupported(ChronoField.HOUR_OF_DAY) ? LocalTime.from(parsed) : LocalTime.MIDNIGHT;
            return LocalDate.from(parsed).atTime(time);
        } catch (DateTimeException e) {
            throw new InvalidInputException("Cannot parse " + field + " '" + raw + "'", e);
        }
    }

    static LocalDate parseDate(String raw, String field) {
        return parseDateTime(raw, field).toLocalDate();
    }
}
