package com.journalengine.common;

import com.journalengine.common.exception.InvalidDateException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Parses the date representations accepted in update requests.
 *
 * Accepted: zoned or offset ISO date-times, local ISO date-times, plain ISO
 * dates and {@code yyyy-MM-dd HH:mm:ss}. Values without zone information are
 * interpreted in the supplied zone.
 */
public final class DateParser {

    private static final DateTimeFormatter SPACED_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private DateParser() {
    }

    public static ZonedDateTime parse(Object value, ZoneId zone) {
        if (value instanceof ZonedDateTime) {
            return (ZonedDateTime) value;
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toZonedDateTime();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).atZone(zone);
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay(zone);
        }
        String string = value == null ? "" : value.toString().trim();
        if (string.isEmpty()) {
            throw new InvalidDateException(string, null);
        }

        try {
            if (string.length() == 10) {
                return LocalDate.parse(string).atStartOfDay(zone);
            }
            if (string.indexOf('T') < 0 && string.indexOf(' ') > 0) {
                return LocalDateTime.parse(string, SPACED_DATE_TIME).atZone(zone);
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(string,
                ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime) {
                return (ZonedDateTime) parsed;
            }
            return ((LocalDateTime) parsed).atZone(zone);
        } catch (DateTimeParseException e) {
            throw new InvalidDateException(string, e);
        }
    }
}
