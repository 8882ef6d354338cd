package com.clinic.scheduling.utils;

import com.clinic.scheduling.exception.ValidationException;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Lenient parsing of the date and time strings clients send.
 * Accepts {@code HH:mm}, {@code HH:mm:ss}, {@code h:mm AM}, {@code h.mm pm} and
 * {@code yyyy-MM-dd[ T]HH:mm[:ss]} date-times.
 */
public final class TimeParser {

    private static final DateTimeFormatter TWELVE_HOUR = DateTimeFormatter.ofPattern("h:mm a", Locale.ENGLISH);

    private TimeParser() {
    }

    public static LocalTime parseTime(String raw, String field) {
        String t = normalizeTime(raw);
        if (t == null) {
            throw new ValidationException(field + " is required.");
        }
        try {
            if (t.endsWith("AM") || t.endsWith("PM")) {
                return LocalTime.parse(t, TWELVE_HOUR);
            }
            if (t.matches("\\d:\\d{2}(:\\d{2})?")) {
                t = "0" + t;
            }
            return LocalTime.parse(t);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid " + field + ": '" + raw + "'. Use HH:mm or hh:mm AM/PM.");
        }
    }

    public static LocalDate parseDate(String raw, String field) {
        if (StringUtils.isBlank(raw)) {
            throw new ValidationException(field + " is required.");
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid " + field + ": '" + raw + "'. Use YYYY-MM-DD.");
        }
    }

    public static LocalDateTime parseDateTime(String raw, String field) {
        if (StringUtils.isBlank(raw)) {
            throw new ValidationException(field + " is required.");
        }
        String t = StringUtils.normalizeSpace(raw).replace('T', ' ');
        int split = t.indexOf(' ');
        if (split < 0) {
            throw new ValidationException("Invalid " + field + ": '" + raw + "'. Use YYYY-MM-DD HH:mm.");
        }
        return LocalDateTime.of(parseDate(t.substring(0, split), field), parseTime(t.substring(split + 1), field));
    }

    /**
     * Upper-cases the meridiem, turns {@code 4.30pm} into {@code 4:30 PM} and drops any
     * trailing range ({@code "10:00 to 10:30"}).
     */
    static String normalizeTime(String time) {
        if (StringUtils.isBlank(time)) return null;

        String t = StringUtils.normalizeSpace(time).replace('.', ':').toUpperCase(Locale.ENGLISH);

        if (t.contains(" TO ")) {
            t = t.substring(0, t.indexOf(" TO ")).trim();
        }

        if (t.matches("\\d{1,2}:\\d{2}\\s*(AM|PM)")) {
            return t.replaceAll("\\s*(AM|PM)$", " $1");
        }
        return t;
    }
}
