package com.culicidaelab.geo;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;

/**
 * Strict {@code YYYY-MM-DD} calendar dates
 */
public final class IsoDates {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    private IsoDates() {
    }

    /**
     * @throws DateTimeParseException if the text is not an existing date in {@code YYYY-MM-DD} form
     */
    public static LocalDate parse(String text) {
        return LocalDate.parse(text, FORMAT);
    }

    /**
     * Parse a stored value, empty when it is missing or not a strict date
     */
    public static Optional<LocalDate> tryParse(Object value) {
        if (!(value instanceof String)) {
            return Optional.empty();
        }
        try {
            return Optional.of(parse((String) value));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Date part of an ISO date or date-time string, cut at {@code T}
     */
    public static String datePart(String value) {
        if (value == null) {
            return null;
        }
        int separator = value.indexOf('T');
        return separator >= 0 ? value.substring(0, separator) : value;
    }

    public static String format(LocalDate date) {
        return date.format(FORMAT);
    }
}
