package com.paxkun.pulldb.util;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Parsing helpers for caller-supplied identifiers and dates.
 * Failures come back empty so batch callers can classify the item instead of aborting.
 */
public final class Identifiers {

    private static final Pattern NUMERIC_ID = Pattern.compile("\\d{1,18}");

    private Identifiers() {
    }

    /**
     * Parses a catalog identifier given as a string or a JSON number. Integral decimals such as
     * {@code 12.0} are accepted.
     */
    public static OptionalLong parseId(Object raw) {
        if (raw instanceof Integer || raw instanceof Long) {
            long value = ((Number) raw).longValue();
            return value >= 0 ? OptionalLong.of(value) : OptionalLong.empty();
        }
        if (raw instanceof Number number) {
            try {
                long value = new BigDecimal(number.toString()).longValueExact();
                return value >= 0 ? OptionalLong.of(value) : OptionalLong.empty();
            } catch (NumberFormatException | ArithmeticException e) {
                return OptionalLong.empty();
            }
        }
        if (raw == null) {
            return OptionalLong.empty();
        }
        String text = raw.toString().trim();
        if (!NUMERIC_ID.matcher(text).matches()) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(Long.parseLong(text));
    }

    /**
     * Parses an ISO date, also accepting a full timestamp and keeping only its date part.
     */
    public static Optional<LocalDate> parseDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = raw.trim();
        if (text.length() > 10 && text.charAt(10) == 'T') {
            text = text.substring(0, 10);
        }
        try {
            return Optional.of(LocalDate.parse(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Strips line breaks and markup-ish characters so caller input can't forge log lines.
     */
    public static String sanitizeForLog(Object value) {
        if (value == null) {
            return "";
        }
        return value.toString().replaceAll("[\\r\\n]", "").replaceAll("[^-\\p{Alnum}\\s_:.]", "").trim();
    }
}
