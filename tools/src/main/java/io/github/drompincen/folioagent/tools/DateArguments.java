package io.github.drompincen.folioagent.tools;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;

/**
 * Parses the date strings the model passes to tools: relative words, ISO dates and the
 * day-first UK forms.
 */
public final class DateArguments {

    private static final List<DateTimeFormatter> FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("d/M/uuuu", Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("d-M-uuuu", Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("d MMMM uuuu", Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("d MMM uuuu", Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("MMMM d, uuuu", Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT));

    private DateArguments() {}

    public static LocalDate parse(String raw, Clock clock) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Date is required");
        }
        String value = raw.trim();
        switch (value.toLowerCase(Locale.ROOT)) {
            case "today":
            case "current":
            case "now":
                return LocalDate.now(clock);
            case "yesterday":
                return LocalDate.now(clock).minusDays(1);
            case "tomorrow":
                return LocalDate.now(clock).plusDays(1);
            default:
                break;
        }
        String normalized = capitalizeMonth(value);
        DateTimeParseException last = null;
        for (DateTimeFormatter format : FORMATS) {
            try {
                return LocalDate.parse(normalized, format);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        throw new IllegalArgumentException("Invalid date format: " + raw, last);
    }

    private static String capitalizeMonth(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        boolean startOfWord = true;
        for (char c : value.toCharArray()) {
            sb.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
            startOfWord = Character.isWhitespace(c);
        }
        return sb.toString();
    }
}
