package com.ipruai.backend.services.emails.parsers;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses single calendar dates written the way clients write them in emails.
 * Numeric dates are day-first. Works on normalized (lower-case) text.
 */
public final class FlexibleDateParser {

    static final int MIN_YEAR = 1990;
    static final int MAX_YEAR = 2050;
    private static final int YEARLESS_LOOKBACK = 8;

    static final String MONTH =
            "(?:jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?|aug(?:ust)?"
                    + "|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?)";

    private static final String ORDINAL = "(?:st|nd|rd|th)?";

    /**
     * One date expression, without capturing groups, safe to embed in larger patterns.
     */
    public static final String DATE_EXPRESSION = "(?<![a-z0-9])(?:"
            + "today|yesterday"
            + "|\\d{4}-\\d{1,2}-\\d{1,2}"
            + "|\\d{1,2}[-/.]\\d{1,2}[-/.](?:\\d{4}|\\d{2})"
            + "|\\d{1,2}[-/]\\d{1,2}"
            + "|\\d{1,2}" + ORDINAL + "[-\\s/.,]*" + MONTH + "(?:[-\\s/.,']*\\d{4}|[-/.']\\d{2})?"
            + "|" + MONTH + "\\s*\\d{1,2}" + ORDINAL + "(?:,?\\s*\\d{4})?"
            + ")(?![a-z0-9])";

    private static final Pattern ISO = Pattern.compile("^(\\d{4})-(\\d{1,2})-(\\d{1,2})$");
    private static final Pattern NUMERIC = Pattern.compile("^(\\d{1,2})[-/.](\\d{1,2})(?:[-/.](\\d{2}|\\d{4}))?$");
    private static final Pattern DAY_MONTH = Pattern.compile(
            "^(\\d{1,2})" + ORDINAL + "[-\\s/.,]*(" + MONTH + ")(?:[-\\s/.,']*(\\d{4})|[-/.'](\\d{2}))?$");
    private static final Pattern MONTH_DAY = Pattern.compile(
            "^(" + MONTH + ")\\s*(\\d{1,2})" + ORDINAL + "(?:,?\\s*(\\d{4}))?$");

    private static final Map<String, Integer> MONTHS = buildMonths();

    private FlexibleDateParser() {
    }

    /**
     * @param fragment text matched by {@link #DATE_EXPRESSION}
     * @param today processing date; resolves "today", "yesterday" and dates without a year
     */
    public static Optional<LocalDate> parse(String fragment, LocalDate today) {
        if (fragment == null || fragment.isBlank()) return Optional.empty();
        String f = fragment.trim().toLowerCase(Locale.ROOT);

        if (f.equals("today")) return Optional.of(today);
        if (f.equals("yesterday")) return Optional.of(today.minusDays(1));

        Matcher m = ISO.matcher(f);
        if (m.matches()) {
            return build(toInt(m.group(1)), toInt(m.group(2)), toInt(m.group(3)));
        }

        m = NUMERIC.matcher(f);
        if (m.matches()) {
            return resolve(toInt(m.group(1)), toInt(m.group(2)), m.group(3), today);
        }

        m = DAY_MONTH.matcher(f);
        if (m.matches()) {
            String year = m.group(3) != null ? m.group(3) : m.group(4);
            return resolve(toInt(m.group(1)), monthOf(m.group(2)), year, today);
        }

        m = MONTH_DAY.matcher(f);
        if (m.matches()) {
            return resolve(toInt(m.group(2)), monthOf(m.group(1)), m.group(3), today);
        }

        return Optional.empty();
    }

    /**
     * Two-digit years are 20xx up to 50 and 19xx above.
     */
    static int expandYear(int year) {
        if (year >= 100) return year;
        return year <= 50 ? 2000 + year : 1900 + year;
    }

    private static Optional<LocalDate> resolve(int day, int month, String year, LocalDate today) {
        if (year != null) {
            return build(expandYear(toInt(year)), month, day);
        }

        // Year omitted: the latest such date that is not in the future. "29-feb" walks back to a leap year.
        for (int y = today.getYear(); y >= today.getYear() - YEARLESS_LOOKBACK; y--) {
            Optional<LocalDate> date = build(y, month, day);
            if (date.isPresent() && !date.get().isAfter(today)) {
                return date;
            }
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> build(int year, int month, int day) {
        if (year < MIN_YEAR || year > MAX_YEAR) return Optional.empty();
        try {
            return Optional.of(LocalDate.of(year, month, day));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    static int monthOf(String name) {
        if (name == null || name.length() < 3) return -1;
        Integer month = MONTHS.get(name.substring(0, 3));
        return month == null ? -1 : month;
    }

    private static int toInt(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static Map<String, Integer> buildMonths() {
        Map<String, Integer> m = new HashMap<>();
        m.put("jan", 1);
        m.put("feb", 2);
        m.put("mar", 3);
        m.put("apr", 4);
        m.put("may", 5);
        m.put("jun", 6);
        m.put("jul", 7);
        m.put("aug", 8);
        m.put("sep", 9);
        m.put("oct", 10);
        m.put("nov", 11);
        m.put("dec", 12);
        return m;
    }
}
