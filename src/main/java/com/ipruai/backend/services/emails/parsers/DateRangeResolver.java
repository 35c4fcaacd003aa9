package com.ipruai.backend.services.emails.parsers;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.ipruai.backend.config.ParserProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves the requested statement period from an email.
 *
 * Expression classes are tried from the most to the least specific: "as on" dates, explicit
 * ranges, whole months, fiscal years, relative periods (also with misspelled period words),
 * stand-alone dates, and finally the default range.
 * Within a class the first occurrence in the text wins. Fragments that do not parse are skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DateRangeResolver {

    private static final String DATE = "(" + FlexibleDateParser.DATE_EXPRESSION + ")";

    private static final Pattern AS_ON_PATTERN = Pattern.compile(
            "\\bas\\s+(?:on|at|of)\\s+" + DATE);

    private static final Pattern RANGE_PATTERN = Pattern.compile(
            "\\b(?:from|between)\\s+" + DATE + "\\s*(?:to|till|until|upto|up\\s+to|and|-)\\s*" + DATE);

    private static final Pattern OPEN_RANGE_PATTERN = Pattern.compile(
            "\\b(?:from|since)\\s+" + DATE);

    private static final Pattern MONTH_YEAR_PATTERN = Pattern.compile(
            "(?<!\\d(?:st|nd|rd|th)?[-\\s/.,]{0,2})(?<![a-z0-9])(" + FlexibleDateParser.MONTH + ")"
                    + "(?:[-\\s/.,]*(\\d{4})|[-\\s]*'(\\d{2}))(?![a-z0-9])");

    private static final Pattern STANDALONE_DATE_PATTERN = Pattern.compile(DATE);

    private static final String FY = "(?:fy|f\\.y\\.|financial\\s+year|fiscal\\s+year)";

    private static final Pattern FISCAL_YEAR_PATTERN = Pattern.compile(
            "\\b(?:(current|this|last|previous|prev|next)\\s+" + FY
                    + "|" + FY + "\\s*'?(\\d{4}|\\d{2})(?:\\s*[-/]\\s*(\\d{4}|\\d{2}))?)(?![a-z0-9])");

    private static final String NUMBER = "(\\d{1,3}|one|two|three|four|five|six|seven|eight|nine|ten|eleven|twelve)";

    private static final Pattern RELATIVE_PATTERN = Pattern.compile(
            "\\b(?:"
                    + "(?:last|past|previous)\\s+" + NUMBER + "\\s+(day|week|month|year)s?"
                    + "|(last|previous|past)\\s+(month|quarter|year|week)"
                    + "|(current|this)\\s+(month|quarter|year)"
                    + "|(ytd|year\\s+to\\s+date|mtd|month\\s+to\\s+date|qtd|quarter\\s+to\\s+date)"
                    + ")\\b");

    /** Words of fiscal and relative expressions that are corrected when misspelled. */
    private static final Set<String> PERIOD_WORDS = Set.of(
            "current", "this", "last", "past", "previous", "next",
            "day", "days", "week", "weeks", "month", "months", "quarter", "quarters", "year", "years",
            "financial", "fiscal");

    private static final Map<String, Integer> NUMBER_WORDS = Map.ofEntries(
            Map.entry("one", 1), Map.entry("two", 2), Map.entry("three", 3), Map.entry("four", 4),
            Map.entry("five", 5), Map.entry("six", 6), Map.entry("seven", 7), Map.entry("eight", 8),
            Map.entry("nine", 9), Map.entry("ten", 10), Map.entry("eleven", 11), Map.entry("twelve", 12));

    private final Clock clock;
    private final ParserProperties parserProperties;

    public DateRange resolve(NormalizedText text) {
        return resolve(text, LocalDate.now(clock));
    }

    DateRange resolve(NormalizedText text, LocalDate today) {
        String t = text == null ? "" : text.value();

        Optional<DateRange> resolved = t.isBlank()
                ? Optional.empty()
                : resolveAsOn(t, today)
                        .or(() -> resolveExplicitRange(t, today))
                        .or(() -> resolveMonthYear(t))
                        .or(() -> resolveFiscalYear(t, today))
                        .or(() -> resolveRelative(t, today))
                        .or(() -> resolveMisspelledPeriod(t, today))
                        .or(() -> resolveStandaloneDates(t, today));

        DateRange range = resolved.orElseGet(() -> defaultRange(today));
        log.debug("[DateRange] {} -> {} ({})", range.from(), range.to(), range.provenance().tag());
        return range;
    }

    public DateRange defaultRange(LocalDate today) {
        return DateRange.defaultRange(parserProperties.getDefaultFromDate(), today.minusDays(1));
    }

    Optional<DateRange> resolveAsOn(String text, LocalDate today) {
        Matcher m = AS_ON_PATTERN.matcher(text);
        while (m.find()) {
            Optional<LocalDate> date = FlexibleDateParser.parse(m.group(1), today);
            if (date.isPresent()) {
                return Optional.of(DateRange.single(date.get()));
            }
        }
        return Optional.empty();
    }

    Optional<DateRange> resolveExplicitRange(String text, LocalDate today) {
        Matcher m = RANGE_PATTERN.matcher(text);
        while (m.find()) {
            Optional<LocalDate> from = FlexibleDateParser.parse(m.group(1), today);
            Optional<LocalDate> to = FlexibleDateParser.parse(m.group(2), today);
            if (from.isPresent() && to.isPresent()) {
                return Optional.of(DateRange.ordered(from.get(), to.get(), DateProvenance.EXPLICIT_RANGE));
            }
        }

        m = OPEN_RANGE_PATTERN.matcher(text);
        while (m.find()) {
            Optional<LocalDate> from = FlexibleDateParser.parse(m.group(1), today);
            if (from.isPresent() && !from.get().isAfter(today)) {
                return Optional.of(new DateRange(from.get(), today, DateProvenance.EXPLICIT_RANGE));
            }
        }
        return Optional.empty();
    }

    /**
     * "March 2024" or "mar'24": the whole calendar month.
     */
    Optional<DateRange> resolveMonthYear(String text) {
        Matcher m = MONTH_YEAR_PATTERN.matcher(text);
        while (m.find()) {
            int month = FlexibleDateParser.monthOf(m.group(1));
            String rawYear = m.group(2) != null ? m.group(2) : m.group(3);
            int year = FlexibleDateParser.expandYear(Integer.parseInt(rawYear));
            if (month < 1 || year < FlexibleDateParser.MIN_YEAR || year > FlexibleDateParser.MAX_YEAR) continue;

            YearMonth ym = YearMonth.of(year, month);
            return Optional.of(new DateRange(ym.atDay(1), ym.atEndOfMonth(), DateProvenance.EXPLICIT_RANGE));
        }
        return Optional.empty();
    }

    Optional<DateRange> resolveFiscalYear(String text, LocalDate today) {
        Matcher m = FISCAL_YEAR_PATTERN.matcher(text);
        while (m.find()) {
            int startYear;
            String relative = m.group(1);
            if (relative != null) {
                int current = fiscalStartYear(today);
                startYear = switch (relative) {
                    case "last", "previous", "prev" -> current - 1;
                    case "next" -> current + 1;
                    default -> current;
                };
            } else {
                int first = FlexibleDateParser.expandYear(Integer.parseInt(m.group(2)));
                // "FY24" alone names the fiscal year that ends in 2024.
                startYear = m.group(3) != null ? first : first - 1;
            }

            if (startYear >= FlexibleDateParser.MIN_YEAR - 1 && startYear < FlexibleDateParser.MAX_YEAR) {
                return Optional.of(fiscalYear(startYear));
            }
        }
        return Optional.empty();
    }

    Optional<DateRange> resolveRelative(String text, LocalDate today) {
        Matcher m = RELATIVE_PATTERN.matcher(text);
        if (!m.find()) {
            return Optional.empty();
        }

        if (m.group(1) != null) {
            int n = parseCount(m.group(1));
            LocalDate from = switch (m.group(2)) {
                case "day" -> today.minusDays(n);
                case "week" -> today.minusWeeks(n);
                case "month" -> today.minusMonths(n);
                default -> today.minusYears(n);
            };
            return Optional.of(new DateRange(from, today, DateProvenance.RELATIVE));
        }

        if (m.group(3) != null) {
            return Optional.of(previousPeriod(m.group(4), today));
        }

        if (m.group(5) != null) {
            return Optional.of(new DateRange(periodStart(m.group(6), today), today, DateProvenance.RELATIVE));
        }

        String toDate = m.group(7).replaceAll("\\s+", " ");
        String period = switch (toDate) {
            case "ytd", "year to date" -> "year";
            case "mtd", "month to date" -> "month";
            default -> "quarter";
        };
        return Optional.of(new DateRange(periodStart(period, today), today, DateProvenance.RELATIVE));
    }

    /**
     * Retries fiscal and relative expressions after correcting typos in period words ("lst quater").
     */
    Optional<DateRange> resolveMisspelledPeriod(String text, LocalDate today) {
        ParserProperties.Fuzzy fuzzy = parserProperties.getFuzzy();
        if (!fuzzy.isEnabled()) {
            return Optional.empty();
        }
        String corrected = FuzzyMatcher.correct(text, PERIOD_WORDS, fuzzy.getDateWordThreshold());
        if (corrected.equals(text)) {
            return Optional.empty();
        }

        Optional<DateRange> range = resolveFiscalYear(corrected, today).or(() -> resolveRelative(corrected, today));
        range.ifPresent(r -> log.debug("[DateRange] period words corrected: '{}'", corrected));
        return range;
    }

    Optional<DateRange> resolveStandaloneDates(String text, LocalDate today) {
        List<LocalDate> dates = new ArrayList<>();
        Matcher m = STANDALONE_DATE_PATTERN.matcher(text);
        while (m.find()) {
            String fragment = m.group(1);
            // Bare "today" / "yesterday" are urgency words more often than periods.
            if (fragment.equals("today") || fragment.equals("yesterday")) continue;
            FlexibleDateParser.parse(fragment, today).ifPresent(dates::add);
        }

        if (dates.isEmpty()) {
            return Optional.empty();
        }
        if (dates.size() == 1) {
            LocalDate only = dates.get(0);
            LocalDate start = parserProperties.getDefaultFromDate();
            return Optional.of(DateRange.ordered(start, only, DateProvenance.EXPLICIT_RANGE));
        }

        LocalDate min = dates.stream().min(LocalDate::compareTo).orElseThrow();
        LocalDate max = dates.stream().max(LocalDate::compareTo).orElseThrow();
        return Optional.of(new DateRange(min, max, DateProvenance.EXPLICIT_RANGE));
    }

    /**
     * Fiscal year starting on April 1st of {@code startYear}.
     */
    static DateRange fiscalYear(int startYear) {
        return new DateRange(LocalDate.of(startYear, 4, 1), LocalDate.of(startYear + 1, 3, 31), DateProvenance.FISCAL_YEAR);
    }

    static int fiscalStartYear(LocalDate date) {
        return date.getMonthValue() >= 4 ? date.getYear() : date.getYear() - 1;
    }

    private DateRange previousPeriod(String unit, LocalDate today) {
        return switch (unit) {
            case "month" -> {
                LocalDate previous = today.minusMonths(1);
                yield new DateRange(previous.withDayOfMonth(1), previous.with(TemporalAdjusters.lastDayOfMonth()), DateProvenance.RELATIVE);
            }
            case "quarter" -> {
                LocalDate start = quarterStart(today).minusMonths(3);
                yield new DateRange(start, start.plusMonths(3).minusDays(1), DateProvenance.RELATIVE);
            }
            case "week" -> {
                LocalDate monday = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).minusWeeks(1);
                yield new DateRange(monday, monday.plusDays(6), DateProvenance.RELATIVE);
            }
            default -> new DateRange(
                    LocalDate.of(today.getYear() - 1, 1, 1),
                    LocalDate.of(today.getYear() - 1, 12, 31),
                    DateProvenance.RELATIVE);
        };
    }

    private LocalDate periodStart(String unit, LocalDate today) {
        return switch (unit) {
            case "month" -> today.withDayOfMonth(1);
            case "quarter" -> quarterStart(today);
            default -> today.withDayOfYear(1);
        };
    }

    private static LocalDate quarterStart(LocalDate date) {
        int firstMonth = ((date.getMonthValue() - 1) / 3) * 3 + 1;
        return LocalDate.of(date.getYear(), firstMonth, 1);
    }

    private static int parseCount(String value) {
        Integer word = NUMBER_WORDS.get(value.toLowerCase(Locale.ROOT));
        return word != null ? word : Integer.parseInt(value);
    }
}
