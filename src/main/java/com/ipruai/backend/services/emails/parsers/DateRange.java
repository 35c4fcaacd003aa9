package com.ipruai.backend.services.emails.parsers;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Requested statement period; always {@code from <= to}.
 */
public record DateRange(LocalDate from, LocalDate to, DateProvenance provenance) {

    public DateRange {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(provenance, "provenance");
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from date " + from + " is after to date " + to);
        }
    }

    /**
     * Builds a range from two dates in any order.
     */
    public static DateRange ordered(LocalDate a, LocalDate b, DateProvenance provenance) {
        return a.isAfter(b) ? new DateRange(b, a, provenance) : new DateRange(a, b, provenance);
    }

    public static DateRange single(LocalDate date) {
        return new DateRange(date, date, DateProvenance.EXPLICIT_SINGLE);
    }

    public static DateRange defaultRange(LocalDate epochStart, LocalDate yesterday) {
        return ordered(epochStart, yesterday, DateProvenance.DEFAULT);
    }

    public boolean isDefault() {
        return provenance == DateProvenance.DEFAULT;
    }
}
