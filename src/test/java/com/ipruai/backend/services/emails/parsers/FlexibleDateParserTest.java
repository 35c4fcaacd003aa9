package com.ipruai.backend.services.emails.parsers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.Optional;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

class FlexibleDateParserTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 8, 11);

    @ParameterizedTest
    @ValueSource(strings = {
            "15-mar-2024", "15 march 2024", "15th march, 2024", "march 15, 2024",
            "15/03/2024", "15.03.24", "2024-03-15", "15-mar-24"
    })
    void parse_acceptsCommonEmailFormats(String fragment) {
        assertEquals(Optional.of(LocalDate.of(2024, 3, 15)), FlexibleDateParser.parse(fragment, TODAY));
    }

    @Test
    void parse_partialDateUsesCurrentYearUnlessInFuture() {
        assertEquals(Optional.of(LocalDate.of(2025, 3, 15)), FlexibleDateParser.parse("15/03", TODAY));
        assertEquals(Optional.of(LocalDate.of(2024, 12, 15)), FlexibleDateParser.parse("15-dec", TODAY));
    }

    @Test
    void parse_relativeWords() {
        assertEquals(Optional.of(TODAY), FlexibleDateParser.parse("today", TODAY));
        assertEquals(Optional.of(TODAY.minusDays(1)), FlexibleDateParser.parse("yesterday", TODAY));
    }

    @Test
    void parse_rejectsImpossibleDatesAndYearsOutOfWindow() {
        assertTrue(FlexibleDateParser.parse("31-02-2024", TODAY).isEmpty());
        assertTrue(FlexibleDateParser.parse("15-03-1985", TODAY).isEmpty());
        assertTrue(FlexibleDateParser.parse("not a date", TODAY).isEmpty());
    }

    @Test
    void expandYear_pivotsAtFifty() {
        assertEquals(2024, FlexibleDateParser.expandYear(24));
        assertEquals(1999, FlexibleDateParser.expandYear(99));
        assertEquals(2031, FlexibleDateParser.expandYear(2031));
    }

    @Test
    void parse_partialLeapDayFindsLatestLeapYear() {
        assertEquals(Optional.of(LocalDate.of(2024, 2, 29)), FlexibleDateParser.parse("29-feb", TODAY));
        assertEquals(Optional.of(LocalDate.of(2024, 2, 29)), FlexibleDateParser.parse("29/02", LocalDate.of(2027, 1, 5)));
        assertTrue(FlexibleDateParser.parse("30-feb", TODAY).isEmpty());
    }
}
