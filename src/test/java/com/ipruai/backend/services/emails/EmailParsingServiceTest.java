package com.ipruai.backend.services.emails;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import com.ipruai.backend.audit.ParseOutcomeRecorder;
import com.ipruai.backend.exceptions.EmailInputException;
import com.ipruai.backend.services.ai.LocalStatementModel;
import com.ipruai.backend.services.ai.NoopStatementModelClient;
import com.ipruai.backend.services.ai.StatementModelClient;
import com.ipruai.backend.services.emails.extraction.FallbackState;
import com.ipruai.backend.services.emails.extraction.ParseResult;
import com.ipruai.backend.services.emails.extraction.ParsingMethod;
import com.ipruai.backend.services.emails.parsers.IdentifierKind;
import com.ipruai.backend.support.ParserFixtures;

class EmailParsingServiceTest {

    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final List<ParseResult> recorded = new ArrayList<>();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private EmailParsingService service(StatementModelClient client) {
        return ParserFixtures.parsingService(ParserFixtures.clock(), client, executor, recorded::add);
    }

    private static StatementModelClient localModel() {
        return LocalStatementModel.load(new ClassPathResource("model/statement-model.json"), ParserFixtures.mapper());
    }

    @Test
    void parse_completeRequestIsRuleBased() {
        ParseResult result = service(localModel()).parse(
                "PMS Statement Request",
                "Send me portfolio statement as on 15-Mar-2024 for PAN ABCDE1234F and DI D0131848");

        assertEquals(List.of("PMS"), result.getStatements().categories());
        assertEquals(List.of("Portfolio_Appraisal"), result.getStatements().types());
        assertEquals(List.of("ABCDE1234F"), result.getIdentifiers().get(IdentifierKind.PAN));
        assertEquals(List.of("D0131848"), result.getIdentifiers().get(IdentifierKind.DI_CODE));
        assertEquals(LocalDate.of(2024, 3, 15), result.getDateRange().from());
        assertEquals(LocalDate.of(2024, 3, 15), result.getDateRange().to());
        assertEquals(ParsingMethod.RULE_BASED, result.getParsingMethod());
        assertTrue(result.getConfidence().overall() >= 80.0);

        assertEquals(FallbackState.RULE_SUFFICIENT, result.getMetadata().getFallbackState());
        assertEquals("email", result.getMetadata().getDateSource());
        assertFalse(result.getMetadata().isMlInvoked());
        assertEquals(1, recorded.size());
    }

    @Test
    void parse_fiscalYearRequest() {
        ParseResult result = service(localModel()).parse(
                "Statements", "Send all statements for PAN ABCDE1234F FY 23-24");

        assertEquals(List.of("PMS", "AIF"), result.getStatements().categories());
        assertEquals(LocalDate.of(2023, 4, 1), result.getDateRange().from());
        assertEquals(LocalDate.of(2024, 3, 31), result.getDateRange().to());
        assertEquals("fiscal-year", result.getMetadata().getDateProvenance());
    }

    @Test
    void parse_vagueRequestFallsBackToModel() {
        ParseResult result = service(localModel()).parse(null, "please send statement");

        assertEquals(ParsingMethod.ML_FALLBACK, result.getParsingMethod());
        assertEquals(List.of("Portfolio_Appraisal"), result.getStatements().types());
        assertEquals(LocalDate.of(1990, 1, 1), result.getDateRange().from());
        assertEquals(LocalDate.of(2025, 8, 10), result.getDateRange().to());
        assertEquals("default", result.getMetadata().getDateSource());
        assertTrue(result.getMetadata().isMlInvoked());
        assertEquals("sample-1.0", result.getMetadata().getModelVersion());
        assertEquals(21.99, result.getConfidence().overall(), 0.01);
    }

    @Test
    void parse_withoutModelDegradesToRules() {
        ParseResult result = service(new NoopStatementModelClient()).parse(null, "please send statement");

        assertEquals(ParsingMethod.RULE_BASED, result.getParsingMethod());
        assertTrue(result.getStatements().isEmpty());
        assertTrue(result.getMetadata().isMlSkipped());
        assertFalse(result.getMetadata().isMlInvoked());
        assertNotNull(result.getMetadata().getMlSkipReason());
        assertEquals(FallbackState.RULE_SUFFICIENT, result.getMetadata().getFallbackState());
        assertEquals(FallbackState.ML_FALLBACK, result.getMetadata().getAttemptedState());
    }

    @Test
    void parse_aifDroppedForDiCodeOnly() {
        ParseResult result = service(localModel()).parse(
                "All Statements", "Send all statements for DI D0131848 for FY 2023-24");

        assertEquals(List.of("PMS"), result.getStatements().categories());
        assertEquals(1, result.getMetadata().getBusinessRules().size());
    }

    @Test
    void parse_concurrentRequestsOnOneInstance() throws Exception {
        ExecutorService modelPool = Executors.newFixedThreadPool(8);
        ExecutorService callers = Executors.newFixedThreadPool(8);
        List<ParseResult> shared = new CopyOnWriteArrayList<>();
        try {
            EmailParsingService service = ParserFixtures.parsingService(
                    ParserFixtures.clock(), localModel(), modelPool, shared::add);
            Callable<ParseResult> complete = () -> service.parse(
                    "PMS Statement Request",
                    "Send me portfolio statement as on 15-Mar-2024 for PAN ABCDE1234F and DI D0131848");
            Callable<ParseResult> vague = () -> service.parse(null, "please send statement");

            List<Callable<ParseResult>> calls = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                calls.add(i % 2 == 0 ? complete : vague);
            }
            List<Future<ParseResult>> futures = callers.invokeAll(calls);

            for (int i = 0; i < futures.size(); i++) {
                ParseResult result = futures.get(i).get();
                ParsingMethod expected = i % 2 == 0 ? ParsingMethod.RULE_BASED : ParsingMethod.ML_FALLBACK;
                assertEquals(expected, result.getParsingMethod());
                assertEquals(List.of("Portfolio_Appraisal"), result.getStatements().types());
            }
            assertEquals(40, shared.size());
        } finally {
            callers.shutdownNow();
            modelPool.shutdownNow();
        }
    }

    @Test
    void parse_rejectsEmptyInput() {
        EmailParsingService service = service(localModel());

        assertThrows(EmailInputException.class, () -> service.parse("  ", null));
        assertThrows(EmailInputException.class, () -> service.parse(null, ""));
        assertTrue(recorded.isEmpty());
    }

    @Test
    void parse_recorderFailureDoesNotFailRequest() {
        ParseOutcomeRecorder failing = r -> {
            throw new IllegalStateException("audit store down");
        };
        EmailParsingService service = ParserFixtures.parsingService(
                ParserFixtures.clock(), localModel(), executor, failing);

        ParseResult result = service.parse("PMS Statement Request", "Send SOA for PAN ABCDE1234F");

        assertEquals(List.of("Portfolio_Appraisal"), result.getStatements().types());
    }

    @Test
    void parse_keepsOriginalText() {
        ParseResult result = service(localModel()).parse("Bank Book", "Need bank book for D0131848");

        assertEquals("Subject: Bank Book\nBody: Need bank book for D0131848", result.getRawText());
        assertNotNull(result.getProcessedAt());
    }
}
