package com.ipruai.backend.services.emails.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.ipruai.backend.classification.StatementSelection;
import com.ipruai.backend.services.ai.ModelPrediction;
import com.ipruai.backend.services.ai.ModelPrediction.PredictedLabel;
import com.ipruai.backend.services.ai.StatementModelException;
import com.ipruai.backend.services.ai.StatementModelInvoker;
import com.ipruai.backend.services.emails.parsers.DateRange;
import com.ipruai.backend.services.emails.parsers.IdentifierKind;
import com.ipruai.backend.services.emails.parsers.IdentifierSet;
import com.ipruai.backend.services.emails.parsers.NormalizedText;
import com.ipruai.backend.services.emails.quality.ConfidenceScore;
import com.ipruai.backend.services.emails.quality.ConfidenceScorer;
import com.ipruai.backend.support.ParserFixtures;

@ExtendWith(MockitoExtension.class)
class FallbackOrchestratorTest {

    private static final NormalizedText TEXT = new NormalizedText("please send statement", "please send statement");
    private static final DateRange DEFAULT_RANGE =
            DateRange.defaultRange(LocalDate.of(1990, 1, 1), LocalDate.of(2025, 8, 10));

    @Mock
    private StatementModelInvoker invoker;

    private ConfidenceScorer scorer;
    private FallbackOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        scorer = ParserFixtures.scorer();
        orchestrator = new FallbackOrchestrator(ParserFixtures.fallbackStrategy(), invoker, ParserFixtures.merger(), scorer);
    }

    private ConfidenceScore score(ExtractionCandidate c) {
        return scorer.score(c.statements(), c.dateRange(), c.identifiers());
    }

    @Test
    void highRuleScore_neverCallsModel() {
        ExtractionCandidate rule = new ExtractionCandidate(
                IdentifierSet.builder()
                        .add(IdentifierKind.PAN, "ABCDE1234F")
                        .add(IdentifierKind.DI_CODE, "D0131848")
                        .build(),
                DateRange.single(LocalDate.of(2024, 3, 15)),
                StatementSelection.builder().putMax("PMS", "Portfolio_Appraisal", 1.0).build(),
                List.of());
        ConfidenceScore ruleScore = score(rule);

        FallbackOutcome outcome = orchestrator.resolve(TEXT, rule, ruleScore);

        verify(invoker, never()).invoke(any());
        assertEquals(FallbackState.RULE_SUFFICIENT, outcome.state());
        assertEquals(ParsingMethod.RULE_BASED, outcome.parsingMethod());
        assertSame(rule, outcome.candidate());
        assertSame(ruleScore, outcome.confidence());
        assertFalse(outcome.mlInvoked());
    }

    @Test
    void lowRuleScore_usesModelPrediction() {
        ExtractionCandidate rule = new ExtractionCandidate(null, DEFAULT_RANGE, null, null);
        when(invoker.invoke(TEXT)).thenReturn(ModelPrediction.labelsOnly(
                List.of(new PredictedLabel("PMS", "Portfolio_Appraisal", 0.55)), 55.0, "sample-1.0"));

        FallbackOutcome outcome = orchestrator.resolve(TEXT, rule, score(rule));

        assertEquals(FallbackState.ML_FALLBACK, outcome.state());
        assertEquals(ParsingMethod.ML_FALLBACK, outcome.parsingMethod());
        assertEquals(List.of("Portfolio_Appraisal"), outcome.candidate().statements().types());
        assertEquals(55.0, outcome.confidence().modelConfidence());
        assertTrue(outcome.mlInvoked());
        assertFalse(outcome.mlSkipped());
    }

    @Test
    void modelTimeout_degradesToRuleResult() {
        ExtractionCandidate rule = new ExtractionCandidate(null, DEFAULT_RANGE, null, null);
        ConfidenceScore ruleScore = score(rule);
        when(invoker.invoke(any())).thenThrow(StatementModelException.timeout(300));

        FallbackOutcome outcome = orchestrator.resolve(TEXT, rule, ruleScore);

        assertEquals(FallbackState.RULE_SUFFICIENT, outcome.state());
        assertEquals(FallbackState.ML_FALLBACK, outcome.attemptedState());
        assertEquals(ParsingMethod.RULE_BASED, outcome.parsingMethod());
        assertSame(rule, outcome.candidate());
        assertSame(ruleScore, outcome.confidence());
        assertTrue(outcome.mlSkipped());
        assertFalse(outcome.mlInvoked());
        assertTrue(outcome.mlSkipReason().contains("timed out"));
    }

    @Test
    void droppedModelLabel_ignoresModelConfidence() {
        ExtractionCandidate rule = new ExtractionCandidate(null, DEFAULT_RANGE, null, null);
        when(invoker.invoke(TEXT)).thenReturn(ModelPrediction.labelsOnly(
                List.of(new PredictedLabel("PMS", "Portfolio_Appraisal", 0.7),
                        new PredictedLabel("MF", "Unknown", 0.9)), 90.0, "sample-1.0"));

        FallbackOutcome outcome = orchestrator.resolve(TEXT, rule, score(rule));

        assertEquals(List.of("Portfolio_Appraisal"), outcome.candidate().statements().types());
        assertNull(outcome.confidence().modelConfidence());
        assertEquals(70.0, outcome.confidence().statementType(), 1e-9);
    }

    @Test
    void mediumRuleScore_enhancesWithModel() {
        ExtractionCandidate rule = mediumRuleCandidate();
        ConfidenceScore ruleScore = score(rule);
        when(invoker.invoke(TEXT)).thenReturn(ModelPrediction.labelsOnly(
                List.of(new PredictedLabel("PMS", "Portfolio_Appraisal", 0.95)), 95.0, "sample-1.0"));

        FallbackOutcome outcome = orchestrator.resolve(TEXT, rule, ruleScore);

        assertEquals(75.0, ruleScore.overall(), 1e-9);
        assertEquals(FallbackState.ML_ENHANCE, outcome.state());
        assertEquals(FallbackState.ML_ENHANCE, outcome.attemptedState());
        assertEquals(ParsingMethod.ML_ENHANCED, outcome.parsingMethod());
        assertEquals(0.95, outcome.candidate().statements().weight("PMS", "Portfolio_Appraisal"), 1e-9);
        assertEquals(95.0, outcome.confidence().modelConfidence());
        // 95 * 0.4 + 95 * 0.3 + 35 * 0.3
        assertEquals(77.0, outcome.confidence().overall(), 1e-9);
        assertTrue(outcome.mlInvoked());
    }

    @Test
    void mediumRuleScore_dropsWeakModelOnlyLabel() {
        ExtractionCandidate rule = mediumRuleCandidate();
        when(invoker.invoke(TEXT)).thenReturn(ModelPrediction.labelsOnly(
                List.of(new PredictedLabel("PMS", "Portfolio_Appraisal", 0.95),
                        new PredictedLabel("PMS", "Transaction_Statement", 0.3)), 95.0, "sample-1.0"));

        FallbackOutcome outcome = orchestrator.resolve(TEXT, rule, score(rule));

        assertEquals(ParsingMethod.ML_ENHANCED, outcome.parsingMethod());
        assertEquals(List.of("Portfolio_Appraisal"), outcome.candidate().statements().types());
        assertNull(outcome.confidence().modelConfidence());
    }

    private static ExtractionCandidate mediumRuleCandidate() {
        return new ExtractionCandidate(
                IdentifierSet.builder().add(IdentifierKind.DI_CODE, "D0131848").build(),
                DateRange.single(LocalDate.of(2024, 3, 15)),
                StatementSelection.builder().putMax("PMS", "Portfolio_Appraisal", 0.9).build(),
                List.of());
    }
}
