package com.ipruai.backend.services.emails;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.concurrent.TimeUnit;

import org.springframework.stereotype.Service;

import com.ipruai.backend.audit.ParseOutcomeRecorder;
import com.ipruai.backend.exceptions.EmailInputException;
import com.ipruai.backend.services.ai.StatementModelInvoker;
import com.ipruai.backend.services.emails.extraction.ExtractionCandidate;
import com.ipruai.backend.services.emails.extraction.FallbackOrchestrator;
import com.ipruai.backend.services.emails.extraction.FallbackOutcome;
import com.ipruai.backend.services.emails.extraction.ParseMetadata;
import com.ipruai.backend.services.emails.extraction.ParseResult;
import com.ipruai.backend.services.emails.extraction.RuleBasedExtractor;
import com.ipruai.backend.services.emails.parsers.NormalizedText;
import com.ipruai.backend.services.emails.parsers.TextNormalizer;
import com.ipruai.backend.services.emails.quality.ConfidenceScore;
import com.ipruai.backend.services.emails.quality.ConfidenceScorer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of the email parsing pipeline: normalize, extract with rules, score, then let the
 * fallback orchestrator decide whether the statistical classifier takes part.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmailParsingService {

    private final TextNormalizer textNormalizer;
    private final RuleBasedExtractor ruleBasedExtractor;
    private final ConfidenceScorer confidenceScorer;
    private final FallbackOrchestrator fallbackOrchestrator;
    private final StatementModelInvoker modelInvoker;
    private final ParseOutcomeRecorder outcomeRecorder;
    private final Clock clock;

    public ParseResult parse(String subject, String body) {
        if (isBlank(subject) && isBlank(body)) {
            throw new EmailInputException("Subject and body cannot both be empty");
        }

        long start = System.nanoTime();

        NormalizedText text = textNormalizer.normalize(subject, body);
        ExtractionCandidate rule = ruleBasedExtractor.extract(text);
        ConfidenceScore ruleScore = confidenceScorer.score(rule.statements(), rule.dateRange(), rule.identifiers());

        FallbackOutcome outcome = fallbackOrchestrator.resolve(text, rule, ruleScore);
        ExtractionCandidate finalCandidate = outcome.candidate();

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        ParseMetadata metadata = ParseMetadata.builder()
                .dateSource(finalCandidate.dateRange().isDefault() ? "default" : "email")
                .dateProvenance(finalCandidate.dateRange().provenance().tag())
                .fallbackState(outcome.state())
                .attemptedState(outcome.attemptedState())
                .mlInvoked(outcome.mlInvoked())
                .mlSkipped(outcome.mlSkipped())
                .mlSkipReason(outcome.mlSkipReason())
                .modelVersion(modelInvoker.modelVersion())
                .hasIdentifiers(!finalCandidate.identifiers().isEmpty())
                .ruleConfidence(ruleScore.overall())
                .processingTimeMs(elapsedMs)
                .businessRules(finalCandidate.businessRules())
                .build();

        ParseResult result = ParseResult.builder()
                .identifiers(finalCandidate.identifiers())
                .dateRange(finalCandidate.dateRange())
                .statements(finalCandidate.statements())
                .confidence(outcome.confidence())
                .parsingMethod(outcome.parsingMethod())
                .metadata(metadata)
                .rawText(text.original())
                .processedAt(LocalDateTime.now(clock))
                .build();

        try {
            outcomeRecorder.record(result);
        } catch (RuntimeException e) {
            log.warn("[EmailParsing] Failed to record parse outcome: {}", e.getMessage());
        }

        return result;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
