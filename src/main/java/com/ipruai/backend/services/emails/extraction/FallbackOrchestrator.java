package com.ipruai.backend.services.emails.extraction;

import java.util.List;

import org.springframework.stereotype.Component;

import com.ipruai.backend.services.ai.ModelPrediction;
import com.ipruai.backend.services.ai.StatementModelException;
import com.ipruai.backend.services.ai.StatementModelInvoker;
import com.ipruai.backend.services.emails.parsers.NormalizedText;
import com.ipruai.backend.services.emails.quality.ConfidenceScore;
import com.ipruai.backend.services.emails.quality.ConfidenceScorer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Threshold-gated second pass through the statistical classifier.
 *
 * A model failure of any kind degrades to RULE_SUFFICIENT: the rule-based result with parsing
 * method {@code rule_based}, the attempted state and the skip reason recorded. It never fails
 * the request.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FallbackOrchestrator {

    private final ModelFallbackStrategy fallbackStrategy;
    private final StatementModelInvoker modelInvoker;
    private final ResultMerger resultMerger;
    private final ConfidenceScorer confidenceScorer;

    public FallbackOutcome resolve(NormalizedText text, ExtractionCandidate rule, ConfidenceScore ruleScore) {
        FallbackState state = fallbackStrategy.decide(ruleScore.overall());
        log.info("[Fallback] {}", fallbackStrategy.describe(state, ruleScore.overall()));

        if (!state.callsModel()) {
            return FallbackOutcome.ruleOnly(state, rule, ruleScore);
        }

        ModelPrediction prediction;
        try {
            prediction = modelInvoker.invoke(text);
        } catch (StatementModelException e) {
            log.warn("[Fallback] Model skipped in state {} (timedOut={}), degrading to {}: {}",
                    state, e.isTimedOut(), FallbackState.RULE_SUFFICIENT, e.getMessage());
            return FallbackOutcome.skipped(state, rule, ruleScore, e.getMessage());
        }

        ExtractionCandidate modelCandidate = resultMerger.toCandidate(prediction);
        ExtractionCandidate merged = resultMerger.merge(rule, modelCandidate, state);

        Double modelConfidence = labelsKept(prediction, modelCandidate, merged) ? prediction.confidence() : null;
        ConfidenceScore score = confidenceScorer.score(
                merged.statements(), merged.dateRange(), merged.identifiers(), modelConfidence);

        log.info("[Fallback] {} -> {} (rule score {}, final {})",
                state, state.parsingMethod(), ruleScore.overall(), score.overall());
        return new FallbackOutcome(state, state, state.parsingMethod(), merged, score, true, false, null);
    }

    /**
     * The model's confidence counts only when every label it predicted survived the merge.
     */
    private static boolean labelsKept(ModelPrediction prediction, ExtractionCandidate model, ExtractionCandidate merged) {
        if (prediction.labels().isEmpty() || model.statements().isEmpty()) {
            return false;
        }
        if (model.statements().types().size() != prediction.labels().size()) {
            return false;
        }
        for (String category : model.statements().categories()) {
            List<String> types = List.copyOf(model.statements().typesOf(category).keySet());
            for (String type : types) {
                if (!merged.statements().contains(category, type)) {
                    return false;
                }
            }
        }
        return true;
    }
}
