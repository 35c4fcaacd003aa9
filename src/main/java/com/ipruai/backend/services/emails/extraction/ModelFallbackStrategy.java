package com.ipruai.backend.services.emails.extraction;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Estratégia de decisão para fallback ao classificador estatístico.
 *
 * score >= high          -> RULE_SUFFICIENT
 * medium <= score < high -> ML_ENHANCE
 * score < medium         -> ML_FALLBACK
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelFallbackStrategy {

    private final FallbackThresholds thresholds;

    public FallbackState decide(double ruleScore) {
        if (ruleScore >= thresholds.high()) {
            log.debug("[Fallback] Score ok ({} >= {}), no model call", ruleScore, thresholds.high());
            return FallbackState.RULE_SUFFICIENT;
        }

        if (ruleScore >= thresholds.medium()) {
            log.info("[Fallback] Score medium ({} < {}), enhancing with model", ruleScore, thresholds.high());
            return FallbackState.ML_ENHANCE;
        }

        log.info("[Fallback] Score low ({} < {}), falling back to model", ruleScore, thresholds.medium());
        return FallbackState.ML_FALLBACK;
    }

    public String describe(FallbackState state, double ruleScore) {
        return switch (state) {
            case RULE_SUFFICIENT -> String.format("Rule-based result kept (score: %.2f)", ruleScore);
            case ML_ENHANCE -> String.format("Rule-based result enhanced with model (score: %.2f)", ruleScore);
            case ML_FALLBACK -> String.format("Model result used as primary (score: %.2f)", ruleScore);
        };
    }
}
