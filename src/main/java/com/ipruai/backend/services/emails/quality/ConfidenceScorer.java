package com.ipruai.backend.services.emails.quality;

import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.ipruai.backend.classification.StatementSelection;
import com.ipruai.backend.services.emails.parsers.DateRange;
import com.ipruai.backend.services.emails.parsers.IdentifierKind;
import com.ipruai.backend.services.emails.parsers.IdentifierSet;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Avalia a confiança de uma extração de e-mail.
 * Retorna um score de 0-100 combinando três sub-scores ponderados.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfidenceScorer {

    static final double EXTRA_VALUE_BONUS = 5.0;

    private final ConfidenceWeights weights;

    public ConfidenceScore score(StatementSelection statements, DateRange dateRange, IdentifierSet identifiers) {
        return score(statements, dateRange, identifiers, null);
    }

    /**
     * @param modelConfidence when given, the statement sub-score is the higher of the rule weight and this value
     */
    public ConfidenceScore score(StatementSelection statements,
                                 DateRange dateRange,
                                 IdentifierSet identifiers,
                                 Double modelConfidence) {

        double statementScore = statementScore(statements);
        if (modelConfidence != null) {
            statementScore = Math.max(statementScore, clamp(modelConfidence));
        }
        double dateScore = dateRange != null ? dateRange.provenance().confidence() : 0.0;
        double identifierScore = identifierScore(identifiers);

        double overall = statementScore * weights.statementType()
                + dateScore * weights.dateParsing()
                + identifierScore * weights.identifiers();
        overall = round(clamp(overall));

        log.debug("[ConfidenceScorer] statement={} date={} identifiers={} model={} -> {}",
                statementScore, dateScore, identifierScore, modelConfidence, overall);

        return new ConfidenceScore(overall, round(statementScore), round(dateScore), round(identifierScore), modelConfidence);
    }

    static double statementScore(StatementSelection statements) {
        if (statements == null || statements.isEmpty()) return 0.0;
        return clamp(statements.maxWeight() * 100.0);
    }

    /**
     * Presence score of every kind found, plus a small bonus per additional value of the same kind.
     */
    static double identifierScore(IdentifierSet identifiers) {
        if (identifiers == null || identifiers.isEmpty()) return 0.0;

        double score = 0.0;
        for (Map.Entry<IdentifierKind, List<String>> e : identifiers.asMap().entrySet()) {
            int count = e.getValue().size();
            if (count == 0) continue;
            score += e.getKey().presenceScore() + EXTRA_VALUE_BONUS * (count - 1);
        }
        return clamp(score);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
