package com.ipruai.backend.services.emails.extraction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.ipruai.backend.classification.StatementSelection;
import com.ipruai.backend.classification.rules.StatementKeywordDictionary;
import com.ipruai.backend.config.ModelProperties;
import com.ipruai.backend.config.ParserProperties;
import com.ipruai.backend.services.ai.ModelPrediction;
import com.ipruai.backend.services.emails.parsers.DateProvenance;
import com.ipruai.backend.services.emails.parsers.DateRange;
import com.ipruai.backend.services.emails.parsers.IdentifierRules;
import com.ipruai.backend.services.emails.parsers.IdentifierSet;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reconciles the rule-based candidate with the model candidate, field by field.
 *
 * Identifiers are united; model values are admitted only when they satisfy the identifier format
 * rules. The rule-based date range is kept unless it is the default range. Statement labels are
 * reconciled per category: a category only one source selected takes that source's labels;
 * matching label sets are united; differing sets go to the source whose best weight is higher by
 * more than the conflict margin, and are united otherwise.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResultMerger {

    private final StatementKeywordDictionary dictionary;
    private final IdentifierRules identifierRules;
    private final StatementEligibilityPolicy eligibilityPolicy;
    private final ParserProperties parserProperties;
    private final ModelProperties modelProperties;

    /**
     * Turns a model prediction into a candidate: unknown labels and malformed identifiers are
     * dropped, and a date range below the date-confidence floor is ignored.
     */
    public ExtractionCandidate toCandidate(ModelPrediction prediction) {
        if (prediction == null) {
            return new ExtractionCandidate(IdentifierSet.empty(), null, StatementSelection.empty(), List.of());
        }

        StatementSelection.Builder statements = StatementSelection.builder();
        for (ModelPrediction.PredictedLabel label : prediction.labels()) {
            if (label == null || !dictionary.contains(label.category(), label.type())) {
                log.debug("[Merge] Discarding unknown model label {}", label);
                continue;
            }
            statements.putMax(label.category(), label.type(), label.probability());
        }

        IdentifierSet.Builder identifiers = IdentifierSet.builder();
        prediction.identifiers().forEach((kind, values) -> {
            for (String value : values) {
                if (identifierRules.isValid(kind, value)) {
                    identifiers.add(kind, IdentifierRules.canonical(value));
                } else {
                    log.debug("[Merge] Discarding invalid model {} '{}'", kind, value);
                }
            }
        });

        DateRange dateRange = null;
        if (prediction.hasDateRange() && prediction.dateConfidence() >= modelProperties.getMinDateConfidence()) {
            DateProvenance provenance = prediction.fromDate().equals(prediction.toDate())
                    ? DateProvenance.EXPLICIT_SINGLE
                    : DateProvenance.EXPLICIT_RANGE;
            dateRange = DateRange.ordered(prediction.fromDate(), prediction.toDate(), provenance);
        }

        return new ExtractionCandidate(identifiers.build(), dateRange, statements.build(), List.of());
    }

    public ExtractionCandidate merge(ExtractionCandidate rule, ExtractionCandidate model, FallbackState state) {
        if (model == null) {
            return rule;
        }

        IdentifierSet identifiers = rule.identifiers().union(
                model.identifiers().filter(identifierRules::isValid));

        DateRange dateRange = mergeDates(rule.dateRange(), model.dateRange());

        StatementSelection statements = mergeStatements(rule.statements(), model.statements(), state);

        List<String> notes = new ArrayList<>(rule.businessRules());
        notes.addAll(model.businessRules());

        ExtractionCandidate merged = eligibilityPolicy.apply(
                new ExtractionCandidate(identifiers, dateRange, statements, notes));

        log.debug("[Merge] state={} categories={} types={} date={}",
                state, merged.statements().categories(), merged.statements().types(), merged.dateRange());
        return merged;
    }

    DateRange mergeDates(DateRange rule, DateRange model) {
        if (rule == null) return model;
        if (rule.isDefault() && model != null && !model.isDefault()) {
            log.info("[Merge] Using model date range {} -> {} over default range", model.from(), model.to());
            return model;
        }
        return rule;
    }

    StatementSelection mergeStatements(StatementSelection rule, StatementSelection model, FallbackState state) {
        StatementSelection.Builder out = StatementSelection.builder();
        double min = parserProperties.getMinTypeWeight();
        double margin = parserProperties.getConflictMargin();

        for (String category : dictionary.categories()) {
            Map<String, Double> r = rule.typesOf(category);
            Map<String, Double> m = model.typesOf(category);
            if (state == FallbackState.ML_ENHANCE) {
                m = aboveThreshold(m, r, min);
            }

            if (r.isEmpty() && m.isEmpty()) continue;

            if (m.isEmpty()) {
                out.putAll(category, r);
            } else if (r.isEmpty()) {
                out.putAll(category, m);
            } else if (r.keySet().equals(m.keySet())) {
                out.putAll(category, r).putAll(category, m);
            } else {
                double ruleMax = rule.maxWeight(category);
                double modelMax = maxOf(m);
                if (modelMax - ruleMax > margin) {
                    log.info("[Merge] {}: model labels {} win ({} vs {})", category, m.keySet(), modelMax, ruleMax);
                    out.putAll(category, m);
                } else if (ruleMax - modelMax > margin) {
                    log.info("[Merge] {}: rule labels {} win ({} vs {})", category, r.keySet(), ruleMax, modelMax);
                    out.putAll(category, r);
                } else {
                    out.putAll(category, r).putAll(category, m);
                }
            }
        }
        return out.build();
    }

    /**
     * Model labels that the rules did not select must clear the inclusion threshold on their own.
     */
    private static Map<String, Double> aboveThreshold(Map<String, Double> model, Map<String, Double> rule, double min) {
        Map<String, Double> kept = new LinkedHashMap<>();
        model.forEach((type, weight) -> {
            if (rule.containsKey(type) || weight > min) {
                kept.put(type, weight);
            }
        });
        return kept;
    }

    private static double maxOf(Map<String, Double> types) {
        return types.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
    }
}
