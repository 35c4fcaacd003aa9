package com.ipruai.backend.classification;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.ipruai.backend.classification.rules.StatementKeywordDictionary;
import com.ipruai.backend.classification.rules.StatementKeywordDictionary.BulkRule;
import com.ipruai.backend.classification.rules.StatementKeywordDictionary.KeywordRule;
import com.ipruai.backend.classification.rules.StatementKeywordDictionary.TypeRules;
import com.ipruai.backend.config.ParserProperties;
import com.ipruai.backend.services.emails.parsers.FuzzyMatcher;
import com.ipruai.backend.services.emails.parsers.NormalizedText;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Rule-based statement classifier.
 *
 * Pipeline:
 * 1) Bulk phrases ("all statements") select every type of the named categories.
 * 2) Per type, each distinct keyword hit adds its weight, capped at 1.0 after each addition.
 *    A keyword that only matches with a typo adds a reduced share of its weight.
 * 3) A type is kept when its weight is strictly above the minimum type weight.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatementClassifier {

    private final StatementKeywordDictionary dictionary;
    private final ParserProperties parserProperties;

    public StatementSelection classify(NormalizedText text) {
        Map<String, Map<String, Double>> scores = score(text);
        double min = parserProperties.getMinTypeWeight();

        StatementSelection.Builder selected = StatementSelection.builder();
        scores.forEach((category, types) -> types.forEach((type, weight) -> {
            if (weight > min) {
                selected.putMax(category, type, weight);
            }
        }));

        StatementSelection result = selected.build();
        log.debug("[StatementClassifier] categories={} types={} maxWeight={}",
                result.categories(), result.types(), result.maxWeight());
        return result;
    }

    /**
     * Accumulated weight of every configured type, including the ones under the inclusion threshold.
     */
    public Map<String, Map<String, Double>> score(NormalizedText text) {
        if (text == null || text.isEmpty()) {
            return new LinkedHashMap<>();
        }
        String value = text.value();
        List<String> tokens = FuzzyMatcher.tokens(value);

        List<String> bulkCategories = new ArrayList<>();
        for (BulkRule bulk : dictionary.bulkRules()) {
            if (bulk.matches(value)) {
                log.debug("[StatementClassifier] bulk phrase '{}' -> {}", bulk.phrase(), bulk.categories());
                bulkCategories.addAll(bulk.categories());
            }
        }

        StatementSelection.Builder scores = StatementSelection.builder();
        for (String category : dictionary.categories()) {
            for (TypeRules rules : dictionary.types(category)) {
                scores.putMax(category, rules.type(), 0.0);
                if (bulkCategories.contains(category)) {
                    scores.putMax(category, rules.type(), StatementSelection.MAX_WEIGHT);
                    continue;
                }
                accumulate(scores, rules, value, tokens);
            }
        }
        return new LinkedHashMap<>(scores.build().asMap());
    }

    private void accumulate(StatementSelection.Builder scores, TypeRules rules, String text, List<String> tokens) {
        ParserProperties.Fuzzy fuzzy = parserProperties.getFuzzy();
        for (KeywordRule keyword : rules.keywords()) {
            double gain;
            if (keyword.matches(text)) {
                gain = keyword.weight();
            } else if (fuzzy.isEnabled() && keyword.keyword().length() >= fuzzy.getMinKeywordLength()) {
                double similarity = FuzzyMatcher.bestPhraseSimilarity(tokens, keyword.tokens());
                double threshold = keyword.primary() ? fuzzy.getPrimaryThreshold() : fuzzy.getSecondaryThreshold();
                if (similarity < threshold) continue;
                gain = keyword.weight() * similarity * fuzzy.getWeightFactor();
                log.debug("[StatementClassifier] {}/{} fuzzy hit '{}' similarity={}",
                        rules.category(), rules.type(), keyword.keyword(), similarity);
            } else {
                continue;
            }
            scores.accumulate(rules.category(), rules.type(), gain);
            log.debug("[StatementClassifier] {}/{} hit '{}' (+{})",
                    rules.category(), rules.type(), keyword.keyword(), gain);
        }
    }
}
