package com.ipruai.backend.classification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.ipruai.backend.config.ParserProperties;
import com.ipruai.backend.services.emails.parsers.NormalizedText;
import com.ipruai.backend.services.emails.parsers.TextNormalizer;
import com.ipruai.backend.support.ParserFixtures;

class StatementClassifierTest {

    private final StatementClassifier classifier = ParserFixtures.classifier();
    private final TextNormalizer normalizer = new TextNormalizer();

    private StatementSelection classify(String subject, String body) {
        return classifier.classify(normalizer.normalize(subject, body));
    }

    @Test
    void classify_portfolioStatementRequest() {
        StatementSelection selection = classify("PMS Statement Request", "Send me portfolio statement as on 15-Mar-2024");

        assertEquals(List.of("PMS"), selection.categories());
        assertEquals(List.of("Portfolio_Appraisal"), selection.types());
        assertEquals(1.0, selection.weight("PMS", "Portfolio_Appraisal"), 1e-9);
    }

    @Test
    void classify_plainWordStatementSelectsNothing() {
        assertTrue(classify(null, "please send statement").isEmpty());
    }

    @Test
    void classify_secondaryHitAloneIsAboveThreshold() {
        StatementSelection selection = classify(null, "kindly share dividend details");

        assertEquals(List.of("Statement_of_Dividend"), selection.types());
        assertEquals(0.5, selection.weight("PMS", "Statement_of_Dividend"), 1e-9);
    }

    @Test
    void classify_multipleCategories() {
        StatementSelection selection = classify("Statements", "Need capital gain statement and the AIF statement for PAN ABCDE1234F");

        assertEquals(List.of("PMS", "AIF"), selection.categories());
        assertTrue(selection.contains("PMS", "Statement_of_Capital_Gain_Loss"));
        assertTrue(selection.contains("AIF", "AIF_Statement"));
    }

    @Test
    void classify_bulkPhraseSelectsEveryTypeOfCategory() {
        StatementSelection selection = classify(null, "Send all PMS statements for FY 23-24");

        assertEquals(List.of("PMS"), selection.categories());
        assertEquals(10, selection.types().size());
        assertEquals(1.0, selection.maxWeight("PMS"), 1e-9);
    }

    @Test
    void classify_allStatementsSelectsBothCategories() {
        StatementSelection selection = classify("All Statements", "Provide both PMS and AIF statements");

        assertEquals(List.of("PMS", "AIF"), selection.categories());
        assertEquals(11, selection.types().size());
    }

    @Test
    void score_distinctKeywordCountsOnceAndWeightIsCapped() {
        Map<String, Map<String, Double>> scores = classifier.score(
                normalizer.normalize(null, "dividend dividend dividends"));

        assertEquals(0.5, scores.get("PMS").get("Statement_of_Dividend"), 1e-9);

        scores = classifier.score(normalizer.normalize(null, "dividend statement, statement of dividend, dividend report"));
        assertEquals(1.0, scores.get("PMS").get("Statement_of_Dividend"), 1e-9);
    }

    @Test
    void classify_isWholeWord() {
        // "soa" must not match inside "soap"
        assertTrue(classify(null, "soap opera").isEmpty());
    }

    @Test
    void classify_isDeterministic() {
        NormalizedText text = normalizer.normalize("Reports", "transaction statement and bank book and performance report");

        assertEquals(classifier.classify(text), classifier.classify(text));
        assertEquals(List.of("Performance_Appraisal", "Transaction_Statement", "Bank_Book"), classifier.classify(text).types());
    }

    @Test
    void classify_toleratesMisspelledKeywords() {
        assertEquals(List.of("Transaction_Statement"), classify(null, "need transacton statment for last year").types());

        StatementSelection selection = classify(null, "portfolio apprasial please");
        assertEquals(List.of("Portfolio_Appraisal"), selection.types());
        // 0.9 * similarity(0.895) * 0.85
        assertEquals(0.684, selection.weight("PMS", "Portfolio_Appraisal"), 1e-3);
    }

    @Test
    void classify_misspelledSecondaryKeywordStaysBelowThreshold() {
        assertTrue(classify(null, "pms statment").isEmpty());
        assertTrue(classify(null, "send statment").isEmpty());
    }

    @Test
    void classify_typosIgnoredWhenFuzzyMatchingIsOff() {
        ParserProperties properties = ParserFixtures.properties();
        properties.getFuzzy().setEnabled(false);
        StatementClassifier strict = new StatementClassifier(ParserFixtures.dictionary(), properties);

        assertTrue(strict.classify(normalizer.normalize(null, "portfolio apprasial please")).isEmpty());
    }
}
