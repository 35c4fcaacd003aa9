package com.ipruai.backend.services.emails.parsers;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.text.similarity.LevenshteinDistance;

/**
 * Comparação tolerante a erros de digitação (distância de Levenshtein).
 *
 * Similaridade = 1 - distância / tamanho da maior string, entre 0 e 1.
 * Exemplo: similarity("statment", "statement") = 1 - 1/9 ≈ 0.89
 */
public final class FuzzyMatcher {

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^a-z0-9]+");
    private static final Pattern WORD = Pattern.compile("[a-z]+");

    /** Tokens shorter than this take part in a phrase match only when spelled exactly. */
    static final int MIN_FUZZY_TOKEN_LENGTH = 4;

    /** Every misspelled token of a phrase must reach this similarity on its own. */
    static final double MIN_TOKEN_SIMILARITY = 0.6;

    /** Words shorter than this are never corrected. */
    static final int MIN_CORRECTABLE_LENGTH = 3;

    private FuzzyMatcher() {}

    public static List<String> tokens(String normalized) {
        List<String> out = new ArrayList<>();
        if (normalized == null) return out;
        for (String token : TOKEN_SPLIT.split(normalized)) {
            if (!token.isEmpty()) out.add(token);
        }
        return out;
    }

    public static double similarity(String a, String b) {
        if (a == null || b == null) return 0.0;
        if (a.equals(b)) return 1.0;
        int longest = Math.max(a.length(), b.length());
        if (longest == 0) return 1.0;
        int distance = LevenshteinDistance.getDefaultInstance().apply(a, b);
        return 1.0 - (double) distance / longest;
    }

    /**
     * Best similarity between the phrase and any run of as many consecutive text tokens,
     * or 0 when no run qualifies. Within a run each token pair must be equal, or both tokens
     * must be long enough and individually similar.
     */
    public static double bestPhraseSimilarity(List<String> textTokens, List<String> phraseTokens) {
        int n = phraseTokens.size();
        if (n == 0 || textTokens.size() < n) return 0.0;

        String phrase = String.join(" ", phraseTokens);
        double best = 0.0;
        for (int start = 0; start + n <= textTokens.size(); start++) {
            List<String> window = textTokens.subList(start, start + n);
            if (!tokensCompatible(window, phraseTokens)) continue;
            best = Math.max(best, similarity(String.join(" ", window), phrase));
            if (best == 1.0) break;
        }
        return best;
    }

    /**
     * Replaces every word of at least three letters with the most similar vocabulary word,
     * when that similarity reaches the threshold. Everything else in the text is kept as is.
     */
    public static String correct(String normalized, Collection<String> vocabulary, double threshold) {
        if (normalized == null || normalized.isEmpty()) return "";

        Matcher m = WORD.matcher(normalized);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String word = m.group();
            m.appendReplacement(out, Matcher.quoteReplacement(closest(word, vocabulary, threshold)));
        }
        m.appendTail(out);
        return out.toString();
    }

    private static String closest(String word, Collection<String> vocabulary, double threshold) {
        if (word.length() < MIN_CORRECTABLE_LENGTH || vocabulary.contains(word)) return word;

        String best = word;
        double bestScore = 0.0;
        for (String candidate : vocabulary) {
            double score = similarity(word, candidate);
            if (score >= threshold && score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        return best;
    }

    private static boolean tokensCompatible(List<String> window, List<String> phraseTokens) {
        for (int i = 0; i < window.size(); i++) {
            String a = window.get(i);
            String b = phraseTokens.get(i);
            if (a.equals(b)) continue;
            if (a.length() < MIN_FUZZY_TOKEN_LENGTH || b.length() < MIN_FUZZY_TOKEN_LENGTH) return false;
            if (similarity(a, b) < MIN_TOKEN_SIMILARITY) return false;
        }
        return true;
    }
}
