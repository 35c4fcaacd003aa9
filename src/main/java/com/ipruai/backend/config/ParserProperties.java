package com.ipruai.backend.config;

import java.time.LocalDate;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Configuração do pipeline de extração de e-mails.
 * Carrega de application.properties com prefixo "ipruai.parser".
 *
 * Exemplo:
 * ipruai.parser.thresholds.high=80
 * ipruai.parser.thresholds.medium=60
 * ipruai.parser.weights.statement-type=0.4
 * ipruai.parser.weights.date-parsing=0.3
 * ipruai.parser.weights.identifiers=0.3
 */
@Data
@ConfigurationProperties(prefix = "ipruai.parser")
public class ParserProperties {

    /**
     * Fallback thresholds. Both are required; there is no built-in default.
     */
    private Thresholds thresholds = new Thresholds();

    /**
     * Weights of the three confidence sub-scores. Must sum to 1.0.
     */
    private Weights weights = new Weights();

    /**
     * A statement type is selected only when its accumulated keyword weight is above this value.
     */
    private double minTypeWeight = 0.45;

    /**
     * Weight difference above which one source's label set wins a category outright during merge.
     */
    private double conflictMargin = 0.2;

    /**
     * Start of the default date range used when the email carries no date expression.
     */
    private LocalDate defaultFromDate = LocalDate.of(1990, 1, 1);

    /**
     * Zone that defines "today" for relative dates.
     */
    private String zone = "Asia/Kolkata";

    /**
     * Typo tolerance for statement keywords and date words.
     */
    private Fuzzy fuzzy = new Fuzzy();

    private String identifierPatterns = "classpath:parser/identifier-patterns.json";

    private String statementKeywords = "classpath:parser/statement-keywords.json";

    @Data
    public static class Thresholds {
        private Double high;
        private Double medium;
    }

    @Data
    public static class Fuzzy {
        private boolean enabled = true;
        private double primaryThreshold = 0.80;
        private double secondaryThreshold = 0.75;
        /** Share of the keyword weight a typo match contributes, times its similarity. */
        private double weightFactor = 0.85;
        private int minKeywordLength = 6;
        /** Minimum similarity for correcting date words ("lst" -> "last"). */
        private double dateWordThreshold = 0.75;
    }

    @Data
    public static class Weights {
        private Double statementType;
        private Double dateParsing;
        private Double identifiers;
    }

    public String getDescription() {
        return String.format(
                "ParserProperties{high=%s, medium=%s, weights=[%s, %s, %s], minTypeWeight=%.2f, margin=%.2f}",
                thresholds.getHigh(),
                thresholds.getMedium(),
                weights.getStatementType(),
                weights.getDateParsing(),
                weights.getIdentifiers(),
                minTypeWeight,
                conflictMargin);
    }
}
