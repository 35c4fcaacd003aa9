package com.ipruai.backend.dto;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;

@Data
public class EmailParseResponseDTO {

    @JsonProperty("statement_category")
    private List<String> statementCategory;

    @JsonProperty("statement_types")
    private List<String> statementTypes;

    @JsonProperty("aif_folio")
    private List<String> aifFolio;

    @JsonProperty("di_code")
    private List<String> diCode;

    @JsonProperty("account_code")
    private List<String> accountCode;

    @JsonProperty("pan_numbers")
    private List<String> panNumbers;

    @JsonProperty("from_date")
    private LocalDate fromDate;

    @JsonProperty("to_date")
    private LocalDate toDate;

    private double confidence;

    @JsonProperty("parsing_method")
    private String parsingMethod;

    private MetadataDTO metadata;

    @JsonProperty("raw_text")
    private String rawText;

    @JsonProperty("processed_at")
    private LocalDateTime processedAt;

    @Data
    public static class MetadataDTO {

        @JsonProperty("date_source")
        private String dateSource;

        @JsonProperty("date_provenance")
        private String dateProvenance;

        @JsonProperty("fallback_state")
        private String fallbackState;

        @JsonProperty("attempted_state")
        private String attemptedState;

        @JsonProperty("ml_invoked")
        private boolean mlInvoked;

        @JsonProperty("ml_skipped")
        private boolean mlSkipped;

        @JsonProperty("ml_skip_reason")
        private String mlSkipReason;

        @JsonProperty("model_version")
        private String modelVersion;

        @JsonProperty("has_identifiers")
        private boolean hasIdentifiers;

        @JsonProperty("rule_confidence")
        private double ruleConfidence;

        @JsonProperty("processing_time_ms")
        private long processingTimeMs;

        @JsonProperty("business_rules")
        private List<String> businessRules;
    }
}
