package com.ipruai.backend.services.ai;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import com.ipruai.backend.services.emails.parsers.IdentifierKind;

/**
 * Output of the statistical classifier. Identifier values are raw suggestions and still have to
 * pass the identifier format rules before they are used.
 *
 * @param confidence 0-100
 * @param dateConfidence 0-100, meaningful only when both dates are present
 */
public record ModelPrediction(
        List<PredictedLabel> labels,
        double confidence,
        Map<IdentifierKind, List<String>> identifiers,
        LocalDate fromDate,
        LocalDate toDate,
        double dateConfidence,
        String modelVersion
) {

    public ModelPrediction {
        labels = labels == null ? List.of() : List.copyOf(labels);
        identifiers = identifiers == null ? Map.of() : Map.copyOf(identifiers);
    }

    public static ModelPrediction labelsOnly(List<PredictedLabel> labels, double confidence, String modelVersion) {
        return new ModelPrediction(labels, confidence, Map.of(), null, null, 0.0, modelVersion);
    }

    public boolean hasDateRange() {
        return fromDate != null && toDate != null;
    }

    public record PredictedLabel(String category, String type, double probability) {
    }
}
