package com.ipruai.backend.services.ai;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.core.io.Resource;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ipruai.backend.services.emails.parsers.NormalizedText;

import lombok.extern.slf4j.Slf4j;

/**
 * Multi-label linear text model loaded from a JSON artifact.
 *
 * Features are the distinct unigrams and bigrams of the normalized text (binary presence).
 * Each label scores {@code sigmoid(bias + sum(weights of present features))} and is predicted
 * when the probability reaches the artifact's decision threshold.
 *
 * Read-only after construction.
 */
@Slf4j
public class LocalStatementModel implements StatementModelClient {

    static final double DEFAULT_DECISION_THRESHOLD = 0.5;

    private final Artifact artifact;

    public LocalStatementModel(Artifact artifact) {
        this.artifact = artifact;
    }

    /**
     * Loads the artifact. A missing or malformed artifact yields an unavailable model.
     */
    public static LocalStatementModel load(Resource resource, ObjectMapper objectMapper) {
        if (resource == null || !resource.exists()) {
            log.warn("[StatementModel] Artifact not found: {}", resource != null ? resource.getDescription() : null);
            return new LocalStatementModel(null);
        }

        try (InputStream in = resource.getInputStream()) {
            Artifact artifact = objectMapper.readValue(in, Artifact.class);
            if (artifact.labels() == null || artifact.labels().isEmpty()) {
                log.warn("[StatementModel] Artifact {} has no labels", resource.getDescription());
                return new LocalStatementModel(null);
            }
            log.info("[StatementModel] Loaded local model version={} labels={}",
                    artifact.version(), artifact.labels().size());
            return new LocalStatementModel(artifact);
        } catch (IOException e) {
            log.warn("[StatementModel] Could not read artifact {}: {}", resource.getDescription(), e.getMessage());
            return new LocalStatementModel(null);
        }
    }

    @Override
    public boolean isAvailable() {
        return artifact != null;
    }

    @Override
    public String version() {
        return artifact != null && artifact.version() != null ? artifact.version() : "unavailable";
    }

    @Override
    public ModelPrediction predict(NormalizedText text) {
        if (artifact == null) {
            throw StatementModelException.unavailable("local artifact not loaded");
        }

        Set<String> features = features(text != null ? text.value() : "");
        double threshold = artifact.decisionThreshold() != null
                ? artifact.decisionThreshold()
                : DEFAULT_DECISION_THRESHOLD;

        List<ModelPrediction.PredictedLabel> predicted = new ArrayList<>();
        double best = 0.0;
        for (Label label : artifact.labels()) {
            double p = probability(label, features);
            if (p >= threshold) {
                predicted.add(new ModelPrediction.PredictedLabel(label.category(), label.type(), p));
                best = Math.max(best, p);
            }
        }

        log.debug("[StatementModel] predicted={} confidence={}", predicted, best * 100.0);
        return ModelPrediction.labelsOnly(predicted, best * 100.0, version());
    }

    static double probability(Label label, Set<String> features) {
        double z = label.bias() != null ? label.bias() : 0.0;
        if (label.weights() != null) {
            for (String feature : features) {
                Double w = label.weights().get(feature);
                if (w != null) z += w;
            }
        }
        return 1.0 / (1.0 + Math.exp(-z));
    }

    static Set<String> features(String normalized) {
        Set<String> features = new LinkedHashSet<>();
        if (normalized == null || normalized.isBlank()) return features;

        List<String> tokens = new ArrayList<>();
        for (String token : normalized.split("[^a-z0-9]+")) {
            if (!token.isEmpty()) tokens.add(token);
        }
        for (int i = 0; i < tokens.size(); i++) {
            features.add(tokens.get(i));
            if (i + 1 < tokens.size()) {
                features.add(tokens.get(i) + " " + tokens.get(i + 1));
            }
        }
        return features;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Artifact(String version, Double decisionThreshold, List<Label> labels) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Label(String category, String type, Double bias, Map<String, Double> weights) {
    }
}
