package com.ipruai.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Statistical classifier settings ("ipruai.model").
 */
@Data
@ConfigurationProperties(prefix = "ipruai.model")
public class ModelProperties {

    /**
     * local | remote | none
     */
    private String provider = "none";

    /**
     * Upper bound for a single inference call, in milliseconds.
     */
    private long timeoutMs = 300;

    /**
     * Serialized model produced by the training pipeline (provider=local).
     */
    private String artifact = "classpath:model/statement-model.json";

    /**
     * Model-serving endpoint (provider=remote).
     */
    private String baseUrl = "http://localhost:8000";

    /**
     * A date range proposed by the model replaces the default range only at or above this confidence.
     */
    private double minDateConfidence = 70.0;

    private int corePoolSize = 2;

    private int maxPoolSize = 8;

    private int queueCapacity = 100;
}
