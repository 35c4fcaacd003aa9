package com.ipruai.backend.services.ai;

import com.ipruai.backend.services.emails.parsers.NormalizedText;

/**
 * Boundary to the statistical statement classifier. Implementations are loaded once and must be
 * safe to call from concurrent requests.
 */
public interface StatementModelClient {

    boolean isAvailable();

    String version();

    /**
     * @throws StatementModelException when the model is unavailable or the call fails
     */
    ModelPrediction predict(NormalizedText text);
}
