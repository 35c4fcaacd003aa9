package com.ipruai.backend.services.ai;

import com.ipruai.backend.services.emails.parsers.NormalizedText;

public class NoopStatementModelClient implements StatementModelClient {

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public String version() {
        return "none";
    }

    @Override
    public ModelPrediction predict(NormalizedText text) {
        throw StatementModelException.unavailable("no model configured");
    }
}
