package com.ipruai.backend.audit;

import com.ipruai.backend.services.emails.extraction.ParseResult;

/**
 * Receives every completed parse. Implementations must not throw back into the parse path.
 */
public interface ParseOutcomeRecorder {

    void record(ParseResult result);
}
