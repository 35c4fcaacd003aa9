package com.ipruai.backend.audit;

import org.springframework.stereotype.Component;

import com.ipruai.backend.services.emails.extraction.ParseResult;
import com.ipruai.backend.services.emails.parsers.IdentifierKind;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
public class LoggingParseOutcomeRecorder implements ParseOutcomeRecorder {

    @Override
    public void record(ParseResult result) {
        if (result == null) return;

        log.info("[ParseOutcome] confidence={} method={} state={} categories={} types={} PAN={} DI={} accounts={} folios={} dates={}..{} ({}) mlSkipped={} timeMs={}",
                result.getConfidence().overall(),
                result.getParsingMethod(),
                result.getMetadata().getFallbackState(),
                result.getStatements().categories(),
                result.getStatements().types(),
                result.getIdentifiers().get(IdentifierKind.PAN).size(),
                result.getIdentifiers().get(IdentifierKind.DI_CODE).size(),
                result.getIdentifiers().get(IdentifierKind.ACCOUNT_CODE).size(),
                result.getIdentifiers().get(IdentifierKind.AIF_FOLIO).size(),
                result.getDateRange().from(),
                result.getDateRange().to(),
                result.getMetadata().getDateProvenance(),
                result.getMetadata().isMlSkipped(),
                result.getMetadata().getProcessingTimeMs());

        if (!result.getMetadata().getBusinessRules().isEmpty()) {
            log.info("[ParseOutcome] business rules applied: {}", result.getMetadata().getBusinessRules());
        }
    }
}
