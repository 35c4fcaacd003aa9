package com.ipruai.backend.services.emails.extraction;

import org.springframework.stereotype.Component;

import com.ipruai.backend.services.emails.parsers.IdentifierKind;
import com.ipruai.backend.services.emails.parsers.IdentifierSet;

import lombok.extern.slf4j.Slf4j;

/**
 * AIF statements are issued against an AIF folio or a PAN. A DI code or account code identifies
 * a PMS account only, so unless a PAN or an AIF folio is present the AIF category is dropped.
 */
@Slf4j
@Component
public class StatementEligibilityPolicy {

    public static final String AIF_CATEGORY = "AIF";
    public static final String AIF_REQUIRES_FOLIO_OR_PAN = "AIF statements require an AIF folio or PAN; AIF removed";

    public ExtractionCandidate apply(ExtractionCandidate candidate) {
        if (candidate == null || !candidate.statements().categories().contains(AIF_CATEGORY)) {
            return candidate;
        }

        IdentifierSet ids = candidate.identifiers();
        if (ids.has(IdentifierKind.AIF_FOLIO) || ids.has(IdentifierKind.PAN)) {
            return candidate;
        }

        log.info("[Eligibility] Dropping AIF: identifiers {} cannot address an AIF holding", ids);
        return candidate.withStatements(
                candidate.statements().withoutCategory(AIF_CATEGORY),
                AIF_REQUIRES_FOLIO_OR_PAN);
    }
}
