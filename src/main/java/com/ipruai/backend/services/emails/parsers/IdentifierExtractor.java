package com.ipruai.backend.services.emails.parsers;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class IdentifierExtractor {

    private final IdentifierRules identifierRules;

    public IdentifierSet extract(NormalizedText text) {
        if (text == null || text.isEmpty()) {
            return IdentifierSet.empty();
        }

        String value = text.value();
        List<int[]> claimed = new ArrayList<>();
        IdentifierSet.Builder builder = IdentifierSet.builder();

        for (IdentifierKind kind : IdentifierKind.values()) {
            Matcher m = identifierRules.rule(kind).search().matcher(value);
            while (m.find()) {
                if (overlapsClaimed(claimed, m.start(), m.end())) {
                    continue;
                }
                String candidate = IdentifierRules.canonical(m.group());
                if (!identifierRules.isValid(kind, candidate)) {
                    log.debug("[Identifiers] Rejected {} candidate '{}'", kind, candidate);
                    continue;
                }
                claimed.add(new int[] { m.start(), m.end() });
                builder.add(kind, candidate);
            }
        }

        IdentifierSet result = builder.build();
        log.debug("[Identifiers] PAN={} DI={} accounts={} folios={}",
                result.get(IdentifierKind.PAN).size(),
                result.get(IdentifierKind.DI_CODE).size(),
                result.get(IdentifierKind.ACCOUNT_CODE).size(),
                result.get(IdentifierKind.AIF_FOLIO).size());
        return result;
    }

    private boolean overlapsClaimed(List<int[]> claimed, int start, int end) {
        for (int[] span : claimed) {
            if (start < span[1] && span[0] < end) return true;
        }
        return false;
    }
}
