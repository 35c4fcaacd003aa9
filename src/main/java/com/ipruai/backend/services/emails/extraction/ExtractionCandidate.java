package com.ipruai.backend.services.emails.extraction;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

import com.ipruai.backend.classification.StatementSelection;
import com.ipruai.backend.services.emails.parsers.DateRange;
import com.ipruai.backend.services.emails.parsers.IdentifierSet;

/**
 * Fields extracted by one source (rules or model) before the final result is assembled.
 *
 * @param dateRange may be {@code null} for a model candidate that proposed no usable range
 * @param businessRules notes added by business rules that changed the candidate
 */
public record ExtractionCandidate(
        IdentifierSet identifiers,
        DateRange dateRange,
        StatementSelection statements,
        List<String> businessRules
) {

    public ExtractionCandidate {
        identifiers = identifiers == null ? IdentifierSet.empty() : identifiers;
        statements = statements == null ? StatementSelection.empty() : statements;
        businessRules = businessRules == null ? List.of() : List.copyOf(new LinkedHashSet<>(businessRules));
    }

    public ExtractionCandidate withStatements(StatementSelection newStatements, String note) {
        List<String> notes = new ArrayList<>(businessRules);
        if (note != null) notes.add(note);
        return new ExtractionCandidate(identifiers, dateRange, newStatements, notes);
    }
}
