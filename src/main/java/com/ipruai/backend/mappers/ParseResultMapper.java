package com.ipruai.backend.mappers;

import com.ipruai.backend.dto.EmailParseResponseDTO;
import com.ipruai.backend.services.emails.extraction.ParseMetadata;
import com.ipruai.backend.services.emails.extraction.ParseResult;
import com.ipruai.backend.services.emails.parsers.IdentifierKind;

public class ParseResultMapper {

    private ParseResultMapper() {}

    public static EmailParseResponseDTO toResponseDTO(ParseResult result) {
        EmailParseResponseDTO dto = new EmailParseResponseDTO();
        dto.setStatementCategory(result.getStatements().categories());
        dto.setStatementTypes(result.getStatements().types());
        dto.setAifFolio(result.getIdentifiers().get(IdentifierKind.AIF_FOLIO));
        dto.setDiCode(result.getIdentifiers().get(IdentifierKind.DI_CODE));
        dto.setAccountCode(result.getIdentifiers().get(IdentifierKind.ACCOUNT_CODE));
        dto.setPanNumbers(result.getIdentifiers().get(IdentifierKind.PAN));
        dto.setFromDate(result.getDateRange().from());
        dto.setToDate(result.getDateRange().to());
        dto.setConfidence(result.getConfidence().overall());
        dto.setParsingMethod(result.getParsingMethod().value());
        dto.setMetadata(toMetadataDTO(result.getMetadata()));
        dto.setRawText(result.getRawText());
        dto.setProcessedAt(result.getProcessedAt());
        return dto;
    }

    private static EmailParseResponseDTO.MetadataDTO toMetadataDTO(ParseMetadata metadata) {
        EmailParseResponseDTO.MetadataDTO dto = new EmailParseResponseDTO.MetadataDTO();
        dto.setDateSource(metadata.getDateSource());
        dto.setDateProvenance(metadata.getDateProvenance());
        dto.setFallbackState(metadata.getFallbackState() != null ? metadata.getFallbackState().name() : null);
        dto.setAttemptedState(metadata.getAttemptedState() != null ? metadata.getAttemptedState().name() : null);
        dto.setMlInvoked(metadata.isMlInvoked());
        dto.setMlSkipped(metadata.isMlSkipped());
        dto.setMlSkipReason(metadata.getMlSkipReason());
        dto.setModelVersion(metadata.getModelVersion());
        dto.setHasIdentifiers(metadata.isHasIdentifiers());
        dto.setRuleConfidence(metadata.getRuleConfidence());
        dto.setProcessingTimeMs(metadata.getProcessingTimeMs());
        dto.setBusinessRules(metadata.getBusinessRules());
        return dto;
    }
}
