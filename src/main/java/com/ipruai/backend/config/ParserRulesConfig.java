package com.ipruai.backend.config;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ipruai.backend.classification.rules.StatementKeywordDictionary;
import com.ipruai.backend.exceptions.ConfigurationException;
import com.ipruai.backend.services.emails.extraction.FallbackThresholds;
import com.ipruai.backend.services.emails.parsers.IdentifierRules;
import com.ipruai.backend.services.emails.quality.ConfidenceWeights;

import lombok.extern.slf4j.Slf4j;

/**
 * Builds the read-only parser configuration once at startup. Any invalid value aborts startup.
 */
@Slf4j
@Configuration
public class ParserRulesConfig {

    @Bean
    public IdentifierRules identifierRules(ParserProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        Map<String, IdentifierRules.PatternDefinition> definitions = readJson(
                resourceLoader.getResource(properties.getIdentifierPatterns()),
                objectMapper,
                new TypeReference<Map<String, IdentifierRules.PatternDefinition>>() { });
        IdentifierRules rules = IdentifierRules.compile(definitions);
        log.info("[ParserConfig] Identifier patterns loaded from {}", properties.getIdentifierPatterns());
        return rules;
    }

    @Bean
    public StatementKeywordDictionary statementKeywordDictionary(ParserProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        StatementKeywordDictionary.Document document = readJson(
                resourceLoader.getResource(properties.getStatementKeywords()),
                objectMapper,
                new TypeReference<StatementKeywordDictionary.Document>() { });
        StatementKeywordDictionary dictionary = StatementKeywordDictionary.compile(document);
        log.info("[ParserConfig] Keyword dictionary loaded: categories={} types={} bulkPhrases={}",
                dictionary.categories(), dictionary.allTypes().size(), dictionary.bulkRules().size());
        return dictionary;
    }

    @Bean
    public ConfidenceWeights confidenceWeights(ParserProperties properties) {
        return ConfidenceWeights.from(properties.getWeights());
    }

    @Bean
    public FallbackThresholds fallbackThresholds(ParserProperties properties) {
        FallbackThresholds thresholds = FallbackThresholds.from(properties.getThresholds());
        log.info("[ParserConfig] {}", properties.getDescription());
        return thresholds;
    }

    @Bean
    public Clock clock(ParserProperties properties) {
        try {
            return Clock.system(ZoneId.of(properties.getZone()));
        } catch (DateTimeException e) {
            throw new ConfigurationException("invalid ipruai.parser.zone: " + properties.getZone(), e);
        }
    }

    static <T> T readJson(Resource resource, ObjectMapper objectMapper, TypeReference<T> type) {
        if (resource == null || !resource.exists()) {
            throw new ConfigurationException("configuration resource not found: "
                    + (resource != null ? resource.getDescription() : null));
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, type);
        } catch (IOException e) {
            throw new ConfigurationException("could not read " + resource.getDescription() + ": " + e.getMessage(), e);
        }
    }
}
