package com.ipruai.backend.config;

import java.time.Duration;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ipruai.backend.services.ai.LocalStatementModel;
import com.ipruai.backend.services.ai.NoopStatementModelClient;
import com.ipruai.backend.services.ai.RemoteStatementModelClient;
import com.ipruai.backend.services.ai.StatementModelClient;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
public class ModelClientConfig {

    @Bean
    @ConditionalOnProperty(name = "ipruai.model.provider", havingValue = "local")
    public StatementModelClient localStatementModel(ModelProperties properties,
                                                    ResourceLoader resourceLoader,
                                                    ObjectMapper objectMapper) {
        LocalStatementModel model = LocalStatementModel.load(resourceLoader.getResource(properties.getArtifact()), objectMapper);
        log.info("Statement model enabled (provider=local, version={}, available={}).", model.version(), model.isAvailable());
        return model;
    }

    @Bean
    @ConditionalOnProperty(name = "ipruai.model.provider", havingValue = "remote")
    public StatementModelClient remoteStatementModelClient(ModelProperties properties) {
        log.info("Statement model enabled (provider=remote, baseUrl={}).", properties.getBaseUrl());
        return new RemoteStatementModelClient(properties.getBaseUrl(), Duration.ofMillis(properties.getTimeoutMs()));
    }

    @Bean
    @ConditionalOnMissingBean(StatementModelClient.class)
    public StatementModelClient noopStatementModelClient() {
        log.info("Statement model disabled (provider=none).");
        return new NoopStatementModelClient();
    }
}
