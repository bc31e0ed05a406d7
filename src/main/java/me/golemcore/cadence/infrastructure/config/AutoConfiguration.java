package me.golemcore.cadence.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.cadence.port.outbound.ActionProviderPort;
import me.golemcore.cadence.port.outbound.EmbeddingPort;
import me.golemcore.cadence.port.outbound.LlmPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;

/**
 * Shared beans and startup checks.
 *
 * <p>
 * Provides the {@link Clock} and the {@link ObjectMapper} used for planner
 * parsing and JSON persistence, then logs the configured model, embedding
 * availability and storage location once the context is up.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final CadenceProperties properties;
    private final LlmPort llmPort;
    private final EmbeddingPort embeddingPort;
    private final ActionProviderPort actionProvider;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("Cadence v{} starting...", version);
        log.info("Planner Model: {} (available: {})", llmPort.getCurrentModel(), llmPort.isAvailable());
        log.info("Embeddings: {} (available: {})", embeddingPort.getModel(), embeddingPort.isAvailable());
        log.info("Storage Path: {}", properties.getStorage().getBasePath());
        if (!actionProvider.healthCheck()) {
            log.warn("Clinical data store is not readable; actions will fail until it is");
        }
    }
}
