package me.golemcore.chorus.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chorus.domain.service.PersonaOrchestrator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared beans plus startup of every configured persona.
 *
 * <p>
 * Personas start from {@code @PostConstruct} unless
 * {@code bot.autostart=false}, which tests use to get a context without live
 * channels.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final BotProperties properties;

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

    @Configuration
    @ConditionalOnProperty(prefix = "bot", name = "autostart", havingValue = "true", matchIfMissing = true)
    @RequiredArgsConstructor
    static class PersonaStartup {

        private final BotProperties properties;
        private final PersonaOrchestrator personaOrchestrator;

        @PostConstruct
        public void init() {
            log.info("GolemCore Chorus starting...");
            log.info("LLM Provider: {}", properties.getLlm().getProvider());
            log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());
            log.info("Configured personas: {}", properties.getPersonas().size());
            personaOrchestrator.startAll();
            log.info("GolemCore Chorus started");
        }
    }

    @PostConstruct
    public void logEngineSettings() {
        BotProperties.EngineProperties engine = properties.getEngine();
        log.debug("Engine: queueCapacity={}, workers={}, janitorIntervalMs={}",
                engine.getQueueCapacity(), engine.getWorkerConcurrency(), engine.getJanitorIntervalMs());
    }
}
