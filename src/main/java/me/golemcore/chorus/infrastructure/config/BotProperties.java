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

import lombok.Data;
import me.golemcore.chorus.domain.model.ParticipationStrategy;
import me.golemcore.chorus.domain.model.RoleOverrides;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link PersonaProperties} - personas and their channel credentials</li>
 * <li>{@link EngineProperties} - queue, observation and cleanup limits</li>
 * <li>{@link ConversationStoreProperties} - shared buffer retention</li>
 * <li>{@link OracleProperties} - decision oracle timeouts</li>
 * <li>{@link LlmProperties} - LLM provider settings</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private boolean autostart = true;
    private List<PersonaProperties> personas = new ArrayList<>();
    private EngineProperties engine = new EngineProperties();
    private ConversationStoreProperties conversationStore = new ConversationStoreProperties();
    private OracleProperties oracle = new OracleProperties();
    private LlmProperties llm = new LlmProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private VoiceProperties voice = new VoiceProperties();
    private AttachmentProperties attachments = new AttachmentProperties();

    @Data
    public static class PersonaProperties {
        private String id;
        private boolean enabled = true;
        private String channel = "telegram";
        private String token;

        // Optional role overrides, applied on top of built-in defaults
        private String name;
        private String description;
        private String strategy;
        private Long observationDelayMs;
        private String decisionPrompt;
        private Integer maxObservationMessages;
        private Boolean refreshBeforeReply;

        /**
         * Converts the optional role fields into overrides. An unknown strategy is
         * passed through as {@code null} and reported by the caller.
         */
        public RoleOverrides toOverrides() {
            return RoleOverrides.builder()
                    .name(name)
                    .description(description)
                    .participationStrategy(ParticipationStrategy.fromId(strategy).orElse(null))
                    .observationDelay(observationDelayMs != null ? Duration.ofMillis(observationDelayMs) : null)
                    .decisionPrompt(decisionPrompt)
                    .maxObservationMessages(maxObservationMessages)
                    .refreshBeforeReply(refreshBeforeReply)
                    .build();
        }
    }

    @Data
    public static class EngineProperties {
        private int queueCapacity = 100;
        private int workerConcurrency = 5;
        private long queueItemMaxAgeMs = 300_000;
        private long participationMaxAgeMs = 3_600_000;
        private long topicCacheTtlMs = 3_600_000;
        private int topicCacheMaxEntries = 10_000;
        private long observationGraceMs = 150_000;
        private long janitorIntervalMs = 60_000;
        private long sendTimeoutMs = 30_000;
        private boolean oracleChosenDelay = true;
        private String capacityNotice = "Too many messages right now, please try again in a moment.";
        private String emptyReplyFallback = "I had a thought on this, but it came out as technical noise. Skipping it.";
    }

    @Data
    public static class ConversationStoreProperties {
        private long expiryMs = 600_000;
        private int maxMessagesPerConversation = 50;
        private long sweepIntervalMs = 60_000;
    }

    @Data
    public static class OracleProperties {
        private long timeoutMs = 30_000;
        private String model;
        private double temperature = 0.7;
    }

    @Data
    public static class LlmProperties {
        private String provider = "langchain4j";
        private Langchain4jProperties langchain4j = new Langchain4jProperties();
    }

    @Data
    public static class Langchain4jProperties {
        private String model = "openai/gpt-4o-mini";
        private long timeoutMs = 60_000;
        private Integer maxTokens;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/chorus";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class VoiceProperties {
        private WhisperProperties whisper = new WhisperProperties();
    }

    @Data
    public static class WhisperProperties {
        private String url;
        private String apiKey;
        private String model = "whisper-1";
        private String language;
        private long timeoutMs = 60_000;
    }

    @Data
    public static class AttachmentProperties {
        private int maxDocumentChars = 8000;
        private long maxDownloadBytes = 10 * 1024 * 1024;
    }
}
