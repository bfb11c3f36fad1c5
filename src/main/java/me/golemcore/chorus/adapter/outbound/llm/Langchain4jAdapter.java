package me.golemcore.chorus.adapter.outbound.llm;

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

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chorus.domain.model.LlmRequest;
import me.golemcore.chorus.domain.model.LlmResponse;
import me.golemcore.chorus.domain.model.Message;
import me.golemcore.chorus.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * LLM adapter backed by langchain4j.
 *
 * <p>
 * Models are written as {@code provider/model} (e.g. {@code openai/gpt-4o-mini},
 * {@code anthropic/claude-3-5-haiku-latest}). Anthropic models use the
 * Anthropic API; every other provider is treated as OpenAI-compatible, with
 * credentials from {@code bot.llm.langchain4j.providers.<provider>}. Built
 * models are cached per model and temperature.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String DEFAULT_PROVIDER = "openai";
    private static final int DEFAULT_ANTHROPIC_MAX_TOKENS = 4096;

    private final BotProperties properties;

    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public void initialize() {
        String model = getCurrentModel();
        log.info("Langchain4j adapter using default model: {} (available={})", model, isAvailable());
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            String model = request.getModel() != null && !request.getModel().isBlank()
                    ? request.getModel()
                    : getCurrentModel();
            String cacheKey = model + "@" + request.getTemperature() + "@" + request.getMaxTokens();
            ChatModel chatModel = models.computeIfAbsent(cacheKey,
                    key -> createModel(model, request.getTemperature(), request.getMaxTokens()));
            try {
                ChatResponse response = chatModel.chat(convertMessages(request));
                return convertResponse(response, model);
            } catch (RuntimeException e) {
                log.error("[LLM] chat failed for model {}: {}", model, e.getMessage());
                throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getLangchain4j().getModel();
    }

    @Override
    public boolean isAvailable() {
        return properties.getLlm().getLangchain4j().getProviders().values().stream()
                .anyMatch(p -> p.getApiKey() != null && !p.getApiKey().isBlank());
    }

    static String providerOf(String model) {
        return model.contains("/") ? model.substring(0, model.indexOf('/')) : DEFAULT_PROVIDER;
    }

    static String stripProviderPrefix(String model) {
        return model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
    }

    private ChatModel createModel(String model, double temperature, Integer maxTokens) {
        String provider = providerOf(model);
        BotProperties.ProviderProperties config = getProviderConfig(provider);
        String modelName = stripProviderPrefix(model);
        Duration timeout = Duration.ofMillis(properties.getLlm().getLangchain4j().getTimeoutMs());
        Integer configuredMaxTokens = maxTokens != null ? maxTokens : properties.getLlm().getLangchain4j()
                .getMaxTokens();
        log.debug("[LLM] creating {} model {}", provider, modelName);

        if (PROVIDER_ANTHROPIC.equals(provider)) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(modelName)
                    .maxRetries(0)
                    .maxTokens(configuredMaxTokens != null ? configuredMaxTokens : DEFAULT_ANTHROPIC_MAX_TOKENS)
                    .temperature(temperature)
                    .timeout(timeout);
            if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
                builder.baseUrl(config.getBaseUrl());
            }
            return builder.build();
        }

        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0)
                .temperature(temperature)
                .timeout(timeout);
        if (configuredMaxTokens != null) {
            builder.maxTokens(configuredMaxTokens);
        }
        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private BotProperties.ProviderProperties getProviderConfig(String providerName) {
        var config = properties.getLlm().getLangchain4j().getProviders().get(providerName);
        if (config == null || config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new IllegalStateException("Provider not configured: " + providerName
                    + ". Add bot.llm.langchain4j.providers." + providerName + ".api-key");
        }
        return config;
    }

    private List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        for (Message message : request.getMessages()) {
            if (message.isAssistantMessage()) {
                messages.add(AiMessage.from(message.getContent()));
            } else if ("system".equals(message.getRole())) {
                messages.add(SystemMessage.from(message.getContent()));
            } else {
                messages.add(UserMessage.from(message.getContent()));
            }
        }
        return messages;
    }

    private LlmResponse convertResponse(ChatResponse response, String model) {
        AiMessage aiMessage = response.aiMessage();
        if (response.tokenUsage() != null) {
            log.debug("[LLM] {} used {} tokens", model, response.tokenUsage().totalTokenCount());
        }
        return LlmResponse.builder()
                .content(aiMessage != null ? aiMessage.text() : null)
                .model(model)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }
}
