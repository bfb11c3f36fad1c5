package me.golemcore.chorus.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chorus.domain.model.LlmRequest;
import me.golemcore.chorus.domain.model.LlmResponse;
import me.golemcore.chorus.domain.model.Message;
import me.golemcore.chorus.domain.model.OracleContext;
import me.golemcore.chorus.infrastructure.config.BotProperties;
import me.golemcore.chorus.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single entry point for every oracle question asked by the engine.
 *
 * <p>
 * Each call is bounded by {@code bot.oracle.timeout-ms}. Every failure mode
 * (provider error, timeout, interruption) surfaces as an
 * {@link OracleException}; nothing is retried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OracleService {

    private final LlmPort llmPort;
    private final BotProperties properties;

    public String ask(String prompt, OracleContext context) {
        BotProperties.OracleProperties oracleProperties = properties.getOracle();
        LlmRequest request = LlmRequest.builder()
                .model(oracleProperties.getModel())
                .temperature(oracleProperties.getTemperature())
                .messages(new ArrayList<>(List.of(Message.user(prompt))))
                .sessionId(context.conversationId())
                .build();

        long timeoutMs = oracleProperties.getTimeoutMs();
        long startedAt = System.nanoTime();
        CompletableFuture<LlmResponse> future = null;
        try {
            future = llmPort.chat(request);
            LlmResponse response = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            String content = response != null && response.getContent() != null ? response.getContent() : "";
            log.debug("[Oracle] {}/{} answered in {}ms ({} chars)", context.personaName(), context.purpose(),
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt), content.length());
            return content;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new OracleException("oracle timed out after " + timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (future != null) {
                future.cancel(true);
            }
            throw new OracleException("oracle call interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new OracleException("oracle failed: " + cause.getMessage(), cause);
        } catch (RuntimeException e) {
            throw new OracleException("oracle failed: " + e.getMessage(), e);
        }
    }
}
