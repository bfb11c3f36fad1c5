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
import me.golemcore.chorus.domain.model.DeliveryResult;
import me.golemcore.chorus.infrastructure.config.BotProperties;
import me.golemcore.chorus.port.inbound.ChannelPort;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends a reply in platform-sized chunks. Only the first chunk is threaded as
 * a reply. Every chunk has its own timeout; a failed chunk is logged and the
 * rest are still attempted. Nothing is resent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReplySender {

    private final BotProperties properties;

    public DeliveryResult send(ChannelPort channel, String conversationId, String text, String replyToMessageId) {
        List<String> chunks = MessageChunker.split(text, channel.getMaxMessageLength());
        long timeoutMs = properties.getEngine().getSendTimeoutMs();
        int sent = 0;
        int failed = 0;

        for (int i = 0; i < chunks.size(); i++) {
            String replyTarget = i == 0 ? replyToMessageId : null;
            try {
                CompletableFuture<Void> future = channel.sendMessage(conversationId, chunks.get(i), replyTarget);
                if (future != null) {
                    future.get(timeoutMs, TimeUnit.MILLISECONDS);
                }
                sent++;
            } catch (TimeoutException e) {
                failed++;
                log.warn("[Send] chunk {}/{} to {} timed out after {}ms", i + 1, chunks.size(), conversationId,
                        timeoutMs);
            } catch (ExecutionException e) {
                failed++;
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("[Send] chunk {}/{} to {} failed: {}", i + 1, chunks.size(), conversationId,
                        cause.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failed += chunks.size() - i;
                log.warn("[Send] interrupted while sending to {}, {} chunks not sent", conversationId,
                        chunks.size() - i);
                break;
            } catch (RuntimeException e) {
                failed++;
                log.warn("[Send] chunk {}/{} to {} failed: {}", i + 1, chunks.size(), conversationId,
                        e.getMessage());
            }
        }

        if (failed > 0) {
            log.warn("[Send] delivered {}/{} chunks to {}", sent, chunks.size(), conversationId);
        }
        return new DeliveryResult(sent, failed);
    }
}
