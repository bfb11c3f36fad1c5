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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.chorus.domain.model.StoredMessage;
import me.golemcore.chorus.port.inbound.ChannelPort;
import me.golemcore.chorus.port.outbound.HistorySource;

import java.util.List;
import java.util.Optional;

/**
 * History backed by the platform itself, for channels that can list recent
 * messages. Falls back to the shared store when the platform call yields
 * nothing. Writes always go to the store so other personas keep seeing them.
 */
@Slf4j
public class ChannelHistorySource implements HistorySource {

    // Anchored windows need to look a bit further back than the window itself
    private static final int FETCH_MULTIPLIER = 3;

    private final ChannelPort channel;
    private final HistorySource fallback;

    public ChannelHistorySource(ChannelPort channel, HistorySource fallback) {
        this.channel = channel;
        this.fallback = fallback;
    }

    @Override
    public List<StoredMessage> getHistory(String conversationId, int limit, String sinceMessageId) {
        Optional<List<StoredMessage>> fetched;
        try {
            fetched = channel.fetchRecentMessages(conversationId, Math.max(limit, limit * FETCH_MULTIPLIER));
        } catch (RuntimeException e) {
            log.warn("[History] native fetch failed for {}: {}", conversationId, e.getMessage());
            fetched = Optional.empty();
        }
        if (fetched.isEmpty() || fetched.get().isEmpty()) {
            return fallback.getHistory(conversationId, limit, sinceMessageId);
        }
        return HistoryWindow.apply(fetched.get(), limit, sinceMessageId);
    }

    @Override
    public boolean record(String conversationId, String author, String content, boolean bot, String messageId,
            boolean reply) {
        return fallback.record(conversationId, author, content, bot, messageId, reply);
    }
}
