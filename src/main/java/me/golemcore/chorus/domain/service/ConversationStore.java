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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chorus.domain.model.StoredMessage;
import me.golemcore.chorus.infrastructure.config.BotProperties;
import me.golemcore.chorus.port.outbound.HistorySource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared, bounded, time-expiring buffer of recent messages per conversation.
 *
 * <p>
 * Platforms that never show a bot the messages of other bots still let every
 * persona see the whole conversation through this store. One instance is
 * shared by all personas of the process.
 *
 * <p>
 * Writes for one conversation are serialized; reads copy under the same lock
 * and never mutate. Expired messages are hidden from reads immediately and
 * physically removed by a background sweep.
 */
@Component
@Slf4j
public class ConversationStore implements HistorySource {

    private final Clock clock;
    private final Duration expiry;
    private final int maxMessagesPerConversation;
    private final Duration sweepInterval;

    private final Map<String, Deque<StoredMessage>> conversations = new ConcurrentHashMap<>();
    private ScheduledExecutorService sweeper;

    @Autowired
    public ConversationStore(BotProperties properties, Clock clock) {
        this(clock,
                Duration.ofMillis(properties.getConversationStore().getExpiryMs()),
                properties.getConversationStore().getMaxMessagesPerConversation(),
                Duration.ofMillis(properties.getConversationStore().getSweepIntervalMs()));
    }

    public ConversationStore(Clock clock, Duration expiry, int maxMessagesPerConversation, Duration sweepInterval) {
        if (maxMessagesPerConversation <= 0) {
            throw new IllegalArgumentException("maxMessagesPerConversation must be positive");
        }
        this.clock = clock;
        this.expiry = expiry;
        this.maxMessagesPerConversation = maxMessagesPerConversation;
        this.sweepInterval = sweepInterval;
    }

    @PostConstruct
    public void start() {
        sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "conversation-store-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        long intervalMs = sweepInterval.toMillis();
        sweeper.scheduleAtFixedRate(this::sweepSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[ConversationStore] started (expiry={}s, maxPerConversation={}, sweepEvery={}s)",
                expiry.toSeconds(), maxMessagesPerConversation, sweepInterval.toSeconds());
    }

    @PreDestroy
    public void stop() {
        if (sweeper == null) {
            return;
        }
        sweeper.shutdown();
        try {
            if (!sweeper.awaitTermination(5, TimeUnit.SECONDS)) {
                sweeper.shutdownNow();
            }
        } catch (InterruptedException e) {
            sweeper.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean record(String conversationId, String author, String content, boolean bot, String messageId,
            boolean reply) {
        if (conversationId == null || conversationId.isBlank()) {
            log.warn("[ConversationStore] refusing message without conversation id");
            return false;
        }

        AtomicBoolean stored = new AtomicBoolean(false);
        conversations.compute(conversationId, (key, existing) -> {
            Deque<StoredMessage> messages = existing != null ? existing : new ArrayDeque<>();
            synchronized (messages) {
                if (messageId != null && containsMessageId(messages, messageId)) {
                    return messages;
                }

                Instant now = clock.instant();
                StoredMessage last = messages.peekLast();
                if (last != null && now.isBefore(last.getTimestamp())) {
                    now = last.getTimestamp();
                }

                messages.addLast(StoredMessage.builder()
                        .author(author)
                        .content(content)
                        .bot(bot)
                        .timestamp(now)
                        .messageId(messageId)
                        .reply(reply)
                        .build());
                while (messages.size() > maxMessagesPerConversation) {
                    messages.removeFirst();
                }
                stored.set(true);
            }
            return messages;
        });

        if (!stored.get()) {
            log.debug("[ConversationStore] duplicate message ignored: conversation={}, messageId={}",
                    conversationId, messageId);
        }
        return stored.get();
    }

    @Override
    public List<StoredMessage> getHistory(String conversationId, int limit, String sinceMessageId) {
        Deque<StoredMessage> messages = conversations.get(conversationId);
        if (messages == null) {
            return List.of();
        }

        Instant cutoff = clock.instant().minus(expiry);
        List<StoredMessage> live = new ArrayList<>();
        synchronized (messages) {
            for (StoredMessage message : messages) {
                if (message.getTimestamp().isAfter(cutoff)) {
                    live.add(message);
                }
            }
        }
        return HistoryWindow.apply(live, limit, sinceMessageId);
    }

    /**
     * Removes expired messages and drops conversations left empty.
     *
     * @return number of conversations removed
     */
    public int sweep() {
        Instant cutoff = clock.instant().minus(expiry);
        int removedConversations = 0;
        for (String conversationId : List.copyOf(conversations.keySet())) {
            Deque<StoredMessage> after = conversations.computeIfPresent(conversationId, (key, messages) -> {
                synchronized (messages) {
                    Iterator<StoredMessage> iterator = messages.iterator();
                    while (iterator.hasNext()) {
                        if (!iterator.next().getTimestamp().isAfter(cutoff)) {
                            iterator.remove();
                        }
                    }
                    return messages.isEmpty() ? null : messages;
                }
            });
            if (after == null) {
                removedConversations++;
            }
        }
        if (removedConversations > 0) {
            log.debug("[ConversationStore] swept {} empty conversations", removedConversations);
        }
        return removedConversations;
    }

    public int conversationCount() {
        return conversations.size();
    }

    public int messageCount(String conversationId) {
        Deque<StoredMessage> messages = conversations.get(conversationId);
        if (messages == null) {
            return 0;
        }
        synchronized (messages) {
            return messages.size();
        }
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (Exception e) { // NOSONAR - must not kill scheduler thread
            log.error("[ConversationStore] sweep failed: {}", e.getMessage(), e);
        }
    }

    private static boolean containsMessageId(Deque<StoredMessage> messages, String messageId) {
        for (StoredMessage message : messages) {
            if (messageId.equals(message.getMessageId())) {
                return true;
            }
        }
        return false;
    }
}
