package me.golemcore.chorus.port.inbound;

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

import me.golemcore.chorus.domain.model.InboundMessage;
import me.golemcore.chorus.domain.model.StoredMessage;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Bidirectional port for a chat platform connection owned by one persona.
 * Implementations manage the connection lifecycle and deliver inbound messages
 * to the registered handler.
 */
public interface ChannelPort {

    /**
     * Returns the channel type identifier (e.g., "telegram").
     */
    String getChannelType();

    void start();

    void stop();

    boolean isRunning();

    /**
     * Sends a text message, optionally as a reply to an existing message.
     *
     * @param replyToMessageId
     *            message to reply to, or {@code null}
     */
    CompletableFuture<Void> sendMessage(String conversationId, String text, String replyToMessageId);

    /**
     * Largest text the platform accepts in a single message.
     */
    int getMaxMessageLength();

    /**
     * Registers the callback invoked for every inbound message.
     */
    void onMessage(Consumer<InboundMessage> handler);

    /**
     * Displays a typing indicator. Default implementation does nothing.
     */
    default void showTyping(String conversationId) {
        // no-op by default
    }

    /**
     * Whether the platform can return recent messages itself.
     */
    default boolean supportsNativeHistory() {
        return false;
    }

    /**
     * Fetches recent messages from the platform, oldest first. Only meaningful
     * when {@link #supportsNativeHistory()} is true.
     */
    default Optional<List<StoredMessage>> fetchRecentMessages(String conversationId, int limit) {
        return Optional.empty();
    }
}
