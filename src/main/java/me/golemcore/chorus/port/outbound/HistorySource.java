package me.golemcore.chorus.port.outbound;

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

import me.golemcore.chorus.domain.model.StoredMessage;

import java.util.List;

/**
 * Where observation cycles read conversation history from.
 */
public interface HistorySource {

    /**
     * Returns a window of recent, non-expired messages, oldest first.
     *
     * @param sinceMessageId
     *            anchor message; when present the window starts at it
     */
    List<StoredMessage> getHistory(String conversationId, int limit, String sinceMessageId);

    /**
     * Appends a message. Recording the same {@code messageId} twice is a no-op.
     *
     * @return {@code true} if the message was stored
     */
    boolean record(String conversationId, String author, String content, boolean bot, String messageId,
            boolean reply);
}
