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

import me.golemcore.chorus.domain.model.StoredMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * Selects the slice of a conversation an observation cycle looks at.
 *
 * <p>
 * With an anchor that is present, the window starts at the anchor and keeps
 * only later messages that continue it: bot messages and replies. Fresh
 * questions asked after the anchor belong to their own observation and are
 * left out. The anchor is always kept, followed by the latest
 * {@code limit - 1} continuations, so a busy thread still shows its newest
 * turns. Without an anchor, or when the anchor has already left the buffer, the last
 * {@code limit} messages are returned.
 */
public final class HistoryWindow {

    private HistoryWindow() {
    }

    public static List<StoredMessage> apply(List<StoredMessage> messages, int limit, String sinceMessageId) {
        if (messages == null || messages.isEmpty() || limit <= 0) {
            return List.of();
        }

        if (sinceMessageId != null && !sinceMessageId.isBlank()) {
            int anchorIndex = indexOf(messages, sinceMessageId);
            if (anchorIndex >= 0) {
                List<StoredMessage> continuations = new ArrayList<>();
                for (int i = anchorIndex + 1; i < messages.size(); i++) {
                    StoredMessage candidate = messages.get(i);
                    if (candidate.isBot() || candidate.isReply()) {
                        continuations.add(candidate);
                    }
                }
                int keep = Math.min(continuations.size(), limit - 1);
                List<StoredMessage> window = new ArrayList<>(keep + 1);
                window.add(messages.get(anchorIndex));
                window.addAll(continuations.subList(continuations.size() - keep, continuations.size()));
                return List.copyOf(window);
            }
        }

        int from = Math.max(0, messages.size() - limit);
        return List.copyOf(messages.subList(from, messages.size()));
    }

    private static int indexOf(List<StoredMessage> messages, String messageId) {
        for (int i = 0; i < messages.size(); i++) {
            if (messageId.equals(messages.get(i).getMessageId())) {
                return i;
            }
        }
        return -1;
    }
}
