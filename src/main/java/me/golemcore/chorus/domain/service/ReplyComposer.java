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
import me.golemcore.chorus.domain.model.RoleConfig;
import me.golemcore.chorus.domain.model.StoredMessage;
import me.golemcore.chorus.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the texts exchanged with the oracle and the chat: formatted history,
 * topic summaries, the final reply prompt and the persona-labelled reply.
 */
@Component
@RequiredArgsConstructor
public class ReplyComposer {

    static final int TOPIC_SUMMARY_LENGTH = 200;

    private final BotProperties properties;

    /**
     * Renders history as {@code "Author [User]: text"} blocks separated by blank
     * lines.
     */
    public String formatHistory(List<StoredMessage> history) {
        return history.stream()
                .map(message -> message.getAuthor() + (message.isBot() ? " [Bot]" : " [User]") + ": "
                        + message.getContent())
                .collect(Collectors.joining("\n\n"));
    }

    /**
     * Start of the latest human message, or of the formatted history when the
     * window holds only bot messages.
     */
    public String topicSummary(List<StoredMessage> history, String formattedHistory) {
        for (int i = history.size() - 1; i >= 0; i--) {
            StoredMessage message = history.get(i);
            if (!message.isBot() && message.getContent() != null && !message.getContent().isBlank()) {
                return truncate(message.getContent());
            }
        }
        return truncate(formattedHistory);
    }

    public String composeReplyPrompt(RoleConfig role, String formattedHistory) {
        return formattedHistory + ParticipationDecider.SEPARATOR
                + "You are " + role.getName() + ", " + role.getDescription() + ". "
                + "Respond to the conversation above from your role. Be concise and do not repeat "
                + "what others have already said.";
    }

    public String composeAnswerPrompt(RoleConfig role, String question) {
        return "You are " + role.getName() + ", " + role.getDescription() + ". "
                + "Answer the following question from a group chat.\n\n" + question;
    }

    /**
     * Sanitizes raw oracle output, substituting the configured fallback if
     * nothing readable is left.
     */
    public String finalizeReply(String rawReply) {
        String cleaned = ReplySanitizer.sanitize(rawReply);
        if (cleaned.isEmpty()) {
            return properties.getEngine().getEmptyReplyFallback();
        }
        return cleaned;
    }

    public String withPersonaHeader(RoleConfig role, String reply) {
        return "**" + role.getName() + "'s take:**\n\n" + reply;
    }

    private static String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= TOPIC_SUMMARY_LENGTH ? text : text.substring(0, TOPIC_SUMMARY_LENGTH);
    }
}
