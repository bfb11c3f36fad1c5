package me.golemcore.chorus.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Message as delivered by a channel adapter, before it enters the engine.
 */
@Data
@Builder(toBuilder = true)
public class InboundMessage {

    private String conversationId;
    private String messageId;
    private String replyToMessageId;
    private String author;
    private String content;
    private boolean bot;
    private String channelType;
    private Instant timestamp;

    @Builder.Default
    private List<Attachment> attachments = new ArrayList<>();

    /**
     * A reply continues an existing thread instead of asking a new question.
     */
    public boolean isReply() {
        return replyToMessageId != null && !replyToMessageId.isBlank();
    }

    public boolean hasText() {
        return content != null && !content.isBlank();
    }

    public boolean hasAttachments() {
        return attachments != null && !attachments.isEmpty();
    }

    public boolean hasAttachment(Attachment.Type type) {
        return hasAttachments() && attachments.stream().anyMatch(a -> a.getType() == type);
    }
}
