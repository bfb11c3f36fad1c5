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
import me.golemcore.chorus.domain.model.Attachment;
import me.golemcore.chorus.domain.model.AttachmentContent;
import me.golemcore.chorus.domain.model.ExtractedDocument;
import me.golemcore.chorus.domain.model.InboundMessage;
import me.golemcore.chorus.port.outbound.AttachmentPort;
import org.springframework.stereotype.Component;

/**
 * Folds attachment-derived text into a message's content so the rest of the
 * engine only ever deals with text.
 *
 * <p>
 * A voice transcript replaces the text; document text and image descriptions
 * are appended as labelled sections. When nothing could be extracted, a short
 * placeholder such as {@code [Voice message]} stands in.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AttachmentFolder {

    private final AttachmentPort attachmentPort;

    public String fold(InboundMessage message) {
        String text = message.getContent() != null ? message.getContent().trim() : "";
        if (!message.hasAttachments()) {
            return text;
        }

        AttachmentContent extracted;
        try {
            extracted = attachmentPort.process(message);
        } catch (RuntimeException e) {
            log.warn("[Attachments] processing failed for message {}: {}", message.getMessageId(), e.getMessage());
            extracted = AttachmentContent.empty();
        }
        if (extracted == null) {
            extracted = AttachmentContent.empty();
        }

        StringBuilder folded = new StringBuilder(extracted.hasTranscript() ? extracted.getTranscript().trim() : text);
        for (ExtractedDocument document : extracted.getExtractedDocuments()) {
            folded.append("\n\n[Document: ").append(document.filename()).append("]\n").append(document.text());
        }
        for (String description : extracted.getImageDescriptions()) {
            folded.append("\n\n[Image]\n").append(description);
        }

        String result = folded.toString().trim();
        return result.isEmpty() ? placeholder(message) : result;
    }

    static String placeholder(InboundMessage message) {
        Attachment first = message.getAttachments().get(0);
        return switch (first.getType()) {
        case VOICE, AUDIO -> "[Voice message]";
        case VIDEO -> "[Video message]";
        case DOCUMENT -> "[Document: " + (first.getFilename() != null ? first.getFilename() : "file") + "]";
        case IMAGE -> "[Image]";
        };
    }
}
