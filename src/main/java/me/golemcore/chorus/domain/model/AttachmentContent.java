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
import lombok.Value;

import java.util.List;

/**
 * What attachment processing managed to extract from a message.
 */
@Value
@Builder
public class AttachmentContent {

    private static final AttachmentContent EMPTY = AttachmentContent.builder().build();

    String transcript;

    @Builder.Default
    List<ExtractedDocument> extractedDocuments = List.of();

    @Builder.Default
    List<String> imageDescriptions = List.of();

    public static AttachmentContent empty() {
        return EMPTY;
    }

    public boolean hasTranscript() {
        return transcript != null && !transcript.isBlank();
    }

    public boolean isEmpty() {
        return !hasTranscript() && extractedDocuments.isEmpty() && imageDescriptions.isEmpty();
    }
}
