package me.golemcore.chorus.adapter.outbound.attachment;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chorus.domain.model.Attachment;
import me.golemcore.chorus.domain.model.AttachmentContent;
import me.golemcore.chorus.domain.model.ExtractedDocument;
import me.golemcore.chorus.domain.model.InboundMessage;
import me.golemcore.chorus.infrastructure.config.BotProperties;
import me.golemcore.chorus.port.outbound.AttachmentPort;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Extracts text from attachments: voice and audio through a Whisper-compatible
 * endpoint ({@code POST /v1/audio/transcriptions}), and plain-text documents
 * by decoding them as UTF-8. Other attachments yield nothing.
 *
 * <p>
 * Voice transcription is skipped when {@code bot.voice.whisper.url} is blank.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WhisperAttachmentAdapter implements AttachmentPort {

    private static final String TRANSCRIPTION_PATH = "/v1/audio/transcriptions";
    private static final Set<String> TEXT_EXTENSIONS = Set.of("txt", "md", "csv", "json", "log", "xml", "yaml",
            "yml", "html", "java", "py", "js", "ts");

    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final BotProperties properties;

    @Override
    public AttachmentContent process(InboundMessage message) {
        String transcript = null;
        List<ExtractedDocument> documents = new ArrayList<>();

        for (Attachment attachment : message.getAttachments()) {
            switch (attachment.getType()) {
            case VOICE, AUDIO -> {
                if (transcript == null && attachment.loadData()) {
                    transcript = transcribe(attachment);
                }
            }
            case DOCUMENT -> {
                if (attachment.loadData()) {
                    extractText(attachment).ifPresent(documents::add);
                }
            }
            default -> log.debug("[Attachments] no extractor for {}", attachment.getType());
            }
        }

        return AttachmentContent.builder()
                .transcript(transcript)
                .extractedDocuments(documents)
                .build();
    }

    String transcribe(Attachment attachment) {
        BotProperties.WhisperProperties whisper = properties.getVoice().getWhisper();
        if (whisper.getUrl() == null || whisper.getUrl().isBlank()) {
            log.debug("[WhisperSTT] URL not configured, skipping transcription");
            return null;
        }

        String mimeType = attachment.getMimeType() != null ? attachment.getMimeType() : "audio/ogg";
        String filename = attachment.getFilename() != null ? attachment.getFilename() : "audio.ogg";
        RequestBody fileBody = RequestBody.create(attachment.getData(), MediaType.parse(mimeType));

        MultipartBody.Builder body = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("file", filename, fileBody)
                .addFormDataPart("model", whisper.getModel())
                .addFormDataPart("response_format", "json");
        if (whisper.getLanguage() != null && !whisper.getLanguage().isBlank()) {
            body.addFormDataPart("language", whisper.getLanguage());
        }

        Request.Builder requestBuilder = new Request.Builder()
                .url(normalizeBaseUrl(whisper.getUrl()) + TRANSCRIPTION_PATH)
                .post(body.build());
        if (whisper.getApiKey() != null && !whisper.getApiKey().isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + whisper.getApiKey());
        }

        long startTime = System.currentTimeMillis();
        try (Response response = okHttpClient.newCall(requestBuilder.build()).execute()) {
            ResponseBody responseBody = response.body();
            if (!response.isSuccessful() || responseBody == null) {
                log.warn("[WhisperSTT] transcription failed (HTTP {})", response.code());
                return null;
            }
            WhisperResponse parsed = objectMapper.readValue(responseBody.string(), WhisperResponse.class);
            String text = parsed.getText() != null ? parsed.getText().trim() : null;
            log.info("[WhisperSTT] transcribed {} bytes into {} chars in {}ms", attachment.getData().length,
                    text != null ? text.length() : 0, System.currentTimeMillis() - startTime);
            return text == null || text.isEmpty() ? null : text;
        } catch (IOException e) {
            log.warn("[WhisperSTT] transcription request failed: {}", e.getMessage());
            return null;
        }
    }

    Optional<ExtractedDocument> extractText(Attachment attachment) {
        if (!isTextLike(attachment)) {
            return Optional.empty();
        }
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(attachment.getData()))
                    .toString()
                    .trim();
        } catch (CharacterCodingException e) {
            log.debug("[Attachments] {} is not valid UTF-8", attachment.getFilename());
            return Optional.empty();
        }
        if (text.isEmpty()) {
            return Optional.empty();
        }
        int maxChars = properties.getAttachments().getMaxDocumentChars();
        if (text.length() > maxChars) {
            text = text.substring(0, maxChars) + "\n[truncated]";
        }
        String name = attachment.getFilename() != null ? attachment.getFilename() : "document";
        return Optional.of(new ExtractedDocument(name, text));
    }

    private static boolean isTextLike(Attachment attachment) {
        String mimeType = attachment.getMimeType();
        if (mimeType != null && (mimeType.startsWith("text/") || mimeType.equals("application/json"))) {
            return true;
        }
        String filename = attachment.getFilename();
        if (filename == null || !filename.contains(".")) {
            return false;
        }
        String extension = filename.substring(filename.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT);
        return TEXT_EXTENSIONS.contains(extension);
    }

    private static String normalizeBaseUrl(String baseUrl) {
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WhisperResponse {
        private String text;
        private String language;
    }
}
