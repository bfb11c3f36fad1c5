package me.golemcore.chorus.adapter.inbound.telegram;

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
import me.golemcore.chorus.domain.model.Attachment;
import me.golemcore.chorus.domain.model.InboundMessage;
import me.golemcore.chorus.port.inbound.ChannelPort;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.ActionType;
import org.telegram.telegrambots.meta.api.methods.GetFile;
import org.telegram.telegrambots.meta.api.methods.send.SendChatAction;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Document;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Telegram connection of a single persona, using long polling.
 *
 * <p>
 * Each persona has its own bot token and therefore its own adapter instance.
 * Telegram never shows a bot the messages of other bots in a group, which is
 * why personas share history through the conversation store.
 */
@Slf4j
public class TelegramChannelAdapter implements ChannelPort, LongPollingSingleThreadUpdateConsumer {

    static final String CHANNEL_TYPE = "telegram";
    static final int MAX_MESSAGE_LENGTH = 4000;
    private static final int TELEGRAM_HARD_LIMIT = 4096;

    private final String personaId;
    private final String token;
    private final TelegramBotsLongPollingApplication botsApplication;
    private final TelegramClient telegramClient;
    private final long maxDownloadBytes;

    private volatile Consumer<InboundMessage> messageHandler;
    private volatile boolean running = false;
    private final Object lifecycleLock = new Object();

    public TelegramChannelAdapter(String personaId, String token, TelegramBotsLongPollingApplication botsApplication,
            TelegramClient telegramClient, long maxDownloadBytes) {
        this.personaId = personaId;
        this.token = token;
        this.botsApplication = botsApplication;
        this.telegramClient = telegramClient;
        this.maxDownloadBytes = maxDownloadBytes;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("[Telegram] {} already running", personaId);
                return;
            }
            try {
                botsApplication.registerBot(token, this);
                running = true;
                log.info("[Telegram] {} started polling", personaId);
            } catch (TelegramApiException e) {
                throw new IllegalStateException("Telegram registration failed for " + personaId + ": "
                        + e.getMessage(), e);
            }
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            try {
                botsApplication.unregisterBot(token);
                log.info("[Telegram] {} stopped polling", personaId);
            } catch (TelegramApiException e) {
                log.warn("[Telegram] {} could not unregister: {}", personaId, e.getMessage());
            }
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getMaxMessageLength() {
        return MAX_MESSAGE_LENGTH;
    }

    @Override
    public void onMessage(Consumer<InboundMessage> handler) {
        this.messageHandler = handler;
    }

    @Override
    public void consume(Update update) {
        if (!update.hasMessage()) {
            return;
        }
        Consumer<InboundMessage> handler = messageHandler;
        if (handler == null) {
            log.debug("[Telegram] {} has no handler yet, dropping update {}", personaId, update.getUpdateId());
            return;
        }
        try {
            handler.accept(toInboundMessage(update.getMessage()));
        } catch (Exception e) { // NOSONAR - must not kill polling thread
            log.error("[Telegram] {} failed to handle update {}: {}", personaId, update.getUpdateId(),
                    e.getMessage(), e);
        }
    }

    InboundMessage toInboundMessage(Message telegramMessage) {
        User from = telegramMessage.getFrom();
        String content = telegramMessage.hasText() ? telegramMessage.getText() : telegramMessage.getCaption();
        Message replyTo = telegramMessage.getReplyToMessage();
        Instant timestamp = telegramMessage.getDate() != null
                ? Instant.ofEpochSecond(telegramMessage.getDate())
                : Instant.now();

        return InboundMessage.builder()
                .conversationId(telegramMessage.getChatId().toString())
                .messageId(telegramMessage.getMessageId().toString())
                .replyToMessageId(replyTo != null ? replyTo.getMessageId().toString() : null)
                .author(displayName(from))
                .bot(from != null && Boolean.TRUE.equals(from.getIsBot()))
                .content(content)
                .channelType(CHANNEL_TYPE)
                .timestamp(timestamp)
                .attachments(collectAttachments(telegramMessage))
                .build();
    }

    private List<Attachment> collectAttachments(Message telegramMessage) {
        List<Attachment> attachments = new ArrayList<>();
        if (telegramMessage.hasVoice()) {
            attachments.add(Attachment.builder()
                    .type(Attachment.Type.VOICE)
                    .loader(deferredDownload(telegramMessage.getVoice().getFileId(),
                            telegramMessage.getVoice().getFileSize()))
                    .filename("voice.ogg")
                    .mimeType("audio/ogg")
                    .build());
        }
        if (telegramMessage.hasAudio()) {
            attachments.add(Attachment.builder()
                    .type(Attachment.Type.AUDIO)
                    .loader(deferredDownload(telegramMessage.getAudio().getFileId(),
                            telegramMessage.getAudio().getFileSize()))
                    .filename(telegramMessage.getAudio().getFileName())
                    .mimeType(telegramMessage.getAudio().getMimeType())
                    .build());
        }
        if (telegramMessage.hasDocument()) {
            Document document = telegramMessage.getDocument();
            attachments.add(Attachment.builder()
                    .type(Attachment.Type.DOCUMENT)
                    .loader(deferredDownload(document.getFileId(), document.getFileSize()))
                    .filename(document.getFileName())
                    .mimeType(document.getMimeType())
                    .build());
        }
        if (telegramMessage.hasPhoto()) {
            attachments.add(Attachment.builder().type(Attachment.Type.IMAGE).mimeType("image/jpeg").build());
        }
        if (telegramMessage.hasVideo() || telegramMessage.hasVideoNote()) {
            attachments.add(Attachment.builder().type(Attachment.Type.VIDEO).build());
        }
        return attachments;
    }

    private Attachment.Loader deferredDownload(String fileId, Long declaredSize) {
        if (declaredSize != null && declaredSize > maxDownloadBytes) {
            log.info("[Telegram] {} skipping download of {} ({} bytes over limit)", personaId, fileId, declaredSize);
            return null;
        }
        return () -> download(fileId);
    }

    private byte[] download(String fileId) {
        try {
            org.telegram.telegrambots.meta.api.objects.File file = telegramClient.execute(new GetFile(fileId));
            try (InputStream in = telegramClient.downloadFileAsStream(file)) {
                return in.readAllBytes();
            }
        } catch (TelegramApiException | IOException e) {
            log.warn("[Telegram] {} could not download {}: {}", personaId, fileId, e.getMessage());
            return null;
        }
    }

    @Override
    public CompletableFuture<Void> sendMessage(String conversationId, String text, String replyToMessageId) {
        return CompletableFuture.runAsync(() -> {
            Integer replyTo = parseMessageId(replyToMessageId);
            String formatted = TelegramMarkdownFormatter.format(text);
            if (formatted.length() > TELEGRAM_HARD_LIMIT) {
                formatted = formatted.substring(0, TELEGRAM_HARD_LIMIT - 3) + "...";
            }
            try {
                telegramClient.execute(SendMessage.builder()
                        .chatId(conversationId)
                        .text(formatted)
                        .parseMode("HTML")
                        .replyToMessageId(replyTo)
                        .build());
            } catch (TelegramApiException htmlEx) {
                log.debug("[Telegram] HTML send failed, retrying as plain text: {}", htmlEx.getMessage());
                try {
                    telegramClient.execute(SendMessage.builder()
                            .chatId(conversationId)
                            .text(text)
                            .replyToMessageId(replyTo)
                            .build());
                } catch (TelegramApiException plainEx) {
                    throw new IllegalStateException("Failed to send message to " + conversationId, plainEx);
                }
            }
        });
    }

    @Override
    public void showTyping(String conversationId) {
        try {
            telegramClient.execute(SendChatAction.builder()
                    .chatId(conversationId)
                    .action(ActionType.TYPING.toString())
                    .build());
        } catch (TelegramApiException e) {
            log.debug("[Telegram] failed to send typing indicator", e);
        }
    }

    private static Integer parseMessageId(String messageId) {
        if (messageId == null || messageId.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(messageId);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String displayName(User user) {
        if (user == null) {
            return "Unknown";
        }
        String first = user.getFirstName() != null ? user.getFirstName() : "";
        String last = user.getLastName() != null ? user.getLastName() : "";
        String full = (first + " " + last).trim();
        if (!full.isEmpty()) {
            return full;
        }
        return user.getUserName() != null ? user.getUserName() : String.valueOf(user.getId());
    }
}
