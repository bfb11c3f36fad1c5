package me.golemcore.chorus.adapter.inbound.telegram;

import me.golemcore.chorus.domain.model.Attachment;
import me.golemcore.chorus.domain.model.InboundMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.meta.api.methods.GetFile;
import org.telegram.telegrambots.meta.api.methods.send.SendChatAction;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.File;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.api.objects.Voice;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.io.ByteArrayInputStream;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TelegramChannelAdapterTest {

    private static final String TOKEN = "123:abc";

    private TelegramBotsLongPollingApplication botsApplication;
    private TelegramClient telegramClient;
    private TelegramChannelAdapter adapter;

    @BeforeEach
    void setUp() {
        botsApplication = mock(TelegramBotsLongPollingApplication.class);
        telegramClient = mock(TelegramClient.class);
        adapter = new TelegramChannelAdapter("critic", TOKEN, botsApplication, telegramClient, 1024);
    }

    // ===== lifecycle =====

    @Test
    void shouldRegisterOnceAndUnregisterOnStop() throws Exception {
        adapter.start();
        adapter.start();

        assertTrue(adapter.isRunning());
        verify(botsApplication, times(1)).registerBot(TOKEN, adapter);

        adapter.stop();

        assertFalse(adapter.isRunning());
        verify(botsApplication).unregisterBot(TOKEN);
    }

    @Test
    void shouldFailStartWhenRegistrationFails() throws Exception {
        doThrow(new TelegramApiException("Unauthorized")).when(botsApplication).registerBot(TOKEN, adapter);

        assertThrows(IllegalStateException.class, () -> adapter.start());
        assertFalse(adapter.isRunning());
    }

    // ===== inbound =====

    @Test
    void shouldConvertTextMessage() {
        Message replyTo = mock(Message.class);
        when(replyTo.getMessageId()).thenReturn(7);
        Message message = textMessage(-100L, 8, "Are you sure?", user("Alice", "Smith", false));
        when(message.getReplyToMessage()).thenReturn(replyTo);
        when(message.getDate()).thenReturn(1_767_268_800);

        InboundMessage inbound = adapter.toInboundMessage(message);

        assertEquals("-100", inbound.getConversationId());
        assertEquals("8", inbound.getMessageId());
        assertEquals("7", inbound.getReplyToMessageId());
        assertTrue(inbound.isReply());
        assertEquals("Alice Smith", inbound.getAuthor());
        assertFalse(inbound.isBot());
        assertEquals("Are you sure?", inbound.getContent());
        assertEquals("telegram", inbound.getChannelType());
        assertEquals(Instant.ofEpochSecond(1_767_268_800), inbound.getTimestamp());
        assertTrue(inbound.getAttachments().isEmpty());
    }

    @Test
    void shouldMarkBotAuthors() {
        Message message = textMessage(1L, 2, "Paris.", user(null, null, true));

        InboundMessage inbound = adapter.toInboundMessage(message);

        assertTrue(inbound.isBot());
        assertEquals("expert_bot", inbound.getAuthor());
    }

    @Test
    void shouldDeferVoiceDownloadUntilLoaded() throws Exception {
        Message message = textMessage(1L, 2, null, user("Alice", null, false));
        when(message.hasText()).thenReturn(false);
        Voice voice = mock(Voice.class);
        when(voice.getFileId()).thenReturn("voice-1");
        when(voice.getFileSize()).thenReturn(3L);
        when(message.hasVoice()).thenReturn(true);
        when(message.getVoice()).thenReturn(voice);
        File file = mock(File.class);
        when(telegramClient.execute(any(GetFile.class))).thenReturn(file);
        when(telegramClient.downloadFileAsStream(file)).thenReturn(new ByteArrayInputStream(new byte[] { 1, 2, 3 }));

        InboundMessage inbound = adapter.toInboundMessage(message);

        assertTrue(inbound.hasAttachment(Attachment.Type.VOICE));
        verify(telegramClient, never()).execute(any(GetFile.class));

        Attachment attachment = inbound.getAttachments().get(0);
        assertTrue(attachment.loadData());
        assertArrayEquals(new byte[] { 1, 2, 3 }, attachment.getData());
        assertTrue(attachment.loadData());
        verify(telegramClient, times(1)).execute(any(GetFile.class));
    }

    @Test
    void shouldSkipOversizedDownloads() throws Exception {
        Message message = textMessage(1L, 2, null, user("Alice", null, false));
        Voice voice = mock(Voice.class);
        when(voice.getFileId()).thenReturn("voice-1");
        when(voice.getFileSize()).thenReturn(4096L);
        when(message.hasVoice()).thenReturn(true);
        when(message.getVoice()).thenReturn(voice);

        InboundMessage inbound = adapter.toInboundMessage(message);

        assertFalse(inbound.getAttachments().get(0).loadData());
        verify(telegramClient, never()).execute(any(GetFile.class));
    }

    @Test
    void shouldMarkPhotosAsImages() {
        Message message = textMessage(1L, 2, null, user("Alice", null, false));
        when(message.hasPhoto()).thenReturn(true);
        when(message.getCaption()).thenReturn("look at this");

        InboundMessage inbound = adapter.toInboundMessage(message);

        assertEquals("look at this", inbound.getContent());
        assertTrue(inbound.hasAttachment(Attachment.Type.IMAGE));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldDeliverUpdatesToHandlerAndSurviveHandlerFailure() {
        Consumer<InboundMessage> handler = mock(Consumer.class);
        doThrow(new IllegalStateException("boom")).when(handler).accept(any());
        adapter.onMessage(handler);
        Update update = mock(Update.class);
        when(update.hasMessage()).thenReturn(true);
        Message message = textMessage(1L, 2, "hi", user("Alice", null, false));
        when(update.getMessage()).thenReturn(message);

        assertDoesNotThrow(() -> adapter.consume(update));
        verify(handler).accept(any(InboundMessage.class));
    }

    @Test
    void shouldIgnoreUpdatesWithoutMessage() {
        Update update = mock(Update.class);
        when(update.hasMessage()).thenReturn(false);

        adapter.consume(update);

        verify(update, never()).getMessage();
    }

    // ===== outbound =====

    @Test
    void shouldSendHtmlReply() throws Exception {
        when(telegramClient.execute(any(SendMessage.class))).thenReturn(mock(Message.class));

        adapter.sendMessage("100", "**Critic's take:**\n\nFine.", "42").get();

        ArgumentCaptor<SendMessage> captor = ArgumentCaptor.forClass(SendMessage.class);
        verify(telegramClient).execute(captor.capture());
        SendMessage sent = captor.getValue();
        assertEquals("100", sent.getChatId());
        assertEquals("HTML", sent.getParseMode());
        assertEquals(42, sent.getReplyToMessageId());
        assertEquals("<b>Critic's take:</b>\n\nFine.", sent.getText());
    }

    @Test
    void shouldFallBackToPlainText() throws Exception {
        when(telegramClient.execute(any(SendMessage.class)))
                .thenThrow(new TelegramApiException("can't parse entities"))
                .thenReturn(mock(Message.class));

        adapter.sendMessage("100", "**bold**", null).get();

        ArgumentCaptor<SendMessage> captor = ArgumentCaptor.forClass(SendMessage.class);
        verify(telegramClient, times(2)).execute(captor.capture());
        List<SendMessage> attempts = captor.getAllValues();
        assertNull(attempts.get(1).getParseMode());
        assertEquals("**bold**", attempts.get(1).getText());
    }

    @Test
    void shouldFailWhenBothAttemptsFail() throws Exception {
        when(telegramClient.execute(any(SendMessage.class))).thenThrow(new TelegramApiException("blocked"));

        assertThrows(ExecutionException.class, () -> adapter.sendMessage("100", "hi", null).get());
    }

    @Test
    void shouldSendTypingIndicator() throws Exception {
        adapter.showTyping("100");

        verify(telegramClient).execute(any(SendChatAction.class));
    }

    @Test
    void shouldExposeTelegramLimits() {
        assertEquals("telegram", adapter.getChannelType());
        assertEquals(4000, adapter.getMaxMessageLength());
        assertFalse(adapter.supportsNativeHistory());
    }

    private static Message textMessage(long chatId, int messageId, String text, User from) {
        Message message = mock(Message.class);
        when(message.getChatId()).thenReturn(chatId);
        when(message.getMessageId()).thenReturn(messageId);
        when(message.getFrom()).thenReturn(from);
        when(message.hasText()).thenReturn(text != null);
        when(message.getText()).thenReturn(text);
        return message;
    }

    private static User user(String firstName, String lastName, boolean bot) {
        User user = mock(User.class);
        when(user.getId()).thenReturn(55L);
        when(user.getFirstName()).thenReturn(firstName);
        when(user.getLastName()).thenReturn(lastName);
        when(user.getUserName()).thenReturn("expert_bot");
        when(user.getIsBot()).thenReturn(bot);
        return user;
    }
}
