package me.filot.bot.adapter.inbound.telegram;

import me.filot.bot.domain.model.EventKind;
import me.filot.bot.domain.model.InboundEvent;
import me.filot.bot.domain.model.InstanceLeaseAcquiredEvent;
import me.filot.bot.domain.model.InstanceLeaseLostEvent;
import me.filot.bot.domain.service.UpdateDispatcher;
import me.filot.bot.infrastructure.config.BotProperties;
import me.filot.bot.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TelegramAdapterTest {

    private static final long CHAT_ID = 100L;

    private MutableClock clock;
    private TelegramBotsLongPollingApplication botsApplication;
    private UpdateDispatcher dispatcher;
    private TelegramClient telegramClient;
    private TelegramAdapter adapter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        botsApplication = mock(TelegramBotsLongPollingApplication.class);
        dispatcher = mock(UpdateDispatcher.class);
        telegramClient = mock(TelegramClient.class);

        BotProperties properties = new BotProperties();
        BotProperties.ChannelProperties telegram = new BotProperties.ChannelProperties();
        telegram.setEnabled(true);
        telegram.setToken("test-token");
        properties.getChannels().put("telegram", telegram);

        adapter = new TelegramAdapter(properties, botsApplication, dispatcher, clock);
        adapter.setTelegramClient(telegramClient);
    }

    @Test
    void shouldRegisterBotOnStart() throws Exception {
        adapter.start();

        assertTrue(adapter.isRunning());
        verify(botsApplication).registerBot("test-token", adapter);
    }

    @Test
    void shouldDispatchCallbackWithCallbackIdAsEventId() throws Exception {
        adapter.start();

        adapter.consume(createCallbackUpdate("cb-1", 42, "menu_invest"));

        ArgumentCaptor<InboundEvent> captor = ArgumentCaptor.forClass(InboundEvent.class);
        verify(dispatcher).dispatch(captor.capture());
        InboundEvent event = captor.getValue();
        assertEquals(CHAT_ID, event.getChatId());
        assertEquals("cb-1", event.getEventId());
        assertEquals(EventKind.CALLBACK, event.getKind());
        assertEquals("menu_invest", event.getPayload());
        assertEquals(42, event.getMessageId());
        assertEquals(clock.instant(), event.getTimestamp());
        verify(telegramClient, timeout(1000)).execute(any(AnswerCallbackQuery.class));
    }

    @Test
    void shouldDispatchTextMessageWithUpdateIdAsEventId() throws Exception {
        adapter.start();

        adapter.consume(createTextUpdate(777, "amount_100"));

        ArgumentCaptor<InboundEvent> captor = ArgumentCaptor.forClass(InboundEvent.class);
        verify(dispatcher).dispatch(captor.capture());
        assertEquals("777", captor.getValue().getEventId());
        assertEquals(EventKind.MESSAGE, captor.getValue().getKind());
        assertEquals("amount_100", captor.getValue().getPayload());
    }

    @Test
    void shouldIgnoreCallbackWithoutMessage() throws Exception {
        adapter.start();
        CallbackQuery callback = mock(CallbackQuery.class);
        when(callback.getMessage()).thenReturn(null);
        Update update = mock(Update.class);
        when(update.hasCallbackQuery()).thenReturn(true);
        when(update.getCallbackQuery()).thenReturn(callback);

        adapter.consume(update);

        verify(dispatcher, never()).dispatch(any());
    }

    @Test
    void shouldIgnoreUpdatesWhileStopped() {
        adapter.consume(createTextUpdate(1, "hello"));

        verify(dispatcher, never()).dispatch(any());
    }

    @Test
    void shouldKeepDispatchingWhenCallbackAnswerFails() throws Exception {
        adapter.start();
        when(telegramClient.execute(any(AnswerCallbackQuery.class))).thenThrow(new TelegramApiException("expired"));

        adapter.consume(createCallbackUpdate("cb-2", 1, "start_invest"));

        verify(dispatcher).dispatch(any(InboundEvent.class));
    }

    @Test
    void shouldNotWaitForCallbackAnswerBeforeDispatching() throws Exception {
        adapter.start();
        CountDownLatch answerReleased = new CountDownLatch(1);
        when(telegramClient.execute(any(AnswerCallbackQuery.class))).thenAnswer(invocation -> {
            answerReleased.await(5, TimeUnit.SECONDS);
            return true;
        });

        long started = System.nanoTime();
        adapter.consume(createCallbackUpdate("cb-3", 1, "menu_invest"));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        try {
            assertTrue(elapsedMs < 1000, "consume blocked for " + elapsedMs + " ms");
            verify(dispatcher).dispatch(any(InboundEvent.class));
            verify(telegramClient, timeout(1000)).execute(any(AnswerCallbackQuery.class));
        } finally {
            answerReleased.countDown();
        }
    }

    @Test
    void shouldStopPollingWhenLeaseLost() throws Exception {
        adapter.start();

        adapter.onLeaseLost(new InstanceLeaseLostEvent("owner-a", "heartbeat not renewed"));

        assertFalse(adapter.isRunning());
        verify(botsApplication).unregisterBot("test-token");
        verify(botsApplication, never()).close();
        adapter.consume(createTextUpdate(2, "hello"));
        verify(dispatcher, never()).dispatch(any());
    }

    @Test
    void shouldResumePollingWhenLeaseReacquired() throws Exception {
        adapter.start();
        adapter.onLeaseLost(new InstanceLeaseLostEvent("owner-a", "heartbeat not renewed"));

        adapter.onLeaseAcquired(new InstanceLeaseAcquiredEvent("owner-a"));

        assertTrue(adapter.isRunning());
        verify(botsApplication, times(2)).registerBot("test-token", adapter);
        adapter.consume(createTextUpdate(3, "hello"));
        verify(dispatcher).dispatch(any(InboundEvent.class));
    }

    @Test
    void shouldNotResumePollingWhenChannelDisabled() throws Exception {
        BotProperties disabledProperties = new BotProperties();
        BotProperties.ChannelProperties telegram = new BotProperties.ChannelProperties();
        telegram.setEnabled(false);
        telegram.setToken("test-token");
        disabledProperties.getChannels().put("telegram", telegram);
        TelegramAdapter disabled = new TelegramAdapter(disabledProperties, botsApplication, dispatcher, clock);
        disabled.setTelegramClient(telegramClient);

        disabled.onLeaseAcquired(new InstanceLeaseAcquiredEvent("owner-a"));

        assertFalse(disabled.isRunning());
        verify(botsApplication, never()).registerBot("test-token", disabled);
    }

    @Test
    void shouldCloseApplicationOnDestroy() throws Exception {
        adapter.start();

        adapter.destroy();

        assertFalse(adapter.isRunning());
        verify(botsApplication).unregisterBot("test-token");
        verify(botsApplication).close();
    }

    @Test
    void shouldSendMessage() throws Exception {
        adapter.sendMessage(CHAT_ID, "hi").join();

        ArgumentCaptor<SendMessage> captor = ArgumentCaptor.forClass(SendMessage.class);
        verify(telegramClient).execute(captor.capture());
        assertEquals("100", captor.getValue().getChatId());
        assertEquals("hi", captor.getValue().getText());
    }

    @Test
    void shouldTruncateOverlongMessage() throws Exception {
        adapter.sendMessage(CHAT_ID, "x".repeat(5000)).join();

        ArgumentCaptor<SendMessage> captor = ArgumentCaptor.forClass(SendMessage.class);
        verify(telegramClient).execute(captor.capture());
        assertEquals(4096, captor.getValue().getText().length());
    }

    @Test
    void shouldFailFutureWhenSendFails() throws Exception {
        when(telegramClient.execute(any(SendMessage.class))).thenThrow(new TelegramApiException("blocked"));

        assertThrows(CompletionException.class, () -> adapter.sendMessage(CHAT_ID, "hi").join());
    }

    @Test
    void shouldExposeChannelType() {
        assertEquals("telegram", adapter.getChannelType());
    }

    private Update createCallbackUpdate(String callbackId, int messageId, String data) {
        Message message = mock(Message.class);
        when(message.getChatId()).thenReturn(CHAT_ID);
        when(message.getMessageId()).thenReturn(messageId);

        CallbackQuery callback = mock(CallbackQuery.class);
        when(callback.getId()).thenReturn(callbackId);
        when(callback.getMessage()).thenReturn(message);
        when(callback.getData()).thenReturn(data);

        Update update = mock(Update.class);
        when(update.hasCallbackQuery()).thenReturn(true);
        when(update.getCallbackQuery()).thenReturn(callback);
        return update;
    }

    private Update createTextUpdate(int updateId, String text) {
        Message message = mock(Message.class);
        when(message.getChatId()).thenReturn(CHAT_ID);
        when(message.getMessageId()).thenReturn(1);
        when(message.hasText()).thenReturn(true);
        when(message.getText()).thenReturn(text);

        Update update = mock(Update.class);
        when(update.getUpdateId()).thenReturn(updateId);
        when(update.hasCallbackQuery()).thenReturn(false);
        when(update.hasMessage()).thenReturn(true);
        when(update.getMessage()).thenReturn(message);
        return update;
    }
}
