package me.filot.bot.adapter.inbound.telegram;

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

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.filot.bot.domain.model.EventKind;
import me.filot.bot.domain.model.InboundEvent;
import me.filot.bot.domain.model.InstanceLeaseAcquiredEvent;
import me.filot.bot.domain.model.InstanceLeaseLostEvent;
import me.filot.bot.domain.service.UpdateDispatcher;
import me.filot.bot.infrastructure.config.BotProperties;
import me.filot.bot.port.inbound.ChannelPort;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;

/**
 * Telegram channel adapter using long polling.
 *
 * <p>
 * This adapter implements both {@link ChannelPort} for outbound messaging and
 * {@link LongPollingSingleThreadUpdateConsumer} for inbound updates. Every
 * update is converted to an {@link InboundEvent} and handed to the
 * {@link UpdateDispatcher}; the polling thread never runs business logic.
 *
 * <p>
 * Event ids:
 * <ul>
 * <li>callback query: the callback query id, payload = callback data</li>
 * <li>text message: the update id, payload = message text</li>
 * </ul>
 *
 * <p>
 * Polling is started only by the startup sequence after the instance lease is
 * held. It stops as soon as {@link InstanceLeaseLostEvent} is published and
 * resumes on {@link InstanceLeaseAcquiredEvent}. Callback acknowledgements are
 * sent off the polling thread so a slow Telegram API never delays admission.
 *
 * @see me.filot.bot.port.inbound.ChannelPort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramAdapter implements ChannelPort, LongPollingSingleThreadUpdateConsumer {

    private static final String CHANNEL_TYPE = "telegram";
    private static final int TELEGRAM_MAX_MESSAGE_LENGTH = 4096;

    private final BotProperties properties;
    private final TelegramBotsLongPollingApplication botsApplication;
    private final UpdateDispatcher dispatcher;
    private final Clock clock;

    private TelegramClient telegramClient;
    private String registeredBotToken;
    private volatile boolean running = false;
    private volatile boolean initialized = false;
    private final Object lifecycleLock = new Object();

    /**
     * Package-private setter for testing, allows injecting a mock TelegramClient.
     */
    void setTelegramClient(TelegramClient client) {
        this.telegramClient = client;
        this.initialized = true;
    }

    private String getToken() {
        BotProperties.ChannelProperties channel = properties.getChannels().get(CHANNEL_TYPE);
        return channel != null ? channel.getToken() : null;
    }

    private boolean isEnabled() {
        BotProperties.ChannelProperties channel = properties.getChannels().get(CHANNEL_TYPE);
        return channel != null && channel.isEnabled();
    }

    private synchronized void ensureInitialized() {
        if (initialized) {
            return;
        }
        String token = getToken();
        if (token == null || token.isBlank()) {
            log.warn("Telegram token not configured, adapter will not start");
            return;
        }
        this.telegramClient = new OkHttpTelegramClient(token);
        initialized = true;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("Telegram adapter already running");
                return;
            }
            ensureInitialized();
            if (telegramClient == null) {
                log.warn("Telegram client not initialized, cannot start");
                return;
            }
            try {
                String token = getToken();
                botsApplication.registerBot(token, this);
                registeredBotToken = token;
                running = true;
                log.info("Telegram adapter started");
            } catch (TelegramApiException e) {
                log.error("Failed to start Telegram adapter", e);
            }
        }
    }

    @Override
    @SuppressWarnings("PMD.NullAssignment") // null clears the token after unregister
    public void stop() {
        synchronized (lifecycleLock) {
            running = false;
            try {
                if (registeredBotToken != null) {
                    botsApplication.unregisterBot(registeredBotToken);
                    log.info("Telegram adapter stopped");
                }
                registeredBotToken = null;
            } catch (Exception e) {
                log.error("Error stopping Telegram adapter", e);
            }
        }
    }

    @PreDestroy
    public void destroy() {
        synchronized (lifecycleLock) {
            stop();
            try {
                botsApplication.close();
            } catch (Exception e) {
                log.error("Error closing Telegram polling application", e);
            }
        }
    }

    /**
     * The lease could not be renewed: stop polling before the next batch of
     * updates is fetched. The polling application stays open for a restart.
     */
    @EventListener
    public void onLeaseLost(InstanceLeaseLostEvent event) {
        log.warn("[Telegram] Instance lease lost by {} ({}), stopping polling", event.ownerId(), event.reason());
        stop();
    }

    @EventListener
    public void onLeaseAcquired(InstanceLeaseAcquiredEvent event) {
        if (!isEnabled()) {
            return;
        }
        log.info("[Telegram] Instance lease re-acquired by {}, resuming polling", event.ownerId());
        start();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public void consume(Update update) {
        if (!running) {
            log.debug("Adapter stopped, ignoring update {}", update.getUpdateId());
            return;
        }
        InboundEvent event = toInboundEvent(update);
        if (event == null) {
            return;
        }
        dispatcher.dispatch(event);
        if (event.isCallback()) {
            String callbackId = update.getCallbackQuery().getId();
            CompletableFuture.runAsync(() -> acknowledgeCallback(callbackId));
        }
    }

    InboundEvent toInboundEvent(Update update) {
        if (update.hasCallbackQuery()) {
            CallbackQuery callback = update.getCallbackQuery();
            if (callback.getMessage() == null) {
                log.warn("Callback query without associated message, ignoring");
                return null;
            }
            return InboundEvent.builder()
                    .chatId(callback.getMessage().getChatId())
                    .eventId(callback.getId() != null ? callback.getId() : "")
                    .kind(EventKind.CALLBACK)
                    .payload(callback.getData() != null ? callback.getData() : "")
                    .messageId(callback.getMessage().getMessageId())
                    .timestamp(clock.instant())
                    .build();
        }
        if (update.hasMessage() && update.getMessage().hasText()) {
            Message message = update.getMessage();
            return InboundEvent.builder()
                    .chatId(message.getChatId())
                    .eventId(update.getUpdateId() != null ? update.getUpdateId().toString() : "")
                    .kind(EventKind.MESSAGE)
                    .payload(message.getText())
                    .messageId(message.getMessageId())
                    .timestamp(clock.instant())
                    .build();
        }
        log.debug("Ignoring update {} without text or callback", update.getUpdateId());
        return null;
    }

    // Stops the client-side spinner; the real reply is sent by the handler.
    private void acknowledgeCallback(String callbackId) {
        try {
            telegramClient.execute(AnswerCallbackQuery.builder().callbackQueryId(callbackId).build());
        } catch (TelegramApiException e) {
            log.debug("Failed to answer callback {}: {}", callbackId, e.getMessage());
        }
    }

    @Override
    public CompletableFuture<Void> sendMessage(long chatId, String content) {
        return CompletableFuture.runAsync(() -> {
            String text = content.length() > TELEGRAM_MAX_MESSAGE_LENGTH
                    ? content.substring(0, TELEGRAM_MAX_MESSAGE_LENGTH - 3) + "..."
                    : content;
            SendMessage sendMessage = SendMessage.builder()
                    .chatId(chatId)
                    .text(text)
                    .build();
            try {
                telegramClient.execute(sendMessage);
            } catch (TelegramApiException e) {
                log.error("Failed to send message to chat: {}", chatId, e);
                throw new IllegalStateException("Failed to send message", e);
            }
        });
    }
}
