package me.filot.bot.domain.service;

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
import me.filot.bot.domain.model.AdmissionDecision;
import me.filot.bot.domain.model.InboundEvent;
import me.filot.bot.domain.model.RoutedAction;
import me.filot.bot.port.inbound.ChannelPort;
import me.filot.bot.port.outbound.ActionHandlerPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;

/**
 * Default business handler: resolves callbacks through {@link CallbackRouter},
 * answers the basic slash commands and replies through the active
 * {@link ChannelPort}.
 *
 * <p>
 * The channel is looked up lazily because the channel itself depends on the
 * dispatcher that calls this handler.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RoutingActionHandler implements ActionHandlerPort {

    static final String HELP_TEXT = "Available commands:\n"
            + "/start - open the main menu\n"
            + "/menu - show the main menu\n"
            + "/status - check the bot status\n"
            + "/help - show this message";
    static final String STATUS_TEXT = "The bot is running.";
    static final String INVALID_TEXT = "Sorry, that option is not valid. Please try again from the menu.";
    static final String MESSAGE_ACK = "Got it. Use the menu buttons or /help to see what I can do.";

    private static final Map<String, String> ACTION_REPLIES = Map.of(
            CallbackRouter.START_INVEST_FLOW, "Let's start your investment. Choose a risk profile.",
            CallbackRouter.INVEST_BACK_TO_PROFILE, "Back to risk profile selection.",
            CallbackRouter.WALLET_CONNECT, "Connect your wallet to continue.",
            CallbackRouter.SIMULATE, "Running the return simulation.");

    private final CallbackRouter callbackRouter;
    private final ObjectProvider<ChannelPort> channelProvider;

    @Override
    public void handle(InboundEvent event, AdmissionDecision decision) {
        String reply = event.isCallback()
                ? replyForCallback(event)
                : replyForMessage(event.getPayload());
        if (decision.isForceRefresh()) {
            log.debug("[Navigation] Fresh message requested for chat {} (pattern {})", event.getChatId(),
                    decision.getPattern().getCode());
        }
        send(event.getChatId(), reply);
    }

    String replyForCallback(InboundEvent event) {
        RoutedAction action = callbackRouter.route(event.getChatId(), event.getPayload());
        if (action.getMessage() != null) {
            return action.getMessage();
        }
        if (action.isError()) {
            return INVALID_TEXT;
        }
        String type = action.getType();
        Map<String, Object> params = action.getParams();
        switch (type) {
            case CallbackRouter.MENU_NAVIGATION:
                return "Opening " + params.get("menu") + " menu.";
            case CallbackRouter.CONFIRM_INVESTMENT:
                return "Confirming your investment in pool " + params.get("poolId") + ".";
            case CallbackRouter.INVEST_OPTION:
                return "Investment option selected.";
            case CallbackRouter.CHECK_WALLET_SESSION:
                return "Checking wallet session " + params.get("sessionId") + ".";
            case CallbackRouter.WALLET_CONNECT_WITH_AMOUNT:
                return String.format(Locale.ROOT, "Connect your wallet to invest $%.2f.", params.get("amount"));
            default:
                return ACTION_REPLIES.getOrDefault(type, INVALID_TEXT);
        }
    }

    String replyForMessage(String text) {
        String command = text != null ? text.trim().split("\\s+", 2)[0].split("@")[0] : "";
        switch (command) {
            case "/start":
            case "/menu":
            case "/help":
                return HELP_TEXT;
            case "/status":
                return STATUS_TEXT;
            default:
                return MESSAGE_ACK;
        }
    }

    private void send(long chatId, String text) {
        ChannelPort channel = channelProvider.getIfAvailable();
        if (channel == null) {
            log.warn("No channel available, reply to chat {} dropped", chatId);
            return;
        }
        channel.sendMessage(chatId, text).join();
    }
}
