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

import lombok.extern.slf4j.Slf4j;
import me.filot.bot.domain.model.RoutedAction;
import org.springframework.stereotype.Service;

/**
 * Maps inline-keyboard callback data to a {@link RoutedAction}.
 *
 * <p>
 * Recognized callback data:
 * <ul>
 * <li>{@code menu_<name>} - menu navigation</li>
 * <li>{@code start_invest}, {@code invest_back_to_profile},
 * {@code confirm_invest_<pool>}, {@code invest_<option>} - investment
 * flow</li>
 * <li>{@code walletconnect}, {@code check_wc_<session>},
 * {@code wallet_connect_<amount>} - wallet flow</li>
 * <li>{@code simulate_period_<period>[_<amount>]} - return simulation</li>
 * </ul>
 * Anything else resolves to {@link RoutedAction#UNKNOWN} with a hint to use
 * /help. Malformed amounts resolve to {@link RoutedAction#INVALID}.
 *
 * <p>
 * Routing is pure: no I/O, no state. Duplicate suppression happens before the
 * router is reached.
 */
@Service
@Slf4j
public class CallbackRouter {

    public static final String MENU_NAVIGATION = "menu_navigation";
    public static final String START_INVEST_FLOW = "start_invest_flow";
    public static final String INVEST_BACK_TO_PROFILE = "invest_back_to_profile";
    public static final String CONFIRM_INVESTMENT = "confirm_investment";
    public static final String INVEST_OPTION = "invest_option";
    public static final String WALLET_CONNECT = "walletconnect";
    public static final String CHECK_WALLET_SESSION = "check_wallet_session";
    public static final String WALLET_CONNECT_WITH_AMOUNT = "wallet_connect_with_amount";
    public static final String SIMULATE = "simulate";

    static final String UNKNOWN_MESSAGE = "I received your selection, but I'm not sure how to process it. "
            + "Please use /help to see available commands.";
    static final double DEFAULT_SIMULATION_AMOUNT = 1000.0;

    private static final String MENU_PREFIX = "menu_";
    private static final String CONFIRM_INVEST_PREFIX = "confirm_invest_";
    private static final String INVEST_PREFIX = "invest_";
    private static final String CHECK_WC_PREFIX = "check_wc_";
    private static final String WALLET_CONNECT_PREFIX = "wallet_connect_";
    private static final String SIMULATE_PREFIX = "simulate_period_";

    public RoutedAction route(long chatId, String callbackData) {
        String data = callbackData != null ? callbackData.trim() : "";
        log.info("Routing callback: {} for chat {}", data, chatId);

        if (data.startsWith(MENU_PREFIX)) {
            return action(MENU_NAVIGATION, chatId).param("menu", data.substring(MENU_PREFIX.length())).build();
        }
        if ("start_invest".equals(data)) {
            return action(START_INVEST_FLOW, chatId).build();
        }
        if (INVEST_BACK_TO_PROFILE.equals(data)) {
            return action(INVEST_BACK_TO_PROFILE, chatId).build();
        }
        if (data.startsWith(CONFIRM_INVEST_PREFIX)) {
            return action(CONFIRM_INVESTMENT, chatId)
                    .param("poolId", data.substring(CONFIRM_INVEST_PREFIX.length()))
                    .build();
        }
        if (data.startsWith(INVEST_PREFIX)) {
            return action(INVEST_OPTION, chatId).param("callbackData", data).build();
        }
        if (WALLET_CONNECT.equals(data)) {
            return action(WALLET_CONNECT, chatId).build();
        }
        if (data.startsWith(CHECK_WC_PREFIX)) {
            return action(CHECK_WALLET_SESSION, chatId)
                    .param("sessionId", data.substring(CHECK_WC_PREFIX.length()))
                    .build();
        }
        if (data.startsWith(WALLET_CONNECT_PREFIX)) {
            return routeWalletConnect(chatId, data);
        }
        if (data.startsWith(SIMULATE_PREFIX)) {
            return routeSimulation(chatId, data);
        }

        log.warn("Unknown callback type: {}", data);
        return RoutedAction.builder()
                .type(RoutedAction.UNKNOWN)
                .param("chatId", chatId)
                .message(UNKNOWN_MESSAGE)
                .error("Unknown callback type")
                .build();
    }

    private RoutedAction routeWalletConnect(long chatId, String data) {
        // Format: wallet_connect_<amount>[_...]
        String[] parts = data.split("_");
        try {
            double amount = Double.parseDouble(parts[2]);
            return action(WALLET_CONNECT_WITH_AMOUNT, chatId).param("amount", amount).build();
        } catch (ArrayIndexOutOfBoundsException | NumberFormatException e) {
            log.error("Invalid wallet_connect callback format: {}", data);
            return invalid(chatId, "Invalid wallet connect format");
        }
    }

    private RoutedAction routeSimulation(long chatId, String data) {
        // Format: simulate_period_<period>[_<amount>]
        String[] parts = data.split("_");
        try {
            String period = parts[2];
            double amount = parts.length > 3 ? Double.parseDouble(parts[3]) : DEFAULT_SIMULATION_AMOUNT;
            return action(SIMULATE, chatId).param("period", period).param("amount", amount).build();
        } catch (ArrayIndexOutOfBoundsException | NumberFormatException e) {
            log.error("Invalid simulate_period callback format: {}", data);
            return invalid(chatId, "Invalid simulation format");
        }
    }

    private static RoutedAction.RoutedActionBuilder action(String type, long chatId) {
        return RoutedAction.builder().type(type).param("chatId", chatId);
    }

    private static RoutedAction invalid(long chatId, String error) {
        return RoutedAction.builder()
                .type(RoutedAction.INVALID)
                .param("chatId", chatId)
                .error(error)
                .build();
    }
}
