package me.filot.bot.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the bot, bound from
 * application.properties.
 *
 * <p>
 * All bot configuration is organized under the {@code bot.*} prefix. This class
 * contains nested property classes for different subsystems:
 * <ul>
 * <li>{@link AdmissionProperties} - duplicate and loop suppression</li>
 * <li>{@link NavigationProperties} - per-chat navigation history</li>
 * <li>{@link InstanceProperties} - single poller election</li>
 * <li>{@link DispatchProperties} - worker pool for inbound updates</li>
 * <li>{@link ChannelProperties} - input channels (Telegram)</li>
 * </ul>
 *
 * <p>
 * Uses Spring Boot's {@link ConfigurationProperties} for type-safe property
 * binding. Every window and cooldown is configuration, not fixed behavior.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private AdmissionProperties admission = new AdmissionProperties();
    private NavigationProperties navigation = new NavigationProperties();
    private InstanceProperties instance = new InstanceProperties();
    private DispatchProperties dispatch = new DispatchProperties();
    private Map<String, ChannelProperties> channels = new HashMap<>();

    // ==================== ADMISSION ====================

    @Data
    public static class AdmissionProperties {
        /** Hard cap on de-duplication keys kept in memory. */
        private int maxTrackedKeys = 1000;

        /** Keys older than this are dropped regardless of count. */
        private Duration maxKeyAge = Duration.ofSeconds(30);

        /** Identical stateful content inside this window is treated as a loop. */
        private Duration statefulCooldown = Duration.ofSeconds(1);

        /** How long a chat stays locked after a loop was detected. */
        private Duration breakerDuration = Duration.ofSeconds(2);

        /**
         * Callback data prefixes that only re-render a screen.
         */
        private List<String> navigationalPrefixes = new ArrayList<>(List.of(
                "menu_", "back_", "explore_", "page_"));

        /**
         * Exact callback data or commands that only re-render a screen.
         */
        private List<String> navigationalActions = new ArrayList<>(List.of(
                "back_to_explore", "status", "help", "subscribe", "unsubscribe",
                "/start", "/help", "/menu", "/status"));

        /**
         * Suppress a navigational action repeated inside the navigation duplicate
         * window, unless the user is oscillating between two screens.
         */
        private boolean navigationDoubleTapGuard = false;
    }

    // ==================== NAVIGATION ====================

    @Data
    public static class NavigationProperties {
        private int maxHistory = 20;
        private Duration purgeThreshold = Duration.ofHours(1);
        private int purgeEveryInserts = 10;
        private Duration duplicateWindow = Duration.ofMillis(500);
        private String menuPrefix = "menu_";
    }

    // ==================== SINGLE INSTANCE ====================

    @Data
    public static class InstanceProperties {
        /**
         * Lease owner id. Blank means a random id is generated on startup.
         */
        private String ownerId = "";
        private String leasePath = "${user.home}/.filot/instance.lease";
        private Duration heartbeatInterval = Duration.ofSeconds(3);

        /** Must stay well above the heartbeat interval. Default: 3x heartbeat. */
        private Duration leaseTtl = Duration.ofSeconds(9);

        /** How long startup waits for the lease before giving up. */
        private Duration startupTimeout = Duration.ofSeconds(30);

        /** Upper bound for a single lease storage call. */
        private Duration leaseIoTimeout = Duration.ofSeconds(1);
    }

    // ==================== DISPATCH ====================

    @Data
    public static class DispatchProperties {
        private int workerThreads = 8;
        private Duration metricsLogInterval = Duration.ofMinutes(1);
    }

    // ==================== CHANNELS ====================

    @Data
    public static class ChannelProperties {
        private boolean enabled = false;
        private String token = "";
    }
}
