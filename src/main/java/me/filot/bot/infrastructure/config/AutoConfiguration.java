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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.filot.bot.domain.service.JvmExitService;
import me.filot.bot.domain.service.SingleInstanceCoordinator;
import me.filot.bot.port.inbound.ChannelPort;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Spring configuration that starts the bot once the context is ready.
 *
 * <p>
 * Startup sequence:
 * <ol>
 * <li>acquire the instance lease within {@code bot.instance.startup-timeout};
 * on failure log an error and exit cleanly, since another instance is
 * polling</li>
 * <li>start the lease heartbeat</li>
 * <li>start every channel whose {@code bot.channels.<type>.enabled} property is
 * true</li>
 * </ol>
 *
 * <p>
 * Shutdown runs in reverse: channels stop polling first, then the lease is
 * released, so a newly started instance cannot poll while this one still is.
 * This bean depends on both, so its {@code @PreDestroy} runs before theirs.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final BotProperties properties;
    private final List<ChannelPort> channelPorts;
    private final SingleInstanceCoordinator instanceCoordinator;
    private final JvmExitService jvmExitService;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        String ownerId = instanceCoordinator.getOwnerId();
        Duration startupTimeout = properties.getInstance().getStartupTimeout();
        log.info("FiLot bot starting as {}", ownerId);

        if (!instanceCoordinator.acquireWithin(ownerId, startupTimeout)) {
            log.error("Another instance holds the lease, shutting down. Only one instance may poll at a time.");
            jvmExitService.exit(0);
            return;
        }
        instanceCoordinator.startHeartbeat(ownerId);

        for (ChannelPort channel : channelPorts) {
            String channelType = channel.getChannelType();
            if (isChannelEnabled(channelType)) {
                log.info("Starting channel: {}", channelType);
                channel.start();
            }
        }

        log.info("FiLot bot started successfully");
    }

    @PreDestroy
    public void stop() {
        for (ChannelPort channel : channelPorts) {
            try {
                channel.stop();
            } catch (RuntimeException e) {
                log.error("Failed to stop channel: {}", channel.getChannelType(), e);
            }
        }
        instanceCoordinator.shutdown();
        log.info("FiLot bot stopped");
    }

    private boolean isChannelEnabled(String channelType) {
        BotProperties.ChannelProperties channelProps = properties.getChannels().get(channelType);
        return channelProps != null && channelProps.isEnabled();
    }
}
