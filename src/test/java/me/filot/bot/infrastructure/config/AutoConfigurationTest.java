package me.filot.bot.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.filot.bot.domain.model.InstanceLease;
import me.filot.bot.domain.service.JvmExitService;
import me.filot.bot.domain.service.SingleInstanceCoordinator;
import me.filot.bot.port.inbound.ChannelPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AutoConfigurationTest {

    private static final String OWNER = "owner-a";

    private BotProperties properties;
    private ChannelPort telegram;
    private ChannelPort other;
    private SingleInstanceCoordinator coordinator;
    private JvmExitService exitService;
    private AutoConfiguration autoConfiguration;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        BotProperties.ChannelProperties enabled = new BotProperties.ChannelProperties();
        enabled.setEnabled(true);
        properties.getChannels().put("telegram", enabled);

        telegram = mock(ChannelPort.class);
        when(telegram.getChannelType()).thenReturn("telegram");
        other = mock(ChannelPort.class);
        when(other.getChannelType()).thenReturn("discord");

        coordinator = mock(SingleInstanceCoordinator.class);
        when(coordinator.getOwnerId()).thenReturn(OWNER);
        exitService = mock(JvmExitService.class);

        autoConfiguration = new AutoConfiguration(properties, List.of(telegram, other), coordinator, exitService);
    }

    @Test
    void shouldStartEnabledChannelsAfterAcquiringLease() {
        when(coordinator.acquireWithin(OWNER, properties.getInstance().getStartupTimeout())).thenReturn(true);

        autoConfiguration.start();

        verify(coordinator).startHeartbeat(OWNER);
        verify(telegram).start();
        verify(other, never()).start();
        verify(exitService, never()).exit(0);
    }

    @Test
    void shouldExitCleanlyWhenLeaseNotAcquired() {
        when(coordinator.acquireWithin(anyString(), any(Duration.class))).thenReturn(false);

        autoConfiguration.start();

        verify(exitService).exit(0);
        verify(coordinator, never()).startHeartbeat(anyString());
        verify(telegram, never()).start();
    }

    @Test
    void shouldStopChannelsBeforeReleasingLease() {
        autoConfiguration.stop();

        InOrder order = inOrder(telegram, other, coordinator);
        order.verify(telegram).stop();
        order.verify(other).stop();
        order.verify(coordinator).shutdown();
    }

    @Test
    void shouldReleaseLeaseEvenWhenChannelFailsToStop() {
        doThrow(new IllegalStateException("stuck")).when(telegram).stop();

        autoConfiguration.stop();

        verify(other).stop();
        verify(coordinator).shutdown();
    }

    @Test
    void shouldSerializeInstantsAsIsoStrings() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();
        InstanceLease lease = InstanceLease.builder()
                .ownerId(OWNER)
                .expiresAt(Instant.parse("2026-01-01T00:00:09Z"))
                .build();

        String json = mapper.writeValueAsString(lease);

        assertTrue(json.contains("\"expiresAt\":\"2026-01-01T00:00:09Z\""));
        assertEquals(lease, mapper.readValue(json, InstanceLease.class));
    }
}
