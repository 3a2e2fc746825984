package me.filot.bot.domain.service;

import me.filot.bot.domain.model.InstanceLease;
import me.filot.bot.domain.model.InstanceLeaseAcquiredEvent;
import me.filot.bot.domain.model.InstanceLeaseLostEvent;
import me.filot.bot.infrastructure.config.BotProperties;
import me.filot.bot.port.outbound.LeaseStoragePort;
import me.filot.bot.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SingleInstanceCoordinatorTest {

    private static final String OWNER_A = "owner-a";
    private static final String OWNER_B = "owner-b";

    private MutableClock clock;
    private BotProperties properties;
    private InMemoryLeaseStorage storage;
    private ApplicationEventPublisher publisher;
    private final List<SingleInstanceCoordinator> coordinators = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        properties = new BotProperties();
        properties.getInstance().setHeartbeatInterval(Duration.ofSeconds(3));
        properties.getInstance().setLeaseTtl(Duration.ofSeconds(9));
        storage = new InMemoryLeaseStorage();
        publisher = mock(ApplicationEventPublisher.class);
    }

    @AfterEach
    void tearDown() {
        coordinators.forEach(SingleInstanceCoordinator::stopHeartbeat);
    }

    private SingleInstanceCoordinator newCoordinator(LeaseStoragePort port) {
        SingleInstanceCoordinator coordinator = new SingleInstanceCoordinator(port, publisher, properties, clock);
        coordinators.add(coordinator);
        return coordinator;
    }

    // ===== Acquisition =====

    @Test
    void shouldGrantLeaseToExactlyOneOfConcurrentOwners() throws Exception {
        SingleInstanceCoordinator first = newCoordinator(storage);
        SingleInstanceCoordinator second = newCoordinator(storage);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<Boolean> a = executor.submit(() -> {
                start.await();
                return first.tryAcquire(OWNER_A);
            });
            Future<Boolean> b = executor.submit(() -> {
                start.await();
                return second.tryAcquire(OWNER_B);
            });
            start.countDown();

            assertNotEquals(a.get(), b.get());
        } finally {
            executor.shutdownNow();
        }

        String winner = storage.current().getOwnerId();
        String loser = OWNER_A.equals(winner) ? OWNER_B : OWNER_A;
        SingleInstanceCoordinator loserCoordinator = OWNER_A.equals(winner) ? second : first;

        clock.advance(properties.getInstance().getLeaseTtl().plusSeconds(1));

        assertTrue(loserCoordinator.tryAcquire(loser));
        assertEquals(loser, storage.current().getOwnerId());
    }

    @Test
    void shouldLetSecondOwnerTakeOverOnlyAfterTtl() {
        SingleInstanceCoordinator a = newCoordinator(storage);
        SingleInstanceCoordinator b = newCoordinator(storage);

        assertTrue(a.tryAcquire(OWNER_A));

        clock.advance(Duration.ofSeconds(5));
        assertFalse(b.tryAcquire(OWNER_B));

        clock.advance(Duration.ofSeconds(5));
        assertTrue(b.tryAcquire(OWNER_B));
        assertTrue(b.isLeader());
    }

    @Test
    void shouldRenewOwnLeaseOnRepeatedAcquire() {
        SingleInstanceCoordinator a = newCoordinator(storage);
        assertTrue(a.tryAcquire(OWNER_A));
        InstanceLease first = storage.current();

        clock.advance(Duration.ofSeconds(2));
        assertTrue(a.tryAcquire(OWNER_A));

        InstanceLease renewed = storage.current();
        assertEquals(first.getAcquiredAt(), renewed.getAcquiredAt());
        assertTrue(renewed.getExpiresAt().isAfter(first.getExpiresAt()));
    }

    @Test
    void shouldTreatStorageTimeoutAsNotAcquired() {
        properties.getInstance().setLeaseIoTimeout(Duration.ofMillis(50));
        SingleInstanceCoordinator coordinator = newCoordinator(new HangingLeaseStorage());

        assertFalse(coordinator.tryAcquire(OWNER_A));
        assertFalse(coordinator.heartbeat(OWNER_A));
        assertFalse(coordinator.isLeader());
    }

    @Test
    void shouldTreatStorageFailureAsNotAcquired() {
        LeaseStoragePort failing = mock(LeaseStoragePort.class);
        when(failing.read())
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk gone")));
        SingleInstanceCoordinator coordinator = newCoordinator(failing);

        assertFalse(coordinator.tryAcquire(OWNER_A));
    }

    @Test
    void shouldGiveUpAcquireWithinAfterTimeout() {
        properties.getInstance().setHeartbeatInterval(Duration.ofMillis(20));
        assertTrue(newCoordinator(storage).tryAcquire(OWNER_B));
        SingleInstanceCoordinator a = newCoordinator(storage);

        long started = System.nanoTime();
        assertFalse(a.acquireWithin(OWNER_A, Duration.ofMillis(150)));

        assertTrue(Duration.ofNanos(System.nanoTime() - started).toMillis() >= 150);
    }

    @Test
    void shouldAcquireWithinImmediatelyWhenFree() {
        assertTrue(newCoordinator(storage).acquireWithin(OWNER_A, Duration.ofSeconds(1)));
    }

    // ===== Heartbeat =====

    @Test
    void shouldExtendExpiryOnHeartbeat() {
        SingleInstanceCoordinator a = newCoordinator(storage);
        a.tryAcquire(OWNER_A);

        clock.advance(Duration.ofSeconds(3));
        assertTrue(a.heartbeat(OWNER_A));

        assertEquals(clock.instant().plusSeconds(9), storage.current().getExpiresAt());
        assertEquals(clock.instant(), storage.current().getHeartbeatAt());
    }

    @Test
    void shouldFailHeartbeatWhenAnotherOwnerTookOver() {
        SingleInstanceCoordinator a = newCoordinator(storage);
        SingleInstanceCoordinator b = newCoordinator(storage);
        a.tryAcquire(OWNER_A);
        clock.advance(Duration.ofSeconds(10));
        b.tryAcquire(OWNER_B);

        assertFalse(a.heartbeat(OWNER_A));
        assertEquals(OWNER_B, storage.current().getOwnerId());
    }

    @Test
    void shouldPublishLeaseLostWhenScheduledHeartbeatFails() {
        properties.getInstance().setHeartbeatInterval(Duration.ofMillis(30));
        SingleInstanceCoordinator a = newCoordinator(storage);
        assertTrue(a.tryAcquire(OWNER_A));

        storage.force(InstanceLease.builder()
                .ownerId(OWNER_B)
                .acquiredAt(clock.instant())
                .heartbeatAt(clock.instant())
                .expiresAt(clock.instant().plusSeconds(60))
                .build());
        a.startHeartbeat(OWNER_A);

        verify(publisher, timeout(2000)).publishEvent(new InstanceLeaseLostEvent(OWNER_A, "heartbeat not renewed"));
        assertFalse(a.isLeader());
    }

    @Test
    void shouldKeepLeaseAliveWithScheduledHeartbeat() throws InterruptedException {
        properties.getInstance().setHeartbeatInterval(Duration.ofMillis(20));
        SingleInstanceCoordinator a = newCoordinator(storage);
        assertTrue(a.tryAcquire(OWNER_A));

        a.startHeartbeat(OWNER_A);
        Thread.sleep(150);

        verify(publisher, never()).publishEvent(any(Object.class));
        assertTrue(a.isLeader());
    }

    @Test
    void shouldReacquireLeaseAfterTransientHeartbeatFailure() {
        properties.getInstance().setHeartbeatInterval(Duration.ofMillis(30));
        properties.getInstance().setLeaseTtl(Duration.ofMillis(90));
        FlakyLeaseStorage flaky = new FlakyLeaseStorage(storage, 2);
        SingleInstanceCoordinator a = newCoordinator(flaky);
        assertTrue(a.tryAcquire(OWNER_A));

        a.startHeartbeat(OWNER_A);

        verify(publisher, timeout(2000)).publishEvent(new InstanceLeaseLostEvent(OWNER_A, "heartbeat not renewed"));
        verify(publisher, timeout(2000)).publishEvent(new InstanceLeaseAcquiredEvent(OWNER_A));
        assertTrue(a.isLeader());
        assertEquals(OWNER_A, storage.current().getOwnerId());
        assertTrue(flaky.reads() >= 3);
    }

    @Test
    void shouldKeepRetryingWhileCompetitorHoldsLease() {
        properties.getInstance().setHeartbeatInterval(Duration.ofMillis(20));
        SingleInstanceCoordinator a = newCoordinator(storage);
        a.tryAcquire(OWNER_A);
        InstanceLease competitor = InstanceLease.builder()
                .ownerId(OWNER_B)
                .acquiredAt(clock.instant())
                .heartbeatAt(clock.instant())
                .expiresAt(clock.instant().plusSeconds(60))
                .build();
        storage.force(competitor);
        a.startHeartbeat(OWNER_A);
        verify(publisher, timeout(2000)).publishEvent(new InstanceLeaseLostEvent(OWNER_A, "heartbeat not renewed"));

        clock.advance(Duration.ofSeconds(61));

        verify(publisher, timeout(2000)).publishEvent(new InstanceLeaseAcquiredEvent(OWNER_A));
        assertEquals(OWNER_A, storage.current().getOwnerId());
    }

    @Test
    void shouldNotReacquireAfterHeartbeatStopped() {
        SingleInstanceCoordinator a = newCoordinator(storage);

        a.runHeartbeat(OWNER_A);

        assertFalse(a.isLeader());
        assertNull(storage.current());
        verify(publisher, never()).publishEvent(any(Object.class));
    }

    // ===== Release =====

    @Test
    void shouldDeleteLeaseOnRelease() {
        SingleInstanceCoordinator a = newCoordinator(storage);
        a.tryAcquire(OWNER_A);

        assertTrue(a.release(OWNER_A));

        assertNull(storage.current());
        assertFalse(a.isLeader());
        assertTrue(newCoordinator(storage).tryAcquire(OWNER_B));
    }

    @Test
    void shouldNotReleaseLeaseOfAnotherOwner() {
        SingleInstanceCoordinator a = newCoordinator(storage);
        a.tryAcquire(OWNER_A);

        assertFalse(newCoordinator(storage).release(OWNER_B));

        assertEquals(OWNER_A, storage.current().getOwnerId());
    }

    @Test
    void shouldUseConfiguredOwnerId() {
        properties.getInstance().setOwnerId("bot-1");

        assertEquals("bot-1", newCoordinator(storage).getOwnerId());
    }

    @Test
    void shouldGenerateOwnerIdWhenNotConfigured() {
        String ownerId = newCoordinator(storage).getOwnerId();

        assertTrue(ownerId.startsWith("bot-" + ProcessHandle.current().pid() + "-"));
        assertNotEquals(ownerId, newCoordinator(storage).getOwnerId());
    }

    private static final class InMemoryLeaseStorage implements LeaseStoragePort {

        private InstanceLease stored;

        synchronized InstanceLease current() {
            return stored;
        }

        synchronized void force(InstanceLease lease) {
            stored = lease;
        }

        @Override
        public synchronized CompletableFuture<Optional<InstanceLease>> read() {
            return CompletableFuture.completedFuture(Optional.ofNullable(stored));
        }

        @Override
        public synchronized CompletableFuture<Boolean> compareAndSet(InstanceLease expected,
                InstanceLease replacement) {
            if (!Objects.equals(stored, expected)) {
                return CompletableFuture.completedFuture(false);
            }
            stored = replacement;
            return CompletableFuture.completedFuture(true);
        }
    }

    private static final class FlakyLeaseStorage implements LeaseStoragePort {

        private final LeaseStoragePort delegate;
        private final int failingRead;
        private final AtomicInteger reads = new AtomicInteger();

        FlakyLeaseStorage(LeaseStoragePort delegate, int failingRead) {
            this.delegate = delegate;
            this.failingRead = failingRead;
        }

        int reads() {
            return reads.get();
        }

        @Override
        public CompletableFuture<Optional<InstanceLease>> read() {
            if (reads.incrementAndGet() == failingRead) {
                return CompletableFuture.failedFuture(new IllegalStateException("transient read failure"));
            }
            return delegate.read();
        }

        @Override
        public CompletableFuture<Boolean> compareAndSet(InstanceLease expected, InstanceLease replacement) {
            return delegate.compareAndSet(expected, replacement);
        }
    }

    private static final class HangingLeaseStorage implements LeaseStoragePort {

        @Override
        public CompletableFuture<Optional<InstanceLease>> read() {
            return new CompletableFuture<>();
        }

        @Override
        public CompletableFuture<Boolean> compareAndSet(InstanceLease expected, InstanceLease replacement) {
            return new CompletableFuture<>();
        }
    }
}
