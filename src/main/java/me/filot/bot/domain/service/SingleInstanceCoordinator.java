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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.filot.bot.domain.model.InstanceLease;
import me.filot.bot.domain.model.InstanceLeaseAcquiredEvent;
import me.filot.bot.domain.model.InstanceLeaseLostEvent;
import me.filot.bot.infrastructure.config.BotProperties;
import me.filot.bot.port.outbound.LeaseStoragePort;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cross-process leader election: only the holder of the instance lease may poll
 * the chat platform.
 *
 * <p>
 * Lease lifecycle:
 * <ul>
 * <li>{@link #tryAcquire(String)} succeeds only if no lease is stored, the
 * stored lease expired, or it already belongs to the caller</li>
 * <li>{@link #heartbeat(String)} pushes {@code expiresAt} forward; it fails
 * when someone else has taken the lease</li>
 * <li>{@link #release(String)} deletes the record on clean shutdown</li>
 * </ul>
 *
 * <p>
 * Every storage call is bounded by {@code bot.instance.lease-io-timeout}. A
 * timeout or storage error counts as "not acquired" / "not renewed", so the
 * process gives up exclusivity rather than assuming it. Heartbeats run on
 * their own scheduler; a failed heartbeat publishes
 * {@link InstanceLeaseLostEvent}. The scheduler keeps running after a loss and
 * retries {@link #tryAcquire(String)} on every tick, publishing
 * {@link InstanceLeaseAcquiredEvent} once the lease is held again.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class SingleInstanceCoordinator {

    private final LeaseStoragePort leaseStorage;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final String ownerId;
    private final Duration leaseTtl;
    private final Duration heartbeatInterval;
    private final Duration ioTimeout;

    private final Object lifecycleLock = new Object();
    private ScheduledExecutorService heartbeatExecutor;
    private volatile String heldBy;

    public SingleInstanceCoordinator(LeaseStoragePort leaseStorage, ApplicationEventPublisher eventPublisher,
            BotProperties properties, Clock clock) {
        BotProperties.InstanceProperties config = properties.getInstance();
        this.leaseStorage = leaseStorage;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.ownerId = resolveOwnerId(config.getOwnerId());
        this.leaseTtl = config.getLeaseTtl();
        this.heartbeatInterval = config.getHeartbeatInterval();
        this.ioTimeout = config.getLeaseIoTimeout();
        if (leaseTtl.compareTo(heartbeatInterval.multipliedBy(2)) < 0) {
            log.warn("[Lease] lease-ttl {} is less than twice the heartbeat interval {}", leaseTtl,
                    heartbeatInterval);
        }
    }

    /**
     * Owner id of this process.
     */
    public String getOwnerId() {
        return ownerId;
    }

    public boolean isLeader() {
        return heldBy != null;
    }

    public boolean tryAcquire(String candidate) {
        Optional<InstanceLease> stored = await(leaseStorage.read(), "read");
        if (stored == null) {
            return false;
        }
        Instant now = clock.instant();
        InstanceLease existing = stored.orElse(null);
        boolean renewingOwn = existing != null && existing.isOwnedBy(candidate) && !existing.isExpired(now);
        if (existing != null && !existing.isExpired(now) && !renewingOwn) {
            log.info("[Lease] Lease held by {} until {}", existing.getOwnerId(), existing.getExpiresAt());
            return false;
        }

        InstanceLease lease = InstanceLease.builder()
                .ownerId(candidate)
                .acquiredAt(renewingOwn ? existing.getAcquiredAt() : now)
                .heartbeatAt(now)
                .expiresAt(now.plus(leaseTtl))
                .build();
        boolean acquired = Boolean.TRUE.equals(await(leaseStorage.compareAndSet(existing, lease), "acquire"));
        if (acquired) {
            heldBy = candidate;
            if (existing != null && !renewingOwn) {
                log.warn("[Lease] Reclaimed expired lease of {}", existing.getOwnerId());
            }
            log.info("[Lease] Acquired instance lease as {} (expires {})", candidate, lease.getExpiresAt());
        }
        return acquired;
    }

    /**
     * Retries {@link #tryAcquire(String)} every heartbeat interval until it
     * succeeds or {@code timeout} elapses.
     */
    public boolean acquireWithin(String candidate, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            if (tryAcquire(candidate)) {
                return true;
            }
            long remainingNanos = deadline - System.nanoTime();
            if (remainingNanos <= 0) {
                log.error("[Lease] Could not acquire instance lease within {}", timeout);
                return false;
            }
            long sleepMs = Math.max(1, Math.min(heartbeatInterval.toMillis(),
                    TimeUnit.NANOSECONDS.toMillis(remainingNanos)));
            try {
                Thread.sleep(sleepMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    public boolean heartbeat(String candidate) {
        Optional<InstanceLease> stored = await(leaseStorage.read(), "read");
        if (stored == null) {
            return false;
        }
        InstanceLease existing = stored.orElse(null);
        if (existing == null || !existing.isOwnedBy(candidate)) {
            log.warn("[Lease] Heartbeat rejected for {}: lease now owned by {}", candidate,
                    existing != null ? existing.getOwnerId() : "nobody");
            return false;
        }
        Instant now = clock.instant();
        InstanceLease renewed = existing.toBuilder()
                .heartbeatAt(now)
                .expiresAt(now.plus(leaseTtl))
                .build();
        boolean ok = Boolean.TRUE.equals(await(leaseStorage.compareAndSet(existing, renewed), "heartbeat"));
        if (ok) {
            log.debug("[Lease] Heartbeat renewed until {}", renewed.getExpiresAt());
        } else {
            log.warn("[Lease] Heartbeat lost the race for {}", candidate);
        }
        return ok;
    }

    public boolean release(String candidate) {
        stopHeartbeat();
        if (candidate.equals(heldBy)) {
            heldBy = null;
        }
        Optional<InstanceLease> stored = await(leaseStorage.read(), "read");
        if (stored == null || stored.isEmpty() || !stored.get().isOwnedBy(candidate)) {
            return false;
        }
        boolean released = Boolean.TRUE.equals(await(leaseStorage.compareAndSet(stored.get(), null), "release"));
        if (released) {
            log.info("[Lease] Released instance lease of {}", candidate);
        }
        return released;
    }

    /**
     * Renews the lease every heartbeat interval on a dedicated thread, independent
     * of the polling loop.
     */
    public void startHeartbeat(String candidate) {
        synchronized (lifecycleLock) {
            if (heartbeatExecutor != null) {
                return;
            }
            heartbeatExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "lease-heartbeat");
                t.setDaemon(true);
                return t;
            });
            long intervalMs = heartbeatInterval.toMillis();
            heartbeatExecutor.scheduleWithFixedDelay(() -> runHeartbeat(candidate), intervalMs, intervalMs,
                    TimeUnit.MILLISECONDS);
        }
        log.info("[Lease] Heartbeat started every {} ms", heartbeatInterval.toMillis());
    }

    public void stopHeartbeat() {
        synchronized (lifecycleLock) {
            if (heartbeatExecutor != null) {
                heartbeatExecutor.shutdownNow();
                heartbeatExecutor = null;
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        String holder = heldBy;
        if (holder != null) {
            release(holder);
        } else {
            stopHeartbeat();
        }
    }

    void runHeartbeat(String candidate) {
        if (heldBy == null) {
            reacquire(candidate);
            return;
        }
        boolean renewed;
        try {
            renewed = heartbeat(candidate);
        } catch (RuntimeException e) { // NOSONAR - must not kill the scheduler thread
            log.error("[Lease] Heartbeat failed", e);
            renewed = false;
        }
        if (!renewed) {
            heldBy = null;
            log.error("[Lease] Instance lease lost by {}, polling stops until it is re-acquired", candidate);
            eventPublisher.publishEvent(new InstanceLeaseLostEvent(candidate, "heartbeat not renewed"));
        }
    }

    // Keeps competing for the lease on the heartbeat schedule after a loss.
    private void reacquire(String candidate) {
        if (!isHeartbeatActive()) {
            return;
        }
        boolean acquired;
        try {
            acquired = tryAcquire(candidate);
        } catch (RuntimeException e) { // NOSONAR - must not kill the scheduler thread
            log.error("[Lease] Lease re-acquisition failed", e);
            acquired = false;
        }
        if (acquired) {
            log.info("[Lease] Instance lease re-acquired by {}, polling resumes", candidate);
            eventPublisher.publishEvent(new InstanceLeaseAcquiredEvent(candidate));
        }
    }

    private boolean isHeartbeatActive() {
        synchronized (lifecycleLock) {
            return heartbeatExecutor != null;
        }
    }

    private <T> T await(CompletableFuture<T> future, String operation) {
        try {
            return future.get(ioTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Lease] Lease {} timed out after {} ms", operation, ioTimeout.toMillis());
            return null;
        } catch (ExecutionException e) {
            log.warn("[Lease] Lease {} failed: {}", operation, e.getCause() != null
                    ? e.getCause().getMessage()
                    : e.getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    private static String resolveOwnerId(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        return "bot-" + ProcessHandle.current().pid() + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
