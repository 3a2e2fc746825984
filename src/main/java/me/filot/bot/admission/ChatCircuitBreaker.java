package me.filot.bot.admission;

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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Chat-level kill switch for stateful responses.
 *
 * <p>
 * A chat is either open (normal) or tripped (suppressing). A trip always ends
 * on its own after the given duration:
 * <ul>
 * <li>callers never release a lock explicitly</li>
 * <li>{@link #isLocked(long)} compares against the clock, so a late timer
 * cannot stretch a lock</li>
 * <li>releases run on one shared scheduler thread with at most one pending
 * release per chat; a release that fires while the lock was extended re-arms
 * itself for the remainder</li>
 * <li>a release arriving after {@link #resetAll()} is a no-op</li>
 * </ul>
 *
 * @since 1.0
 */
@Slf4j
public class ChatCircuitBreaker implements AutoCloseable {

    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final Object lock = new Object();
    private final Map<Long, Instant> lockedUntil = new HashMap<>();
    private final Set<Long> releaseArmed = new HashSet<>();

    public ChatCircuitBreaker(Clock clock) {
        this(clock, Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "chat-breaker-release");
            t.setDaemon(true);
            return t;
        }));
    }

    ChatCircuitBreaker(Clock clock, ScheduledExecutorService scheduler) {
        this.clock = clock;
        this.scheduler = scheduler;
    }

    /**
     * Locks {@code chatId} for {@code duration}. Tripping an already locked chat
     * extends the lock if the new expiry is later.
     */
    public void trip(long chatId, Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        Instant until;
        synchronized (lock) {
            until = clock.instant().plus(duration);
            Instant current = lockedUntil.get(chatId);
            if (current == null || until.isAfter(current)) {
                lockedUntil.put(chatId, until);
            } else {
                until = current;
            }
            if (!releaseArmed.contains(chatId)) {
                armRelease(chatId, duration);
            }
        }
        log.info("[Breaker] Chat {} locked until {}", chatId, until);
    }

    public boolean isLocked(long chatId) {
        synchronized (lock) {
            Instant until = lockedUntil.get(chatId);
            return until != null && clock.instant().isBefore(until);
        }
    }

    /**
     * Number of chats currently tripped.
     */
    public int activeLocks() {
        Instant now = clock.instant();
        synchronized (lock) {
            return (int) lockedUntil.values().stream().filter(now::isBefore).count();
        }
    }

    public void resetAll() {
        synchronized (lock) {
            lockedUntil.clear();
            releaseArmed.clear();
        }
        log.info("[Breaker] All chat locks cleared");
    }

    /**
     * Chats with lock state still held in memory, expired or not.
     */
    int trackedChats() {
        synchronized (lock) {
            return lockedUntil.size();
        }
    }

    void release(long chatId) {
        boolean released = false;
        synchronized (lock) {
            releaseArmed.remove(chatId);
            Instant until = lockedUntil.get(chatId);
            if (until == null) {
                return;
            }
            Duration remaining = Duration.between(clock.instant(), until);
            if (remaining.isZero() || remaining.isNegative()) {
                lockedUntil.remove(chatId);
                released = true;
            } else {
                armRelease(chatId, remaining);
            }
        }
        if (released) {
            log.info("[Breaker] Chat {} released", chatId);
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }

    // Caller holds the lock.
    private void armRelease(long chatId, Duration delay) {
        try {
            long delayMs = Math.max(1, delay.toMillis());
            scheduler.schedule(() -> release(chatId), delayMs, TimeUnit.MILLISECONDS);
            releaseArmed.add(chatId);
        } catch (RejectedExecutionException e) {
            log.debug("[Breaker] Scheduler stopped, chat {} expires by clock only", chatId);
        }
    }
}
