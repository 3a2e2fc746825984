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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded sliding window of event keys and the time each was recorded.
 *
 * <p>
 * The store never keeps a key forever:
 * <ul>
 * <li>entries older than {@code maxAge} are dropped on every write</li>
 * <li>once {@code capacity} is exceeded the oldest entries are evicted</li>
 * </ul>
 *
 * <p>
 * Entries are kept in recording order, so both age and capacity pruning only
 * ever walk from the head. Refreshing a key moves it to the tail. All methods
 * are synchronized on the store; every operation is a hash-map lookup.
 *
 * @since 1.0
 */
public class EventKeyStore {

    private final int capacity;
    private final Duration maxAge;
    private final Clock clock;
    private final LinkedHashMap<String, Instant> entries = new LinkedHashMap<>();

    public EventKeyStore(int capacity, Duration maxAge, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.maxAge = maxAge;
        this.clock = clock;
    }

    /**
     * Returns whether {@code key} was recorded and is still inside the window.
     * Records it with the current time when it was not.
     */
    public synchronized boolean seen(String key) {
        return recordIfAbsent(key) != null;
    }

    /**
     * Records {@code key} if absent.
     *
     * @return the time the key was previously recorded, or {@code null} if it was
     *         not present (in which case it is recorded now)
     */
    public synchronized Instant recordIfAbsent(String key) {
        Instant now = clock.instant();
        Instant previous = entries.get(key);
        if (previous != null && isExpired(previous, now)) {
            entries.remove(key);
            previous = null;
        }
        if (previous == null) {
            entries.put(key, now);
        }
        prune(now);
        return previous;
    }

    /**
     * Re-records {@code key} with the current time, moving it to the newest end.
     *
     * @return the time the key was previously recorded, or {@code null} if it was
     *         absent or already outside the window
     */
    public synchronized Instant refresh(String key) {
        Instant now = clock.instant();
        Instant previous = entries.remove(key);
        if (previous != null && isExpired(previous, now)) {
            previous = null;
        }
        entries.put(key, now);
        prune(now);
        return previous;
    }

    public synchronized void prune() {
        prune(clock.instant());
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    public int getCapacity() {
        return capacity;
    }

    private void prune(Instant now) {
        Iterator<Map.Entry<String, Instant>> iterator = entries.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, Instant> eldest = iterator.next();
            if (entries.size() > capacity || isExpired(eldest.getValue(), now)) {
                iterator.remove();
            } else {
                break;
            }
        }
    }

    private boolean isExpired(Instant recordedAt, Instant now) {
        return Duration.between(recordedAt, now).compareTo(maxAge) > 0;
    }
}
