package me.filot.bot.port.outbound;

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

import me.filot.bot.domain.model.InstanceLease;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the instance lease record shared by every candidate process (file,
 * database row or distributed key/value entry).
 *
 * <p>
 * The only atomicity required is compare-and-set on the whole record.
 * Implementations complete futures exceptionally on I/O failure; callers bound
 * every call with a timeout.
 */
public interface LeaseStoragePort {

    /**
     * Reads the current lease, empty if none is stored.
     */
    CompletableFuture<Optional<InstanceLease>> read();

    /**
     * Atomically replaces the stored lease.
     *
     * @param expected
     *            lease the caller last read, or {@code null} if it read none; the
     *            swap only happens when the stored record still equals it
     * @param replacement
     *            new lease, or {@code null} to delete the record
     * @return {@code true} if the swap happened
     */
    CompletableFuture<Boolean> compareAndSet(InstanceLease expected, InstanceLease replacement);
}
