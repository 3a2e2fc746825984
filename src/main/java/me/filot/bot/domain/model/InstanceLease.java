package me.filot.bot.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Ownership token for "who may poll the event source". The only record shared
 * between processes, persisted as JSON.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class InstanceLease {

    private String ownerId;
    private Instant acquiredAt;
    private Instant heartbeatAt;
    private Instant expiresAt;

    public boolean isExpired(Instant now) {
        return expiresAt == null || now.isAfter(expiresAt);
    }

    public boolean isOwnedBy(String candidate) {
        return ownerId != null && ownerId.equals(candidate);
    }
}
