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

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A single inbound event received from a chat platform, normalized for the
 * admission layer.
 *
 * <p>
 * {@code eventId} is the platform's own identifier when available (callback
 * query id, update id). When absent it is an empty string and de-duplication
 * falls back to content fingerprinting.
 */
@Value
@Builder
public class InboundEvent {

    long chatId;

    @Builder.Default
    String eventId = "";

    @Builder.Default
    EventKind kind = EventKind.MESSAGE;

    @Builder.Default
    String payload = "";

    /** Platform-side message id, used when replying by editing a message. */
    Integer messageId;

    Instant timestamp;

    public boolean isCallback() {
        return kind == EventKind.CALLBACK;
    }
}
