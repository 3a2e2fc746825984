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

/**
 * Why an inbound event was (or was not) let through to business logic.
 */
public enum SuppressionReason {
    ADMITTED,
    /** The chat circuit breaker is tripped. */
    CHAT_LOCKED,
    /** Same physical event seen before (transport redelivery). */
    DUPLICATE_EVENT,
    /** Identical stateful content inside the cooldown window. */
    LOOP_DETECTED,
    /** Navigational action pressed twice inside the duplicate window. */
    DOUBLE_TAP
}
