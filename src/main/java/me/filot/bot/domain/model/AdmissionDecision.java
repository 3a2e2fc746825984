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

/**
 * Result of an admission check.
 *
 * <p>
 * Contains:
 * <ul>
 * <li>{@code admitted} - whether the event may reach business logic</li>
 * <li>{@code reason} - {@link SuppressionReason#ADMITTED} or why it was
 * suppressed</li>
 * <li>{@code navigational} - how the payload was classified</li>
 * <li>{@code pattern} - navigation pattern after recording this action</li>
 * <li>{@code forceRefresh} - hint to send a fresh message instead of editing
 * the previous one</li>
 * <li>{@code rapidRepeat} - the same action was seen within the navigation
 * duplicate window (informational)</li>
 * </ul>
 *
 * @since 1.0
 */
@Value
@Builder
public class AdmissionDecision {

    boolean admitted;

    @Builder.Default
    SuppressionReason reason = SuppressionReason.ADMITTED;

    boolean navigational;

    @Builder.Default
    NavigationPattern pattern = NavigationPattern.NONE;

    boolean forceRefresh;

    boolean rapidRepeat;

    public static AdmissionDecision suppressed(SuppressionReason reason, boolean navigational) {
        return AdmissionDecision.builder()
                .admitted(false)
                .reason(reason)
                .navigational(navigational)
                .build();
    }
}
