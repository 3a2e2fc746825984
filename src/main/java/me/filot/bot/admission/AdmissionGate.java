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
import me.filot.bot.domain.model.AdmissionDecision;
import me.filot.bot.domain.model.AdmissionMetrics;
import me.filot.bot.domain.model.InboundEvent;
import me.filot.bot.domain.model.NavigationPattern;
import me.filot.bot.domain.model.SuppressionReason;
import me.filot.bot.domain.service.NavigationTracker;
import me.filot.bot.infrastructure.config.BotProperties;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decides, per inbound event, whether it is a new user action that must reach
 * business logic or a redelivery/loop that must be suppressed.
 *
 * <p>
 * Navigational actions (re-render a screen, safe to repeat) are always
 * admitted. Stateful actions go through three checks, in order:
 * <ol>
 * <li>the chat's {@link ChatCircuitBreaker} must be open</li>
 * <li>the physical event id must not have been seen before</li>
 * <li>identical content must not repeat within the stateful cooldown; a repeat
 * is the strongest loop signal and also trips the breaker</li>
 * </ol>
 *
 * <p>
 * Every admitted action is recorded in the {@link NavigationTracker}, and the
 * decision carries the resulting navigation pattern so the content layer can
 * choose between editing the last message and sending a fresh one.
 *
 * <p>
 * The gate never throws: any internal failure admits the event.
 *
 * @since 1.0
 */
@Slf4j
public class AdmissionGate {

    static final String ID_PREFIX = "id:";
    private static final int MAX_RECORDED_ACTION_LENGTH = 64;

    private final EventKeyStore keyStore;
    private final ChatCircuitBreaker breaker;
    private final NavigationTracker navigationTracker;
    private final ActionClassifier classifier;
    private final Clock clock;
    private final Duration statefulCooldown;
    private final Duration breakerDuration;
    private final boolean doubleTapGuard;

    private final AtomicLong admittedCount = new AtomicLong();
    private final AtomicLong suppressedCount = new AtomicLong();

    public AdmissionGate(EventKeyStore keyStore, ChatCircuitBreaker breaker, NavigationTracker navigationTracker,
            ActionClassifier classifier, BotProperties.AdmissionProperties properties, Clock clock) {
        this.keyStore = keyStore;
        this.breaker = breaker;
        this.navigationTracker = navigationTracker;
        this.classifier = classifier;
        this.clock = clock;
        this.statefulCooldown = properties.getStatefulCooldown();
        this.breakerDuration = properties.getBreakerDuration();
        this.doubleTapGuard = properties.isNavigationDoubleTapGuard();
    }

    /**
     * Shorthand for {@link #evaluate(InboundEvent)} returning only ADMIT/SUPPRESS.
     */
    public boolean admit(long chatId, String eventId, String payload) {
        return evaluate(InboundEvent.builder()
                .chatId(chatId)
                .eventId(eventId != null ? eventId : "")
                .payload(payload != null ? payload : "")
                .build()).isAdmitted();
    }

    public AdmissionDecision evaluate(InboundEvent event) {
        if (event == null) {
            log.warn("[Admission] Null event, admitting");
            admittedCount.incrementAndGet();
            return AdmissionDecision.builder().admitted(true).build();
        }
        long chatId = event.getChatId();
        String eventId = event.getEventId() != null ? event.getEventId().trim() : "";
        String payload = event.getPayload() != null ? event.getPayload() : "";

        AdmissionDecision decision;
        try {
            boolean navigational = classify(payload);
            decision = navigational
                    ? evaluateNavigational(chatId, payload)
                    : evaluateStateful(chatId, eventId, payload);
        } catch (RuntimeException e) {
            log.error("[Admission] Check failed for chat {}, admitting", chatId, e);
            decision = AdmissionDecision.builder().admitted(true).build();
        }

        if (decision.isAdmitted()) {
            admittedCount.incrementAndGet();
        } else {
            suppressedCount.incrementAndGet();
            log.info("[Admission] Suppressed chat={} event={} reason={}", chatId, eventId, decision.getReason());
        }
        return decision;
    }

    /**
     * Clears every piece of in-memory state: event keys, chat locks and
     * navigation history.
     */
    public void resetAll() {
        keyStore.clear();
        breaker.resetAll();
        navigationTracker.clear();
        admittedCount.set(0);
        suppressedCount.set(0);
        log.info("[Admission] All admission state has been reset");
    }

    public AdmissionMetrics metricsSnapshot() {
        return AdmissionMetrics.builder()
                .trackedKeys(keyStore.size())
                .activeLocks(breaker.activeLocks())
                .trackedChats(navigationTracker.trackedChats())
                .navigationSteps(navigationTracker.totalSteps())
                .admitted(admittedCount.get())
                .suppressed(suppressedCount.get())
                .build();
    }

    private boolean classify(String payload) {
        try {
            return classifier.isNavigational(payload);
        } catch (RuntimeException e) {
            log.warn("[Admission] Classifier failed for '{}', treating as navigational", abbreviate(payload), e);
            return true;
        }
    }

    private AdmissionDecision evaluateNavigational(long chatId, String payload) {
        String action = abbreviate(payload);
        boolean rapidRepeat = navigationTracker.isDuplicate(chatId, action);
        if (doubleTapGuard && rapidRepeat && !navigationTracker.isOscillation(chatId, action)) {
            return AdmissionDecision.suppressed(SuppressionReason.DOUBLE_TAP, true);
        }
        return admitted(chatId, action, true, rapidRepeat);
    }

    private AdmissionDecision evaluateStateful(long chatId, String eventId, String payload) {
        if (breaker.isLocked(chatId)) {
            return AdmissionDecision.suppressed(SuppressionReason.CHAT_LOCKED, false);
        }

        if (!eventId.isEmpty() && keyStore.seen(ID_PREFIX + chatId + ":" + eventId)) {
            return AdmissionDecision.suppressed(SuppressionReason.DUPLICATE_EVENT, false);
        }

        if (!payload.isBlank()) {
            Instant previous = keyStore.refresh(ContentFingerprint.fingerprint(chatId, payload));
            if (previous != null && Duration.between(previous, clock.instant()).compareTo(statefulCooldown) < 0) {
                log.warn("[Admission] Identical content within {} ms in chat {}: {}", statefulCooldown.toMillis(),
                        chatId, abbreviate(payload));
                breaker.trip(chatId, breakerDuration);
                return AdmissionDecision.suppressed(SuppressionReason.LOOP_DETECTED, false);
            }
        }

        String action = abbreviate(payload);
        return admitted(chatId, action, false, navigationTracker.isDuplicate(chatId, action));
    }

    private AdmissionDecision admitted(long chatId, String action, boolean navigational, boolean rapidRepeat) {
        boolean forceRefresh = navigationTracker.shouldForceRefresh(chatId, action);
        navigationTracker.record(chatId, action);
        NavigationPattern pattern = navigationTracker.detectPattern(chatId);
        return AdmissionDecision.builder()
                .admitted(true)
                .navigational(navigational)
                .pattern(pattern)
                .forceRefresh(forceRefresh || pattern == NavigationPattern.BACK_FORTH)
                .rapidRepeat(rapidRepeat)
                .build();
    }

    private static String abbreviate(String payload) {
        String trimmed = payload.trim();
        return trimmed.length() <= MAX_RECORDED_ACTION_LENGTH
                ? trimmed
                : trimmed.substring(0, MAX_RECORDED_ACTION_LENGTH);
    }
}
