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

import lombok.extern.slf4j.Slf4j;
import me.filot.bot.domain.model.NavigationPattern;
import me.filot.bot.domain.model.NavigationStep;
import me.filot.bot.infrastructure.config.BotProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-chat bounded history of recent navigation actions.
 *
 * <p>
 * Each chat has a lazily created session id and an ordered list of steps,
 * newest first. The tracker exposes:
 * <ul>
 * <li>pattern detection over the last 3-4 steps (back-and-forth, circular,
 * rapid menu switching)</li>
 * <li>a short-window duplicate check used as a secondary double-tap
 * signal</li>
 * <li>a force-refresh hint for the content layer</li>
 * </ul>
 *
 * <p>
 * Retention: at most {@code bot.navigation.max-history} steps per chat,
 * enforced on every insert. Steps older than
 * {@code bot.navigation.purge-threshold} are purged across all chats every
 * {@code bot.navigation.purge-every-inserts} inserts.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class NavigationTracker {

    private static final int PATTERN_DEPTH = 4;
    private static final int DUPLICATE_DEPTH = 3;
    private static final int MENU_SWITCH_DEPTH = 3;
    private static final int MIN_STEPS_FOR_PATTERN = 3;

    private final Clock clock;
    private final int maxHistory;
    private final Duration purgeThreshold;
    private final int purgeEveryInserts;
    private final Duration duplicateWindow;
    private final String menuPrefix;

    private final Object lock = new Object();
    private final Map<Long, ChatNavigation> chats = new HashMap<>();
    private long inserts;

    public NavigationTracker(BotProperties properties, Clock clock) {
        BotProperties.NavigationProperties config = properties.getNavigation();
        this.clock = clock;
        this.maxHistory = Math.max(1, config.getMaxHistory());
        this.purgeThreshold = config.getPurgeThreshold();
        this.purgeEveryInserts = Math.max(1, config.getPurgeEveryInserts());
        this.duplicateWindow = config.getDuplicateWindow();
        this.menuPrefix = config.getMenuPrefix();
    }

    /**
     * Appends a step for {@code chatId}, assigning the next index within the
     * chat's current session.
     */
    public NavigationStep record(long chatId, String action) {
        Instant now = clock.instant();
        String normalized = action != null ? action : "";
        NavigationStep step;
        boolean purge;
        synchronized (lock) {
            ChatNavigation chat = chats.computeIfAbsent(chatId, id -> new ChatNavigation(newSessionId(id, now)));
            chat.nextStepIndex++;
            step = NavigationStep.builder()
                    .chatId(chatId)
                    .sessionId(chat.sessionId)
                    .action(normalized)
                    .timestamp(now)
                    .stepIndex(chat.nextStepIndex)
                    .build();
            chat.steps.addFirst(step);
            while (chat.steps.size() > maxHistory) {
                chat.steps.removeLast();
            }
            inserts++;
            purge = inserts % purgeEveryInserts == 0;
            if (purge) {
                purgeOlderThan(now.minus(purgeThreshold));
            }
        }
        log.debug("[Navigation] chat={} step={} action={}", chatId, step.getStepIndex(), normalized);
        return step;
    }

    /**
     * Snapshot of the last {@code n} steps, most recent first.
     */
    public List<NavigationStep> history(long chatId, int n) {
        if (n <= 0) {
            return List.of();
        }
        synchronized (lock) {
            ChatNavigation chat = chats.get(chatId);
            if (chat == null) {
                return List.of();
            }
            List<NavigationStep> result = new ArrayList<>(Math.min(n, chat.steps.size()));
            Iterator<NavigationStep> iterator = chat.steps.iterator();
            while (iterator.hasNext() && result.size() < n) {
                result.add(iterator.next());
            }
            return List.copyOf(result);
        }
    }

    public NavigationPattern detectPattern(long chatId) {
        List<String> actions = recentActions(chatId, PATTERN_DEPTH);
        if (actions.size() < MIN_STEPS_FOR_PATTERN) {
            return NavigationPattern.NONE;
        }
        if (actions.get(0).equals(actions.get(2)) && !actions.get(0).equals(actions.get(1))) {
            return NavigationPattern.BACK_FORTH;
        }
        if (actions.size() >= PATTERN_DEPTH && actions.get(0).equals(actions.get(3))
                && new HashSet<>(actions.subList(0, PATTERN_DEPTH)).size() >= 3) {
            return NavigationPattern.CIRCULAR;
        }
        long menuSteps = actions.stream()
                .limit(MENU_SWITCH_DEPTH)
                .filter(this::isMenuRoot)
                .count();
        if (menuSteps >= 2) {
            return NavigationPattern.MENU_SWITCHING;
        }
        return NavigationPattern.NONE;
    }

    /**
     * Whether {@code action} already appears among the last few steps within the
     * duplicate window (a double-click rather than a deliberate re-press).
     */
    public boolean isDuplicate(long chatId, String action) {
        Instant now = clock.instant();
        for (NavigationStep step : history(chatId, DUPLICATE_DEPTH)) {
            if (step.getAction().equals(action)
                    && Duration.between(step.getTimestamp(), now).compareTo(duplicateWindow) < 0) {
                log.debug("[Navigation] Duplicate navigation within {} ms: {}", duplicateWindow.toMillis(), action);
                return true;
            }
        }
        return false;
    }

    /**
     * Whether recording {@code action} now would continue an A, B, A oscillation:
     * it equals the step before the most recent one and differs from the most
     * recent one.
     */
    public boolean isOscillation(long chatId, String action) {
        List<String> actions = recentActions(chatId, 2);
        return actions.size() == 2
                && actions.get(1).equals(action)
                && !actions.get(0).equals(action);
    }

    /**
     * Most recent menu-root action, or {@code null} if the chat has none.
     */
    public String currentMenu(long chatId) {
        for (String action : recentActions(chatId, maxHistory)) {
            if (isMenuRoot(action)) {
                return action;
            }
        }
        return null;
    }

    /**
     * Hint for the content layer to send a fresh message instead of editing the
     * last one: the user is oscillating, or re-opens the menu already shown.
     */
    public boolean shouldForceRefresh(long chatId, String action) {
        if (detectPattern(chatId) == NavigationPattern.BACK_FORTH) {
            return true;
        }
        String current = currentMenu(chatId);
        return current != null && current.equals(action);
    }

    /**
     * Starts a new session for {@code chatId}. History is kept; the step index
     * restarts at 1.
     */
    public String resetSession(long chatId) {
        Instant now = clock.instant();
        String sessionId;
        synchronized (lock) {
            ChatNavigation chat = chats.get(chatId);
            sessionId = newSessionId(chatId, now) + "_reset";
            if (chat == null) {
                chats.put(chatId, new ChatNavigation(sessionId));
            } else {
                chat.sessionId = sessionId;
                chat.nextStepIndex = 0;
            }
        }
        log.info("[Navigation] Reset navigation session for chat {}: {}", chatId, sessionId);
        return sessionId;
    }

    /**
     * Current session id, or {@code null} if nothing was recorded yet.
     */
    public String sessionId(long chatId) {
        synchronized (lock) {
            ChatNavigation chat = chats.get(chatId);
            return chat != null ? chat.sessionId : null;
        }
    }

    public void purgeExpired() {
        synchronized (lock) {
            purgeOlderThan(clock.instant().minus(purgeThreshold));
        }
    }

    public void clear() {
        synchronized (lock) {
            chats.clear();
            inserts = 0;
        }
    }

    public int trackedChats() {
        synchronized (lock) {
            return chats.size();
        }
    }

    public int totalSteps() {
        synchronized (lock) {
            return chats.values().stream().mapToInt(chat -> chat.steps.size()).sum();
        }
    }

    private List<String> recentActions(long chatId, int depth) {
        return history(chatId, depth).stream().map(NavigationStep::getAction).toList();
    }

    private boolean isMenuRoot(String action) {
        return menuPrefix != null && !menuPrefix.isEmpty() && action.startsWith(menuPrefix);
    }

    // Caller holds the lock.
    private void purgeOlderThan(Instant cutoff) {
        int removed = 0;
        Iterator<Map.Entry<Long, ChatNavigation>> iterator = chats.entrySet().iterator();
        while (iterator.hasNext()) {
            Deque<NavigationStep> steps = iterator.next().getValue().steps;
            while (!steps.isEmpty() && steps.peekLast().getTimestamp().isBefore(cutoff)) {
                steps.removeLast();
                removed++;
            }
            if (steps.isEmpty()) {
                iterator.remove();
            }
        }
        if (removed > 0) {
            log.debug("[Navigation] Purged {} expired steps", removed);
        }
    }

    private static String newSessionId(long chatId, Instant now) {
        return "session_" + chatId + "_" + now.getEpochSecond();
    }

    private static final class ChatNavigation {

        private final Deque<NavigationStep> steps = new ArrayDeque<>();
        private String sessionId;
        private int nextStepIndex;

        private ChatNavigation(String sessionId) {
            this.sessionId = sessionId;
        }
    }
}
