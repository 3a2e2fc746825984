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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.filot.bot.admission.AdmissionGate;
import me.filot.bot.domain.model.AdmissionDecision;
import me.filot.bot.domain.model.AdmissionMetrics;
import me.filot.bot.domain.model.InboundEvent;
import me.filot.bot.infrastructure.config.BotProperties;
import me.filot.bot.port.outbound.ActionHandlerPort;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands inbound events from the polling thread to a bounded worker pool.
 *
 * <p>
 * Each worker asks the {@link AdmissionGate} first and only calls the
 * {@link ActionHandlerPort} for admitted events. A handler failure is logged
 * and resets the chat's navigation session so the next action starts clean.
 * Admission metrics are logged periodically at DEBUG.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class UpdateDispatcher {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final AdmissionGate admissionGate;
    private final ActionHandlerPort actionHandler;
    private final NavigationTracker navigationTracker;
    private final BotProperties.DispatchProperties config;
    private final ExecutorService workers;
    private ScheduledExecutorService metricsExecutor;

    public UpdateDispatcher(AdmissionGate admissionGate, ActionHandlerPort actionHandler,
            NavigationTracker navigationTracker, BotProperties properties) {
        this.admissionGate = admissionGate;
        this.actionHandler = actionHandler;
        this.navigationTracker = navigationTracker;
        this.config = properties.getDispatch();
        AtomicInteger threadIndex = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(Math.max(1, config.getWorkerThreads()), r -> {
            Thread t = new Thread(r, "update-worker-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void startMetricsLog() {
        long intervalMs = config.getMetricsLogInterval().toMillis();
        if (intervalMs <= 0) {
            return;
        }
        metricsExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "admission-metrics");
            t.setDaemon(true);
            return t;
        });
        metricsExecutor.scheduleAtFixedRate(this::logMetrics, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Queues {@code event} for admission and handling. The returned future
     * completes with the admission decision once the handler (if any) returned.
     */
    public CompletableFuture<AdmissionDecision> dispatch(InboundEvent event) {
        try {
            return CompletableFuture.supplyAsync(() -> process(event), workers);
        } catch (RejectedExecutionException e) {
            log.warn("Dispatcher stopped, dropping event {} for chat {}", event.getEventId(), event.getChatId());
            return CompletableFuture.failedFuture(e);
        }
    }

    AdmissionDecision process(InboundEvent event) {
        AdmissionDecision decision = admissionGate.evaluate(event);
        if (!decision.isAdmitted()) {
            return decision;
        }
        try {
            actionHandler.handle(event, decision);
        } catch (RuntimeException e) { // NOSONAR - worker must survive handler failures
            log.error("Handler failed for chat {} event {}", event.getChatId(), event.getEventId(), e);
            navigationTracker.resetSession(event.getChatId());
        }
        return decision;
    }

    void logMetrics() {
        if (!log.isDebugEnabled()) {
            return;
        }
        AdmissionMetrics metrics = admissionGate.metricsSnapshot();
        log.debug("[Admission] keys={} locks={} chats={} steps={} admitted={} suppressed={}",
                metrics.getTrackedKeys(), metrics.getActiveLocks(), metrics.getTrackedChats(),
                metrics.getNavigationSteps(), metrics.getAdmitted(), metrics.getSuppressed());
    }

    @PreDestroy
    public void shutdown() {
        if (metricsExecutor != null) {
            metricsExecutor.shutdownNow();
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }
}
