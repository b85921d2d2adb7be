package me.golemcore.memory.sweep;

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
import me.golemcore.memory.domain.model.EventsIngestedEvent;
import me.golemcore.memory.domain.model.SweepReport;
import me.golemcore.memory.domain.service.CognitiveSweepService;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the cognitive sweep in the background.
 *
 * <p>
 * A single ticker thread wakes every {@code memory.sweep.interval-minutes}
 * and submits one sweep per known user to a worker pool, so different users
 * are swept in parallel. A user whose sweep is still running is skipped. After
 * {@code memory.sweep.event-batch-size} newly ingested events for a user, a
 * sweep for that user is triggered without waiting for the next tick.
 *
 * @since 1.0
 * @see CognitiveSweepService
 */
@Component
@Slf4j
public class CognitiveSweepScheduler {

    private final CognitiveSweepService sweepService;
    private final MemoryProperties properties;
    private final Clock clock;

    private final Set<String> running = ConcurrentHashMap.newKeySet();
    private final Map<String, AtomicInteger> pendingEvents = new ConcurrentHashMap<>();
    private final Map<String, Future<?>> inFlight = new ConcurrentHashMap<>();

    private ScheduledExecutorService ticker;
    private ExecutorService workers;
    private ScheduledFuture<?> tickTask;

    public CognitiveSweepScheduler(CognitiveSweepService sweepService, MemoryProperties properties, Clock clock) {
        this.sweepService = sweepService;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        MemoryProperties.SweepProperties config = properties.getSweep();
        if (!config.isEnabled()) {
            log.info("[SweepScheduler] Background sweep disabled");
            return;
        }

        AtomicInteger workerIndex = new AtomicInteger();
        workers = Executors.newFixedThreadPool(Math.max(1, config.getWorkerThreads()), r -> {
            Thread t = new Thread(r, "memory-sweep-" + workerIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "memory-sweep-scheduler");
            t.setDaemon(true);
            return t;
        });

        int intervalMinutes = Math.max(1, config.getIntervalMinutes());
        tickTask = ticker.scheduleAtFixedRate(this::tick, intervalMinutes, intervalMinutes, TimeUnit.MINUTES);
        log.info("[SweepScheduler] Started with interval {} min and {} worker(s)", intervalMinutes,
                config.getWorkerThreads());
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        inFlight.values().forEach(future -> future.cancel(true));
        shutdownExecutor(ticker);
        shutdownExecutor(workers);
        log.info("[SweepScheduler] Shut down");
    }

    @EventListener
    public void onEventsIngested(EventsIngestedEvent event) {
        int pending = pendingEvents.computeIfAbsent(event.userId(), id -> new AtomicInteger())
                .addAndGet(event.eventCount());
        if (pending >= properties.getSweep().getEventBatchSize()) {
            log.debug("[SweepScheduler] {} new event(s) for user {}, triggering sweep", pending, event.userId());
            submit(event.userId());
        }
    }

    void tick() {
        try {
            List<String> users = sweepService.knownUsers();
            log.debug("[SweepScheduler] Tick: {} known user(s)", users.size());
            users.forEach(this::submit);
        } catch (Exception e) {
            log.error("[SweepScheduler] Tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Schedules a sweep for the user unless one is already running.
     *
     * @return the submitted sweep, empty when skipped
     */
    public Optional<Future<?>> submit(String userId) {
        if (workers == null) {
            return Optional.empty();
        }
        if (!running.add(userId)) {
            log.debug("[SweepScheduler] Sweep of user {} already running, skipped", userId);
            return Optional.empty();
        }
        try {
            FutureTask<Void> task = new FutureTask<>(() -> runSweep(userId), null);
            inFlight.put(userId, task);
            workers.execute(task);
            return Optional.of(task);
        } catch (RejectedExecutionException e) {
            inFlight.remove(userId);
            running.remove(userId);
            log.warn("[SweepScheduler] Sweep of user {} rejected: {}", userId, e.getMessage());
            return Optional.empty();
        }
    }

    public boolean isRunning(String userId) {
        return running.contains(userId);
    }

    private void runSweep(String userId) {
        try {
            pendingEvents.computeIfAbsent(userId, id -> new AtomicInteger()).set(0);
            SweepReport report = sweepService.sweep(userId, clock.instant());
            if (report.isAborted()) {
                log.info("[SweepScheduler] Sweep of user {} aborted", userId);
            }
        } catch (Exception e) {
            log.error("[SweepScheduler] Sweep of user {} failed: {}", userId, e.getMessage(), e);
        } finally {
            inFlight.remove(userId);
            running.remove(userId);
        }
    }

    private void shutdownExecutor(ExecutorService executor) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
