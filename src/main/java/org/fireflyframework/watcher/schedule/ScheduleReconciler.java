/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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
 */

package org.fireflyframework.watcher.schedule;

import org.fireflyframework.watcher.exception.InvalidRecurrenceException;
import org.fireflyframework.watcher.exception.WatcherIndexNotFoundException;
import org.fireflyframework.watcher.execution.WatcherExecutor;
import org.fireflyframework.watcher.metrics.WatcherMetrics;
import org.fireflyframework.watcher.model.RecurrenceSpec;
import org.fireflyframework.watcher.model.ScheduleEntry;
import org.fireflyframework.watcher.model.WatcherDefinition;
import org.fireflyframework.watcher.model.WatcherHit;
import org.fireflyframework.watcher.properties.WatcherProperties;
import org.fireflyframework.watcher.store.WatcherStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.lang.Nullable;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.util.StringUtils;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;

/**
 * Keeps the {@link ScheduleTable} in step with the watchers held in storage.
 * <p>
 * Each reconciliation cycle:
 * <ol>
 *   <li>fetches every stored watcher</li>
 *   <li>cancels and removes entries whose watcher disappeared</li>
 *   <li>leaves entries whose watcher is unchanged alone</li>
 *   <li>replaces the timer of every new or changed watcher</li>
 * </ol>
 * A cycle never fails. A missing watcher index is reported at INFO and leaves the table
 * untouched; any other fetch failure is reported at ERROR. Failures of a single watcher
 * are logged and do not affect the others.
 * <p>
 * {@link #start()} runs a cycle immediately and then every
 * {@code firefly.watcher.reload-interval}; cycles never overlap.
 */
@Slf4j
public class ScheduleReconciler implements DisposableBean {

    private enum Outcome { SCHEDULED, UNCHANGED, SKIPPED }

    private final WatcherStore watcherStore;
    private final ScheduleTable scheduleTable;
    private final TaskScheduler taskScheduler;
    private final RecurrenceParser recurrenceParser;
    private final WatcherExecutor watcherExecutor;
    private final WatcherProperties properties;
    private final WatcherMetrics watcherMetrics;
    private final ZoneId zone;

    private volatile Disposable reloadSubscription;
    private volatile ReconcileResult lastResult;

    public ScheduleReconciler(WatcherStore watcherStore,
                              ScheduleTable scheduleTable,
                              TaskScheduler taskScheduler,
                              RecurrenceParser recurrenceParser,
                              WatcherExecutor watcherExecutor,
                              WatcherProperties properties,
                              @Nullable WatcherMetrics watcherMetrics) {
        this.watcherStore = watcherStore;
        this.scheduleTable = scheduleTable;
        this.taskScheduler = taskScheduler;
        this.recurrenceParser = recurrenceParser;
        this.watcherExecutor = watcherExecutor;
        this.properties = properties;
        this.watcherMetrics = watcherMetrics;
        String configuredZone = properties.getScheduling().getZone();
        this.zone = StringUtils.hasText(configuredZone) ? ZoneId.of(configuredZone) : ZoneId.systemDefault();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.getScheduling().isAutoStart()) {
            start();
        } else {
            log.info("Watcher auto-start disabled, reload loop not started");
        }
    }

    /**
     * Starts the reload loop. Calling it while the loop is running has no effect.
     */
    public synchronized void start() {
        if (isRunning()) {
            log.warn("Watcher reconciler is already running");
            return;
        }

        Duration reloadInterval = properties.getReloadInterval();
        log.info("Starting watcher reconciler with reloadInterval={}", reloadInterval);

        reloadSubscription = Flux.interval(Duration.ZERO, reloadInterval)
                .onBackpressureDrop(tick -> log.debug("Reconciliation still running, dropping reload tick {}", tick))
                .concatMap(tick -> reconcile(), 0)
                .subscribe(
                        null,
                        error -> log.error("Watcher reload loop terminated unexpectedly", error));
    }

    /**
     * Stops the reload loop. Timers already installed keep running.
     */
    public synchronized void stop() {
        if (isRunning()) {
            log.info("Stopping watcher reconciler");
            reloadSubscription.dispose();
            reloadSubscription = null;
        }
    }

    public boolean isRunning() {
        Disposable subscription = reloadSubscription;
        return subscription != null && !subscription.isDisposed();
    }

    /**
     * Runs one reconciliation cycle.
     *
     * @return the outcome of the cycle; the Mono never errors
     */
    public Mono<ReconcileResult> reconcile() {
        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            return watcherStore.getCount()
                    .flatMap(count -> watcherStore.getWatchers(count).collectList())
                    .defaultIfEmpty(List.of())
                    .map(hits -> apply(hits, startNanos))
                    .onErrorResume(WatcherIndexNotFoundException.class, e -> {
                        log.info("No watcher index found, initializing: index={}", e.getIndex());
                        return Mono.just(ReconcileResult.of(ReconcileResult.Status.INDEX_MISSING, elapsed(startNanos)));
                    })
                    .onErrorResume(e -> {
                        log.error("Failed to reload watchers: {}", e.getMessage(), e);
                        return Mono.just(ReconcileResult.of(ReconcileResult.Status.FAILED, elapsed(startNanos)));
                    })
                    .doOnNext(this::complete);
        });
    }

    /**
     * Runs a watcher once, outside its schedule.
     *
     * @param watcherId the watcher to run
     * @return true once the firing is over, false if the watcher is not in the schedule table
     */
    public Mono<Boolean> triggerNow(String watcherId) {
        return Mono.defer(() -> scheduleTable.get(watcherId)
                .map(entry -> {
                    log.info("Manually firing watcher: {}", watcherId);
                    return watcherExecutor.execute(entry.hit()).thenReturn(true);
                })
                .orElseGet(() -> Mono.just(false)));
    }

    public List<ScheduleEntry> getEntries() {
        return scheduleTable.entries();
    }

    public Optional<ScheduleEntry> getEntry(String watcherId) {
        return scheduleTable.get(watcherId);
    }

    /**
     * @return the outcome of the most recent cycle, or null before the first one
     */
    @Nullable
    public ReconcileResult getLastResult() {
        return lastResult;
    }

    /**
     * Stops the reload loop and cancels every timer.
     */
    @Override
    public void destroy() {
        stop();
        scheduleTable.clear();
    }

    synchronized ReconcileResult apply(List<WatcherHit> hits, long startNanos) {
        Map<String, WatcherHit> fetched = new LinkedHashMap<>();
        for (WatcherHit hit : hits) {
            if (hit == null || hit.id() == null) {
                log.debug("Ignoring watcher record without id");
                continue;
            }
            fetched.put(hit.id(), hit);
        }

        int orphansRemoved = removeOrphans(fetched.keySet());

        int scheduled = 0;
        int unchanged = 0;
        int skipped = 0;
        int failed = 0;
        for (WatcherHit hit : fetched.values()) {
            try {
                switch (reconcileWatcher(hit)) {
                    case SCHEDULED -> scheduled++;
                    case UNCHANGED -> unchanged++;
                    case SKIPPED -> skipped++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("Failed to schedule watcher {}: {}", hit.id(), e.getMessage(), e);
            }
        }

        ReconcileResult result = new ReconcileResult(fetched.size(), scheduled, unchanged, skipped, failed,
                orphansRemoved, ReconcileResult.Status.COMPLETED, Instant.now(), elapsed(startNanos));
        log.debug("Reconciled watchers: fetched={}, scheduled={}, unchanged={}, skipped={}, failed={}, orphansRemoved={}",
                result.fetched(), scheduled, unchanged, skipped, failed, orphansRemoved);
        return result;
    }

    private int removeOrphans(Set<String> fetchedIds) {
        int removed = 0;
        for (String watcherId : scheduleTable.ids()) {
            if (fetchedIds.contains(watcherId)) {
                continue;
            }
            try {
                log.info("Removing orphaned watcher: {}", watcherId);
                scheduleTable.remove(watcherId);
                removed++;
            } catch (RuntimeException e) {
                log.warn("Failed to remove orphaned watcher {}: {}", watcherId, e.getMessage());
            }
        }
        return removed;
    }

    private Outcome reconcileWatcher(WatcherHit hit) {
        String watcherId = hit.id();

        Optional<ScheduleEntry> existing = scheduleTable.get(watcherId);
        if (existing.isPresent()) {
            if (existing.get().hit().equals(hit)) {
                return Outcome.UNCHANGED;
            }
            log.info("Clearing watcher: {}", watcherId);
            scheduleTable.remove(watcherId);
        }

        RecurrenceSpec recurrence = resolveRecurrence(hit);
        if (recurrence == null) {
            scheduleTable.put(ScheduleEntry.unscheduled(hit));
            return Outcome.SKIPPED;
        }

        ScheduledFuture<?> future;
        try {
            future = taskScheduler.schedule(() -> watcherExecutor.fire(hit), recurrence.toTrigger(zone));
        } catch (RuntimeException e) {
            log.warn("Watcher {} schedule '{}' could not be installed, not scheduled: {}",
                    watcherId, recurrence.description(), e.getMessage());
            scheduleTable.put(ScheduleEntry.unscheduled(hit));
            return Outcome.SKIPPED;
        }
        if (future == null) {
            log.info("Watcher {} schedule '{}' never fires, not scheduled", watcherId, recurrence.description());
            scheduleTable.put(ScheduleEntry.unscheduled(hit));
            return Outcome.SKIPPED;
        }

        scheduleTable.put(new ScheduleEntry(hit, recurrence, future, Instant.now()));
        log.info("Scheduled watcher {} every {}", watcherId, recurrence.description());
        return Outcome.SCHEDULED;
    }

    /**
     * Resolves the recurrence of a watcher: a {@code later} phrase wins over a numeric
     * {@code interval}, which must be a positive whole number of seconds no longer than
     * {@link RecurrenceSpec#MAX_PERIOD}.
     *
     * @return the recurrence, or null if the watcher cannot be scheduled
     */
    @Nullable
    RecurrenceSpec resolveRecurrence(WatcherHit hit) {
        WatcherDefinition definition = hit.source();
        WatcherDefinition.ScheduleSpec schedule = definition != null ? definition.schedule() : null;
        if (schedule == null) {
            log.info("Watcher {} has no schedule, not scheduled", hit.id());
            return null;
        }

        if (StringUtils.hasText(schedule.later())) {
            try {
                return recurrenceParser.parse(schedule.later());
            } catch (InvalidRecurrenceException e) {
                log.info("Watcher {} has an invalid schedule, not scheduled: {}", hit.id(), e.getMessage());
                return null;
            }
        }

        Double interval = schedule.interval();
        if (interval != null && interval > 0 && interval % 1 == 0 && interval <= RecurrenceSpec.MAX_PERIOD.toSeconds()) {
            return RecurrenceSpec.everySeconds(interval.longValue());
        }

        log.info("Watcher {} has no usable schedule (interval={}), not scheduled", hit.id(), interval);
        return null;
    }

    private void complete(ReconcileResult result) {
        lastResult = result;
        if (watcherMetrics != null) {
            watcherMetrics.recordReconcile(result);
            watcherMetrics.updateScheduledCount(scheduleTable.activeCount());
        }
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
