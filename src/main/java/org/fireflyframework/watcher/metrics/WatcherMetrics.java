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

package org.fireflyframework.watcher.metrics;

import org.fireflyframework.watcher.schedule.ReconcileResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Provides Micrometer metrics for watcher scheduling and execution.
 * <p>
 * This class tracks the following metrics:
 * <ul>
 *   <li><b>reconcile.cycles</b> - Counter of reconciliation cycles (tags: status)</li>
 *   <li><b>reconcile.duration</b> - Timer for reconciliation cycles (tags: status)</li>
 *   <li><b>reconcile.watchers</b> - Counter of per-watcher outcomes (tags: outcome)</li>
 *   <li><b>scheduled</b> - Gauge of watchers with an active timer</li>
 *   <li><b>firings</b> - Counter of firings (tags: watcherId)</li>
 *   <li><b>firing.duration</b> - Timer for firings (tags: watcherId)</li>
 *   <li><b>conditions.met</b> - Counter of conditions evaluated truthy (tags: watcherId)</li>
 *   <li><b>actions.dispatched</b> - Counter of dispatched actions (tags: watcherId, kind)</li>
 *   <li><b>script.errors</b> - Counter of script failures (tags: watcherId, kind)</li>
 *   <li><b>search.errors</b> - Counter of failed searches (tags: watcherId)</li>
 * </ul>
 * <p>
 * All metrics are prefixed with "firefly.watcher.".
 */
@Slf4j
public class WatcherMetrics {

    private static final String METRIC_PREFIX = "firefly.watcher.";

    private static final String TAG_WATCHER_ID = "watcherId";
    private static final String TAG_STATUS = "status";
    private static final String TAG_OUTCOME = "outcome";
    private static final String TAG_KIND = "kind";

    private final MeterRegistry meterRegistry;
    private final AtomicInteger scheduledWatchers = new AtomicInteger();

    public WatcherMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        Gauge.builder(METRIC_PREFIX + "scheduled", scheduledWatchers, AtomicInteger::get)
                .description("Number of watchers with an active timer")
                .register(meterRegistry);
        log.info("WatcherMetrics initialized with MeterRegistry: {}", meterRegistry.getClass().getSimpleName());
    }

    // ==================== Reconciliation Metrics ====================

    public void recordReconcile(ReconcileResult result) {
        String statusTag = result.status().name().toLowerCase();

        Counter.builder(METRIC_PREFIX + "reconcile.cycles")
                .description("Number of reconciliation cycles")
                .tag(TAG_STATUS, statusTag)
                .register(meterRegistry)
                .increment();

        Timer.builder(METRIC_PREFIX + "reconcile.duration")
                .description("Reconciliation cycle duration")
                .tag(TAG_STATUS, statusTag)
                .register(meterRegistry)
                .record(result.duration());

        incrementOutcome("scheduled", result.scheduled());
        incrementOutcome("unchanged", result.unchanged());
        incrementOutcome("skipped", result.skipped());
        incrementOutcome("failed", result.failed());
        incrementOutcome("orphaned", result.orphansRemoved());

        log.debug("METRIC: reconcile status={}, fetched={}, scheduled={}, orphansRemoved={}",
                result.status(), result.fetched(), result.scheduled(), result.orphansRemoved());
    }

    public void updateScheduledCount(long count) {
        scheduledWatchers.set((int) count);
    }

    // ==================== Firing Metrics ====================

    public void recordFiring(String watcherId) {
        Counter.builder(METRIC_PREFIX + "firings")
                .description("Number of watcher firings")
                .tag(TAG_WATCHER_ID, watcherId)
                .register(meterRegistry)
                .increment();
    }

    public void recordConditionMet(String watcherId) {
        Counter.builder(METRIC_PREFIX + "conditions.met")
                .description("Number of conditions that evaluated truthy")
                .tag(TAG_WATCHER_ID, watcherId)
                .register(meterRegistry)
                .increment();
    }

    public void recordActionsDispatched(String watcherId, String kind, int count) {
        Counter.builder(METRIC_PREFIX + "actions.dispatched")
                .description("Number of actions handed to the dispatcher")
                .tag(TAG_WATCHER_ID, watcherId)
                .tag(TAG_KIND, kind)
                .register(meterRegistry)
                .increment(count);

        log.debug("METRIC: actions.dispatched watcherId={}, kind={}, count={}", watcherId, kind, count);
    }

    public void recordScriptError(String watcherId, String kind) {
        Counter.builder(METRIC_PREFIX + "script.errors")
                .description("Number of condition or transform failures")
                .tag(TAG_WATCHER_ID, watcherId)
                .tag(TAG_KIND, kind)
                .register(meterRegistry)
                .increment();
    }

    public void recordSearchError(String watcherId) {
        Counter.builder(METRIC_PREFIX + "search.errors")
                .description("Number of failed watcher searches")
                .tag(TAG_WATCHER_ID, watcherId)
                .register(meterRegistry)
                .increment();
    }

    /**
     * Creates a timer sample for measuring a firing.
     */
    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Stops a firing timer sample.
     */
    public void stopTimer(Timer.Sample sample, String watcherId) {
        if (sample == null) return;

        sample.stop(Timer.builder(METRIC_PREFIX + "firing.duration")
                .description("Watcher firing duration")
                .tag(TAG_WATCHER_ID, watcherId)
                .register(meterRegistry));
    }

    private void incrementOutcome(String outcome, int amount) {
        if (amount <= 0) {
            return;
        }
        Counter.builder(METRIC_PREFIX + "reconcile.watchers")
                .description("Per-watcher reconciliation outcomes")
                .tag(TAG_OUTCOME, outcome)
                .register(meterRegistry)
                .increment(amount);
    }
}
