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

package org.fireflyframework.watcher.health;

import org.fireflyframework.watcher.exception.WatcherIndexNotFoundException;
import org.fireflyframework.watcher.schedule.ReconcileResult;
import org.fireflyframework.watcher.schedule.ScheduleReconciler;
import org.fireflyframework.watcher.schedule.ScheduleTable;
import org.fireflyframework.watcher.store.WatcherStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Health indicator for the Watcher Engine.
 * <p>
 * Reports the health status based on:
 * <ul>
 *   <li>Watcher store connectivity</li>
 *   <li>Outcome of the last reconciliation cycle</li>
 *   <li>Number of scheduled watchers</li>
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class WatcherEngineHealthIndicator implements ReactiveHealthIndicator {

    private final ScheduleReconciler reconciler;
    private final ScheduleTable scheduleTable;
    private final WatcherStore watcherStore;

    @Override
    public Mono<Health> health() {
        return checkStore()
                .map(storeHealthy -> {
                    ReconcileResult lastResult = reconciler.getLastResult();

                    Health.Builder builder;
                    if (!storeHealthy || (lastResult != null && lastResult.isFailed())) {
                        builder = Health.down();
                    } else if (lastResult == null) {
                        builder = Health.unknown();
                    } else {
                        builder = Health.up();
                    }

                    builder.withDetail("store", storeHealthy ? "connected" : "disconnected")
                            .withDetail("reloadLoop", reconciler.isRunning() ? "running" : "stopped")
                            .withDetail("watchers", scheduleTable.size())
                            .withDetail("scheduledWatchers", scheduleTable.activeCount());
                    if (lastResult != null) {
                        builder.withDetail("lastReconcileStatus", lastResult.status())
                                .withDetail("lastReconcileAt", lastResult.completedAt());
                    }
                    return builder.build();
                })
                .onErrorResume(e -> {
                    log.warn("Watcher engine health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }

    private Mono<Boolean> checkStore() {
        // a missing index still means the store answered
        return watcherStore.getCount()
                .map(count -> true)
                .switchIfEmpty(Mono.just(true))
                .timeout(Duration.ofSeconds(5))
                .onErrorResume(WatcherIndexNotFoundException.class, e -> Mono.just(true))
                .onErrorReturn(false);
    }
}
