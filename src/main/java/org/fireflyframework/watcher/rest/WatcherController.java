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

package org.fireflyframework.watcher.rest;

import org.fireflyframework.watcher.rest.dto.ReconcileResponse;
import org.fireflyframework.watcher.rest.dto.ScheduleEntryResponse;
import org.fireflyframework.watcher.schedule.ScheduleReconciler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;

/**
 * REST controller for the watcher schedule.
 * <p>
 * Provides endpoints for:
 * <ul>
 *   <li>Listing the schedule table</li>
 *   <li>Forcing a reconciliation with storage</li>
 *   <li>Running a watcher once outside its schedule</li>
 * </ul>
 */
@Slf4j
@RestController
@RequestMapping("${firefly.watcher.api.base-path:/api/v1/watchers}")
@RequiredArgsConstructor
public class WatcherController {

    private final ScheduleReconciler reconciler;

    /**
     * Lists every watcher in the schedule table, ordered by id.
     */
    @GetMapping("/schedule")
    public Mono<ResponseEntity<List<ScheduleEntryResponse>>> listSchedule() {
        return Mono.fromSupplier(() -> reconciler.getEntries().stream()
                        .map(ScheduleEntryResponse::from)
                        .sorted(Comparator.comparing(ScheduleEntryResponse::id))
                        .toList())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/schedule/{watcherId}")
    public Mono<ResponseEntity<ScheduleEntryResponse>> getScheduleEntry(@PathVariable String watcherId) {
        return Mono.justOrEmpty(reconciler.getEntry(watcherId))
                .map(ScheduleEntryResponse::from)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    /**
     * Reconciles the schedule with storage now, without waiting for the reload interval.
     */
    @PostMapping("/reload")
    public Mono<ResponseEntity<ReconcileResponse>> reload() {
        log.info("Reload requested through REST API");
        return reconciler.reconcile()
                .map(ReconcileResponse::from)
                .map(ResponseEntity::ok);
    }

    /**
     * Runs a watcher once and responds when the firing is over.
     */
    @PostMapping("/{watcherId}/execute")
    public Mono<ResponseEntity<Void>> execute(@PathVariable String watcherId) {
        return reconciler.triggerNow(watcherId)
                .map(found -> found
                        ? ResponseEntity.accepted().<Void>build()
                        : ResponseEntity.notFound().<Void>build());
    }
}
