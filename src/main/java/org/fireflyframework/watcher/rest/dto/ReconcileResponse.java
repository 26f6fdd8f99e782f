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

package org.fireflyframework.watcher.rest.dto;

import org.fireflyframework.watcher.schedule.ReconcileResult;

import java.time.Instant;

/**
 * Response DTO for a reconciliation cycle.
 */
public record ReconcileResponse(
        ReconcileResult.Status status,
        int fetched,
        int scheduled,
        int unchanged,
        int skipped,
        int failed,
        int orphansRemoved,
        long durationMs,
        Instant completedAt
) {

    public static ReconcileResponse from(ReconcileResult result) {
        return new ReconcileResponse(
                result.status(),
                result.fetched(),
                result.scheduled(),
                result.unchanged(),
                result.skipped(),
                result.failed(),
                result.orphansRemoved(),
                result.duration().toMillis(),
                result.completedAt()
        );
    }
}
