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

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one reconciliation cycle.
 *
 * @param fetched        watcher records fetched from storage
 * @param scheduled      timers installed (new or changed watchers)
 * @param unchanged      watchers whose snapshot was unchanged
 * @param skipped        watchers left without a timer (no usable trigger)
 * @param failed         watchers whose processing threw
 * @param orphansRemoved entries removed because their watcher disappeared
 * @param status         overall cycle status
 * @param completedAt    when the cycle finished
 * @param duration       how long the cycle took
 */
public record ReconcileResult(
        int fetched,
        int scheduled,
        int unchanged,
        int skipped,
        int failed,
        int orphansRemoved,
        Status status,
        Instant completedAt,
        Duration duration
) {

    public enum Status {
        /** Watchers were fetched and reconciled. */
        COMPLETED,
        /** The watcher index does not exist yet; nothing was scheduled. */
        INDEX_MISSING,
        /** Fetching watchers failed; the schedule was left untouched. */
        FAILED
    }

    public static ReconcileResult of(Status status, Duration duration) {
        return new ReconcileResult(0, 0, 0, 0, 0, 0, status, Instant.now(), duration);
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
