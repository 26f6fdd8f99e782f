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

package org.fireflyframework.watcher.model;

import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * One row of the schedule table.
 * <p>
 * An entry without a recurrence (and therefore without a timer) records a watcher whose
 * trigger could not be resolved. Keeping the snapshot means the watcher is not re-examined
 * until its stored definition changes.
 *
 * @param hit         the last-seen watcher record, used for change detection
 * @param recurrence  the resolved recurrence, or null when the watcher is unscheduled
 * @param future      the active timer handle, or null when the watcher is unscheduled
 * @param scheduledAt when the entry was created
 */
public record ScheduleEntry(
        WatcherHit hit,
        @Nullable RecurrenceSpec recurrence,
        @Nullable ScheduledFuture<?> future,
        Instant scheduledAt
) {

    public static ScheduleEntry unscheduled(WatcherHit hit) {
        return new ScheduleEntry(hit, null, null, Instant.now());
    }

    public String watcherId() {
        return hit.id();
    }

    public boolean isActive() {
        return future != null && !future.isCancelled();
    }

    @Nullable
    public String interval() {
        return recurrence != null ? recurrence.description() : null;
    }

    /**
     * Cancels the timer without interrupting a firing that is already running.
     * A missing or already-cancelled handle is a no-op.
     *
     * @return true if a live timer was cancelled
     */
    public boolean cancel() {
        if (future == null || future.isCancelled()) {
            return false;
        }
        return future.cancel(false);
    }
}
