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

import org.fireflyframework.watcher.model.ScheduleEntry;
import org.fireflyframework.watcher.model.WatcherDefinition;

import java.time.Instant;

/**
 * Response DTO for a schedule table entry.
 */
public record ScheduleEntryResponse(
        String id,
        String title,
        String interval,
        String cronExpression,
        boolean active,
        boolean disabled,
        Instant scheduledAt
) {

    /**
     * Creates a response from a ScheduleEntry.
     */
    public static ScheduleEntryResponse from(ScheduleEntry entry) {
        WatcherDefinition definition = entry.hit().source();
        return new ScheduleEntryResponse(
                entry.watcherId(),
                definition != null ? definition.title() : null,
                entry.interval(),
                entry.recurrence() != null ? entry.recurrence().cronExpression() : null,
                entry.isActive(),
                definition != null && definition.disable(),
                entry.scheduledAt()
        );
    }
}
