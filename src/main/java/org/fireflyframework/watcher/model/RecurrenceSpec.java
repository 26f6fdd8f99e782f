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

import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.scheduling.support.PeriodicTrigger;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Resolved, schedulable form of a watcher trigger.
 * <p>
 * Exactly one of {@code cronExpression} and {@code period} is set.
 *
 * @param description    the human-readable interval stored on the schedule entry
 *                       (the original phrase, or the number of seconds)
 * @param cronExpression a Spring six-field cron expression, or null
 * @param period         a fixed period, or null
 */
public record RecurrenceSpec(String description, String cronExpression, Duration period) {

    /**
     * Longest fixed period a trigger may use.
     */
    public static final Duration MAX_PERIOD = Duration.ofDays(3650);

    public RecurrenceSpec {
        Objects.requireNonNull(description, "description");
        if ((cronExpression == null) == (period == null)) {
            throw new IllegalArgumentException("Exactly one of cronExpression and period must be set");
        }
    }

    public static RecurrenceSpec cron(String description, String cronExpression) {
        return new RecurrenceSpec(description, cronExpression, null);
    }

    public static RecurrenceSpec everySeconds(long seconds) {
        if (seconds <= 0 || seconds > MAX_PERIOD.toSeconds()) {
            throw new IllegalArgumentException("Interval out of range: " + seconds);
        }
        return new RecurrenceSpec(String.valueOf(seconds), null, Duration.ofSeconds(seconds));
    }

    public static RecurrenceSpec every(String description, Duration period) {
        return new RecurrenceSpec(description, null, period);
    }

    public boolean isCron() {
        return cronExpression != null;
    }

    /**
     * Builds the Spring trigger for this recurrence.
     *
     * @param zone time zone used for cron evaluation
     * @return a {@link CronTrigger} or a fixed-rate {@link PeriodicTrigger}
     */
    public Trigger toTrigger(ZoneId zone) {
        if (isCron()) {
            return new CronTrigger(cronExpression, zone);
        }
        PeriodicTrigger trigger = new PeriodicTrigger(period);
        trigger.setFixedRate(true);
        trigger.setInitialDelay(period);
        return trigger;
    }

    @Override
    public String toString() {
        return isCron() ? description + " (cron: " + cronExpression + ")" : description + "s";
    }
}
