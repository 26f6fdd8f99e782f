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

import org.fireflyframework.watcher.TestWatchers;
import org.fireflyframework.watcher.model.RecurrenceSpec;
import org.fireflyframework.watcher.model.ScheduleEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ScheduleTable}.
 */
@ExtendWith(MockitoExtension.class)
class ScheduleTableTest {

    @Mock
    private ScheduledFuture<Object> firstFuture;

    @Mock
    private ScheduledFuture<Object> secondFuture;

    private ScheduleTable table;

    @BeforeEach
    void setUp() {
        table = new ScheduleTable();
    }

    private ScheduleEntry entry(String id, ScheduledFuture<?> future) {
        return new ScheduleEntry(TestWatchers.hit(id, TestWatchers.interval(30.0)),
                RecurrenceSpec.everySeconds(30), future, Instant.now());
    }

    @Test
    @DisplayName("should cancel the replaced entry's timer without interrupting it")
    void shouldCancelReplacedTimer() {
        table.put(entry("w1", firstFuture));
        table.put(entry("w1", secondFuture));

        verify(firstFuture).cancel(false);
        verify(secondFuture, never()).cancel(false);
        assertThat(table.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("should cancel and remove an entry")
    void shouldCancelAndRemoveEntry() {
        table.put(entry("w1", firstFuture));

        assertThat(table.remove("w1")).isPresent();
        assertThat(table.remove("w1")).isEmpty();

        verify(firstFuture).cancel(false);
        assertThat(table.get("w1")).isEmpty();
    }

    @Test
    @DisplayName("should remove the entry even when cancelling fails")
    void shouldRemoveEntryEvenWhenCancelFails() {
        when(firstFuture.cancel(false)).thenThrow(new IllegalStateException("executor gone"));
        table.put(entry("w1", firstFuture));

        assertThatThrownBy(() -> table.remove("w1")).isInstanceOf(IllegalStateException.class);
        assertThat(table.ids()).isEmpty();
    }

    @Test
    @DisplayName("should tolerate entries without a timer")
    void shouldTolerateEntriesWithoutTimer() {
        table.put(ScheduleEntry.unscheduled(TestWatchers.hit("w1", TestWatchers.interval(1.5))));

        assertThat(table.activeCount()).isZero();
        assertThat(table.remove("w1")).isPresent();
    }

    @Test
    @DisplayName("should not cancel an already-cancelled timer")
    void shouldNotCancelAlreadyCancelledTimer() {
        when(firstFuture.isCancelled()).thenReturn(true);
        table.put(entry("w1", firstFuture));

        table.remove("w1");

        verify(firstFuture, never()).cancel(false);
    }

    @Test
    @DisplayName("should cancel every timer on clear, even after a failure")
    void shouldCancelEveryTimerOnClear() {
        when(firstFuture.cancel(false)).thenThrow(new IllegalStateException("executor gone"));
        table.put(entry("w1", firstFuture));
        table.put(entry("w2", secondFuture));

        table.clear();

        verify(firstFuture).cancel(false);
        verify(secondFuture).cancel(false);
        assertThat(table.size()).isZero();
    }
}
