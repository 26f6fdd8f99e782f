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

import org.fireflyframework.watcher.model.ScheduleEntry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Watcher id to {@link ScheduleEntry} map owned by the reconciler.
 * <p>
 * Holds at most one entry, and therefore at most one timer, per watcher id. An entry's
 * timer is always cancelled before the entry is replaced or removed. All access goes
 * through a single lock.
 */
@Slf4j
public class ScheduleTable {

    private final Map<String, ScheduleEntry> entries = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public Optional<ScheduleEntry> get(String watcherId) {
        lock.lock();
        try {
            return Optional.ofNullable(entries.get(watcherId));
        } finally {
            lock.unlock();
        }
    }

    public Set<String> ids() {
        lock.lock();
        try {
            return new LinkedHashSet<>(entries.keySet());
        } finally {
            lock.unlock();
        }
    }

    public List<ScheduleEntry> entries() {
        lock.lock();
        try {
            return new ArrayList<>(entries.values());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public long activeCount() {
        lock.lock();
        try {
            return entries.values().stream().filter(ScheduleEntry::isActive).count();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores an entry, cancelling the timer of any entry it replaces.
     */
    public void put(ScheduleEntry entry) {
        lock.lock();
        try {
            ScheduleEntry previous = entries.get(entry.watcherId());
            if (previous != null && previous != entry) {
                previous.cancel();
            }
            entries.put(entry.watcherId(), entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels the entry's timer and removes the entry.
     * <p>
     * The entry is removed even if cancelling fails; the failure is rethrown afterwards.
     *
     * @return the removed entry, if there was one
     */
    public Optional<ScheduleEntry> remove(String watcherId) {
        lock.lock();
        try {
            ScheduleEntry entry = entries.get(watcherId);
            if (entry == null) {
                return Optional.empty();
            }
            try {
                entry.cancel();
            } finally {
                entries.remove(watcherId);
            }
            return Optional.of(entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels every timer and empties the table.
     */
    public void clear() {
        lock.lock();
        try {
            entries.values().forEach(entry -> {
                try {
                    entry.cancel();
                } catch (RuntimeException e) {
                    log.warn("Failed to cancel timer for watcher {}: {}", entry.watcherId(), e.getMessage());
                }
            });
            log.info("Cleared {} scheduled watcher(s)", entries.size());
            entries.clear();
        } finally {
            lock.unlock();
        }
    }
}
