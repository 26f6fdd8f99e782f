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

package org.fireflyframework.watcher.store;

import org.fireflyframework.watcher.model.WatcherDefinition;
import org.fireflyframework.watcher.model.WatcherHit;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-process {@link WatcherStore}. Keeps insertion order.
 */
public class InMemoryWatcherStore implements WatcherStore {

    private final Map<String, WatcherDefinition> watchers = new LinkedHashMap<>();

    public synchronized void save(String id, WatcherDefinition definition) {
        watchers.put(id, definition);
    }

    public synchronized boolean delete(String id) {
        return watchers.remove(id) != null;
    }

    public synchronized Optional<WatcherDefinition> get(String id) {
        return Optional.ofNullable(watchers.get(id));
    }

    @Override
    public Mono<Long> getCount() {
        return Mono.fromSupplier(this::size);
    }

    @Override
    public Flux<WatcherHit> getWatchers(long count) {
        return Flux.defer(() -> Flux.fromIterable(snapshot())).take(count);
    }

    private synchronized long size() {
        return watchers.size();
    }

    private synchronized List<WatcherHit> snapshot() {
        List<WatcherHit> hits = new ArrayList<>(watchers.size());
        watchers.forEach((id, definition) -> hits.add(new WatcherHit(id, definition)));
        return hits;
    }
}
