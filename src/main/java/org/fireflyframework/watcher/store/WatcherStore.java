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

import org.fireflyframework.watcher.exception.WatcherIndexNotFoundException;
import org.fireflyframework.watcher.model.WatcherHit;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Source of stored watcher definitions.
 * <p>
 * Listing takes an upper bound, so callers count first and then fetch that many records.
 * Both operations signal {@link WatcherIndexNotFoundException} when the backing index does
 * not exist yet.
 */
public interface WatcherStore {

    /**
     * @return the number of stored watchers
     */
    Mono<Long> getCount();

    /**
     * @param count maximum number of records to return
     * @return the stored watchers, in storage order
     */
    Flux<WatcherHit> getWatchers(long count);
}
