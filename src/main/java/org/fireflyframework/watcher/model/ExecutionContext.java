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

import org.fireflyframework.watcher.search.SearchClient;

/**
 * Per-firing state. Never persisted.
 *
 * @param watcherId    the watcher being fired
 * @param hit          the snapshot captured when the timer was installed
 * @param searchClient client used for every search of this firing
 * @param searchMethod the search operation selected for this client
 */
public record ExecutionContext(
        String watcherId,
        WatcherHit hit,
        SearchClient searchClient,
        String searchMethod
) {

    public WatcherDefinition definition() {
        return hit.source();
    }
}
