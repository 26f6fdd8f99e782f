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

package org.fireflyframework.watcher.search;

import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Set;

/**
 * Runs watcher search requests.
 * <p>
 * A client can expose several synonymous search operations (for instance one offered by a
 * distributed-search extension next to the plain {@code search}); the operation to use is
 * chosen by {@link SearchMethodResolver}.
 */
public interface SearchClient {

    String DEFAULT_METHOD = "search";

    /**
     * @return the names of the search operations this client supports
     */
    Set<String> supportedMethods();

    /**
     * Executes a search request.
     *
     * @param method  one of {@link #supportedMethods()}
     * @param request the request, typically {@code {index: ..., body: {...}}}
     * @return the result payload, empty if there is none, or an error
     */
    Mono<Map<String, Object>> search(String method, Map<String, Object> request);
}
