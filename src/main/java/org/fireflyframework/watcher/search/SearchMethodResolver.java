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

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Picks the search operation used by watcher firings.
 * <p>
 * When the cluster runs the distributed-search extension, the first candidate of
 * {@link #PREFERRED_METHODS} that the client supports wins; otherwise the plain
 * {@code search} operation is used. The choice is made once and cached.
 */
@Slf4j
public class SearchMethodResolver {

    public static final String DISTRIBUTED_SEARCH_PLUGIN = "siren-vanguard";

    public static final List<String> PREFERRED_METHODS = List.of("kibi_search", "vanguard_search", SearchClient.DEFAULT_METHOD);

    private final SearchClient searchClient;
    private final List<String> clusterPlugins;

    private volatile String resolvedMethod;

    public SearchMethodResolver(SearchClient searchClient, List<String> clusterPlugins) {
        this.searchClient = searchClient;
        this.clusterPlugins = clusterPlugins != null ? List.copyOf(clusterPlugins) : List.of();
    }

    public String resolve() {
        String method = resolvedMethod;
        if (method == null) {
            method = probe();
            resolvedMethod = method;
        }
        return method;
    }

    private String probe() {
        if (!clusterPlugins.contains(DISTRIBUTED_SEARCH_PLUGIN)) {
            return SearchClient.DEFAULT_METHOD;
        }
        String method = PREFERRED_METHODS.stream()
                .filter(candidate -> searchClient.supportedMethods().contains(candidate))
                .findFirst()
                .orElse(SearchClient.DEFAULT_METHOD);
        log.info("Distributed search extension detected, using search method: {}", method);
        return method;
    }
}
