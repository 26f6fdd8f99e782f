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

import org.fireflyframework.watcher.exception.WatcherException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link SearchClient} talking to an Elasticsearch-compatible REST API.
 * <p>
 * Requests follow the layout of the JavaScript client: {@code index} (string or list),
 * optional {@code type} and the query {@code body}. The plain {@code search} operation
 * posts to {@code /{index}/_search}; extension operations post to their configured
 * endpoint, where {@code {index}} is substituted.
 */
@Slf4j
public class ElasticsearchSearchClient implements SearchClient {

    private static final ParameterizedTypeReference<Map<String, Object>> MAP_TYPE =
            new ParameterizedTypeReference<>() {};

    private static final String ALL_INDICES = "_all";

    private final WebClient webClient;
    private final Map<String, String> extensionEndpoints;
    private final Duration requestTimeout;
    private final Set<String> supportedMethods;

    public ElasticsearchSearchClient(WebClient webClient, Map<String, String> extensionEndpoints,
                                     Duration requestTimeout) {
        this.webClient = webClient;
        this.extensionEndpoints = extensionEndpoints != null
                ? new LinkedHashMap<>(extensionEndpoints) : new LinkedHashMap<>();
        this.requestTimeout = requestTimeout;

        Set<String> methods = new LinkedHashSet<>();
        methods.add(DEFAULT_METHOD);
        methods.addAll(this.extensionEndpoints.keySet());
        this.supportedMethods = Collections.unmodifiableSet(methods);
    }

    @Override
    public Set<String> supportedMethods() {
        return supportedMethods;
    }

    @Override
    public Mono<Map<String, Object>> search(String method, Map<String, Object> request) {
        String path;
        try {
            path = resolvePath(method, request);
        } catch (WatcherException e) {
            return Mono.error(e);
        }

        Object body = request.get("body") != null ? request.get("body") : Map.of();
        log.debug("Executing search: method={}, path={}", method, path);

        return webClient.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(MAP_TYPE)
                .timeout(requestTimeout);
    }

    String resolvePath(String method, Map<String, Object> request) {
        String index = formatIndex(request.get("index"));
        if (DEFAULT_METHOD.equals(method)) {
            Object type = request.get("type");
            return type != null
                    ? "/" + index + "/" + type + "/_search"
                    : "/" + index + "/_search";
        }
        String endpoint = extensionEndpoints.get(method);
        if (endpoint == null) {
            throw new WatcherException("Unsupported search method: " + method);
        }
        return endpoint.replace("{index}", index);
    }

    private String formatIndex(Object index) {
        if (index == null) {
            return ALL_INDICES;
        }
        if (index instanceof Collection<?> indices) {
            return indices.isEmpty()
                    ? ALL_INDICES
                    : indices.stream().map(String::valueOf).collect(Collectors.joining(","));
        }
        String value = index.toString();
        return value.isBlank() ? ALL_INDICES : value;
    }
}
