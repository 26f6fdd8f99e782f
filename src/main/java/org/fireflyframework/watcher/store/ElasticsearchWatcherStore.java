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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.watcher.exception.WatcherIndexNotFoundException;
import org.fireflyframework.watcher.model.WatcherHit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * {@link WatcherStore} reading watcher documents from an Elasticsearch-compatible index.
 * <p>
 * When a document type is configured only documents of that type are considered,
 * otherwise every document of the index is a watcher. A 404 from the cluster is reported
 * as {@link WatcherIndexNotFoundException}. Documents that cannot be mapped to a
 * {@link WatcherHit} are logged and skipped so they cannot hide the others.
 */
@Slf4j
public class ElasticsearchWatcherStore implements WatcherStore {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String index;
    private final String type;
    private final Duration requestTimeout;

    public ElasticsearchWatcherStore(WebClient webClient, ObjectMapper objectMapper,
                                     String index, String type, Duration requestTimeout) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.index = index;
        this.type = type;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public Mono<Long> getCount() {
        return webClient.post()
                .uri("/{index}/_count", index)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", query()))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(response -> response.path("count").asLong(0))
                .timeout(requestTimeout)
                .onErrorMap(WebClientResponseException.NotFound.class,
                        e -> new WatcherIndexNotFoundException(index, e));
    }

    @Override
    public Flux<WatcherHit> getWatchers(long count) {
        return webClient.post()
                .uri("/{index}/_search", index)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("size", count, "query", query()))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(requestTimeout)
                .onErrorMap(WebClientResponseException.NotFound.class,
                        e -> new WatcherIndexNotFoundException(index, e))
                .flatMapMany(response -> Flux.fromIterable(response.path("hits").path("hits")))
                .concatMap(this::toHit);
    }

    private Mono<WatcherHit> toHit(JsonNode document) {
        return Mono.fromCallable(() -> objectMapper.treeToValue(document, WatcherHit.class))
                .onErrorResume(e -> {
                    log.error("Skipping malformed watcher document {}: {}",
                            document.path("_id").asText(), e.getMessage());
                    return Mono.empty();
                });
    }

    private Map<String, Object> query() {
        if (!StringUtils.hasText(type)) {
            return Map.of("match_all", Map.of());
        }
        return Map.of("term", Map.of("_type", type));
    }
}
