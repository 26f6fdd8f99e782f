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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.watcher.exception.WatcherIndexNotFoundException;
import org.fireflyframework.watcher.model.WatcherHit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ElasticsearchWatcherStore}.
 */
class ElasticsearchWatcherStoreTest {

    private static final String SEARCH_RESPONSE = """
            {
              "hits": {
                "total": 2,
                "hits": [
                  {
                    "_id": "w1",
                    "_type": "sentinl-watcher",
                    "_source": {
                      "title": "Error spike",
                      "disable": false,
                      "trigger": { "schedule": { "later": "every 5 minutes" } },
                      "input": { "search": { "request": { "index": ["logs"], "body": {} } } },
                      "condition": { "script": { "script": "payload.hits.total > 0" } },
                      "actions": { "email_admin": { "email": { "to": "admin@example.com" } } },
                      "wizard": { "ignored": true }
                    }
                  },
                  {
                    "_id": "broken",
                    "_source": { "trigger": "not-an-object" }
                  },
                  {
                    "_id": "w2",
                    "_source": { "trigger": { "schedule": { "interval": 30 } } }
                  }
                ]
              }
            }
            """;

    private final List<ClientRequest> requests = new ArrayList<>();

    private ElasticsearchWatcherStore store(HttpStatus status, String body, String type) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://localhost:9200")
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new ElasticsearchWatcherStore(webClient, new ObjectMapper(), "watcher", type, Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("should read the document count")
    void shouldReadCount() {
        StepVerifier.create(store(HttpStatus.OK, "{\"count\":12}", "sentinl-watcher").getCount())
                .expectNext(12L)
                .verifyComplete();

        assertThat(requests.get(0).url().getPath()).isEqualTo("/watcher/_count");
    }

    @Test
    @DisplayName("should map a missing index to WatcherIndexNotFoundException")
    void shouldMapMissingIndex() {
        ElasticsearchWatcherStore store = store(HttpStatus.NOT_FOUND, "{\"error\":\"index_not_found_exception\"}", "");

        StepVerifier.create(store.getCount())
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(WatcherIndexNotFoundException.class);
                    assertThat(((WatcherIndexNotFoundException) e).getIndex()).isEqualTo("watcher");
                })
                .verify();

        StepVerifier.create(store.getWatchers(10))
                .expectError(WatcherIndexNotFoundException.class)
                .verify();
    }

    @Test
    @DisplayName("should map hits and skip malformed documents")
    void shouldMapHitsAndSkipMalformedDocuments() {
        ElasticsearchWatcherStore store = store(HttpStatus.OK, SEARCH_RESPONSE, "sentinl-watcher");

        StepVerifier.create(store.getWatchers(3))
                .assertNext(hit -> {
                    assertThat(hit.id()).isEqualTo("w1");
                    assertThat(hit.source().title()).isEqualTo("Error spike");
                    assertThat(hit.source().schedule().later()).isEqualTo("every 5 minutes");
                    assertThat(hit.source().conditionScript()).isEqualTo("payload.hits.total > 0");
                    assertThat(hit.source().actions()).containsOnlyKeys("email_admin");
                })
                .assertNext(hit -> {
                    assertThat(hit.id()).isEqualTo("w2");
                    assertThat(hit.source().schedule().interval()).isEqualTo(30.0);
                })
                .verifyComplete();

        assertThat(requests.get(0).url().getPath()).isEqualTo("/watcher/_search");
    }

    @Test
    @DisplayName("should map equal documents to equal hits")
    void shouldMapEqualDocumentsToEqualHits() {
        List<WatcherHit> first = store(HttpStatus.OK, SEARCH_RESPONSE, "").getWatchers(3).collectList().block();
        List<WatcherHit> second = store(HttpStatus.OK, SEARCH_RESPONSE, "").getWatchers(3).collectList().block();

        assertThat(first).isEqualTo(second);
    }
}
