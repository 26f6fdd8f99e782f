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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ElasticsearchSearchClient}.
 */
class ElasticsearchSearchClientTest {

    private static final Map<String, String> EXTENSIONS = Map.of(
            "kibi_search", "/{index}/_msearch/kibi",
            "vanguard_search", "/{index}/_vanguard/search");

    private final List<ClientRequest> requests = new ArrayList<>();

    private ElasticsearchSearchClient client(HttpStatus status, String body) {
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
        return new ElasticsearchSearchClient(webClient, EXTENSIONS, Duration.ofSeconds(5));
    }

    @Nested
    @DisplayName("resolvePath")
    class ResolvePathTests {

        private final ElasticsearchSearchClient client = client(HttpStatus.OK, "{}");

        @Test
        void shouldJoinIndexList() {
            assertThat(client.resolvePath("search", Map.of("index", List.of("logs-a", "logs-b"))))
                    .isEqualTo("/logs-a,logs-b/_search");
        }

        @Test
        void shouldUseSingleIndex() {
            assertThat(client.resolvePath("search", Map.of("index", "logs")))
                    .isEqualTo("/logs/_search");
        }

        @Test
        void shouldIncludeDocumentType() {
            assertThat(client.resolvePath("search", Map.of("index", "logs", "type", "event")))
                    .isEqualTo("/logs/event/_search");
        }

        @Test
        void shouldSearchAllIndicesWhenIndexIsMissing() {
            assertThat(client.resolvePath("search", Map.of())).isEqualTo("/_all/_search");
            assertThat(client.resolvePath("search", Map.of("index", List.of()))).isEqualTo("/_all/_search");
            assertThat(client.resolvePath("search", Map.of("index", " "))).isEqualTo("/_all/_search");
        }

        @Test
        void shouldSubstituteIndexInExtensionEndpoint() {
            assertThat(client.resolvePath("kibi_search", Map.of("index", "logs")))
                    .isEqualTo("/logs/_msearch/kibi");
        }

        @Test
        void shouldRejectUnknownMethod() {
            assertThatThrownBy(() -> client.resolvePath("sql_search", Map.of("index", "logs")))
                    .isInstanceOf(WatcherException.class)
                    .hasMessageContaining("sql_search");
        }
    }

    @Test
    @DisplayName("should advertise search and the configured extension operations")
    void shouldAdvertiseSupportedMethods() {
        assertThat(client(HttpStatus.OK, "{}").supportedMethods())
                .containsExactlyInAnyOrder("search", "kibi_search", "vanguard_search");
    }

    @Test
    @DisplayName("should post the request body and return the response payload")
    void shouldPostBodyAndReturnPayload() {
        ElasticsearchSearchClient client = client(HttpStatus.OK, "{\"hits\":{\"total\":3,\"hits\":[]}}");
        Map<String, Object> request = new HashMap<>();
        request.put("index", List.of("logs"));
        request.put("body", Map.of("query", Map.of("match_all", Map.of())));

        StepVerifier.create(client.search("search", request))
                .assertNext(payload -> {
                    assertThat(payload).containsKey("hits");
                    @SuppressWarnings("unchecked")
                    Map<String, Object> hits = (Map<String, Object>) payload.get("hits");
                    assertThat(hits).containsEntry("total", 3);
                })
                .verifyComplete();

        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).url().getPath()).isEqualTo("/logs/_search");
    }

    @Test
    @DisplayName("should propagate HTTP errors")
    void shouldPropagateHttpErrors() {
        ElasticsearchSearchClient client = client(HttpStatus.INTERNAL_SERVER_ERROR, "{\"error\":\"boom\"}");

        StepVerifier.create(client.search("search", Map.of("index", "logs")))
                .expectError()
                .verify();
    }

    @Test
    @DisplayName("should fail lazily for unsupported methods")
    void shouldFailForUnsupportedMethods() {
        StepVerifier.create(client(HttpStatus.OK, "{}").search("sql_search", Map.of("index", "logs")))
                .expectError(WatcherException.class)
                .verify();

        assertThat(requests).isEmpty();
    }
}
