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

package org.fireflyframework.watcher.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the Watcher Engine.
 */
@ConfigurationProperties(prefix = "firefly.watcher")
@Validated
@Data
public class WatcherProperties {

    /**
     * Whether the watcher engine is enabled.
     */
    private boolean enabled = true;

    /**
     * How often stored watchers are reloaded and reconciled against the schedule.
     */
    @NotNull
    private Duration reloadInterval = Duration.ofSeconds(10);

    /**
     * Whether to enable metrics collection.
     */
    private boolean metricsEnabled = true;

    /**
     * Whether to enable health checks.
     */
    private boolean healthEnabled = true;

    /**
     * Timer scheduling configuration.
     */
    @Valid
    @NotNull
    private SchedulingConfig scheduling = new SchedulingConfig();

    /**
     * Watcher storage configuration.
     */
    @Valid
    @NotNull
    private StorageConfig storage = new StorageConfig();

    /**
     * Search backend configuration.
     */
    @Valid
    @NotNull
    private SearchConfig search = new SearchConfig();

    /**
     * Resilience configuration (Time Limiter, Circuit Breaker, Bulkhead).
     */
    @Valid
    @NotNull
    private ResilienceConfig resilience = new ResilienceConfig();

    /**
     * REST API configuration.
     */
    @Valid
    @NotNull
    private ApiConfig api = new ApiConfig();

    /**
     * Timer scheduling configuration.
     */
    @Data
    public static class SchedulingConfig {

        /**
         * Whether the reload loop starts when the application is ready.
         */
        private boolean autoStart = true;

        /**
         * Thread pool size for watcher timers.
         */
        @Min(1)
        private int poolSize = 5;

        /**
         * Thread name prefix for watcher timers.
         */
        private String threadNamePrefix = "watcher-scheduler-";

        /**
         * Time zone for recurrence phrases; empty means the system default.
         */
        private String zone = "";

        /**
         * Whether to wait for running firings to complete on shutdown.
         */
        private boolean waitForTasksToCompleteOnShutdown = false;

        /**
         * Timeout in seconds to wait for firings on shutdown.
         */
        @Min(0)
        private int awaitTerminationSeconds = 30;
    }

    /**
     * Where watcher definitions are stored.
     */
    public enum StorageType {
        ELASTICSEARCH,
        MEMORY
    }

    /**
     * Watcher storage configuration.
     */
    @Data
    public static class StorageConfig {

        /**
         * Storage backend.
         */
        @NotNull
        private StorageType backend = StorageType.ELASTICSEARCH;

        /**
         * Base URL of the cluster holding the watcher index.
         */
        @NotBlank
        private String url = "http://localhost:9200";

        /**
         * Index holding watcher definitions.
         */
        @NotBlank
        private String index = "watcher";

        /**
         * Document type of watcher definitions; empty for typeless clusters.
         */
        private String type = "sentinl-watcher";

        /**
         * Request timeout for storage calls.
         */
        @NotNull
        private Duration requestTimeout = Duration.ofSeconds(30);
    }

    /**
     * Search backend configuration.
     */
    @Data
    public static class SearchConfig {

        /**
         * Base URL of the cluster watchers search; defaults to the storage URL.
         */
        private String url;

        /**
         * Plugins installed on the cluster. Listing {@code siren-vanguard} enables the
         * distributed-search operations.
         */
        private List<String> plugins = new ArrayList<>();

        /**
         * Additional search operations, by name, with their endpoint path. {@code {index}}
         * in the path is replaced with the request's index. Names containing underscores
         * must be written in bracket notation, e.g. {@code extension-endpoints[kibi_search]}.
         */
        private Map<String, String> extensionEndpoints = new LinkedHashMap<>();

        /**
         * Request timeout for search calls.
         */
        @NotNull
        private Duration requestTimeout = Duration.ofSeconds(60);
    }

    /**
     * Resilience configuration.
     */
    @Data
    public static class ResilienceConfig {

        /**
         * Whether resilience features are enabled.
         */
        private boolean enabled = true;

        /**
         * Per-firing time limiter.
         */
        @Valid
        @NotNull
        private TimeLimiterConfig timeLimiter = new TimeLimiterConfig();

        /**
         * Circuit breaker around search calls.
         */
        @Valid
        @NotNull
        private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();

        /**
         * Bulkhead capping concurrent firings.
         */
        @Valid
        @NotNull
        private BulkheadConfig bulkhead = new BulkheadConfig();
    }

    /**
     * Time limiter configuration for firing timeouts.
     */
    @Data
    public static class TimeLimiterConfig {

        /**
         * Whether the per-firing timeout is enabled.
         */
        private boolean enabled = true;

        /**
         * Maximum duration of one firing.
         */
        @NotNull
        private Duration timeoutDuration = Duration.ofMinutes(5);
    }

    /**
     * Circuit breaker configuration.
     */
    @Data
    public static class CircuitBreakerConfig {

        /**
         * Whether the search circuit breaker is enabled.
         */
        private boolean enabled = false;

        /**
         * Failure rate threshold percentage (0-100) to open the circuit.
         */
        @Min(1)
        private int failureRateThreshold = 50;

        /**
         * Minimum number of calls before calculating failure rate.
         */
        @Min(1)
        private int minimumNumberOfCalls = 10;

        /**
         * Sliding window size (number of calls).
         */
        @Min(1)
        private int slidingWindowSize = 100;

        /**
         * Wait duration in open state before transitioning to half-open.
         */
        @NotNull
        private Duration waitDurationInOpenState = Duration.ofSeconds(60);

        /**
         * Number of permitted calls in half-open state.
         */
        @Min(1)
        private int permittedNumberOfCallsInHalfOpenState = 10;
    }

    /**
     * Bulkhead configuration for limiting concurrent firings.
     */
    @Data
    public static class BulkheadConfig {

        /**
         * Whether the bulkhead is enabled.
         */
        private boolean enabled = false;

        /**
         * Maximum number of concurrent firings.
         */
        @Min(1)
        private int maxConcurrentCalls = 25;

        /**
         * Maximum wait duration for a permit.
         */
        @NotNull
        private Duration maxWaitDuration = Duration.ofMillis(0);
    }

    /**
     * REST API configuration.
     */
    @Data
    public static class ApiConfig {

        /**
         * Whether to enable the REST API.
         */
        private boolean enabled = true;

        /**
         * Base path for watcher REST endpoints.
         */
        private String basePath = "/api/v1/watchers";
    }
}
