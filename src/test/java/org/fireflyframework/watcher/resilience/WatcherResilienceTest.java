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

package org.fireflyframework.watcher.resilience;

import org.fireflyframework.watcher.properties.WatcherProperties;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link WatcherResilience}.
 */
class WatcherResilienceTest {

    private WatcherProperties properties;

    @BeforeEach
    void setUp() {
        properties = new WatcherProperties();
    }

    @Test
    @DisplayName("should return the firing unchanged when resilience is disabled")
    void shouldPassThroughWhenDisabled() {
        properties.getResilience().setEnabled(false);
        WatcherResilience resilience = new WatcherResilience(properties);
        Mono<String> firing = Mono.just("done");

        assertThat(resilience.decorateFiring("w1", firing)).isSameAs(firing);
        assertThat(resilience.decorateSearch(firing)).isSameAs(firing);
    }

    @Nested
    @DisplayName("time limiter")
    class TimeLimiterTests {

        @Test
        @DisplayName("should fail a firing that runs past the timeout")
        void shouldTimeOutSlowFiring() {
            properties.getResilience().getTimeLimiter().setTimeoutDuration(Duration.ofMillis(100));
            WatcherResilience resilience = new WatcherResilience(properties);

            StepVerifier.create(resilience.decorateFiring("w1", Mono.never()))
                    .expectError(TimeoutException.class)
                    .verify(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("should let a fast firing through")
        void shouldLetFastFiringThrough() {
            WatcherResilience resilience = new WatcherResilience(properties);

            StepVerifier.create(resilience.decorateFiring("w1", Mono.just("done")))
                    .expectNext("done")
                    .verifyComplete();
        }

        @Test
        @DisplayName("should share one time limiter across all watchers")
        void shouldShareOneTimeLimiter() {
            WatcherResilience resilience = new WatcherResilience(properties);

            for (int i = 0; i < 50; i++) {
                StepVerifier.create(resilience.decorateFiring("w" + i, Mono.just("done")))
                        .expectNext("done")
                        .verifyComplete();
            }

            assertThat(resilience.getTimeLimiterRegistry().getAllTimeLimiters())
                    .singleElement()
                    .isSameAs(resilience.getFiringTimeLimiter());
        }
    }

    @Nested
    @DisplayName("circuit breaker")
    class CircuitBreakerTests {

        @Test
        @DisplayName("should not guard searches unless enabled")
        void shouldNotGuardSearchesByDefault() {
            WatcherResilience resilience = new WatcherResilience(properties);
            Mono<String> search = Mono.just("result");

            assertThat(resilience.decorateSearch(search)).isSameAs(search);
        }

        @Test
        @DisplayName("should open after repeated search failures")
        void shouldOpenAfterRepeatedFailures() {
            WatcherProperties.CircuitBreakerConfig cb = properties.getResilience().getCircuitBreaker();
            cb.setEnabled(true);
            cb.setMinimumNumberOfCalls(2);
            cb.setSlidingWindowSize(2);
            WatcherResilience resilience = new WatcherResilience(properties);

            for (int i = 0; i < 2; i++) {
                StepVerifier.create(resilience.decorateSearch(Mono.error(new IllegalStateException("down"))))
                        .expectError(IllegalStateException.class)
                        .verify();
            }

            assertThat(resilience.getSearchCircuitBreaker().getState()).isEqualTo(CircuitBreaker.State.OPEN);
            StepVerifier.create(resilience.decorateSearch(Mono.just("result")))
                    .expectError(CallNotPermittedException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("bulkhead")
    class BulkheadTests {

        @Test
        @DisplayName("should reject firings beyond the concurrency limit")
        void shouldRejectFiringsBeyondLimit() {
            properties.getResilience().getTimeLimiter().setEnabled(false);
            properties.getResilience().getBulkhead().setEnabled(true);
            properties.getResilience().getBulkhead().setMaxConcurrentCalls(1);
            WatcherResilience resilience = new WatcherResilience(properties);

            Disposable running = resilience.decorateFiring("w1", Mono.never()).subscribe();
            try {
                StepVerifier.create(resilience.decorateFiring("w2", Mono.just("done")))
                        .expectError(BulkheadFullException.class)
                        .verify();
            } finally {
                running.dispose();
            }
        }
    }
}
