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
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.reactor.bulkhead.operator.BulkheadOperator;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.TimeoutException;

/**
 * Provides Resilience4j decorators for watcher firings and searches.
 * <ul>
 *   <li>a shared time limiter bounds each firing, so a hung search or dispatch
 *       cannot hold a worker forever</li>
 *   <li>a shared bulkhead caps the number of concurrent firings</li>
 *   <li>a shared circuit breaker guards the search backend</li>
 * </ul>
 */
@Slf4j
public class WatcherResilience {

    public static final String SEARCH_CIRCUIT_BREAKER = "watcher-search";
    public static final String FIRING_BULKHEAD = "watcher-firings";
    public static final String FIRING_TIME_LIMITER = "watcher-firing-timeout";

    private final WatcherProperties.ResilienceConfig config;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final BulkheadRegistry bulkheadRegistry;
    private final TimeLimiterRegistry timeLimiterRegistry;

    private volatile TimeLimiter firingTimeLimiter;
    private volatile CircuitBreaker searchCircuitBreaker;
    private volatile Bulkhead firingBulkhead;

    public WatcherResilience(WatcherProperties properties) {
        this.config = properties.getResilience();

        this.circuitBreakerRegistry = createCircuitBreakerRegistry();
        this.bulkheadRegistry = createBulkheadRegistry();
        this.timeLimiterRegistry = createTimeLimiterRegistry();

        log.info("RESILIENCE_INIT: timeLimiter={}, circuitBreaker={}, bulkhead={}",
                config.getTimeLimiter().isEnabled(),
                config.getCircuitBreaker().isEnabled(),
                config.getBulkhead().isEnabled());
    }

    /**
     * Decorates one firing with the time limiter and the bulkhead.
     *
     * @param watcherId the watcher being fired
     * @param mono      the firing
     * @param <T>       the result type
     * @return the decorated firing
     */
    public <T> Mono<T> decorateFiring(String watcherId, Mono<T> mono) {
        if (!config.isEnabled()) {
            return mono;
        }

        Mono<T> decorated = mono;

        if (config.getTimeLimiter().isEnabled()) {
            TimeLimiter timeLimiter = getFiringTimeLimiter();
            var timeoutDuration = timeLimiter.getTimeLimiterConfig().getTimeoutDuration();
            decorated = decorated
                    .timeout(timeoutDuration)
                    .doOnError(TimeoutException.class, e -> {
                        timeLimiter.onError(e);
                        log.warn("TIME_LIMITER_TIMEOUT: name={}, watcherId={}, timeout={}",
                                timeLimiter.getName(), watcherId, timeoutDuration);
                    })
                    .doOnSuccess(result -> timeLimiter.onSuccess())
                    .subscribeOn(Schedulers.boundedElastic());
        }

        if (config.getBulkhead().isEnabled()) {
            decorated = decorated.transformDeferred(BulkheadOperator.of(getFiringBulkhead()));
        }

        return decorated;
    }

    /**
     * Decorates a search call with the search circuit breaker.
     */
    public <T> Mono<T> decorateSearch(Mono<T> mono) {
        if (!config.isEnabled() || !config.getCircuitBreaker().isEnabled()) {
            return mono;
        }
        return mono.transformDeferred(CircuitBreakerOperator.of(getSearchCircuitBreaker()));
    }

    public CircuitBreaker getSearchCircuitBreaker() {
        CircuitBreaker cb = searchCircuitBreaker;
        if (cb == null) {
            synchronized (this) {
                cb = searchCircuitBreaker;
                if (cb == null) {
                    cb = circuitBreakerRegistry.circuitBreaker(SEARCH_CIRCUIT_BREAKER);
                    cb.getEventPublisher()
                            .onStateTransition(event ->
                                    log.info("CIRCUIT_BREAKER_STATE: name={}, from={}, to={}",
                                            event.getCircuitBreakerName(),
                                            event.getStateTransition().getFromState(),
                                            event.getStateTransition().getToState()))
                            .onError(event ->
                                    log.warn("CIRCUIT_BREAKER_ERROR: name={}, error={}",
                                            event.getCircuitBreakerName(),
                                            event.getThrowable().getMessage()));
                    searchCircuitBreaker = cb;
                }
            }
        }
        return cb;
    }

    public Bulkhead getFiringBulkhead() {
        Bulkhead bh = firingBulkhead;
        if (bh == null) {
            synchronized (this) {
                bh = firingBulkhead;
                if (bh == null) {
                    bh = bulkheadRegistry.bulkhead(FIRING_BULKHEAD);
                    bh.getEventPublisher()
                            .onCallRejected(event ->
                                    log.warn("BULKHEAD_REJECTED: name={}", event.getBulkheadName()));
                    firingBulkhead = bh;
                }
            }
        }
        return bh;
    }

    public TimeLimiter getFiringTimeLimiter() {
        TimeLimiter tl = firingTimeLimiter;
        if (tl == null) {
            synchronized (this) {
                tl = firingTimeLimiter;
                if (tl == null) {
                    tl = timeLimiterRegistry.timeLimiter(FIRING_TIME_LIMITER);
                    firingTimeLimiter = tl;
                }
            }
        }
        return tl;
    }

    public CircuitBreakerRegistry getCircuitBreakerRegistry() {
        return circuitBreakerRegistry;
    }

    public BulkheadRegistry getBulkheadRegistry() {
        return bulkheadRegistry;
    }

    public TimeLimiterRegistry getTimeLimiterRegistry() {
        return timeLimiterRegistry;
    }

    private CircuitBreakerRegistry createCircuitBreakerRegistry() {
        var cbConfig = config.getCircuitBreaker();
        CircuitBreakerConfig circuitBreakerConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(cbConfig.getFailureRateThreshold())
                .minimumNumberOfCalls(cbConfig.getMinimumNumberOfCalls())
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(cbConfig.getSlidingWindowSize())
                .waitDurationInOpenState(cbConfig.getWaitDurationInOpenState())
                .permittedNumberOfCallsInHalfOpenState(cbConfig.getPermittedNumberOfCallsInHalfOpenState())
                .build();
        return CircuitBreakerRegistry.of(circuitBreakerConfig);
    }

    private BulkheadRegistry createBulkheadRegistry() {
        var bhConfig = config.getBulkhead();
        BulkheadConfig bulkheadConfig = BulkheadConfig.custom()
                .maxConcurrentCalls(bhConfig.getMaxConcurrentCalls())
                .maxWaitDuration(bhConfig.getMaxWaitDuration())
                .build();
        return BulkheadRegistry.of(bulkheadConfig);
    }

    private TimeLimiterRegistry createTimeLimiterRegistry() {
        TimeLimiterConfig timeLimiterConfig = TimeLimiterConfig.custom()
                .timeoutDuration(config.getTimeLimiter().getTimeoutDuration())
                .cancelRunningFuture(true)
                .build();
        return TimeLimiterRegistry.of(timeLimiterConfig);
    }
}
