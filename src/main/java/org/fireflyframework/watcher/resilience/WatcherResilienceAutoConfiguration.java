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
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.micrometer.tagged.TaggedBulkheadMetrics;
import io.github.resilience4j.micrometer.tagged.TaggedCircuitBreakerMetrics;
import io.github.resilience4j.micrometer.tagged.TaggedTimeLimiterMetrics;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Watcher Resilience (Resilience4j integration).
 */
@AutoConfiguration
@EnableConfigurationProperties(WatcherProperties.class)
@ConditionalOnClass(CircuitBreakerRegistry.class)
@ConditionalOnProperty(prefix = "firefly.watcher.resilience", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class WatcherResilienceAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public WatcherResilience watcherResilience(WatcherProperties properties) {
        log.info("Configuring WatcherResilience with Resilience4j");
        return new WatcherResilience(properties);
    }

    /**
     * Binds Resilience4j metrics to Micrometer.
     */
    @Bean
    @ConditionalOnClass(MeterBinder.class)
    @ConditionalOnProperty(prefix = "firefly.watcher", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
    public MeterBinder watcherResilienceMeterBinder(WatcherResilience watcherResilience) {
        return registry -> {
            TaggedCircuitBreakerMetrics
                    .ofCircuitBreakerRegistry(watcherResilience.getCircuitBreakerRegistry())
                    .bindTo(registry);

            TaggedBulkheadMetrics
                    .ofBulkheadRegistry(watcherResilience.getBulkheadRegistry())
                    .bindTo(registry);

            TaggedTimeLimiterMetrics
                    .ofTimeLimiterRegistry(watcherResilience.getTimeLimiterRegistry())
                    .bindTo(registry);

            log.info("Resilience4j metrics bound to Micrometer registry");
        };
    }
}
