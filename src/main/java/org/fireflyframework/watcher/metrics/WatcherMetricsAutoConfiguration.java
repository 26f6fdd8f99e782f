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

package org.fireflyframework.watcher.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for watcher metrics using Micrometer.
 * <p>
 * This configuration is enabled when:
 * <ul>
 *   <li>a Micrometer MeterRegistry bean is available</li>
 *   <li>firefly.watcher.metrics-enabled is true (default)</li>
 * </ul>
 * <p>
 * Configuration properties:
 * <pre>
 * firefly:
 *   watcher:
 *     metrics-enabled: true  # Enable/disable metrics (default: true)
 * </pre>
 *
 * @see WatcherMetrics
 */
@Slf4j
@AutoConfiguration(afterName = {
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"})
@ConditionalOnClass(MeterRegistry.class)
@ConditionalOnProperty(prefix = "firefly.watcher", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
public class WatcherMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MeterRegistry.class)
    public WatcherMetrics watcherMetrics(MeterRegistry meterRegistry) {
        log.info("Configuring WatcherMetrics with Micrometer MeterRegistry");
        return new WatcherMetrics(meterRegistry);
    }
}
