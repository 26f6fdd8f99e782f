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

package org.fireflyframework.watcher.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.watcher.action.ActionClassifier;
import org.fireflyframework.watcher.action.ActionDispatcher;
import org.fireflyframework.watcher.action.EventPublishingActionDispatcher;
import org.fireflyframework.watcher.execution.WatcherExecutor;
import org.fireflyframework.watcher.health.WatcherEngineHealthIndicator;
import org.fireflyframework.watcher.metrics.WatcherMetrics;
import org.fireflyframework.watcher.metrics.WatcherMetricsAutoConfiguration;
import org.fireflyframework.watcher.properties.WatcherProperties;
import org.fireflyframework.watcher.resilience.WatcherResilience;
import org.fireflyframework.watcher.resilience.WatcherResilienceAutoConfiguration;
import org.fireflyframework.watcher.rest.WatcherController;
import org.fireflyframework.watcher.schedule.RecurrenceParser;
import org.fireflyframework.watcher.schedule.ScheduleReconciler;
import org.fireflyframework.watcher.schedule.ScheduleTable;
import org.fireflyframework.watcher.script.ExpressionEvaluator;
import org.fireflyframework.watcher.script.ScriptEvaluator;
import org.fireflyframework.watcher.script.SpelScriptEvaluator;
import org.fireflyframework.watcher.search.ElasticsearchSearchClient;
import org.fireflyframework.watcher.search.SearchClient;
import org.fireflyframework.watcher.search.SearchMethodResolver;
import org.fireflyframework.watcher.store.ElasticsearchWatcherStore;
import org.fireflyframework.watcher.store.InMemoryWatcherStore;
import org.fireflyframework.watcher.store.WatcherStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.web.reactive.function.client.WebClientAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.lang.Nullable;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Auto-configuration for the Firefly Watcher Engine.
 * <p>
 * This configuration provides all necessary beans for watcher scheduling:
 * <ul>
 *   <li>WatcherStore - reads watcher definitions (Elasticsearch or in-memory)</li>
 *   <li>SearchClient / SearchMethodResolver - run watcher searches</li>
 *   <li>ExpressionEvaluator - evaluates conditions and transforms with SpEL</li>
 *   <li>ActionClassifier / ActionDispatcher - split and hand off actions</li>
 *   <li>WatcherExecutor - runs one firing</li>
 *   <li>ScheduleReconciler - keeps timers in step with storage</li>
 *   <li>WatcherController - REST API endpoints</li>
 *   <li>WatcherEngineHealthIndicator - health monitoring</li>
 * </ul>
 */
@Slf4j
@AutoConfiguration(after = {
        WebClientAutoConfiguration.class,
        WatcherMetricsAutoConfiguration.class,
        WatcherResilienceAutoConfiguration.class})
@EnableConfigurationProperties(WatcherProperties.class)
@ConditionalOnProperty(prefix = "firefly.watcher", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WatcherEngineAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ScheduleTable scheduleTable() {
        return new ScheduleTable();
    }

    @Bean
    @ConditionalOnMissingBean
    public RecurrenceParser recurrenceParser() {
        return new RecurrenceParser();
    }

    @Bean
    @ConditionalOnMissingBean
    public ScriptEvaluator scriptEvaluator() {
        log.info("Creating SpEL ScriptEvaluator");
        return new SpelScriptEvaluator();
    }

    @Bean
    @ConditionalOnMissingBean
    public ExpressionEvaluator expressionEvaluator(ScriptEvaluator scriptEvaluator,
                                                   @Nullable WatcherMetrics watcherMetrics) {
        return new ExpressionEvaluator(scriptEvaluator, watcherMetrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public ActionClassifier actionClassifier() {
        return new ActionClassifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public ActionDispatcher actionDispatcher(ApplicationEventPublisher eventPublisher) {
        log.info("Creating EventPublishingActionDispatcher");
        return new EventPublishingActionDispatcher(eventPublisher);
    }

    // ==================== Storage & Search Beans ====================

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.watcher.storage", name = "backend", havingValue = "memory")
    public WatcherStore inMemoryWatcherStore() {
        log.info("Creating InMemoryWatcherStore");
        return new InMemoryWatcherStore();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.watcher.storage", name = "backend", havingValue = "elasticsearch", matchIfMissing = true)
    public WatcherStore elasticsearchWatcherStore(ObjectProvider<WebClient.Builder> webClientBuilder,
                                                  ObjectMapper objectMapper,
                                                  WatcherProperties properties) {
        WatcherProperties.StorageConfig storage = properties.getStorage();
        log.info("Creating ElasticsearchWatcherStore with url: {}, index: {}, type: {}",
                storage.getUrl(), storage.getIndex(), storage.getType());
        WebClient webClient = webClientBuilder.getIfAvailable(WebClient::builder)
                .baseUrl(storage.getUrl())
                .build();
        return new ElasticsearchWatcherStore(webClient, objectMapper, storage.getIndex(), storage.getType(),
                storage.getRequestTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public SearchClient searchClient(ObjectProvider<WebClient.Builder> webClientBuilder,
                                     WatcherProperties properties) {
        WatcherProperties.SearchConfig search = properties.getSearch();
        String url = StringUtils.hasText(search.getUrl()) ? search.getUrl() : properties.getStorage().getUrl();
        log.info("Creating ElasticsearchSearchClient with url: {}, extension endpoints: {}",
                url, search.getExtensionEndpoints().keySet());
        WebClient webClient = webClientBuilder.getIfAvailable(WebClient::builder)
                .baseUrl(url)
                .build();
        return new ElasticsearchSearchClient(webClient, search.getExtensionEndpoints(), search.getRequestTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public SearchMethodResolver searchMethodResolver(SearchClient searchClient, WatcherProperties properties) {
        return new SearchMethodResolver(searchClient, properties.getSearch().getPlugins());
    }

    // ==================== Scheduling Beans ====================

    @Bean
    @ConditionalOnMissingBean
    public WatcherExecutor watcherExecutor(SearchClient searchClient,
                                           SearchMethodResolver searchMethodResolver,
                                           ActionClassifier actionClassifier,
                                           ExpressionEvaluator expressionEvaluator,
                                           ActionDispatcher actionDispatcher,
                                           @Nullable WatcherResilience watcherResilience,
                                           @Nullable WatcherMetrics watcherMetrics) {
        log.info("Creating WatcherExecutor with resilience: {}, metrics: {}",
                watcherResilience != null, watcherMetrics != null);
        return new WatcherExecutor(searchClient, searchMethodResolver, actionClassifier, expressionEvaluator,
                actionDispatcher, watcherResilience, watcherMetrics);
    }

    /**
     * Task scheduler running watcher timers.
     */
    @Bean
    @ConditionalOnMissingBean(name = "watcherTaskScheduler")
    public TaskScheduler watcherTaskScheduler(WatcherProperties properties) {
        WatcherProperties.SchedulingConfig scheduling = properties.getScheduling();
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(scheduling.getPoolSize());
        scheduler.setThreadNamePrefix(scheduling.getThreadNamePrefix());
        scheduler.setWaitForTasksToCompleteOnShutdown(scheduling.isWaitForTasksToCompleteOnShutdown());
        scheduler.setAwaitTerminationSeconds(scheduling.getAwaitTerminationSeconds());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        log.info("Creating watcher TaskScheduler with pool size: {}", scheduling.getPoolSize());
        return scheduler;
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleReconciler scheduleReconciler(WatcherStore watcherStore,
                                                 ScheduleTable scheduleTable,
                                                 TaskScheduler watcherTaskScheduler,
                                                 RecurrenceParser recurrenceParser,
                                                 WatcherExecutor watcherExecutor,
                                                 WatcherProperties properties,
                                                 @Nullable WatcherMetrics watcherMetrics) {
        log.info("Creating ScheduleReconciler with reloadInterval: {}, autoStart: {}",
                properties.getReloadInterval(), properties.getScheduling().isAutoStart());
        return new ScheduleReconciler(watcherStore, scheduleTable, watcherTaskScheduler, recurrenceParser,
                watcherExecutor, properties, watcherMetrics);
    }

    // ==================== API & Health Beans ====================

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.watcher.api", name = "enabled", havingValue = "true", matchIfMissing = true)
    public WatcherController watcherController(ScheduleReconciler scheduleReconciler) {
        log.info("Creating WatcherController REST API");
        return new WatcherController(scheduleReconciler);
    }

    /**
     * Health indicator for watcher engine monitoring.
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.ReactiveHealthIndicator")
    @ConditionalOnProperty(prefix = "firefly.watcher", name = "health-enabled", havingValue = "true", matchIfMissing = true)
    public WatcherEngineHealthIndicator watcherEngineHealthIndicator(ScheduleReconciler scheduleReconciler,
                                                                     ScheduleTable scheduleTable,
                                                                     WatcherStore watcherStore) {
        log.info("Creating WatcherEngineHealthIndicator");
        return new WatcherEngineHealthIndicator(scheduleReconciler, scheduleTable, watcherStore);
    }
}
