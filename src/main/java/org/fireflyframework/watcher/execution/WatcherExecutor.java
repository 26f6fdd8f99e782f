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

package org.fireflyframework.watcher.execution;

import org.fireflyframework.watcher.action.ActionClassifier;
import org.fireflyframework.watcher.action.ActionDispatcher;
import org.fireflyframework.watcher.action.ClassifiedActions;
import org.fireflyframework.watcher.metrics.WatcherMetrics;
import org.fireflyframework.watcher.model.ExecutionContext;
import org.fireflyframework.watcher.model.WatcherDefinition;
import org.fireflyframework.watcher.model.WatcherHit;
import org.fireflyframework.watcher.resilience.WatcherResilience;
import org.fireflyframework.watcher.script.ExpressionEvaluator;
import org.fireflyframework.watcher.search.SearchClient;
import org.fireflyframework.watcher.search.SearchMethodResolver;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Runs one firing of a watcher.
 * <p>
 * A firing takes one of two independent paths, or both:
 * <ul>
 *   <li><b>report</b>: when the watcher is a report watcher, its report actions are
 *       dispatched with {@code {_id: watcherId}} and nothing is searched</li>
 *   <li><b>alert</b>: the watcher's search runs, the condition is evaluated against the
 *       result, an optional transform is applied, and the remaining actions are
 *       dispatched with the resulting payload</li>
 * </ul>
 * A firing never fails: every error is logged with the watcher id and the firing ends.
 */
@Slf4j
public class WatcherExecutor {

    static final String REPORT_ID_KEY = "_id";

    private final SearchClient searchClient;
    private final SearchMethodResolver searchMethodResolver;
    private final ActionClassifier actionClassifier;
    private final ExpressionEvaluator expressionEvaluator;
    private final ActionDispatcher actionDispatcher;
    private final WatcherResilience resilience;
    private final WatcherMetrics watcherMetrics;

    public WatcherExecutor(SearchClient searchClient,
                           SearchMethodResolver searchMethodResolver,
                           ActionClassifier actionClassifier,
                           ExpressionEvaluator expressionEvaluator,
                           ActionDispatcher actionDispatcher,
                           @Nullable WatcherResilience resilience,
                           @Nullable WatcherMetrics watcherMetrics) {
        this.searchClient = searchClient;
        this.searchMethodResolver = searchMethodResolver;
        this.actionClassifier = actionClassifier;
        this.expressionEvaluator = expressionEvaluator;
        this.actionDispatcher = actionDispatcher;
        this.resilience = resilience;
        this.watcherMetrics = watcherMetrics;
    }

    /**
     * Timer callback. Starts a firing and returns immediately.
     *
     * @param hit the watcher snapshot captured when the timer was installed
     */
    public void fire(WatcherHit hit) {
        try {
            execute(hit).subscribe(
                    null,
                    error -> log.error("Unhandled error firing watcher {}", hit.id(), error));
        } catch (RuntimeException e) {
            log.error("Failed to start firing of watcher {}: {}", hit.id(), e.getMessage(), e);
        }
    }

    public Mono<Void> execute(WatcherHit hit) {
        return Mono.defer(() -> execute(createContext(hit)));
    }

    /**
     * Runs the firing described by the context.
     *
     * @param context the per-firing state
     * @return a Mono that completes when the firing is over; it never errors
     */
    public Mono<Void> execute(ExecutionContext context) {
        String watcherId = context.watcherId();

        Mono<Void> firing = Mono.defer(() -> run(context));
        if (resilience != null) {
            firing = resilience.decorateFiring(watcherId, firing);
        }

        Mono<Void> decorated = firing;
        return Mono.defer(() -> {
                    Timer.Sample sample = watcherMetrics != null ? watcherMetrics.startTimer() : null;
                    return decorated.doFinally(signal -> {
                        if (watcherMetrics != null) {
                            watcherMetrics.stopTimer(sample, watcherId);
                        }
                    });
                })
                .onErrorResume(TimeoutException.class, e -> {
                    log.warn("Watcher {} firing timed out", watcherId);
                    return Mono.empty();
                })
                .onErrorResume(e -> {
                    log.error("Watcher {} firing failed: {}", watcherId, e.getMessage(), e);
                    return Mono.empty();
                });
    }

    private ExecutionContext createContext(WatcherHit hit) {
        return new ExecutionContext(hit.id(), hit, searchClient, searchMethodResolver.resolve());
    }

    private Mono<Void> run(ExecutionContext context) {
        String watcherId = context.watcherId();
        WatcherDefinition watcher = context.definition();

        if (watcher == null) {
            log.debug("Watcher {} has no definition, skipping", watcherId);
            return Mono.empty();
        }
        if (watcher.disable()) {
            log.debug("Watcher {} is disabled, skipping", watcherId);
            return Mono.empty();
        }
        if (!watcher.hasActions()) {
            log.debug("Watcher {} has no actions, skipping", watcherId);
            return Mono.empty();
        }

        log.debug("Executing watcher: {}", watcherId);
        if (watcherMetrics != null) {
            watcherMetrics.recordFiring(watcherId);
        }

        ClassifiedActions actions = actionClassifier.classify(watcher.actions());

        if (watcher.report() && actions.hasReportActions()) {
            dispatch(watcherId, "report", actions.report(), Map.of(REPORT_ID_KEY, watcherId), watcher);
        }

        if (!actions.hasOtherActions()) {
            return Mono.empty();
        }
        return handleAlerts(context, actions.other());
    }

    private Mono<Void> handleAlerts(ExecutionContext context, Map<String, Map<String, Object>> alertActions) {
        String watcherId = context.watcherId();
        WatcherDefinition watcher = context.definition();

        Map<String, Object> request = watcher.searchRequest();
        String condition = watcher.conditionScript();
        if (request == null || condition == null) {
            log.debug("Watcher {} has no search request or condition, skipping alerts", watcherId);
            return Mono.empty();
        }

        return search(context, request)
                .switchIfEmpty(Mono.defer(() -> {
                    log.debug("Watcher {} search returned no result", watcherId);
                    return Mono.empty();
                }))
                .flatMap(payload -> {
                    if (!expressionEvaluator.evaluateCondition(watcherId, condition, payload)) {
                        log.debug("Watcher {} condition not met", watcherId);
                        return Mono.<Void>empty();
                    }
                    if (watcherMetrics != null) {
                        watcherMetrics.recordConditionMet(watcherId);
                    }
                    return applyTransformAndDispatch(context, alertActions, payload);
                })
                .onErrorResume(e -> {
                    log.error("Watcher {} search failed: {}", watcherId, e.getMessage(), e);
                    if (watcherMetrics != null) {
                        watcherMetrics.recordSearchError(watcherId);
                    }
                    return Mono.empty();
                })
                .then();
    }

    private Mono<Void> applyTransformAndDispatch(ExecutionContext context,
                                                 Map<String, Map<String, Object>> alertActions,
                                                 Map<String, Object> payload) {
        String watcherId = context.watcherId();
        WatcherDefinition watcher = context.definition();

        String transformScript = watcher.transformScript();
        if (transformScript != null) {
            // dispatch proceeds even if the transform fails
            expressionEvaluator.applyTransform(watcherId, transformScript, payload);
            dispatch(watcherId, "alert", alertActions, payload, watcher);
            return Mono.empty();
        }

        Map<String, Object> transformRequest = watcher.transformSearchRequest();
        if (transformRequest != null) {
            return search(context, transformRequest)
                    .doOnNext(transformed -> dispatch(watcherId, "alert", alertActions, transformed, watcher))
                    .then();
        }

        dispatch(watcherId, "alert", alertActions, payload, watcher);
        return Mono.empty();
    }

    private Mono<Map<String, Object>> search(ExecutionContext context, Map<String, Object> request) {
        Mono<Map<String, Object>> search = context.searchClient()
                .search(context.searchMethod(), request)
                .filter(result -> !result.isEmpty());
        return resilience != null ? resilience.decorateSearch(search) : search;
    }

    private void dispatch(String watcherId, String kind, Map<String, Map<String, Object>> actions,
                          Map<String, Object> payload, WatcherDefinition watcher) {
        try {
            actionDispatcher.dispatch(actions, payload, watcher);
            log.debug("Dispatched {} {} action(s) for watcher {}", actions.size(), kind, watcherId);
            if (watcherMetrics != null) {
                watcherMetrics.recordActionsDispatched(watcherId, kind, actions.size());
            }
        } catch (RuntimeException e) {
            log.error("Action dispatch failed for watcher {}: {}", watcherId, e.getMessage(), e);
        }
    }
}
