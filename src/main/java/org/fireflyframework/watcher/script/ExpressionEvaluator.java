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

package org.fireflyframework.watcher.script;

import org.fireflyframework.watcher.metrics.WatcherMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Evaluates watcher conditions and transforms against a search payload.
 * <p>
 * The payload is bound as {@code payload}. Evaluation failures never escape: a failing
 * condition counts as "not met" and a failing transform leaves the payload as it is.
 */
@Slf4j
public class ExpressionEvaluator {

    public static final String PAYLOAD_BINDING = "payload";

    private final ScriptEvaluator scriptEvaluator;
    private final WatcherMetrics watcherMetrics;

    public ExpressionEvaluator(ScriptEvaluator scriptEvaluator, @Nullable WatcherMetrics watcherMetrics) {
        this.scriptEvaluator = scriptEvaluator;
        this.watcherMetrics = watcherMetrics;
    }

    /**
     * Evaluates a condition expression.
     *
     * @param watcherId  the watcher, for logging
     * @param expression the condition
     * @param payload    the search result
     * @return true if the expression produced a truthy value
     */
    public boolean evaluateCondition(String watcherId, String expression, Map<String, Object> payload) {
        try {
            return isTruthy(scriptEvaluator.evaluate(expression, bindings(payload)));
        } catch (RuntimeException e) {
            log.info("Condition error for watcher {}: {}", watcherId, e.getMessage());
            if (watcherMetrics != null) {
                watcherMetrics.recordScriptError(watcherId, "condition");
            }
            return false;
        }
    }

    /**
     * Runs a transform expression that mutates the payload in place.
     *
     * @return true if the transform ran without error
     */
    public boolean applyTransform(String watcherId, String expression, Map<String, Object> payload) {
        try {
            scriptEvaluator.evaluate(expression, bindings(payload));
            return true;
        } catch (RuntimeException e) {
            log.info("Transform script error for watcher {}: {}", watcherId, e.getMessage());
            if (watcherMetrics != null) {
                watcherMetrics.recordScriptError(watcherId, "transform");
            }
            return false;
        }
    }

    /**
     * Script-style truthiness: null, {@code false}, zero, NaN and the empty string are
     * false; everything else, including empty maps and lists, is true.
     */
    public static boolean isTruthy(@Nullable Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        return true;
    }

    private Map<String, Object> bindings(Map<String, Object> payload) {
        Map<String, Object> bindings = new HashMap<>();
        bindings.put(PAYLOAD_BINDING, payload);
        return bindings;
    }
}
