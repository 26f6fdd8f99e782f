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

import org.fireflyframework.watcher.exception.ScriptEvaluationException;

import java.util.Map;

/**
 * Evaluates watcher-authored expressions.
 * <p>
 * Expressions are trusted input: they come from whoever is allowed to store watchers.
 * Implementations may use an embedded scripting engine, a restricted expression language
 * or a sandboxed interpreter without changing how the execution pipeline calls them.
 */
public interface ScriptEvaluator {

    /**
     * Evaluates an expression.
     * <p>
     * Transforms work by mutating the objects exposed through {@code bindings}; the
     * caller observes the effect on those objects rather than on the return value.
     *
     * @param expression the expression text
     * @param bindings   named values visible to the expression, e.g. {@code payload}
     * @return whatever the expression produces, possibly null
     * @throws ScriptEvaluationException if the expression cannot be parsed or evaluated
     */
    Object evaluate(String expression, Map<String, Object> bindings);
}
