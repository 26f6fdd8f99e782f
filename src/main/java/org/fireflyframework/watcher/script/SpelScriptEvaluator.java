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
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.expression.MapAccessor;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;
import org.springframework.util.ConcurrentLruCache;

import java.util.Map;

/**
 * {@link ScriptEvaluator} backed by Spring Expression Language.
 * <p>
 * The bindings map is the root object and a {@link MapAccessor} is registered, so
 * {@code payload.hits.total > 0} walks nested maps by key. Every binding is also
 * available as a variable ({@code #payload}). Assignments such as
 * {@code payload.hits.total = 0} and method calls such as
 * {@code payload.put('alert', true)} mutate the payload in place.
 * <p>
 * Parsed expressions are kept in an LRU cache of {@link #DEFAULT_CACHE_SIZE} entries.
 */
@Slf4j
public class SpelScriptEvaluator implements ScriptEvaluator {

    public static final int DEFAULT_CACHE_SIZE = 256;

    private final ExpressionParser spelParser = new SpelExpressionParser();
    private final ConcurrentLruCache<String, Expression> expressionCache;

    public SpelScriptEvaluator() {
        this(DEFAULT_CACHE_SIZE);
    }

    public SpelScriptEvaluator(int cacheSize) {
        this.expressionCache = new ConcurrentLruCache<>(cacheSize, spelParser::parseExpression);
    }

    int cachedExpressions() {
        return expressionCache.size();
    }

    @Override
    public Object evaluate(String expression, Map<String, Object> bindings) {
        try {
            Expression parsed = expressionCache.get(expression);

            StandardEvaluationContext evalContext = new StandardEvaluationContext(bindings);
            evalContext.addPropertyAccessor(new MapAccessor());
            bindings.forEach(evalContext::setVariable);

            return parsed.getValue(evalContext);
        } catch (ParseException | EvaluationException e) {
            log.debug("Failed to evaluate expression '{}': {}", expression, e.getMessage());
            throw new ScriptEvaluationException(expression, e);
        }
    }
}
