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

package org.fireflyframework.watcher;

import org.fireflyframework.watcher.model.WatcherDefinition;
import org.fireflyframework.watcher.model.WatcherDefinition.ConditionSpec;
import org.fireflyframework.watcher.model.WatcherDefinition.InputSpec;
import org.fireflyframework.watcher.model.WatcherDefinition.ScheduleSpec;
import org.fireflyframework.watcher.model.WatcherDefinition.ScriptSpec;
import org.fireflyframework.watcher.model.WatcherDefinition.SearchSpec;
import org.fireflyframework.watcher.model.WatcherDefinition.TransformSpec;
import org.fireflyframework.watcher.model.WatcherDefinition.TriggerSpec;
import org.fireflyframework.watcher.model.WatcherHit;

import java.util.List;
import java.util.Map;

/**
 * Builders for watcher definitions used across the test suite.
 */
public final class TestWatchers {

    public static final Map<String, Object> LOGS_REQUEST = Map.of(
            "index", List.of("logs"),
            "body", Map.of("query", Map.of("match_all", Map.of())));

    public static final Map<String, Map<String, Object>> EMAIL_ACTION =
            Map.of("email_admin", Map.of("email", Map.of("to", "admin@example.com")));

    public static final Map<String, Map<String, Object>> REPORT_ACTION =
            Map.of("daily_report", Map.of("report", Map.of("snapshot", Map.of("res", "1280x900"))));

    private TestWatchers() {
    }

    public static WatcherHit hit(String id, WatcherDefinition definition) {
        return new WatcherHit(id, definition);
    }

    public static WatcherDefinition later(String phrase) {
        return alert(new ScheduleSpec(phrase, null), "payload.hits.total > 0", EMAIL_ACTION);
    }

    public static WatcherDefinition interval(Double seconds) {
        return alert(new ScheduleSpec(null, seconds), "payload.hits.total > 0", EMAIL_ACTION);
    }

    public static WatcherDefinition alert(ScheduleSpec schedule, String condition,
                                         Map<String, Map<String, Object>> actions) {
        return new WatcherDefinition(
                "Test watcher",
                null,
                false,
                new TriggerSpec(schedule),
                new InputSpec(new SearchSpec(LOGS_REQUEST)),
                condition != null ? new ConditionSpec(new ScriptSpec(condition)) : null,
                null,
                actions,
                false);
    }

    public static WatcherDefinition withTransformScript(WatcherDefinition definition, String script) {
        return withTransform(definition, new TransformSpec(new ScriptSpec(script), null));
    }

    public static WatcherDefinition withTransformSearch(WatcherDefinition definition, Map<String, Object> request) {
        return withTransform(definition, new TransformSpec(null, new SearchSpec(request)));
    }

    public static WatcherDefinition disabled(WatcherDefinition d) {
        return new WatcherDefinition(d.title(), d.uuid(), true, d.trigger(), d.input(), d.condition(),
                d.transform(), d.actions(), d.report());
    }

    public static WatcherDefinition report(WatcherDefinition d, Map<String, Map<String, Object>> actions) {
        return new WatcherDefinition(d.title(), d.uuid(), d.disable(), d.trigger(), d.input(), d.condition(),
                d.transform(), actions, true);
    }

    public static WatcherDefinition withoutInput(WatcherDefinition d) {
        return new WatcherDefinition(d.title(), d.uuid(), d.disable(), d.trigger(), null, d.condition(),
                d.transform(), d.actions(), d.report());
    }

    private static WatcherDefinition withTransform(WatcherDefinition d, TransformSpec transform) {
        return new WatcherDefinition(d.title(), d.uuid(), d.disable(), d.trigger(), d.input(), d.condition(),
                transform, d.actions(), d.report());
    }
}
