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

package org.fireflyframework.watcher.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * A stored alert definition.
 * <p>
 * Mirrors the document layout kept in the watcher index:
 * <pre>
 * {
 *   "title": "...",
 *   "disable": false,
 *   "report": false,
 *   "trigger": { "schedule": { "later": "every 5 minutes" } },
 *   "input": { "search": { "request": { "index": [...], "body": {...} } } },
 *   "condition": { "script": { "script": "payload.hits.total > 0" } },
 *   "transform": { "script": { "script": "..." } },
 *   "actions": { "email_admin": { "email": {...} } }
 * }
 * </pre>
 * Instances are immutable snapshots; two definitions with the same content are equal,
 * which is what the reconciler relies on for change detection.
 *
 * @param title     human-readable title
 * @param uuid      optional external identifier
 * @param disable   whether the watcher is disabled
 * @param trigger   recurrence configuration
 * @param input     search input
 * @param condition condition expression
 * @param transform optional transform (script or secondary search)
 * @param actions   action name to opaque action settings
 * @param report    watcher-level report flag
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WatcherDefinition(
        String title,
        String uuid,
        boolean disable,
        TriggerSpec trigger,
        InputSpec input,
        ConditionSpec condition,
        TransformSpec transform,
        Map<String, Map<String, Object>> actions,
        boolean report
) {

    /**
     * Marker key that makes an action report-class.
     */
    public static final String REPORT_MARKER = "report";

    @Nullable
    public ScheduleSpec schedule() {
        return trigger != null ? trigger.schedule() : null;
    }

    @Nullable
    public Map<String, Object> searchRequest() {
        return input != null && input.search() != null ? input.search().request() : null;
    }

    @Nullable
    public String conditionScript() {
        return condition != null && condition.script() != null ? condition.script().script() : null;
    }

    @Nullable
    public String transformScript() {
        return transform != null && transform.script() != null ? transform.script().script() : null;
    }

    @Nullable
    public Map<String, Object> transformSearchRequest() {
        return transform != null && transform.search() != null ? transform.search().request() : null;
    }

    public boolean hasActions() {
        return actions != null && !actions.isEmpty();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TriggerSpec(ScheduleSpec schedule) {
    }

    /**
     * Either a recurrence phrase ({@code later}) or a number of seconds ({@code interval}).
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ScheduleSpec(String later, Double interval) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record InputSpec(SearchSpec search) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SearchSpec(Map<String, Object> request) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConditionSpec(ScriptSpec script) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScriptSpec(String script) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record TransformSpec(ScriptSpec script, SearchSpec search) {
    }
}
