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

package org.fireflyframework.watcher.action;

import org.fireflyframework.watcher.model.WatcherDefinition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partitions a watcher's actions by the presence of the {@code report} key in each
 * action's settings. Every action ends up on exactly one side.
 */
public class ActionClassifier {

    public ClassifiedActions classify(Map<String, Map<String, Object>> actions) {
        if (actions == null || actions.isEmpty()) {
            return new ClassifiedActions(Map.of(), Map.of());
        }

        Map<String, Map<String, Object>> report = new LinkedHashMap<>();
        Map<String, Map<String, Object>> other = new LinkedHashMap<>();
        actions.forEach((name, settings) -> {
            if (isReportAction(settings)) {
                report.put(name, settings);
            } else {
                other.put(name, settings);
            }
        });

        return new ClassifiedActions(Collections.unmodifiableMap(report), Collections.unmodifiableMap(other));
    }

    private boolean isReportAction(Map<String, Object> settings) {
        return settings != null && settings.containsKey(WatcherDefinition.REPORT_MARKER);
    }
}
