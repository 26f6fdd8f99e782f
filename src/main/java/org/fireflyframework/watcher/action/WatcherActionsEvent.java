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

import java.time.Instant;
import java.util.Map;

/**
 * Application event carrying actions that a watcher firing wants delivered.
 *
 * @param actions   the actions to run
 * @param payload   the payload for the actions
 * @param watcher   the triggering definition
 * @param timestamp when the actions were dispatched
 */
public record WatcherActionsEvent(
        Map<String, Map<String, Object>> actions,
        Map<String, Object> payload,
        WatcherDefinition watcher,
        Instant timestamp
) {
}
