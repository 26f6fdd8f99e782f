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

import java.util.Map;

/**
 * Hands a set of actions over to the component that delivers them.
 * <p>
 * Fire-and-forget from the engine's point of view: retries and per-action-type failure
 * handling belong to the implementation.
 */
public interface ActionDispatcher {

    /**
     * @param actions the actions to run, keyed by action name
     * @param payload the data the actions should render
     * @param watcher the definition that triggered them
     */
    void dispatch(Map<String, Map<String, Object>> actions, Map<String, Object> payload, WatcherDefinition watcher);
}
