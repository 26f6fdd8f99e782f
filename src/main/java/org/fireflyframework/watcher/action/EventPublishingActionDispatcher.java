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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;

/**
 * Default {@link ActionDispatcher}: publishes a {@link WatcherActionsEvent} so that
 * delivery components (email, webhook, report writers) can pick it up with
 * {@code @EventListener}.
 */
@Slf4j
@RequiredArgsConstructor
public class EventPublishingActionDispatcher implements ActionDispatcher {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public void dispatch(Map<String, Map<String, Object>> actions, Map<String, Object> payload,
                         WatcherDefinition watcher) {
        log.debug("Publishing watcher actions: actions={}, title={}", actions.keySet(), watcher.title());
        eventPublisher.publishEvent(new WatcherActionsEvent(actions, payload, watcher, Instant.now()));
    }
}
