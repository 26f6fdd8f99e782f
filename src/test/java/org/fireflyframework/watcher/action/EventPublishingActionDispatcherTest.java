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

import org.fireflyframework.watcher.TestWatchers;
import org.fireflyframework.watcher.model.WatcherDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link EventPublishingActionDispatcher}.
 */
@ExtendWith(MockitoExtension.class)
class EventPublishingActionDispatcherTest {

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Test
    void shouldPublishActionsEvent() {
        EventPublishingActionDispatcher dispatcher = new EventPublishingActionDispatcher(eventPublisher);
        WatcherDefinition watcher = TestWatchers.later("every 5 minutes");
        Map<String, Object> payload = Map.of("hits", Map.of("total", 3));

        dispatcher.dispatch(TestWatchers.EMAIL_ACTION, payload, watcher);

        ArgumentCaptor<WatcherActionsEvent> captor = ArgumentCaptor.forClass(WatcherActionsEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        WatcherActionsEvent event = captor.getValue();
        assertThat(event.actions()).isEqualTo(TestWatchers.EMAIL_ACTION);
        assertThat(event.payload()).isEqualTo(payload);
        assertThat(event.watcher()).isEqualTo(watcher);
        assertThat(event.timestamp()).isNotNull();
    }
}
