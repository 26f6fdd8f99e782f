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

package org.fireflyframework.watcher.exception;

/**
 * Thrown when a recurrence phrase cannot be turned into a schedule.
 */
public class InvalidRecurrenceException extends WatcherException {

    private final String phrase;

    public InvalidRecurrenceException(String phrase) {
        super("Unsupported recurrence: '" + phrase + "'");
        this.phrase = phrase;
    }

    public InvalidRecurrenceException(String phrase, String reason) {
        super("Unsupported recurrence: '" + phrase + "': " + reason);
        this.phrase = phrase;
    }

    public String getPhrase() {
        return phrase;
    }
}
