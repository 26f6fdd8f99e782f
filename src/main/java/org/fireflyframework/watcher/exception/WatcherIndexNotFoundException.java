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
 * Thrown when the watcher index does not exist yet.
 * <p>
 * The reconciler treats this as "nothing to schedule".
 */
public class WatcherIndexNotFoundException extends WatcherException {

    private final String index;

    public WatcherIndexNotFoundException(String index) {
        super("Watcher index not found: " + index);
        this.index = index;
    }

    public WatcherIndexNotFoundException(String index, Throwable cause) {
        super("Watcher index not found: " + index, cause);
        this.index = index;
    }

    public String getIndex() {
        return index;
    }
}
