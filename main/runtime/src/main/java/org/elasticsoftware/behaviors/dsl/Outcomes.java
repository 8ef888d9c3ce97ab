/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.behaviors.dsl;

import org.elasticsoftware.behaviors.events.EventOutcome;

import java.util.function.Supplier;

final class Outcomes {
    private Outcomes() {
    }

    /**
     * Calls a command handler. A handler that throws, or returns nothing at all, counts as a failed
     * outcome.
     */
    static <T> EventOutcome<T> invoke(Supplier<EventOutcome<T>> handlerCall) {
        try {
            EventOutcome<T> outcome = handlerCall.get();
            if (outcome == null) {
                return EventOutcome.failed(new IllegalStateException("Command handler returned no outcome"));
            }
            return outcome;
        } catch (RuntimeException e) {
            return EventOutcome.failed(e);
        }
    }
}
