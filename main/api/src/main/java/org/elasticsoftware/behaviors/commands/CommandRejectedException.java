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

package org.elasticsoftware.behaviors.commands;

import org.elasticsoftware.behaviors.BehaviorsException;

/**
 * Thrown (or returned through {@code EventOutcome.failed}) by a command handler when a domain
 * precondition does not hold. The behavior turns it into a {@link Rejection.Kind#COMMAND_FAILED}
 * rejection.
 */
public class CommandRejectedException extends BehaviorsException {
    public CommandRejectedException(String message) {
        super(message, null, null);
    }

    public CommandRejectedException(String message, String aggregateName, String aggregateId) {
        super(message, aggregateName, aggregateId);
    }
}
