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

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotNull;

import java.time.Duration;

/**
 * Expected, recoverable outcome of a command that could not be turned into events. Rejections are
 * returned as values and never thrown across the behavior boundary.
 *
 * @param kind          why the command was rejected
 * @param reason        human readable reason
 * @param aggregateName the kind of aggregate that rejected the command
 * @param aggregateId   id of the existing aggregate, {@code null} for rejections during creation
 * @param commandType   simple class name of the rejected command
 * @param command       description of the rejected command
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Rejection(@NotNull Kind kind,
                        @NotNull String reason,
                        @NotNull String aggregateName,
                        String aggregateId,
                        @NotNull String commandType,
                        @NotNull String command) {

    public enum Kind {
        INVALID_COMMAND_FOR_CREATION,
        INVALID_COMMAND_FOR_UPDATE,
        COMMAND_FAILED,
        TIMED_OUT
    }

    public static Rejection invalidForCreation(String aggregateName, Command command) {
        return new Rejection(Kind.INVALID_COMMAND_FOR_CREATION,
                "Invalid command " + command,
                aggregateName,
                null,
                command.getClass().getSimpleName(),
                String.valueOf(command));
    }

    public static Rejection invalidForUpdate(String aggregateName, Command command, String aggregateId) {
        return new Rejection(Kind.INVALID_COMMAND_FOR_UPDATE,
                "Invalid command " + command + " for aggregate " + aggregateId,
                aggregateName,
                aggregateId,
                command.getClass().getSimpleName(),
                String.valueOf(command));
    }

    public static Rejection commandFailed(String aggregateName, Command command, String aggregateId, Throwable cause) {
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new Rejection(Kind.COMMAND_FAILED,
                reason,
                aggregateName,
                aggregateId,
                command.getClass().getSimpleName(),
                String.valueOf(command));
    }

    public static Rejection timedOut(String aggregateName, Command command, String aggregateId, Duration timeout) {
        return new Rejection(Kind.TIMED_OUT,
                "Command " + command + " was not validated within " + timeout.toMillis() + "ms",
                aggregateName,
                aggregateId,
                command.getClass().getSimpleName(),
                String.valueOf(command));
    }
}
