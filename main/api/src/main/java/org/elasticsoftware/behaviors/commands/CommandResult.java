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

import jakarta.validation.constraints.NotNull;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of validating a command: either the produced value or a {@link Rejection}. Exactly one of
 * the two is present.
 *
 * @param <T> the accepted value, one event for creation, a list of events for updates
 */
public sealed interface CommandResult<T> permits CommandResult.Accepted, CommandResult.Rejected {

    static <T> CommandResult<T> accepted(@NotNull T value) {
        return new Accepted<>(Objects.requireNonNull(value, "value"));
    }

    static <T> CommandResult<T> rejected(@NotNull Rejection rejection) {
        return new Rejected<>(Objects.requireNonNull(rejection, "rejection"));
    }

    boolean isAccepted();

    <R> CommandResult<R> map(Function<? super T, ? extends R> mapper);

    <R> R fold(Function<? super T, ? extends R> onAccepted, Function<? super Rejection, ? extends R> onRejected);

    record Accepted<T>(T value) implements CommandResult<T> {
        @Override
        public boolean isAccepted() {
            return true;
        }

        @Override
        public <R> CommandResult<R> map(Function<? super T, ? extends R> mapper) {
            return accepted(mapper.apply(value));
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onAccepted, Function<? super Rejection, ? extends R> onRejected) {
            return onAccepted.apply(value);
        }
    }

    record Rejected<T>(Rejection rejection) implements CommandResult<T> {
        @Override
        public boolean isAccepted() {
            return false;
        }

        @Override
        public <R> CommandResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Rejected<>(rejection);
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onAccepted, Function<? super Rejection, ? extends R> onRejected) {
            return onRejected.apply(rejection);
        }
    }
}
