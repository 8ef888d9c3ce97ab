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

package org.elasticsoftware.behaviors.events;

import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * What a command handler produced: a value that is available now, a failure, or a value that will
 * become available later. Every shape is turned into a {@link CompletableFuture} by
 * {@link #toFuture()}, which is the only form the behavior runtime works with.
 *
 * <p>Creation handlers produce an {@code EventOutcome<E>}, update handlers an
 * {@code EventOutcome<List<E>>}. The {@code single}, {@code attemptSingle} and
 * {@code deferredSingle} factories lift a single event into the update shape.
 *
 * @param <T> the produced value, either one event or a list of events
 */
public sealed interface EventOutcome<T> permits EventOutcome.Immediate, EventOutcome.Failed, EventOutcome.Deferred {

    @NotNull CompletableFuture<T> toFuture();

    <R> EventOutcome<R> map(Function<? super T, ? extends R> mapper);

    static <T> EventOutcome<T> of(@NotNull T value) {
        return new Immediate<>(Objects.requireNonNull(value, "value"));
    }

    static <T> EventOutcome<T> failed(@NotNull Exception exception) {
        return new Failed<>(Objects.requireNonNull(exception, "exception"));
    }

    static <T> EventOutcome<T> deferred(@NotNull CompletionStage<? extends T> stage) {
        return new Deferred<>(Objects.requireNonNull(stage, "stage"));
    }

    /**
     * Runs the computation right away and captures either its value or the exception it threw.
     */
    static <T> EventOutcome<T> attempt(@NotNull Callable<? extends T> computation) {
        try {
            return of(computation.call());
        } catch (Exception e) {
            return failed(e);
        }
    }

    @SafeVarargs
    static <E> EventOutcome<List<E>> events(E... events) {
        return of(List.of(events));
    }

    static <E> EventOutcome<List<E>> single(@NotNull E event) {
        return of(List.of(event));
    }

    static <E> EventOutcome<List<E>> attemptSingle(@NotNull Callable<? extends E> computation) {
        return EventOutcome.<E>attempt(computation).map(List::of);
    }

    static <E> EventOutcome<List<E>> deferredSingle(@NotNull CompletionStage<? extends E> stage) {
        return EventOutcome.<E>deferred(stage).map(List::of);
    }

    record Immediate<T>(T value) implements EventOutcome<T> {
        @Override
        public CompletableFuture<T> toFuture() {
            return CompletableFuture.completedFuture(value);
        }

        @Override
        public <R> EventOutcome<R> map(Function<? super T, ? extends R> mapper) {
            try {
                return of(mapper.apply(value));
            } catch (RuntimeException e) {
                return failed(e);
            }
        }
    }

    record Failed<T>(Exception exception) implements EventOutcome<T> {
        @Override
        public CompletableFuture<T> toFuture() {
            return CompletableFuture.failedFuture(exception);
        }

        @Override
        public <R> EventOutcome<R> map(Function<? super T, ? extends R> mapper) {
            return new Failed<>(exception);
        }
    }

    record Deferred<T>(CompletionStage<? extends T> stage) implements EventOutcome<T> {
        @Override
        public CompletableFuture<T> toFuture() {
            // never hand out the handler's own stage
            CompletableFuture<T> future = new CompletableFuture<>();
            stage.whenComplete((value, throwable) -> {
                if (throwable != null) {
                    future.completeExceptionally(throwable);
                } else {
                    future.complete(value);
                }
            });
            return future;
        }

        @Override
        public <R> EventOutcome<R> map(Function<? super T, ? extends R> mapper) {
            return new Deferred<>(stage.<R>thenApply(mapper::apply));
        }
    }
}
