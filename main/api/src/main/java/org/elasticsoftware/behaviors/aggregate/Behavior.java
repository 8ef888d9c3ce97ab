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

package org.elasticsoftware.behaviors.aggregate;

import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.behaviors.commands.Command;
import org.elasticsoftware.behaviors.commands.CommandResult;
import org.elasticsoftware.behaviors.commands.Rejection;
import org.elasticsoftware.behaviors.events.DomainEvent;
import org.elasticsoftware.behaviors.events.UnhandledEventException;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * The rules of one kind of aggregate: how commands are validated into events and how events are
 * folded into state. There are two phases. Creation applies while no state exists for an aggregate
 * id, update applies once it does.
 *
 * <p>A behavior holds no per aggregate state and can be shared by any number of threads. Callers
 * must make sure that only one command per aggregate id is validated at a time and that the events
 * of an accepted command are folded before the next command for the same id is validated.
 *
 * @param <C> the commands of this aggregate
 * @param <E> the events of this aggregate
 * @param <S> the aggregate state
 */
public interface Behavior<C extends Command, E extends DomainEvent, S extends AggregateState> {

    @NotNull String getName();

    /**
     * Validates a command for an aggregate that does not exist yet. Handler failures and unknown
     * commands are {@link Rejection}s, the returned future does not complete exceptionally because
     * of them.
     *
     * @throws RuntimeException thrown by a guard while a matching rule is looked up. Guards are
     *                          expected not to fail, so this escapes the call instead of being
     *                          turned into a rejection.
     */
    @NotNull CompletableFuture<CommandResult<E>> validateCreation(@NotNull C command);

    /**
     * Validates a command against the current state. An accepted result always contains at least
     * one event, in the order they have to be folded. Failures are reported the same way as for
     * {@link #validateCreation(Command)}.
     *
     * @throws RuntimeException thrown by a guard while a matching rule is looked up
     */
    @NotNull CompletableFuture<CommandResult<List<E>>> validateUpdate(@NotNull C command, @NotNull S aggregate);

    /**
     * Folds the event that created the aggregate.
     *
     * @throws UnhandledEventException when no creation event sourcing handler matches
     */
    @NotNull S applyCreation(@NotNull E event);

    /**
     * Folds an event into existing state. Events without a matching handler leave the state as is.
     */
    @NotNull S applyUpdate(@NotNull S aggregate, @NotNull E event);

    boolean isCreationEventDefined(@NotNull E event);

    boolean isUpdateEventDefined(@NotNull S aggregate, @NotNull E event);
}
