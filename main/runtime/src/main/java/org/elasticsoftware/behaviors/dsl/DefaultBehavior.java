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

import org.elasticsoftware.behaviors.aggregate.AggregateState;
import org.elasticsoftware.behaviors.aggregate.Behavior;
import org.elasticsoftware.behaviors.commands.Command;
import org.elasticsoftware.behaviors.commands.CommandResult;
import org.elasticsoftware.behaviors.commands.Rejection;
import org.elasticsoftware.behaviors.events.DomainEvent;
import org.elasticsoftware.behaviors.events.EventOutcome;
import org.elasticsoftware.behaviors.events.UnhandledEventException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

final class DefaultBehavior<C extends Command, E extends DomainEvent, S extends AggregateState> implements Behavior<C, E, S> {
    private static final Logger logger = LoggerFactory.getLogger(DefaultBehavior.class);
    private final String name;
    private final RuleChain<C, CompletableFuture<CommandResult<E>>> creationCommands;
    private final RuleChain<E, S> creationEvents;
    private final RuleChain<Subject<S, C>, CompletableFuture<CommandResult<List<E>>>> updateCommands;
    private final RuleChain<Subject<S, E>, S> updateEvents;

    DefaultBehavior(String name, CreationRules<C, E, S> creationRules, UpdateRules<C, E, S> updateRules) {
        this.name = name;
        // the catch-all rules go last, every command ends up either accepted or rejected
        this.creationCommands = creationRules.commandRules()
                .map(this::completeCreation)
                .orElse(RuleChain.catchAll(this::rejectUnknownCreation));
        this.creationEvents = creationRules.eventRules();
        this.updateCommands = updateRules.commandRules()
                .map(this::completeUpdate)
                .orElse(RuleChain.catchAll(this::rejectUnknownUpdate));
        this.updateEvents = updateRules.eventRules();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public CompletableFuture<CommandResult<E>> validateCreation(C command) {
        return creationCommands.apply(command);
    }

    @Override
    public CompletableFuture<CommandResult<List<E>>> validateUpdate(C command, S aggregate) {
        return updateCommands.apply(new Subject<>(aggregate, command));
    }

    @Override
    public S applyCreation(E event) {
        return creationEvents.lookup(event)
                .orElseThrow(() -> new UnhandledEventException(name, event))
                .apply(event);
    }

    @Override
    public S applyUpdate(S aggregate, E event) {
        Subject<S, E> subject = new Subject<>(aggregate, event);
        return updateEvents.lookup(subject)
                .map(rule -> rule.apply(subject))
                .orElse(aggregate);
    }

    @Override
    public boolean isCreationEventDefined(E event) {
        return creationEvents.isDefinedAt(event);
    }

    @Override
    public boolean isUpdateEventDefined(S aggregate, E event) {
        return updateEvents.isDefinedAt(new Subject<>(aggregate, event));
    }

    private CompletableFuture<CommandResult<E>> completeCreation(C command, EventOutcome<E> outcome) {
        return outcome.toFuture().<CommandResult<E>>handle((event, throwable) -> {
            if (throwable != null) {
                return reject(Rejection.commandFailed(name, command, null, unwrap(throwable)));
            } else if (event == null) {
                return reject(Rejection.commandFailed(name, command, null,
                        new IllegalStateException("Command handler for " + command.getClass().getSimpleName() + " produced no event")));
            }
            return CommandResult.accepted(event);
        });
    }

    private CompletableFuture<CommandResult<List<E>>> completeUpdate(Subject<S, C> subject, EventOutcome<List<E>> outcome) {
        String aggregateId = subject.state().getAggregateId();
        return outcome.toFuture().<CommandResult<List<E>>>handle((events, throwable) -> {
            if (throwable != null) {
                return reject(Rejection.commandFailed(name, subject.value(), aggregateId, unwrap(throwable)));
            } else if (events == null || events.isEmpty()) {
                return reject(Rejection.commandFailed(name, subject.value(), aggregateId,
                        new IllegalStateException("Command handler for " + subject.value().getClass().getSimpleName() + " produced no events")));
            }
            return CommandResult.accepted(List.copyOf(events));
        });
    }

    private CompletableFuture<CommandResult<E>> rejectUnknownCreation(C command) {
        return CompletableFuture.completedFuture(reject(Rejection.invalidForCreation(name, command)));
    }

    private CompletableFuture<CommandResult<List<E>>> rejectUnknownUpdate(Subject<S, C> subject) {
        return CompletableFuture.completedFuture(
                reject(Rejection.invalidForUpdate(name, subject.value(), subject.state().getAggregateId())));
    }

    private <T> CommandResult<T> reject(Rejection rejection) {
        logger.debug("{} rejected {}: {}", name, rejection.commandType(), rejection.reason());
        return CommandResult.rejected(rejection);
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @Override
    public String toString() {
        return "Behavior[" + name + "]";
    }
}
