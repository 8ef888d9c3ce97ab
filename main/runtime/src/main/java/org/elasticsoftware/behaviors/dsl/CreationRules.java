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
import org.elasticsoftware.behaviors.commands.Command;
import org.elasticsoftware.behaviors.commands.CreationCommandHandlerFunction;
import org.elasticsoftware.behaviors.events.CreationEventSourcingHandlerFunction;
import org.elasticsoftware.behaviors.events.DomainEvent;
import org.elasticsoftware.behaviors.events.EventOutcome;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Rules that apply while an aggregate does not exist yet: which commands may create it and how the
 * creation event becomes the first state.
 *
 * <p>Instances are immutable, every method returns a new {@code CreationRules}. Rules are matched
 * in the order they were added, so a rule added later only sees commands and events that none of
 * the earlier rules matched.
 *
 * @param <C> the commands of the aggregate
 * @param <E> the events of the aggregate
 * @param <S> the aggregate state
 */
public final class CreationRules<C extends Command, E extends DomainEvent, S extends AggregateState> {
    private final RuleChain<C, EventOutcome<E>> commandRules;
    private final RuleChain<E, S> eventRules;

    private CreationRules(RuleChain<C, EventOutcome<E>> commandRules, RuleChain<E, S> eventRules) {
        this.commandRules = commandRules;
        this.eventRules = eventRules;
    }

    public static <C extends Command, E extends DomainEvent, S extends AggregateState> CreationRules<C, E, S> create() {
        return new CreationRules<>(RuleChain.empty(), RuleChain.empty());
    }

    public <X extends C> CreationRules<C, E, S> handleCommand(Class<X> commandClass,
                                                              CreationCommandHandlerFunction<X, E> handlerFunction) {
        return handleCommand(commandClass, command -> true, handlerFunction);
    }

    /**
     * Adds a command handler for commands of the given class that also pass the guard.
     */
    public <X extends C> CreationRules<C, E, S> handleCommand(Class<X> commandClass,
                                                              Predicate<? super X> guard,
                                                              CreationCommandHandlerFunction<X, E> handlerFunction) {
        Objects.requireNonNull(commandClass, "commandClass");
        Objects.requireNonNull(guard, "guard");
        Objects.requireNonNull(handlerFunction, "handlerFunction");
        return new CreationRules<>(
                commandRules.append(
                        command -> commandClass.isInstance(command) && guard.test(commandClass.cast(command)),
                        command -> Outcomes.invoke(() -> handlerFunction.apply(commandClass.cast(command)))),
                eventRules);
    }

    public <X extends E> CreationRules<C, E, S> handleEvent(Class<X> eventClass,
                                                            CreationEventSourcingHandlerFunction<S, X> handlerFunction) {
        Objects.requireNonNull(eventClass, "eventClass");
        Objects.requireNonNull(handlerFunction, "handlerFunction");
        return new CreationRules<>(
                commandRules,
                eventRules.append(eventClass::isInstance, event -> handlerFunction.apply(eventClass.cast(event))));
    }

    /**
     * Combines these rules with a fallback. The fallback's rules are tried after all of these.
     */
    public CreationRules<C, E, S> orElse(CreationRules<C, E, S> fallback) {
        Objects.requireNonNull(fallback, "fallback");
        return new CreationRules<>(commandRules.orElse(fallback.commandRules), eventRules.orElse(fallback.eventRules));
    }

    RuleChain<C, EventOutcome<E>> commandRules() {
        return commandRules;
    }

    RuleChain<E, S> eventRules() {
        return eventRules;
    }
}
