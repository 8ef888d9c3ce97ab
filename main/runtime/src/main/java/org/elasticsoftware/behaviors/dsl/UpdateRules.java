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
import org.elasticsoftware.behaviors.commands.UpdateCommandHandlerFunction;
import org.elasticsoftware.behaviors.events.DomainEvent;
import org.elasticsoftware.behaviors.events.EventOutcome;
import org.elasticsoftware.behaviors.events.EventSourcingHandlerFunction;

import java.util.List;
import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * Rules that apply to an existing aggregate: which commands are valid for the current state and how
 * events change that state.
 *
 * <p>Same composition rules as {@link CreationRules}: immutable, first registered rule wins.
 *
 * @param <C> the commands of the aggregate
 * @param <E> the events of the aggregate
 * @param <S> the aggregate state
 */
public final class UpdateRules<C extends Command, E extends DomainEvent, S extends AggregateState> {
    private final RuleChain<Subject<S, C>, EventOutcome<List<E>>> commandRules;
    private final RuleChain<Subject<S, E>, S> eventRules;

    private UpdateRules(RuleChain<Subject<S, C>, EventOutcome<List<E>>> commandRules,
                        RuleChain<Subject<S, E>, S> eventRules) {
        this.commandRules = commandRules;
        this.eventRules = eventRules;
    }

    public static <C extends Command, E extends DomainEvent, S extends AggregateState> UpdateRules<C, E, S> create() {
        return new UpdateRules<>(RuleChain.empty(), RuleChain.empty());
    }

    public <X extends C> UpdateRules<C, E, S> handleCommand(Class<X> commandClass,
                                                            UpdateCommandHandlerFunction<S, X, E> handlerFunction) {
        return handleCommand(commandClass, (command, state) -> true, handlerFunction);
    }

    /**
     * Adds a command handler for commands of the given class for which the guard holds, given the
     * current state.
     */
    public <X extends C> UpdateRules<C, E, S> handleCommand(Class<X> commandClass,
                                                            BiPredicate<? super X, ? super S> guard,
                                                            UpdateCommandHandlerFunction<S, X, E> handlerFunction) {
        Objects.requireNonNull(commandClass, "commandClass");
        Objects.requireNonNull(guard, "guard");
        Objects.requireNonNull(handlerFunction, "handlerFunction");
        return new UpdateRules<>(
                commandRules.append(
                        subject -> commandClass.isInstance(subject.value())
                                && guard.test(commandClass.cast(subject.value()), subject.state()),
                        subject -> Outcomes.invoke(() -> handlerFunction.apply(commandClass.cast(subject.value()), subject.state()))),
                eventRules);
    }

    public <X extends E> UpdateRules<C, E, S> handleEvent(Class<X> eventClass,
                                                          EventSourcingHandlerFunction<S, X> handlerFunction) {
        Objects.requireNonNull(eventClass, "eventClass");
        Objects.requireNonNull(handlerFunction, "handlerFunction");
        return new UpdateRules<>(
                commandRules,
                eventRules.append(
                        subject -> eventClass.isInstance(subject.value()),
                        subject -> handlerFunction.apply(eventClass.cast(subject.value()), subject.state())));
    }

    public UpdateRules<C, E, S> orElse(UpdateRules<C, E, S> fallback) {
        Objects.requireNonNull(fallback, "fallback");
        return new UpdateRules<>(commandRules.orElse(fallback.commandRules), eventRules.orElse(fallback.eventRules));
    }

    RuleChain<Subject<S, C>, EventOutcome<List<E>>> commandRules() {
        return commandRules;
    }

    RuleChain<Subject<S, E>, S> eventRules() {
        return eventRules;
    }
}
