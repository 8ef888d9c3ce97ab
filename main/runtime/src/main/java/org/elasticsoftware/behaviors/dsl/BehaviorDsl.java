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
import org.elasticsoftware.behaviors.events.DomainEvent;

import java.util.function.UnaryOperator;

/**
 * Entry point for declaring a {@link Behavior}:
 *
 * <pre>{@code
 * Behavior<ProductCommand, ProductEvent, Product> behavior =
 *     BehaviorDsl.behaviorFor("Product", ProductCommand.class, ProductEvent.class, Product.class)
 *         .whenConstructing(rules -> rules
 *             .handleCommand(CreateProduct.class, cmd -> EventOutcome.of(new ProductCreated(...)))
 *             .handleEvent(ProductCreated.class, event -> new Product(...)))
 *         .whenUpdating(rules -> rules
 *             .handleCommand(ChangePrice.class, (cmd, product) -> EventOutcome.single(new PriceChanged(...)))
 *             .handleEvent(PriceChanged.class, (event, product) -> product.withPrice(event.price())))
 *         .build();
 * }</pre>
 *
 * <p>The builder is staged. {@code build()} only exists on {@link Complete}, which is reached once
 * both {@code whenConstructing} and {@code whenUpdating} have been called. Both can be called more
 * than once, rules of later calls are tried after the rules of earlier calls. A stage is only
 * entered when its rules handle at least one command.
 */
public final class BehaviorDsl {
    private BehaviorDsl() {
    }

    public static <C extends Command, E extends DomainEvent, S extends AggregateState> Pending<C, E, S> behaviorFor(String name) {
        if (name == null || name.isBlank()) {
            throw new BehaviorConfigurationException("Behavior name must not be blank", name);
        }
        return new Pending<>(name, CreationRules.create(), UpdateRules.create());
    }

    /**
     * Same as {@link #behaviorFor(String)}, the classes only pin the type parameters.
     */
    public static <C extends Command, E extends DomainEvent, S extends AggregateState> Pending<C, E, S> behaviorFor(String name,
                                                                                                                   Class<C> commandClass,
                                                                                                                   Class<E> eventClass,
                                                                                                                   Class<S> stateClass) {
        return behaviorFor(name);
    }

    private abstract static class Stage<C extends Command, E extends DomainEvent, S extends AggregateState> {
        protected final String name;
        protected final CreationRules<C, E, S> creationRules;
        protected final UpdateRules<C, E, S> updateRules;

        Stage(String name, CreationRules<C, E, S> creationRules, UpdateRules<C, E, S> updateRules) {
            this.name = name;
            this.creationRules = creationRules;
            this.updateRules = updateRules;
        }

        protected CreationRules<C, E, S> addCreationRules(CreationRules<C, E, S> additionalRules) {
            if (additionalRules == null) {
                throw new BehaviorConfigurationException("Creation rules must not be null", name);
            }
            CreationRules<C, E, S> combined = creationRules.orElse(additionalRules);
            if (combined.commandRules().size() == 0) {
                throw new BehaviorConfigurationException("Creation rules must handle at least one command", name);
            }
            return combined;
        }

        protected CreationRules<C, E, S> addCreationRules(UnaryOperator<CreationRules<C, E, S>> configurer) {
            if (configurer == null) {
                throw new BehaviorConfigurationException("Creation rules must not be null", name);
            }
            return addCreationRules(configurer.apply(CreationRules.create()));
        }

        protected UpdateRules<C, E, S> addUpdateRules(UpdateRules<C, E, S> additionalRules) {
            if (additionalRules == null) {
                throw new BehaviorConfigurationException("Update rules must not be null", name);
            }
            UpdateRules<C, E, S> combined = updateRules.orElse(additionalRules);
            if (combined.commandRules().size() == 0) {
                throw new BehaviorConfigurationException("Update rules must handle at least one command", name);
            }
            return combined;
        }

        protected UpdateRules<C, E, S> addUpdateRules(UnaryOperator<UpdateRules<C, E, S>> configurer) {
            if (configurer == null) {
                throw new BehaviorConfigurationException("Update rules must not be null", name);
            }
            return addUpdateRules(configurer.apply(UpdateRules.create()));
        }
    }

    /**
     * Neither creation nor update rules have been supplied.
     */
    public static final class Pending<C extends Command, E extends DomainEvent, S extends AggregateState> extends Stage<C, E, S> {
        private Pending(String name, CreationRules<C, E, S> creationRules, UpdateRules<C, E, S> updateRules) {
            super(name, creationRules, updateRules);
        }

        public CreationDefined<C, E, S> whenConstructing(CreationRules<C, E, S> rules) {
            return new CreationDefined<>(name, addCreationRules(rules), updateRules);
        }

        public CreationDefined<C, E, S> whenConstructing(UnaryOperator<CreationRules<C, E, S>> configurer) {
            return new CreationDefined<>(name, addCreationRules(configurer), updateRules);
        }

        public UpdatesDefined<C, E, S> whenUpdating(UpdateRules<C, E, S> rules) {
            return new UpdatesDefined<>(name, creationRules, addUpdateRules(rules));
        }

        public UpdatesDefined<C, E, S> whenUpdating(UnaryOperator<UpdateRules<C, E, S>> configurer) {
            return new UpdatesDefined<>(name, creationRules, addUpdateRules(configurer));
        }
    }

    /**
     * Creation rules are known, update rules are still missing.
     */
    public static final class CreationDefined<C extends Command, E extends DomainEvent, S extends AggregateState> extends Stage<C, E, S> {
        private CreationDefined(String name, CreationRules<C, E, S> creationRules, UpdateRules<C, E, S> updateRules) {
            super(name, creationRules, updateRules);
        }

        public CreationDefined<C, E, S> whenConstructing(CreationRules<C, E, S> rules) {
            return new CreationDefined<>(name, addCreationRules(rules), updateRules);
        }

        public CreationDefined<C, E, S> whenConstructing(UnaryOperator<CreationRules<C, E, S>> configurer) {
            return new CreationDefined<>(name, addCreationRules(configurer), updateRules);
        }

        public Complete<C, E, S> whenUpdating(UpdateRules<C, E, S> rules) {
            return new Complete<>(name, creationRules, addUpdateRules(rules));
        }

        public Complete<C, E, S> whenUpdating(UnaryOperator<UpdateRules<C, E, S>> configurer) {
            return new Complete<>(name, creationRules, addUpdateRules(configurer));
        }
    }

    /**
     * Update rules are known, creation rules are still missing.
     */
    public static final class UpdatesDefined<C extends Command, E extends DomainEvent, S extends AggregateState> extends Stage<C, E, S> {
        private UpdatesDefined(String name, CreationRules<C, E, S> creationRules, UpdateRules<C, E, S> updateRules) {
            super(name, creationRules, updateRules);
        }

        public Complete<C, E, S> whenConstructing(CreationRules<C, E, S> rules) {
            return new Complete<>(name, addCreationRules(rules), updateRules);
        }

        public Complete<C, E, S> whenConstructing(UnaryOperator<CreationRules<C, E, S>> configurer) {
            return new Complete<>(name, addCreationRules(configurer), updateRules);
        }

        public UpdatesDefined<C, E, S> whenUpdating(UpdateRules<C, E, S> rules) {
            return new UpdatesDefined<>(name, creationRules, addUpdateRules(rules));
        }

        public UpdatesDefined<C, E, S> whenUpdating(UnaryOperator<UpdateRules<C, E, S>> configurer) {
            return new UpdatesDefined<>(name, creationRules, addUpdateRules(configurer));
        }
    }

    /**
     * Both rule sets are known, the behavior can be built.
     */
    public static final class Complete<C extends Command, E extends DomainEvent, S extends AggregateState> extends Stage<C, E, S> {
        private Complete(String name, CreationRules<C, E, S> creationRules, UpdateRules<C, E, S> updateRules) {
            super(name, creationRules, updateRules);
        }

        public Complete<C, E, S> whenConstructing(CreationRules<C, E, S> rules) {
            return new Complete<>(name, addCreationRules(rules), updateRules);
        }

        public Complete<C, E, S> whenConstructing(UnaryOperator<CreationRules<C, E, S>> configurer) {
            return new Complete<>(name, addCreationRules(configurer), updateRules);
        }

        public Complete<C, E, S> whenUpdating(UpdateRules<C, E, S> rules) {
            return new Complete<>(name, creationRules, addUpdateRules(rules));
        }

        public Complete<C, E, S> whenUpdating(UnaryOperator<UpdateRules<C, E, S>> configurer) {
            return new Complete<>(name, creationRules, addUpdateRules(configurer));
        }

        public Behavior<C, E, S> build() {
            return new DefaultBehavior<>(name, creationRules, updateRules);
        }
    }
}
