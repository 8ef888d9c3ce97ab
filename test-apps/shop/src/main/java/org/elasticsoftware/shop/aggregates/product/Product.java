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

package org.elasticsoftware.shop.aggregates.product;

import org.elasticsoftware.behaviors.aggregate.Behavior;
import org.elasticsoftware.behaviors.commands.CommandRejectedException;
import org.elasticsoftware.behaviors.dsl.BehaviorDsl;
import org.elasticsoftware.behaviors.events.EventOutcome;
import org.elasticsoftware.shop.aggregates.product.commands.ChangeNameCommand;
import org.elasticsoftware.shop.aggregates.product.commands.ChangePriceCommand;
import org.elasticsoftware.shop.aggregates.product.commands.CreateProductCommand;
import org.elasticsoftware.shop.aggregates.product.commands.ProductCommand;
import org.elasticsoftware.shop.aggregates.product.events.NameChangedEvent;
import org.elasticsoftware.shop.aggregates.product.events.PriceChangedEvent;
import org.elasticsoftware.shop.aggregates.product.events.ProductCreatedEvent;
import org.elasticsoftware.shop.aggregates.product.events.ProductEvent;

import java.math.BigDecimal;

public final class Product {
    public static final String NAME = "Product";

    private Product() {
    }

    public static Behavior<ProductCommand, ProductEvent, ProductState> behavior() {
        return BehaviorDsl.behaviorFor(NAME, ProductCommand.class, ProductEvent.class, ProductState.class)
                .whenConstructing(rules -> rules
                        .handleCommand(CreateProductCommand.class, cmd -> EventOutcome.attempt(() -> create(cmd)))
                        .handleEvent(ProductCreatedEvent.class, event -> new ProductState(event.number(), event.name(), event.price())))
                .whenUpdating(rules -> rules
                        .handleCommand(ChangePriceCommand.class,
                                (cmd, product) -> cmd.newPrice().signum() > 0,
                                (cmd, product) -> EventOutcome.single(new PriceChangedEvent(product.number(), product.price(), cmd.newPrice())))
                        .handleCommand(ChangePriceCommand.class,
                                (cmd, product) -> EventOutcome.failed(new CommandRejectedException(
                                        "Price of product " + product.number() + " must be positive, got " + cmd.newPrice(),
                                        NAME,
                                        product.getAggregateId())))
                        .handleCommand(ChangeNameCommand.class, (cmd, product) -> EventOutcome.attemptSingle(() -> rename(cmd, product)))
                        .handleEvent(PriceChangedEvent.class, (event, product) -> product.withPrice(event.newPrice()))
                        .handleEvent(NameChangedEvent.class, (event, product) -> product.withName(event.newName())))
                .build();
    }

    private static ProductCreatedEvent create(CreateProductCommand cmd) {
        if (cmd.name() == null || cmd.name().isBlank()) {
            throw new CommandRejectedException("Product " + cmd.number() + " needs a name", NAME, cmd.getAggregateId());
        }
        if (cmd.price() == null || cmd.price().compareTo(BigDecimal.ZERO) < 0) {
            throw new CommandRejectedException("Product " + cmd.number() + " cannot have a negative price", NAME, cmd.getAggregateId());
        }
        return new ProductCreatedEvent(cmd.number(), cmd.name().trim(), cmd.price());
    }

    private static NameChangedEvent rename(ChangeNameCommand cmd, ProductState product) {
        if (cmd.newName() == null || cmd.newName().isBlank()) {
            throw new CommandRejectedException("Product " + product.number() + " needs a name", NAME, product.getAggregateId());
        }
        return new NameChangedEvent(product.number(), cmd.newName().trim());
    }
}
