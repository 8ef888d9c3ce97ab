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

package org.elasticsoftware.shop.service;

import org.elasticsoftware.behaviors.commands.CommandResult;
import org.elasticsoftware.behaviors.dispatch.AggregateDispatcher;
import org.elasticsoftware.behaviors.dispatch.ProcessedCommand;
import org.elasticsoftware.shop.aggregates.product.ProductNumber;
import org.elasticsoftware.shop.aggregates.product.ProductState;
import org.elasticsoftware.shop.aggregates.product.commands.ChangeNameCommand;
import org.elasticsoftware.shop.aggregates.product.commands.ChangePriceCommand;
import org.elasticsoftware.shop.aggregates.product.commands.CreateProductCommand;
import org.elasticsoftware.shop.aggregates.product.commands.ProductCommand;
import org.elasticsoftware.shop.aggregates.product.events.ProductEvent;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * The operations a product controller calls. Every result carries either the new product state or
 * the rejection to report back to the client.
 */
public class ProductService {
    private final AggregateDispatcher<ProductCommand, ProductEvent, ProductState> dispatcher;

    public ProductService(AggregateDispatcher<ProductCommand, ProductEvent, ProductState> dispatcher) {
        this.dispatcher = dispatcher;
    }

    public CompletableFuture<CommandResult<ProductState>> create(String name, BigDecimal price) {
        return create(ProductNumber.generate(), name, price);
    }

    public CompletableFuture<CommandResult<ProductState>> create(ProductNumber number, String name, BigDecimal price) {
        return send(new CreateProductCommand(number, name, price));
    }

    public CompletableFuture<CommandResult<ProductState>> changePrice(ProductNumber number, BigDecimal newPrice) {
        return send(new ChangePriceCommand(number, newPrice));
    }

    public CompletableFuture<CommandResult<ProductState>> changeName(ProductNumber number, String newName) {
        return send(new ChangeNameCommand(number, newName));
    }

    public CompletableFuture<Optional<ProductState>> get(ProductNumber number) {
        return dispatcher.getState(number.value());
    }

    public String location(ProductNumber number) {
        return "/product/" + number.value();
    }

    private CompletableFuture<CommandResult<ProductState>> send(ProductCommand command) {
        return dispatcher.submit(command).thenApply(result -> result.map(ProcessedCommand::state));
    }
}
