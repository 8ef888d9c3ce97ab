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

package org.elasticsoftware.shop;

import org.elasticsoftware.behaviors.aggregate.Behavior;
import org.elasticsoftware.behaviors.beans.AggregateDispatcherFactory;
import org.elasticsoftware.behaviors.beans.BehaviorRuntimeConfiguration;
import org.elasticsoftware.behaviors.dispatch.AggregateDispatcher;
import org.elasticsoftware.shop.aggregates.product.Product;
import org.elasticsoftware.shop.aggregates.product.ProductState;
import org.elasticsoftware.shop.aggregates.product.commands.ProductCommand;
import org.elasticsoftware.shop.aggregates.product.events.ProductEvent;
import org.elasticsoftware.shop.service.ProductService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

@Configuration
@Import(BehaviorRuntimeConfiguration.class)
public class ShopConfiguration {
    @Bean("productBehavior")
    public Behavior<ProductCommand, ProductEvent, ProductState> productBehavior() {
        return Product.behavior();
    }

    @Bean(name = "productDispatcher", destroyMethod = "close")
    public AggregateDispatcher<ProductCommand, ProductEvent, ProductState> productDispatcher(AggregateDispatcherFactory aggregateDispatcherFactory,
                                                                                           Behavior<ProductCommand, ProductEvent, ProductState> productBehavior) {
        return aggregateDispatcherFactory.create(productBehavior);
    }

    @Bean("productService")
    public ProductService productService(AggregateDispatcher<ProductCommand, ProductEvent, ProductState> productDispatcher) {
        return new ProductService(productDispatcher);
    }
}
