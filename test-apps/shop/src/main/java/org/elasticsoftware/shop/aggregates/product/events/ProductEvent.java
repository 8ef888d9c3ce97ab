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

package org.elasticsoftware.shop.aggregates.product.events;

import org.elasticsoftware.behaviors.events.DomainEvent;
import org.elasticsoftware.shop.aggregates.product.ProductNumber;

public sealed interface ProductEvent extends DomainEvent permits ProductCreatedEvent, PriceChangedEvent, NameChangedEvent {
    ProductNumber number();

    @Override
    default String getAggregateId() {
        return number().value();
    }
}
