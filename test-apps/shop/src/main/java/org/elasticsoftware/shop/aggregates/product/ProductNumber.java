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

import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

/**
 * Identifier of a product. Product numbers are assigned by the client that creates the product.
 */
public record ProductNumber(@NotNull @JsonValue String value) {
    public ProductNumber {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Product number must not be blank");
        }
    }

    public static ProductNumber fromString(String value) {
        return new ProductNumber(value == null ? null : value.trim());
    }

    public static ProductNumber generate() {
        return new ProductNumber(UUID.randomUUID().toString());
    }

    @Override
    public String toString() {
        return value;
    }
}
