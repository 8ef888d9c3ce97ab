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
import org.elasticsoftware.behaviors.commands.Rejection;
import org.elasticsoftware.shop.ShopConfiguration;
import org.elasticsoftware.shop.aggregates.product.ProductNumber;
import org.elasticsoftware.shop.aggregates.product.ProductState;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(classes = ShopConfiguration.class)
public class ProductServiceTests {
    @Autowired
    private ProductService productService;

    @Test
    public void testCreateAndChangeProduct() throws Exception {
        ProductNumber number = ProductNumber.generate();

        assertEquals(new ProductState(number, "Widget", BigDecimal.TEN),
                accepted(productService.create(number, "Widget", BigDecimal.TEN)));
        assertEquals(new ProductState(number, "Widget", new BigDecimal("20")),
                accepted(productService.changePrice(number, new BigDecimal("20"))));
        assertEquals(new ProductState(number, "Gadget", new BigDecimal("20")),
                accepted(productService.changeName(number, "Gadget")));
        assertEquals(Optional.of(new ProductState(number, "Gadget", new BigDecimal("20"))),
                productService.get(number).get(5, TimeUnit.SECONDS));
    }

    @Test
    public void testNegativePriceIsRejected() throws Exception {
        ProductNumber number = ProductNumber.generate();
        accepted(productService.create(number, "Widget", BigDecimal.TEN));

        CommandResult<ProductState> result = productService.changePrice(number, new BigDecimal("-5")).get(5, TimeUnit.SECONDS);

        Rejection rejection = assertInstanceOf(CommandResult.Rejected.class, result).rejection();
        assertEquals(Rejection.Kind.COMMAND_FAILED, rejection.kind());
        assertEquals("Product", rejection.aggregateName());
        assertEquals(Optional.of(new ProductState(number, "Widget", BigDecimal.TEN)),
                productService.get(number).get(5, TimeUnit.SECONDS));
    }

    @Test
    public void testCreateWithGeneratedNumber() throws Exception {
        ProductState product = accepted(productService.create("Widget", BigDecimal.ONE));

        assertEquals("/product/" + product.number().value(), productService.location(product.number()));
    }

    @Test
    public void testChangingUnknownProductIsRejected() throws Exception {
        ProductNumber number = ProductNumber.generate();

        CommandResult<ProductState> result = productService.changePrice(number, BigDecimal.ONE).get(5, TimeUnit.SECONDS);

        Rejection rejection = assertInstanceOf(CommandResult.Rejected.class, result).rejection();
        assertEquals(Rejection.Kind.INVALID_COMMAND_FOR_CREATION, rejection.kind());
        assertEquals(Optional.empty(), productService.get(number).get(5, TimeUnit.SECONDS));
    }

    @Test
    public void testConcurrentPriceChangesAreAllApplied() throws Exception {
        ProductNumber number = ProductNumber.generate();
        accepted(productService.create(number, "Widget", BigDecimal.ONE));

        List<CompletableFuture<CommandResult<ProductState>>> changes = new ArrayList<>();
        for (int i = 2; i <= 50; i++) {
            changes.add(productService.changePrice(number, BigDecimal.valueOf(i)));
        }
        for (CompletableFuture<CommandResult<ProductState>> change : changes) {
            accepted(change);
        }

        assertEquals(BigDecimal.valueOf(50), productService.get(number).get(5, TimeUnit.SECONDS).orElseThrow().price());
    }

    private static ProductState accepted(CompletableFuture<CommandResult<ProductState>> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS).fold(state -> state, rejection -> fail("Rejected: " + rejection.reason()));
    }
}
