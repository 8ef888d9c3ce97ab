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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.elasticsoftware.behaviors.commands.CommandResult;
import org.elasticsoftware.behaviors.commands.Rejection;
import org.elasticsoftware.shop.aggregates.product.commands.ChangePriceCommand;
import org.elasticsoftware.shop.aggregates.product.events.PriceChangedEvent;
import org.elasticsoftware.shop.aggregates.product.events.ProductEvent;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class ProductJsonTests {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ProductNumber number = ProductNumber.fromString("p-1");

    @Test
    public void testProductNumberIsWrittenAsPlainString() throws Exception {
        assertEquals("\"p-1\"", objectMapper.writeValueAsString(number));
    }

    @Test
    public void testStateShape() throws Exception {
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(new ProductState(number, "Widget", BigDecimal.TEN)));

        assertEquals("p-1", json.get("number").asText());
        assertEquals("Widget", json.get("name").asText());
        assertEquals(0, BigDecimal.TEN.compareTo(json.get("price").decimalValue()));
        assertFalse(json.has("aggregateId"));
    }

    @Test
    public void testEventShape() throws Exception {
        ProductEvent event = new PriceChangedEvent(number, BigDecimal.TEN, new BigDecimal("20"));
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(event));

        assertTrue(json.get("number").isTextual());
        assertEquals("p-1", json.get("number").asText());
        assertEquals(0, BigDecimal.TEN.compareTo(json.get("oldPrice").decimalValue()));
        assertEquals(0, new BigDecimal("20").compareTo(json.get("newPrice").decimalValue()));
        assertFalse(json.has("aggregateId"));
    }

    @Test
    public void testRejectedPriceChangeShape() throws Exception {
        ProductState widget = new ProductState(number, "Widget", BigDecimal.TEN);
        CommandResult<List<ProductEvent>> result = Product.behavior()
                .validateUpdate(new ChangePriceCommand(number, new BigDecimal("-5")), widget)
                .get(5, TimeUnit.SECONDS);
        Rejection rejection = assertInstanceOf(CommandResult.Rejected.class, result).rejection();

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(rejection));

        assertEquals("COMMAND_FAILED", json.get("kind").asText());
        assertEquals(Product.NAME, json.get("aggregateName").asText());
        assertEquals("p-1", json.get("aggregateId").asText());
        assertEquals("ChangePriceCommand", json.get("commandType").asText());
        assertEquals("ChangePriceCommand[number=p-1, newPrice=-5]", json.get("command").asText());
    }
}
