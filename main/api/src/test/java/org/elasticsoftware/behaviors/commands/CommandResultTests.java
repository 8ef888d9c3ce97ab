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

package org.elasticsoftware.behaviors.commands;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CommandResultTests {
    private final Rejection rejection = Rejection.invalidForCreation("User", new RenameCommand("user-1", "Jane"));

    @Test
    public void testAccepted() {
        CommandResult<String> result = CommandResult.accepted("value");

        assertTrue(result.isAccepted());
        assertEquals(CommandResult.accepted(5), result.map(String::length));
        assertEquals("value!", result.fold(value -> value + "!", Rejection::reason));
    }

    @Test
    public void testRejected() {
        CommandResult<String> result = CommandResult.rejected(rejection);

        assertFalse(result.isAccepted());
        assertEquals(CommandResult.<Integer>rejected(rejection), result.map(String::length));
        assertEquals(rejection.reason(), result.fold(value -> value + "!", Rejection::reason));
    }

    @Test
    public void testNullIsRefused() {
        assertThrows(NullPointerException.class, () -> CommandResult.accepted(null));
        assertThrows(NullPointerException.class, () -> CommandResult.rejected(null));
    }

    @Test
    public void testMapToList() {
        CommandResult<List<String>> result = CommandResult.accepted("event").map(List::of);

        assertEquals(List.of("event"), ((CommandResult.Accepted<List<String>>) result).value());
    }
}
