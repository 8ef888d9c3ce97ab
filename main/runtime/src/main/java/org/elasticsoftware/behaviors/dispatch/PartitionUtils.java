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

package org.elasticsoftware.behaviors.dispatch;

public final class PartitionUtils {
    private PartitionUtils() {
    }

    public static int partitionFor(String aggregateId, int partitions) {
        if (partitions <= 0) {
            throw new IllegalArgumentException("Number of partitions must be positive, got " + partitions);
        }
        return Math.floorMod(aggregateId.hashCode(), partitions);
    }
}
