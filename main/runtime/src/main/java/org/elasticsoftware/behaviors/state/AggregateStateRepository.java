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

package org.elasticsoftware.behaviors.state;

import org.elasticsoftware.behaviors.aggregate.AggregateState;

import java.io.Closeable;

public interface AggregateStateRepository<S extends AggregateState> extends Closeable {
    /**
     * @return the latest snapshot, or {@code null} if this repository does not know the aggregate
     */
    AggregateStateRecord<S> get(String aggregateId);

    void put(AggregateStateRecord<S> record);

    void remove(String aggregateId);

    @Override
    void close();
}
