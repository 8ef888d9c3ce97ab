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

package org.elasticsoftware.behaviors.log;

import org.elasticsoftware.behaviors.BehaviorsException;

public class SequenceMismatchException extends BehaviorsException {
    private final long expectedSequenceNumber;
    private final long actualSequenceNumber;

    public SequenceMismatchException(String aggregateName, String aggregateId, long expectedSequenceNumber, long actualSequenceNumber) {
        super("Expected sequence number " + expectedSequenceNumber + " for " + aggregateName + " " + aggregateId
                + " but found " + actualSequenceNumber, aggregateName, aggregateId);
        this.expectedSequenceNumber = expectedSequenceNumber;
        this.actualSequenceNumber = actualSequenceNumber;
    }

    public long getExpectedSequenceNumber() {
        return expectedSequenceNumber;
    }

    public long getActualSequenceNumber() {
        return actualSequenceNumber;
    }
}
