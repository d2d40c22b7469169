/*
 *
 *  Copyright 2024 Johan Haleby
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package org.sequent.domain.error;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * The expected sequence did not match the stored sequence, so nothing was written.
 * This is an optimistic locking failure, reloading and re-deciding the command is the appropriate reaction.
 */
public final class AggregateConflictException extends AggregateException {
    public final String aggregateType;
    public final String aggregateId;
    public final long expectedSequence;

    public AggregateConflictException(String aggregateType, String aggregateId, long expectedSequence) {
        this(aggregateType, aggregateId, expectedSequence, String.format("%s with id %s was modified concurrently, expected sequence %d is no longer current", aggregateType, aggregateId, expectedSequence));
    }

    public AggregateConflictException(String aggregateType, String aggregateId, long expectedSequence, String message) {
        super(message);
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.expectedSequence = expectedSequence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregateConflictException)) return false;
        AggregateConflictException that = (AggregateConflictException) o;
        return expectedSequence == that.expectedSequence && Objects.equals(aggregateType, that.aggregateType) && Objects.equals(aggregateId, that.aggregateId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateType, aggregateId, expectedSequence);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", AggregateConflictException.class.getSimpleName() + "[", "]")
                .add("aggregateType='" + aggregateType + "'")
                .add("aggregateId='" + aggregateId + "'")
                .add("expectedSequence=" + expectedSequence)
                .toString();
    }
}
