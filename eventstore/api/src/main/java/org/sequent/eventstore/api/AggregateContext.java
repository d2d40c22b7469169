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

package org.sequent.eventstore.api;

import java.util.Objects;

/**
 * The result of loading an aggregate instance. {@code sequence} is the concurrency token to use when appending.
 *
 * @param sequence        The number of events folded into {@code state}, 0 for a new instance
 * @param currentSnapshot The generation of the snapshot last written for this instance, 0 if none
 */
public record AggregateContext<S>(String aggregateType, String aggregateId, S state, long sequence, long currentSnapshot) {
    public AggregateContext {
        Objects.requireNonNull(aggregateType, "aggregateType cannot be null");
        Objects.requireNonNull(aggregateId, "aggregateId cannot be null");
        Objects.requireNonNull(state, "state cannot be null");
    }

    public AggregateContext<S> advance(S newState, long newSequence, long newCurrentSnapshot) {
        return new AggregateContext<>(aggregateType, aggregateId, newState, newSequence, newCurrentSnapshot);
    }
}
