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

import org.sequent.domain.error.AggregateConflictException;

import java.util.Optional;

/**
 * Storage of read model rows, one table per view type keyed by view id.
 *
 * @param <V> The read model type
 */
public interface ViewRepository<V> {

    Optional<VersionedView<V>> load(String viewId);

    /**
     * Write {@code view} if the stored version is still {@code expectedVersion}. An absent row has version 0.
     *
     * @throws AggregateConflictException If the row was written by someone else since it was loaded. The exception is shared
     *                                     with aggregates, so {@code aggregateType} holds the view name, {@code aggregateId} the
     *                                     view id and {@code expectedSequence} the expected version.
     */
    void write(VersionedView<V> view, long expectedVersion);
}
