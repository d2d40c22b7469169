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

import org.jspecify.annotations.Nullable;
import org.sequent.domain.error.AggregateConflictException;
import org.sequent.domain.error.TechnicalException;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * The storage adapter that a backend implements. The rest of the library only depends on this interface.
 * <p>
 * All operations may throw {@link TechnicalException} if the backend is unavailable or misbehaves.
 */
public interface EventRepository {

    /**
     * @return All events of the aggregate instance in ascending sequence order, empty if it has none.
     */
    List<SerializedEvent> loadEvents(String aggregateType, String aggregateId);

    /**
     * @return The events with a sequence greater than {@code sequence}, in ascending order.
     */
    List<SerializedEvent> loadEventsAfter(String aggregateType, String aggregateId, long sequence);

    Optional<SerializedSnapshot> loadSnapshot(String aggregateType, String aggregateId);

    /**
     * Atomically write {@code events} and, if present, {@code snapshot}. Either everything is written or nothing is.
     *
     * @param expectedSequence The sequence the caller loaded, the events must have sequence {@code expectedSequence + 1 ..}
     * @return The committed events
     * @throws AggregateConflictException If the stored sequence is not {@code expectedSequence}
     */
    List<SerializedEvent> commit(String aggregateType, String aggregateId, long expectedSequence, List<SerializedEvent> events, @Nullable SerializedSnapshot snapshot);

    /**
     * @return Every event of every instance of {@code aggregateType}, ordered by sequence within each instance.
     * The stream must be closed by the caller.
     */
    Stream<SerializedEvent> streamAllEvents(String aggregateType);
}
