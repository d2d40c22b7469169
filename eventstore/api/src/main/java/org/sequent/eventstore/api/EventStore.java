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
import org.sequent.domain.error.CommandValidationException;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Ordered, optimistically locked append and load of events for the instances of one aggregate type.
 *
 * @param <S> The state of the aggregate
 * @param <E> The event type of the aggregate
 */
public interface EventStore<S, E> {

    String aggregateType();

    /**
     * Replay the events of an aggregate instance, from a snapshot if a usable one exists.
     *
     * @return The current state and sequence. An instance without events has sequence 0 and the initial state.
     */
    AggregateContext<S> load(String aggregateId);

    List<EventEnvelope<E>> loadEvents(String aggregateId);

    /**
     * Check that {@code events} can be committed in one go after {@code context}, without touching the backend.
     *
     * @throws CommandValidationException If the events exceed the limits of the backend
     */
    void validate(AggregateContext<S> context, List<E> events);

    /**
     * Append {@code events} after the sequence of {@code context}, writing a snapshot in the same commit if one is due.
     *
     * @throws AggregateConflictException  If another writer appended after {@code context} was loaded
     * @throws CommandValidationException If the events exceed the limits of the backend
     */
    List<EventEnvelope<E>> append(AggregateContext<S> context, List<E> events, Map<String, String> metadata);

    /**
     * Append {@code events} after {@code expectedSequence} without writing a snapshot.
     */
    List<EventEnvelope<E>> append(String aggregateId, long expectedSequence, List<E> events, Map<String, String> metadata);

    /**
     * @return Every event of the aggregate type, ordered by sequence within each instance. Must be closed by the caller.
     */
    Stream<EventEnvelope<E>> streamAllEvents();
}
