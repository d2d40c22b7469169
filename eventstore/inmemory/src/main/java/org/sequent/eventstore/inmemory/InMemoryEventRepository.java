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

package org.sequent.eventstore.inmemory;

import org.jspecify.annotations.Nullable;
import org.sequent.domain.error.AggregateConflictException;
import org.sequent.eventstore.api.EventRepository;
import org.sequent.eventstore.api.SerializedEvent;
import org.sequent.eventstore.api.SerializedSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * This is an {@link EventRepository} that stores events in-memory. This is mainly useful for testing and/or demo purposes.
 * <p>
 * A commit replaces the stored list of an aggregate instance in a single {@code compute} call, which makes the
 * expected sequence check and the write one atomic step.
 */
public class InMemoryEventRepository implements EventRepository {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventRepository.class);

    // We cannot use ConcurrentMap since it doesn't maintain insertion order
    private final Map<StreamKey, StoredStream> state = Collections.synchronizedMap(new LinkedHashMap<>());

    private final Consumer<List<SerializedEvent>> listener;

    public InMemoryEventRepository() {
        // @formatter:off
        this(__ -> {});
        // @formatter:on
    }

    /**
     * @param listener A listener that will be invoked after events have been committed (synchronously!)
     */
    public InMemoryEventRepository(Consumer<List<SerializedEvent>> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.listener = listener;
    }

    @Override
    public List<SerializedEvent> loadEvents(String aggregateType, String aggregateId) {
        return loadEventsAfter(aggregateType, aggregateId, 0);
    }

    @Override
    public List<SerializedEvent> loadEventsAfter(String aggregateType, String aggregateId, long sequence) {
        StoredStream stream = state.get(new StreamKey(aggregateType, aggregateId));
        if (stream == null || sequence >= stream.events().size()) {
            return List.of();
        }
        return List.copyOf(stream.events().subList((int) Math.max(0, sequence), stream.events().size()));
    }

    @Override
    public Optional<SerializedSnapshot> loadSnapshot(String aggregateType, String aggregateId) {
        StoredStream stream = state.get(new StreamKey(aggregateType, aggregateId));
        return stream == null ? Optional.empty() : Optional.ofNullable(stream.snapshot());
    }

    @Override
    public List<SerializedEvent> commit(String aggregateType, String aggregateId, long expectedSequence, List<SerializedEvent> events, @Nullable SerializedSnapshot snapshot) {
        requireNonNull(events, "events cannot be null");
        requireConsecutive(aggregateType, aggregateId, expectedSequence, events);

        StreamKey key = new StreamKey(aggregateType, aggregateId);
        AtomicReference<List<SerializedEvent>> committed = new AtomicReference<>(List.of());
        state.compute(key, (__, current) -> {
            long currentSequence = current == null ? 0 : current.events().size();
            if (currentSequence != expectedSequence) {
                log.debug("Rejecting commit of {} events to {} with id {}, expected sequence {} but stream is at {}", events.size(), aggregateType, aggregateId, expectedSequence, currentSequence);
                throw new AggregateConflictException(aggregateType, aggregateId, expectedSequence,
                        String.format("%s with id %s is at sequence %d but expected sequence was %d", aggregateType, aggregateId, currentSequence, expectedSequence));
            }
            List<SerializedEvent> newEvents = new ArrayList<>();
            if (current != null) {
                newEvents.addAll(current.events());
            }
            newEvents.addAll(events);
            committed.set(List.copyOf(events));
            SerializedSnapshot newSnapshot = snapshot == null && current != null ? current.snapshot() : snapshot;
            return new StoredStream(Collections.unmodifiableList(newEvents), newSnapshot);
        });

        List<SerializedEvent> result = committed.get();
        log.debug("Committed {} events to {} with id {} after sequence {} (snapshot written: {})", result.size(), aggregateType, aggregateId, expectedSequence, snapshot != null);
        if (!result.isEmpty()) {
            listener.accept(result);
        }
        return result;
    }

    @Override
    public Stream<SerializedEvent> streamAllEvents(String aggregateType) {
        List<StoredStream> streams;
        synchronized (state) {
            streams = state.entrySet().stream()
                    .filter(entry -> entry.getKey().aggregateType().equals(aggregateType))
                    .map(Map.Entry::getValue)
                    .toList();
        }
        return streams.stream().flatMap(stream -> stream.events().stream());
    }

    /**
     * Delete all events and the snapshot of an aggregate instance. The instance starts over at sequence 0.
     */
    public void deleteEventStream(String aggregateType, String aggregateId) {
        state.remove(new StreamKey(aggregateType, aggregateId));
    }

    /**
     * Replace the snapshot of an aggregate instance, bypassing the commit. Meant for tests that need to simulate a broken cache.
     */
    public void replaceSnapshot(SerializedSnapshot snapshot) {
        requireNonNull(snapshot, SerializedSnapshot.class.getSimpleName() + " cannot be null");
        state.computeIfPresent(new StreamKey(snapshot.aggregateType(), snapshot.aggregateId()), (__, current) -> new StoredStream(current.events(), snapshot));
    }

    private static void requireConsecutive(String aggregateType, String aggregateId, long expectedSequence, List<SerializedEvent> events) {
        long sequence = expectedSequence;
        for (SerializedEvent event : events) {
            sequence++;
            if (event.sequence() != sequence || !event.aggregateType().equals(aggregateType) || !event.aggregateId().equals(aggregateId)) {
                throw new IllegalArgumentException(String.format("Event %s/%s at sequence %d cannot be committed to %s/%s as sequence %d",
                        event.aggregateType(), event.aggregateId(), event.sequence(), aggregateType, aggregateId, sequence));
            }
        }
    }

    private record StreamKey(String aggregateType, String aggregateId) {
        private StreamKey {
            requireNonNull(aggregateType, "aggregateType cannot be null");
            requireNonNull(aggregateId, "aggregateId cannot be null");
        }
    }

    private record StoredStream(List<SerializedEvent> events, @Nullable SerializedSnapshot snapshot) {
    }
}
