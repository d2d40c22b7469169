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
import org.sequent.domain.Aggregate;
import org.sequent.domain.DomainEvent;
import org.sequent.domain.error.AggregateException;
import org.sequent.domain.error.TechnicalException;
import org.sequent.eventstore.api.serialization.EventSerializationException;
import org.sequent.eventstore.api.serialization.EventSerializer;
import org.sequent.eventstore.api.serialization.StateSerializer;
import org.sequent.eventstore.api.upcasting.EventUpcasterChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;
import static org.sequent.domain.error.TechnicalException.Kind.UNEXPECTED;

/**
 * An {@link EventStore} on top of an {@link EventRepository}. Events are upcasted and deserialized when loaded,
 * and serialized and checked against the {@link BackendLimits} before they are committed.
 * <p>
 * Snapshots are only used if a {@link StateSerializer} is configured. A snapshot is written in the same commit as the
 * events whenever the {@link SnapshotStrategy} says so.
 *
 * @param <S> The state of the aggregate
 * @param <E> The event type of the aggregate
 */
public class PersistedEventStore<S, E extends DomainEvent> implements EventStore<S, E> {
    private static final Logger log = LoggerFactory.getLogger(PersistedEventStore.class);

    private final Aggregate<?, S, E, ?> aggregate;
    private final EventRepository repository;
    private final EventSerializer<E> eventSerializer;
    private final @Nullable StateSerializer<S> stateSerializer;
    private final EventUpcasterChain upcasterChain;
    private final SnapshotStrategy snapshotStrategy;
    private final BackendLimits backendLimits;

    private PersistedEventStore(Builder<S, E> builder) {
        this.aggregate = builder.aggregate;
        this.repository = builder.repository;
        this.eventSerializer = builder.eventSerializer;
        this.stateSerializer = builder.stateSerializer;
        this.upcasterChain = builder.upcasterChain;
        this.snapshotStrategy = builder.stateSerializer == null ? SnapshotStrategy.none() : builder.snapshotStrategy;
        this.backendLimits = builder.backendLimits;
    }

    public static <S, E extends DomainEvent> Builder<S, E> builder(Aggregate<?, S, E, ?> aggregate, EventRepository repository, EventSerializer<E> eventSerializer) {
        return new Builder<>(aggregate, repository, eventSerializer);
    }

    @Override
    public String aggregateType() {
        return aggregate.aggregateType();
    }

    @Override
    public AggregateContext<S> load(String aggregateId) {
        requireNonNull(aggregateId, "aggregateId cannot be null");
        Optional<SerializedSnapshot> snapshot = stateSerializer == null ? Optional.empty() : call(() -> repository.loadSnapshot(aggregateType(), aggregateId));
        if (snapshot.isPresent()) {
            Optional<AggregateContext<S>> fromSnapshot = loadFromSnapshot(snapshot.get());
            if (fromSnapshot.isPresent()) {
                return fromSnapshot.get();
            }
        }
        long currentSnapshot = snapshot.map(SerializedSnapshot::currentSnapshot).orElse(0L);
        List<SerializedEvent> events = call(() -> repository.loadEvents(aggregateType(), aggregateId));
        requireGapless(aggregateId, events, 1);
        S state = aggregate.fold(aggregate.initialState(), payloads(events));
        log.debug("Loaded {} with id {} at sequence {} by replaying {} events", aggregateType(), aggregateId, events.size(), events.size());
        return new AggregateContext<>(aggregateType(), aggregateId, state, events.size(), currentSnapshot);
    }

    private Optional<AggregateContext<S>> loadFromSnapshot(SerializedSnapshot snapshot) {
        String aggregateId = snapshot.aggregateId();
        final S snapshotState;
        try {
            snapshotState = requireNonNull(stateSerializer).deserialize(snapshot.state());
        } catch (EventSerializationException e) {
            log.warn("Discarding snapshot {} of {} with id {}, replaying all events instead", snapshot.currentSnapshot(), aggregateType(), aggregateId, e);
            return Optional.empty();
        }
        long lastSequence = snapshot.lastSequence();
        List<SerializedEvent> tail;
        if (lastSequence > 0) {
            // The event at lastSequence is loaded as well, a snapshot may only cover events that are in the log
            List<SerializedEvent> covered = call(() -> repository.loadEventsAfter(aggregateType(), aggregateId, lastSequence - 1));
            if (covered.isEmpty() || covered.get(0).sequence() != lastSequence) {
                log.warn("Discarding snapshot {} of {} with id {} since the event log does not contain sequence {}", snapshot.currentSnapshot(), aggregateType(), aggregateId, lastSequence);
                return Optional.empty();
            }
            tail = covered.subList(1, covered.size());
        } else {
            tail = call(() -> repository.loadEventsAfter(aggregateType(), aggregateId, lastSequence));
        }
        if (!tail.isEmpty() && tail.get(0).sequence() != lastSequence + 1) {
            log.warn("Discarding snapshot {} of {} with id {} since the event log does not continue at sequence {}", snapshot.currentSnapshot(), aggregateType(), aggregateId, snapshot.lastSequence() + 1);
            return Optional.empty();
        }
        requireGapless(aggregateId, tail, snapshot.lastSequence() + 1);
        S state = aggregate.fold(snapshotState, payloads(tail));
        long sequence = snapshot.lastSequence() + tail.size();
        log.debug("Loaded {} with id {} at sequence {} from snapshot at sequence {} and {} events", aggregateType(), aggregateId, sequence, snapshot.lastSequence(), tail.size());
        return Optional.of(new AggregateContext<>(aggregateType(), aggregateId, state, sequence, snapshot.currentSnapshot()));
    }

    @Override
    public List<EventEnvelope<E>> loadEvents(String aggregateId) {
        requireNonNull(aggregateId, "aggregateId cannot be null");
        List<SerializedEvent> events = call(() -> repository.loadEvents(aggregateType(), aggregateId));
        requireGapless(aggregateId, events, 1);
        List<EventEnvelope<E>> envelopes = new ArrayList<>(events.size());
        for (SerializedEvent event : events) {
            envelopes.add(deserialize(event));
        }
        return Collections.unmodifiableList(envelopes);
    }

    @Override
    public void validate(AggregateContext<S> context, List<E> events) {
        requireNonNull(context, AggregateContext.class.getSimpleName() + " cannot be null");
        requireNonNull(events, "events cannot be null");
        backendLimits.validateEventCount(events.size(), isSnapshotDue(context.sequence(), events.size()));
    }

    @Override
    public List<EventEnvelope<E>> append(AggregateContext<S> context, List<E> events, Map<String, String> metadata) {
        validate(context, events);
        if (events.isEmpty()) {
            return List.of();
        }
        long newSequence = context.sequence() + events.size();
        SerializedSnapshot snapshot = isSnapshotDue(context.sequence(), events.size()) ? snapshot(context, events, newSequence) : null;
        return commit(context.aggregateId(), context.sequence(), events, metadata, snapshot);
    }

    @Override
    public List<EventEnvelope<E>> append(String aggregateId, long expectedSequence, List<E> events, Map<String, String> metadata) {
        requireNonNull(aggregateId, "aggregateId cannot be null");
        requireNonNull(events, "events cannot be null");
        if (expectedSequence < 0) {
            throw new IllegalArgumentException("expectedSequence cannot be negative");
        }
        backendLimits.validateEventCount(events.size(), false);
        if (events.isEmpty()) {
            return List.of();
        }
        return commit(aggregateId, expectedSequence, events, metadata, null);
    }

    @Override
    public Stream<EventEnvelope<E>> streamAllEvents() {
        return call(() -> repository.streamAllEvents(aggregateType())).map(this::deserialize);
    }

    private List<EventEnvelope<E>> commit(String aggregateId, long expectedSequence, List<E> events, @Nullable Map<String, String> metadata, @Nullable SerializedSnapshot snapshot) {
        Map<String, String> safeMetadata = metadata == null ? Map.of() : metadata;
        List<SerializedEvent> serializedEvents = new ArrayList<>(events.size());
        for (int i = 0; i < events.size(); i++) {
            E event = requireNonNull(events.get(i), "Event cannot be null");
            SerializedEvent serialized = new SerializedEvent(aggregateType(), aggregateId, expectedSequence + i + 1, event.eventType(), event.eventVersion(),
                    eventSerializer.serialize(event), safeMetadata);
            backendLimits.validatePayloadSize(i, eventSerializer.sizeInBytes(serialized.payload()));
            serializedEvents.add(serialized);
        }

        List<SerializedEvent> committed = call(() -> repository.commit(aggregateType(), aggregateId, expectedSequence, serializedEvents, snapshot));
        log.debug("Committed {} events to {} with id {} after sequence {}{}", committed.size(), aggregateType(), aggregateId, expectedSequence,
                snapshot == null ? "" : " together with snapshot " + snapshot.currentSnapshot());

        List<EventEnvelope<E>> envelopes = new ArrayList<>(committed.size());
        for (int i = 0; i < committed.size(); i++) {
            SerializedEvent c = committed.get(i);
            envelopes.add(new EventEnvelope<>(c.aggregateType(), c.aggregateId(), c.sequence(), c.eventType(), c.eventVersion(), events.get(i), c.metadata()));
        }
        return Collections.unmodifiableList(envelopes);
    }

    private boolean isSnapshotDue(long sequence, int eventCount) {
        return eventCount > 0 && snapshotStrategy.shouldSnapshot(sequence, sequence + eventCount);
    }

    // A commit never fails because its snapshot could not be created
    private @Nullable SerializedSnapshot snapshot(AggregateContext<S> context, List<E> events, long newSequence) {
        try {
            S newState = aggregate.fold(context.state(), events);
            return new SerializedSnapshot(aggregateType(), context.aggregateId(), newSequence, context.currentSnapshot() + 1, requireNonNull(stateSerializer).serialize(newState));
        } catch (EventSerializationException e) {
            log.warn("Skipping snapshot of {} with id {} at sequence {}", aggregateType(), context.aggregateId(), newSequence, e);
            return null;
        }
    }

    private List<E> payloads(List<SerializedEvent> events) {
        List<E> payloads = new ArrayList<>(events.size());
        for (SerializedEvent event : events) {
            payloads.add(deserialize(event).payload());
        }
        return payloads;
    }

    private EventEnvelope<E> deserialize(SerializedEvent stored) {
        SerializedEvent event = upcasterChain.upcast(stored);
        E payload = eventSerializer.deserialize(event.eventType(), event.payload());
        return new EventEnvelope<>(event.aggregateType(), event.aggregateId(), event.sequence(), event.eventType(), event.eventVersion(), payload, event.metadata());
    }

    private void requireGapless(String aggregateId, List<SerializedEvent> events, long firstSequence) {
        long expected = firstSequence;
        for (SerializedEvent event : events) {
            if (event.sequence() != expected) {
                throw new TechnicalException(UNEXPECTED, String.format("Event log of %s with id %s is corrupt, expected sequence %d but found %d", aggregateType(), aggregateId, expected, event.sequence()));
            }
            expected++;
        }
    }

    private static <T> T call(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (AggregateException e) {
            throw e;
        } catch (RuntimeException e) {
            throw TechnicalException.unexpected(e);
        }
    }

    public static final class Builder<S, E extends DomainEvent> {
        private final Aggregate<?, S, E, ?> aggregate;
        private final EventRepository repository;
        private final EventSerializer<E> eventSerializer;
        private @Nullable StateSerializer<S> stateSerializer;
        private EventUpcasterChain upcasterChain = EventUpcasterChain.empty();
        private SnapshotStrategy snapshotStrategy = SnapshotStrategy.none();
        private BackendLimits backendLimits = BackendLimits.unlimited();

        private Builder(Aggregate<?, S, E, ?> aggregate, EventRepository repository, EventSerializer<E> eventSerializer) {
            this.aggregate = requireNonNull(aggregate, Aggregate.class.getSimpleName() + " cannot be null");
            this.repository = requireNonNull(repository, EventRepository.class.getSimpleName() + " cannot be null");
            this.eventSerializer = requireNonNull(eventSerializer, EventSerializer.class.getSimpleName() + " cannot be null");
        }

        public Builder<S, E> upcasters(EventUpcasterChain upcasterChain) {
            this.upcasterChain = requireNonNull(upcasterChain, EventUpcasterChain.class.getSimpleName() + " cannot be null");
            return this;
        }

        public Builder<S, E> snapshots(StateSerializer<S> stateSerializer, SnapshotStrategy snapshotStrategy) {
            this.stateSerializer = requireNonNull(stateSerializer, StateSerializer.class.getSimpleName() + " cannot be null");
            this.snapshotStrategy = requireNonNull(snapshotStrategy, SnapshotStrategy.class.getSimpleName() + " cannot be null");
            return this;
        }

        public Builder<S, E> backendLimits(BackendLimits backendLimits) {
            this.backendLimits = requireNonNull(backendLimits, BackendLimits.class.getSimpleName() + " cannot be null");
            return this;
        }

        public PersistedEventStore<S, E> build() {
            return new PersistedEventStore<>(this);
        }
    }
}
