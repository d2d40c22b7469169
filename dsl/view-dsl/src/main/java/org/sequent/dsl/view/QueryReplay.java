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

package org.sequent.dsl.view;

import org.sequent.eventstore.api.EventEnvelope;
import org.sequent.eventstore.api.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Dispatches already committed events to a {@link Query} again, for example to build a new view or to catch up
 * a view that missed a dispatch. The query receives the full log, so the views it writes to should be empty.
 *
 * @param <E> The event type of the aggregate
 */
public class QueryReplay<E> {
    private static final Logger log = LoggerFactory.getLogger(QueryReplay.class);

    private final EventStore<?, E> eventStore;
    private final Query<E> query;

    public QueryReplay(EventStore<?, E> eventStore, Query<E> query) {
        this.eventStore = requireNonNull(eventStore, EventStore.class.getSimpleName() + " cannot be null");
        this.query = requireNonNull(query, Query.class.getSimpleName() + " cannot be null");
    }

    /**
     * @return The number of replayed events
     */
    public int replay(String aggregateId) {
        List<EventEnvelope<E>> events = eventStore.loadEvents(aggregateId);
        if (!events.isEmpty()) {
            query.dispatch(aggregateId, events);
        }
        log.info("Replayed {} events of {} with id {}", events.size(), eventStore.aggregateType(), aggregateId);
        return events.size();
    }

    /**
     * Replay every instance of the aggregate type, one dispatch per instance.
     *
     * @return The number of replayed events
     */
    public long replayAll() {
        long count = 0;
        List<EventEnvelope<E>> batch = new ArrayList<>();
        try (Stream<EventEnvelope<E>> events = eventStore.streamAllEvents()) {
            for (EventEnvelope<E> event : (Iterable<EventEnvelope<E>>) events::iterator) {
                if (!batch.isEmpty() && !batch.get(0).aggregateId().equals(event.aggregateId())) {
                    dispatch(batch);
                    batch = new ArrayList<>();
                }
                batch.add(event);
                count++;
            }
        }
        if (!batch.isEmpty()) {
            dispatch(batch);
        }
        log.info("Replayed {} events of {}", count, eventStore.aggregateType());
        return count;
    }

    private void dispatch(List<EventEnvelope<E>> batch) {
        query.dispatch(batch.get(0).aggregateId(), List.copyOf(batch));
    }
}
