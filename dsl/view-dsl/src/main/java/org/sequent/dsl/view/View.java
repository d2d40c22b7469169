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

import org.jspecify.annotations.NonNull;
import org.sequent.eventstore.api.EventEnvelope;

import java.util.List;
import java.util.function.BiFunction;

/**
 * A read model that is updated from committed events
 *
 * @param <V> The type of the read model that this view produces
 * @param <E> The type of the event that is used to update the read model
 */
public interface View<V, E> {
    /**
     * @return The read model used when no row exists for a view id
     */
    V initialState();

    /**
     * Update the read model with a committed event
     *
     * @param view  The current read model
     * @param event The event, with its aggregate id and sequence
     * @return The updated read model
     */
    V update(V view, @NonNull EventEnvelope<E> event);

    default V update(V view, @NonNull List<EventEnvelope<E>> events) {
        V current = view;
        for (EventEnvelope<E> event : events) {
            current = update(current, event);
        }
        return current;
    }

    /**
     * Update the initial state from events
     *
     * @return The updated read model
     */
    default V update(@NonNull List<EventEnvelope<E>> events) {
        return update(initialState(), events);
    }

    static <V, E> View<V, E> create(V initialState, @NonNull BiFunction<V, EventEnvelope<E>, V> update) {
        return new View<>() {
            @Override
            public V initialState() {
                return initialState;
            }

            @Override
            public V update(V view, @NonNull EventEnvelope<E> event) {
                return update.apply(view, event);
            }
        };
    }
}
