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

import org.sequent.domain.error.AggregateConflictException;
import org.sequent.eventstore.api.EventEnvelope;
import org.sequent.eventstore.api.VersionedView;
import org.sequent.eventstore.api.ViewRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * A {@link Query} that materializes a {@link View} into a {@link ViewRepository}. Each delivered envelope is applied to the
 * row of its view id and the row is written back with an optimistic version check. A conflicting write is retried by
 * reloading the row and applying the envelopes again, at most {@code maxAttempts} times in total.
 * <p>
 * Failures never leave {@link #dispatch(String, List)}, they are logged and handed to the {@link QueryErrorHandler}.
 *
 * @param <V> The read model type
 * @param <E> The event type of the aggregate
 */
public class GenericQuery<V, E> implements Query<E> {
    private static final Logger log = LoggerFactory.getLogger(GenericQuery.class);
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    private final View<V, E> view;
    private final ViewRepository<V> repository;
    private final Function<EventEnvelope<E>, String> viewIdMapper;
    private final QueryErrorHandler errorHandler;
    private final int maxAttempts;

    private GenericQuery(Builder<V, E> builder) {
        this.view = builder.view;
        this.repository = builder.repository;
        this.viewIdMapper = builder.viewIdMapper;
        this.errorHandler = builder.errorHandler;
        this.maxAttempts = builder.maxAttempts;
    }

    public static <V, E> GenericQuery<V, E> create(View<V, E> view, ViewRepository<V> repository) {
        return builder(view, repository).build();
    }

    public static <V, E> Builder<V, E> builder(View<V, E> view, ViewRepository<V> repository) {
        return new Builder<>(view, repository);
    }

    @Override
    public void dispatch(String aggregateId, List<EventEnvelope<E>> events) {
        Map<String, List<EventEnvelope<E>>> eventsByViewId = new LinkedHashMap<>();
        for (EventEnvelope<E> event : events) {
            final String viewId;
            try {
                viewId = requireNonNull(viewIdMapper.apply(event), "viewId cannot be null");
            } catch (RuntimeException e) {
                handleError(aggregateId, e);
                return;
            }
            eventsByViewId.computeIfAbsent(viewId, __ -> new ArrayList<>()).add(event);
        }
        eventsByViewId.forEach(this::updateView);
    }

    public Optional<V> load(String viewId) {
        return loadVersioned(viewId).map(VersionedView::view);
    }

    public Optional<VersionedView<V>> loadVersioned(String viewId) {
        requireNonNull(viewId, "viewId cannot be null");
        return repository.load(viewId);
    }

    private void updateView(String viewId, List<EventEnvelope<E>> events) {
        for (int attempt = 1; ; attempt++) {
            try {
                VersionedView<V> current = repository.load(viewId).orElseGet(() -> new VersionedView<>(viewId, 0, view.initialState()));
                V updated = view.update(current.view(), events);
                repository.write(new VersionedView<>(viewId, current.version() + events.size(), updated), current.version());
                log.debug("Updated view {} to version {}", viewId, current.version() + events.size());
                return;
            } catch (AggregateConflictException e) {
                if (attempt >= maxAttempts) {
                    handleError(viewId, e);
                    return;
                }
                log.debug("View {} was updated concurrently, reloading (attempt {} of {})", viewId, attempt, maxAttempts);
            } catch (RuntimeException e) {
                handleError(viewId, e);
                return;
            }
        }
    }

    private void handleError(String viewId, RuntimeException e) {
        log.error("Failed to update view {}", viewId, e);
        try {
            errorHandler.onError(viewId, e);
        } catch (RuntimeException handlerError) {
            log.error("Error handler failed for view {}", viewId, handlerError);
        }
    }

    public static final class Builder<V, E> {
        private final View<V, E> view;
        private final ViewRepository<V> repository;
        private Function<EventEnvelope<E>, String> viewIdMapper = EventEnvelope::aggregateId;
        private QueryErrorHandler errorHandler = QueryErrorHandler.ignore();
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;

        private Builder(View<V, E> view, ViewRepository<V> repository) {
            this.view = requireNonNull(view, View.class.getSimpleName() + " cannot be null");
            this.repository = requireNonNull(repository, ViewRepository.class.getSimpleName() + " cannot be null");
        }

        /**
         * @param viewIdMapper Derives the view id from an envelope, defaults to the aggregate id
         */
        public Builder<V, E> viewId(Function<EventEnvelope<E>, String> viewIdMapper) {
            this.viewIdMapper = requireNonNull(viewIdMapper, "viewIdMapper cannot be null");
            return this;
        }

        public Builder<V, E> errorHandler(QueryErrorHandler errorHandler) {
            this.errorHandler = requireNonNull(errorHandler, QueryErrorHandler.class.getSimpleName() + " cannot be null");
            return this;
        }

        public Builder<V, E> maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be greater than 0");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public GenericQuery<V, E> build() {
            return new GenericQuery<>(this);
        }
    }
}
