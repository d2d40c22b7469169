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

package org.sequent.application.service;

import org.jspecify.annotations.Nullable;
import org.sequent.domain.Aggregate;
import org.sequent.domain.DomainEvent;
import org.sequent.dsl.view.Query;
import org.sequent.eventstore.api.EventStore;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

import static java.util.Objects.requireNonNull;

/**
 * Everything a {@link CqrsFramework} needs, built once at startup.
 *
 * @param <C>   The command type of the aggregate
 * @param <S>   The state of the aggregate
 * @param <E>   The event type of the aggregate
 * @param <SVC> The services passed to the aggregate when it handles a command
 */
public final class FrameworkConfiguration<C, S, E extends DomainEvent, SVC> {
    private final Aggregate<C, S, E, SVC> aggregate;
    private final EventStore<S, E> eventStore;
    private final List<Query<E>> queries;
    private final @Nullable SVC services;
    private final Executor executor;

    private FrameworkConfiguration(Builder<C, S, E, SVC> builder) {
        this.aggregate = builder.aggregate;
        this.eventStore = builder.eventStore;
        this.queries = List.copyOf(builder.queries);
        this.services = builder.services;
        this.executor = builder.executor;
    }

    public static <C, S, E extends DomainEvent, SVC> Builder<C, S, E, SVC> builder(Aggregate<C, S, E, SVC> aggregate, EventStore<S, E> eventStore) {
        return new Builder<>(aggregate, eventStore);
    }

    public Aggregate<C, S, E, SVC> aggregate() {
        return aggregate;
    }

    public EventStore<S, E> eventStore() {
        return eventStore;
    }

    public List<Query<E>> queries() {
        return queries;
    }

    public @Nullable SVC services() {
        return services;
    }

    public Executor executor() {
        return executor;
    }

    public static final class Builder<C, S, E extends DomainEvent, SVC> {
        private final Aggregate<C, S, E, SVC> aggregate;
        private final EventStore<S, E> eventStore;
        private final List<Query<E>> queries = new ArrayList<>();
        private @Nullable SVC services;
        private Executor executor = ForkJoinPool.commonPool();

        private Builder(Aggregate<C, S, E, SVC> aggregate, EventStore<S, E> eventStore) {
            this.aggregate = requireNonNull(aggregate, Aggregate.class.getSimpleName() + " cannot be null");
            this.eventStore = requireNonNull(eventStore, EventStore.class.getSimpleName() + " cannot be null");
            if (!aggregate.aggregateType().equals(eventStore.aggregateType())) {
                throw new IllegalArgumentException(String.format("Aggregate type %s doesn't match the aggregate type of the event store (%s)", aggregate.aggregateType(), eventStore.aggregateType()));
            }
        }

        /**
         * Register a query. Queries receive the committed events in the order they are registered.
         */
        public Builder<C, S, E, SVC> query(Query<E> query) {
            queries.add(requireNonNull(query, Query.class.getSimpleName() + " cannot be null"));
            return this;
        }

        public Builder<C, S, E, SVC> queries(List<? extends Query<E>> queries) {
            requireNonNull(queries, "queries cannot be null").forEach(this::query);
            return this;
        }

        /**
         * @param services Passed to the aggregate when it handles a command, leave unset if the aggregate uses {@link Void}
         */
        public Builder<C, S, E, SVC> services(SVC services) {
            this.services = requireNonNull(services, "services cannot be null");
            return this;
        }

        /**
         * @param executor Runs {@link ApplicationService#executeAsync(String, Object, java.util.Map)}, defaults to the common fork join pool
         */
        public Builder<C, S, E, SVC> executor(Executor executor) {
            this.executor = requireNonNull(executor, Executor.class.getSimpleName() + " cannot be null");
            return this;
        }

        public FrameworkConfiguration<C, S, E, SVC> build() {
            return new FrameworkConfiguration<>(this);
        }
    }
}
