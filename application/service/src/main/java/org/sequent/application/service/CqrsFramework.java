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

import org.sequent.domain.Aggregate;
import org.sequent.domain.Aggregate.Decision;
import org.sequent.domain.DomainEvent;
import org.sequent.dsl.view.Query;
import org.sequent.eventstore.api.AggregateContext;
import org.sequent.eventstore.api.EventEnvelope;
import org.sequent.eventstore.api.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static java.util.Objects.requireNonNull;

/**
 * An {@link ApplicationService} that loads an aggregate instance, lets it decide a command, appends the new events
 * with the loaded sequence as concurrency token and dispatches the committed events to every registered {@link Query}.
 * <p>
 * A conflicting append is not retried here, wrap the framework in a {@link RetryingApplicationService} for that.
 * Queries are dispatched exactly once per commit and a failing query never fails the command.
 *
 * @param <C>   The command type of the aggregate
 * @param <S>   The state of the aggregate
 * @param <E>   The event type of the aggregate
 * @param <SVC> The services passed to the aggregate when it handles a command
 */
public class CqrsFramework<C, S, E extends DomainEvent, SVC> implements ApplicationService<C, S, E> {
    private static final Logger log = LoggerFactory.getLogger(CqrsFramework.class);

    private final FrameworkConfiguration<C, S, E, SVC> configuration;

    public CqrsFramework(FrameworkConfiguration<C, S, E, SVC> configuration) {
        this.configuration = requireNonNull(configuration, FrameworkConfiguration.class.getSimpleName() + " cannot be null");
    }

    @Override
    public CommandResult<S, E> execute(String aggregateId, C command, Map<String, String> metadata) {
        requireNonNull(aggregateId, "aggregateId cannot be null");
        requireNonNull(command, "command cannot be null");
        requireNonNull(metadata, "metadata cannot be null");

        Aggregate<C, S, E, SVC> aggregate = configuration.aggregate();
        EventStore<S, E> eventStore = configuration.eventStore();

        AggregateContext<S> context = eventStore.load(aggregateId);
        Decision<S, E> decision = aggregate.decide(context.state(), command, configuration.services());
        if (decision.events().isEmpty()) {
            log.debug("{} resulted in no events for {} with id {}", command.getClass().getSimpleName(), aggregate.aggregateType(), aggregateId);
            return new CommandResult<>(aggregateId, context.sequence(), context.state(), List.of());
        }

        eventStore.validate(context, decision.events());
        List<EventEnvelope<E>> committed = eventStore.append(context, decision.events(), metadata);
        long sequence = context.sequence() + committed.size();
        log.debug("{} committed {} events to {} with id {}, now at sequence {}", command.getClass().getSimpleName(), committed.size(), aggregate.aggregateType(), aggregateId, sequence);

        dispatch(aggregateId, committed);
        return new CommandResult<>(aggregateId, sequence, decision.state(), committed);
    }

    @Override
    public CompletableFuture<CommandResult<S, E>> executeAsync(String aggregateId, C command, Map<String, String> metadata) {
        return CompletableFuture.supplyAsync(() -> execute(aggregateId, command, metadata), configuration.executor());
    }

    private void dispatch(String aggregateId, List<EventEnvelope<E>> committed) {
        for (Query<E> query : configuration.queries()) {
            try {
                query.dispatch(aggregateId, committed);
            } catch (RuntimeException e) {
                log.error("Query {} failed to handle {} events of {} with id {}", query.getClass().getName(), committed.size(), configuration.aggregate().aggregateType(), aggregateId, e);
            }
        }
    }
}
