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

import org.sequent.domain.error.AggregateConflictException;
import org.sequent.domain.error.CommandValidationException;
import org.sequent.domain.error.TechnicalException;
import org.sequent.domain.error.UserErrorException;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Executes commands against the instances of one aggregate type.
 *
 * @param <C> The command type of the aggregate
 * @param <S> The state of the aggregate
 * @param <E> The event type of the aggregate
 */
public interface ApplicationService<C, S, E> {

    /**
     * Load the aggregate instance, decide the command, append the new events and dispatch them to the registered queries.
     *
     * @param aggregateId The id of the aggregate instance, an instance without events is created implicitly
     * @param command     The command
     * @param metadata    Metadata stored with every new event
     * @return The outcome of the command
     * @throws UserErrorException          If the command was rejected by a business rule
     * @throws AggregateConflictException If another command was committed to the same instance in the meantime
     * @throws CommandValidationException If the new events cannot be committed in one go
     * @throws TechnicalException          If the event store failed
     */
    CommandResult<S, E> execute(String aggregateId, C command, Map<String, String> metadata);

    default CommandResult<S, E> execute(String aggregateId, C command) {
        return execute(aggregateId, command, Map.of());
    }

    /**
     * Same as {@link #execute(String, Object, Map)} but runs asynchronously. The returned future completes exceptionally
     * with the exceptions that {@code execute} would throw.
     */
    CompletableFuture<CommandResult<S, E>> executeAsync(String aggregateId, C command, Map<String, String> metadata);

    default CompletableFuture<CommandResult<S, E>> executeAsync(String aggregateId, C command) {
        return executeAsync(aggregateId, command, Map.of());
    }
}
