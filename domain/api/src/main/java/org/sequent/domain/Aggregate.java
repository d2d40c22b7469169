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

package org.sequent.domain;

import org.jspecify.annotations.NullMarked;
import org.sequent.domain.error.UserErrorException;

import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * The state machine of an aggregate: a pure decision function from command and state to new events,
 * and a pure fold step applying one event to the state.
 *
 * @param <C>   The type of commands that the aggregate can handle
 * @param <S>   The state that the aggregate works on
 * @param <E>   The type of events that the aggregate returns
 * @param <SVC> Read-only services that {@link #handle(Object, Object, Object)} may consult, use {@link Void} if none are needed
 */
@NullMarked
public interface Aggregate<C, S, E extends DomainEvent, SVC> {

    /**
     * @return The name of this kind of aggregate, unique in the whole system. Used as a partition key.
     */
    String aggregateType();

    S initialState();

    /**
     * Decide which events a command results in, given the current state. Must not mutate {@code state}.
     *
     * @return The new events in the order they should be applied, possibly empty.
     * @throws UserErrorException If the command is rejected by a business rule.
     */
    List<E> handle(C command, S state, SVC services);

    /**
     * Apply an event to the state. This is a historical fact and can never be refused.
     */
    S apply(S state, E event);

    default S fold(S state, List<? extends E> events) {
        S current = state;
        for (E event : events) {
            current = apply(current, event);
        }
        return current;
    }

    default S replay(List<? extends E> events) {
        return fold(initialState(), events);
    }

    default Decision<S, E> decide(S state, C command, SVC services) {
        List<E> newEvents = List.copyOf(handle(command, state, services));
        return new Decision<>(fold(state, newEvents), newEvents);
    }

    record Decision<S, E>(S state, List<E> events) {
    }

    @FunctionalInterface
    interface CommandHandler<C, S, E, SVC> {
        List<E> handle(C command, S state, SVC services);
    }

    static <C, S, E extends DomainEvent, SVC> Aggregate<C, S, E, SVC> create(String aggregateType, S initialState, CommandHandler<C, S, E, SVC> handle, BiFunction<S, E, S> apply) {
        Objects.requireNonNull(aggregateType, "aggregateType cannot be null");
        Objects.requireNonNull(initialState, "initialState cannot be null");
        Objects.requireNonNull(handle, "handle cannot be null");
        Objects.requireNonNull(apply, "apply cannot be null");
        return new Aggregate<>() {
            @Override
            public String aggregateType() {
                return aggregateType;
            }

            @Override
            public S initialState() {
                return initialState;
            }

            @Override
            public List<E> handle(C command, S state, SVC services) {
                return handle.handle(command, state, services);
            }

            @Override
            public S apply(S state, E event) {
                return apply.apply(state, event);
            }
        };
    }
}
