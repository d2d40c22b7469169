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

import org.sequent.eventstore.api.EventEnvelope;

import java.util.List;
import java.util.Objects;

/**
 * The outcome of a successfully executed command.
 *
 * @param aggregateId The id of the aggregate instance
 * @param sequence    The sequence of the instance after the command, unchanged if no events were produced
 * @param state       The state of the instance after the command
 * @param events      The committed events, empty if the command produced none
 */
public record CommandResult<S, E>(String aggregateId, long sequence, S state, List<EventEnvelope<E>> events) {
    public CommandResult {
        Objects.requireNonNull(aggregateId, "aggregateId cannot be null");
        Objects.requireNonNull(state, "state cannot be null");
        events = List.copyOf(events);
    }

    public boolean hasEvents() {
        return !events.isEmpty();
    }
}
