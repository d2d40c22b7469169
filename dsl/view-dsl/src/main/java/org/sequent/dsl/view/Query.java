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

import java.util.List;

/**
 * Receives the envelopes of every successful commit, in commit order. Anything a query throws is logged by the
 * caller and never affects the commit or the other queries.
 *
 * @param <E> The event type of the aggregate
 */
@FunctionalInterface
public interface Query<E> {

    void dispatch(String aggregateId, List<EventEnvelope<E>> events);
}
