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

import org.sequent.dsl.view.Query;
import org.sequent.eventstore.api.EventEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Logs every committed event at info level.
 */
public class LoggingQuery<E> implements Query<E> {
    private static final Logger log = LoggerFactory.getLogger(LoggingQuery.class);

    @Override
    public void dispatch(String aggregateId, List<EventEnvelope<E>> events) {
        for (EventEnvelope<E> event : events) {
            log.info("{} with id {} committed {} (version {}) at sequence {}: {}", event.aggregateType(), aggregateId, event.eventType(),
                    event.eventVersion(), event.sequence(), event.payload());
        }
    }
}
