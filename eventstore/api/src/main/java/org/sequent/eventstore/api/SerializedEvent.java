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

package org.sequent.eventstore.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Objects;

/**
 * The persisted form of an {@link EventEnvelope}, one row in the event log keyed by {@code (aggregateType, aggregateId, sequence)}.
 */
public record SerializedEvent(String aggregateType, String aggregateId, long sequence, String eventType, String eventVersion, JsonNode payload,
                              Map<String, String> metadata) {
    public SerializedEvent {
        Objects.requireNonNull(aggregateType, "aggregateType cannot be null");
        Objects.requireNonNull(aggregateId, "aggregateId cannot be null");
        Objects.requireNonNull(eventType, "eventType cannot be null");
        Objects.requireNonNull(eventVersion, "eventVersion cannot be null");
        Objects.requireNonNull(payload, "payload cannot be null");
        metadata = EventEnvelope.orderedCopy(metadata);
    }

    public SerializedEvent withPayload(String eventVersion, JsonNode payload) {
        return new SerializedEvent(aggregateType, aggregateId, sequence, eventType, eventVersion, payload, metadata);
    }
}
