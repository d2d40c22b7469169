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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A committed event together with its position in the log of an aggregate instance.
 *
 * @param aggregateType The type of the aggregate the event belongs to
 * @param aggregateId   The id of the aggregate instance
 * @param sequence      1-based position of the event in the log of the aggregate instance
 * @param eventType     The stored name of the event
 * @param eventVersion  The semantic version of the payload
 * @param payload       The event
 * @param metadata      Ordered, unmodifiable metadata supplied when the event was appended
 * @param <E>           The event type
 */
public record EventEnvelope<E>(String aggregateType, String aggregateId, long sequence, String eventType, String eventVersion, E payload,
                               Map<String, String> metadata) {
    public EventEnvelope {
        Objects.requireNonNull(aggregateType, "aggregateType cannot be null");
        Objects.requireNonNull(aggregateId, "aggregateId cannot be null");
        Objects.requireNonNull(eventType, "eventType cannot be null");
        Objects.requireNonNull(eventVersion, "eventVersion cannot be null");
        Objects.requireNonNull(payload, "payload cannot be null");
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be greater than 0");
        }
        metadata = orderedCopy(metadata);
    }

    static Map<String, String> orderedCopy(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
