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

import java.util.Objects;

/**
 * A cached replay checkpoint. Never authoritative, it can always be discarded and rebuilt from the event log.
 *
 * @param lastSequence    The sequence of the last event folded into {@code state}
 * @param currentSnapshot Generation counter, incremented each time a new snapshot replaces the previous one
 */
public record SerializedSnapshot(String aggregateType, String aggregateId, long lastSequence, long currentSnapshot, JsonNode state) {
    public SerializedSnapshot {
        Objects.requireNonNull(aggregateType, "aggregateType cannot be null");
        Objects.requireNonNull(aggregateId, "aggregateId cannot be null");
        Objects.requireNonNull(state, "state cannot be null");
    }
}
