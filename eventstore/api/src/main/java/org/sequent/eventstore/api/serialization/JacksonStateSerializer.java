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

package org.sequent.eventstore.api.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import static java.util.Objects.requireNonNull;

public class JacksonStateSerializer<S> implements StateSerializer<S> {
    private final ObjectMapper objectMapper;
    private final Class<S> stateType;

    public JacksonStateSerializer(ObjectMapper objectMapper, Class<S> stateType) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        requireNonNull(stateType, "stateType cannot be null");
        this.objectMapper = objectMapper;
        this.stateType = stateType;
    }

    @Override
    public JsonNode serialize(S state) {
        try {
            return objectMapper.valueToTree(state);
        } catch (IllegalArgumentException e) {
            throw new EventSerializationException("Failed to serialize state of type " + stateType.getName(), e);
        }
    }

    @Override
    public S deserialize(JsonNode state) {
        try {
            return objectMapper.treeToValue(state, stateType);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventSerializationException("Failed to deserialize state into " + stateType.getName(), e);
        }
    }
}
