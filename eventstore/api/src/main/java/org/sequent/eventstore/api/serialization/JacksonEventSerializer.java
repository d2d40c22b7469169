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

/**
 * An {@link EventSerializer} that uses a Jackson {@link ObjectMapper} to convert events to JSON.
 *
 * @param <E> The event type
 */
public class JacksonEventSerializer<E> implements EventSerializer<E> {
    private final ObjectMapper objectMapper;
    private final EventTypeMapper<E> eventTypeMapper;

    public JacksonEventSerializer(ObjectMapper objectMapper, EventTypeMapper<E> eventTypeMapper) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        requireNonNull(eventTypeMapper, EventTypeMapper.class.getSimpleName() + " cannot be null");
        this.objectMapper = objectMapper;
        this.eventTypeMapper = eventTypeMapper;
    }

    /**
     * Create a serializer for the events of a sealed hierarchy, see {@link ReflectionEventTypeMapper#sealed(Class)}.
     */
    public static <E> JacksonEventSerializer<E> forSealedHierarchy(ObjectMapper objectMapper, Class<E> root) {
        return new JacksonEventSerializer<>(objectMapper, ReflectionEventTypeMapper.sealed(root));
    }

    @Override
    public JsonNode serialize(E event) {
        requireNonNull(event, "Event cannot be null");
        try {
            return objectMapper.valueToTree(event);
        } catch (IllegalArgumentException e) {
            throw new EventSerializationException("Failed to serialize " + event.getClass().getName(), e);
        }
    }

    @Override
    public E deserialize(String eventType, JsonNode payload) {
        Class<? extends E> eventClass = eventTypeMapper.eventClass(eventType);
        try {
            return objectMapper.treeToValue(payload, eventClass);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventSerializationException("Failed to deserialize event of type " + eventType + " into " + eventClass.getName(), e);
        }
    }

    @Override
    public int sizeInBytes(JsonNode payload) {
        try {
            return objectMapper.writeValueAsBytes(payload).length;
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to write event payload", e);
        }
    }
}
