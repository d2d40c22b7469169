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

import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * An {@link EventTypeMapper} that uses reflection to find the event class.
 * <ul>
 *     <li>{@link #sealed(Class)} maps the simple name of every concrete class in a sealed hierarchy, which matches the default
 *     {@link org.sequent.domain.DomainEvent#eventType()}.</li>
 *     <li>{@link #qualified()} expects the stored event type to be a fully qualified class name.</li>
 * </ul>
 *
 * @param <E> The event type
 */
public class ReflectionEventTypeMapper<E> implements EventTypeMapper<E> {
    private final Map<String, Class<? extends E>> eventClasses;
    private final boolean qualified;

    private ReflectionEventTypeMapper(Map<String, Class<? extends E>> eventClasses, boolean qualified) {
        this.eventClasses = Map.copyOf(eventClasses);
        this.qualified = qualified;
    }

    @SuppressWarnings("unchecked")
    public static <E> ReflectionEventTypeMapper<E> sealed(Class<E> root) {
        Objects.requireNonNull(root, "root cannot be null");
        if (!root.isSealed()) {
            throw new IllegalArgumentException(root.getName() + " is not sealed");
        }
        Map<String, Class<? extends E>> eventClasses = new HashMap<>();
        Deque<Class<?>> toVisit = new ArrayDeque<>();
        toVisit.push(root);
        while (!toVisit.isEmpty()) {
            Class<?> current = toVisit.pop();
            if (current.isSealed()) {
                for (Class<?> permitted : current.getPermittedSubclasses()) {
                    toVisit.push(permitted);
                }
            }
            if (!current.isInterface() && !Modifier.isAbstract(current.getModifiers())) {
                Class<?> existing = eventClasses.put(current.getSimpleName(), (Class<? extends E>) current);
                if (existing != null && !existing.equals(current)) {
                    throw new IllegalArgumentException("Event type " + current.getSimpleName() + " is defined by both " + existing.getName() + " and " + current.getName());
                }
            }
        }
        return new ReflectionEventTypeMapper<>(eventClasses, false);
    }

    public static <E> ReflectionEventTypeMapper<E> qualified() {
        return new ReflectionEventTypeMapper<>(Map.of(), true);
    }

    /**
     * @return A new mapper that also maps {@code eventType} to {@code eventClass}, for events that override {@code eventType()}.
     */
    public ReflectionEventTypeMapper<E> withEventType(String eventType, Class<? extends E> eventClass) {
        Map<String, Class<? extends E>> copy = new HashMap<>(eventClasses);
        copy.put(eventType, eventClass);
        return new ReflectionEventTypeMapper<>(copy, qualified);
    }

    @SuppressWarnings("unchecked")
    @Override
    public Class<? extends E> eventClass(String eventType) {
        Class<? extends E> eventClass = eventClasses.get(eventType);
        if (eventClass != null) {
            return eventClass;
        }
        if (qualified) {
            try {
                return (Class<? extends E>) Class.forName(eventType);
            } catch (ClassNotFoundException e) {
                throw new EventSerializationException("Cannot find class for event type " + eventType, e);
            }
        }
        throw new EventSerializationException("Unknown event type " + eventType);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ReflectionEventTypeMapper.class.getSimpleName() + "[", "]")
                .add("eventTypes=" + eventClasses.keySet())
                .add("qualified=" + qualified)
                .toString();
    }
}
