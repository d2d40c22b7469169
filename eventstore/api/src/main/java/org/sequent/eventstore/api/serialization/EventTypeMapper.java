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

/**
 * Maps the stored name of an event back to the class it is deserialized into.
 *
 * @param <E> The event type
 */
@FunctionalInterface
public interface EventTypeMapper<E> {

    /**
     * @throws EventSerializationException If {@code eventType} is not known
     */
    Class<? extends E> eventClass(String eventType);
}
