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

package org.sequent.domain;

/**
 * An immutable fact describing a state change that already happened to an aggregate.
 * <p>
 * Events of an aggregate form a closed set, typically modelled as records implementing a sealed interface that extends this one.
 */
public interface DomainEvent {

    /**
     * @return The name the event is stored under. Defaults to the simple name of the implementing class.
     */
    default String eventType() {
        return getClass().getSimpleName();
    }

    /**
     * @return The semantic version of the payload shape, for example {@code "1.0"} or {@code "2.1.0"}.
     */
    String eventVersion();
}
