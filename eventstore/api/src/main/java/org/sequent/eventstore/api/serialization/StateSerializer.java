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

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Converts aggregate state to and from the JSON payload of a snapshot.
 *
 * @param <S> The state type
 */
public interface StateSerializer<S> {

    JsonNode serialize(S state);

    S deserialize(JsonNode state);
}
