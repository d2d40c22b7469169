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

package org.sequent.domain.error;

import java.util.Map;
import java.util.Objects;

/**
 * Application-defined description of why a command was rejected.
 *
 * @param error  A short error message, for example {@code "funds not available"}
 * @param params Additional parameters describing the error
 */
public record UserErrorPayload(String error, Map<String, String> params) {
    public UserErrorPayload {
        Objects.requireNonNull(error, "error cannot be null");
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public static UserErrorPayload of(String error) {
        return new UserErrorPayload(error, Map.of());
    }
}
