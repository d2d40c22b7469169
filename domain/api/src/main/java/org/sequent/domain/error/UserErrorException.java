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
 * Thrown by an aggregate when a command violates a business rule. Never retried automatically.
 */
public final class UserErrorException extends AggregateException {
    public final UserErrorPayload payload;

    public UserErrorException(String error) {
        this(UserErrorPayload.of(error));
    }

    public UserErrorException(String error, Map<String, String> params) {
        this(new UserErrorPayload(error, params));
    }

    public UserErrorException(UserErrorPayload payload) {
        super(Objects.requireNonNull(payload, UserErrorPayload.class.getSimpleName() + " cannot be null").error());
        this.payload = payload;
    }

    public UserErrorPayload payload() {
        return payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UserErrorException)) return false;
        UserErrorException that = (UserErrorException) o;
        return payload.equals(that.payload);
    }

    @Override
    public int hashCode() {
        return payload.hashCode();
    }

    @Override
    public String toString() {
        return UserErrorException.class.getSimpleName() + "[" + payload + "]";
    }
}
