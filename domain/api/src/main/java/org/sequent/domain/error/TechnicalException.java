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

import java.util.Objects;

/**
 * The store or the serialization layer misbehaved. Carries the underlying cause when there is one.
 */
public non-sealed class TechnicalException extends AggregateException {
    public final Kind kind;

    public enum Kind {
        CONNECTION, DESERIALIZATION, UNEXPECTED
    }

    public TechnicalException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, Kind.class.getSimpleName() + " cannot be null");
    }

    public TechnicalException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, Kind.class.getSimpleName() + " cannot be null");
    }

    public static TechnicalException unexpected(Throwable cause) {
        return new TechnicalException(Kind.UNEXPECTED, cause.getMessage() == null ? cause.getClass().getName() : cause.getMessage(), cause);
    }

    public Kind kind() {
        return kind;
    }
}
