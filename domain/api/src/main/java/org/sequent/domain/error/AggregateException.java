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

/**
 * Base class of every error that can be the outcome of executing a command.
 * The subclasses form a closed set so that callers can tell a rejected request apart from an unavailable system.
 */
public abstract sealed class AggregateException extends RuntimeException
        permits UserErrorException, AggregateConflictException, TechnicalException, CommandValidationException {

    AggregateException(String message) {
        super(message);
    }

    AggregateException(String message, Throwable cause) {
        super(message, cause);
    }
}
