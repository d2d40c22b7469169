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

package org.sequent.retry;

import java.time.Duration;

/**
 * Information about the attempt that just failed with a retryable error.
 *
 * @param attemptNumber The number of the failed attempt, starting at 1
 * @param maxAttempts   The configured max attempts
 * @param backoff       The time that will be waited before the next attempt
 */
public record RetryInfo(int attemptNumber, MaxAttempts maxAttempts, Duration backoff) {

    public int retryCount() {
        return attemptNumber - 1;
    }
}
