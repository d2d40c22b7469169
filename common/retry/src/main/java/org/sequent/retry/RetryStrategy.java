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

import org.jspecify.annotations.NullMarked;
import org.sequent.retry.internal.RetryImpl;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static org.sequent.retry.internal.RetryExecution.executeWithRetry;

/**
 * Retry strategy to use if an action throws an exception.
 * <p>
 * A {@code RetryStrategy} is thread-safe and immutable, every configuration method returns a new instance:
 * <pre>
 * RetryStrategy retryStrategy = RetryStrategy.fixed(200).maxAttempts(5);
 * retryStrategy.execute(() -> applicationService.execute(id, command));
 * </pre>
 */
@NullMarked
public interface RetryStrategy {
    /**
     * Create a retry strategy that retries on every {@link RuntimeException}, forever, without backoff.
     * Narrow it down with {@link Retry#maxAttempts(int)}, {@link Retry#retryIf(Predicate)} and {@link Retry#backoff(Backoff)}.
     */
    static Retry retry() {
        return new RetryImpl();
    }

    /**
     * @return A retry strategy that doesn't retry at all.
     */
    static DontRetry none() {
        return DontRetry.INSTANCE;
    }

    /**
     * Shortcut for {@code RetryStrategy.retry().backoff(Backoff.exponential(initial, max, multiplier))}.
     *
     * @param initial    The initial wait time before retrying the first time
     * @param max        Max wait time
     * @param multiplier Multiplier between retries
     * @return A retry strategy with exponential backoff
     */
    static Retry exponentialBackoff(Duration initial, Duration max, double multiplier) {
        return retry().backoff(Backoff.exponential(initial, max, multiplier));
    }

    static Retry fixed(Duration duration) {
        return retry().backoff(Backoff.fixed(duration));
    }

    static Retry fixed(long millis) {
        return retry().backoff(Backoff.fixed(millis));
    }

    /**
     * Execute a {@link Supplier} with the configured retry settings.
     * Rethrows the exception from the supplier if the retry strategy is exhausted or the exception is not retryable.
     *
     * @param supplier The supplier to execute
     * @return The result of the supplier, if successful.
     */
    default <T> T execute(Supplier<T> supplier) {
        Objects.requireNonNull(supplier, Supplier.class.getSimpleName() + " cannot be null");
        return executeWithRetry(supplier, this);
    }

    /**
     * Execute a {@link Runnable} with the configured retry settings.
     *
     * @param runnable The runnable to execute
     */
    default void execute(Runnable runnable) {
        Objects.requireNonNull(runnable, Runnable.class.getSimpleName() + " cannot be null");
        executeWithRetry(() -> {
            runnable.run();
            return null;
        }, this);
    }

    /**
     * A retry strategy that doesn't retry at all. Just rethrows the exception.
     */
    final class DontRetry implements RetryStrategy {
        private static final DontRetry INSTANCE = new DontRetry();

        private DontRetry() {
        }

        @Override
        public String toString() {
            return DontRetry.class.getSimpleName();
        }
    }

    interface Retry extends RetryStrategy {
        /**
         * @param backoff The backoff to use between attempts.
         * @return A new instance of {@link Retry} with the backoff applied.
         */
        Retry backoff(Backoff backoff);

        /**
         * Retry an infinite number of times (this is default).
         */
        Retry infiniteAttempts();

        /**
         * Limit the number of attempts, the first attempt included. {@code maxAttempts(1)} means no retries.
         */
        Retry maxAttempts(int maxAttempts);

        /**
         * Only retry if the exception matches the predicate. All other exceptions are rethrown immediately.
         */
        Retry retryIf(Predicate<Throwable> retryPredicate);

        /**
         * Register a listener that is invoked each time a retryable error occurs, before the backoff is applied.
         */
        Retry onRetryableError(BiConsumer<RetryInfo, Throwable> listener);
    }
}
