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

package org.sequent.application.service;

import org.sequent.domain.error.AggregateConflictException;
import org.sequent.retry.RetryStrategy;
import org.sequent.retry.RetryStrategy.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

import static java.util.Objects.requireNonNull;

/**
 * An {@link ApplicationService} that executes the command again if it lost a race against a concurrent command on the
 * same aggregate instance. Each attempt reloads the instance and decides the command from scratch. Only
 * {@link AggregateConflictException} is retried by the default {@link RetryStrategy}.
 *
 * @param <C> The command type of the aggregate
 * @param <S> The state of the aggregate
 * @param <E> The event type of the aggregate
 */
public class RetryingApplicationService<C, S, E> implements ApplicationService<C, S, E> {
    private static final Logger log = LoggerFactory.getLogger(RetryingApplicationService.class);

    private final ApplicationService<C, S, E> delegate;
    private final RetryStrategy retryStrategy;
    private final Executor executor;

    /**
     * Create a RetryingApplicationService that uses exponential backoff starting with 100 ms and progressively goes up to max 2 seconds
     * wait time between each retry, if {@link AggregateConflictException} is caught. It gives up after 5 attempts, rethrowing the conflict.
     */
    public RetryingApplicationService(ApplicationService<C, S, E> delegate) {
        this(delegate, defaultRetryStrategy());
    }

    public RetryingApplicationService(ApplicationService<C, S, E> delegate, RetryStrategy retryStrategy) {
        this(delegate, retryStrategy, ForkJoinPool.commonPool());
    }

    public RetryingApplicationService(ApplicationService<C, S, E> delegate, RetryStrategy retryStrategy, Executor executor) {
        this.delegate = requireNonNull(delegate, ApplicationService.class.getSimpleName() + " cannot be null");
        this.retryStrategy = requireNonNull(retryStrategy, RetryStrategy.class.getSimpleName() + " cannot be null");
        this.executor = requireNonNull(executor, Executor.class.getSimpleName() + " cannot be null");
    }

    @Override
    public CommandResult<S, E> execute(String aggregateId, C command, Map<String, String> metadata) {
        return retryStrategy.execute(() -> delegate.execute(aggregateId, command, metadata));
    }

    @Override
    public CompletableFuture<CommandResult<S, E>> executeAsync(String aggregateId, C command, Map<String, String> metadata) {
        return CompletableFuture.supplyAsync(() -> execute(aggregateId, command, metadata), executor);
    }

    /**
     * @return The default {@link RetryStrategy} using exponential backoff starting with 100 ms and progressively going up to max 2 seconds wait time
     * if {@link AggregateConflictException} is caught. It will only make 5 attempts before giving up, rethrowing the conflict.
     */
    public static Retry defaultRetryStrategy() {
        return RetryStrategy.exponentialBackoff(Duration.ofMillis(100), Duration.ofSeconds(2), 2.0)
                .maxAttempts(5)
                .retryIf(AggregateConflictException.class::isInstance)
                .onRetryableError((info, e) -> log.info("Conflicting command, retrying (attempt {} of {})", info.attemptNumber(), info.maxAttempts()));
    }
}
