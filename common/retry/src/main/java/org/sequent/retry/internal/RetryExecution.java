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

package org.sequent.retry.internal;

import org.sequent.retry.Backoff;
import org.sequent.retry.RetryInfo;
import org.sequent.retry.RetryStrategy;
import org.sequent.retry.RetryStrategy.DontRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Iterator;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Internal class for executing functions with retry capability. Never use this class directly from your own code!
 */
public class RetryExecution {
    private static final Logger log = LoggerFactory.getLogger(RetryExecution.class);

    public static <T> T executeWithRetry(Supplier<T> supplier, RetryStrategy retryStrategy) {
        if (retryStrategy instanceof DontRetry) {
            return supplier.get();
        }
        RetryImpl retry = (RetryImpl) retryStrategy;
        Iterator<Long> delay = convertToDelayStream(retry.backoff);
        int currentAttempt = 1;
        for (; ; ) {
            Duration backoff = Duration.ofMillis(delay.next());
            try {
                return supplier.get();
            } catch (RuntimeException e) {
                if (retry.maxAttempts.isExhausted(currentAttempt) || !retry.retryPredicate.test(e)) {
                    throw e;
                }
                log.debug("Attempt {} failed with {}, retrying in {} ms", currentAttempt, e.getClass().getSimpleName(), backoff.toMillis());
                retry.retryableErrorListener.accept(new RetryInfo(currentAttempt, retry.maxAttempts, backoff), e);
                sleep(backoff, e);
                currentAttempt++;
            }
        }
    }

    private static void sleep(Duration backoff, RuntimeException cause) {
        long millis = backoff.toMillis();
        if (millis <= 0) {
            return;
        }
        try {
            TimeUnit.MILLISECONDS.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            cause.addSuppressed(ie);
            throw cause;
        }
    }

    private static Iterator<Long> convertToDelayStream(Backoff backoff) {
        final Stream<Long> delay;
        if (backoff instanceof Backoff.None) {
            delay = Stream.iterate(0L, __ -> 0L);
        } else if (backoff instanceof Backoff.Fixed) {
            long millis = ((Backoff.Fixed) backoff).millis;
            delay = Stream.iterate(millis, __ -> millis);
        } else if (backoff instanceof Backoff.Exponential strategy) {
            long initialMillis = strategy.initial.toMillis();
            long maxMillis = strategy.max.toMillis();
            double multiplier = strategy.multiplier;
            delay = Stream.iterate(initialMillis, current -> Math.min(maxMillis, Math.round(current * multiplier)));
        } else {
            throw new IllegalStateException("Invalid backoff: " + backoff.getClass().getName());
        }
        return delay.iterator();
    }
}
