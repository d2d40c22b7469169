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

package org.sequent.eventstore.api;

/**
 * Decides whether a commit should also write a snapshot of the post-commit state.
 */
@FunctionalInterface
public interface SnapshotStrategy {

    /**
     * @param previousSequence The sequence before the commit
     * @param newSequence      The sequence after the commit
     */
    boolean shouldSnapshot(long previousSequence, long newSequence);

    static SnapshotStrategy none() {
        return (previousSequence, newSequence) -> false;
    }

    /**
     * Snapshot whenever a commit reaches or passes a multiple of {@code n} events.
     */
    static SnapshotStrategy everyNEvents(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("n must be greater than 0");
        }
        return (previousSequence, newSequence) -> newSequence / n > previousSequence / n;
    }
}
