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

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.LongRange;

import static org.assertj.core.api.Assertions.assertThat;

class SnapshotStrategyTest {

    @Property
    void every_n_events_snapshots_exactly_when_a_multiple_of_n_is_reached_or_passed(@ForAll @IntRange(min = 1, max = 50) int n,
                                                                                    @ForAll @LongRange(max = 1000) long previousSequence,
                                                                                    @ForAll @IntRange(min = 1, max = 30) int eventCount) {
        // Given
        SnapshotStrategy strategy = SnapshotStrategy.everyNEvents(n);
        long newSequence = previousSequence + eventCount;

        // When
        boolean shouldSnapshot = strategy.shouldSnapshot(previousSequence, newSequence);

        // Then
        boolean crossesMultiple = false;
        for (long sequence = previousSequence + 1; sequence <= newSequence; sequence++) {
            if (sequence % n == 0) {
                crossesMultiple = true;
            }
        }
        assertThat(shouldSnapshot).isEqualTo(crossesMultiple);
    }

    @Property
    void none_never_snapshots(@ForAll @LongRange(max = 1000) long previousSequence, @ForAll @IntRange(min = 1, max = 30) int eventCount) {
        assertThat(SnapshotStrategy.none().shouldSnapshot(previousSequence, previousSequence + eventCount)).isFalse();
    }
}
