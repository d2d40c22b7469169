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

package org.sequent.eventstore.api.upcasting;

import org.sequent.eventstore.api.SerializedEvent;
import org.sequent.eventstore.api.serialization.EventSerializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * An ordered list of {@link EventUpcaster}s. Each pass applies every matching upcaster from left to right, and passes are
 * repeated until a pass changes nothing or {@code maxPasses} is reached.
 */
public class EventUpcasterChain {
    private static final Logger log = LoggerFactory.getLogger(EventUpcasterChain.class);
    private static final int DEFAULT_MAX_PASSES = 10;
    private static final EventUpcasterChain EMPTY = new EventUpcasterChain(List.of(), DEFAULT_MAX_PASSES);

    private final List<EventUpcaster> upcasters;
    private final int maxPasses;

    public EventUpcasterChain(List<EventUpcaster> upcasters, int maxPasses) {
        Objects.requireNonNull(upcasters, "upcasters cannot be null");
        if (maxPasses < 1) {
            throw new IllegalArgumentException("maxPasses must be greater than 0");
        }
        this.upcasters = List.copyOf(upcasters);
        this.maxPasses = maxPasses;
    }

    public static EventUpcasterChain empty() {
        return EMPTY;
    }

    public static EventUpcasterChain of(EventUpcaster... upcasters) {
        return new EventUpcasterChain(Arrays.asList(upcasters), DEFAULT_MAX_PASSES);
    }

    public EventUpcasterChain maxPasses(int maxPasses) {
        return new EventUpcasterChain(upcasters, maxPasses);
    }

    /**
     * @return The upcasted event, or {@code event} itself if no upcaster matches.
     * @throws EventSerializationException If an upcaster fails
     */
    public SerializedEvent upcast(SerializedEvent event) {
        if (upcasters.isEmpty()) {
            return event;
        }
        SerializedEvent current = event;
        for (int pass = 1; pass <= maxPasses; pass++) {
            boolean changed = false;
            for (EventUpcaster upcaster : upcasters) {
                if (upcaster.canUpcast(current.eventType(), current.eventVersion())) {
                    current = apply(upcaster, current);
                    changed = true;
                }
            }
            if (!changed) {
                return current;
            }
        }
        log.warn("Upcasting of {} version {} (aggregate {}/{}, sequence {}) did not settle after {} passes, using version {}",
                event.eventType(), event.eventVersion(), event.aggregateType(), event.aggregateId(), event.sequence(), maxPasses, current.eventVersion());
        return current;
    }

    private static SerializedEvent apply(EventUpcaster upcaster, SerializedEvent event) {
        try {
            SerializedEvent upcasted = Objects.requireNonNull(upcaster.upcast(event), "Upcaster returned null");
            log.trace("Upcasted {} from version {} to {} using {}", event.eventType(), event.eventVersion(), upcasted.eventVersion(), upcaster);
            return upcasted;
        } catch (RuntimeException e) {
            throw new EventSerializationException(String.format("Failed to upcast %s version %s of %s/%s at sequence %d", event.eventType(), event.eventVersion(),
                    event.aggregateType(), event.aggregateId(), event.sequence()), e);
        }
    }

    public boolean isEmpty() {
        return upcasters.isEmpty();
    }
}
