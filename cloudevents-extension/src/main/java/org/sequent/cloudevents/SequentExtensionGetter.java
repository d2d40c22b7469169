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

package org.sequent.cloudevents;

import io.cloudevents.CloudEvent;

import static org.sequent.cloudevents.SequentCloudEventExtension.AGGREGATE_ID;
import static org.sequent.cloudevents.SequentCloudEventExtension.AGGREGATE_SEQUENCE;
import static org.sequent.cloudevents.SequentCloudEventExtension.AGGREGATE_TYPE;
import static org.sequent.cloudevents.SequentCloudEventExtension.EVENT_VERSION;

/**
 * Utility class that helps get sequent extension values, and converts them to the correct type, from a {@link CloudEvent}.
 */
public class SequentExtensionGetter {

    private SequentExtensionGetter() {
    }

    public static String getAggregateType(CloudEvent cloudEvent) {
        return getString(cloudEvent, AGGREGATE_TYPE);
    }

    public static String getAggregateId(CloudEvent cloudEvent) {
        return getString(cloudEvent, AGGREGATE_ID);
    }

    public static String getEventVersion(CloudEvent cloudEvent) {
        return getString(cloudEvent, EVENT_VERSION);
    }

    /**
     * Get the sequence from a {@link CloudEvent} that has {@link SequentCloudEventExtension} applied.
     *
     * @param cloudEvent The cloud event
     * @return the position of the event in the log of its aggregate instance
     */
    public static long getSequence(CloudEvent cloudEvent) {
        if (!cloudEvent.getExtensionNames().contains(AGGREGATE_SEQUENCE)) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain the " + AGGREGATE_SEQUENCE + " key");
        }

        Object sequence = cloudEvent.getExtension(AGGREGATE_SEQUENCE);
        if (!(sequence instanceof Long)) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain a " + AGGREGATE_SEQUENCE + " value that is an instance of " + long.class.getSimpleName());
        }
        return (long) sequence;
    }

    private static String getString(CloudEvent cloudEvent, String key) {
        if (!cloudEvent.getExtensionNames().contains(key)) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain the " + key + " key");
        }

        Object value = cloudEvent.getExtension(key);
        if (!(value instanceof String)) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain a " + key + " value that is an instance of " + String.class.getSimpleName());
        }
        return (String) value;
    }
}
