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
import io.cloudevents.CloudEventExtension;
import io.cloudevents.CloudEventExtensions;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A {@link CloudEvent} {@link CloudEventExtension} that tells where a committed event belongs. These are:<br><br>
 *
 * <table>
 *     <tr><th>Key</th><th>Description</th></tr>
 *     <tr><td>{@value #AGGREGATE_TYPE}</td><td>The type of the aggregate that emitted the event</td></tr>
 *     <tr><td>{@value #AGGREGATE_ID}</td><td>The id of the aggregate instance</td></tr>
 *     <tr><td>{@value #AGGREGATE_SEQUENCE}</td><td>The 1-based position of the event in the log of the aggregate instance</td></tr>
 *     <tr><td>{@value #EVENT_VERSION}</td><td>The semantic version of the event payload</td></tr>
 * </table>
 */
public class SequentCloudEventExtension implements CloudEventExtension {
    public static final String AGGREGATE_TYPE = "aggregatetype";
    public static final String AGGREGATE_ID = "aggregateid";
    public static final String AGGREGATE_SEQUENCE = "aggregatesequence";
    public static final String EVENT_VERSION = "eventversion";

    static final Set<String> KEYS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(AGGREGATE_TYPE, AGGREGATE_ID, AGGREGATE_SEQUENCE, EVENT_VERSION)));
    private String aggregateType;
    private String aggregateId;
    private long sequence;
    private String eventVersion;

    public SequentCloudEventExtension(String aggregateType, String aggregateId, long sequence, String eventVersion) {
        Objects.requireNonNull(aggregateType, "aggregateType cannot be null");
        Objects.requireNonNull(aggregateId, "aggregateId cannot be null");
        Objects.requireNonNull(eventVersion, "eventVersion cannot be null");
        if (sequence < 1) {
            throw new IllegalArgumentException("Sequence cannot be less than 1");
        }
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.sequence = sequence;
        this.eventVersion = eventVersion;
    }

    public static SequentCloudEventExtension sequent(String aggregateType, String aggregateId, long sequence, String eventVersion) {
        return new SequentCloudEventExtension(aggregateType, aggregateId, sequence, eventVersion);
    }

    @Override
    public void readFrom(CloudEventExtensions extensions) {
        Object aggregateType = extensions.getExtension(AGGREGATE_TYPE);
        if (aggregateType != null) {
            this.aggregateType = aggregateType.toString();
        }

        Object aggregateId = extensions.getExtension(AGGREGATE_ID);
        if (aggregateId != null) {
            this.aggregateId = aggregateId.toString();
        }

        Object sequence = extensions.getExtension(AGGREGATE_SEQUENCE);
        if (sequence instanceof Number) {
            this.sequence = ((Number) sequence).longValue();
        }

        Object eventVersion = extensions.getExtension(EVENT_VERSION);
        if (eventVersion != null) {
            this.eventVersion = eventVersion.toString();
        }
    }

    @Override
    public Object getValue(String key) throws IllegalArgumentException {
        if (AGGREGATE_TYPE.equals(key)) {
            return this.aggregateType;
        } else if (AGGREGATE_ID.equals(key)) {
            return this.aggregateId;
        } else if (AGGREGATE_SEQUENCE.equals(key)) {
            return this.sequence;
        } else if (EVENT_VERSION.equals(key)) {
            return this.eventVersion;
        }
        throw new IllegalArgumentException(this.getClass().getSimpleName() + " doesn't expect the attribute key \"" + key + "\"");
    }

    @Override
    public Set<String> getKeys() {
        return KEYS;
    }
}
