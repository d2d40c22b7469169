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

import org.sequent.domain.error.CommandValidationException;

/**
 * Hard limits imposed by a storage backend on a single commit.
 *
 * @param maxEventsPerCommit             Max number of events in one commit when no snapshot is written
 * @param maxEventsPerCommitWithSnapshot Max number of events in one commit that also writes a snapshot
 * @param maxPayloadBytes                Max size of a single serialized event payload
 */
public record BackendLimits(int maxEventsPerCommit, int maxEventsPerCommitWithSnapshot, long maxPayloadBytes) {
    private static final BackendLimits UNLIMITED = new BackendLimits(Integer.MAX_VALUE, Integer.MAX_VALUE, Long.MAX_VALUE);
    // A DynamoDB transaction holds at most 25 items and an item is at most 400 KB.
    private static final BackendLimits DYNAMO_DB = new BackendLimits(25, 24, 400 * 1024);

    public BackendLimits {
        if (maxEventsPerCommit < 1 || maxEventsPerCommitWithSnapshot < 1 || maxPayloadBytes < 1) {
            throw new IllegalArgumentException("Backend limits must be greater than 0");
        }
    }

    public static BackendLimits unlimited() {
        return UNLIMITED;
    }

    public static BackendLimits dynamoDb() {
        return DYNAMO_DB;
    }

    /**
     * @throws CommandValidationException If {@code eventCount} events cannot be written in one commit
     */
    public void validateEventCount(int eventCount, boolean withSnapshot) {
        int max = withSnapshot ? maxEventsPerCommitWithSnapshot : maxEventsPerCommit;
        if (eventCount > max) {
            throw new CommandValidationException(String.format("Command produced %d events but at most %d can be committed at once%s", eventCount, max, withSnapshot ? " together with a snapshot" : ""));
        }
    }

    /**
     * @param index Zero-based position of the event in the commit
     * @throws CommandValidationException If the serialized event is larger than the backend accepts
     */
    public void validatePayloadSize(int index, long sizeInBytes) {
        if (sizeInBytes > maxPayloadBytes) {
            throw new CommandValidationException(String.format("Event %d has a serialized size of %d bytes which exceeds the limit of %d bytes", index + 1, sizeInBytes, maxPayloadBytes));
        }
    }
}
