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

import com.fasterxml.jackson.databind.JsonNode;
import org.sequent.eventstore.api.SerializedEvent;

import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.UnaryOperator;

/**
 * Upcasts events of a given type whose version is older than {@code targetVersion}. The upcasted event gets {@code targetVersion}.
 * <pre>
 * new SemanticVersionEventUpcaster("AccountOpened", "2.0", payload -> {
 *     ObjectNode node = (ObjectNode) payload;
 *     node.set("accountId", node.remove("id"));
 *     return node;
 * });
 * </pre>
 */
public class SemanticVersionEventUpcaster implements EventUpcaster {
    private final String eventType;
    private final SemanticVersion targetVersion;
    private final UnaryOperator<JsonNode> upcastFunction;

    /**
     * @throws IllegalArgumentException If {@code targetVersion} is not a semantic version
     */
    public SemanticVersionEventUpcaster(String eventType, String targetVersion, UnaryOperator<JsonNode> upcastFunction) {
        Objects.requireNonNull(eventType, "eventType cannot be null");
        Objects.requireNonNull(upcastFunction, "upcastFunction cannot be null");
        this.eventType = eventType;
        this.targetVersion = SemanticVersion.parse(targetVersion);
        this.upcastFunction = upcastFunction;
    }

    @Override
    public boolean canUpcast(String eventType, String eventVersion) {
        if (!this.eventType.equals(eventType)) {
            return false;
        }
        return SemanticVersion.tryParse(eventVersion)
                .map(targetVersion::supersedes)
                .orElse(false);
    }

    @Override
    public SerializedEvent upcast(SerializedEvent event) {
        // The stored payload must never be mutated in place
        JsonNode upcasted = upcastFunction.apply(event.payload().deepCopy());
        return event.withPayload(targetVersion.toString(), upcasted);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", SemanticVersionEventUpcaster.class.getSimpleName() + "[", "]")
                .add("eventType='" + eventType + "'")
                .add("targetVersion=" + targetVersion)
                .toString();
    }
}
