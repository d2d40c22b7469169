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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cloudevents.CloudEvent;
import io.cloudevents.SpecVersion;
import io.cloudevents.core.builder.CloudEventBuilder;
import io.cloudevents.jackson.JsonCloudEventData;
import org.sequent.cloudevents.SequentCloudEventExtension;
import org.sequent.dsl.view.Query;
import org.sequent.eventstore.api.EventEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.function.Consumer;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * Converts committed events into {@link CloudEvent}s and hands them to a consumer, for example a message broker client.
 * The id of a cloud event is {@code <aggregate type>:<aggregate id>:<sequence>} so a consumer can detect redelivery.
 * The position of the event is available through {@link SequentCloudEventExtension}.
 * <p>
 * Metadata of the event is carried as cloud event extensions. Only keys that are valid extension names (lower-case
 * letters and digits, at most 20 characters) and that don't clash with a cloud event attribute or a
 * {@link SequentCloudEventExtension} key are carried, other keys are left out.
 *
 * @param <E> The event type of the aggregate
 */
public class CloudEventPublishingQuery<E> implements Query<E> {
    private static final Logger log = LoggerFactory.getLogger(CloudEventPublishingQuery.class);
    private static final String JSON = "application/json";
    private static final Pattern EXTENSION_NAME = Pattern.compile("[a-z0-9]{1,20}");

    private final ObjectMapper objectMapper;
    private final Consumer<CloudEvent> publisher;
    private final Clock clock;

    public CloudEventPublishingQuery(ObjectMapper objectMapper, Consumer<CloudEvent> publisher) {
        this(objectMapper, publisher, Clock.systemUTC());
    }

    public CloudEventPublishingQuery(ObjectMapper objectMapper, Consumer<CloudEvent> publisher, Clock clock) {
        this.objectMapper = requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        this.publisher = requireNonNull(publisher, "publisher cannot be null");
        this.clock = requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
    }

    @Override
    public void dispatch(String aggregateId, List<EventEnvelope<E>> events) {
        for (EventEnvelope<E> event : events) {
            CloudEvent cloudEvent = toCloudEvent(event);
            publisher.accept(cloudEvent);
            log.debug("Published cloud event {}", cloudEvent.getId());
        }
    }

    public CloudEvent toCloudEvent(EventEnvelope<E> event) {
        requireNonNull(event, EventEnvelope.class.getSimpleName() + " cannot be null");
        JsonNode data = objectMapper.valueToTree(event.payload());
        SequentCloudEventExtension position = SequentCloudEventExtension.sequent(event.aggregateType(), event.aggregateId(), event.sequence(), event.eventVersion());
        CloudEventBuilder builder = CloudEventBuilder.v1()
                .withId(event.aggregateType() + ":" + event.aggregateId() + ":" + event.sequence())
                .withSource(URI.create("urn:" + event.aggregateType()))
                .withType(event.eventType())
                .withSubject(event.aggregateId())
                .withTime(OffsetDateTime.now(clock))
                .withData(JSON, JsonCloudEventData.wrap(data))
                .withExtension(position);
        event.metadata().forEach((key, value) -> {
            if (EXTENSION_NAME.matcher(key).matches() && !SpecVersion.V1.getAllAttributes().contains(key) && !position.getKeys().contains(key)) {
                builder.withExtension(key, value);
            } else {
                log.debug("Metadata {} of {} with id {} at sequence {} is not a usable cloud event extension name, leaving it out", key, event.aggregateType(), event.aggregateId(), event.sequence());
            }
        });
        return builder.build();
    }
}
