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
import io.cloudevents.core.builder.CloudEventBuilder;

import java.util.Objects;

/**
 * Removes the {@link SequentCloudEventExtension} attributes from a {@link CloudEvent}, for example before it is handed
 * to a consumer that should not see the position of the event in its aggregate log.
 */
public class SequentExtensionRemover {

    private SequentExtensionRemover() {
    }

    public static CloudEvent removeSequentExtensions(CloudEvent cloudEvent) {
        Objects.requireNonNull(cloudEvent, CloudEvent.class.getSimpleName() + " cannot be null");
        CloudEventBuilder builder = CloudEventBuilder.v1(cloudEvent);
        SequentCloudEventExtension.KEYS.forEach(builder::withoutExtension);
        return builder.build();
    }
}
