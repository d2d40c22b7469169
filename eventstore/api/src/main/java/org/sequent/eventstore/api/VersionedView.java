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

import java.util.Objects;

/**
 * A stored read model row.
 *
 * @param viewId  The id of the view instance
 * @param version The number of events applied to the view, used as its optimistic concurrency token
 * @param view    The read model
 */
public record VersionedView<V>(String viewId, long version, V view) {
    public VersionedView {
        Objects.requireNonNull(viewId, "viewId cannot be null");
        Objects.requireNonNull(view, "view cannot be null");
        if (version < 0) {
            throw new IllegalArgumentException("version cannot be negative");
        }
    }
}
