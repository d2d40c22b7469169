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

package org.sequent.eventstore.inmemory;

import org.sequent.domain.error.AggregateConflictException;
import org.sequent.eventstore.api.VersionedView;
import org.sequent.eventstore.api.ViewRepository;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static java.util.Objects.requireNonNull;

/**
 * A {@link ViewRepository} that keeps views in a {@link ConcurrentMap}. Mainly useful for testing and/or demo purposes.
 *
 * @param <V> The read model type
 */
public class InMemoryViewRepository<V> implements ViewRepository<V> {
    private final String viewType;
    private final ConcurrentMap<String, VersionedView<V>> views = new ConcurrentHashMap<>();

    /**
     * @param viewType Name of the view, reported in conflicts
     */
    public InMemoryViewRepository(String viewType) {
        this.viewType = requireNonNull(viewType, "viewType cannot be null");
    }

    @Override
    public Optional<VersionedView<V>> load(String viewId) {
        requireNonNull(viewId, "viewId cannot be null");
        return Optional.ofNullable(views.get(viewId));
    }

    /**
     * {@inheritDoc}
     * <p>
     * A conflict is reported with the view name given to the constructor as {@link AggregateConflictException#aggregateType}.
     */
    @Override
    public void write(VersionedView<V> view, long expectedVersion) {
        requireNonNull(view, VersionedView.class.getSimpleName() + " cannot be null");
        views.compute(view.viewId(), (viewId, current) -> {
            long currentVersion = current == null ? 0 : current.version();
            if (currentVersion != expectedVersion) {
                throw new AggregateConflictException(viewType, viewId, expectedVersion,
                        String.format("View %s with id %s is at version %d but expected version was %d", viewType, viewId, currentVersion, expectedVersion));
            }
            return view;
        });
    }

    public void delete(String viewId) {
        views.remove(viewId);
    }
}
