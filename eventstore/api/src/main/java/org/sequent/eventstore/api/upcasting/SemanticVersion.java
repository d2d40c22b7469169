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

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@code major.minor.patch} version. Missing components are 0 and components after the patch are ignored,
 * so {@code "2"} is {@code 2.0.0} and {@code "2.3.4.5"} is {@code 2.3.4}.
 */
public record SemanticVersion(int major, int minor, int patch) implements Comparable<SemanticVersion> {
    private static final Comparator<SemanticVersion> ORDER = Comparator.comparingInt(SemanticVersion::major)
            .thenComparingInt(SemanticVersion::minor)
            .thenComparingInt(SemanticVersion::patch);

    public SemanticVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("Version components cannot be negative");
        }
    }

    /**
     * @throws IllegalArgumentException If {@code version} is not a semantic version
     */
    public static SemanticVersion parse(String version) {
        return tryParse(version).orElseThrow(() -> new IllegalArgumentException("'" + version + "' is not a semantic version"));
    }

    public static Optional<SemanticVersion> tryParse(String version) {
        if (version == null || version.isEmpty()) {
            return Optional.empty();
        }
        String[] parts = version.split("\\.", -1);
        int[] components = new int[3];
        for (int i = 0; i < Math.min(parts.length, 3); i++) {
            Optional<Integer> component = component(parts[i]);
            if (component.isEmpty()) {
                return Optional.empty();
            }
            components[i] = component.get();
        }
        return Optional.of(new SemanticVersion(components[0], components[1], components[2]));
    }

    private static Optional<Integer> component(String part) {
        if (part.isEmpty() || !part.chars().allMatch(Character::isDigit)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(part));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * @return {@code true} if this version is strictly newer than {@code other}.
     */
    public boolean supersedes(SemanticVersion other) {
        Objects.requireNonNull(other, "other cannot be null");
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(SemanticVersion other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
