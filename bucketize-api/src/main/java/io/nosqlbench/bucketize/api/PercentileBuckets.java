package io.nosqlbench.bucketize.api;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// An immutable set of percentile ranges keyed by unique bucket label.
///
/// Iteration follows insertion order. Overlap and bound checks are not done here; see
/// `RangeValidator` in the engine module.
public final class PercentileBuckets implements Iterable<PercentileRange> {

    private final Map<String, PercentileRange> ranges;

    private PercentileBuckets(Map<String, PercentileRange> ranges) {
        this.ranges = Collections.unmodifiableMap(new LinkedHashMap<>(ranges));
    }

    /// @return a builder for a new bucket set
    public static Builder builder() {
        return new Builder();
    }

    /// Create a bucket set from label to `[start, end]` pairs.
    /// @param bounds label to two-element array
    /// @return the bucket set
    /// @throws BucketConfigException if an entry does not hold exactly two values
    public static PercentileBuckets of(Map<String, double[]> bounds) {
        Builder builder = builder();
        bounds.forEach((label, pair) -> {
            if (pair == null || pair.length != 2) {
                throw new BucketConfigException(
                    "percentile bucket '" + label + "' must have exactly two bounds [start, end]");
            }
            builder.add(label, pair[0], pair[1]);
        });
        return builder.build();
    }

    /// @return all ranges in insertion order
    public List<PercentileRange> ranges() {
        return new ArrayList<>(ranges.values());
    }

    /// @param label a bucket label
    /// @return the range for the label, if defined
    public Optional<PercentileRange> get(String label) {
        return Optional.ofNullable(ranges.get(label));
    }

    public int size() {
        return ranges.size();
    }

    public boolean isEmpty() {
        return ranges.isEmpty();
    }

    @Override
    public Iterator<PercentileRange> iterator() {
        return ranges.values().iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PercentileBuckets other && ranges.equals(other.ranges);
    }

    @Override
    public int hashCode() {
        return ranges.hashCode();
    }

    @Override
    public String toString() {
        return ranges.values().toString();
    }

    /// Collects ranges, rejecting duplicate labels as they are added.
    public static final class Builder {
        private final Map<String, PercentileRange> ranges = new LinkedHashMap<>();

        private Builder() {
        }

        /// @param label the bucket label
        /// @param start the lower percentile bound
        /// @param end the upper percentile bound
        /// @return this builder
        /// @throws BucketConfigException if the label is already present
        public Builder add(String label, double start, double end) {
            return add(new PercentileRange(label, start, end));
        }

        /// @param range the range to add
        /// @return this builder
        /// @throws BucketConfigException if the label is already present
        public Builder add(PercentileRange range) {
            PercentileRange existing = ranges.putIfAbsent(range.label(), range);
            if (existing != null) {
                throw new BucketConfigException(
                    "duplicate percentile bucket label '" + range.label() + "': " + existing.bounds()
                        + " and " + range.bounds(), existing, range);
            }
            return this;
        }

        public PercentileBuckets build() {
            return new PercentileBuckets(ranges);
        }
    }
}
