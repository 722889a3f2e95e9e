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

import java.util.Objects;

/// A named percentile range `[start, end]` in percentage units.
///
/// Bounds are not checked here; a set of ranges is checked as a whole by the range validator
/// so that an error can name both sides of an overlap.
///
/// @param label the bucket label rows in this range are assigned to
/// @param start the lower bound, in `[0,100]`
/// @param end the upper bound, in `[0,100]`, greater than `start`
public record PercentileRange(String label, double start, double end) {

    public PercentileRange {
        Objects.requireNonNull(label, "bucket label must not be null");
        if (label.isBlank()) {
            throw new BucketConfigException("bucket label must not be blank");
        }
    }

    /// @return true if this range starts at the 0th percentile
    public boolean startsAtZero() {
        return start == 0.0d;
    }

    /// @return true if this range ends at the 100th percentile
    public boolean endsAtHundred() {
        return end == 100.0d;
    }

    /// @return the bounds in `[start, end]` form, without the label
    public String bounds() {
        return "[" + start + ", " + end + "]";
    }

    @Override
    public String toString() {
        return label + bounds();
    }
}
