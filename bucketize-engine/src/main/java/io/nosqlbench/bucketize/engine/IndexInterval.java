package io.nosqlbench.bucketize.engine;

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

/// A half-open row index interval `[lowerBound, higherBound)`.
///
/// @param lowerBound the first index, inclusive
/// @param higherBound the last index, exclusive
public record IndexInterval(long lowerBound, long higherBound) {

    /// @return the number of indices in the interval
    public long size() {
        return higherBound - lowerBound;
    }

    public boolean isEmpty() {
        return higherBound <= lowerBound;
    }

    /// @param index a row index
    /// @return true if the index lies in this interval
    public boolean contains(long index) {
        return index >= lowerBound && index < higherBound;
    }

    /// @param other another interval
    /// @return true if both intervals hold at least one common index
    public boolean overlaps(IndexInterval other) {
        return !isEmpty() && !other.isEmpty()
            && lowerBound < other.higherBound && other.lowerBound < higherBound;
    }

    @Override
    public String toString() {
        return "[" + lowerBound + ", " + higherBound + ")";
    }
}
