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

import io.nosqlbench.bucketize.api.BucketInvariantException;
import io.nosqlbench.bucketize.api.PercentileRange;

/// Converts a percentile range into a row index interval for a given row count.
///
/// The bounds are `floor(start / 100 * rowCount)` and `floor(end / 100 * rowCount)`, except
/// that a range starting at exactly 0 always begins at index 0 and a range ending at exactly 100
/// always ends at `rowCount`, so floating point truncation can never drop the first or last row.
public final class BucketAssigner {

    private BucketAssigner() {
    }

    /// @param range a validated percentile range
    /// @param rowCount the number of ranked rows
    /// @return the index interval of the rows in the range
    /// @throws BucketInvariantException if the bounds fall outside `[0, rowCount]` or are inverted
    public static IndexInterval resolve(PercentileRange range, long rowCount) {
        long lowerBound = range.startsAtZero() ? 0L : percentileIndex(range.start(), rowCount);
        long higherBound = range.endsAtHundred() ? rowCount : percentileIndex(range.end(), rowCount);

        if (lowerBound < 0 || higherBound > rowCount || lowerBound > higherBound) {
            throw new BucketInvariantException(range, lowerBound, higherBound, rowCount);
        }
        return new IndexInterval(lowerBound, higherBound);
    }

    private static long percentileIndex(double percentile, long rowCount) {
        return (long) Math.floor(percentile / 100.0d * rowCount);
    }
}
