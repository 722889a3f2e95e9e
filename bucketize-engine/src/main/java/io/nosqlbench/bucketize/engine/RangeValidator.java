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

import io.nosqlbench.bucketize.api.BucketConfigException;
import io.nosqlbench.bucketize.api.PercentileBuckets;
import io.nosqlbench.bucketize.api.PercentileRange;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Comparator;
import java.util.List;

/// Checks a set of percentile ranges before any row is read.
///
/// Every range must lie within `[0,100]` with `start < end`, and once sorted by start no range
/// may begin before the previous one ends. Ranges that share a boundary value are accepted: the
/// half-open index intervals they resolve to never share a row.
public final class RangeValidator {
    private static final Logger logger = LogManager.getLogger(RangeValidator.class);

    private RangeValidator() {
    }

    /// Validate the ranges of a bucket set.
    /// @param buckets the configured buckets
    /// @return the same buckets, for chaining
    /// @throws BucketConfigException naming the offending range, or both ranges of an overlap
    public static PercentileBuckets validate(PercentileBuckets buckets) {
        List<PercentileRange> sorted = buckets.ranges();
        sorted.sort(Comparator.comparingDouble(PercentileRange::start));

        PercentileRange last = null;
        for (PercentileRange range : sorted) {
            // negated comparisons so that NaN bounds are rejected too
            if (!(range.start() >= 0.0d)) {
                throw new BucketConfigException(String.format(
                    "Invalid percentileBucket %s %s: lower bound must be greater or equal to 0",
                    range.label(), range.bounds()), range);
            }
            if (!(range.end() <= 100.0d)) {
                throw new BucketConfigException(String.format(
                    "Invalid percentileBucket %s %s: higher bound must be lower or equal to 100",
                    range.label(), range.bounds()), range);
            }
            if (!(range.start() < range.end())) {
                throw new BucketConfigException(String.format(
                    "Invalid percentileBucket %s %s: higher bound must be greater than lower bound",
                    range.label(), range.bounds()), range);
            }
            if (last != null && range.start() < last.end()) {
                throw new BucketConfigException(String.format(
                    "Invalid percentileBucket: %s %s is overlapping with %s %s",
                    last.label(), last.bounds(), range.label(), range.bounds()), last, range);
            }
            last = range;
        }
        logger.debug("Validated {} percentile buckets: {}", sorted.size(), sorted);
        return buckets;
    }
}
