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

import io.nosqlbench.bucketize.api.PercentileRange;

/// How one configured bucket resolved in a run.
///
/// @param range the configured percentile range
/// @param interval the row index interval it resolved to
public record BucketSummary(PercentileRange range, IndexInterval interval) {

    public String label() {
        return range.label();
    }

    /// @return the number of rows assigned to the bucket
    public long rowCount() {
        return interval.size();
    }
}
