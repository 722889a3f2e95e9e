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

import io.nosqlbench.bucketize.api.SinkStatus;

import java.time.Instant;
import java.util.List;

/// The outcome of a committed bucketize run.
///
/// @param rowCount the number of ranked rows
/// @param representativeTimestamp the timestamp attached to every assignment
/// @param buckets each bucket with its resolved interval, in configuration order
/// @param assignments the number of assignments written
/// @param flushes the number of batched sink writes
/// @param sinkStatus the status reported by the sink at commit
public record BucketizeResult(
    long rowCount,
    Instant representativeTimestamp,
    List<BucketSummary> buckets,
    long assignments,
    long flushes,
    SinkStatus sinkStatus
) {
    public BucketizeResult {
        buckets = List.copyOf(buckets);
    }
}
