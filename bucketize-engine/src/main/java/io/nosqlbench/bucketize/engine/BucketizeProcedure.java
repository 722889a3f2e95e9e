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

import io.nosqlbench.bucketize.api.BucketAssignment;
import io.nosqlbench.bucketize.api.Cell;
import io.nosqlbench.bucketize.api.OrderedRowSource;
import io.nosqlbench.bucketize.api.PercentileRange;
import io.nosqlbench.bucketize.api.RowSink;
import io.nosqlbench.bucketize.api.SinkStatus;
import io.nosqlbench.bucketize.api.Timestamps;
import io.nosqlbench.bucketize.config.BucketizeConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ForkJoinPool;

/// Assigns ranked rows to named percentile buckets and writes the assignments to a sink.
///
/// The bucket configuration is validated when the procedure is created, so a malformed
/// configuration fails before any row is read. A run then:
///
/// 1. reads the ordered rows and computes the representative timestamp,
/// 2. resolves every bucket to a row index interval,
/// 3. fans each interval out over a worker pool, one bucket after another,
/// 4. drains the worker buffers and commits the sink once.
///
/// Any failure stops the run before the commit; the caller then closes the sink, which discards
/// the uncommitted rows.
///
/// ```java
/// BucketizeConfig config = BucketizeConfig.of(PercentileBuckets.builder()
///     .add("low", 0, 50)
///     .add("high", 50, 100)
///     .build());
/// try (RowSink sink = RowSinks.open(SinkSpec.forPath(out, true))) {
///     BucketizeResult result = new BucketizeProcedure(config).run(source, sink);
/// }
/// ```
public class BucketizeProcedure {
    private static final Logger logger = LogManager.getLogger(BucketizeProcedure.class);

    private final BucketizeConfig config;

    /// @param config the run configuration
    /// @throws io.nosqlbench.bucketize.api.BucketConfigException if the buckets are malformed
    public BucketizeProcedure(BucketizeConfig config) {
        RangeValidator.validate(config.percentileBuckets());
        this.config = config;
    }

    public BucketizeConfig getConfig() {
        return config;
    }

    /// Run without progress reporting.
    /// @param source the rows in rank order
    /// @param sink the output sink; committed on success, never closed
    /// @return the run result
    public BucketizeResult run(OrderedRowSource source, RowSink sink) {
        return run(source, sink, ProgressCallback.NONE);
    }

    /// @param source the rows in rank order
    /// @param sink the output sink; committed on success, never closed
    /// @param progress receives an update after rank resolution and after each bucket
    /// @return the run result
    public BucketizeResult run(OrderedRowSource source, RowSink sink, ProgressCallback progress) {
        logger.info("Bucketizing rows from {} into {} buckets", source.describe(),
            config.percentileBuckets().size());

        RankResolution resolution = RankResolver.resolve(source);
        long rowCount = resolution.rowCount();
        progress.onProgress(0.0d, "Resolved " + rowCount + " ranked rows");

        List<BucketSummary> summaries = new ArrayList<>();
        for (PercentileRange range : config.percentileBuckets()) {
            IndexInterval interval = BucketAssigner.resolve(range, rowCount);
            logger.debug("Bucket {} from {} to {}", range.label(), interval.lowerBound(), interval.higherBound());
            summaries.add(new BucketSummary(range, interval));
        }

        ForkJoinPool pool = new ForkJoinPool(config.parallelism());
        BucketFanout fanout = new BucketFanout(pool, config.parallelism(), sink, config.flushThreshold());
        try {
            int done = 0;
            for (BucketSummary summary : summaries) {
                Cell bucketCell = BucketAssignment.bucketCell(summary.label(), resolution.representativeTimestamp());
                fanout.assign(resolution.rows(), summary.interval(), bucketCell);
                done++;
                progress.onProgress((double) done / summaries.size(),
                    "Assigned " + summary.rowCount() + " rows to bucket " + summary.label());
            }
            fanout.drain();
        } finally {
            pool.shutdown();
        }

        SinkStatus status = sink.commit();
        logger.info("Committed {} bucket assignments for {} rows in {} sink writes, timestamp {}",
            fanout.assignmentCount(), rowCount, fanout.flushCount(),
            Timestamps.format(resolution.representativeTimestamp()));

        return new BucketizeResult(rowCount, resolution.representativeTimestamp(), summaries,
            fanout.assignmentCount(), fanout.flushCount(), status);
    }
}
