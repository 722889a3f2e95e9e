package io.nosqlbench.bucketize.config;

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
import io.nosqlbench.bucketize.sinks.SinkSpec;
import io.nosqlbench.bucketize.sources.JsonLinesSourceSpec;

import java.util.Objects;
import java.util.Optional;

/// The settings of one bucketize run.
///
/// Instances are immutable. Command line overrides are applied with the `with...` methods over
/// the configuration read from a file.
///
/// @param percentileBuckets the named percentile ranges
/// @param flushThreshold the worker buffer size at which assignments are written to the sink
/// @param parallelism the number of worker threads
/// @param input the rows to rank, or null when the caller supplies its own source
/// @param output the sink to write to, or null when the caller supplies its own sink
public record BucketizeConfig(
    PercentileBuckets percentileBuckets,
    int flushThreshold,
    int parallelism,
    JsonLinesSourceSpec input,
    SinkSpec output
) {
    /// The number of buffered assignments per worker before a sink write
    public static final int DEFAULT_FLUSH_THRESHOLD = 1024;

    public BucketizeConfig {
        Objects.requireNonNull(percentileBuckets, "percentileBuckets must not be null");
        if (flushThreshold < 1) {
            throw new BucketConfigException("flushThreshold must be at least 1, but was " + flushThreshold);
        }
        if (parallelism < 1) {
            throw new BucketConfigException("parallelism must be at least 1, but was " + parallelism);
        }
    }

    /// @return available processors minus one, at least 1
    public static int defaultParallelism() {
        return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
    }

    /// @param buckets the named percentile ranges
    /// @return a configuration with default threshold and parallelism and no input or output
    public static BucketizeConfig of(PercentileBuckets buckets) {
        return new BucketizeConfig(buckets, DEFAULT_FLUSH_THRESHOLD, defaultParallelism(), null, null);
    }

    /// @return a configuration with no buckets, to be filled in by overrides
    public static BucketizeConfig defaults() {
        return of(PercentileBuckets.builder().build());
    }

    public Optional<JsonLinesSourceSpec> inputSpec() {
        return Optional.ofNullable(input);
    }

    public Optional<SinkSpec> outputSpec() {
        return Optional.ofNullable(output);
    }

    public BucketizeConfig withPercentileBuckets(PercentileBuckets newBuckets) {
        return new BucketizeConfig(newBuckets, flushThreshold, parallelism, input, output);
    }

    public BucketizeConfig withFlushThreshold(int newFlushThreshold) {
        return new BucketizeConfig(percentileBuckets, newFlushThreshold, parallelism, input, output);
    }

    public BucketizeConfig withParallelism(int newParallelism) {
        return new BucketizeConfig(percentileBuckets, flushThreshold, newParallelism, input, output);
    }

    public BucketizeConfig withInput(JsonLinesSourceSpec newInput) {
        return new BucketizeConfig(percentileBuckets, flushThreshold, parallelism, newInput, output);
    }

    public BucketizeConfig withOutput(SinkSpec newOutput) {
        return new BucketizeConfig(percentileBuckets, flushThreshold, parallelism, input, newOutput);
    }
}
