package io.nosqlbench.bucketize.command.common;

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
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared percentile bucket option.
 * Buckets are given as repeated {@code -b label=[start,end]} or {@code -b label=start..end}.
 */
public class PercentileBucketOption {

    /**
     * Picocli type converter for {@link PercentileRange} specifications.
     * Supports formats: label=[m,n], label=m..n
     */
    public static class PercentileRangeConverter implements CommandLine.ITypeConverter<PercentileRange> {

        @Override
        public PercentileRange convert(String value) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("Bucket specification cannot be empty");
            }
            int eq = value.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException(
                    "Invalid bucket format: " + value + ". Expected: label=[start,end] or label=start..end"
                );
            }
            String label = value.substring(0, eq).trim();
            String bounds = value.substring(eq + 1).trim();

            String[] parts;
            if (bounds.startsWith("[") && bounds.endsWith("]")) {
                parts = bounds.substring(1, bounds.length() - 1).split(",");
            } else if (bounds.contains("..")) {
                parts = bounds.split("\\.\\.");
            } else {
                throw new IllegalArgumentException(
                    "Invalid bucket bounds: " + bounds + ". Expected: [start,end] or start..end"
                );
            }
            if (parts.length != 2) {
                throw new IllegalArgumentException(
                    "Invalid bucket bounds: " + bounds + ". Expected exactly two numbers"
                );
            }
            try {
                double start = Double.parseDouble(parts[0].trim());
                double end = Double.parseDouble(parts[1].trim());
                return new PercentileRange(label, start, end);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                    "Invalid bucket bounds: " + bounds + ". Could not parse numbers: " + e.getMessage()
                );
            } catch (BucketConfigException e) {
                throw new IllegalArgumentException(e.getMessage(), e);
            }
        }
    }

    @CommandLine.Option(
        names = {"-b", "--bucket"},
        description = "A named percentile bucket, repeatable. Formats: 'label=[start,end]', 'label=start..end'",
        converter = PercentileRangeConverter.class
    )
    private List<PercentileRange> ranges = new ArrayList<>();

    /**
     * Checks if any bucket was given on the command line.
     */
    public boolean isSpecified() {
        return !ranges.isEmpty();
    }

    public List<PercentileRange> getRanges() {
        return List.copyOf(ranges);
    }

    /**
     * Builds the bucket set in the order given.
     *
     * @throws BucketConfigException if a label is repeated
     */
    public PercentileBuckets getBuckets() {
        PercentileBuckets.Builder builder = PercentileBuckets.builder();
        ranges.forEach(builder::add);
        return builder.build();
    }
}
