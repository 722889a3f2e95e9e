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

import java.util.List;

/// Thrown when a bucket configuration is malformed: bounds outside `[0,100]`, an empty or
/// inverted range, overlapping ranges, duplicate labels, or bad run settings.
///
/// It is always raised before any row is read.
public class BucketConfigException extends BucketizeException {

    private final List<PercentileRange> offendingRanges;

    public BucketConfigException(String message, PercentileRange... offendingRanges) {
        super(message);
        this.offendingRanges = List.of(offendingRanges);
    }

    public BucketConfigException(String message, Throwable cause) {
        super(message, cause);
        this.offendingRanges = List.of();
    }

    /// @return the ranges named by this error, empty if the error is not about specific ranges
    public List<PercentileRange> getOffendingRanges() {
        return offendingRanges;
    }
}
