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

/// Thrown when resolved index bounds fall outside `[0, rowCount]` or are inverted.
///
/// This is a defect in bound computation, never a user error.
public class BucketInvariantException extends BucketizeException {

    private final long lowerBound;
    private final long higherBound;
    private final long rowCount;

    public BucketInvariantException(PercentileRange range, long lowerBound, long higherBound, long rowCount) {
        super(String.format("Bucket %s resolved to invalid index interval [%d, %d) for %d rows",
            range, lowerBound, higherBound, rowCount));
        this.lowerBound = lowerBound;
        this.higherBound = higherBound;
        this.rowCount = rowCount;
    }

    public long getLowerBound() {
        return lowerBound;
    }

    public long getHigherBound() {
        return higherBound;
    }

    public long getRowCount() {
        return rowCount;
    }
}
