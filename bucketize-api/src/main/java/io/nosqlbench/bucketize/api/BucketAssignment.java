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

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/// A row assigned to a bucket.
///
/// The bucket cell is built once per bucket and shared by every assignment in it, so an
/// assignment only adds the row name.
///
/// @param rowName the row identifier
/// @param bucketCell the `bucket` cell holding the label and the representative timestamp
public record BucketAssignment(String rowName, Cell bucketCell) implements RowRecord {

    /// The column bucket labels are written to
    public static final String BUCKET_COLUMN = "bucket";

    public BucketAssignment {
        Objects.requireNonNull(rowName, "rowName must not be null");
        Objects.requireNonNull(bucketCell, "bucketCell must not be null");
    }

    /// Build the shared cell for one bucket.
    /// @param label the bucket label
    /// @param timestamp the representative timestamp of the run
    /// @return a `bucket` column cell
    public static Cell bucketCell(String label, Instant timestamp) {
        return new Cell(BUCKET_COLUMN, label, timestamp);
    }

    /// @return the label of the assigned bucket
    public String bucketLabel() {
        return (String) bucketCell.value();
    }

    /// @return the representative timestamp carried by this assignment
    public Instant timestamp() {
        return bucketCell.timestamp();
    }

    @Override
    public List<Cell> cells() {
        return List.of(bucketCell);
    }
}
