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
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// A row as delivered by the ordering step: its identifier and, for each order-by key, the
/// timestamp associated with the key value (null when the key carries no valid point in time).
///
/// @param rowName the row identifier
/// @param keyTimestamps per order-by key timestamps, may contain nulls
public record RankedRow(String rowName, List<Instant> keyTimestamps) {

    public RankedRow {
        Objects.requireNonNull(rowName, "rowName must not be null");
        keyTimestamps = keyTimestamps == null ? List.of() : Collections.unmodifiableList(keyTimestamps);
    }

    /// @param rowName the row identifier
    /// @return a ranked row whose keys carry no timestamps
    public static RankedRow untimed(String rowName) {
        return new RankedRow(rowName, List.of());
    }
}
