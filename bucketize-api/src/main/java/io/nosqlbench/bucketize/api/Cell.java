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
import java.util.Objects;

/// One column value of a row, with the point in time it is valid from.
///
/// @param column the column name
/// @param value a `String`, `Boolean`, `Long` or `Double`
/// @param timestamp the cell timestamp; `Timestamps.NEGATIVE_INFINITY` when unknown
public record Cell(String column, Object value, Instant timestamp) {

    public Cell {
        Objects.requireNonNull(column, "column must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (!(value instanceof String || value instanceof Boolean
            || value instanceof Long || value instanceof Double)) {
            throw new IllegalArgumentException(
                "unsupported cell value type for column '" + column + "': " + value.getClass().getName());
        }
    }
}
