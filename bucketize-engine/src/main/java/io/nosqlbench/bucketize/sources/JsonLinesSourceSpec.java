package io.nosqlbench.bucketize.sources;

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

import java.nio.file.Path;
import java.util.Objects;

/// Where and how to read ranked rows from a JSON-lines file.
///
/// @param path the JSON-lines file
/// @param orderBy the ranking order
/// @param rowNameField the field holding the row identifier; rows without it are named
///     `row<line>` after their one-based line number
/// @param timestampField the field holding the row timestamp, or null
/// @param offset the number of ranked rows to skip
/// @param limit the maximum number of ranked rows to keep, or -1 for all
public record JsonLinesSourceSpec(
    Path path,
    OrderBy orderBy,
    String rowNameField,
    String timestampField,
    long offset,
    long limit
) {
    /// The default row name field
    public static final String DEFAULT_ROW_NAME_FIELD = "rowName";

    public JsonLinesSourceSpec {
        Objects.requireNonNull(path, "input path must not be null");
        orderBy = orderBy == null ? OrderBy.NONE : orderBy;
        rowNameField = rowNameField == null ? DEFAULT_ROW_NAME_FIELD : rowNameField;
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative: " + offset);
        }
        if (limit < -1) {
            throw new IllegalArgumentException("limit must be -1 (no limit) or non-negative: " + limit);
        }
    }

    /// @param path the JSON-lines file
    /// @return a spec keeping all rows in file order
    public static JsonLinesSourceSpec of(Path path) {
        return new JsonLinesSourceSpec(path, OrderBy.NONE, DEFAULT_ROW_NAME_FIELD, null, 0L, -1L);
    }

    public JsonLinesSourceSpec withPath(Path newPath) {
        return new JsonLinesSourceSpec(newPath, orderBy, rowNameField, timestampField, offset, limit);
    }

    public JsonLinesSourceSpec withOrderBy(OrderBy newOrderBy) {
        return new JsonLinesSourceSpec(path, newOrderBy, rowNameField, timestampField, offset, limit);
    }

    public JsonLinesSourceSpec withRowNameField(String newRowNameField) {
        return new JsonLinesSourceSpec(path, orderBy, newRowNameField, timestampField, offset, limit);
    }

    public JsonLinesSourceSpec withTimestampField(String newTimestampField) {
        return new JsonLinesSourceSpec(path, orderBy, rowNameField, newTimestampField, offset, limit);
    }

    public JsonLinesSourceSpec withOffset(long newOffset) {
        return new JsonLinesSourceSpec(path, orderBy, rowNameField, timestampField, newOffset, limit);
    }

    public JsonLinesSourceSpec withLimit(long newLimit) {
        return new JsonLinesSourceSpec(path, orderBy, rowNameField, timestampField, offset, newLimit);
    }
}
