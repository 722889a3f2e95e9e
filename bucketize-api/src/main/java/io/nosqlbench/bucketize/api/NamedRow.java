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
import java.util.Objects;

/// A row with an arbitrary list of cells.
///
/// @param rowName the row identifier
/// @param cells the row cells, copied
public record NamedRow(String rowName, List<Cell> cells) implements RowRecord {

    public NamedRow {
        Objects.requireNonNull(rowName, "rowName must not be null");
        cells = List.copyOf(cells);
    }
}
