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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/// The row identifiers of a run in rank order.
///
/// Immutable once built, so it can be read by every worker without synchronization.
public final class OrderedRowSequence {

    private static final OrderedRowSequence EMPTY = new OrderedRowSequence(new String[0]);

    private final String[] rowNames;

    private OrderedRowSequence(String[] rowNames) {
        this.rowNames = rowNames;
    }

    /// @param rowNames row identifiers in rank order; copied
    /// @return the sequence
    public static OrderedRowSequence of(List<String> rowNames) {
        return rowNames.isEmpty() ? EMPTY : new OrderedRowSequence(rowNames.toArray(new String[0]));
    }

    /// @param rowNames row identifiers in rank order; copied
    /// @return the sequence
    public static OrderedRowSequence of(String... rowNames) {
        return rowNames.length == 0 ? EMPTY : new OrderedRowSequence(rowNames.clone());
    }

    /// @param rank a zero-based rank
    /// @return the row identifier at that rank
    public String get(long rank) {
        return rowNames[Math.toIntExact(rank)];
    }

    public long size() {
        return rowNames.length;
    }

    /// @return a read-only list view of the sequence
    public List<String> asList() {
        return Collections.unmodifiableList(Arrays.asList(rowNames));
    }
}
