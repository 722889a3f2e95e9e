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

/// A destination for rows.
///
/// The bucketize engine calls {@link #recordRows(List)} from several worker threads at once and
/// does not serialize those calls itself; each implementation states and provides its own
/// concurrency guarantees. {@link #commit()} is called once, after every row has been recorded,
/// and makes the rows visible. {@link #close()} releases resources and discards anything not
/// yet committed.
public interface RowSink extends AutoCloseable {

    /// Record a batch of rows. The list is owned by the caller and must not be retained.
    /// @param rows the rows to record
    /// @throws RowSinkException if the rows cannot be recorded
    void recordRows(List<? extends RowRecord> rows);

    /// Record a single row.
    /// @param row the row to record
    /// @throws RowSinkException if the row cannot be recorded
    default void recordRow(RowRecord row) {
        recordRows(List.of(row));
    }

    /// Make all recorded rows visible.
    /// @return the sink status after commit
    /// @throws RowSinkException if the commit fails
    SinkStatus commit();

    /// Release resources. Rows recorded since the last commit are discarded.
    @Override
    void close();
}
