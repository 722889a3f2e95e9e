package io.nosqlbench.bucketize.sinks;

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

import io.nosqlbench.bucketize.api.RowRecord;
import io.nosqlbench.bucketize.api.RowSink;
import io.nosqlbench.bucketize.api.RowSinkException;
import io.nosqlbench.bucketize.api.SinkStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/// Keeps recorded rows in memory. Safe for concurrent {@link #recordRows(List)} calls.
public class InMemoryRowSink implements RowSink {

    /// The sink type name reported in the status
    public static final String TYPE = "memory";

    private final Queue<RowRecord> rows = new ConcurrentLinkedQueue<>();
    private final Queue<Integer> batchSizes = new ConcurrentLinkedQueue<>();
    private final AtomicLong cellCount = new AtomicLong();
    private volatile boolean committed;
    private volatile boolean closed;

    @Override
    public void recordRows(List<? extends RowRecord> batch) {
        if (committed || closed) {
            throw new RowSinkException("In-memory sink no longer accepts rows");
        }
        rows.addAll(batch);
        batchSizes.add(batch.size());
        long cells = 0;
        for (RowRecord row : batch) {
            cells += row.cells().size();
        }
        cellCount.addAndGet(cells);
    }

    @Override
    public synchronized SinkStatus commit() {
        if (committed) {
            throw new RowSinkException("In-memory sink is already committed");
        }
        committed = true;
        return new SinkStatus(TYPE, "memory", rows.size(), cellCount.get());
    }

    @Override
    public void close() {
        closed = true;
    }

    /// @return a snapshot of all rows recorded so far, in arrival order
    public List<RowRecord> rows() {
        return new ArrayList<>(rows);
    }

    /// @return the size of each batch received, in arrival order
    public List<Integer> batchSizes() {
        return new ArrayList<>(batchSizes);
    }

    public boolean committed() {
        return committed;
    }

    public boolean isClosed() {
        return closed;
    }
}
