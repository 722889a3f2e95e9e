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

import io.nosqlbench.bucketize.api.BucketAssignment;
import io.nosqlbench.bucketize.api.BucketizeException;
import io.nosqlbench.bucketize.api.Cell;
import io.nosqlbench.bucketize.api.RowSink;
import io.nosqlbench.bucketize.api.RowSinkException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;

/// Writes bucket assignments for index intervals of an ordered row sequence to a sink, in
/// parallel, through per-worker buffers.
///
/// Each call to {@link #assign} splits one interval into contiguous slices and runs them on the
/// executor, blocking until all slices are done. A worker appends to its own buffer and sends the
/// whole buffer to the sink in one call whenever it reaches the flush threshold. Buffers outlive a
/// single interval; {@link #drain()} flushes whatever is left in each of them exactly once and
/// closes the fan-out to further work.
///
/// The first failure in any worker stops the others at their next row and is rethrown from
/// {@link #assign}. After a failure the fan-out cannot be drained.
public final class BucketFanout {
    private static final Logger logger = LogManager.getLogger(BucketFanout.class);

    /// The default number of buffered assignments that triggers a sink write
    public static final int DEFAULT_FLUSH_THRESHOLD = 1024;

    /// Slices smaller than this are not split further
    static final long MIN_SLICE_SIZE = 4096;

    /// Slices per worker, so that uneven workers still finish close together
    private static final int SLICES_PER_WORKER = 4;

    private final ExecutorService executor;
    private final int parallelism;
    private final RowSink sink;
    private final int flushThreshold;
    private final PerThreadAccumulator<List<BucketAssignment>> buffers;

    private final AtomicLong assignments = new AtomicLong();
    private final AtomicLong flushes = new AtomicLong();
    private volatile boolean aborted = false;
    private boolean drained = false;

    /// @param executor runs the slices; not shut down by this class
    /// @param parallelism the number of workers the executor runs
    /// @param sink receives the assignments
    /// @param flushThreshold the buffer size that triggers a sink write, at least 1
    public BucketFanout(ExecutorService executor, int parallelism, RowSink sink, int flushThreshold) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1: " + parallelism);
        }
        if (flushThreshold < 1) {
            throw new IllegalArgumentException("flush threshold must be at least 1: " + flushThreshold);
        }
        this.executor = executor;
        this.parallelism = parallelism;
        this.sink = sink;
        this.flushThreshold = flushThreshold;
        this.buffers = new PerThreadAccumulator<>(() -> new ArrayList<>(flushThreshold));
    }

    /// Assign every row in the interval to the bucket named by the cell.
    /// @param rows the ordered rows
    /// @param interval the rows to assign
    /// @param bucketCell the shared bucket cell for this interval
    /// @return the number of assignments made
    /// @throws RowSinkException if the sink rejects a batch
    /// @throws IllegalStateException if the fan-out was drained or has failed
    public long assign(OrderedRowSequence rows, IndexInterval interval, Cell bucketCell) {
        if (drained) {
            throw new IllegalStateException("bucket fan-out already drained");
        }
        if (aborted) {
            throw new IllegalStateException("bucket fan-out aborted by an earlier failure");
        }
        if (interval.isEmpty()) {
            return 0L;
        }

        List<Callable<Long>> slices = slice(rows, interval, bucketCell);
        logger.debug("Assigning {} rows {} in {} slices", interval.size(), interval, slices.size());

        try {
            long assigned = 0L;
            for (Future<Long> future : executor.invokeAll(slices)) {
                assigned += future.get();
            }
            return assigned;
        } catch (InterruptedException e) {
            aborted = true;
            Thread.currentThread().interrupt();
            throw new BucketizeException("interrupted while assigning rows " + interval, e);
        } catch (ExecutionException e) {
            aborted = true;
            throw rethrow(e.getCause());
        }
    }

    /// Flush the remainder of every worker buffer, once, and refuse further work.
    /// @return the number of buffers visited
    /// @throws RowSinkException if the sink rejects a batch
    public int drain() {
        if (drained) {
            throw new IllegalStateException("bucket fan-out already drained");
        }
        if (aborted) {
            throw new IllegalStateException("bucket fan-out aborted by an earlier failure");
        }
        drained = true;
        buffers.forEach(buffer -> {
            if (!buffer.isEmpty()) {
                flush(buffer);
            }
        });
        logger.debug("Drained {} worker buffers, {} sink writes in total", buffers.size(), flushes.get());
        return buffers.size();
    }

    /// @return the number of assignments made so far
    public long assignmentCount() {
        return assignments.get();
    }

    /// @return the number of batched sink writes so far
    public long flushCount() {
        return flushes.get();
    }

    public int getFlushThreshold() {
        return flushThreshold;
    }

    private List<Callable<Long>> slice(OrderedRowSequence rows, IndexInterval interval, Cell bucketCell) {
        long size = interval.size();
        long wanted = (long) parallelism * SLICES_PER_WORKER;
        long sliceSize = Math.max(MIN_SLICE_SIZE, (size + wanted - 1) / wanted);

        List<Callable<Long>> slices = new ArrayList<>();
        for (long from = interval.lowerBound(); from < interval.higherBound(); from += sliceSize) {
            long to = Math.min(from + sliceSize, interval.higherBound());
            slices.add(new SliceTask(rows, from, to, bucketCell));
        }
        return slices;
    }

    private void flush(List<BucketAssignment> buffer) {
        try {
            sink.recordRows(buffer);
        } catch (BucketizeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RowSinkException("sink rejected a batch of " + buffer.size() + " rows", e);
        }
        flushes.incrementAndGet();
        buffer.clear();
    }

    private static RuntimeException rethrow(Throwable cause) {
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new BucketizeException("bucket worker failed", cause);
    }

    /// Assigns one contiguous slice of an interval on whichever worker runs it.
    private final class SliceTask implements Callable<Long> {
        private final OrderedRowSequence rows;
        private final long from;
        private final long to;
        private final Cell bucketCell;

        SliceTask(OrderedRowSequence rows, long from, long to, Cell bucketCell) {
            this.rows = rows;
            this.from = from;
            this.to = to;
            this.bucketCell = bucketCell;
        }

        @Override
        public Long call() {
            List<BucketAssignment> buffer = buffers.get();
            long assigned = 0L;
            try {
                for (long rank = from; rank < to && !aborted; rank++) {
                    buffer.add(new BucketAssignment(rows.get(rank), bucketCell));
                    assigned++;
                    if (buffer.size() >= flushThreshold) {
                        flush(buffer);
                    }
                }
            } catch (RuntimeException | Error e) {
                aborted = true;
                throw e;
            } finally {
                assignments.addAndGet(assigned);
            }
            return assigned;
        }
    }
}
