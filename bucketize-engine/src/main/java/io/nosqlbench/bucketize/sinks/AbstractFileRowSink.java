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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;

/// Base for sinks that write rows to a text file.
///
/// Rows go to `<path>.inprogress`; {@link #commit()} moves that file onto the target path, so
/// the target only ever holds complete output. {@link #close()} without a commit deletes the
/// in-progress file. Writes are serialized on this sink, so concurrent
/// {@link #recordRows(List)} calls are safe.
public abstract class AbstractFileRowSink implements RowSink {
    private static final Logger logger = LogManager.getLogger(AbstractFileRowSink.class);

    /// Suffix of the file rows are written to before commit
    public static final String IN_PROGRESS_SUFFIX = ".inprogress";

    private final String sinkType;
    private final Path target;
    private final Path inProgress;

    private BufferedWriter writer;
    private long rowCount;
    private long cellCount;
    private boolean committed;
    private boolean closed;

    /// @param sinkType the registered sink type name
    /// @param spec the output path and overwrite policy
    /// @throws RowSinkException if the target exists and overwrite is not allowed
    protected AbstractFileRowSink(String sinkType, SinkSpec spec) {
        this.sinkType = sinkType;
        this.target = spec.path().normalize();
        if (Files.exists(target) && !spec.overwrite()) {
            throw new RowSinkException("Output file already exists: " + target + ". Use overwrite to replace it.");
        }
        this.inProgress = target.resolveSibling(target.getFileName() + IN_PROGRESS_SUFFIX);
    }

    /// Write anything that precedes the rows, such as a header line.
    /// @param out the output
    /// @throws IOException if writing fails
    protected void writeHeader(Writer out) throws IOException {
    }

    /// Write one row.
    /// @param out the output
    /// @param row the row
    /// @throws IOException if writing fails
    protected abstract void writeRow(Writer out, RowRecord row) throws IOException;

    @Override
    public synchronized void recordRows(List<? extends RowRecord> rows) {
        Writer out = openWriter();
        try {
            for (RowRecord row : rows) {
                writeRow(out, row);
                rowCount++;
                cellCount += row.cells().size();
            }
        } catch (IOException e) {
            throw new RowSinkException("Unable to write " + rows.size() + " rows to " + inProgress, e);
        }
    }

    @Override
    public synchronized SinkStatus commit() {
        Writer out = openWriter();
        try {
            out.close();
            moveIntoPlace();
        } catch (IOException e) {
            throw new RowSinkException("Unable to commit " + target, e);
        }
        committed = true;
        logger.debug("Committed {} rows to {}", rowCount, target);
        return new SinkStatus(sinkType, target.toString(), rowCount, cellCount);
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (committed) {
            return;
        }
        try {
            if (writer != null) {
                writer.close();
            }
            if (Files.deleteIfExists(inProgress)) {
                logger.info("Discarded uncommitted output {}", inProgress);
            }
        } catch (IOException e) {
            throw new RowSinkException("Unable to discard uncommitted output " + inProgress, e);
        }
    }

    /// @return the path rows become visible at after commit
    public Path getTarget() {
        return target;
    }

    /// @return the path rows are written to before commit
    public Path getInProgressPath() {
        return inProgress;
    }

    private Writer openWriter() {
        if (committed) {
            throw new RowSinkException("Sink for " + target + " is already committed");
        }
        if (closed) {
            throw new RowSinkException("Sink for " + target + " is closed");
        }
        if (writer == null) {
            try {
                Path parent = target.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                writer = Files.newBufferedWriter(inProgress, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
                writeHeader(writer);
            } catch (IOException e) {
                throw new RowSinkException("Unable to open " + inProgress + " for writing", e);
            }
        }
        return writer;
    }

    private void moveIntoPlace() throws IOException {
        try {
            Files.move(inProgress, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, replacing in place", target);
            Files.move(inProgress, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
