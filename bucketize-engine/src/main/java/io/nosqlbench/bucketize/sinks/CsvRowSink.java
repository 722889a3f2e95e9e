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

import io.nosqlbench.bucketize.api.Cell;
import io.nosqlbench.bucketize.api.RowRecord;
import io.nosqlbench.bucketize.api.Timestamps;

import java.io.IOException;
import java.io.Writer;

/// Writes rows in long format, one line per cell: `rowName,column,value,ts`.
///
/// Fields holding a comma, quote or line break are quoted, with quotes doubled.
public class CsvRowSink extends AbstractFileRowSink {

    /// The sink type name
    public static final String TYPE = "csv";

    /// The header line
    public static final String HEADER = "rowName,column,value,ts";

    public CsvRowSink(SinkSpec spec) {
        super(TYPE, spec);
    }

    @Override
    protected void writeHeader(Writer out) throws IOException {
        out.write(HEADER);
        out.write('\n');
    }

    @Override
    protected void writeRow(Writer out, RowRecord row) throws IOException {
        String rowName = quote(row.rowName());
        for (Cell cell : row.cells()) {
            out.write(rowName);
            out.write(',');
            out.write(quote(cell.column()));
            out.write(',');
            out.write(quote(cell.value().toString()));
            out.write(',');
            out.write(Timestamps.format(cell.timestamp()));
            out.write('\n');
        }
    }

    static String quote(String field) {
        boolean needsQuotes = field.indexOf(',') >= 0 || field.indexOf('"') >= 0
            || field.indexOf('\n') >= 0 || field.indexOf('\r') >= 0;
        if (!needsQuotes) {
            return field;
        }
        return '"' + field.replace("\"", "\"\"") + '"';
    }
}
