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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.nosqlbench.bucketize.api.Cell;
import io.nosqlbench.bucketize.api.RowRecord;
import io.nosqlbench.bucketize.api.Timestamps;

import java.io.IOException;
import java.io.Writer;

/// Writes one JSON object per line:
///
/// ```json
/// {"rowName":"row7","cells":[{"column":"bucket","value":"low","ts":"2024-01-01T00:00:00Z"}]}
/// ```
public class JsonLinesRowSink extends AbstractFileRowSink {

    /// The sink type name
    public static final String TYPE = "jsonl";

    private static final ObjectMapper mapper = new ObjectMapper();

    public JsonLinesRowSink(SinkSpec spec) {
        super(TYPE, spec);
    }

    @Override
    protected void writeRow(Writer out, RowRecord row) throws IOException {
        ObjectNode node = mapper.createObjectNode();
        node.put("rowName", row.rowName());
        ArrayNode cells = node.putArray("cells");
        for (Cell cell : row.cells()) {
            ObjectNode cellNode = cells.addObject();
            cellNode.put("column", cell.column());
            putValue(cellNode, cell.value());
            cellNode.put("ts", Timestamps.format(cell.timestamp()));
        }
        out.write(mapper.writeValueAsString(node));
        out.write('\n');
    }

    private static void putValue(ObjectNode cellNode, Object value) {
        if (value instanceof Long longValue) {
            cellNode.put("value", longValue);
        } else if (value instanceof Double doubleValue) {
            cellNode.put("value", doubleValue);
        } else if (value instanceof Boolean booleanValue) {
            cellNode.put("value", booleanValue);
        } else {
            cellNode.put("value", value.toString());
        }
    }
}
