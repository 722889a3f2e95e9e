package io.nosqlbench.bucketize.importer;

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

import com.fasterxml.jackson.databind.JsonNode;
import io.nosqlbench.bucketize.api.Cell;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/// Turns a JSON object into flat cells.
///
/// - null values produce no cell
/// - booleans, numbers and strings produce one cell; integral numbers become `Long`, others `Double`
/// - objects are flattened with `parent.child` column names
/// - arrays of scalars produce one `true` cell per element, named `parent.<element>`
/// - arrays holding arrays or objects produce one cell with the compact JSON text
///
/// All cells carry the epoch as timestamp.
public final class JsonRowFlattener {

    /// The timestamp of every imported cell
    public static final Instant IMPORT_TIMESTAMP = Instant.EPOCH;

    private JsonRowFlattener() {
    }

    /// @param root a JSON object
    /// @return the cells in field order
    public static List<Cell> flatten(JsonNode root) {
        if (!root.isObject()) {
            throw new IllegalArgumentException("Only JSON objects can be flattened, not " + root.getNodeType());
        }
        List<Cell> cells = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            emplace(field.getKey(), field.getValue(), cells);
        }
        return cells;
    }

    private static void emplace(String column, JsonNode value, List<Cell> cells) {
        switch (value.getNodeType()) {
            case NULL, MISSING -> {
            }
            case BOOLEAN -> cells.add(cell(column, value.booleanValue()));
            case NUMBER -> cells.add(cell(column, numberValue(value)));
            case STRING -> cells.add(cell(column, value.textValue()));
            case BINARY, POJO -> cells.add(cell(column, value.asText()));
            case OBJECT -> {
                Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    emplace(column + "." + field.getKey(), field.getValue(), cells);
                }
            }
            case ARRAY -> {
                if (onlyScalars(value)) {
                    for (JsonNode element : value) {
                        cells.add(cell(column + "." + element.asText(), Boolean.TRUE));
                    }
                } else {
                    cells.add(cell(column, value.toString()));
                }
            }
        }
    }

    private static boolean onlyScalars(JsonNode array) {
        for (JsonNode element : array) {
            if (element.isContainerNode()) {
                return false;
            }
        }
        return true;
    }

    private static Object numberValue(JsonNode number) {
        if (number.isIntegralNumber() && number.canConvertToLong()) {
            return number.longValue();
        }
        return number.doubleValue();
    }

    private static Cell cell(String column, Object value) {
        return new Cell(column, value, IMPORT_TIMESTAMP);
    }
}
