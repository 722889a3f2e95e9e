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

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Comparator;

/// Orders JSON values for ranking: missing and null first, then booleans, numbers, text, and
/// finally arrays and objects compared by their JSON text.
public final class JsonValueOrder implements Comparator<JsonNode> {

    /// The shared instance
    public static final JsonValueOrder INSTANCE = new JsonValueOrder();

    private JsonValueOrder() {
    }

    @Override
    public int compare(JsonNode a, JsonNode b) {
        int kindA = kind(a);
        int kindB = kind(b);
        if (kindA != kindB) {
            return Integer.compare(kindA, kindB);
        }
        return switch (kindA) {
            case 0 -> 0;
            case 1 -> Boolean.compare(a.booleanValue(), b.booleanValue());
            case 2 -> compareNumbers(a, b);
            case 3 -> a.textValue().compareTo(b.textValue());
            default -> a.toString().compareTo(b.toString());
        };
    }

    private static int compareNumbers(JsonNode a, JsonNode b) {
        if (a.canConvertToExactIntegral() && b.canConvertToExactIntegral()
            && a.canConvertToLong() && b.canConvertToLong()) {
            return Long.compare(a.longValue(), b.longValue());
        }
        return a.decimalValue().compareTo(b.decimalValue());
    }

    private static int kind(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return 0;
        }
        if (node.isBoolean()) {
            return 1;
        }
        if (node.isNumber()) {
            return 2;
        }
        if (node.isTextual()) {
            return 3;
        }
        return 4;
    }
}
