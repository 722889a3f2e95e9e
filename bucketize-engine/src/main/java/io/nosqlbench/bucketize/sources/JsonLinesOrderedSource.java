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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nosqlbench.bucketize.api.OrderedRowSource;
import io.nosqlbench.bucketize.api.RankedRow;
import io.nosqlbench.bucketize.api.Timestamps;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/// Ranks the rows of a JSON-lines file.
///
/// Every non-blank line must hold a JSON object. Rows are sorted by the order-by fields with a
/// stable sort, so rows with equal keys keep their file order; offset and limit then apply to
/// the sorted rows. The file is read on the first iteration and the ranking reused after that.
///
/// For each order-by key the row carries a timestamp: the value of the timestamp field when one
/// is configured and holds a date, otherwise the key value itself when it is ISO-8601 date text.
public class JsonLinesOrderedSource implements OrderedRowSource {
    private static final Logger logger = LogManager.getLogger(JsonLinesOrderedSource.class);

    private static final ObjectMapper mapper = new ObjectMapper();

    private final JsonLinesSourceSpec spec;
    private List<RankedRow> ranked;

    public JsonLinesOrderedSource(JsonLinesSourceSpec spec) {
        this.spec = spec;
    }

    @Override
    public synchronized Iterator<RankedRow> iterator() {
        if (ranked == null) {
            ranked = rank();
        }
        return ranked.iterator();
    }

    @Override
    public String describe() {
        return spec.path() + (spec.orderBy().isEmpty() ? "" : " ordered by " + spec.orderBy());
    }

    private List<RankedRow> rank() {
        List<Entry> entries = read();
        List<OrderBy.Clause> clauses = spec.orderBy().clauses();
        if (!clauses.isEmpty()) {
            entries.sort(comparator(clauses));
        }

        int from = (int) Math.min(spec.offset(), entries.size());
        int to = spec.limit() < 0 || spec.limit() >= entries.size() - from
            ? entries.size()
            : from + (int) spec.limit();
        List<RankedRow> rows = new ArrayList<>(to - from);
        for (Entry entry : entries.subList(from, to)) {
            rows.add(new RankedRow(entry.rowName, Arrays.asList(entry.keyTimestamps)));
        }
        logger.debug("Ranked {} of {} rows from {}", rows.size(), entries.size(), spec.path());
        return List.copyOf(rows);
    }

    private List<Entry> read() {
        List<OrderBy.Clause> clauses = spec.orderBy().clauses();
        List<Entry> entries = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(spec.path(), StandardCharsets.UTF_8)) {
            String line;
            long lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                JsonNode row = parse(line, lineNumber);
                JsonNode nameNode = row.get(spec.rowNameField());
                String rowName = nameNode != null && !nameNode.isNull() ? nameNode.asText() : "row" + lineNumber;
                Instant rowTimestamp = spec.timestampField() == null ? null
                    : asTimestamp(row.get(spec.timestampField()), true);

                JsonNode[] keys = new JsonNode[clauses.size()];
                Instant[] keyTimestamps = new Instant[clauses.size()];
                for (int i = 0; i < clauses.size(); i++) {
                    keys[i] = row.get(clauses.get(i).field());
                    keyTimestamps[i] = rowTimestamp != null ? rowTimestamp : asTimestamp(keys[i], false);
                }
                entries.add(new Entry(rowName, keys, keyTimestamps));
            }
        } catch (IOException e) {
            throw new RowSourceException("Unable to read rows from " + spec.path(), e);
        }
        return entries;
    }

    private static JsonNode parse(String line, long lineNumber) {
        JsonNode node;
        try {
            node = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new RowSourceException("Unable to parse line " + lineNumber + " to JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new RowSourceException("JSON at line " + lineNumber + " is not an object");
        }
        return node;
    }

    /// @param node a JSON value, or null
    /// @param epochMillis whether integral numbers are read as epoch milliseconds
    /// @return the point in time the value denotes, or null
    static Instant asTimestamp(JsonNode node, boolean epochMillis) {
        if (node == null) {
            return null;
        }
        if (node.isTextual()) {
            return Timestamps.parse(node.textValue()).orElse(null);
        }
        if (epochMillis && node.isIntegralNumber() && node.canConvertToLong()) {
            return Instant.ofEpochMilli(node.longValue());
        }
        return null;
    }

    private static Comparator<Entry> comparator(List<OrderBy.Clause> clauses) {
        Comparator<Entry> comparator = null;
        for (int i = 0; i < clauses.size(); i++) {
            int keyIndex = i;
            Comparator<Entry> byKey = (a, b) -> JsonValueOrder.INSTANCE.compare(a.keys[keyIndex], b.keys[keyIndex]);
            if (clauses.get(i).descending()) {
                byKey = byKey.reversed();
            }
            comparator = comparator == null ? byKey : comparator.thenComparing(byKey);
        }
        return comparator;
    }

    private static final class Entry {
        private final String rowName;
        private final JsonNode[] keys;
        private final Instant[] keyTimestamps;

        private Entry(String rowName, JsonNode[] keys, Instant[] keyTimestamps) {
            this.rowName = rowName;
            this.keys = keys;
            this.keyTimestamps = keyTimestamps;
        }
    }
}
