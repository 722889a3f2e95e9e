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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nosqlbench.bucketize.api.NamedRow;
import io.nosqlbench.bucketize.api.RowSink;
import io.nosqlbench.bucketize.api.SinkStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

/// Imports a file with one JSON object per line as rows.
///
/// Line numbers are zero-based physical lines and row names are `row<lineNumber+1>`. The first
/// `offset` lines are skipped and at most `limit` lines after them are read. Empty lines count
/// as lines but produce no row. Rows go to the sink in batches and the sink is committed once.
public class JsonLinesImporter {
    private static final Logger logger = LogManager.getLogger(JsonLinesImporter.class);

    /// The number of rows recorded per sink call
    public static final int BATCH_SIZE = 1024;

    private static final ObjectMapper mapper = new ObjectMapper();

    private final JsonImportConfig config;

    public JsonLinesImporter(JsonImportConfig config) {
        this.config = config;
    }

    /// @param sink the destination; committed on success, never closed
    /// @return the import counts and the sink status
    /// @throws JsonImportException for a bad line when bad lines are not ignored
    public ImportResult run(RowSink sink) {
        logger.info("Importing JSON lines from {}", config.dataFile());
        long rowCount = 0;
        long errors = 0;
        List<NamedRow> batch = new ArrayList<>(BATCH_SIZE);

        try (BufferedReader reader = Files.newBufferedReader(config.dataFile(), StandardCharsets.UTF_8)) {
            String line;
            long lineNumber = -1;
            long processed = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (lineNumber < config.offset()) {
                    continue;
                }
                if (config.limit() >= 0 && processed >= config.limit()) {
                    break;
                }
                processed++;
                if (line.isEmpty()) {
                    continue;
                }

                JsonNode root;
                try {
                    root = parse(line, lineNumber);
                } catch (JsonImportException e) {
                    if (!config.ignoreBadLines()) {
                        throw e;
                    }
                    logger.warn("Skipping line {}: {}", lineNumber, e.getMessage());
                    errors++;
                    continue;
                }

                batch.add(new NamedRow("row" + (lineNumber + 1), JsonRowFlattener.flatten(root)));
                rowCount++;
                if (batch.size() >= BATCH_SIZE) {
                    sink.recordRows(batch);
                    batch.clear();
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + config.dataFile(), e);
        }

        if (!batch.isEmpty()) {
            sink.recordRows(batch);
        }
        SinkStatus status = sink.commit();
        logger.info("Imported {} rows with {} line errors", rowCount, errors);
        return new ImportResult(rowCount, errors, status);
    }

    private static JsonNode parse(String line, long lineNumber) {
        JsonNode root;
        try {
            root = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new JsonImportException("Unable to parse line " + lineNumber + " to JSON", lineNumber, e);
        }
        if (root == null || !root.isObject()) {
            throw new JsonImportException("JSON at line " + lineNumber + " is not an object", lineNumber);
        }
        return root;
    }
}
