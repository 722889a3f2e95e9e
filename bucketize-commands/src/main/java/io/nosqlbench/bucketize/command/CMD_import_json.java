package io.nosqlbench.bucketize.command;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import io.nosqlbench.bucketize.api.BucketizeException;
import io.nosqlbench.bucketize.api.RowSink;
import io.nosqlbench.bucketize.command.common.OutputSinkOption;
import io.nosqlbench.bucketize.command.common.VerbosityOption;
import io.nosqlbench.bucketize.importer.ImportResult;
import io.nosqlbench.bucketize.importer.JsonImportConfig;
import io.nosqlbench.bucketize.importer.JsonLinesImporter;
import io.nosqlbench.bucketize.sinks.RowSinks;
import io.nosqlbench.bucketize.sinks.SinkSpec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Import a file with one JSON object per line as flattened rows
@CommandLine.Command(name = "import-json",
    description = "Import a text file with one JSON object per line as rows")
public class CMD_import_json implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_import_json.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_FILE_EXISTS = 1;
    private static final int EXIT_ERROR = 2;

    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    @CommandLine.Option(names = {"-i", "--input"}, required = true,
        description = "The JSON-lines file to import")
    private Path inputPath;

    @CommandLine.Option(names = {"--offset"}, defaultValue = "0",
        description = "Skip the first n lines (default: ${DEFAULT-VALUE})")
    private long offset;

    @CommandLine.Option(names = {"--limit"}, defaultValue = "-1",
        description = "Maximum number of lines to process, -1 for all (default: ${DEFAULT-VALUE})")
    private long limit;

    @CommandLine.Option(names = {"--ignore-bad-lines"},
        description = "Count and skip lines that are not JSON objects instead of failing")
    private boolean ignoreBadLines;

    @CommandLine.Mixin
    private OutputSinkOption outputOption = new OutputSinkOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @Override
    public Integer call() {
        JsonImportConfig config;
        SinkSpec output;
        try {
            verbosityOption.validate();
            verbosityOption.applyLogLevel();
            config = new JsonImportConfig(inputPath, offset, limit, ignoreBadLines);
            output = outputOption.applyTo(null);
        } catch (IllegalArgumentException | IllegalStateException e) {
            logger.error(e.getMessage());
            return EXIT_ERROR;
        }
        if (output == null) {
            logger.error("No output configured. Use --output.");
            return EXIT_ERROR;
        }
        if (!Files.isRegularFile(inputPath)) {
            logger.error("Input file does not exist: {}", inputPath);
            return EXIT_ERROR;
        }
        if (OutputSinkOption.existsWithoutForce(output)) {
            logger.error("Output file already exists: {}. Use --force to overwrite.", output.path());
            return EXIT_FILE_EXISTS;
        }

        try (RowSink sink = RowSinks.open(output)) {
            ImportResult result = new JsonLinesImporter(config).run(sink);
            JsonObject summary = new JsonObject();
            summary.addProperty("rowCount", result.rowCount());
            summary.addProperty("numLineErrors", result.numLineErrors());
            summary.addProperty("output", result.sinkStatus().location());
            System.out.println(gson.toJson(summary));
            return EXIT_SUCCESS;
        } catch (BucketizeException | UncheckedIOException e) {
            logger.error("Import failed: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }
    }
}
