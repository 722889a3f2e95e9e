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
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.nosqlbench.bucketize.api.BucketizeException;
import io.nosqlbench.bucketize.api.RowSink;
import io.nosqlbench.bucketize.api.SinkStatus;
import io.nosqlbench.bucketize.api.Timestamps;
import io.nosqlbench.bucketize.command.common.OutputSinkOption;
import io.nosqlbench.bucketize.command.common.ParallelExecutionOption;
import io.nosqlbench.bucketize.command.common.PercentileBucketOption;
import io.nosqlbench.bucketize.command.common.VerbosityOption;
import io.nosqlbench.bucketize.config.BucketizeConfig;
import io.nosqlbench.bucketize.config.BucketizeConfigLoader;
import io.nosqlbench.bucketize.engine.BucketSummary;
import io.nosqlbench.bucketize.engine.BucketizeProcedure;
import io.nosqlbench.bucketize.engine.BucketizeResult;
import io.nosqlbench.bucketize.engine.ProgressCallback;
import io.nosqlbench.bucketize.sinks.RowSinks;
import io.nosqlbench.bucketize.sources.JsonLinesOrderedSource;
import io.nosqlbench.bucketize.sources.JsonLinesSourceSpec;
import io.nosqlbench.bucketize.sources.OrderBy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Assign the rows of a JSON-lines file to named percentile buckets by their rank
///
/// Settings come from an optional YAML or JSON configuration file and are overridden by the
/// command line options. The rows are ranked by `--order-by`, each bucket resolves to a slice
/// of the ranking, and one `bucket` cell per row is written to the output sink. A summary of
/// the run is printed as JSON on stdout.
@CommandLine.Command(name = "bucketize",
    description = "Assign ranked rows to named percentile buckets")
public class CMD_bucketize implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_bucketize.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_FILE_EXISTS = 1;
    private static final int EXIT_ERROR = 2;

    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    @CommandLine.Option(names = {"--config"},
        description = "A YAML or JSON file with percentileBuckets, input, output and tuning settings")
    private Path configFile;

    @CommandLine.Option(names = {"-i", "--input"},
        description = "The JSON-lines file holding the rows to rank")
    private Path inputPath;

    @CommandLine.Option(names = {"--order-by"},
        description = "The ranking order, e.g. 'score DESC, id'")
    private String orderBy;

    @CommandLine.Option(names = {"--row-name-field"},
        description = "The field holding the row name (default: rowName)")
    private String rowNameField;

    @CommandLine.Option(names = {"--timestamp-field"},
        description = "The field holding the row timestamp")
    private String timestampField;

    @CommandLine.Option(names = {"--offset"},
        description = "Number of ranked rows to skip")
    private Long offset;

    @CommandLine.Option(names = {"--limit"},
        description = "Maximum number of ranked rows to bucketize, -1 for all")
    private Long limit;

    @CommandLine.Option(names = {"--flush-threshold"},
        description = "Buffered assignments per worker before a sink write (default: "
            + BucketizeConfig.DEFAULT_FLUSH_THRESHOLD + ")")
    private Integer flushThreshold;

    @CommandLine.Mixin
    private PercentileBucketOption bucketOption = new PercentileBucketOption();

    @CommandLine.Mixin
    private OutputSinkOption outputOption = new OutputSinkOption();

    @CommandLine.Mixin
    private ParallelExecutionOption parallelExecutionOption = new ParallelExecutionOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @Override
    public Integer call() {
        BucketizeConfig config;
        try {
            verbosityOption.validate();
            verbosityOption.applyLogLevel();
            config = effectiveConfig();
        } catch (BucketizeException | IllegalArgumentException | IllegalStateException e) {
            logger.error(e.getMessage());
            return EXIT_ERROR;
        }

        if (config.percentileBuckets().isEmpty()) {
            logger.error("No percentile buckets configured. Use --bucket or percentileBuckets in --config.");
            return EXIT_ERROR;
        }
        if (config.input() == null) {
            logger.error("No input configured. Use --input or input in --config.");
            return EXIT_ERROR;
        }
        if (config.output() == null) {
            logger.error("No output configured. Use --output or output in --config.");
            return EXIT_ERROR;
        }
        if (OutputSinkOption.existsWithoutForce(config.output())) {
            logger.error("Output file already exists: {}. Use --force to overwrite.", config.output().path());
            return EXIT_FILE_EXISTS;
        }
        if (parallelExecutionOption.exceedsAvailableCores()) {
            logger.warn("Specified thread count ({}) >= available cores ({}). This may cause contention.",
                parallelExecutionOption.getExplicitThreads(), Runtime.getRuntime().availableProcessors());
        }

        try {
            BucketizeProcedure procedure = new BucketizeProcedure(config);
            ProgressCallback progress = verbosityOption.showVerbose()
                ? (fraction, message) -> logger.debug("[{}%] {}", Math.round(fraction * 100), message)
                : ProgressCallback.NONE;
            BucketizeResult result;
            try (RowSink sink = RowSinks.open(config.output())) {
                result = procedure.run(new JsonLinesOrderedSource(config.input()), sink, progress);
            }
            System.out.println(gson.toJson(summarize(config, result)));
            return EXIT_SUCCESS;
        } catch (BucketizeException e) {
            logger.error("Bucketize failed: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }
    }

    /// Read the configuration file, if any, and apply the command line over it.
    BucketizeConfig effectiveConfig() {
        BucketizeConfig config = configFile != null
            ? BucketizeConfigLoader.load(configFile)
            : BucketizeConfig.defaults();

        if (bucketOption.isSpecified()) {
            config = config.withPercentileBuckets(bucketOption.getBuckets());
        }
        if (flushThreshold != null) {
            config = config.withFlushThreshold(flushThreshold);
        }
        if (parallelExecutionOption.isSpecified()) {
            config = config.withParallelism(parallelExecutionOption.resolveThreadCount(config.parallelism()));
        }
        config = config.withInput(applyInputOptions(config.input()));
        return config.withOutput(outputOption.applyTo(config.output()));
    }

    private JsonLinesSourceSpec applyInputOptions(JsonLinesSourceSpec configured) {
        JsonLinesSourceSpec spec = configured;
        if (inputPath != null) {
            spec = spec == null ? JsonLinesSourceSpec.of(inputPath) : spec.withPath(inputPath);
        }
        if (spec == null) {
            return null;
        }
        if (orderBy != null) {
            spec = spec.withOrderBy(OrderBy.parse(orderBy));
        }
        if (rowNameField != null) {
            spec = spec.withRowNameField(rowNameField);
        }
        if (timestampField != null) {
            spec = spec.withTimestampField(timestampField);
        }
        if (offset != null) {
            spec = spec.withOffset(offset);
        }
        if (limit != null) {
            spec = spec.withLimit(limit);
        }
        return spec;
    }

    private static JsonObject summarize(BucketizeConfig config, BucketizeResult result) {
        JsonObject summary = new JsonObject();
        summary.addProperty("input", config.input().path().toString());
        summary.addProperty("rowCount", result.rowCount());
        summary.addProperty("timestamp", Timestamps.format(result.representativeTimestamp()));
        summary.addProperty("assignments", result.assignments());
        summary.addProperty("flushes", result.flushes());
        summary.addProperty("parallelism", config.parallelism());
        summary.addProperty("flushThreshold", config.flushThreshold());

        JsonArray buckets = new JsonArray();
        for (BucketSummary bucket : result.buckets()) {
            JsonObject b = new JsonObject();
            b.addProperty("label", bucket.label());
            b.addProperty("start", bucket.range().start());
            b.addProperty("end", bucket.range().end());
            b.addProperty("lowerBound", bucket.interval().lowerBound());
            b.addProperty("higherBound", bucket.interval().higherBound());
            b.addProperty("rows", bucket.rowCount());
            buckets.add(b);
        }
        summary.add("buckets", buckets);

        SinkStatus status = result.sinkStatus();
        JsonObject sink = new JsonObject();
        sink.addProperty("type", status.sinkType());
        sink.addProperty("location", status.location());
        sink.addProperty("rowCount", status.rowCount());
        sink.addProperty("cellCount", status.cellCount());
        summary.add("sink", sink);
        return summary;
    }
}
