package io.nosqlbench.bucketize.command.common;

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

import io.nosqlbench.bucketize.sinks.SinkSpec;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared output sink option with sink format and force overwrite flag.
 */
public class OutputSinkOption {

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "The output file path"
    )
    private Path outputPath;

    @CommandLine.Option(
        names = {"--format"},
        description = "The output sink type, e.g. jsonl or csv (default: from the file extension)"
    )
    private String format;

    @CommandLine.Option(
        names = {"-f", "--force"},
        description = "Force overwrite if output file already exists"
    )
    private boolean force = false;

    public Path getOutputPath() {
        return outputPath;
    }

    public String getFormat() {
        return format;
    }

    public boolean isForce() {
        return force;
    }

    /**
     * Applies the given options over a configured sink.
     *
     * @param configured the sink from a configuration file, or null
     * @return the effective sink, or null if neither names an output path
     */
    public SinkSpec applyTo(SinkSpec configured) {
        SinkSpec spec = configured;
        if (outputPath != null) {
            spec = spec == null ? SinkSpec.forPath(outputPath, force) : spec.withPath(outputPath);
        }
        if (spec == null) {
            return null;
        }
        if (format != null) {
            spec = spec.withType(format);
        }
        if (force) {
            spec = spec.withOverwrite(true);
        }
        return spec;
    }

    /**
     * Checks if the output file of a sink exists and may not be replaced.
     *
     * @param spec the effective sink
     * @return true if the command should stop
     */
    public static boolean existsWithoutForce(SinkSpec spec) {
        return Files.exists(spec.path()) && !spec.overwrite();
    }
}
