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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Assign ranked rows to named percentile buckets, and import JSON-lines files as rows
@CommandLine.Command(name = "bucketize-tools",
    header = "Assign ranked rows to named percentile buckets",
    description = "Contains subcommands to bucketize ranked rows and to import JSON-lines files",
    mixinStandardHelpOptions = true,
    subcommands = {
        CMD_bucketize.class,
        CMD_import_json.class,
        CommandLine.HelpCommand.class
    })
public class BucketizeTools implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(BucketizeTools.class);

    /// Create the BucketizeTools command
    public BucketizeTools() {}

    /// Run a bucketize-tools command
    /// @param args Command line arguments
    public static void main(String[] args) {
        BucketizeTools command = new BucketizeTools();
        CommandLine commandLine = new CommandLine(command).setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
        logger.debug("executing commandline");
        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        // Print help information if no subcommand is specified
        CommandLine.usage(this, System.out);
        return 0;
    }
}
