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

import picocli.CommandLine;

/**
 * Shared parallel execution options.
 * Provides {@code --parallel} and {@code --threads} options for commands that fan work out
 * over a worker pool.
 */
public class ParallelExecutionOption {

    @CommandLine.Option(
        names = {"-p", "--parallel"},
        description = "Use all but one of the available CPU cores"
    )
    private boolean parallel = false;

    @CommandLine.Option(
        names = {"--threads"},
        description = "Number of worker threads (overrides --parallel and the configured parallelism)"
    )
    private Integer explicitThreads;

    /**
     * Checks if parallel execution was requested.
     *
     * @return true if {@code --parallel} was given
     */
    public boolean isParallel() {
        return parallel;
    }

    /**
     * Gets the explicitly specified thread count, if any.
     *
     * @return the thread count, or null if none was given
     */
    public Integer getExplicitThreads() {
        return explicitThreads;
    }

    /**
     * Checks if either option was given on the command line.
     *
     * @return true if the parallelism should override the configured value
     */
    public boolean isSpecified() {
        return parallel || explicitThreads != null;
    }

    /**
     * Resolves the worker count. An explicit thread count wins, then {@code --parallel},
     * then the configured value.
     *
     * @param configured the parallelism from the configuration
     * @return the thread count to use
     */
    public int resolveThreadCount(int configured) {
        if (explicitThreads != null) {
            return explicitThreads;
        } else if (parallel) {
            return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        } else {
            return configured;
        }
    }

    /**
     * Checks if the user explicitly specified at least as many threads as available cores.
     *
     * @return true if the thread count may cause contention
     */
    public boolean exceedsAvailableCores() {
        if (explicitThreads == null) {
            return false;
        }
        return explicitThreads >= Runtime.getRuntime().availableProcessors();
    }
}
