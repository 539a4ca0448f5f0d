/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.phylodist.command.common;

import picocli.CommandLine;

/**
 * Shared parallel execution option.
 * Provides a {@code --threads} option for commands that fan work out over a thread pool.
 * Without it, every available processor is used.
 */
public class ParallelExecutionOption {

    @CommandLine.Option(
        names = {"--threads"},
        paramLabel = "N",
        description = "Number of worker threads (default: number of available processors)"
    )
    private Integer explicitThreads;

    /**
     * Gets the explicitly specified thread count, if any.
     *
     * @return the thread count, or null if auto-detect should be used
     */
    public Integer getExplicitThreads() {
        return explicitThreads;
    }

    /**
     * Calculates the thread count to use.
     *
     * @return the explicit thread count if given, otherwise the number of available processors
     */
    public int getOptimalThreadCount() {
        if (explicitThreads != null) {
            return explicitThreads;
        }
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Checks if the user explicitly specified more threads than available cores.
     *
     * @return true if thread count exceeds available cores
     */
    public boolean exceedsAvailableCores() {
        if (explicitThreads == null) {
            return false;
        }
        return explicitThreads > Runtime.getRuntime().availableProcessors();
    }

    /**
     * Validates the thread count.
     *
     * @throws IllegalStateException if an explicit thread count is not positive
     */
    public void validate() {
        if (explicitThreads != null && explicitThreads < 1) {
            throw new IllegalStateException("Thread count must be positive, got: " + explicitThreads);
        }
    }
}
