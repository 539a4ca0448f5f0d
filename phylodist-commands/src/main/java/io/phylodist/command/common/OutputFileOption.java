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

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared output file option.
 * An existing output file is replaced once the new content has been written completely.
 */
public class OutputFileOption {

    @CommandLine.Option(
        names = {"-o", "--output"},
        paramLabel = "OUTPUT_FILE",
        description = "Output file for distance matrix",
        required = true
    )
    private Path outputPath;

    /**
     * Gets the output file path.
     */
    public Path getOutputPath() {
        return outputPath;
    }

    /**
     * Gets the normalized output file path.
     */
    public Path getNormalizedOutputPath() {
        return outputPath != null ? outputPath.normalize() : null;
    }

    /**
     * Validates that the output path does not name a directory.
     *
     * @throws IllegalStateException if the option is missing or names a directory
     */
    public void validate() {
        if (outputPath == null) {
            throw new IllegalStateException("Output file is required");
        }
        if (Files.isDirectory(outputPath)) {
            throw new IllegalStateException("Output path is a directory: " + outputPath);
        }
    }

    @Override
    public String toString() {
        return String.valueOf(outputPath);
    }
}
