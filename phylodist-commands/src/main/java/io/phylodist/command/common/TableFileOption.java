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
 * Shared sample table option.
 * Provides the required {@code -i/--input} option naming a whitespace-delimited
 * taxa by samples table.
 */
public class TableFileOption {

    @CommandLine.Option(
        names = {"-i", "--input"},
        paramLabel = "TABLE_FILE",
        description = "Input tab-delimited sample-feature table",
        required = true
    )
    private Path tablePath;

    /**
     * Gets the table file path.
     */
    public Path getTablePath() {
        return tablePath;
    }

    /**
     * Gets the normalized table file path.
     */
    public Path getNormalizedTablePath() {
        return tablePath != null ? tablePath.normalize() : null;
    }

    /**
     * Validates that the table file exists.
     *
     * @throws IllegalStateException if the option is missing or the file does not exist
     */
    public void validate() {
        if (tablePath == null) {
            throw new IllegalStateException("Table file is required");
        }
        if (!Files.isRegularFile(tablePath)) {
            throw new IllegalStateException("Table file does not exist: " + tablePath);
        }
    }

    @Override
    public String toString() {
        return String.valueOf(tablePath);
    }
}
