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
 * Shared tree file option.
 * Provides the required {@code -t/--tree} option naming a Newick file.
 */
public class TreeFileOption {

    @CommandLine.Option(
        names = {"-t", "--tree"},
        paramLabel = "TREE_FILE",
        description = "Input Newick format tree file",
        required = true
    )
    private Path treePath;

    /**
     * Gets the tree file path.
     */
    public Path getTreePath() {
        return treePath;
    }

    /**
     * Gets the normalized tree file path.
     */
    public Path getNormalizedTreePath() {
        return treePath != null ? treePath.normalize() : null;
    }

    /**
     * Validates that the tree file exists.
     *
     * @throws IllegalStateException if the option is missing or the file does not exist
     */
    public void validate() {
        if (treePath == null) {
            throw new IllegalStateException("Tree file is required");
        }
        if (!Files.isRegularFile(treePath)) {
            throw new IllegalStateException("Tree file does not exist: " + treePath);
        }
    }

    @Override
    public String toString() {
        return String.valueOf(treePath);
    }
}
