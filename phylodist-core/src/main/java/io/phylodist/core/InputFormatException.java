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

package io.phylodist.core;

import java.nio.file.Path;

/// Raised when an input file cannot be read or does not have the expected layout,
/// for example a table without a header line or an unbalanced Newick string.
public class InputFormatException extends PhyloDistException {

    private final Path source;

    public InputFormatException(String message) {
        this(null, message, null);
    }

    public InputFormatException(Path source, String message) {
        this(source, message, null);
    }

    public InputFormatException(Path source, String message, Throwable cause) {
        super(source == null ? message : source + ": " + message, cause);
        this.source = source;
    }

    /// @return the file that failed to parse, or null when the input did not come from a file
    public Path getSource() {
        return source;
    }
}
