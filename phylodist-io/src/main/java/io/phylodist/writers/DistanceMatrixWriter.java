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

package io.phylodist.writers;

import io.phylodist.core.unifrac.DistanceMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/// Writes a {@link DistanceMatrix} as tab-delimited text.
///
/// The first row is {@code Sample} followed by the sample names; each further row is a sample
/// name followed by its distances to every sample, in the same order, with six decimals.
public class DistanceMatrixWriter {
    private static final Logger logger = LogManager.getLogger(DistanceMatrixWriter.class);

    /// Header of the first column
    public static final String CORNER = "Sample";

    private final Path filePath;

    /// @param filePath the output file; its parent directory is created when missing
    public DistanceMatrixWriter(Path filePath) {
        this.filePath = Objects.requireNonNull(filePath, "filePath cannot be null");
    }

    /// @return the output file
    public Path getFilePath() {
        return filePath;
    }

    /// Writes the matrix to a temporary file next to the target and moves it into place, so the
    /// target is either left untouched or holds the complete matrix.
    ///
    /// @param matrix the distances to write
    /// @throws IOException if the file cannot be written
    public void write(DistanceMatrix matrix) throws IOException {
        Path target = filePath.toAbsolutePath();
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = Files.createTempFile(parent, "." + target.getFileName(), ".tmp");
        try {
            try (BufferedWriter out = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                write(matrix, out);
            }
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move not supported for {}, falling back to replace", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        logger.info("Wrote {}x{} distance matrix to {}", matrix.size(), matrix.size(), target);
    }

    /// Writes the matrix text to a character stream. The stream is flushed but not closed.
    ///
    /// @param matrix the distances to write
    /// @param out    destination
    /// @throws IOException if writing fails
    public static void write(DistanceMatrix matrix, Writer out) throws IOException {
        List<String> samples = matrix.samples();
        StringBuilder line = new StringBuilder(CORNER);
        for (String sample : samples) {
            line.append('\t').append(sample);
        }
        out.write(line.append('\n').toString());

        for (int i = 0; i < samples.size(); i++) {
            line.setLength(0);
            line.append(samples.get(i));
            for (int j = 0; j < samples.size(); j++) {
                line.append('\t').append(format(matrix.get(i, j)));
            }
            out.write(line.append('\n').toString());
        }
        out.flush();
    }

    /// @return the distance with six decimals, independent of the default locale
    public static String format(double distance) {
        return String.format(Locale.ROOT, "%.6f", distance);
    }
}
