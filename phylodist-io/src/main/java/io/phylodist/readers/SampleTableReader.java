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

package io.phylodist.readers;

import io.phylodist.core.InputFormatException;
import io.phylodist.core.table.SampleTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// Reads a whitespace-delimited sample by taxon table.
///
/// Layout:
/// ```
/// #OTU     sampleA  sampleB  sampleC
/// taxon1   12       0        3
/// taxon2   0        7        1
/// ```
///
/// The first token of the header line is ignored; the remaining tokens name the samples in
/// column order. Every following line starts with a taxon name followed by one value per
/// sample. Values that do not parse as numbers are read as {@code 0.0}, as are values missing
/// at the end of a short line. Values beyond the last sample are ignored. A line after the
/// header without any token has no taxon and is rejected.
///
/// A reader instance counts the cells it had to coerce; see {@link #malformedCells()}.
public class SampleTableReader {
    private static final Logger logger = LogManager.getLogger(SampleTableReader.class);

    private long malformedCells;
    private long missingCells;

    /// Reads a table file.
    ///
    /// @param path the table file
    /// @return the raw table
    /// @throws InputFormatException if the file cannot be read, has no header, or a line has no
    ///     taxon
    public SampleTable read(Path path) {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            SampleTable table = read(reader, path);
            logger.info("Read table from {}: {} taxa x {} samples", path, table.taxonCount(), table.sampleCount());
            return table;
        } catch (IOException e) {
            throw new InputFormatException(path, "Unable to read table file: " + e.getMessage(), e);
        }
    }

    /// Reads a table from a character stream.
    ///
    /// @param in     the table text
    /// @param source the file the text came from, for error messages; may be null
    /// @return the raw table
    /// @throws IOException if reading fails
    /// @throws InputFormatException if there is no header or a line has no taxon
    public SampleTable read(Reader in, Path source) throws IOException {
        malformedCells = 0;
        missingCells = 0;
        BufferedReader reader = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);

        String header = reader.readLine();
        if (header == null) {
            throw new InputFormatException(source, "No header in table");
        }
        String[] headerTokens = tokens(header);
        if (headerTokens.length < 2) {
            throw new InputFormatException(source, "Header line has no sample names");
        }
        List<String> samples = Arrays.asList(headerTokens).subList(1, headerTokens.length);
        int sampleCount = samples.size();

        List<String> taxa = new ArrayList<>();
        List<double[]> rows = new ArrayList<>();
        String line;
        int lineNumber = 1;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String[] parts = tokens(line);
            if (parts.length == 0) {
                throw new InputFormatException(source, "Taxon missing on line " + lineNumber);
            }
            taxa.add(parts[0]);
            double[] values = new double[sampleCount];
            for (int sample = 0; sample < sampleCount; sample++) {
                int token = sample + 1;
                if (token < parts.length) {
                    values[sample] = parseValue(parts[token], source, lineNumber);
                } else {
                    missingCells++;
                }
            }
            rows.add(values);
        }

        if (malformedCells > 0 || missingCells > 0) {
            logger.debug("{}: {} malformed and {} missing values read as 0.0",
                source == null ? "table" : source, malformedCells, missingCells);
        }
        return new SampleTable(taxa, samples, rows.toArray(new double[0][]));
    }

    private double parseValue(String token, Path source, int lineNumber) {
        try {
            return Double.parseDouble(token);
        } catch (NumberFormatException e) {
            malformedCells++;
            logger.trace("{} line {}: '{}' is not a number, using 0.0",
                source == null ? "table" : source, lineNumber, token);
            return 0.0;
        }
    }

    private static String[] tokens(String line) {
        String trimmed = line.strip();
        return trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+");
    }

    /// @return the number of values in the last table read that were not numbers
    public long malformedCells() {
        return malformedCells;
    }

    /// @return the number of values in the last table read that were missing from short lines
    public long missingCells() {
        return missingCells;
    }
}
