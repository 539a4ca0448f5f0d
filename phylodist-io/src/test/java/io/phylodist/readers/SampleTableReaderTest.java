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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SampleTableReader")
class SampleTableReaderTest {

    private static SampleTable read(SampleTableReader reader, String text) throws IOException {
        return reader.read(new StringReader(text), null);
    }

    @Test
    @DisplayName("reads samples from the header and taxa from the first column")
    void readsTable() throws IOException {
        SampleTable table = read(new SampleTableReader(),
            "#OTU\tS1\tS2\tS3\n"
                + "A\t1\t0\t2.5\n"
                + "B   0   3   0\n");

        assertThat(table.samples()).containsExactly("S1", "S2", "S3");
        assertThat(table.taxa()).containsExactly("A", "B");
        assertThat(table.toArray()).isDeepEqualTo(new double[][]{{1, 0, 2.5}, {0, 3, 0}});
    }

    @Test
    @DisplayName("reads malformed numbers as zero and counts them")
    void malformedValues() throws IOException {
        SampleTableReader reader = new SampleTableReader();

        SampleTable table = read(reader, "id S1 S2\nA 1 n/a\nB x 2\n");

        assertThat(table.toArray()).isDeepEqualTo(new double[][]{{1, 0}, {0, 2}});
        assertThat(reader.malformedCells()).isEqualTo(2);
    }

    @Test
    @DisplayName("pads short lines with zeros and ignores extra values")
    void shortAndLongLines() throws IOException {
        SampleTableReader reader = new SampleTableReader();

        SampleTable table = read(reader, "id S1 S2 S3\nA 4\nB 1 2 3 4 5\nC\n");

        assertThat(table.toArray()).isDeepEqualTo(new double[][]{{4, 0, 0}, {1, 2, 3}, {0, 0, 0}});
        assertThat(reader.missingCells()).isEqualTo(5);
        assertThat(reader.malformedCells()).isZero();
    }

    @Test
    @DisplayName("rejects a line without a taxon")
    void rejectsLineWithoutTaxon() {
        assertThatThrownBy(() -> read(new SampleTableReader(), "x S1 S2\nA 1 0\n   \nC 0 1\n"))
            .isInstanceOf(InputFormatException.class)
            .hasMessage("Taxon missing on line 3");
        assertThatThrownBy(() -> read(new SampleTableReader(), "x S1\nA 1\n\n"))
            .isInstanceOf(InputFormatException.class)
            .hasMessageContaining("line 3");
    }

    @Test
    @DisplayName("keeps taxa whose name starts with #")
    void keepsHashTaxa() throws IOException {
        SampleTable table = read(new SampleTableReader(), "x S1 S2\nA 1 0\n#B 0 1\nC 0 1\n");

        assertThat(table.taxa()).containsExactly("A", "#B", "C");
        assertThat(table.toArray()[1]).containsExactly(0.0, 1.0);
    }

    @Test
    @DisplayName("takes every header token after the first as a sample")
    void headerTokens() throws IOException {
        SampleTable table = read(new SampleTableReader(), "#OTU ID\tS1\nA 1 2\n");

        assertThat(table.samples()).containsExactly("ID", "S1");
    }

    @Test
    @DisplayName("accepts a header without any taxa")
    void headerOnly() throws IOException {
        SampleTable table = read(new SampleTableReader(), "id S1 S2\n");

        assertThat(table.taxonCount()).isZero();
        assertThat(table.sampleCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("rejects an empty input")
    void rejectsEmpty() {
        assertThatThrownBy(() -> read(new SampleTableReader(), ""))
            .isInstanceOf(InputFormatException.class)
            .hasMessage("No header in table");
    }

    @Test
    @DisplayName("rejects a header without sample names")
    void rejectsHeaderWithoutSamples() {
        assertThatThrownBy(() -> read(new SampleTableReader(), "#OTU\nA 1\n"))
            .isInstanceOf(InputFormatException.class)
            .hasMessageContaining("no sample names");
    }

    @Test
    @DisplayName("reads a file and names it in errors")
    void readsFile(@TempDir Path dir) throws IOException {
        Path good = dir.resolve("table.tsv");
        Files.writeString(good, "id\tS1\tS2\nA\t1\t1\n");
        Path empty = dir.resolve("empty.tsv");
        Files.writeString(empty, "");

        assertThat(new SampleTableReader().read(good).sampleCount()).isEqualTo(2);
        assertThatThrownBy(() -> new SampleTableReader().read(empty))
            .isInstanceOf(InputFormatException.class)
            .hasMessage(empty + ": No header in table");
        assertThatThrownBy(() -> new SampleTableReader().read(dir.resolve("absent.tsv")))
            .isInstanceOf(InputFormatException.class)
            .hasMessageContaining("Unable to read table file");
    }
}
