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
import io.phylodist.core.tree.FlattenedTree;
import io.phylodist.core.tree.PhyloTree;
import io.phylodist.core.tree.TreeFlattener;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("NewickTreeReader")
class NewickTreeReaderTest {

    @Nested
    @DisplayName("well formed input")
    class WellFormed {

        @Test
        @DisplayName("reads nested groups with lengths")
        void readsNestedGroups() {
            PhyloTree tree = NewickTreeReader.parse("((A:1,B:1):1,C:2);");

            assertThat(tree.size()).isEqualTo(5);
            assertThat(tree.root()).hasValue(0);
            assertThat(tree.children(0)).containsExactly(1, 4);
            assertThat(tree.name(2)).contains("A");
            assertThat(tree.name(4)).contains("C");
            assertThat(tree.parentEdge(1).getAsDouble()).isEqualTo(1.0);
            assertThat(tree.parentEdge(4).getAsDouble()).isEqualTo(2.0);
            assertThat(tree.parentEdge(0)).isEmpty();

            FlattenedTree flat = TreeFlattener.flatten(tree);
            assertThat(flat.parents()).containsExactly(2, 2, 4, 4, 4);
            assertThat(flat.branchLengths()).containsExactly(1.0, 1.0, 1.0, 2.0, 0.0);
        }

        @Test
        @DisplayName("keeps internal and root labels")
        void internalLabels() {
            PhyloTree tree = NewickTreeReader.parse("((A,B)ab:0.5,C)root;");

            assertThat(tree.name(0)).contains("root");
            assertThat(tree.name(1)).contains("ab");
            assertThat(tree.parentEdge(1).getAsDouble()).isEqualTo(0.5);
            assertThat(tree.parentEdge(2)).isEmpty();
        }

        @Test
        @DisplayName("reads scientific notation and polytomies")
        void scientificNotation() {
            PhyloTree tree = NewickTreeReader.parse("(A:1e-3,B:2.5E+1,C:-0.0,D:.5);");

            assertThat(tree.children(0)).hasSize(4);
            assertThat(tree.parentEdge(1).getAsDouble()).isEqualTo(0.001);
            assertThat(tree.parentEdge(2).getAsDouble()).isEqualTo(25.0);
            assertThat(tree.parentEdge(4).getAsDouble()).isEqualTo(0.5);
        }

        @Test
        @DisplayName("unquotes labels and keeps underscores")
        void quotedLabels() {
            PhyloTree tree = NewickTreeReader.parse("('tip one':1,'it''s',plain_name)'the root';");

            assertThat(tree.name(1)).contains("tip one");
            assertThat(tree.name(2)).contains("it's");
            assertThat(tree.name(3)).contains("plain_name");
            assertThat(tree.name(0)).contains("the root");
        }

        @Test
        @DisplayName("skips whitespace, line breaks and comments")
        void whitespaceAndComments() {
            PhyloTree tree = NewickTreeReader.parse("[tree 1]\n(\n  A : 1 [bootstrap],\n  B:2\n) ;\n");

            assertThat(tree.size()).isEqualTo(3);
            assertThat(tree.name(1)).contains("A");
            assertThat(tree.parentEdge(1).getAsDouble()).isEqualTo(1.0);
            assertThat(tree.parentEdge(2).getAsDouble()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("reads only the first of several trees")
        void firstTreeOnly() {
            PhyloTree tree = NewickTreeReader.parse("(A,B);\n(C,D,E);\n");

            assertThat(tree.size()).isEqualTo(3);
        }

        @Test
        @DisplayName("allows the final semicolon to be omitted")
        void missingSemicolon() {
            assertThat(NewickTreeReader.parse("(A,B)").size()).isEqualTo(3);
            assertThat(NewickTreeReader.parse("A;").size()).isEqualTo(1);
        }

        @Test
        @DisplayName("creates unnamed tips for empty positions")
        void emptyTips() {
            PhyloTree tree = NewickTreeReader.parse("(,A,);");

            assertThat(tree.children(0)).hasSize(3);
            assertThat(tree.name(1)).isEmpty();
            assertThat(tree.name(2)).contains("A");
            assertThat(tree.name(3)).isEmpty();
        }

        @Test
        @DisplayName("handles very deep nesting")
        void deepNesting() {
            int depth = 100_000;
            StringBuilder newick = new StringBuilder();
            newick.append("(".repeat(depth)).append("X");
            for (int i = 0; i < depth; i++) {
                newick.append(",T").append(i).append(")");
            }
            newick.append(';');

            PhyloTree tree = NewickTreeReader.parse(newick);

            assertThat(tree.size()).isEqualTo(2 * depth + 1);
            assertThat(TreeFlattener.flatten(tree).size()).isEqualTo(tree.size());
        }

        @Test
        @DisplayName("reads a tree file")
        void readsFile(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("tree.nwk");
            Files.writeString(file, "((A:1,B:1):1,C:2);\n");

            assertThat(NewickTreeReader.read(file).tips()).hasSize(3);
        }
    }

    @Nested
    @DisplayName("malformed input")
    class Malformed {

        @ParameterizedTest(name = "[{0}]")
        @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "\"\"             | Empty tree",
            "\"   \"          | Empty tree",
            "(A,B           | 1 unclosed group(s)",
            "((A,B)         | 1 unclosed group(s)",
            "(A,B));        | Unbalanced ')'",
            "(A,B)(C,D);    | Unexpected '('",
            "A,B;           | ',' outside of any group",
            "(A:x,B);       | Invalid branch length 'x' at offset 3",
            "(A:,B);        | Invalid branch length ''",
            "(A:Infinity,B);| Invalid branch length 'Infinity'",
            "(A:1,B:NaN);   | Invalid branch length 'NaN'",
            "(A:1d,B);      | Invalid branch length '1d'",
            "(A:0x1p3,B);   | Invalid branch length '0x1p3'",
            "(A:1e999,B);   | Branch length out of range '1e999'",
            "('A,B);        | Unterminated quoted label",
            "(A[note,B);    | Unterminated comment",
            "(A,B;          | ';' before 1 group(s) were closed",
            ";              | Unexpected ';'",
        })
        @DisplayName("is rejected with a position")
        void rejectsMalformed(String newick, String message) {
            assertThatThrownBy(() -> NewickTreeReader.parse(newick))
                .isInstanceOf(InputFormatException.class)
                .hasMessageContaining(message)
                .hasMessageContaining("at offset");
        }

        @Test
        @DisplayName("names the file in the message")
        void namesFile(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("broken.nwk");
            Files.writeString(file, "((A,B);");

            assertThatThrownBy(() -> NewickTreeReader.read(file))
                .isInstanceOf(InputFormatException.class)
                .hasMessageStartingWith(file + ": ")
                .satisfies(e -> assertThat(((InputFormatException) e).getSource()).isEqualTo(file));
        }

        @Test
        @DisplayName("reports unreadable files")
        void missingFile(@TempDir Path dir) {
            assertThatThrownBy(() -> NewickTreeReader.read(dir.resolve("absent.nwk")))
                .isInstanceOf(InputFormatException.class)
                .hasMessageContaining("Unable to read tree file")
                .hasCauseInstanceOf(IOException.class);
        }
    }
}
