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

package io.phylodist.core.unifrac;

import io.phylodist.core.TreeStructureException;
import io.phylodist.core.table.SampleTable;
import io.phylodist.core.tree.PhyloTree;
import io.phylodist.core.tree.TestTrees;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("UniFracPipeline")
class UniFracPipelineTest {

    @Test
    @DisplayName("computes the matrix and reports tree diagnostics")
    void computesMatrix() {
        SampleTable table = new SampleTable(
            List.of("A", "B", "C"),
            List.of("S1", "S2", "S3"),
            new double[][]{{1, 0, 2}, {0, 1, 0}, {0, 0, 7}});

        UniFracResult result = new UniFracPipeline(2, DistanceNormalization.NONE).run(TestTrees.threeTips(), table);

        DistanceMatrix matrix = result.matrix();
        assertThat(matrix.samples()).containsExactly("S1", "S2", "S3");
        assertThat(matrix.get(0, 1)).isCloseTo(2.0, within(1e-12));
        // {A} against {A,C}: half of the mass moves from A to C
        assertThat(matrix.get(0, 2)).isCloseTo(2.0, within(1e-12));
        assertThat(matrix.get(1, 2)).isCloseTo(3.0, within(1e-12));
        assertThat(result.treeNodes()).isEqualTo(5);
        assertThat(result.totalBranchLength()).isEqualTo(5.0);
        assertThat(result.unmatchedTaxa()).isEmpty();
        assertThat(result.normalization()).isEqualTo(DistanceNormalization.NONE);
    }

    @Test
    @DisplayName("a taxon missing from the tree changes nothing versus deleting its row")
    void unmatchedTaxonIsIgnored() {
        PhyloTree tree = TestTrees.threeTips();
        SampleTable withStray = new SampleTable(
            List.of("A", "X", "B", "C"),
            List.of("S1", "S2", "S3"),
            new double[][]{{1, 0, 1}, {5, 5, 0}, {0, 1, 1}, {0, 0, 1}});
        SampleTable withoutStray = withStray.retainTaxa(taxon -> !taxon.equals("X"));
        UniFracPipeline pipeline = new UniFracPipeline(1, DistanceNormalization.NONE);

        UniFracResult with = pipeline.run(tree, withStray);
        UniFracResult without = pipeline.run(tree, withoutStray);

        assertThat(with.matrix().toArray()).isDeepEqualTo(without.matrix().toArray());
        assertThat(with.matrix().get(0, 1)).isCloseTo(2.0, within(1e-12));
        assertThat(with.unmatchedTaxa()).containsExactly("X");
        assertThat(with.unmatchedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("tree length normalization divides by the total branch length")
    void treeLengthNormalization() {
        SampleTable table = new SampleTable(
            List.of("A", "B", "C"),
            List.of("S1", "S2"),
            new double[][]{{1, 0}, {0, 1}, {1, 0}});

        UniFracResult result = new UniFracPipeline(1, DistanceNormalization.TREE_LENGTH).run(TestTrees.threeTips(), table);

        assertThat(result.matrix().get(0, 1)).isCloseTo(0.6, within(1e-12));
    }

    @Test
    @DisplayName("propagates tree structure errors")
    void propagatesTreeErrors() {
        SampleTable table = new SampleTable(List.of("A"), List.of("S1"), new double[][]{{1}});

        assertThatThrownBy(() -> new UniFracPipeline(1, DistanceNormalization.NONE).run(PhyloTree.builder().build(), table))
            .isInstanceOf(TreeStructureException.class);
    }

    @Test
    @DisplayName("rejects non-positive thread counts")
    void rejectsBadThreads() {
        assertThatThrownBy(() -> new UniFracPipeline(0, DistanceNormalization.NONE))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
