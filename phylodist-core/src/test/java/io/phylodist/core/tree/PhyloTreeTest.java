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

package io.phylodist.core.tree;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PhyloTree")
class PhyloTreeTest {

    @Test
    @DisplayName("postorder visits children before parents, siblings in insertion order")
    void postorderVisitsChildrenFirst() {
        PhyloTree tree = TestTrees.threeTips();

        int[] order = tree.postorder(tree.root().getAsInt());

        // ids: root=0, ab=1, A=2, B=3, C=4
        assertThat(order).containsExactly(2, 3, 1, 4, 0);
    }

    @Test
    @DisplayName("tips are the childless nodes")
    void tipsAreChildless() {
        PhyloTree tree = TestTrees.threeTips();

        assertThat(tree.tips()).containsExactly(2, 3, 4);
        assertThat(tree.isTip(1)).isFalse();
        assertThat(tree.children(1)).containsExactly(2, 3);
        assertThat(tree.children(0)).containsExactly(1, 4);
    }

    @Test
    @DisplayName("missing edge lengths and names are reported as empty")
    void missingValuesAreEmpty() {
        PhyloTree tree = TestTrees.threeTips();

        assertThat(tree.parentEdge(0)).isEmpty();
        assertThat(tree.name(0)).isEmpty();
        assertThat(tree.name(2)).contains("A");
        assertThat(tree.parentEdge(4).getAsDouble()).isEqualTo(2.0);
        assertThat(tree.parent(2)).isEqualTo(1);
        assertThat(tree.parent(0)).isEqualTo(PhyloTree.NO_PARENT);
    }

    @Test
    @DisplayName("empty tree has no root")
    void emptyTreeHasNoRoot() {
        assertThat(PhyloTree.builder().build().root()).isEmpty();
    }

    @Test
    @DisplayName("builder rejects unknown parents")
    void builderRejectsUnknownParent() {
        PhyloTree.Builder builder = PhyloTree.builder();
        builder.addRoot();

        assertThatThrownBy(() -> builder.addChild(5))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("has not been added");
    }

    @Test
    @DisplayName("empty names are stored as absent")
    void emptyNameIsAbsent() {
        PhyloTree.Builder builder = PhyloTree.builder();
        int root = builder.addRoot();
        builder.name(root, "");

        assertThat(builder.build().name(root)).isEmpty();
    }

    @Test
    @DisplayName("postorder of a subtree only contains that subtree")
    void postorderOfSubtree() {
        PhyloTree tree = TestTrees.threeTips();

        assertThat(tree.postorder(1)).containsExactly(2, 3, 1);
        assertThatThrownBy(() -> tree.postorder(9)).isInstanceOf(IndexOutOfBoundsException.class);
    }
}
