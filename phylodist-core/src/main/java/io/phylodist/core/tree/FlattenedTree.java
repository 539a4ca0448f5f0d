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

import java.util.Arrays;
import java.util.Optional;

/// Array encoding of a rooted tree, indexed by postorder rank.
///
/// For every position {@code p}:
/// - {@code parent(p)} is the position of the parent node; the root is its own parent and is
///   the only position for which that holds
/// - {@code branchLength(p)} is the length of the edge to the parent, {@code 0} for the root
/// - {@code name(p)} is the label of the source node, if it had one
///
/// Children always sit at lower positions than their parents, so a single pass over
/// increasing positions sees every subtree complete before its parent.
///
/// Instances are immutable and shared read-only by all pair computations.
public final class FlattenedTree {

    private final int[] tint;
    private final double[] lint;
    private final String[] names;
    private final int[] postorder;
    private final int root;

    FlattenedTree(int[] tint, double[] lint, String[] names, int[] postorder, int root) {
        this.tint = tint;
        this.lint = lint;
        this.names = names;
        this.postorder = postorder;
        this.root = root;
    }

    /// @return the number of positions, equal to the number of nodes in the source tree
    public int size() {
        return tint.length;
    }

    /// @return the position of the root, always the last position
    public int rootPosition() {
        return root;
    }

    /// @return the parent position of {@code position}
    public int parent(int position) {
        return tint[position];
    }

    /// @return the edge length between {@code position} and its parent
    public double branchLength(int position) {
        return lint[position];
    }

    /// @return the source node label at {@code position}, if any
    public Optional<String> name(int position) {
        return Optional.ofNullable(names[position]);
    }

    /// @return the source tree node id at {@code position}
    public int nodeId(int position) {
        return postorder[position];
    }

    /// @return a copy of the parent array
    public int[] parents() {
        return tint.clone();
    }

    /// @return a copy of the branch length array
    public double[] branchLengths() {
        return lint.clone();
    }

    /// @return a copy of the source node ids in postorder
    public int[] postorder() {
        return postorder.clone();
    }

    /// Sums every edge length in the tree. The root contributes nothing.
    /// @return the total branch length
    public double totalBranchLength() {
        double total = 0.0;
        for (double length : lint) {
            total += length;
        }
        return total;
    }

    @Override
    public String toString() {
        return "FlattenedTree{size=" + tint.length + ", root=" + root
            + ", tint=" + (tint.length <= 16 ? Arrays.toString(tint) : "...") + "}";
    }
}
