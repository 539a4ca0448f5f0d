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

import io.phylodist.core.TreeStructureException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.OptionalDouble;
import java.util.stream.IntStream;

/// Converts a {@link PhyloTree} into a {@link FlattenedTree}.
///
/// The flattening walks the tree once in postorder from the root and records, at each rank,
/// the rank of the parent and the length of the edge to it. Missing edge lengths become
/// {@code 0.0}; trees with an unlabelled root edge or without lengths on some branches are
/// common and are not an error.
public final class TreeFlattener {
    private static final Logger logger = LogManager.getLogger(TreeFlattener.class);

    private TreeFlattener() {
    }

    /// Flattens a tree.
    ///
    /// @param tree the source tree
    /// @return the flattened encoding
    /// @throws TreeStructureException if the tree has no root, if a node other than the root
    ///     has no parent, if some node is not reachable from the root, or if an edge length is
    ///     negative
    public static FlattenedTree flatten(PhyloTree tree) {
        int rootId = tree.root()
            .orElseThrow(() -> new TreeStructureException("Tree has no root node"));

        int[] order = tree.postorder(rootId);
        int numNodes = order.length;
        if (numNodes != tree.size()) {
            throw new TreeStructureException(describeUnreachable(tree, order, rootId));
        }

        int[] pos = new int[tree.size()];
        for (int rank = 0; rank < numNodes; rank++) {
            pos[order[rank]] = rank;
        }

        int[] tint = new int[numNodes];
        double[] lint = new double[numNodes];
        String[] names = new String[numNodes];

        int rootPos = pos[rootId];
        tint[rootPos] = rootPos;
        lint[rootPos] = 0.0;

        for (int rank = 0; rank < numNodes; rank++) {
            int node = order[rank];
            names[rank] = tree.name(node).orElse(null);
            if (node == rootId) {
                continue;
            }
            int parent = tree.parent(node);
            if (parent == PhyloTree.NO_PARENT) {
                throw new TreeStructureException("Node " + node + " has no parent but is not the root");
            }
            tint[rank] = pos[parent];
            OptionalDouble edge = tree.parentEdge(node);
            double length = edge.orElse(0.0);
            if (length < 0.0) {
                throw new TreeStructureException("Node " + describe(tree, node)
                    + " has a negative branch length: " + length);
            }
            lint[rank] = length;
        }

        logger.debug("Flattened tree with {} nodes, root at position {}", numNodes, rootPos);
        return new FlattenedTree(tint, lint, names, order, rootPos);
    }

    private static String describeUnreachable(PhyloTree tree, int[] order, int rootId) {
        boolean[] seen = new boolean[tree.size()];
        for (int node : order) {
            seen[node] = true;
        }
        int[] missing = IntStream.range(0, tree.size()).filter(n -> !seen[n]).toArray();
        for (int node : missing) {
            if (tree.parent(node) == PhyloTree.NO_PARENT) {
                return "Node " + describe(tree, node) + " has no parent but is not the root (root is node "
                    + rootId + ")";
            }
        }
        return "Tree is not connected: " + missing.length + " nodes are not reachable from the root "
            + Arrays.toString(Arrays.copyOf(missing, Math.min(8, missing.length)));
    }

    private static String describe(PhyloTree tree, int node) {
        return tree.name(node).map(name -> node + " (" + name + ")").orElse(String.valueOf(node));
    }
}
