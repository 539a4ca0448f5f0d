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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.stream.IntStream;

/// A rooted phylogenetic tree addressed by integer node ids.
///
/// Node ids are assigned by the {@link Builder} in creation order, starting at 0. Every node
/// other than a root refers to a parent that was created before it, so a tree built here can
/// never contain a cycle. Edge lengths and names are optional: a missing edge length is
/// reported as an empty {@link OptionalDouble}, and it is up to the consumer to decide what
/// that means.
///
/// Instances are immutable and safe to share between threads.
public final class PhyloTree {

    /// Parent value used for nodes that have no parent
    public static final int NO_PARENT = -1;

    private final int[] parents;
    private final double[] parentEdges;
    private final String[] names;
    private final int[][] children;

    private PhyloTree(int[] parents, double[] parentEdges, String[] names) {
        this.parents = parents;
        this.parentEdges = parentEdges;
        this.names = names;
        this.children = buildChildren(parents);
    }

    private static int[][] buildChildren(int[] parents) {
        int[] counts = new int[parents.length];
        for (int parent : parents) {
            if (parent != NO_PARENT) {
                counts[parent]++;
            }
        }
        int[][] children = new int[parents.length][];
        for (int i = 0; i < parents.length; i++) {
            children[i] = new int[counts[i]];
        }
        int[] fill = new int[parents.length];
        for (int node = 0; node < parents.length; node++) {
            int parent = parents[node];
            if (parent != NO_PARENT) {
                children[parent][fill[parent]++] = node;
            }
        }
        return children;
    }

    /// @return the number of nodes in the tree, including internal nodes and the root
    public int size() {
        return parents.length;
    }

    /// Finds the root: the first node, in id order, that has no parent.
    ///
    /// A well-formed tree has exactly one such node. Any further parentless node is a
    /// malformed input which {@link TreeFlattener} rejects.
    ///
    /// @return the root node id, or empty when the tree has no nodes
    public OptionalInt root() {
        for (int node = 0; node < parents.length; node++) {
            if (parents[node] == NO_PARENT) {
                return OptionalInt.of(node);
            }
        }
        return OptionalInt.empty();
    }

    /// @param node a node id
    /// @return the parent id, or {@link #NO_PARENT}
    public int parent(int node) {
        return parents[node];
    }

    /// @param node a node id
    /// @return the length of the edge between the node and its parent, if one was given
    public OptionalDouble parentEdge(int node) {
        double length = parentEdges[node];
        return Double.isNaN(length) ? OptionalDouble.empty() : OptionalDouble.of(length);
    }

    /// @param node a node id
    /// @return the node label, if one was given
    public Optional<String> name(int node) {
        return Optional.ofNullable(names[node]);
    }

    /// @param node a node id
    /// @return the ids of the direct children, in the order they were added
    public int[] children(int node) {
        return children[node].clone();
    }

    /// @param node a node id
    /// @return true if the node has no children
    public boolean isTip(int node) {
        return children[node].length == 0;
    }

    /// @return the ids of every node without children, in id order
    public int[] tips() {
        return IntStream.range(0, parents.length).filter(this::isTip).toArray();
    }

    /// Enumerates the subtree under {@code start} in postorder: every node appears after all
    /// of its descendants, and siblings appear in the order they were added.
    ///
    /// The traversal is iterative, so deep unbalanced trees do not exhaust the call stack.
    ///
    /// @param start the node to start from, usually the root
    /// @return the node ids of the subtree in postorder
    public int[] postorder(int start) {
        if (start < 0 || start >= parents.length) {
            throw new IndexOutOfBoundsException("No node with id " + start + " in a tree of " + parents.length);
        }
        int[] order = new int[parents.length];
        int visited = 0;
        int[] stack = new int[parents.length];
        int[] nextChild = new int[parents.length];
        int top = 0;
        stack[top] = start;
        nextChild[top] = 0;
        top++;
        while (top > 0) {
            int node = stack[top - 1];
            int[] kids = children[node];
            int k = nextChild[top - 1];
            if (k < kids.length) {
                nextChild[top - 1]++;
                stack[top] = kids[k];
                nextChild[top] = 0;
                top++;
            } else {
                order[visited++] = node;
                top--;
            }
        }
        return Arrays.copyOf(order, visited);
    }

    @Override
    public String toString() {
        return "PhyloTree{nodes=" + parents.length + ", tips=" + tips().length + "}";
    }

    /// @return a builder for assembling a tree node by node
    public static Builder builder() {
        return new Builder();
    }

    /// Mutable assembly helper for {@link PhyloTree}. Not thread safe.
    public static final class Builder {
        private final List<Integer> parents = new ArrayList<>();
        private final List<Double> edges = new ArrayList<>();
        private final List<String> names = new ArrayList<>();

        private Builder() {
        }

        /// Adds a node without a parent.
        /// @return the new node id
        public int addRoot() {
            return add(NO_PARENT);
        }

        /// Adds a child of an existing node.
        /// @param parent the id of a node already added to this builder
        /// @return the new node id
        public int addChild(int parent) {
            if (parent < 0 || parent >= parents.size()) {
                throw new IllegalArgumentException("Parent " + parent + " has not been added");
            }
            return add(parent);
        }

        private int add(int parent) {
            parents.add(parent);
            edges.add(Double.NaN);
            names.add(null);
            return parents.size() - 1;
        }

        /// Sets the length of the edge from a node to its parent.
        /// @return this builder
        public Builder parentEdge(int node, double length) {
            checkNode(node);
            edges.set(node, length);
            return this;
        }

        /// Sets the label of a node. A null or empty label clears it.
        /// @return this builder
        public Builder name(int node, String name) {
            checkNode(node);
            names.set(node, name == null || name.isEmpty() ? null : name);
            return this;
        }

        /// @return the number of nodes added so far
        public int size() {
            return parents.size();
        }

        private void checkNode(int node) {
            if (node < 0 || node >= parents.size()) {
                throw new IllegalArgumentException("Node " + node + " has not been added");
            }
        }

        /// @return an immutable tree holding the nodes added so far
        public PhyloTree build() {
            int size = parents.size();
            int[] parentArray = new int[size];
            double[] edgeArray = new double[size];
            String[] nameArray = new String[size];
            for (int i = 0; i < size; i++) {
                parentArray[i] = parents.get(i);
                edgeArray[i] = edges.get(i);
                nameArray[i] = names.get(i);
            }
            return new PhyloTree(parentArray, edgeArray, nameArray);
        }
    }
}
