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

import io.phylodist.core.table.SampleTable;
import io.phylodist.core.tree.FlattenedTree;
import io.phylodist.core.tree.LeafIndex;

/// Unweighted UniFrac between two samples, computed as an earth mover's distance on the tree.
///
/// For a pair of samples {@code P} and {@code Q} the per-tip mass difference {@code P - Q} is
/// placed on the tips and pushed up the flattened tree one position at a time. Each edge
/// contributes its length times the absolute imbalance crossing it; the sum over all edges is
/// the distance. Because positions are in postorder, a subtree is always complete before its
/// mass is added to the parent.
///
/// The sample table is expected to be normalized already (see
/// {@link io.phylodist.core.table.SampleTableNormalizer}). Taxa without a tip in the tree are
/// resolved once at construction time and carry no mass.
///
/// An instance holds only read-only state and may be used from any number of threads.
public final class UnweightedUniFrac implements PairDistanceFunction {

    /// Differences at or below this magnitude are treated as zero
    public static final double DIFFERENCE_TOLERANCE = 1e-14;

    private final int[] tint;
    private final double[] lint;
    private final int root;
    private final int[] leafPositions;
    private final double[][] bySample;
    private final DistanceNormalization normalization;
    private final double totalBranchLength;

    /// Creates an engine reporting raw, unnormalized distances.
    public UnweightedUniFrac(FlattenedTree tree, LeafIndex leaves, SampleTable normalized) {
        this(tree, leaves, normalized, DistanceNormalization.NONE);
    }

    /// @param tree          the flattened tree
    /// @param leaves        tip lookup for {@code tree}
    /// @param normalized    presence distributions, one column per sample
    /// @param normalization how the raw sum is reported
    public UnweightedUniFrac(
        FlattenedTree tree,
        LeafIndex leaves,
        SampleTable normalized,
        DistanceNormalization normalization
    ) {
        this.tint = tree.parents();
        this.lint = tree.branchLengths();
        this.root = tree.rootPosition();
        this.leafPositions = leaves.resolve(normalized.taxa());
        this.bySample = new double[normalized.sampleCount()][];
        for (int sample = 0; sample < bySample.length; sample++) {
            bySample[sample] = normalized.column(sample);
        }
        this.normalization = normalization;
        this.totalBranchLength = tree.totalBranchLength();
    }

    /// @return the number of samples this engine can compare
    public int sampleCount() {
        return bySample.length;
    }

    @Override
    public double distance(int first, int second) {
        if (first == second) {
            checkSample(first);
            return 0.0;
        }
        double[] p = sample(first);
        double[] q = sample(second);

        double[] partial = new double[tint.length];
        for (int taxon = 0; taxon < leafPositions.length; taxon++) {
            int position = leafPositions[taxon];
            if (position == LeafIndex.ABSENT) {
                continue;
            }
            double diff = p[taxon] - q[taxon];
            if (Math.abs(diff) > DIFFERENCE_TOLERANCE) {
                partial[position] = diff;
            }
        }

        double z = 0.0;
        for (int position = 0; position < tint.length; position++) {
            if (position == root) {
                continue;
            }
            double mass = partial[position];
            partial[tint[position]] += mass;
            z += lint[position] * Math.abs(mass);
        }
        return normalization.apply(z, totalBranchLength);
    }

    private double[] sample(int index) {
        checkSample(index);
        return bySample[index];
    }

    private void checkSample(int index) {
        if (index < 0 || index >= bySample.length) {
            throw new IndexOutOfBoundsException("Sample index " + index + " outside 0.." + (bySample.length - 1));
        }
    }
}
