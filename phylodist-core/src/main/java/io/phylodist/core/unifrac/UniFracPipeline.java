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
import io.phylodist.core.table.SampleTableNormalizer;
import io.phylodist.core.tree.FlattenedTree;
import io.phylodist.core.tree.LeafIndex;
import io.phylodist.core.tree.LeafIndexResolver;
import io.phylodist.core.tree.PhyloTree;
import io.phylodist.core.tree.TreeFlattener;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/// Runs the whole unweighted UniFrac computation for one tree and one raw sample table:
/// flatten the tree, index its tips, normalize the table, then compute every sample pair.
///
/// Table taxa without a tip in the tree take no part in the computation at all. The result is
/// the same as for a table from which those rows were deleted.
public final class UniFracPipeline {
    private static final Logger logger = LogManager.getLogger(UniFracPipeline.class);

    private final int threads;
    private final DistanceNormalization normalization;

    /// @param threads       worker threads for the pair computations
    /// @param normalization how raw sums are reported
    public UniFracPipeline(int threads, DistanceNormalization normalization) {
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be positive, got: " + threads);
        }
        this.threads = threads;
        this.normalization = normalization;
    }

    /// @param tree     the phylogeny
    /// @param rawTable abundances or counts, taxa by samples
    /// @return the distance matrix and run diagnostics
    /// @throws io.phylodist.core.TreeStructureException if the tree is malformed
    public UniFracResult run(PhyloTree tree, SampleTable rawTable) {
        long start = System.nanoTime();
        FlattenedTree flattened = TreeFlattener.flatten(tree);
        double totalBranchLength = flattened.totalBranchLength();
        logger.info("Flattened tree: {} nodes, total branch length {}", flattened.size(), totalBranchLength);

        LeafIndex leaves = LeafIndexResolver.resolve(tree, flattened);
        List<String> unmatched = leaves.unmatchedTaxa(rawTable.taxa());
        if (!unmatched.isEmpty()) {
            logger.warn("{} of {} taxa in the table have no matching tip in the tree and are ignored",
                unmatched.size(), rawTable.taxonCount());
            logger.debug("Unmatched taxa: {}", unmatched);
        }

        // Only taxa with a tip in the tree take part in normalization.
        SampleTable normalized = SampleTableNormalizer.normalize(rawTable.retainTaxa(leaves::contains));
        logger.info("Normalized {} samples over {} taxa", normalized.sampleCount(), normalized.taxonCount());

        UnweightedUniFrac engine = new UnweightedUniFrac(flattened, leaves, normalized, normalization);
        DistanceMatrix matrix = new PairScheduler(threads).compute(normalized.samples(), engine);

        logger.info("UniFrac matrix for {} samples done in {} ms",
            matrix.size(), (System.nanoTime() - start) / 1_000_000);
        return new UniFracResult(matrix, unmatched, flattened.size(), totalBranchLength, normalization);
    }
}
