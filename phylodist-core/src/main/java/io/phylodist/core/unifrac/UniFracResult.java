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

import java.util.List;

/// Output of a {@link UniFracPipeline} run.
///
/// @param matrix            pairwise distances in table sample order
/// @param unmatchedTaxa     table taxa without a tip in the tree, in table order
/// @param treeNodes         number of nodes in the flattened tree
/// @param totalBranchLength sum of all edge lengths in the tree
/// @param normalization     how the distances were reported
public record UniFracResult(
    DistanceMatrix matrix,
    List<String> unmatchedTaxa,
    int treeNodes,
    double totalBranchLength,
    DistanceNormalization normalization
) {
    public UniFracResult {
        unmatchedTaxa = List.copyOf(unmatchedTaxa);
    }

    /// @return the number of table taxa that did not contribute to any distance
    public int unmatchedCount() {
        return unmatchedTaxa.size();
    }
}
