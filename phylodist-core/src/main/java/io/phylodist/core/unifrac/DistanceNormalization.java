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

/// How a raw edge-weighted mass sum is reported as a distance.
public enum DistanceNormalization {
    /// The raw sum over edges of length times absolute mass imbalance
    NONE,
    /// The raw sum divided by the total branch length of the tree, giving a value in [0,1]
    TREE_LENGTH;

    /// @param raw               the raw propagated sum
    /// @param totalBranchLength sum of all edge lengths in the tree
    /// @return the reported distance
    public double apply(double raw, double totalBranchLength) {
        switch (this) {
            case NONE:
                return raw;
            case TREE_LENGTH:
                return totalBranchLength > 0.0 ? raw / totalBranchLength : 0.0;
            default:
                throw new IllegalArgumentException("Unsupported normalization: " + this);
        }
    }
}
