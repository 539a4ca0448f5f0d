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

/// Computes the distance between two samples identified by their column index.
@FunctionalInterface
public interface PairDistanceFunction {

    /// @param first  index of the first sample
    /// @param second index of the second sample
    /// @return the distance between the two samples
    double distance(int first, int second);
}
