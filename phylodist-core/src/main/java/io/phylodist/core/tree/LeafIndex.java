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
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/// Lookup from taxon name to the flattened position of the tip carrying that name.
///
/// Taxa that are not in the index are not an error anywhere in the computation. They simply
/// carry no mass in the tree; {@link #unmatchedTaxa(List)} reports them for diagnostics.
public final class LeafIndex {

    /// Position returned by {@link #positionOrAbsent(String)} for names not in the index
    public static final int ABSENT = -1;

    private final Map<String, Integer> positions;

    LeafIndex(Map<String, Integer> positions) {
        this.positions = Collections.unmodifiableMap(positions);
    }

    /// @return the number of named tips
    public int size() {
        return positions.size();
    }

    /// @return true if a tip with this name exists
    public boolean contains(String taxon) {
        return positions.containsKey(taxon);
    }

    /// @return the flattened position of the named tip, if any
    public OptionalInt position(String taxon) {
        Integer position = positions.get(taxon);
        return position == null ? OptionalInt.empty() : OptionalInt.of(position);
    }

    /// @return the flattened position of the named tip, or {@link #ABSENT}
    public int positionOrAbsent(String taxon) {
        return positions.getOrDefault(taxon, ABSENT);
    }

    /// Resolves every taxon of a table to its flattened position at once.
    ///
    /// @param taxa taxon names in table row order
    /// @return positions aligned with {@code taxa}, {@link #ABSENT} where a taxon is not a tip
    public int[] resolve(List<String> taxa) {
        int[] resolved = new int[taxa.size()];
        for (int i = 0; i < resolved.length; i++) {
            resolved[i] = positionOrAbsent(taxa.get(i));
        }
        return resolved;
    }

    /// @param taxa taxon names in table row order
    /// @return the taxa that have no tip in the tree, in table order
    public List<String> unmatchedTaxa(List<String> taxa) {
        List<String> unmatched = new ArrayList<>();
        for (String taxon : taxa) {
            if (!positions.containsKey(taxon)) {
                unmatched.add(taxon);
            }
        }
        return unmatched;
    }

    /// @return a read-only view of the name to position mapping
    public Map<String, Integer> asMap() {
        return positions;
    }

    @Override
    public String toString() {
        return "LeafIndex{tips=" + positions.size() + "}";
    }
}
