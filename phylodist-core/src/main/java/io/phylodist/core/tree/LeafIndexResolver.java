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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.Map;

/// Builds the {@link LeafIndex} for a tree and its flattened form.
public final class LeafIndexResolver {
    private static final Logger logger = LogManager.getLogger(LeafIndexResolver.class);

    private LeafIndexResolver() {
    }

    /// Maps every named tip of {@code tree} to its position in {@code flattened}. Internal
    /// nodes are never indexed, even when labelled.
    ///
    /// When two tips share a name, the one at the higher position wins and a warning is logged.
    ///
    /// @param tree      the source tree
    /// @param flattened the flattening of {@code tree}
    /// @return the leaf index
    public static LeafIndex resolve(PhyloTree tree, FlattenedTree flattened) {
        Map<String, Integer> positions = new HashMap<>();
        int duplicates = 0;
        for (int position = 0; position < flattened.size(); position++) {
            int node = flattened.nodeId(position);
            if (!tree.isTip(node)) {
                continue;
            }
            String name = flattened.name(position).orElse(null);
            if (name == null) {
                continue;
            }
            Integer previous = positions.put(name, position);
            if (previous != null) {
                duplicates++;
                logger.warn("Tip name '{}' appears more than once; using position {} instead of {}",
                    name, position, previous);
            }
        }
        logger.debug("Indexed {} named tips ({} duplicate names)", positions.size(), duplicates);
        return new LeafIndex(positions);
    }
}
