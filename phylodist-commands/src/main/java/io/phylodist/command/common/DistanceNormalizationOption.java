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

package io.phylodist.command.common;

import io.phylodist.core.unifrac.DistanceNormalization;
import picocli.CommandLine;

/**
 * Shared distance normalization option.
 */
public class DistanceNormalizationOption {

    @CommandLine.Option(
        names = {"--normalize"},
        description = {
            "How distances are reported:",
            "  NONE: raw sum of branch length times mass imbalance (default)",
            "  TREE_LENGTH: raw sum divided by the total branch length of the tree",
            "Valid values: ${COMPLETION-CANDIDATES}"
        },
        defaultValue = "NONE"
    )
    private DistanceNormalization normalization = DistanceNormalization.NONE;

    /**
     * Gets the selected normalization.
     *
     * @return the normalization
     */
    public DistanceNormalization getNormalization() {
        return normalization;
    }
}
