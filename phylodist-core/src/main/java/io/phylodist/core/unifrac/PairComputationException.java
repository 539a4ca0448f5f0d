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

import io.phylodist.core.PhyloDistException;

/// Wraps an unexpected failure raised while computing a slice of sample pairs.
public class PairComputationException extends PhyloDistException {

    public PairComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
