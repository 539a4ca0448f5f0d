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

package io.phylodist.core.table;

/// Turns a raw abundance table into per-sample presence distributions.
///
/// Every value greater than zero becomes {@code 1.0} and everything else, including NaN,
/// becomes {@code 0.0}. Each sample column is then divided by its sum so that it sums to one.
/// A sample without any present taxon keeps an all-zero column; that is a valid sample, not
/// an error.
public final class SampleTableNormalizer {

    private SampleTableNormalizer() {
    }

    /// @param raw a table of abundances or counts
    /// @return a new table holding the normalized presence distributions; {@code raw} is not
    ///     modified
    public static SampleTable normalize(SampleTable raw) {
        double[][] values = raw.toArray();
        for (double[] row : values) {
            for (int sample = 0; sample < row.length; sample++) {
                row[sample] = row[sample] > 0.0 ? 1.0 : 0.0;
            }
        }
        for (int sample = 0; sample < raw.sampleCount(); sample++) {
            double sum = 0.0;
            for (double[] row : values) {
                sum += row[sample];
            }
            if (sum > 0.0) {
                for (double[] row : values) {
                    row[sample] /= sum;
                }
            }
        }
        return new SampleTable(raw.taxa(), raw.samples(), values);
    }
}
