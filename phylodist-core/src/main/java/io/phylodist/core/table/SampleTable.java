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

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/// A taxa by samples table of non-negative values.
///
/// Rows are taxa and columns are samples, both kept in input order. Row order has no relation
/// to the order of tips in any tree: taxa are matched to the tree by name.
///
/// Instances are immutable. The constructor copies its input and accessors never expose the
/// backing arrays.
public final class SampleTable {

    private final List<String> taxa;
    private final List<String> samples;
    private final double[][] values;

    /// @param taxa    taxon names, one per row
    /// @param samples sample names, one per column
    /// @param values  {@code values[row][column]}; every row must have one entry per sample
    public SampleTable(List<String> taxa, List<String> samples, double[][] values) {
        if (taxa.size() != values.length) {
            throw new IllegalArgumentException("Expected " + taxa.size() + " rows, got " + values.length);
        }
        this.taxa = List.copyOf(taxa);
        this.samples = List.copyOf(samples);
        this.values = new double[values.length][];
        for (int row = 0; row < values.length; row++) {
            if (values[row].length != samples.size()) {
                throw new IllegalArgumentException("Row " + row + " (" + taxa.get(row) + ") has "
                    + values[row].length + " values, expected " + samples.size());
            }
            this.values[row] = values[row].clone();
        }
    }

    /// @return taxon names in row order
    public List<String> taxa() {
        return taxa;
    }

    /// @return sample names in column order
    public List<String> samples() {
        return samples;
    }

    public int taxonCount() {
        return taxa.size();
    }

    public int sampleCount() {
        return samples.size();
    }

    /// @return the value for one taxon in one sample
    public double get(int taxon, int sample) {
        return values[taxon][sample];
    }

    /// @return a copy of one sample's column
    public double[] column(int sample) {
        double[] column = new double[values.length];
        for (int row = 0; row < values.length; row++) {
            column[row] = values[row][sample];
        }
        return column;
    }

    /// @return the sum of one sample's column
    public double columnSum(int sample) {
        double sum = 0.0;
        for (double[] row : values) {
            sum += row[sample];
        }
        return sum;
    }

    /// @return a copy of the whole table as {@code [row][column]}
    public double[][] toArray() {
        double[][] copy = new double[values.length][];
        for (int row = 0; row < values.length; row++) {
            copy[row] = values[row].clone();
        }
        return copy;
    }

    /// Keeps only the rows whose taxon satisfies {@code keep}, in their original order.
    ///
    /// @param keep taxon filter
    /// @return this table if every row is kept, otherwise a new table
    public SampleTable retainTaxa(Predicate<String> keep) {
        List<String> keptTaxa = new ArrayList<>();
        List<double[]> keptRows = new ArrayList<>();
        for (int row = 0; row < values.length; row++) {
            if (keep.test(taxa.get(row))) {
                keptTaxa.add(taxa.get(row));
                keptRows.add(values[row]);
            }
        }
        if (keptTaxa.size() == taxa.size()) {
            return this;
        }
        return new SampleTable(keptTaxa, samples, keptRows.toArray(new double[0][]));
    }

    @Override
    public String toString() {
        return "SampleTable{taxa=" + taxa.size() + ", samples=" + samples.size() + "}";
    }
}
