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

import java.util.List;

/// Square symmetric matrix of sample distances with a zero diagonal.
///
/// Values are stored row-major in a single array. The only mutator is package-private and
/// always writes a cell together with its mirror, so symmetry holds by construction.
public final class DistanceMatrix {

    /// Largest number of cells a matrix can hold
    public static final int MAX_CELLS = Integer.MAX_VALUE - 8;

    private final List<String> samples;
    private final int n;
    private final double[] cells;

    /// Creates an all-zero matrix for the given samples.
    /// @param samples sample names in output order
    /// @throws PhyloDistException if {@code n * n} cells do not fit in one array
    public DistanceMatrix(List<String> samples) {
        long cellCount = (long) samples.size() * samples.size();
        if (cellCount > MAX_CELLS) {
            throw new PhyloDistException("Too many samples for a single matrix: " + samples.size()
                + " samples need " + cellCount + " cells, at most " + MAX_CELLS + " are supported");
        }
        this.samples = List.copyOf(samples);
        this.n = samples.size();
        this.cells = new double[(int) cellCount];
    }

    /// Builds a matrix from explicit values. The upper triangle is authoritative and mirrored.
    ///
    /// @param samples sample names in output order
    /// @param values  {@code values[i][j]} for {@code i < j}; other cells are ignored
    /// @return a new matrix
    public static DistanceMatrix of(List<String> samples, double[][] values) {
        DistanceMatrix matrix = new DistanceMatrix(samples);
        if (values.length != matrix.n) {
            throw new IllegalArgumentException("Expected " + matrix.n + " rows, got " + values.length);
        }
        for (int i = 0; i < matrix.n; i++) {
            for (int j = i + 1; j < matrix.n; j++) {
                matrix.set(i, j, values[i][j]);
            }
        }
        return matrix;
    }

    void set(int i, int j, double distance) {
        if (i == j) {
            throw new IllegalArgumentException("Diagonal cell (" + i + "," + i + ") is always zero");
        }
        cells[i * n + j] = distance;
        cells[j * n + i] = distance;
    }

    /// @return the distance between samples {@code i} and {@code j}
    public double get(int i, int j) {
        if (i < 0 || i >= n || j < 0 || j >= n) {
            throw new IndexOutOfBoundsException("(" + i + "," + j + ") outside a " + n + "x" + n + " matrix");
        }
        return cells[i * n + j];
    }

    /// @return the number of samples on each side
    public int size() {
        return n;
    }

    /// @return sample names in row and column order
    public List<String> samples() {
        return samples;
    }

    /// @return a copy of row {@code i}
    public double[] row(int i) {
        double[] row = new double[n];
        System.arraycopy(cells, i * n, row, 0, n);
        return row;
    }

    /// @return a copy of the matrix as {@code [row][column]}
    public double[][] toArray() {
        double[][] copy = new double[n][];
        for (int i = 0; i < n; i++) {
            copy[i] = row(i);
        }
        return copy;
    }

    @Override
    public String toString() {
        return "DistanceMatrix{samples=" + n + "}";
    }
}
