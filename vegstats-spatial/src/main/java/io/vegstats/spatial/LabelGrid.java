/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.vegstats.spatial;

import java.util.Arrays;

/// # LabelGrid
///
/// Immutable integer surface assigning a label to each cell of a [Grid].
///
/// Two conventions share this type:
/// - **Region label maps**: `0` means "not in mask", positive labels `1..N` identify
///   connected components. The unassigned marker is [#NO_REGION].
/// - **Cluster assignments**: every valid cell carries a cluster id (`-1` is DBSCAN noise),
///   invalid cells carry [#UNASSIGNED].
///
/// The marker in use is fixed at construction and reported by [#unassignedLabel()].
public final class LabelGrid {

    /// Unassigned marker for region label maps
    public static final int NO_REGION = 0;

    /// Unassigned marker for cluster assignments
    public static final int UNASSIGNED = Integer.MIN_VALUE;

    private final int rows;
    private final int cols;
    private final int[] labels;
    private final int unassigned;

    private LabelGrid(int rows, int cols, int[] labels, int unassigned) {
        this.rows = rows;
        this.cols = cols;
        this.labels = labels;
        this.unassigned = unassigned;
    }

    /// Creates a label grid from row-major labels.
    ///
    /// @param rows number of rows
    /// @param cols number of columns
    /// @param rowMajor labels, length `rows * cols`; the array is copied
    /// @param unassigned the marker for cells that carry no label
    /// @return a new immutable label grid
    public static LabelGrid of(int rows, int cols, int[] rowMajor, int unassigned) {
        if (rowMajor.length != rows * cols) {
            throw new IllegalArgumentException("Expected " + (rows * cols) + " labels, got " + rowMajor.length);
        }
        return new LabelGrid(rows, cols, rowMajor.clone(), unassigned);
    }

    /// Creates a label grid where every cell is unassigned.
    ///
    /// @param rows number of rows
    /// @param cols number of columns
    /// @param unassigned the marker for cells that carry no label
    /// @return a new label grid
    public static LabelGrid unassigned(int rows, int cols, int unassigned) {
        int[] labels = new int[rows * cols];
        Arrays.fill(labels, unassigned);
        return new LabelGrid(rows, cols, labels, unassigned);
    }

    /// @return number of rows
    public int rows() {
        return rows;
    }

    /// @return number of columns
    public int cols() {
        return cols;
    }

    /// @return the marker for cells that carry no label
    public int unassignedLabel() {
        return unassigned;
    }

    /// @param row row index
    /// @param col column index
    /// @return the label at the cell, possibly the unassigned marker
    public int get(int row, int col) {
        if (row < 0 || row >= rows || col < 0 || col >= cols) {
            throw new IndexOutOfBoundsException(
                "Cell (" + row + ", " + col + ") outside " + rows + "x" + cols + " label grid");
        }
        return labels[row * cols + col];
    }

    /// @param index row-major cell index
    /// @return the label at the cell, possibly the unassigned marker
    public int get(int index) {
        return labels[index];
    }

    /// @param row row index
    /// @param col column index
    /// @return true if the cell carries a label
    public boolean isAssigned(int row, int col) {
        return get(row, col) != unassigned;
    }

    /// @param label a label value
    /// @return number of cells carrying the label
    public int count(int label) {
        int n = 0;
        for (int l : labels) {
            if (l == label) {
                n++;
            }
        }
        return n;
    }

    /// @param label a label value
    /// @return mask set where the cell carries the label
    public GridMask maskOf(int label) {
        boolean[] bits = new boolean[labels.length];
        for (int i = 0; i < labels.length; i++) {
            bits[i] = labels[i] == label;
        }
        return GridMask.wrap(rows, cols, bits);
    }

    /// Renders the labels as a [Grid] where unassigned cells are NaN.
    ///
    /// @return a new grid of label values
    public Grid toGrid() {
        double[] out = new double[labels.length];
        for (int i = 0; i < labels.length; i++) {
            out[i] = labels[i] == unassigned ? Double.NaN : labels[i];
        }
        return Grid.wrap("labels", rows, cols, out);
    }

    /// @return a copy of the labels indexed `[row][col]`
    public int[][] toArray() {
        int[][] out = new int[rows][cols];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(labels, r * cols, out[r], 0, cols);
        }
        return out;
    }

    @Override
    public String toString() {
        return String.format("LabelGrid{shape=%dx%d, unassigned=%d}", rows, cols, unassigned);
    }
}
