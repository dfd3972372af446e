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

/// Immutable boolean surface with the same shape as a [Grid].
///
/// Used for validity masks, hotspot and coldspot masks, and change-category masks.
/// Classification masks produced by this library are always false outside the
/// validity mask of the grid they were derived from.
public final class GridMask {

    private final int rows;
    private final int cols;
    private final boolean[] bits;
    private final int count;

    private GridMask(int rows, int cols, boolean[] bits) {
        this.rows = rows;
        this.cols = cols;
        this.bits = bits;
        int c = 0;
        for (boolean bit : bits) {
            if (bit) {
                c++;
            }
        }
        this.count = c;
    }

    /// Creates a mask from a rectangular 2D array.
    ///
    /// @param data flags indexed `[row][col]`
    /// @return a new immutable mask
    /// @throws IllegalArgumentException if the array is empty or ragged
    public static GridMask of(boolean[][] data) {
        if (data == null || data.length == 0 || data[0] == null || data[0].length == 0) {
            throw new IllegalArgumentException("Mask data must have at least one row and one column");
        }
        int rows = data.length;
        int cols = data[0].length;
        boolean[] flat = new boolean[rows * cols];
        for (int r = 0; r < rows; r++) {
            if (data[r] == null || data[r].length != cols) {
                throw new IllegalArgumentException(
                    "Mask rows must all have " + cols + " columns, row " + r + " does not");
            }
            System.arraycopy(data[r], 0, flat, r * cols, cols);
        }
        return new GridMask(rows, cols, flat);
    }

    /// Creates an all-false mask.
    ///
    /// @param rows number of rows
    /// @param cols number of columns
    /// @return a mask with no cell set
    public static GridMask empty(int rows, int cols) {
        return new GridMask(rows, cols, new boolean[rows * cols]);
    }

    /// Wraps an array this package has just allocated, without copying.
    static GridMask wrap(int rows, int cols, boolean[] owned) {
        if (owned.length != rows * cols) {
            throw new IllegalArgumentException("Expected " + (rows * cols) + " flags, got " + owned.length);
        }
        return new GridMask(rows, cols, owned);
    }

    /// Builds masks from row-major flags. Used by the analysis packages, which allocate
    /// their own flag arrays and hand them over.
    ///
    /// @param rows number of rows
    /// @param cols number of columns
    /// @param rowMajor flags, length `rows * cols`; the array is copied
    /// @return a new immutable mask
    public static GridMask fromRowMajor(int rows, int cols, boolean[] rowMajor) {
        return wrap(rows, cols, rowMajor.clone());
    }

    /// @return number of rows
    public int rows() {
        return rows;
    }

    /// @return number of columns
    public int cols() {
        return cols;
    }

    /// @param row row index
    /// @param col column index
    /// @return the flag at the cell
    public boolean get(int row, int col) {
        if (row < 0 || row >= rows || col < 0 || col >= cols) {
            throw new IndexOutOfBoundsException(
                "Cell (" + row + ", " + col + ") outside " + rows + "x" + cols + " mask");
        }
        return bits[row * cols + col];
    }

    /// @param index row-major cell index
    /// @return the flag at the cell
    public boolean get(int index) {
        return bits[index];
    }

    /// @return number of cells set
    public int count() {
        return count;
    }

    /// @return true if no cell is set
    public boolean isEmpty() {
        return count == 0;
    }

    /// @param other a mask of the same shape
    /// @return true if any cell is set in both masks
    public boolean intersects(GridMask other) {
        requireSameShape(other);
        for (int i = 0; i < bits.length; i++) {
            if (bits[i] && other.bits[i]) {
                return true;
            }
        }
        return false;
    }

    /// @param other a mask of the same shape
    /// @return a new mask set where either mask is set
    public GridMask or(GridMask other) {
        requireSameShape(other);
        boolean[] out = new boolean[bits.length];
        for (int i = 0; i < bits.length; i++) {
            out[i] = bits[i] || other.bits[i];
        }
        return new GridMask(rows, cols, out);
    }

    /// @param other a mask of the same shape
    /// @return a new mask set where both masks are set
    public GridMask and(GridMask other) {
        requireSameShape(other);
        boolean[] out = new boolean[bits.length];
        for (int i = 0; i < bits.length; i++) {
            out[i] = bits[i] && other.bits[i];
        }
        return new GridMask(rows, cols, out);
    }

    /// @return a copy of the flags indexed `[row][col]`
    public boolean[][] toArray() {
        boolean[][] out = new boolean[rows][cols];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(bits, r * cols, out[r], 0, cols);
        }
        return out;
    }

    private void requireSameShape(GridMask other) {
        if (rows != other.rows || cols != other.cols) {
            throw new IllegalArgumentException("Mask shapes differ: " + rows + "x" + cols
                + " vs " + other.rows + "x" + other.cols);
        }
    }

    @Override
    public String toString() {
        return String.format("GridMask{shape=%dx%d, set=%d}", rows, cols, count);
    }
}
