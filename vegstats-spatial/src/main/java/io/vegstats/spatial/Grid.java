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

/// # Grid
///
/// Immutable rectangular surface of index values, one double per spatial cell.
/// This is the primary input data structure for all spatial analysis operations.
///
/// ## Missing Data
/// A cell carrying NaN or an infinite value is "no data": outside the area of interest,
/// a sensor gap, or a filtered value. Such cells are excluded from every statistic and from
/// clustering and labeling input sets. Use [#isValid(int, int)] or [#validityMask()] rather
/// than relying on NaN propagation in arithmetic.
///
/// ## Usage
/// ```java
/// Grid grid = Grid.of("ndvi-2024-05-01", values);
/// int valid = grid.validCount();
/// double v = grid.get(3, 4);
/// ```
///
/// ## Implementation Notes
/// - Input arrays are copied on construction and never exposed
/// - Values are stored row-major in a single flat array
/// - The `id` is only used to label reports
public final class Grid {

    /// Identifier used for grids created without an explicit id
    public static final String DEFAULT_ID = "grid";

    private final String id;
    private final int rows;
    private final int cols;
    private final double[] values;
    private final int validCount;

    private Grid(String id, int rows, int cols, double[] values) {
        this.id = id;
        this.rows = rows;
        this.cols = cols;
        this.values = values;
        int count = 0;
        for (double value : values) {
            if (Double.isFinite(value)) {
                count++;
            }
        }
        this.validCount = count;
    }

    /// Creates a grid from a rectangular 2D array.
    ///
    /// @param id identifier used in reports
    /// @param data values indexed `[row][col]`
    /// @return a new immutable grid
    /// @throws IllegalArgumentException if the array is empty or ragged
    public static Grid of(String id, double[][] data) {
        if (data == null || data.length == 0 || data[0] == null || data[0].length == 0) {
            throw new IllegalArgumentException("Grid data must have at least one row and one column");
        }
        int rows = data.length;
        int cols = data[0].length;
        double[] flat = new double[rows * cols];
        for (int r = 0; r < rows; r++) {
            if (data[r] == null || data[r].length != cols) {
                throw new IllegalArgumentException(
                    "Grid rows must all have " + cols + " columns, row " + r + " does not");
            }
            System.arraycopy(data[r], 0, flat, r * cols, cols);
        }
        return new Grid(id, rows, cols, flat);
    }

    /// Creates a grid with the default id.
    ///
    /// @param data values indexed `[row][col]`
    /// @return a new immutable grid
    public static Grid of(double[][] data) {
        return of(DEFAULT_ID, data);
    }

    /// Creates a grid from row-major values.
    ///
    /// @param id identifier used in reports
    /// @param rows number of rows
    /// @param cols number of columns
    /// @param rowMajor values, length `rows * cols`
    /// @return a new immutable grid
    /// @throws IllegalArgumentException if the shape does not match the value count
    public static Grid of(String id, int rows, int cols, double[] rowMajor) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Grid shape must be positive, got " + rows + "x" + cols);
        }
        if (rowMajor == null || rowMajor.length != rows * cols) {
            throw new IllegalArgumentException("Expected " + (rows * cols) + " values for a "
                + rows + "x" + cols + " grid");
        }
        return new Grid(id, rows, cols, rowMajor.clone());
    }

    /// Creates a grid where every cell holds the same value.
    ///
    /// @param id identifier used in reports
    /// @param rows number of rows
    /// @param cols number of columns
    /// @param value the fill value (may be NaN)
    /// @return a new immutable grid
    public static Grid filled(String id, int rows, int cols, double value) {
        double[] flat = new double[rows * cols];
        Arrays.fill(flat, value);
        return of(id, rows, cols, flat);
    }

    /// Wraps an array this package has just allocated, without copying.
    static Grid wrap(String id, int rows, int cols, double[] owned) {
        return new Grid(id, rows, cols, owned);
    }

    /// Returns a grid with the same values under a different id.
    ///
    /// @param newId the id to use
    /// @return a new grid sharing no mutable state with this one
    public Grid withId(String newId) {
        return new Grid(newId, rows, cols, values);
    }

    /// @return identifier used in reports
    public String getId() {
        return id;
    }

    /// @return number of rows
    public int rows() {
        return rows;
    }

    /// @return number of columns
    public int cols() {
        return cols;
    }

    /// @return total number of cells, valid or not
    public int size() {
        return values.length;
    }

    /// Gets the raw value of a cell, NaN or infinite where the cell has no data.
    ///
    /// @param row row index
    /// @param col column index
    /// @return the cell value
    /// @throws IndexOutOfBoundsException if the cell lies outside the grid
    public double get(int row, int col) {
        return values[index(row, col)];
    }

    /// Gets the raw value at a row-major index.
    ///
    /// @param index row-major cell index
    /// @return the cell value
    public double get(int index) {
        return values[index];
    }

    /// @param row row index
    /// @param col column index
    /// @return true if the cell carries a finite value
    public boolean isValid(int row, int col) {
        return Double.isFinite(values[index(row, col)]);
    }

    /// @param index row-major cell index
    /// @return true if the cell carries a finite value
    public boolean isValid(int index) {
        return Double.isFinite(values[index]);
    }

    /// @return number of cells carrying a finite value
    public int validCount() {
        return validCount;
    }

    /// @return true if the grid has at least one valid cell
    public boolean hasValidCells() {
        return validCount > 0;
    }

    /// Collects the valid values in row-major order.
    ///
    /// @return a new array of length [#validCount()]
    public double[] validValues() {
        double[] out = new double[validCount];
        int n = 0;
        for (double value : values) {
            if (Double.isFinite(value)) {
                out[n++] = value;
            }
        }
        return out;
    }

    /// Derives the validity mask. The mask is recomputed on each call and owned by the caller.
    ///
    /// @return mask that is true where the cell value is finite
    public GridMask validityMask() {
        boolean[] bits = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            bits[i] = Double.isFinite(values[i]);
        }
        return GridMask.wrap(rows, cols, bits);
    }

    /// @return a copy of the values in row-major order
    public double[] toRowMajor() {
        return values.clone();
    }

    /// @return a copy of the values indexed `[row][col]`
    public double[][] toArray() {
        double[][] out = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(values, r * cols, out[r], 0, cols);
        }
        return out;
    }

    /// @param other another grid
    /// @return true if both grids have the same number of rows and columns
    public boolean sameShape(Grid other) {
        return rows == other.rows && cols == other.cols;
    }

    private int index(int row, int col) {
        if (row < 0 || row >= rows || col < 0 || col >= cols) {
            throw new IndexOutOfBoundsException(
                "Cell (" + row + ", " + col + ") outside " + rows + "x" + cols + " grid");
        }
        return row * cols + col;
    }

    @Override
    public String toString() {
        return String.format("Grid{id=%s, shape=%dx%d, valid=%d}", id, rows, cols, validCount);
    }
}
