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

package io.vegstats.spatial.measures;

import io.vegstats.spatial.AbstractGridMeasure;
import io.vegstats.spatial.Grid;
import io.vegstats.spatial.LabelGrid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Divides a grid into an {@code nRows × nCols} lattice of rectangular tiles and
 * summarizes the valid cells of each tile.
 *
 * Tile height is {@code rows / nRows} and width {@code cols / nCols} by integer division;
 * the last tile row and column absorb the remainder, so the tiles cover every cell exactly
 * once. A tile without valid cells is reported with {@code pixelCount = 0} and an empty
 * summary. This is a fixed-geometry alternative to the clustering-based zoning in
 * {@code io.vegstats.spatial.cluster}.
 */
public class QuadrantPartitioner extends AbstractGridMeasure<QuadrantPartitioner.QuadrantResult> {

    /// Mnemonic under which this measure registers
    public static final String MNEMONIC = "Quadrants";

    private final int nRows;
    private final int nCols;

    /// @param nRows number of tile rows, at least 1
    /// @param nCols number of tile columns, at least 1
    public QuadrantPartitioner(int nRows, int nCols) {
        if (nRows < 1 || nCols < 1) {
            throw new IllegalArgumentException("Tile counts must be at least 1, got " + nRows + "x" + nCols);
        }
        this.nRows = nRows;
        this.nCols = nCols;
    }

    /// Creates a 2×2 partitioner.
    public QuadrantPartitioner() {
        this(2, 2);
    }

    @Override
    public String getMnemonic() {
        return MNEMONIC;
    }

    @Override
    public String[] getDependencies() {
        return new String[0];
    }

    @Override
    protected Class<QuadrantResult> getResultClass() {
        return QuadrantResult.class;
    }

    /// @return number of tile rows
    public int getRowTiles() {
        return nRows;
    }

    /// @return number of tile columns
    public int getColTiles() {
        return nCols;
    }

    @Override
    protected Optional<QuadrantResult> computeImpl(Grid grid, Map<String, Object> dependencyResults) {
        int tileH = grid.rows() / nRows;
        int tileW = grid.cols() / nCols;

        int[] zones = new int[grid.size()];
        List<Tile> tiles = new ArrayList<>(nRows * nCols);
        for (int i = 0; i < nRows; i++) {
            int r0 = i * tileH;
            int r1 = i == nRows - 1 ? grid.rows() : (i + 1) * tileH;
            for (int j = 0; j < nCols; j++) {
                int c0 = j * tileW;
                int c1 = j == nCols - 1 ? grid.cols() : (j + 1) * tileW;
                int zone = i * nCols + j;

                double[] buf = new double[(r1 - r0) * (c1 - c0)];
                int count = 0;
                for (int r = r0; r < r1; r++) {
                    for (int c = c0; c < c1; c++) {
                        zones[r * grid.cols() + c] = zone;
                        if (grid.isValid(r, c)) {
                            buf[count++] = grid.get(r, c);
                        }
                    }
                }
                double[] values = new double[count];
                System.arraycopy(buf, 0, values, 0, count);
                tiles.add(new Tile(i + "-" + j, i, j, r0, r1, c0, c1, count, GridStatistics.summarize(values)));
            }
        }
        return Optional.of(new QuadrantResult(nRows, nCols, Collections.unmodifiableList(tiles),
            LabelGrid.of(grid.rows(), grid.cols(), zones, LabelGrid.UNASSIGNED)));
    }

    /// One tile of the lattice.
    ///
    /// @param label `"i-j"` with zero-based tile row and column
    /// @param tileRow zero-based tile row
    /// @param tileCol zero-based tile column
    /// @param rowStart first grid row, inclusive
    /// @param rowEnd last grid row, exclusive
    /// @param colStart first grid column, inclusive
    /// @param colEnd last grid column, exclusive
    /// @param pixelCount number of valid cells in the tile
    /// @param summary statistics of the valid cells, empty when `pixelCount == 0`
    public record Tile(
        String label,
        int tileRow,
        int tileCol,
        int rowStart,
        int rowEnd,
        int colStart,
        int colEnd,
        int pixelCount,
        GridStatistics.Summary summary
    ) {
        public OptionalDouble mean() {
            return summary.mean();
        }

        public OptionalDouble median() {
            return summary.median();
        }

        public OptionalDouble std() {
            return summary.std();
        }

        public OptionalDouble min() {
            return summary.min();
        }

        public OptionalDouble max() {
            return summary.max();
        }

        /// @return number of grid cells covered, valid or not
        public int area() {
            return (rowEnd - rowStart) * (colEnd - colStart);
        }
    }

    /// Tiles of one grid in row-major tile order.
    ///
    /// @param rowTiles number of tile rows
    /// @param colTiles number of tile columns
    /// @param tiles the tiles, `rowTiles * colTiles` of them
    /// @param zones zone index `tileRow * colTiles + tileCol` for every cell
    public record QuadrantResult(int rowTiles, int colTiles, List<Tile> tiles, LabelGrid zones) {

        /// @param tileRow zero-based tile row
        /// @param tileCol zero-based tile column
        /// @return the tile
        public Tile tile(int tileRow, int tileCol) {
            return tiles.get(tileRow * colTiles + tileCol);
        }

        /// @param label a `"i-j"` label
        /// @return the tile with that label, if any
        public Optional<Tile> tile(String label) {
            return tiles.stream().filter(t -> t.label().equals(label)).findFirst();
        }
    }
}
