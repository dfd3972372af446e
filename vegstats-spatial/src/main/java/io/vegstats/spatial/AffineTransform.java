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

/// Georeferencing of a grid: maps cell indices to map coordinates.
///
/// ```text
///   x = a·col + b·row + c
///   y = d·col + e·row + f
/// ```
///
/// `(c, f)` is the outer corner of cell `(0, 0)`; `a` and `e` are the cell width and
/// (usually negative) height. None of the analyses use it; callers keep it next to a grid
/// to place results such as region centroids on a map.
///
/// @param a x change per column
/// @param b x change per row
/// @param c x of the grid origin
/// @param d y change per column
/// @param e y change per row
/// @param f y of the grid origin
public record AffineTransform(double a, double b, double c, double d, double e, double f) {

    /// Transform that maps `(row, col)` to `(x = col, y = row)`
    public static final AffineTransform IDENTITY = new AffineTransform(1, 0, 0, 0, 1, 0);

    /// North-up transform without rotation.
    ///
    /// @param originX x of the upper-left corner
    /// @param originY y of the upper-left corner
    /// @param cellWidth cell width in map units
    /// @param cellHeight cell height in map units, positive
    /// @return the transform
    public static AffineTransform northUp(double originX, double originY, double cellWidth, double cellHeight) {
        return new AffineTransform(cellWidth, 0, originX, 0, -cellHeight, originY);
    }

    /// @param row fractional row index
    /// @param col fractional column index
    /// @return `{x, y}` of the position
    public double[] apply(double row, double col) {
        return new double[]{a * col + b * row + c, d * col + e * row + f};
    }

    /// @param row row index
    /// @param col column index
    /// @return `{x, y}` of the cell center
    public double[] cellCenter(int row, int col) {
        return apply(row + 0.5, col + 0.5);
    }
}
