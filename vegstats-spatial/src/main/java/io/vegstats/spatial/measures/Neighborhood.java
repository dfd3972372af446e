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

import java.util.Locale;

/// Spatial weights used by [MoranAutocorrelation]: binary contiguity over a 3×3 window.
///
/// ```text
///   QUEEN        ROOK
///   x x x        . x .
///   x o x        x o x
///   x x x        . x .
/// ```
public enum Neighborhood {

    /// Shares an edge or a corner
    QUEEN(new int[][]{
        {1, 1, 1},
        {1, 0, 1},
        {1, 1, 1}
    }),

    /// Shares an edge
    ROOK(new int[][]{
        {0, 1, 0},
        {1, 0, 1},
        {0, 1, 0}
    });

    private final int[][] weights;

    Neighborhood(int[][] weights) {
        this.weights = weights;
    }

    /// @param dRow row offset in `[-1, 1]`
    /// @param dCol column offset in `[-1, 1]`
    /// @return true if a cell at this offset is a neighbor
    boolean isNeighbor(int dRow, int dCol) {
        return weights[dRow + 1][dCol + 1] != 0;
    }

    /// Parses `queen` or `rook`, case-insensitively.
    ///
    /// @param name the neighborhood name
    /// @return the neighborhood
    /// @throws IllegalArgumentException if the name is not recognized
    public static Neighborhood fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Neighborhood name must not be null");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unrecognized neighborhood '" + name + "', expected queen or rook", e);
        }
    }
}
