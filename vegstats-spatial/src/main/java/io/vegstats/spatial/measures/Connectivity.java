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

/// Adjacency used when grouping mask cells into connected regions.
public enum Connectivity {

    /// Orthogonal neighbors only
    FOUR(new int[][]{{-1, 0}, {0, -1}, {0, 1}, {1, 0}}),

    /// Orthogonal and diagonal neighbors
    EIGHT(new int[][]{{-1, -1}, {-1, 0}, {-1, 1}, {0, -1}, {0, 1}, {1, -1}, {1, 0}, {1, 1}});

    private final int[][] offsets;

    Connectivity(int[][] offsets) {
        this.offsets = offsets;
    }

    /// @return `{dRow, dCol}` offsets of the neighbors; callers must not modify the array
    int[][] offsets() {
        return offsets;
    }

    /// Parses `4`, `8`, `four` or `eight`, case-insensitively.
    ///
    /// @param name the connectivity name
    /// @return the connectivity
    /// @throws IllegalArgumentException if the name is not recognized
    public static Connectivity fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Connectivity name must not be null");
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "4":
            case "four":
                return FOUR;
            case "8":
            case "eight":
                return EIGHT;
            default:
                throw new IllegalArgumentException("Unrecognized connectivity '" + name + "', expected 4 or 8");
        }
    }
}
