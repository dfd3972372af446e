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

package io.vegstats.spatial.cluster;

import java.util.OptionalDouble;

/// Raw-value statistics of the cells assigned to one cluster.
///
/// @param clusterId the cluster id as it appears in the assignment grid
/// @param pixelCount number of cells in the cluster
/// @param percent cells as a percentage of all clustered (valid) cells
/// @param mean mean raw value, empty for an empty cluster
/// @param std population standard deviation of raw values, empty for an empty cluster
/// @param min minimum raw value, empty for an empty cluster
/// @param max maximum raw value, empty for an empty cluster
public record ClusterStats(
    int clusterId,
    int pixelCount,
    double percent,
    OptionalDouble mean,
    OptionalDouble std,
    OptionalDouble min,
    OptionalDouble max
) {

    /// @return true if no cell was assigned to this cluster
    public boolean isEmpty() {
        return pixelCount == 0;
    }

    @Override
    public String toString() {
        if (pixelCount == 0) {
            return String.format("ClusterStats{id=%d, empty}", clusterId);
        }
        return String.format("ClusterStats{id=%d, n=%d (%.1f%%), mean=%.4f, std=%.4f, min=%.4f, max=%.4f}",
            clusterId, pixelCount, percent, mean.getAsDouble(), std.getAsDouble(),
            min.getAsDouble(), max.getAsDouble());
    }
}
