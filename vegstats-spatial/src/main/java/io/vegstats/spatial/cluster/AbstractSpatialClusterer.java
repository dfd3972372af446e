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

import io.vegstats.spatial.AbstractGridMeasure;
import io.vegstats.spatial.Grid;
import io.vegstats.spatial.GridUtils;
import io.vegstats.spatial.LabelGrid;
import org.apache.commons.math3.ml.clustering.Clusterable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Shared pipeline of the spatial clusterers.
 *
 * <p>Each valid cell becomes one feature vector, {@code [value]} or, when coordinates are
 * requested, {@code [value, col/cols, row/rows]}. Every feature is standardized to zero
 * mean and unit population variance; a feature without variance becomes all zeros. The
 * clusterer assigns one id per vector and the ids are scattered back to the cells they
 * came from, leaving invalid cells {@link LabelGrid#UNASSIGNED}.</p>
 *
 * @param <R> the clustering result type
 */
public abstract class AbstractSpatialClusterer<R> extends AbstractGridMeasure<R> {

    private final boolean useCoordinates;

    protected AbstractSpatialClusterer(boolean useCoordinates) {
        this.useCoordinates = useCoordinates;
    }

    /// @return true if normalized cell coordinates are part of the feature vector
    public boolean isUsingCoordinates() {
        return useCoordinates;
    }

    @Override
    public String[] getDependencies() {
        return new String[0];
    }

    /// Builds the standardized feature vectors of the valid cells, in row-major order.
    ///
    /// @param grid the grid to cluster
    /// @return the features
    protected Features buildFeatures(Grid grid) {
        int n = grid.validCount();
        int dims = useCoordinates ? 3 : 1;
        int[] cells = new int[n];
        double[] raw = new double[n];
        double[][] features = new double[n][dims];

        int k = 0;
        for (int r = 0; r < grid.rows(); r++) {
            for (int c = 0; c < grid.cols(); c++) {
                if (!grid.isValid(r, c)) {
                    continue;
                }
                double v = grid.get(r, c);
                cells[k] = r * grid.cols() + c;
                raw[k] = v;
                features[k][0] = v;
                if (useCoordinates) {
                    features[k][1] = (double) c / grid.cols();
                    features[k][2] = (double) r / grid.rows();
                }
                k++;
            }
        }
        double[][] standardized = GridUtils.standardizeColumns(features);
        List<CellPoint> points = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            points.add(new CellPoint(i, standardized[i]));
        }
        return new Features(cells, raw, points);
    }

    /// Writes per-vector ids back onto the grid.
    ///
    /// @param grid the clustered grid
    /// @param features the features the ids belong to
    /// @param ids one id per feature vector
    /// @return the assignment grid
    protected static LabelGrid scatter(Grid grid, Features features, int[] ids) {
        int[] labels = new int[grid.size()];
        Arrays.fill(labels, LabelGrid.UNASSIGNED);
        for (int i = 0; i < ids.length; i++) {
            labels[features.cells()[i]] = ids[i];
        }
        return LabelGrid.of(grid.rows(), grid.cols(), labels, LabelGrid.UNASSIGNED);
    }

    /// Computes raw-value statistics for one cluster id.
    ///
    /// @param clusterId the id to summarize
    /// @param features the clustered features
    /// @param ids one id per feature vector
    /// @return the statistics, empty fields if no vector carries the id
    protected static ClusterStats statsFor(int clusterId, Features features, int[] ids) {
        double[] raw = features.raw();
        int count = 0;
        for (int id : ids) {
            if (id == clusterId) count++;
        }
        if (count == 0) {
            return new ClusterStats(clusterId, 0, 0.0,
                OptionalDouble.empty(), OptionalDouble.empty(), OptionalDouble.empty(), OptionalDouble.empty());
        }
        double[] members = new double[count];
        int j = 0;
        for (int i = 0; i < ids.length; i++) {
            if (ids[i] == clusterId) {
                members[j++] = raw[i];
            }
        }
        GridUtils.Statistics s = GridUtils.computeStatistics(members);
        return new ClusterStats(clusterId, count, count * 100.0 / ids.length,
            OptionalDouble.of(s.mean), OptionalDouble.of(s.stdDev), OptionalDouble.of(s.min), OptionalDouble.of(s.max));
    }

    /// Feature vectors of the valid cells.
    ///
    /// @param cells row-major cell index of each vector
    /// @param raw raw cell value of each vector
    /// @param points standardized vectors, `points.get(i).index() == i`
    protected record Features(int[] cells, double[] raw, List<CellPoint> points) {
        int size() {
            return cells.length;
        }
    }

    /// A standardized feature vector tied to its position in [Features].
    ///
    /// Equality is identity: two cells with identical features remain distinct points.
    protected static final class CellPoint implements Clusterable {
        private final int index;
        private final double[] point;

        CellPoint(int index, double[] point) {
            this.index = index;
            this.point = point;
        }

        int index() {
            return index;
        }

        @Override
        public double[] getPoint() {
            return point;
        }
    }
}
