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

import io.vegstats.spatial.Grid;
import io.vegstats.spatial.LabelGrid;
import org.apache.commons.math3.ml.clustering.Cluster;
import org.apache.commons.math3.ml.clustering.DBSCANClusterer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Density-based zoning (DBSCAN) of the valid cells.
 *
 * A cell is a core point when at least {@code minSamples} cells, itself included, lie
 * within {@code eps} of it in standardized feature space. Clusters grow from core points;
 * cells reachable from no core point are noise and carry id {@value #NOISE}. Cluster ids
 * follow discovery order over the row-major cell sequence and are not reordered.
 *
 * No result is produced when there are fewer valid cells than {@code minSamples}.
 */
public class DensityClusterer extends AbstractSpatialClusterer<DensityClusterer.DensityResult> {

    private static final Logger logger = LogManager.getLogger(DensityClusterer.class);

    /// Mnemonic under which this measure registers
    public static final String MNEMONIC = "DBSCAN";

    /// Id of cells that belong to no cluster
    public static final int NOISE = -1;

    /// Default neighborhood radius in standardized feature space
    public static final double DEFAULT_EPS = 0.5;
    /// Default neighborhood size for a core point
    public static final int DEFAULT_MIN_SAMPLES = 10;

    private final double eps;
    private final int minSamples;

    /// Creates a density clusterer.
    ///
    /// @param eps neighborhood radius, positive
    /// @param minSamples neighborhood size for a core point, counting the point itself, at least 1
    /// @param useCoordinates whether normalized cell coordinates join the cell value as features
    public DensityClusterer(double eps, int minSamples, boolean useCoordinates) {
        super(useCoordinates);
        if (!(eps > 0.0) || Double.isInfinite(eps)) {
            throw new IllegalArgumentException("Neighborhood radius must be positive and finite, got " + eps);
        }
        if (minSamples < 1) {
            throw new IllegalArgumentException("Minimum samples must be at least 1, got " + minSamples);
        }
        this.eps = eps;
        this.minSamples = minSamples;
    }

    /// Creates a clusterer with `eps = 0.5`, `minSamples = 10`, using coordinates.
    public DensityClusterer() {
        this(DEFAULT_EPS, DEFAULT_MIN_SAMPLES, true);
    }

    @Override
    public String getMnemonic() {
        return MNEMONIC;
    }

    @Override
    protected Class<DensityResult> getResultClass() {
        return DensityResult.class;
    }

    /// @return neighborhood radius in standardized feature space
    public double getEps() {
        return eps;
    }

    /// @return neighborhood size for a core point, counting the point itself
    public int getMinSamples() {
        return minSamples;
    }

    @Override
    protected Optional<DensityResult> computeImpl(Grid grid, Map<String, Object> dependencyResults) {
        int n = grid.validCount();
        if (n < minSamples) {
            logger.debug("DBSCAN skipped for {}: {} valid cells, minSamples={}", grid.getId(), n, minSamples);
            return Optional.empty();
        }

        Features features = buildFeatures(grid);
        // commons counts neighbors excluding the point itself
        DBSCANClusterer<CellPoint> dbscan = new DBSCANClusterer<>(eps, minSamples - 1);
        List<Cluster<CellPoint>> clusters = dbscan.cluster(features.points());

        int[] ids = new int[features.size()];
        Arrays.fill(ids, NOISE);
        for (int id = 0; id < clusters.size(); id++) {
            for (CellPoint p : clusters.get(id).getPoints()) {
                ids[p.index()] = id;
            }
        }

        List<ClusterStats> stats = new ArrayList<>(clusters.size());
        for (int id = 0; id < clusters.size(); id++) {
            stats.add(statsFor(id, features, ids));
        }
        int noise = 0;
        for (int id : ids) {
            if (id == NOISE) noise++;
        }

        return Optional.of(new DensityResult(
            scatter(grid, features, ids),
            clusters.size(),
            noise,
            noise * 100.0 / ids.length,
            features.size(),
            Collections.unmodifiableList(stats)));
    }

    /// Result of density-based zoning.
    ///
    /// @param assignments cluster id per valid cell, [#NOISE] for noise, [LabelGrid#UNASSIGNED] elsewhere
    /// @param clusterCount number of clusters, noise excluded
    /// @param noiseCount number of noise cells
    /// @param noisePercent noise cells as a percentage of valid cells
    /// @param validCount number of clustered cells
    /// @param clusters statistics per cluster, index equals cluster id
    public record DensityResult(
        LabelGrid assignments,
        int clusterCount,
        int noiseCount,
        double noisePercent,
        int validCount,
        List<ClusterStats> clusters
    ) {
        @Override
        public String toString() {
            return String.format("DensityResult{clusters=%d, noise=%d (%.1f%%), cells=%d}",
                clusterCount, noiseCount, noisePercent, validCount);
        }
    }
}
