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
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.JDKRandomGenerator;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;

/// # K-Means Zoning
///
/// Partitions the valid cells into `k` zones with k-means++ seeding and Lloyd iterations.
///
/// ## Algorithm
///
/// ```text
/// 1. Build standardized features per valid cell
/// 2. Repeat `restarts` times from one seeded generator:
///      seed k centers with k-means++, iterate until stable or maxIterations
///      inertia = Σ ‖x − center(x)‖²
/// 3. Keep the run with the lowest inertia
/// 4. Re-label clusters 0..k-1 by ascending mean raw value
/// ```
///
/// Results are deterministic for a given seed. Cluster `0` is always the zone with the
/// lowest mean value. A cluster that ends up without cells sorts after all populated
/// clusters and reports zero cells.
///
/// No result is produced when there are fewer valid cells than `k`.
public class KMeansClusterer extends AbstractSpatialClusterer<KMeansClusterer.KMeansResult> {

    private static final Logger logger = LogManager.getLogger(KMeansClusterer.class);

    /// Mnemonic under which this measure registers
    public static final String MNEMONIC = "KMeans";

    /// Default number of clusters
    public static final int DEFAULT_K = 5;
    /// Default seed of the k-means++ random source
    public static final long DEFAULT_SEED = 42L;
    /// Default number of independent runs
    public static final int DEFAULT_RESTARTS = 10;
    /// Default iteration cap per run
    public static final int DEFAULT_MAX_ITERATIONS = 300;

    private final int k;
    private final long seed;
    private final int restarts;
    private final int maxIterations;

    /// Creates a k-means clusterer.
    ///
    /// @param k number of clusters, at least 1
    /// @param useCoordinates whether normalized cell coordinates join the cell value as features
    /// @param seed seed of the random generator shared by all restarts
    /// @param restarts number of independent runs, at least 1
    /// @param maxIterations iteration cap per run, at least 1
    public KMeansClusterer(int k, boolean useCoordinates, long seed, int restarts, int maxIterations) {
        super(useCoordinates);
        if (k < 1) {
            throw new IllegalArgumentException("Number of clusters must be at least 1, got " + k);
        }
        if (restarts < 1) {
            throw new IllegalArgumentException("Number of restarts must be at least 1, got " + restarts);
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("Iteration cap must be at least 1, got " + maxIterations);
        }
        this.k = k;
        this.seed = seed;
        this.restarts = restarts;
        this.maxIterations = maxIterations;
    }

    /// Creates a clusterer with default seed, restarts and iteration cap.
    ///
    /// @param k number of clusters, at least 1
    /// @param useCoordinates whether normalized cell coordinates join the cell value as features
    public KMeansClusterer(int k, boolean useCoordinates) {
        this(k, useCoordinates, DEFAULT_SEED, DEFAULT_RESTARTS, DEFAULT_MAX_ITERATIONS);
    }

    /// Creates a 5-cluster clusterer using coordinates.
    public KMeansClusterer() {
        this(DEFAULT_K, true);
    }

    @Override
    public String getMnemonic() {
        return MNEMONIC;
    }

    @Override
    protected Class<KMeansResult> getResultClass() {
        return KMeansResult.class;
    }

    /// @return number of clusters
    public int getK() {
        return k;
    }

    /// @return seed of the k-means++ random source
    public long getSeed() {
        return seed;
    }

    /// @return number of independent runs
    public int getRestarts() {
        return restarts;
    }

    /// @return iteration cap per run
    public int getMaxIterations() {
        return maxIterations;
    }

    @Override
    protected Optional<KMeansResult> computeImpl(Grid grid, Map<String, Object> dependencyResults) {
        int n = grid.validCount();
        if (n < k) {
            logger.debug("K-means skipped for {}: {} valid cells for k={}", grid.getId(), n, k);
            return Optional.empty();
        }

        Features features = buildFeatures(grid);
        RandomGenerator random = new JDKRandomGenerator();
        random.setSeed(seed);
        KMeansPlusPlusClusterer<CellPoint> clusterer =
            new KMeansPlusPlusClusterer<>(k, maxIterations, new EuclideanDistance(), random);

        List<CentroidCluster<CellPoint>> best = null;
        double bestInertia = Double.POSITIVE_INFINITY;
        for (int run = 0; run < restarts; run++) {
            List<CentroidCluster<CellPoint>> clusters;
            try {
                clusters = clusterer.cluster(features.points());
            } catch (MathIllegalStateException e) {
                logger.warn("K-means run {} on {} did not converge: {}", run, grid.getId(), e.getMessage());
                continue;
            }
            double inertia = inertia(clusters);
            logger.trace("K-means run {} on {}: inertia={}", run, grid.getId(), inertia);
            if (inertia < bestInertia) {
                bestInertia = inertia;
                best = clusters;
            }
        }
        if (best == null) {
            throw new IllegalStateException("No k-means run converged for grid " + grid.getId());
        }

        return Optional.of(relabel(grid, features, best, bestInertia));
    }

    private KMeansResult relabel(Grid grid, Features features, List<CentroidCluster<CellPoint>> clusters, double inertia) {
        int dims = isUsingCoordinates() ? 3 : 1;
        double[] raw = features.raw();

        // commons may return fewer than k clusters when seeding runs out of distinct points
        double[] meanOf = new double[k];
        Arrays.fill(meanOf, Double.NaN);
        int[] sizeOf = new int[k];
        for (int j = 0; j < clusters.size(); j++) {
            List<CellPoint> members = clusters.get(j).getPoints();
            sizeOf[j] = members.size();
            if (!members.isEmpty()) {
                double sum = 0;
                for (CellPoint p : members) {
                    sum += raw[p.index()];
                }
                meanOf[j] = sum / members.size();
            }
        }

        Integer[] order = IntStream.range(0, k).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.<Integer>comparingInt(j -> sizeOf[j] == 0 ? 1 : 0)
            .thenComparingDouble(j -> sizeOf[j] == 0 ? 0.0 : meanOf[j]));
        int[] newId = new int[k];
        for (int rank = 0; rank < k; rank++) {
            newId[order[rank]] = rank;
        }

        int[] ids = new int[features.size()];
        for (int j = 0; j < clusters.size(); j++) {
            for (CellPoint p : clusters.get(j).getPoints()) {
                ids[p.index()] = newId[j];
            }
        }

        List<double[]> centroids = new ArrayList<>(k);
        List<ClusterStats> stats = new ArrayList<>(k);
        for (int rank = 0; rank < k; rank++) {
            int j = order[rank];
            if (j < clusters.size()) {
                centroids.add(clusters.get(j).getCenter().getPoint().clone());
            } else {
                double[] missing = new double[dims];
                Arrays.fill(missing, Double.NaN);
                centroids.add(missing);
            }
            stats.add(statsFor(rank, features, ids));
        }

        return new KMeansResult(
            scatter(grid, features, ids),
            k,
            features.size(),
            Collections.unmodifiableList(stats),
            inertia,
            Collections.unmodifiableList(centroids));
    }

    private static double inertia(List<CentroidCluster<CellPoint>> clusters) {
        double total = 0;
        for (CentroidCluster<CellPoint> cluster : clusters) {
            double[] center = cluster.getCenter().getPoint();
            for (CellPoint p : cluster.getPoints()) {
                double[] x = p.getPoint();
                for (int d = 0; d < x.length; d++) {
                    double diff = x[d] - center[d];
                    total += diff * diff;
                }
            }
        }
        return total;
    }

    /// Result of k-means zoning.
    ///
    /// @param assignments cluster id `0..k-1` per valid cell, [LabelGrid#UNASSIGNED] elsewhere
    /// @param k number of clusters requested
    /// @param validCount number of clustered cells
    /// @param clusters statistics per cluster, index equals cluster id
    /// @param inertia within-cluster sum of squares in standardized feature space
    /// @param centroids cluster centers in standardized feature space, index equals cluster id
    public record KMeansResult(
        LabelGrid assignments,
        int k,
        int validCount,
        List<ClusterStats> clusters,
        double inertia,
        List<double[]> centroids
    ) {
        @Override
        public String toString() {
            return String.format("KMeansResult{k=%d, cells=%d, inertia=%.4f}", k, validCount, inertia);
        }
    }
}
