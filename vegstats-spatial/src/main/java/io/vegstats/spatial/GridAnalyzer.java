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

import io.vegstats.spatial.cluster.ClusterStats;
import io.vegstats.spatial.cluster.DensityClusterer;
import io.vegstats.spatial.cluster.KMeansClusterer;
import io.vegstats.spatial.config.SpatialAnalysisConfig;
import io.vegstats.spatial.measures.GridStatistics;
import io.vegstats.spatial.measures.HotspotDetector;
import io.vegstats.spatial.measures.MoranAutocorrelation;
import io.vegstats.spatial.measures.QuadrantPartitioner;
import io.vegstats.spatial.measures.RegionLabeler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;

/// # GridAnalyzer
///
/// Runs a set of [GridMeasure]s over a grid and collects their results.
///
/// ## Purpose
/// Coordinates measure execution, resolving the dependencies each measure declares so that
/// shared work (for example the global statistics used by hotspot detection) runs once per
/// grid.
///
/// ## Features
/// - **Measure Registration**: pluggable measures keyed by mnemonic
/// - **Dependency Management**: dependencies computed first and handed to dependents
/// - **Absent Results**: measures that produce nothing for a grid are recorded as absent
/// - **Batch Analysis**: independent grids analyzed in parallel on a bounded pool
///
/// ## Usage
/// ```java
/// GridAnalyzer analyzer = new GridAnalyzer(SpatialAnalysisConfig.defaults());
/// GridAnalyzer.AnalysisReport report = analyzer.analyze(grid);
/// System.out.println(report.getSummary());
/// ```
///
/// ## Default Measures
/// - **Stats**: descriptive statistics
/// - **Hotspots**: hotspot and coldspot masks
/// - **Regions**: connected hotspot and coldspot regions
/// - **KMeans**: k-means zoning
/// - **Moran**: global spatial autocorrelation
/// - **Quadrants**: fixed tile statistics
///
/// The analyzer keeps no per-grid state. Register measures before analyzing; the registry
/// is not meant to change while analyses run.
public class GridAnalyzer {

    private static final Logger logger = LogManager.getLogger(GridAnalyzer.class);

    private final Map<String, GridMeasure<?>> measures;

    /// Creates an analyzer with the default measures configured from `config`.
    ///
    /// @param config parameters of the default measures
    public GridAnalyzer(SpatialAnalysisConfig config) {
        this.measures = new LinkedHashMap<>();
        registerMeasure(new GridStatistics());
        registerMeasure(config.newHotspotDetector());
        registerMeasure(config.newRegionLabeler());
        registerMeasure(config.newKMeansClusterer());
        registerMeasure(config.newMoranAutocorrelation());
        registerMeasure(config.newQuadrantPartitioner());
    }

    /// Creates an analyzer with the default measures and default parameters.
    public GridAnalyzer() {
        this(SpatialAnalysisConfig.defaults());
    }

    /// Creates an analyzer with exactly the given measures.
    ///
    /// @param measures the measures to register, in execution order
    /// @return the analyzer
    public static GridAnalyzer of(GridMeasure<?>... measures) {
        GridAnalyzer analyzer = new GridAnalyzer(Collections.emptyMap());
        for (GridMeasure<?> m : measures) {
            analyzer.registerMeasure(m);
        }
        return analyzer;
    }

    private GridAnalyzer(Map<String, GridMeasure<?>> measures) {
        this.measures = new LinkedHashMap<>(measures);
    }

    /// Registers a measure, replacing any measure with the same mnemonic.
    ///
    /// @param measure the measure to register
    public void registerMeasure(GridMeasure<?> measure) {
        measures.put(measure.getMnemonic(), measure);
    }

    /// @return mnemonics of the registered measures, in execution order
    public Set<String> getMnemonics() {
        return Collections.unmodifiableSet(measures.keySet());
    }

    /// Runs every registered measure over a grid.
    ///
    /// @param grid the grid to analyze
    /// @return the report
    /// @throws IllegalStateException if a measure depends on an unregistered mnemonic
    public AnalysisReport analyze(Grid grid) {
        Map<String, Optional<?>> computed = new LinkedHashMap<>();
        for (GridMeasure<?> measure : measures.values()) {
            computeMeasure(measure, grid, computed, new LinkedHashSet<>());
        }

        Map<String, Object> results = new LinkedHashMap<>();
        Set<String> absent = new LinkedHashSet<>();
        computed.forEach((mnemonic, result) -> {
            if (result.isPresent()) {
                results.put(mnemonic, result.get());
            } else {
                absent.add(mnemonic);
            }
        });
        logger.debug("Analyzed {}: {} results, absent {}", grid.getId(), results.size(), absent);
        return new AnalysisReport(grid, results, absent);
    }

    /// Analyzes several grids in parallel. Each grid's analysis is independent.
    ///
    /// @param grids the grids to analyze
    /// @param parallelism maximum number of grids analyzed at once, at least 1
    /// @return one report per grid, in input order
    public List<AnalysisReport> analyzeAll(List<Grid> grids, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1, got " + parallelism);
        }
        ForkJoinPool pool = new ForkJoinPool(parallelism);
        try {
            List<ForkJoinTask<AnalysisReport>> tasks = new ArrayList<>(grids.size());
            for (Grid grid : grids) {
                tasks.add(pool.submit(() -> analyze(grid)));
            }
            List<AnalysisReport> reports = new ArrayList<>(grids.size());
            for (ForkJoinTask<AnalysisReport> task : tasks) {
                reports.add(task.join());
            }
            return reports;
        } finally {
            pool.shutdown();
        }
    }

    /// Analyzes several grids with one worker per available processor.
    ///
    /// @param grids the grids to analyze
    /// @return one report per grid, in input order
    public List<AnalysisReport> analyzeAll(List<Grid> grids) {
        return analyzeAll(grids, Math.max(1, Runtime.getRuntime().availableProcessors()));
    }

    private Optional<?> computeMeasure(GridMeasure<?> measure, Grid grid,
                                       Map<String, Optional<?>> computed, Set<String> inProgress) {
        String mnemonic = measure.getMnemonic();
        if (computed.containsKey(mnemonic)) {
            return computed.get(mnemonic);
        }
        if (!inProgress.add(mnemonic)) {
            throw new IllegalStateException("Dependency cycle through measure: " + mnemonic);
        }

        Map<String, Object> dependencyResults = new HashMap<>();
        for (String dependency : measure.getDependencies()) {
            GridMeasure<?> depMeasure = measures.get(dependency);
            if (depMeasure == null) {
                throw new IllegalStateException("Unknown dependency: " + dependency + " for measure: " + mnemonic);
            }
            computeMeasure(depMeasure, grid, computed, inProgress)
                .ifPresent(r -> dependencyResults.put(dependency, r));
        }

        Optional<?> result = measure.compute(grid, dependencyResults);
        computed.put(mnemonic, result);
        inProgress.remove(mnemonic);
        return result;
    }

    /// ## AnalysisReport
    ///
    /// Results of every registered measure for one grid.
    ///
    /// ### Usage
    /// ```java
    /// AnalysisReport report = analyzer.analyze(grid);
    /// Optional<MoranAutocorrelation.MoranResult> moran =
    ///     report.getResult("Moran", MoranAutocorrelation.MoranResult.class);
    /// System.out.println(report.getSummary());
    /// ```
    public static class AnalysisReport {
        /// The grid that was analyzed
        public final Grid grid;
        /// Map of measure mnemonics to their results, for measures that produced one
        public final Map<String, Object> results;
        /// Mnemonics of measures that produced no result for this grid
        public final Set<String> absent;

        /// Creates a new analysis report.
        ///
        /// @param grid the analyzed grid
        /// @param results map of measure mnemonics to their results
        /// @param absent mnemonics of measures without a result
        public AnalysisReport(Grid grid, Map<String, Object> results, Set<String> absent) {
            this.grid = grid;
            this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
            this.absent = Collections.unmodifiableSet(new LinkedHashSet<>(absent));
        }

        /// Gets a specific result by measure mnemonic with type checking.
        ///
        /// @param mnemonic the measure mnemonic (e.g., "Stats", "Hotspots", "Moran")
        /// @param resultClass the expected result class
        /// @param <T> the result type
        /// @return the result, or empty if the measure produced none or it has another type
        public <T> Optional<T> getResult(String mnemonic, Class<T> resultClass) {
            Object result = results.get(mnemonic);
            if (resultClass.isInstance(result)) {
                return Optional.of(resultClass.cast(result));
            }
            return Optional.empty();
        }

        /// @param mnemonic a measure mnemonic
        /// @return true if the measure ran and produced no result
        public boolean isAbsent(String mnemonic) {
            return absent.contains(mnemonic);
        }

        /// Generates a text summary of the analysis results.
        ///
        /// @return formatted multi-line summary
        public String getSummary() {
            StringBuilder sb = new StringBuilder();
            sb.append("Spatial Analysis Report\n");
            sb.append("=======================\n");
            sb.append(String.format("Grid: %s\n", grid.getId()));
            sb.append(String.format("Shape: %d x %d, valid cells: %d\n", grid.rows(), grid.cols(), grid.validCount()));
            sb.append("\n");

            getResult(GridStatistics.MNEMONIC, GridStatistics.Summary.class).ifPresent(s -> {
                sb.append("Statistics:\n");
                if (s.isEmpty()) {
                    sb.append("  no valid cells\n");
                } else {
                    sb.append(String.format("  Mean: %s ± %s (std dev), median %s\n",
                        fmt(s.mean()), fmt(s.std()), fmt(s.median())));
                    sb.append(String.format("  Range: %s to %s\n", fmt(s.min()), fmt(s.max())));
                    sb.append(String.format("  P05/P25/P75/P95: %s / %s / %s / %s\n",
                        fmt(s.p05()), fmt(s.p25()), fmt(s.p75()), fmt(s.p95())));
                    sb.append(String.format("  CV: %s%%, %s\n", fmt(s.shape().cvPercent()), s.shape().heterogeneity()));
                }
                sb.append("\n");
            });

            getResult(HotspotDetector.MNEMONIC, HotspotDetector.HotspotResult.class).ifPresent(h -> {
                sb.append(String.format("Hotspots (%s, threshold %.3f):\n", h.method(), h.threshold()));
                sb.append(String.format("  Hotspots: %d (%.1f%%), mean %s\n",
                    h.hotspotCount(), h.hotspotPercent(), fmt(h.hotspotMean())));
                sb.append(String.format("  Coldspots: %d (%.1f%%), mean %s\n",
                    h.coldspotCount(), h.coldspotPercent(), fmt(h.coldspotMean())));
                sb.append("\n");
            });

            getResult(RegionLabeler.MNEMONIC, RegionLabeler.HotspotRegions.class).ifPresent(r -> {
                sb.append(String.format("Regions (%s connectivity):\n", r.hotspotRegions().connectivity()));
                sb.append(String.format("  Hotspot regions: %d, mean size %s\n",
                    r.hotspotRegions().regionCount(), fmt(r.hotspotRegions().meanSize())));
                sb.append(String.format("  Coldspot regions: %d, mean size %s\n",
                    r.coldspotRegions().regionCount(), fmt(r.coldspotRegions().meanSize())));
                sb.append("\n");
            });

            getResult(KMeansClusterer.MNEMONIC, KMeansClusterer.KMeansResult.class).ifPresent(k -> {
                sb.append(String.format("K-means zoning (k=%d, inertia %.3f):\n", k.k(), k.inertia()));
                for (ClusterStats c : k.clusters()) {
                    sb.append("  ").append(c).append("\n");
                }
                sb.append("\n");
            });

            getResult(DensityClusterer.MNEMONIC, DensityClusterer.DensityResult.class).ifPresent(d -> {
                sb.append(String.format("DBSCAN zoning: %d clusters, noise %d (%.1f%%)\n",
                    d.clusterCount(), d.noiseCount(), d.noisePercent()));
                sb.append("\n");
            });

            getResult(MoranAutocorrelation.MNEMONIC, MoranAutocorrelation.MoranResult.class).ifPresent(m -> {
                sb.append(String.format("Moran's I (%s):\n", m.neighborhood()));
                sb.append(String.format("  I = %.4f (expected %.4f), z = %.3f, p = %.4f\n",
                    m.moranI(), m.expectedI(), m.zScore(), m.pValue()));
                sb.append(String.format("  Pattern: %s\n", m.pattern()));
                sb.append("\n");
            });

            getResult(QuadrantPartitioner.MNEMONIC, QuadrantPartitioner.QuadrantResult.class).ifPresent(q -> {
                sb.append(String.format("Quadrants (%d x %d):\n", q.rowTiles(), q.colTiles()));
                for (QuadrantPartitioner.Tile t : q.tiles()) {
                    sb.append(String.format("  %s: %d cells, mean %s\n", t.label(), t.pixelCount(), fmt(t.mean())));
                }
                sb.append("\n");
            });

            if (!absent.isEmpty()) {
                sb.append("No result: ").append(String.join(", ", absent)).append("\n");
            }
            return sb.toString();
        }

        private static String fmt(OptionalDouble value) {
            return value.isPresent() ? String.format("%.4f", value.getAsDouble()) : "n/a";
        }

        @Override
        public String toString() {
            return getSummary();
        }
    }
}
