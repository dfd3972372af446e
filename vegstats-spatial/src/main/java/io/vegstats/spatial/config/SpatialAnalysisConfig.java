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

package io.vegstats.spatial.config;

import io.vegstats.spatial.Grid;
import io.vegstats.spatial.cluster.DensityClusterer;
import io.vegstats.spatial.cluster.KMeansClusterer;
import io.vegstats.spatial.filter.Smoother;
import io.vegstats.spatial.measures.Connectivity;
import io.vegstats.spatial.measures.HotspotDetector;
import io.vegstats.spatial.measures.HotspotMethod;
import io.vegstats.spatial.measures.MoranAutocorrelation;
import io.vegstats.spatial.measures.Neighborhood;
import io.vegstats.spatial.measures.QuadrantPartitioner;
import io.vegstats.spatial.measures.RegionLabeler;
import io.vegstats.spatial.temporal.TemporalDiffAnalyzer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/// Parameters of every spatial component, with defaults and YAML overrides.
///
/// The defaults ship on the classpath as `vegstats-spatial-defaults.yaml`. A YAML document
/// passed to [#fromYaml(String)] or [#fromFile(Path)] only needs the keys it changes:
///
/// ```yaml
/// hotspots:
///   method: percentile
///   threshold: 10
/// kmeans:
///   k: 3
/// ```
///
/// Unknown sections, keys and enum names are rejected with an [IllegalArgumentException]
/// naming the offending key. Out-of-range values fail the same way when the configuration
/// is built.
///
/// Instances are immutable. The `new*` factory methods return fresh components configured
/// from these parameters.
public final class SpatialAnalysisConfig {

    private static final Logger logger = LogManager.getLogger(SpatialAnalysisConfig.class);

    /// Classpath resource holding the default parameters
    public static final String DEFAULTS_RESOURCE = "vegstats-spatial-defaults.yaml";

    private static final Map<String, Set<String>> SCHEMA = Map.of(
        "hotspots", Set.of("method", "threshold"),
        "regions", Set.of("connectivity"),
        "kmeans", Set.of("k", "includeCoordinates", "seed", "restarts", "maxIterations"),
        "dbscan", Set.of("eps", "minSamples", "includeCoordinates"),
        "moran", Set.of("neighborhood", "alpha"),
        "quadrants", Set.of("rows", "cols"),
        "smoothing", Set.of("sigma"),
        "temporal", Set.of("changeFactor")
    );

    private static volatile SpatialAnalysisConfig defaults;

    private final HotspotMethod hotspotMethod;
    private final double hotspotThreshold;
    private final Connectivity connectivity;
    private final int kmeansK;
    private final boolean kmeansCoordinates;
    private final long kmeansSeed;
    private final int kmeansRestarts;
    private final int kmeansMaxIterations;
    private final double dbscanEps;
    private final int dbscanMinSamples;
    private final boolean dbscanCoordinates;
    private final Neighborhood neighborhood;
    private final double moranAlpha;
    private final int quadrantRows;
    private final int quadrantCols;
    private final double smoothingSigma;
    private final double changeFactor;

    private SpatialAnalysisConfig(Builder b) {
        this.hotspotMethod = b.hotspotMethod;
        this.hotspotThreshold = b.hotspotThreshold;
        this.connectivity = b.connectivity;
        this.kmeansK = b.kmeansK;
        this.kmeansCoordinates = b.kmeansCoordinates;
        this.kmeansSeed = b.kmeansSeed;
        this.kmeansRestarts = b.kmeansRestarts;
        this.kmeansMaxIterations = b.kmeansMaxIterations;
        this.dbscanEps = b.dbscanEps;
        this.dbscanMinSamples = b.dbscanMinSamples;
        this.dbscanCoordinates = b.dbscanCoordinates;
        this.neighborhood = b.neighborhood;
        this.moranAlpha = b.moranAlpha;
        this.quadrantRows = b.quadrantRows;
        this.quadrantCols = b.quadrantCols;
        this.smoothingSigma = b.smoothingSigma;
        this.changeFactor = b.changeFactor;
    }

    /// @return the parameters from the classpath defaults
    /// @throws UncheckedIOException if the defaults resource cannot be read
    public static SpatialAnalysisConfig defaults() {
        SpatialAnalysisConfig d = defaults;
        if (d == null) {
            synchronized (SpatialAnalysisConfig.class) {
                d = defaults;
                if (d == null) {
                    d = builder().apply(loadDefaultsDocument(), "classpath:" + DEFAULTS_RESOURCE).build();
                    defaults = d;
                }
            }
        }
        return d;
    }

    /// Reads overrides from a YAML string on top of the defaults.
    ///
    /// @param yaml a YAML mapping of sections to parameters
    /// @return the configuration
    public static SpatialAnalysisConfig fromYaml(String yaml) {
        return defaults().toBuilder().apply(parse(yaml, "<string>"), "<string>").build();
    }

    /// Reads overrides from a YAML file on top of the defaults.
    ///
    /// @param path the YAML file
    /// @return the configuration
    /// @throws UncheckedIOException if the file cannot be read
    public static SpatialAnalysisConfig fromFile(Path path) {
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read configuration " + path, e);
        }
        logger.info("Loading spatial analysis configuration from {}", path);
        return defaults().toBuilder().apply(parse(text, path.toString()), path.toString()).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// @return a builder preset with these parameters
    public Builder toBuilder() {
        Builder b = new Builder();
        b.hotspotMethod = hotspotMethod;
        b.hotspotThreshold = hotspotThreshold;
        b.connectivity = connectivity;
        b.kmeansK = kmeansK;
        b.kmeansCoordinates = kmeansCoordinates;
        b.kmeansSeed = kmeansSeed;
        b.kmeansRestarts = kmeansRestarts;
        b.kmeansMaxIterations = kmeansMaxIterations;
        b.dbscanEps = dbscanEps;
        b.dbscanMinSamples = dbscanMinSamples;
        b.dbscanCoordinates = dbscanCoordinates;
        b.neighborhood = neighborhood;
        b.moranAlpha = moranAlpha;
        b.quadrantRows = quadrantRows;
        b.quadrantCols = quadrantCols;
        b.smoothingSigma = smoothingSigma;
        b.changeFactor = changeFactor;
        return b;
    }

    /// @return a hotspot detector with the configured method and threshold
    public HotspotDetector newHotspotDetector() {
        return new HotspotDetector(hotspotMethod, hotspotThreshold);
    }

    /// @return a region labeler with the configured connectivity and hotspot detector
    public RegionLabeler newRegionLabeler() {
        return new RegionLabeler(connectivity, newHotspotDetector());
    }

    /// @return a k-means clusterer with the configured runs
    public KMeansClusterer newKMeansClusterer() {
        return new KMeansClusterer(kmeansK, kmeansCoordinates, kmeansSeed, kmeansRestarts, kmeansMaxIterations);
    }

    /// @return a DBSCAN clusterer with the configured radius and core size
    public DensityClusterer newDensityClusterer() {
        return new DensityClusterer(dbscanEps, dbscanMinSamples, dbscanCoordinates);
    }

    /// @return a Moran's I measure with the configured weights and significance level
    public MoranAutocorrelation newMoranAutocorrelation() {
        return new MoranAutocorrelation(neighborhood, moranAlpha);
    }

    /// @return a partitioner with the configured tile lattice
    public QuadrantPartitioner newQuadrantPartitioner() {
        return new QuadrantPartitioner(quadrantRows, quadrantCols);
    }

    /// @return a change analyzer with the configured change factor
    public TemporalDiffAnalyzer newTemporalDiffAnalyzer() {
        return new TemporalDiffAnalyzer(changeFactor);
    }

    /// Smooths a grid with the configured kernel width.
    ///
    /// @param grid the grid to smooth
    /// @return the smoothed grid, NaN where the input is invalid
    public Grid smooth(Grid grid) {
        return Smoother.smooth(grid, smoothingSigma);
    }

    public HotspotMethod getHotspotMethod() {
        return hotspotMethod;
    }

    public double getHotspotThreshold() {
        return hotspotThreshold;
    }

    public Connectivity getConnectivity() {
        return connectivity;
    }

    public int getKMeansK() {
        return kmeansK;
    }

    public boolean isKMeansUsingCoordinates() {
        return kmeansCoordinates;
    }

    public long getKMeansSeed() {
        return kmeansSeed;
    }

    public int getKMeansRestarts() {
        return kmeansRestarts;
    }

    public int getKMeansMaxIterations() {
        return kmeansMaxIterations;
    }

    public double getDbscanEps() {
        return dbscanEps;
    }

    public int getDbscanMinSamples() {
        return dbscanMinSamples;
    }

    public boolean isDbscanUsingCoordinates() {
        return dbscanCoordinates;
    }

    public Neighborhood getNeighborhood() {
        return neighborhood;
    }

    public double getMoranAlpha() {
        return moranAlpha;
    }

    public int getQuadrantRows() {
        return quadrantRows;
    }

    public int getQuadrantCols() {
        return quadrantCols;
    }

    /// @return sigma applied by [#smooth(Grid)], in cells
    public double getSmoothingSigma() {
        return smoothingSigma;
    }

    public double getChangeFactor() {
        return changeFactor;
    }

    @Override
    public String toString() {
        return "SpatialAnalysisConfig{hotspots=" + hotspotMethod + "/" + hotspotThreshold
            + ", connectivity=" + connectivity
            + ", kmeans=k" + kmeansK + (kmeansCoordinates ? "+xy" : "") + " seed=" + kmeansSeed
            + " restarts=" + kmeansRestarts + " maxIter=" + kmeansMaxIterations
            + ", dbscan=eps" + dbscanEps + " minSamples=" + dbscanMinSamples + (dbscanCoordinates ? "+xy" : "")
            + ", moran=" + neighborhood + "@" + moranAlpha
            + ", quadrants=" + quadrantRows + "x" + quadrantCols
            + ", sigma=" + smoothingSigma
            + ", changeFactor=" + changeFactor + "}";
    }

    private static Map<String, Object> loadDefaultsDocument() {
        try (InputStream in = SpatialAnalysisConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new UncheckedIOException(new IOException("Missing classpath resource " + DEFAULTS_RESOURCE));
            }
            logger.debug("Loading spatial analysis defaults from {}", DEFAULTS_RESOURCE);
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), DEFAULTS_RESOURCE);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + DEFAULTS_RESOURCE, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parse(String yaml, String source) {
        LoadSettings loadSettings = LoadSettings.builder().setLabel(source).build();
        Load load = new Load(loadSettings);
        Object doc = load.loadFromString(yaml);
        if (doc == null) {
            return Map.of();
        }
        if (!(doc instanceof Map<?, ?>)) {
            throw new IllegalArgumentException(source + ": configuration must be a mapping of sections");
        }
        return (Map<String, Object>) doc;
    }

    /// Mutable parameter set. [#build()] validates every parameter.
    public static final class Builder {
        private HotspotMethod hotspotMethod = HotspotDetector.DEFAULT_METHOD;
        private double hotspotThreshold = HotspotDetector.DEFAULT_THRESHOLD;
        private Connectivity connectivity = Connectivity.EIGHT;
        private int kmeansK = KMeansClusterer.DEFAULT_K;
        private boolean kmeansCoordinates = true;
        private long kmeansSeed = KMeansClusterer.DEFAULT_SEED;
        private int kmeansRestarts = KMeansClusterer.DEFAULT_RESTARTS;
        private int kmeansMaxIterations = KMeansClusterer.DEFAULT_MAX_ITERATIONS;
        private double dbscanEps = DensityClusterer.DEFAULT_EPS;
        private int dbscanMinSamples = DensityClusterer.DEFAULT_MIN_SAMPLES;
        private boolean dbscanCoordinates = true;
        private Neighborhood neighborhood = Neighborhood.QUEEN;
        private double moranAlpha = MoranAutocorrelation.DEFAULT_ALPHA;
        private int quadrantRows = 2;
        private int quadrantCols = 2;
        private double smoothingSigma = 1.0;
        private double changeFactor = TemporalDiffAnalyzer.DEFAULT_CHANGE_FACTOR;

        private Builder() {
        }

        public Builder hotspots(HotspotMethod method, double threshold) {
            this.hotspotMethod = method;
            this.hotspotThreshold = threshold;
            return this;
        }

        public Builder connectivity(Connectivity connectivity) {
            this.connectivity = connectivity;
            return this;
        }

        public Builder kmeans(int k, boolean includeCoordinates) {
            this.kmeansK = k;
            this.kmeansCoordinates = includeCoordinates;
            return this;
        }

        public Builder kmeansRuns(long seed, int restarts, int maxIterations) {
            this.kmeansSeed = seed;
            this.kmeansRestarts = restarts;
            this.kmeansMaxIterations = maxIterations;
            return this;
        }

        public Builder dbscan(double eps, int minSamples, boolean includeCoordinates) {
            this.dbscanEps = eps;
            this.dbscanMinSamples = minSamples;
            this.dbscanCoordinates = includeCoordinates;
            return this;
        }

        public Builder moran(Neighborhood neighborhood, double alpha) {
            this.neighborhood = neighborhood;
            this.moranAlpha = alpha;
            return this;
        }

        public Builder quadrants(int rows, int cols) {
            this.quadrantRows = rows;
            this.quadrantCols = cols;
            return this;
        }

        public Builder smoothingSigma(double sigma) {
            this.smoothingSigma = sigma;
            return this;
        }

        public Builder changeFactor(double factor) {
            this.changeFactor = factor;
            return this;
        }

        /// Applies the keys present in a parsed YAML document.
        ///
        /// @param doc section name to parameter mapping
        /// @param source where the document came from, for error messages
        /// @return this builder
        /// @throws IllegalArgumentException on unknown sections, keys or values
        public Builder apply(Map<String, Object> doc, String source) {
            for (Map.Entry<String, Object> section : doc.entrySet()) {
                String name = String.valueOf(section.getKey());
                Set<String> allowed = SCHEMA.get(name);
                if (allowed == null) {
                    throw new IllegalArgumentException(source + ": unknown section '" + name
                        + "', expected one of " + SCHEMA.keySet());
                }
                if (section.getValue() == null) {
                    continue;
                }
                if (!(section.getValue() instanceof Map<?, ?> params)) {
                    throw new IllegalArgumentException(source + ": section '" + name + "' must be a mapping");
                }
                for (Map.Entry<?, ?> param : params.entrySet()) {
                    String key = String.valueOf(param.getKey());
                    if (!allowed.contains(key)) {
                        throw new IllegalArgumentException(source + ": unknown key '" + name + "." + key
                            + "', expected one of " + allowed);
                    }
                    set(name + "." + key, param.getValue(), source);
                }
            }
            return this;
        }

        private void set(String key, Object value, String source) {
            try {
                switch (key) {
                    case "hotspots.method":
                        hotspotMethod = HotspotMethod.fromName(text(value));
                        break;
                    case "hotspots.threshold":
                        hotspotThreshold = number(value).doubleValue();
                        break;
                    case "regions.connectivity":
                        connectivity = Connectivity.fromName(text(value));
                        break;
                    case "kmeans.k":
                        kmeansK = integer(value);
                        break;
                    case "kmeans.includeCoordinates":
                        kmeansCoordinates = bool(value);
                        break;
                    case "kmeans.seed":
                        kmeansSeed = number(value).longValue();
                        break;
                    case "kmeans.restarts":
                        kmeansRestarts = integer(value);
                        break;
                    case "kmeans.maxIterations":
                        kmeansMaxIterations = integer(value);
                        break;
                    case "dbscan.eps":
                        dbscanEps = number(value).doubleValue();
                        break;
                    case "dbscan.minSamples":
                        dbscanMinSamples = integer(value);
                        break;
                    case "dbscan.includeCoordinates":
                        dbscanCoordinates = bool(value);
                        break;
                    case "moran.neighborhood":
                        neighborhood = Neighborhood.fromName(text(value));
                        break;
                    case "moran.alpha":
                        moranAlpha = number(value).doubleValue();
                        break;
                    case "quadrants.rows":
                        quadrantRows = integer(value);
                        break;
                    case "quadrants.cols":
                        quadrantCols = integer(value);
                        break;
                    case "smoothing.sigma":
                        smoothingSigma = number(value).doubleValue();
                        break;
                    case "temporal.changeFactor":
                        changeFactor = number(value).doubleValue();
                        break;
                    default:
                        throw new IllegalStateException("Unhandled configuration key " + key);
                }
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(source + ": invalid value for '" + key + "': " + e.getMessage(), e);
            }
        }

        /// @return the validated configuration
        /// @throws IllegalArgumentException if any parameter is out of range
        public SpatialAnalysisConfig build() {
            require(hotspotMethod != null, "hotspots.method must be set");
            hotspotMethod.validateThreshold(hotspotThreshold);
            require(connectivity != null, "regions.connectivity must be set");
            require(kmeansK >= 1, "kmeans.k must be at least 1, got " + kmeansK);
            require(kmeansRestarts >= 1, "kmeans.restarts must be at least 1, got " + kmeansRestarts);
            require(kmeansMaxIterations >= 1, "kmeans.maxIterations must be at least 1, got " + kmeansMaxIterations);
            require(dbscanEps > 0.0 && !Double.isInfinite(dbscanEps),
                "dbscan.eps must be positive and finite, got " + dbscanEps);
            require(dbscanMinSamples >= 1, "dbscan.minSamples must be at least 1, got " + dbscanMinSamples);
            require(neighborhood != null, "moran.neighborhood must be set");
            require(moranAlpha > 0.0 && moranAlpha < 1.0, "moran.alpha must be in (0, 1), got " + moranAlpha);
            require(quadrantRows >= 1 && quadrantCols >= 1,
                "quadrants must be at least 1x1, got " + quadrantRows + "x" + quadrantCols);
            require(smoothingSigma > 0.0 && !Double.isInfinite(smoothingSigma),
                "smoothing.sigma must be positive and finite, got " + smoothingSigma);
            require(changeFactor >= 0.0 && !Double.isInfinite(changeFactor),
                "temporal.changeFactor must be finite and non-negative, got " + changeFactor);
            return new SpatialAnalysisConfig(this);
        }

        private static void require(boolean condition, String message) {
            if (!condition) {
                throw new IllegalArgumentException(message);
            }
        }

        private static String text(Object value) {
            if (value == null) {
                throw new IllegalArgumentException("value is missing");
            }
            return String.valueOf(value);
        }

        private static Number number(Object value) {
            if (value instanceof Number n) {
                return n;
            }
            throw new IllegalArgumentException("expected a number, got " + value);
        }

        private static int integer(Object value) {
            Number n = number(value);
            if (n.doubleValue() != n.longValue() || n.longValue() > Integer.MAX_VALUE || n.longValue() < Integer.MIN_VALUE) {
                throw new IllegalArgumentException("expected an integer, got " + value);
            }
            return n.intValue();
        }

        private static boolean bool(Object value) {
            if (value instanceof Boolean b) {
                return b;
            }
            throw new IllegalArgumentException("expected true or false, got " + value);
        }
    }
}
