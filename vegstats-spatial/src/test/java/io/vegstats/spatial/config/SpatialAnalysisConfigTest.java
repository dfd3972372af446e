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
import io.vegstats.spatial.TestGrids;
import io.vegstats.spatial.filter.Smoother;
import io.vegstats.spatial.measures.Connectivity;
import io.vegstats.spatial.measures.HotspotMethod;
import io.vegstats.spatial.measures.Neighborhood;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class SpatialAnalysisConfigTest {

    @TempDir
    Path tempDir;

    @Test
    public void testClasspathDefaults() {
        SpatialAnalysisConfig config = SpatialAnalysisConfig.defaults();
        assertEquals(HotspotMethod.ZSCORE, config.getHotspotMethod());
        assertEquals(1.5, config.getHotspotThreshold());
        assertEquals(Connectivity.EIGHT, config.getConnectivity());
        assertEquals(5, config.getKMeansK());
        assertTrue(config.isKMeansUsingCoordinates());
        assertEquals(42L, config.getKMeansSeed());
        assertEquals(10, config.getKMeansRestarts());
        assertEquals(300, config.getKMeansMaxIterations());
        assertEquals(0.5, config.getDbscanEps());
        assertEquals(10, config.getDbscanMinSamples());
        assertTrue(config.isDbscanUsingCoordinates());
        assertEquals(Neighborhood.QUEEN, config.getNeighborhood());
        assertEquals(0.05, config.getMoranAlpha());
        assertEquals(2, config.getQuadrantRows());
        assertEquals(2, config.getQuadrantCols());
        assertEquals(1.0, config.getSmoothingSigma());
        assertEquals(0.5, config.getChangeFactor());
        assertSame(config, SpatialAnalysisConfig.defaults());
    }

    @Test
    public void testYamlOverridesOnlyNamedKeys() {
        SpatialAnalysisConfig config = SpatialAnalysisConfig.fromYaml(String.join("\n",
            "hotspots:",
            "  method: percentile",
            "  threshold: 10",
            "regions:",
            "  connectivity: 4",
            "moran:",
            "  neighborhood: rook",
            ""));

        assertEquals(HotspotMethod.PERCENTILE, config.getHotspotMethod());
        assertEquals(10.0, config.getHotspotThreshold());
        assertEquals(Connectivity.FOUR, config.getConnectivity());
        assertEquals(Neighborhood.ROOK, config.getNeighborhood());
        assertEquals(0.05, config.getMoranAlpha());
        assertEquals(5, config.getKMeansK());

        assertEquals(HotspotMethod.PERCENTILE, config.newHotspotDetector().getMethod());
        assertEquals(Connectivity.FOUR, config.newRegionLabeler().getConnectivity());
        assertEquals(Neighborhood.ROOK, config.newMoranAutocorrelation().getNeighborhood());
    }

    @Test
    public void testEmptyYamlIsDefaults() {
        SpatialAnalysisConfig config = SpatialAnalysisConfig.fromYaml("");
        assertEquals(SpatialAnalysisConfig.defaults().toString(), config.toString());
    }

    @Test
    public void testFromFile() throws IOException {
        Path file = tempDir.resolve("spatial.yaml");
        Files.writeString(file, "kmeans:\n  k: 3\n  includeCoordinates: false\ndbscan:\n  eps: 0.8\n  minSamples: 4\n");

        SpatialAnalysisConfig config = SpatialAnalysisConfig.fromFile(file);
        assertEquals(3, config.newKMeansClusterer().getK());
        assertFalse(config.newKMeansClusterer().isUsingCoordinates());
        assertEquals(0.8, config.newDensityClusterer().getEps());
        assertEquals(4, config.newDensityClusterer().getMinSamples());
        assertTrue(config.isDbscanUsingCoordinates());
    }

    @Test
    public void testMissingFile() {
        assertThrows(UncheckedIOException.class, () -> SpatialAnalysisConfig.fromFile(tempDir.resolve("absent.yaml")));
    }

    @Test
    public void testUnknownSectionAndKey() {
        assertThatThrownBy(() -> SpatialAnalysisConfig.fromYaml("clustering:\n  k: 3\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("unknown section 'clustering'");
        assertThatThrownBy(() -> SpatialAnalysisConfig.fromYaml("kmeans:\n  clusters: 3\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("unknown key 'kmeans.clusters'");
    }

    @Test
    public void testInvalidValues() {
        assertThatThrownBy(() -> SpatialAnalysisConfig.fromYaml("hotspots:\n  method: gaussian\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("invalid value for 'hotspots.method'");
        assertThatThrownBy(() -> SpatialAnalysisConfig.fromYaml("kmeans:\n  k: 2.5\n"))
            .hasMessageContaining("kmeans.k");
        assertThatThrownBy(() -> SpatialAnalysisConfig.fromYaml("dbscan:\n  includeCoordinates: maybe\n"))
            .hasMessageContaining("dbscan.includeCoordinates");
        assertThatThrownBy(() -> SpatialAnalysisConfig.fromYaml("- one\n- two\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("mapping");
    }

    @Test
    public void testBuildValidatesRanges() {
        assertThrows(IllegalArgumentException.class, () -> SpatialAnalysisConfig.fromYaml("kmeans:\n  k: 0\n"));
        assertThrows(IllegalArgumentException.class, () -> SpatialAnalysisConfig.fromYaml("quadrants:\n  rows: 0\n"));
        assertThrows(IllegalArgumentException.class, () -> SpatialAnalysisConfig.fromYaml("smoothing:\n  sigma: -1\n"));
        assertThrows(IllegalArgumentException.class,
            () -> SpatialAnalysisConfig.builder().moran(Neighborhood.QUEEN, 1.5).build());
        assertThrows(IllegalArgumentException.class,
            () -> SpatialAnalysisConfig.builder().changeFactor(-1).build());
        assertThatThrownBy(() -> SpatialAnalysisConfig.builder().dbscan(0.0, 5, false).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("dbscan.eps");
        assertThatThrownBy(() -> SpatialAnalysisConfig.builder().hotspots(HotspotMethod.PERCENTILE, 120).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("120");
        assertThatThrownBy(() -> SpatialAnalysisConfig.builder().kmeansRuns(1L, 0, 10).build())
            .hasMessageContaining("kmeans.restarts");
    }

    @Test
    public void testSmoothUsesConfiguredSigma() {
        Grid grid = TestGrids.withHoles(TestGrids.noise("noise", 9, 9, 0.5, 0.2, 4L), 10, 40);
        SpatialAnalysisConfig config = SpatialAnalysisConfig.fromYaml("smoothing:\n  sigma: 2.0\n");

        Grid smoothed = config.smooth(grid);
        assertArrayEquals(Smoother.smooth(grid, 2.0).toRowMajor(), smoothed.toRowMajor());
        assertTrue(Double.isNaN(smoothed.get(1, 1)));
        assertEquals(79, smoothed.validCount());
    }

    @Test
    public void testBuilderRoundTrip() {
        SpatialAnalysisConfig config = SpatialAnalysisConfig.builder()
            .hotspots(HotspotMethod.IQR, 1.0)
            .quadrants(3, 4)
            .smoothingSigma(2.0)
            .build();
        SpatialAnalysisConfig copy = config.toBuilder().changeFactor(1.0).build();

        assertEquals(HotspotMethod.IQR, copy.getHotspotMethod());
        assertEquals(3, copy.newQuadrantPartitioner().getRowTiles());
        assertEquals(4, copy.newQuadrantPartitioner().getColTiles());
        assertEquals(2.0, copy.getSmoothingSigma());
        assertEquals(1.0, copy.newTemporalDiffAnalyzer().getChangeFactor());
        assertEquals(0.5, config.getChangeFactor());
    }
}
