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
import io.vegstats.spatial.TestGrids;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class KMeansClustererTest {

    @Test
    public void testSeparatesTwoHalves() {
        Grid grid = TestGrids.twoHalves(6, 6, 0.1, 0.8);
        KMeansClusterer.KMeansResult result = new KMeansClusterer(2, false).compute(grid).orElseThrow();

        assertEquals(2, result.k());
        assertEquals(36, result.validCount());
        LabelGrid assignments = result.assignments();
        for (int r = 0; r < 6; r++) {
            for (int c = 0; c < 6; c++) {
                assertEquals(c < 3 ? 0 : 1, assignments.get(r, c), "cell " + r + "," + c);
            }
        }
        ClusterStats low = result.clusters().get(0);
        ClusterStats high = result.clusters().get(1);
        assertEquals(18, low.pixelCount());
        assertEquals(50.0, low.percent(), 1e-12);
        assertEquals(0.1, low.mean().getAsDouble(), 1e-12);
        assertEquals(0.8, high.mean().getAsDouble(), 1e-12);
        assertEquals(0.0, result.inertia(), 1e-9);
        assertEquals(2, result.centroids().size());
        assertEquals(1, result.centroids().get(0).length);
    }

    @Test
    public void testClusterIdsOrderedByMean() {
        Grid grid = TestGrids.noise("noise", 15, 15, 0.5, 0.15, 21L);
        KMeansClusterer.KMeansResult result = new KMeansClusterer(4, true).compute(grid).orElseThrow();

        assertThat(result.clusters()).hasSize(4);
        double previous = Double.NEGATIVE_INFINITY;
        int total = 0;
        for (int id = 0; id < 4; id++) {
            ClusterStats stats = result.clusters().get(id);
            assertEquals(id, stats.clusterId());
            assertEquals(stats.pixelCount(), result.assignments().count(id));
            if (!stats.isEmpty()) {
                assertTrue(stats.mean().getAsDouble() >= previous);
                previous = stats.mean().getAsDouble();
            }
            total += stats.pixelCount();
        }
        assertEquals(225, total);
        assertEquals(3, result.centroids().get(0).length);
    }

    @Test
    public void testSameSeedSameAssignments() {
        Grid grid = TestGrids.noise("noise", 12, 12, 0.5, 0.2, 5L);
        KMeansClusterer.KMeansResult first = new KMeansClusterer(3, true, 7L, 4, 100).compute(grid).orElseThrow();
        KMeansClusterer.KMeansResult second = new KMeansClusterer(3, true, 7L, 4, 100).compute(grid).orElseThrow();
        assertArrayEquals(first.assignments().toArray(), second.assignments().toArray());
        assertEquals(first.inertia(), second.inertia());
    }

    @Test
    public void testInvalidCellsUnassigned() {
        Grid grid = TestGrids.withHoles(TestGrids.twoHalves(4, 4, 0.2, 0.6), 0, 15);
        KMeansClusterer.KMeansResult result = new KMeansClusterer(2, false).compute(grid).orElseThrow();
        assertEquals(14, result.validCount());
        assertFalse(result.assignments().isAssigned(0, 0));
        assertFalse(result.assignments().isAssigned(3, 3));
        assertEquals(LabelGrid.UNASSIGNED, result.assignments().get(0, 0));
        assertTrue(Double.isNaN(result.assignments().toGrid().get(3, 3)));
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.1, 0.3, 0.7, 0.5})
    public void testConstantGridLeavesEmptyClustersLast(double value) {
        KMeansClusterer.KMeansResult result = new KMeansClusterer(3, false, 42L, 2, 20)
            .compute(Grid.filled("flat", 4, 4, value)).orElseThrow();
        assertEquals(16, result.clusters().get(0).pixelCount());
        assertEquals(value, result.clusters().get(0).mean().getAsDouble());
        assertEquals(0.0, result.clusters().get(0).std().getAsDouble());
        assertTrue(result.clusters().get(1).isEmpty());
        assertTrue(result.clusters().get(2).isEmpty());
        assertTrue(result.clusters().get(2).mean().isEmpty());
        assertEquals("ClusterStats{id=2, empty}", result.clusters().get(2).toString());
    }

    @Test
    public void testTooFewCellsNoResult() {
        KMeansClusterer kmeans = new KMeansClusterer(5, true);
        assertTrue(kmeans.compute(TestGrids.sequence("small", 2, 2, 0)).isEmpty());
        assertTrue(kmeans.compute(TestGrids.allInvalid(4, 4)).isEmpty());
        assertTrue(new KMeansClusterer(1, false).compute(TestGrids.singleValid(3, 3, 0, 0.5)).isPresent());
    }

    @Test
    public void testArguments() {
        KMeansClusterer kmeans = new KMeansClusterer();
        assertEquals("KMeans", kmeans.getMnemonic());
        assertEquals(5, kmeans.getK());
        assertEquals(42L, kmeans.getSeed());
        assertEquals(10, kmeans.getRestarts());
        assertEquals(300, kmeans.getMaxIterations());
        assertTrue(kmeans.isUsingCoordinates());
        assertEquals(0, kmeans.getDependencies().length);
        assertThrows(IllegalArgumentException.class, () -> new KMeansClusterer(0, true));
        assertThrows(IllegalArgumentException.class, () -> new KMeansClusterer(2, true, 1L, 0, 10));
        assertThrows(IllegalArgumentException.class, () -> new KMeansClusterer(2, true, 1L, 1, 0));
    }
}
