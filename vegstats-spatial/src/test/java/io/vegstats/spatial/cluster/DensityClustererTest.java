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

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class DensityClustererTest {

    @Test
    public void testTwoDenseValueGroups() {
        DensityClusterer.DensityResult result = new DensityClusterer(0.5, 5, false)
            .compute(TestGrids.twoHalves(6, 6, 0, 10)).orElseThrow();

        assertEquals(2, result.clusterCount());
        assertEquals(0, result.noiseCount());
        assertEquals(0.0, result.noisePercent());
        assertEquals(36, result.validCount());
        // discovery starts at the upper-left cell, which belongs to the low half
        assertEquals(0, result.assignments().get(0, 0));
        assertEquals(1, result.assignments().get(0, 5));
        assertEquals(0.0, result.clusters().get(0).mean().getAsDouble(), 1e-12);
        assertEquals(10.0, result.clusters().get(1).mean().getAsDouble(), 1e-12);
        assertEquals(18, result.clusters().get(1).pixelCount());
    }

    @Test
    public void testIsolatedValueIsNoise() {
        double[] values = TestGrids.twoHalves(6, 6, 0, 10).toRowMajor();
        values[35] = 5;
        Grid grid = Grid.of("outlier", 6, 6, values);

        DensityClusterer.DensityResult result = new DensityClusterer(0.5, 5, false).compute(grid).orElseThrow();
        assertEquals(2, result.clusterCount());
        assertEquals(1, result.noiseCount());
        assertEquals(100.0 / 36, result.noisePercent(), 1e-12);
        assertEquals(DensityClusterer.NOISE, result.assignments().get(5, 5));
        assertEquals(17, result.clusters().get(1).pixelCount());
    }

    @Test
    public void testMinSamplesCountsThePointItself() {
        // two identical cells form a cluster only when minSamples allows a pair
        Grid pair = Grid.of("pair", new double[][]{{1, 1, 50}});
        DensityClusterer.DensityResult loose = new DensityClusterer(0.5, 2, false).compute(pair).orElseThrow();
        assertEquals(1, loose.clusterCount());
        assertEquals(1, loose.noiseCount());

        DensityClusterer.DensityResult strict = new DensityClusterer(0.5, 3, false).compute(pair).orElseThrow();
        assertEquals(0, strict.clusterCount());
        assertEquals(3, strict.noiseCount());
        assertTrue(strict.clusters().isEmpty());
    }

    @Test
    public void testInvalidCellsUnassigned() {
        Grid grid = TestGrids.withHoles(TestGrids.twoHalves(6, 6, 0, 10), 7);
        DensityClusterer.DensityResult result = new DensityClusterer(0.5, 5, false).compute(grid).orElseThrow();
        assertEquals(35, result.validCount());
        assertEquals(LabelGrid.UNASSIGNED, result.assignments().get(1, 1));
    }

    @Test
    public void testTooFewCellsNoResult() {
        assertTrue(new DensityClusterer().compute(TestGrids.sequence("small", 3, 3, 0)).isEmpty());
        assertTrue(new DensityClusterer(0.5, 1, true).compute(TestGrids.allInvalid(2, 2)).isEmpty());
    }

    @Test
    public void testArguments() {
        DensityClusterer dbscan = new DensityClusterer();
        assertEquals("DBSCAN", dbscan.getMnemonic());
        assertEquals(0.5, dbscan.getEps());
        assertEquals(10, dbscan.getMinSamples());
        assertTrue(dbscan.isUsingCoordinates());
        assertThrows(IllegalArgumentException.class, () -> new DensityClusterer(0, 5, true));
        assertThrows(IllegalArgumentException.class, () -> new DensityClusterer(Double.POSITIVE_INFINITY, 5, true));
        assertThrows(IllegalArgumentException.class, () -> new DensityClusterer(0.5, 0, true));
    }
}
