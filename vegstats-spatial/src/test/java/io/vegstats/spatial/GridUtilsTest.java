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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class GridUtilsTest {

    private static final double[] ONE_TO_SIXTEEN = TestGrids.oneToSixteen().validValues();

    @Test
    public void testComputeStatistics() {
        GridUtils.Statistics stats = GridUtils.computeStatistics(ONE_TO_SIXTEEN);
        assertEquals(8.5, stats.mean, 1e-12);
        assertEquals(Math.sqrt(21.25), stats.stdDev, 1e-12);
        assertEquals(1.0, stats.min);
        assertEquals(16.0, stats.max);
        assertTrue(stats.toString().contains("mean=8.5000"));
    }

    @Test
    public void testLinearInterpolationPercentiles() {
        GridUtils.Quantiles q = GridUtils.quantiles(ONE_TO_SIXTEEN);
        assertEquals(1.0, q.percentile(0), 1e-12);
        assertEquals(1.75, q.percentile(5), 1e-12);
        assertEquals(4.75, q.percentile(25), 1e-12);
        assertEquals(8.5, q.percentile(50), 1e-12);
        assertEquals(12.25, q.percentile(75), 1e-12);
        assertEquals(15.25, q.percentile(95), 1e-12);
        assertEquals(16.0, q.percentile(100), 1e-12);
        assertEquals(8.5, GridUtils.median(ONE_TO_SIXTEEN), 1e-12);
    }

    @Test
    public void testPercentileArgumentChecks() {
        assertThrows(IllegalArgumentException.class, () -> GridUtils.percentile(ONE_TO_SIXTEEN, -1));
        assertThrows(IllegalArgumentException.class, () -> GridUtils.percentile(ONE_TO_SIXTEEN, 100.5));
        assertThrows(IllegalArgumentException.class, () -> GridUtils.quantiles(new double[0]));
    }

    @Test
    public void testStandardizeColumns() {
        double[][] features = {
            {1, 5},
            {2, 5},
            {3, 5}
        };
        double[][] z = GridUtils.standardizeColumns(features);
        double scale = Math.sqrt(2.0 / 3.0);
        assertEquals(-1 / scale, z[0][0], 1e-12);
        assertEquals(0.0, z[1][0], 1e-12);
        assertEquals(1 / scale, z[2][0], 1e-12);
        for (double[] row : z) {
            assertEquals(0.0, row[1], "a constant feature becomes zero");
        }
        assertEquals(1.0, features[0][0], "input must not be modified");
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.1, 0.3, 0.7, 0.5})
    public void testConstantValuesHaveExactlyZeroSpread(double value) {
        double[] values = new double[25];
        Arrays.fill(values, value);

        GridUtils.Statistics stats = GridUtils.computeStatistics(values);
        assertEquals(value, stats.mean);
        assertEquals(0.0, stats.stdDev);

        double[][] features = new double[25][];
        for (int i = 0; i < features.length; i++) {
            features[i] = new double[]{value, i};
        }
        double[][] z = GridUtils.standardizeColumns(features);
        for (double[] row : z) {
            assertEquals(0.0, row[0]);
        }
    }
}
