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

package io.vegstats.spatial.measures;

import io.vegstats.spatial.Grid;
import io.vegstats.spatial.TestGrids;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class MoranAutocorrelationTest {

    @Test
    public void testCheckerboardRookIsPerfectlyDispersed() {
        MoranAutocorrelation.MoranResult result = new MoranAutocorrelation(Neighborhood.ROOK)
            .compute(TestGrids.checkerboard3x3()).orElseThrow();

        assertEquals(-1.0, result.moranI(), 1e-12);
        assertEquals(-0.125, result.expectedI(), 1e-12);
        assertEquals(9, result.validCells());
        assertEquals(24, result.neighborPairs());
        assertThat(result.zScore()).isCloseTo(-0.875 / Math.sqrt(0.125), within(1e-12));
        assertThat(result.pValue()).isCloseTo(0.0133, within(1e-3));
        assertTrue(result.significant());
        assertEquals(MoranAutocorrelation.AutocorrelationPattern.DISPERSED, result.pattern());
        assertEquals(Neighborhood.ROOK, result.neighborhood());
    }

    @Test
    public void testCheckerboardQueenCountsDiagonals() {
        MoranAutocorrelation.MoranResult result = new MoranAutocorrelation(Neighborhood.QUEEN)
            .compute(TestGrids.checkerboard3x3()).orElseThrow();
        // diagonal pairs join like values, pulling I toward zero
        assertEquals(40, result.neighborPairs());
        assertEquals(9.0 / 40.0 * (-152.0 / 180.0), result.moranI(), 1e-12);
    }

    @Test
    public void testRampIsClustered() {
        MoranAutocorrelation.MoranResult result = new MoranAutocorrelation()
            .compute(TestGrids.columnRamp(10, 10)).orElseThrow();
        assertTrue(result.moranI() > 0.5);
        assertTrue(result.pValue() < 0.001);
        assertEquals(MoranAutocorrelation.AutocorrelationPattern.CLUSTERED, result.pattern());
    }

    @Test
    public void testInvalidCellsAreNotNeighbors() {
        Grid full = TestGrids.columnRamp(6, 6);
        Grid holed = TestGrids.withHoles(full, 7, 14, 21);
        MoranAutocorrelation moran = new MoranAutocorrelation(Neighborhood.ROOK);

        MoranAutocorrelation.MoranResult result = moran.compute(holed).orElseThrow();
        assertEquals(33, result.validCells());
        assertTrue(result.neighborPairs() < moran.compute(full).orElseThrow().neighborPairs());
    }

    @Test
    public void testDegenerateGridsHaveNoResult() {
        MoranAutocorrelation moran = new MoranAutocorrelation();
        assertTrue(moran.compute(TestGrids.allInvalid(4, 4)).isEmpty());
        assertTrue(moran.compute(TestGrids.singleValid(4, 4, 5, 1.0)).isEmpty());
        assertTrue(moran.compute(Grid.filled("flat", 4, 4, 0.5)).isEmpty());

        double nan = Double.NaN;
        Grid isolated = Grid.of("isolated", new double[][]{
            {1, nan, 2},
            {nan, nan, nan}
        });
        assertTrue(moran.compute(isolated).isEmpty());
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.1, 0.3, 0.7, 0.5})
    public void testConstantSurfaceHasNoResult(double value) {
        for (Neighborhood neighborhood : Neighborhood.values()) {
            MoranAutocorrelation moran = new MoranAutocorrelation(neighborhood);
            assertTrue(moran.compute(Grid.filled("flat", 5, 5, value)).isEmpty(), neighborhood.name());
            assertTrue(moran.compute(TestGrids.withHoles(Grid.filled("flat", 6, 4, value), 0, 11)).isEmpty(),
                neighborhood.name());
        }
    }

    @Test
    public void testRandomNoiseIsNotSignificantlyPatterned() {
        MoranAutocorrelation.MoranResult result = new MoranAutocorrelation(Neighborhood.QUEEN, 0.01)
            .compute(TestGrids.noise("noise", 20, 20, 0.4, 0.1, 3L)).orElseThrow();
        assertThat(Math.abs(result.moranI() - result.expectedI())).isLessThan(0.1);
    }

    @Test
    public void testArguments() {
        MoranAutocorrelation moran = new MoranAutocorrelation();
        assertEquals("Moran", moran.getMnemonic());
        assertEquals(Neighborhood.QUEEN, moran.getNeighborhood());
        assertEquals(0.05, moran.getAlpha());
        assertThrows(IllegalArgumentException.class, () -> new MoranAutocorrelation(Neighborhood.ROOK, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new MoranAutocorrelation(Neighborhood.ROOK, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new MoranAutocorrelation(null, 0.05));
        assertEquals(Neighborhood.ROOK, Neighborhood.fromName("rook"));
        assertThrows(IllegalArgumentException.class, () -> Neighborhood.fromName("bishop"));
    }
}
