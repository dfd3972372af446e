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

package io.vegstats.spatial.temporal;

import io.vegstats.spatial.Grid;
import io.vegstats.spatial.TestGrids;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class TemporalDiffAnalyzerTest {

    private static final Grid EARLIER = Grid.filled("june", 2, 2, 0.0);
    private static final Grid LATER = Grid.of("july", new double[][]{{1, -1}, {0, 0}});

    @Test
    public void testClassifiesAgainstHalfStd() {
        TemporalDiffAnalyzer.DiffResult result = new TemporalDiffAnalyzer().diff(EARLIER, LATER).orElseThrow();

        assertEquals(Math.sqrt(0.5) * 0.5, result.threshold(), 1e-12);
        assertEquals(1, result.increaseCount());
        assertEquals(1, result.decreaseCount());
        assertEquals(2, result.noChangeCount());
        assertTrue(result.increaseStrong().get(0, 0));
        assertTrue(result.decreaseStrong().get(0, 1));
        assertTrue(result.noChange().get(1, 0));
        assertEquals(25.0, result.increasePercent(), 1e-12);
        assertEquals(50.0, result.noChangePercent(), 1e-12);
        assertEquals(0.0, result.mean(), 1e-12);
        assertEquals(0.0, result.median(), 1e-12);
        assertEquals(-1.0, result.min());
        assertEquals(1.0, result.max());
        assertEquals("july-june", result.difference().getId());
    }

    @Test
    public void testCategoriesPartitionCommonValidCells() {
        Grid earlier = TestGrids.withHoles(TestGrids.noise("a", 10, 10, 0.4, 0.1, 1L), 3, 50);
        Grid later = TestGrids.withHoles(TestGrids.noise("b", 10, 10, 0.5, 0.1, 2L), 50, 77);
        TemporalDiffAnalyzer.DiffResult result = new TemporalDiffAnalyzer(1.0).diff(earlier, later).orElseThrow();

        assertEquals(97, result.validCount());
        assertEquals(97, result.increaseCount() + result.decreaseCount() + result.noChangeCount());
        assertEquals(97, result.increaseStrong().or(result.decreaseStrong()).or(result.noChange()).count());
        assertFalse(result.increaseStrong().intersects(result.decreaseStrong()));
        assertFalse(result.noChange().intersects(result.increaseStrong()));
        assertTrue(Double.isNaN(result.difference().get(7, 7)));
        assertEquals(100.0, result.increasePercent() + result.decreasePercent() + result.noChangePercent(), 1e-9);
    }

    @Test
    public void testIdenticalGridsHaveNoChange() {
        Grid grid = TestGrids.withHoles(TestGrids.noise("same", 6, 6, 0.5, 0.1, 12L), 4, 20);
        TemporalDiffAnalyzer.DiffResult result = new TemporalDiffAnalyzer().diff(grid, grid).orElseThrow();

        assertEquals(34, result.validCount());
        assertEquals(0, result.increaseCount());
        assertEquals(0, result.decreaseCount());
        assertEquals(34, result.noChangeCount());
        assertEquals(grid.validityMask().count(), result.noChange().and(grid.validityMask()).count());
        for (double d : result.difference().validValues()) {
            assertEquals(0.0, d);
        }
    }

    @Test
    public void testZeroFactorTreatsOnlyExactZeroAsNoChange() {
        TemporalDiffAnalyzer.DiffResult result = new TemporalDiffAnalyzer(0.0).diff(EARLIER, LATER).orElseThrow();
        assertEquals(0.0, result.threshold());
        assertEquals(2, result.noChangeCount());
    }

    @Test
    public void testNoCommonValidCells() {
        Grid left = TestGrids.singleValid(2, 2, 0, 1.0);
        Grid right = TestGrids.singleValid(2, 2, 3, 1.0);
        assertTrue(new TemporalDiffAnalyzer().diff(left, right).isEmpty());
    }

    @Test
    public void testShapeMismatchRejected() {
        Grid wide = Grid.filled("wide", 2, 3, 0.0);
        assertThatThrownBy(() -> new TemporalDiffAnalyzer().diff(EARLIER, wide))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("differ in shape");
        assertThrows(IllegalArgumentException.class, () -> TemporalDiffAnalyzer.velocity(EARLIER, wide, 10));
    }

    @Test
    public void testVelocity() {
        Grid later = TestGrids.withHoles(LATER, 3);
        Grid v = TemporalDiffAnalyzer.velocity(EARLIER, later, 4.0);
        assertEquals(0.25, v.get(0, 0), 1e-12);
        assertEquals(-0.25, v.get(0, 1), 1e-12);
        assertTrue(Double.isNaN(v.get(1, 1)));

        Grid sameDay = TemporalDiffAnalyzer.velocity(EARLIER, later, 0);
        assertEquals(4, sameDay.validCount());
        assertEquals(0.0, sameDay.get(0, 0));

        assertThrows(IllegalArgumentException.class, () -> TemporalDiffAnalyzer.velocity(EARLIER, LATER, Double.NaN));
    }

    @Test
    public void testCompareDistributionsUsesValidCells() {
        Grid earlier = TestGrids.sequence("a", 10, 10, 0);
        Grid later = TestGrids.sequence("b", 10, 10, 50);
        DistributionComparison comparison = TemporalDiffAnalyzer.compareDistributions(earlier, later).orElseThrow();
        assertEquals(50.0, comparison.meanDifference(), 1e-12);
        assertTrue(TemporalDiffAnalyzer.compareDistributions(earlier, TestGrids.singleValid(10, 10, 0, 1)).isEmpty());
    }

    @Test
    public void testFactorValidation() {
        assertEquals(0.5, new TemporalDiffAnalyzer().getChangeFactor());
        assertThrows(IllegalArgumentException.class, () -> new TemporalDiffAnalyzer(-0.1));
        assertThrows(IllegalArgumentException.class, () -> new TemporalDiffAnalyzer(Double.NaN));
    }
}
