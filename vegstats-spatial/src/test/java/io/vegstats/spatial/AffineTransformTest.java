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

import io.vegstats.spatial.measures.RegionLabeler;
import io.vegstats.spatial.measures.Connectivity;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class AffineTransformTest {

    @Test
    public void testIdentity() {
        assertArrayEquals(new double[]{3.0, 2.0}, AffineTransform.IDENTITY.apply(2, 3), 1e-12);
    }

    @Test
    public void testNorthUp() {
        AffineTransform t = AffineTransform.northUp(500_000, 4_200_000, 10, 10);
        assertArrayEquals(new double[]{500_000, 4_200_000}, t.apply(0, 0), 1e-9);
        assertArrayEquals(new double[]{500_030, 4_199_980}, t.apply(2, 3), 1e-9);
        assertArrayEquals(new double[]{500_005, 4_199_995}, t.cellCenter(0, 0), 1e-9);
    }

    @Test
    public void testMapsRegionCentroid() {
        GridMask mask = GridMask.of(new boolean[][]{
            {false, false, false},
            {false, true, true},
            {false, true, true}
        });
        RegionLabeler.Centroid centroid = RegionLabeler.label(mask, Connectivity.FOUR).centroids().get(0);
        AffineTransform t = AffineTransform.northUp(100, 200, 2, 2);
        double[] xy = t.apply(centroid.row() + 0.5, centroid.col() + 0.5);
        assertArrayEquals(new double[]{104.0, 196.0}, xy, 1e-12);
    }

    @Test
    public void testRotationTerms() {
        AffineTransform t = new AffineTransform(1, 2, 0, 3, 4, 0);
        assertArrayEquals(new double[]{1 * 5 + 2 * 7, 3 * 5 + 4 * 7}, t.apply(7, 5), 1e-12);
    }
}
