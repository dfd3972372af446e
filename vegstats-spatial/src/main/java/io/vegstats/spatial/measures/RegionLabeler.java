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

import io.vegstats.spatial.AbstractGridMeasure;
import io.vegstats.spatial.Grid;
import io.vegstats.spatial.GridMask;
import io.vegstats.spatial.LabelGrid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Connected-component labeling of boolean masks.
 *
 * Regions are found by flood fill from each unvisited {@code true} cell in row-major
 * order and numbered from 1 in discovery order. The numbering carries no meaning beyond
 * identity; compare regions by size and centroid.
 *
 * As a grid measure, the labeler consumes the {@code Hotspots} result and labels both
 * the hotspot and the coldspot mask.
 */
public class RegionLabeler extends AbstractGridMeasure<RegionLabeler.HotspotRegions> {

    /// Mnemonic under which this measure registers
    public static final String MNEMONIC = "Regions";

    private final Connectivity connectivity;
    private final HotspotDetector fallbackDetector;

    /// Creates a labeler.
    ///
    /// @param connectivity the adjacency used to join cells
    /// @param fallbackDetector detector used when no `Hotspots` result is supplied
    public RegionLabeler(Connectivity connectivity, HotspotDetector fallbackDetector) {
        if (connectivity == null) {
            throw new IllegalArgumentException("Connectivity must not be null");
        }
        this.connectivity = connectivity;
        this.fallbackDetector = fallbackDetector != null ? fallbackDetector : new HotspotDetector();
    }

    /// Creates a labeler with the given adjacency and a default hotspot detector.
    ///
    /// @param connectivity the adjacency used to join cells
    public RegionLabeler(Connectivity connectivity) {
        this(connectivity, new HotspotDetector());
    }

    /// Creates an 8-connected labeler.
    public RegionLabeler() {
        this(Connectivity.EIGHT);
    }

    @Override
    public String getMnemonic() {
        return MNEMONIC;
    }

    @Override
    public String[] getDependencies() {
        return new String[]{HotspotDetector.MNEMONIC};
    }

    @Override
    protected Class<HotspotRegions> getResultClass() {
        return HotspotRegions.class;
    }

    /// @return the adjacency used to join cells
    public Connectivity getConnectivity() {
        return connectivity;
    }

    @Override
    protected Optional<HotspotRegions> computeImpl(Grid grid, Map<String, Object> dependencyResults) {
        Optional<HotspotDetector.HotspotResult> hotspots =
            dependency(dependencyResults, HotspotDetector.MNEMONIC, HotspotDetector.HotspotResult.class)
                .or(() -> fallbackDetector.compute(grid));
        return hotspots.map(h -> new HotspotRegions(label(h.hotspots()), label(h.coldspots())));
    }

    /// Labels the connected regions of a mask with this labeler's connectivity.
    ///
    /// @param mask the mask to label
    /// @return the labeling
    public Labeling label(GridMask mask) {
        return label(mask, connectivity);
    }

    /// Labels the connected regions of a mask.
    ///
    /// @param mask the mask to label
    /// @param connectivity the adjacency used to join cells
    /// @return the labeling; a mask without set cells yields zero regions
    public static Labeling label(GridMask mask, Connectivity connectivity) {
        int rows = mask.rows();
        int cols = mask.cols();
        int[] labels = new int[rows * cols];
        int[] stack = new int[rows * cols];
        int[][] offsets = connectivity.offsets();

        List<Integer> sizes = new ArrayList<>();
        List<Centroid> centroids = new ArrayList<>();
        int next = 0;

        for (int seed = 0; seed < labels.length; seed++) {
            if (!mask.get(seed) || labels[seed] != LabelGrid.NO_REGION) {
                continue;
            }
            int label = ++next;
            int top = 0;
            stack[top++] = seed;
            labels[seed] = label;

            int area = 0;
            long sumRow = 0;
            long sumCol = 0;

            while (top > 0) {
                int p = stack[--top];
                int r = p / cols;
                int c = p % cols;
                area++;
                sumRow += r;
                sumCol += c;

                for (int[] off : offsets) {
                    int nr = r + off[0];
                    int nc = c + off[1];
                    if (nr < 0 || nr >= rows || nc < 0 || nc >= cols) {
                        continue;
                    }
                    int q = nr * cols + nc;
                    if (mask.get(q) && labels[q] == LabelGrid.NO_REGION) {
                        labels[q] = label;
                        stack[top++] = q;
                    }
                }
            }
            sizes.add(area);
            centroids.add(new Centroid((double) sumRow / area, (double) sumCol / area));
        }

        return new Labeling(
            LabelGrid.of(rows, cols, labels, LabelGrid.NO_REGION),
            next,
            Collections.unmodifiableList(sizes),
            Collections.unmodifiableList(centroids),
            connectivity);
    }

    /// Summarizes grid values inside each labeled region.
    ///
    /// @param grid the values to summarize
    /// @param labels a label grid of the same shape
    /// @return summaries keyed by label in ascending order; unassigned cells are skipped
    public static Map<Integer, GridStatistics.Summary> regionStatistics(Grid grid, LabelGrid labels) {
        if (grid.rows() != labels.rows() || grid.cols() != labels.cols()) {
            throw new IllegalArgumentException("Grid " + grid.rows() + "x" + grid.cols()
                + " and labels " + labels.rows() + "x" + labels.cols() + " differ in shape");
        }
        Map<Integer, List<Double>> byLabel = new TreeMap<>();
        for (int i = 0; i < grid.size(); i++) {
            int label = labels.get(i);
            if (label == labels.unassignedLabel()) {
                continue;
            }
            List<Double> bucket = byLabel.computeIfAbsent(label, l -> new ArrayList<>());
            if (grid.isValid(i)) {
                bucket.add(grid.get(i));
            }
        }
        Map<Integer, GridStatistics.Summary> out = new LinkedHashMap<>();
        byLabel.forEach((label, bucket) ->
            out.put(label, GridStatistics.summarize(bucket.stream().mapToDouble(Double::doubleValue).toArray())));
        return out;
    }

    /// Center of mass of a region, in fractional row and column indices.
    ///
    /// @param row mean row index of the region's cells
    /// @param col mean column index of the region's cells
    public record Centroid(double row, double col) {
    }

    /// Connected regions of one mask.
    ///
    /// @param labels label map, `0` outside the mask
    /// @param regionCount number of regions
    /// @param sizes cell count per region, index `i` for label `i + 1`
    /// @param centroids centroid per region, index `i` for label `i + 1`
    /// @param connectivity adjacency used
    public record Labeling(
        LabelGrid labels,
        int regionCount,
        List<Integer> sizes,
        List<Centroid> centroids,
        Connectivity connectivity
    ) {
        /// @return total number of labeled cells
        public int labeledCells() {
            int total = 0;
            for (int s : sizes) {
                total += s;
            }
            return total;
        }

        /// @return mean region size, empty when there are no regions
        public OptionalDouble meanSize() {
            return regionCount == 0 ? OptionalDouble.empty() : OptionalDouble.of((double) labeledCells() / regionCount);
        }

        /// @return size of the largest region, empty when there are no regions
        public OptionalInt largestSize() {
            return sizes.stream().mapToInt(Integer::intValue).max();
        }

        /// @return size of the smallest region, empty when there are no regions
        public OptionalInt smallestSize() {
            return sizes.stream().mapToInt(Integer::intValue).min();
        }

        @Override
        public String toString() {
            return String.format("Labeling{regions=%d, cells=%d, connectivity=%s}", regionCount, labeledCells(), connectivity);
        }
    }

    /// Regions of the hotspot and coldspot masks of one grid.
    ///
    /// @param hotspotRegions connected hotspot regions
    /// @param coldspotRegions connected coldspot regions
    public record HotspotRegions(Labeling hotspotRegions, Labeling coldspotRegions) {
    }
}
