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

import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Hotspot and coldspot detection: cells whose values are unusually high or low
 * relative to the whole grid under a chosen {@link HotspotMethod}.
 *
 * The measure computes:
 * - Hotspot mask: valid cells above the upper threshold
 * - Coldspot mask: valid cells below the lower threshold, disjoint from the hotspots
 * - Counts, percentages of valid cells, and mean value inside each mask
 *
 * Invalid cells are never flagged. A grid without valid cells yields no result.
 * When run by an analyzer, the {@code Stats} result is reused if available.
 */
public class HotspotDetector extends AbstractGridMeasure<HotspotDetector.HotspotResult> {

    /// Mnemonic under which this measure registers
    public static final String MNEMONIC = "Hotspots";

    /// Default policy
    public static final HotspotMethod DEFAULT_METHOD = HotspotMethod.ZSCORE;

    /// Default threshold, in standard deviations for the default policy
    public static final double DEFAULT_THRESHOLD = 1.5;

    private final HotspotMethod method;
    private final double threshold;

    /// Creates a detector with the given policy and threshold.
    ///
    /// @param method the threshold policy
    /// @param threshold the threshold, interpreted by the policy
    /// @throws IllegalArgumentException if the threshold is not usable with the policy
    public HotspotDetector(HotspotMethod method, double threshold) {
        if (method == null) {
            throw new IllegalArgumentException("Hotspot method must not be null");
        }
        method.validateThreshold(threshold);
        this.method = method;
        this.threshold = threshold;
    }

    /// Creates a detector from a policy name such as `zscore`, `percentile` or `iqr`.
    ///
    /// @param methodName the threshold policy name
    /// @param threshold the threshold, interpreted by the policy
    /// @throws IllegalArgumentException if the name is not recognized
    public HotspotDetector(String methodName, double threshold) {
        this(HotspotMethod.fromName(methodName), threshold);
    }

    /// Creates a z-score detector with a threshold of 1.5 standard deviations.
    public HotspotDetector() {
        this(DEFAULT_METHOD, DEFAULT_THRESHOLD);
    }

    @Override
    public String getMnemonic() {
        return MNEMONIC;
    }

    @Override
    public String[] getDependencies() {
        return new String[]{GridStatistics.MNEMONIC};
    }

    @Override
    protected Class<HotspotResult> getResultClass() {
        return HotspotResult.class;
    }

    /// @return the threshold policy
    public HotspotMethod getMethod() {
        return method;
    }

    /// @return the threshold
    public double getThreshold() {
        return threshold;
    }

    @Override
    protected Optional<HotspotResult> computeImpl(Grid grid, Map<String, Object> dependencyResults) {
        double[] values = grid.validValues();
        if (values.length == 0) {
            return Optional.empty();
        }
        GridStatistics.Summary summary = dependency(dependencyResults, GridStatistics.MNEMONIC, GridStatistics.Summary.class)
            .orElseGet(() -> GridStatistics.summarize(values));

        HotspotMethod.CellRule rule = method.rule(values, summary, threshold);

        int size = grid.size();
        boolean[] hot = new boolean[size];
        boolean[] cold = new boolean[size];
        int hotCount = 0;
        int coldCount = 0;
        double hotSum = 0;
        double coldSum = 0;
        for (int i = 0; i < size; i++) {
            if (!grid.isValid(i)) {
                continue;
            }
            double v = grid.get(i);
            if (rule.hot().test(v)) {
                hot[i] = true;
                hotCount++;
                hotSum += v;
            } else if (rule.cold().test(v)) {
                cold[i] = true;
                coldCount++;
                coldSum += v;
            }
        }

        int total = values.length;
        return Optional.of(new HotspotResult(
            GridMask.fromRowMajor(grid.rows(), grid.cols(), hot),
            GridMask.fromRowMajor(grid.rows(), grid.cols(), cold),
            hotCount,
            coldCount,
            total,
            hotCount * 100.0 / total,
            coldCount * 100.0 / total,
            hotCount > 0 ? OptionalDouble.of(hotSum / hotCount) : OptionalDouble.empty(),
            coldCount > 0 ? OptionalDouble.of(coldSum / coldCount) : OptionalDouble.empty(),
            method,
            threshold));
    }

    /// Result of hotspot detection.
    ///
    /// @param hotspots mask of hotspot cells
    /// @param coldspots mask of coldspot cells, disjoint from `hotspots`
    /// @param hotspotCount number of hotspot cells
    /// @param coldspotCount number of coldspot cells
    /// @param validCount number of valid cells in the grid
    /// @param hotspotPercent hotspots as a percentage of valid cells
    /// @param coldspotPercent coldspots as a percentage of valid cells
    /// @param hotspotMean mean value of hotspot cells, empty if there are none
    /// @param coldspotMean mean value of coldspot cells, empty if there are none
    /// @param method the policy used
    /// @param threshold the threshold used
    public record HotspotResult(
        GridMask hotspots,
        GridMask coldspots,
        int hotspotCount,
        int coldspotCount,
        int validCount,
        double hotspotPercent,
        double coldspotPercent,
        OptionalDouble hotspotMean,
        OptionalDouble coldspotMean,
        HotspotMethod method,
        double threshold
    ) {
        @Override
        public String toString() {
            return String.format("HotspotResult{method=%s, threshold=%.3f, hotspots=%d (%.1f%%), coldspots=%d (%.1f%%), valid=%d}",
                method, threshold, hotspotCount, hotspotPercent, coldspotCount, coldspotPercent, validCount);
        }
    }
}
