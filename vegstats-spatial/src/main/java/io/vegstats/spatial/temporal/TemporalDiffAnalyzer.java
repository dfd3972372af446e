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
import io.vegstats.spatial.GridMask;
import io.vegstats.spatial.GridUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/// # Localized Change Between Two Dates
///
/// Compares two time-aligned grids cell by cell.
///
/// ```text
///   diff = later − earlier            valid where both inputs are valid
///   t    = factor · std(diff)         population std over valid diff cells
///
///   increaseStrong : diff >  t
///   decreaseStrong : diff < −t
///   noChange       : |diff| ≤ t
/// ```
///
/// The three masks are disjoint and together cover exactly the cells valid in both grids.
/// With the default factor of 0.5, a cell changes "strongly" when it moves by more than half
/// a standard deviation of all changes.
public class TemporalDiffAnalyzer {

    private static final Logger logger = LogManager.getLogger(TemporalDiffAnalyzer.class);

    /// Default multiple of the difference standard deviation used as the change threshold
    public static final double DEFAULT_CHANGE_FACTOR = 0.5;

    private final double changeFactor;

    /// @param changeFactor multiple of the difference standard deviation, non-negative
    public TemporalDiffAnalyzer(double changeFactor) {
        if (!(changeFactor >= 0.0) || Double.isInfinite(changeFactor)) {
            throw new IllegalArgumentException("Change factor must be finite and non-negative, got " + changeFactor);
        }
        this.changeFactor = changeFactor;
    }

    /// Creates an analyzer with the default change factor of 0.5.
    public TemporalDiffAnalyzer() {
        this(DEFAULT_CHANGE_FACTOR);
    }

    /// @return multiple of the difference standard deviation used as the threshold
    public double getChangeFactor() {
        return changeFactor;
    }

    /// Computes and classifies the change from `earlier` to `later`.
    ///
    /// @param earlier the grid of the earlier date
    /// @param later the grid of the later date
    /// @return the classified difference, or empty if no cell is valid in both
    /// @throws IllegalArgumentException if the shapes differ
    public Optional<DiffResult> diff(Grid earlier, Grid later) {
        requireSameShape(earlier, later);
        int rows = earlier.rows();
        int cols = earlier.cols();
        int size = earlier.size();

        double[] diff = new double[size];
        for (int i = 0; i < size; i++) {
            diff[i] = earlier.isValid(i) && later.isValid(i) ? later.get(i) - earlier.get(i) : Double.NaN;
        }
        Grid difference = Grid.of(later.getId() + "-" + earlier.getId(), rows, cols, diff);
        if (!difference.hasValidCells()) {
            logger.debug("No common valid cells between {} and {}", earlier.getId(), later.getId());
            return Optional.empty();
        }

        double[] values = difference.validValues();
        GridUtils.Statistics stats = GridUtils.computeStatistics(values);
        double threshold = changeFactor * stats.stdDev;

        boolean[] up = new boolean[size];
        boolean[] down = new boolean[size];
        boolean[] flat = new boolean[size];
        int nUp = 0;
        int nDown = 0;
        int nFlat = 0;
        for (int i = 0; i < size; i++) {
            if (!difference.isValid(i)) {
                continue;
            }
            double d = difference.get(i);
            if (d > threshold) {
                up[i] = true;
                nUp++;
            } else if (d < -threshold) {
                down[i] = true;
                nDown++;
            } else {
                flat[i] = true;
                nFlat++;
            }
        }

        int n = values.length;
        logger.debug("Change {} -> {}: threshold={}, up={}, down={}, flat={}",
            earlier.getId(), later.getId(), threshold, nUp, nDown, nFlat);
        return Optional.of(new DiffResult(
            difference,
            GridMask.fromRowMajor(rows, cols, up),
            GridMask.fromRowMajor(rows, cols, down),
            GridMask.fromRowMajor(rows, cols, flat),
            n,
            nUp,
            nDown,
            nFlat,
            nUp * 100.0 / n,
            nDown * 100.0 / n,
            nFlat * 100.0 / n,
            stats.mean,
            GridUtils.median(values),
            stats.stdDev,
            stats.min,
            stats.max,
            threshold));
    }

    /// Rate of change per day.
    ///
    /// @param earlier the grid of the earlier date
    /// @param later the grid of the later date
    /// @param days days between the two dates
    /// @return `(later − earlier) / days`, NaN where either input is invalid; an all-zero
    ///     grid when `days == 0`
    /// @throws IllegalArgumentException if the shapes differ or `days` is not finite
    public static Grid velocity(Grid earlier, Grid later, double days) {
        requireSameShape(earlier, later);
        if (!Double.isFinite(days)) {
            throw new IllegalArgumentException("Days between dates must be finite, got " + days);
        }
        String id = later.getId() + "-" + earlier.getId() + "/day";
        if (days == 0) {
            return Grid.filled(id, earlier.rows(), earlier.cols(), 0.0);
        }
        double[] v = new double[earlier.size()];
        for (int i = 0; i < v.length; i++) {
            v[i] = earlier.isValid(i) && later.isValid(i) ? (later.get(i) - earlier.get(i)) / days : Double.NaN;
        }
        return Grid.of(id, earlier.rows(), earlier.cols(), v);
    }

    /// Compares the value distributions of two grids.
    ///
    /// @param earlier the grid of the earlier date
    /// @param later the grid of the later date
    /// @return the comparison, or empty if either grid has fewer than two valid cells
    public static Optional<DistributionComparison> compareDistributions(Grid earlier, Grid later) {
        return DistributionComparison.compare(earlier.validValues(), later.validValues());
    }

    private static void requireSameShape(Grid a, Grid b) {
        if (!a.sameShape(b)) {
            throw new IllegalArgumentException("Grids " + a.getId() + " (" + a.rows() + "x" + a.cols() + ") and "
                + b.getId() + " (" + b.rows() + "x" + b.cols() + ") differ in shape");
        }
    }

    /// Classified change between two grids.
    ///
    /// @param difference `later − earlier`, NaN where either input is invalid
    /// @param increaseStrong cells with `diff > threshold`
    /// @param decreaseStrong cells with `diff < -threshold`
    /// @param noChange cells with `|diff| <= threshold`
    /// @param validCount cells valid in both inputs
    /// @param increaseCount size of `increaseStrong`
    /// @param decreaseCount size of `decreaseStrong`
    /// @param noChangeCount size of `noChange`
    /// @param increasePercent `increaseCount` as a percentage of `validCount`
    /// @param decreasePercent `decreaseCount` as a percentage of `validCount`
    /// @param noChangePercent `noChangeCount` as a percentage of `validCount`
    /// @param mean mean difference
    /// @param median median difference
    /// @param std population standard deviation of the differences
    /// @param min smallest difference
    /// @param max largest difference
    /// @param threshold the change threshold used
    public record DiffResult(
        Grid difference,
        GridMask increaseStrong,
        GridMask decreaseStrong,
        GridMask noChange,
        int validCount,
        int increaseCount,
        int decreaseCount,
        int noChangeCount,
        double increasePercent,
        double decreasePercent,
        double noChangePercent,
        double mean,
        double median,
        double std,
        double min,
        double max,
        double threshold
    ) {
        @Override
        public String toString() {
            return String.format("DiffResult{mean=%.4f, std=%.4f, threshold=%.4f, up=%d (%.1f%%), down=%d (%.1f%%), flat=%d (%.1f%%)}",
                mean, std, threshold, increaseCount, increasePercent, decreaseCount, decreasePercent,
                noChangeCount, noChangePercent);
        }
    }
}
