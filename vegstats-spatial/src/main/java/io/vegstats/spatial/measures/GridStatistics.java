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
import io.vegstats.spatial.GridUtils;

import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Descriptive statistics over the valid cells of a grid.
 *
 * Reports location, spread and percentiles, plus distribution shape and a
 * heterogeneity class derived from the coefficient of variation. Percentiles use
 * linear interpolation between closest ranks and the standard deviation is the
 * population one.
 *
 * A grid without valid cells yields a summary with {@code n = 0} and every other
 * field unavailable. Fields that are undefined for the data at hand (for example the
 * coefficient of variation when the mean is zero) are empty rather than zero.
 */
public class GridStatistics extends AbstractGridMeasure<GridStatistics.Summary> {

    /// Mnemonic under which this measure registers
    public static final String MNEMONIC = "Stats";

    @Override
    public String getMnemonic() {
        return MNEMONIC;
    }

    @Override
    public String[] getDependencies() {
        return new String[0];
    }

    @Override
    protected Class<Summary> getResultClass() {
        return Summary.class;
    }

    @Override
    protected Optional<Summary> computeImpl(Grid grid, Map<String, Object> dependencyResults) {
        return Optional.of(summarize(grid.validValues()));
    }

    /// Summarizes the valid cells of a grid. Never fails.
    ///
    /// @param grid the grid to summarize
    /// @return the summary, with `n = 0` when the grid has no valid cells
    public static Summary of(Grid grid) {
        return summarize(grid.validValues());
    }

    /// Summarizes an array of values. Non-finite entries are ignored.
    ///
    /// @param values the values to summarize
    /// @return the summary, with `n = 0` when no finite value is present
    public static Summary summarize(double[] values) {
        double[] data = finiteOnly(values);
        int n = data.length;
        if (n == 0) {
            return Summary.EMPTY;
        }

        GridUtils.Statistics basic = GridUtils.computeStatistics(data);
        GridUtils.Quantiles q = GridUtils.quantiles(data);
        double median = q.percentile(50);
        double p25 = q.percentile(25);
        double p75 = q.percentile(75);

        double std = basic.stdDev;
        OptionalDouble cv = basic.mean != 0 ? OptionalDouble.of(std / basic.mean) : OptionalDouble.empty();

        return new Summary(
            n,
            OptionalDouble.of(basic.mean),
            OptionalDouble.of(median),
            OptionalDouble.of(std),
            OptionalDouble.of(basic.min),
            OptionalDouble.of(basic.max),
            OptionalDouble.of(basic.max - basic.min),
            cv,
            OptionalDouble.of(q.percentile(5)),
            OptionalDouble.of(p25),
            OptionalDouble.of(p75),
            OptionalDouble.of(q.percentile(95)),
            computeShape(data, basic, median, p75 - p25)
        );
    }

    private static Shape computeShape(double[] data, GridUtils.Statistics basic, double median, double iqr) {
        int n = data.length;
        double m2 = 0;
        double m3 = 0;
        double m4 = 0;
        double[] absDev = new double[n];
        for (int i = 0; i < n; i++) {
            double d = data[i] - basic.mean;
            double d2 = d * d;
            m2 += d2;
            m3 += d2 * d;
            m4 += d2 * d2;
            absDev[i] = Math.abs(data[i] - median);
        }
        m2 /= n;
        m3 /= n;
        m4 /= n;

        OptionalDouble skewness = OptionalDouble.empty();
        OptionalDouble kurtosis = OptionalDouble.empty();
        if (basic.stdDev > 0 && m2 > 0) {
            skewness = OptionalDouble.of(m3 / Math.pow(m2, 1.5));
            kurtosis = OptionalDouble.of(m4 / (m2 * m2) - 3.0);
        }

        OptionalDouble cvPercent = basic.mean != 0
            ? OptionalDouble.of(basic.stdDev / Math.abs(basic.mean) * 100.0)
            : OptionalDouble.empty();
        OptionalDouble normalizedIqr = median != 0 ? OptionalDouble.of(iqr / median) : OptionalDouble.empty();

        return new Shape(
            OptionalDouble.of(m2),
            OptionalDouble.of(iqr),
            normalizedIqr,
            OptionalDouble.of(GridUtils.median(absDev)),
            skewness,
            kurtosis,
            cvPercent,
            Heterogeneity.classify(cvPercent)
        );
    }

    private static double[] finiteOnly(double[] values) {
        int n = 0;
        for (double v : values) {
            if (Double.isFinite(v)) n++;
        }
        if (n == values.length) {
            return values;
        }
        double[] out = new double[n];
        int i = 0;
        for (double v : values) {
            if (Double.isFinite(v)) out[i++] = v;
        }
        return out;
    }

    /// Descriptive statistics of the valid cells.
    ///
    /// @param n number of valid cells
    /// @param mean arithmetic mean
    /// @param median median
    /// @param std population standard deviation
    /// @param min minimum
    /// @param max maximum
    /// @param range `max - min`
    /// @param cv `std / mean`, unavailable when the mean is zero
    /// @param p05 5th percentile
    /// @param p25 25th percentile
    /// @param p75 75th percentile
    /// @param p95 95th percentile
    /// @param shape distribution shape and heterogeneity
    public record Summary(
        int n,
        OptionalDouble mean,
        OptionalDouble median,
        OptionalDouble std,
        OptionalDouble min,
        OptionalDouble max,
        OptionalDouble range,
        OptionalDouble cv,
        OptionalDouble p05,
        OptionalDouble p25,
        OptionalDouble p75,
        OptionalDouble p95,
        Shape shape
    ) {
        /// Summary of a grid without valid cells
        public static final Summary EMPTY = new Summary(0,
            OptionalDouble.empty(), OptionalDouble.empty(), OptionalDouble.empty(),
            OptionalDouble.empty(), OptionalDouble.empty(), OptionalDouble.empty(),
            OptionalDouble.empty(), OptionalDouble.empty(), OptionalDouble.empty(),
            OptionalDouble.empty(), OptionalDouble.empty(), Shape.EMPTY);

        /// @return true if no valid cell was summarized
        public boolean isEmpty() {
            return n == 0;
        }

        @Override
        public String toString() {
            if (n == 0) {
                return "Summary{n=0}";
            }
            return String.format("Summary{n=%d, mean=%.4f, median=%.4f, std=%.4f, min=%.4f, max=%.4f, cv=%s}",
                n, mean.getAsDouble(), median.getAsDouble(), std.getAsDouble(),
                min.getAsDouble(), max.getAsDouble(),
                cv.isPresent() ? String.format("%.4f", cv.getAsDouble()) : "n/a");
        }
    }

    /// Distribution shape of the valid cells.
    ///
    /// @param variance population variance
    /// @param iqr interquartile range `p75 - p25`
    /// @param normalizedIqr `iqr / median`, unavailable when the median is zero
    /// @param mad median absolute deviation from the median
    /// @param skewness biased moment skewness, unavailable for constant data
    /// @param kurtosis biased excess kurtosis, unavailable for constant data
    /// @param cvPercent `100 * std / |mean|`, unavailable when the mean is zero
    /// @param heterogeneity class derived from `cvPercent`
    public record Shape(
        OptionalDouble variance,
        OptionalDouble iqr,
        OptionalDouble normalizedIqr,
        OptionalDouble mad,
        OptionalDouble skewness,
        OptionalDouble kurtosis,
        OptionalDouble cvPercent,
        Heterogeneity heterogeneity
    ) {
        /// Shape of a grid without valid cells
        public static final Shape EMPTY = new Shape(
            OptionalDouble.empty(), OptionalDouble.empty(), OptionalDouble.empty(), OptionalDouble.empty(),
            OptionalDouble.empty(), OptionalDouble.empty(), OptionalDouble.empty(), Heterogeneity.UNKNOWN);
    }

    /// Spatial heterogeneity classes by coefficient of variation (percent).
    public enum Heterogeneity {
        /// cv below 10%
        HOMOGENEOUS,
        /// cv from 10% to below 20%
        MODERATELY_HETEROGENEOUS,
        /// cv from 20% to below 30%
        HETEROGENEOUS,
        /// cv of 30% or more
        VERY_HETEROGENEOUS,
        /// cv unavailable
        UNKNOWN;

        /// @param cvPercent coefficient of variation in percent
        /// @return the heterogeneity class
        public static Heterogeneity classify(OptionalDouble cvPercent) {
            if (cvPercent.isEmpty()) {
                return UNKNOWN;
            }
            double cv = cvPercent.getAsDouble();
            if (cv < 10) return HOMOGENEOUS;
            if (cv < 20) return MODERATELY_HETEROGENEOUS;
            if (cv < 30) return HETEROGENEOUS;
            return VERY_HETEROGENEOUS;
        }
    }
}
