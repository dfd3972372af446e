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

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/// # GridUtils
///
/// Low-level numeric helpers shared by the spatial measures.
///
/// ## Purpose
/// - **Statistics**: mean, population standard deviation, min and max of a value array
/// - **Quantiles**: linear-interpolation percentiles (R-7, the same estimator numpy uses)
/// - **Standardization**: per-column zero-mean, unit-variance scaling of feature matrices
///
/// ## Usage
/// ```java
/// GridUtils.Statistics stats = GridUtils.computeStatistics(grid.validValues());
/// double q3 = GridUtils.percentile(values, 75.0);
/// ```
public final class GridUtils {

    private GridUtils() {} // Utility class

    /// Computes basic statistics (mean, population std dev, min, max) for an array of values.
    /// An empty array yields all-zero statistics; callers check emptiness first where zero
    /// would be misleading. A constant array reports its value as the mean and a standard
    /// deviation of exactly zero, whatever the rounding of `sum / n`.
    ///
    /// @param values the values to analyze
    /// @return statistics object with computed measures
    public static Statistics computeStatistics(double[] values) {
        if (values.length == 0) {
            return new Statistics(0, 0, 0, 0);
        }

        double sum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;

        for (double value : values) {
            sum += value;
            if (value < min) min = value;
            if (value > max) max = value;
        }

        if (min == max) {
            return new Statistics(min, 0, min, max);
        }

        double mean = sum / values.length;

        double sumSquaredDeviations = 0;
        for (double value : values) {
            double deviation = value - mean;
            sumSquaredDeviations += deviation * deviation;
        }

        double stdDev = Math.sqrt(sumSquaredDeviations / values.length);

        return new Statistics(mean, stdDev, min, max);
    }

    /// Creates a percentile estimator over the given values using linear interpolation
    /// between closest ranks. The values are copied; reuse the estimator for several
    /// quantiles of the same data.
    ///
    /// @param values the values to rank (must not be empty)
    /// @return a quantile function over the values
    public static Quantiles quantiles(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot compute quantiles of an empty array");
        }
        return new Quantiles(values);
    }

    /// Computes one percentile of the given values.
    ///
    /// @param values the values to rank (must not be empty)
    /// @param p percentile in `[0, 100]`
    /// @return the interpolated percentile
    public static double percentile(double[] values, double p) {
        return quantiles(values).percentile(p);
    }

    /// Computes the median of the given values.
    ///
    /// @param values the values to rank (must not be empty)
    /// @return the median, averaging the two middle values for even lengths
    public static double median(double[] values) {
        return percentile(values, 50.0);
    }

    /// Standardizes each column of a feature matrix to zero mean and unit population variance.
    /// A column with zero variance becomes all zeros.
    ///
    /// @param features matrix indexed `[sample][feature]`; not modified
    /// @return a new standardized matrix
    public static double[][] standardizeColumns(double[][] features) {
        int n = features.length;
        if (n == 0) {
            return new double[0][];
        }
        int dim = features[0].length;
        double[][] out = new double[n][dim];
        double[] column = new double[n];
        for (int d = 0; d < dim; d++) {
            for (int i = 0; i < n; i++) {
                column[i] = features[i][d];
            }
            Statistics s = computeStatistics(column);
            for (int i = 0; i < n; i++) {
                out[i][d] = s.stdDev > 0 ? (column[i] - s.mean) / s.stdDev : 0.0;
            }
        }
        return out;
    }

    /// ## Quantiles
    ///
    /// Percentile function over a fixed sample. Percentile 0 is the sample minimum.
    /// Not thread-safe; create one per computation.
    public static final class Quantiles {
        private final Percentile estimator;
        private final double min;

        private Quantiles(double[] values) {
            this.estimator = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
            this.estimator.setData(values);
            double m = Double.POSITIVE_INFINITY;
            for (double v : values) {
                if (v < m) m = v;
            }
            this.min = m;
        }

        /// @param p percentile in `[0, 100]`
        /// @return the interpolated percentile
        /// @throws IllegalArgumentException if `p` is outside `[0, 100]`
        public double percentile(double p) {
            if (p < 0.0 || p > 100.0 || Double.isNaN(p)) {
                throw new IllegalArgumentException("Percentile must be in [0, 100], got " + p);
            }
            return p == 0.0 ? min : estimator.evaluate(p);
        }
    }

    /// ## Statistics
    ///
    /// Container for basic statistical measures of a numeric array.
    ///
    /// ### Fields
    /// - **mean**: Arithmetic mean of the values
    /// - **stdDev**: Population standard deviation
    /// - **min**: Minimum value
    /// - **max**: Maximum value
    public static class Statistics {
        /// Arithmetic mean of the values
        public final double mean;
        /// Population standard deviation
        public final double stdDev;
        /// Minimum value in the dataset
        public final double min;
        /// Maximum value in the dataset
        public final double max;

        /// Creates a new statistics summary.
        ///
        /// @param mean arithmetic mean
        /// @param stdDev standard deviation
        /// @param min minimum value
        /// @param max maximum value
        public Statistics(double mean, double stdDev, double min, double max) {
            this.mean = mean;
            this.stdDev = stdDev;
            this.min = min;
            this.max = max;
        }

        @Override
        public String toString() {
            return String.format("Statistics{mean=%.4f, stdDev=%.4f, min=%.4f, max=%.4f}",
                               mean, stdDev, min, max);
        }
    }
}
