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

import io.vegstats.spatial.GridUtils;

import java.util.Locale;
import java.util.function.DoublePredicate;

/// Threshold policies for hotspot and coldspot classification.
///
/// Each constant turns the valid values of a grid, their summary and a threshold into a
/// [CellRule]. A value matching both predicates, possible only for percentile thresholds
/// above 50, is classified as hot.
///
/// | Policy | Hotspot | Coldspot | Threshold |
/// |--------|---------|----------|-----------|
/// | ZSCORE | `z > t` | `z < -t` | `t >= 0`, in standard deviations |
/// | PERCENTILE | `v > P(100 - t)` | `v < P(t)` | `0 <= t <= 100`, in percent |
/// | IQR | `v > Q3 + t·IQR` | `v < Q1 - t·IQR` | `t >= 0`, IQR multiples |
public enum HotspotMethod {

    /// Standardized value against the global mean and standard deviation
    ZSCORE {
        @Override
        CellRule rule(double[] values, GridStatistics.Summary summary, double threshold) {
            double mean = summary.mean().orElseThrow();
            double std = summary.std().orElseThrow();
            if (std <= 0) {
                return CellRule.NONE;
            }
            return new CellRule(
                v -> (v - mean) / std > threshold,
                v -> (v - mean) / std < -threshold);
        }
    },

    /// Raw value against the upper and lower tail percentiles
    PERCENTILE {
        @Override
        CellRule rule(double[] values, GridStatistics.Summary summary, double threshold) {
            GridUtils.Quantiles q = GridUtils.quantiles(values);
            double high = q.percentile(100.0 - threshold);
            double low = q.percentile(threshold);
            return new CellRule(v -> v > high, v -> v < low);
        }

        @Override
        public void validateThreshold(double threshold) {
            if (!(threshold >= 0.0 && threshold <= 100.0)) {
                throw new IllegalArgumentException(
                    "Percentile threshold must be within [0, 100], got " + threshold);
            }
        }
    },

    /// Raw value against the Tukey fences built from the interquartile range
    IQR {
        @Override
        CellRule rule(double[] values, GridStatistics.Summary summary, double threshold) {
            double q1 = summary.p25().orElseThrow();
            double q3 = summary.p75().orElseThrow();
            double iqr = q3 - q1;
            double upper = q3 + threshold * iqr;
            double lower = q1 - threshold * iqr;
            return new CellRule(v -> v > upper, v -> v < lower);
        }
    };

    /// Builds the classification rule for one grid.
    ///
    /// @param values the valid values of the grid, not empty
    /// @param summary statistics of the same values
    /// @param threshold the policy threshold, already validated
    /// @return the per-cell rule
    abstract CellRule rule(double[] values, GridStatistics.Summary summary, double threshold);

    /// @param threshold a candidate threshold
    /// @throws IllegalArgumentException if the threshold is not usable with this policy
    public void validateThreshold(double threshold) {
        if (!(threshold >= 0.0) || Double.isInfinite(threshold)) {
            throw new IllegalArgumentException(
                name().toLowerCase(Locale.ROOT) + " threshold must be finite and non-negative, got " + threshold);
        }
    }

    /// Parses a policy name, case-insensitively. Accepts `zscore`, `z-score`, `percentile`
    /// and `iqr`.
    ///
    /// @param name the policy name
    /// @return the policy
    /// @throws IllegalArgumentException if the name is not recognized
    public static HotspotMethod fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Hotspot method name must not be null");
        }
        String key = name.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
        switch (key) {
            case "zscore":
                return ZSCORE;
            case "percentile":
                return PERCENTILE;
            case "iqr":
                return IQR;
            default:
                throw new IllegalArgumentException("Unrecognized hotspot method '" + name
                    + "', expected one of zscore, percentile, iqr");
        }
    }

    /// Per-cell hot and cold predicates for valid values.
    record CellRule(DoublePredicate hot, DoublePredicate cold) {
        static final CellRule NONE = new CellRule(v -> false, v -> false);
    }
}
