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

package io.vegstats.spatial.model;

/// Standard normal CDF and two-tailed p-values, used by the significance tests.
///
/// # Mathematical Definition
///
/// ```text
///                    1      x
///   Φ(x) = ─────── ∫   e^(-t²/2) dt  =  ½[1 + erf(x/√2)]
///          √(2π)   -∞
///
///   Two-tailed p-value of a z statistic:
///     p = 2 · (1 − Φ(|z|))
///
///   Reference points:
///     Φ(0)    = 0.5
///     Φ(1.96) ≈ 0.9750   →  p ≈ 0.05
///     Φ(2.576)≈ 0.9950   →  p ≈ 0.01
/// ```
///
/// @see io.vegstats.spatial.measures.MoranAutocorrelation
public final class GaussianCDF {

    private GaussianCDF() {
        // Utility class
    }

    /// Computes the standard normal CDF Φ(x) = P(X ≤ x) for X ~ N(0,1).
    ///
    /// @param x the value at which to evaluate the CDF
    /// @return the probability P(X ≤ x) for standard normal X
    public static double standardNormalCDF(double x) {
        return 0.5 * (1.0 + erf(x / Math.sqrt(2.0)));
    }

    /// Computes the two-tailed p-value of a standard normal test statistic.
    ///
    /// @param z the test statistic
    /// @return `2 · (1 − Φ(|z|))`, in `[0, 1]`
    public static double twoTailedPValue(double z) {
        double p = 2.0 * (1.0 - standardNormalCDF(Math.abs(z)));
        return Math.max(0.0, Math.min(1.0, p));
    }

    /// Error function approximation using Horner's method.
    ///
    /// Uses the Abramowitz and Stegun approximation (7.1.26) which provides
    /// accuracy to approximately 1.5 × 10⁻⁷.
    ///
    /// @param x the argument
    /// @return erf(x)
    private static double erf(double x) {
        // Abramowitz and Stegun 7.1.26, |error| < 1.5e-7
        double sign = x < 0 ? -1.0 : 1.0;
        x = Math.abs(x);

        double a1 = 0.254829592;
        double a2 = -0.284496736;
        double a3 = 1.421413741;
        double a4 = -1.453152027;
        double a5 = 1.061405429;
        double p = 0.3275911;

        double t = 1.0 / (1.0 + p * x);
        double poly = t * (a1 + t * (a2 + t * (a3 + t * (a4 + t * a5))));

        return sign * (1.0 - poly * Math.exp(-x * x));
    }
}
