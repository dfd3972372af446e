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

import org.apache.commons.math3.stat.inference.KolmogorovSmirnovTest;
import org.apache.commons.math3.stat.inference.MannWhitneyUTest;
import org.apache.commons.math3.stat.inference.TTest;
import org.apache.commons.math3.stat.ranking.NaNStrategy;
import org.apache.commons.math3.stat.ranking.NaturalRanking;
import org.apache.commons.math3.stat.ranking.TiesStrategy;

import java.util.Arrays;
import java.util.Optional;
import java.util.OptionalDouble;

/// Two-sample comparison of value distributions, typically the valid cells of one area on
/// two dates.
///
/// | Test | Statistic | Null hypothesis |
/// |------|-----------|-----------------|
/// | Kolmogorov–Smirnov | `D = max abs(F₁ − F₂)` | same distribution |
/// | Student t, pooled variance | `t = (m₁ − m₂) / s_p√(1/n₁ + 1/n₂)` | same mean |
/// | Mann–Whitney | `U₁ = R₁ − n₁(n₁+1)/2` | neither sample tends to be larger |
///
/// The samples are considered different when the Kolmogorov–Smirnov p-value is below 0.05.
/// The Mann–Whitney p-value is the two-sided normal approximation.
///
/// @param firstMean mean of the first sample
/// @param secondMean mean of the second sample
/// @param meanDifference `secondMean − firstMean`
/// @param percentDifference `100 · meanDifference / firstMean`, empty when `firstMean == 0`
/// @param ksStatistic Kolmogorov–Smirnov `D`
/// @param ksPValue Kolmogorov–Smirnov p-value
/// @param tStatistic Student t, empty when both samples are constant
/// @param tPValue Student t p-value, empty when the statistic is
/// @param mannWhitneyU U statistic of the first sample
/// @param mannWhitneyPValue Mann–Whitney p-value
/// @param different whether `ksPValue < 0.05`
public record DistributionComparison(
    double firstMean,
    double secondMean,
    double meanDifference,
    OptionalDouble percentDifference,
    double ksStatistic,
    double ksPValue,
    OptionalDouble tStatistic,
    OptionalDouble tPValue,
    double mannWhitneyU,
    double mannWhitneyPValue,
    boolean different
) {

    /// Significance level of the `different` flag
    public static final double SIGNIFICANCE = 0.05;

    /// Compares two samples. Non-finite entries are dropped.
    ///
    /// @param first the first sample
    /// @param second the second sample
    /// @return the comparison, or empty if either sample has fewer than two finite values
    public static Optional<DistributionComparison> compare(double[] first, double[] second) {
        double[] x = Arrays.stream(first).filter(Double::isFinite).toArray();
        double[] y = Arrays.stream(second).filter(Double::isFinite).toArray();
        if (x.length < 2 || y.length < 2) {
            return Optional.empty();
        }

        double m1 = Arrays.stream(x).average().orElseThrow();
        double m2 = Arrays.stream(y).average().orElseThrow();
        double delta = m2 - m1;

        KolmogorovSmirnovTest ks = new KolmogorovSmirnovTest();
        double d = ks.kolmogorovSmirnovStatistic(x, y);
        double ksP = ks.kolmogorovSmirnovTest(x, y);

        TTest tTest = new TTest();
        double t = tTest.homoscedasticT(x, y);
        OptionalDouble tStat = Double.isFinite(t) ? OptionalDouble.of(t) : OptionalDouble.empty();
        OptionalDouble tP = tStat.isPresent()
            ? OptionalDouble.of(tTest.homoscedasticTTest(x, y))
            : OptionalDouble.empty();

        double u1 = firstSampleU(x, y);
        double uP = new MannWhitneyUTest().mannWhitneyUTest(x, y);

        return Optional.of(new DistributionComparison(
            m1,
            m2,
            delta,
            m1 != 0 ? OptionalDouble.of(delta / m1 * 100.0) : OptionalDouble.empty(),
            d,
            ksP,
            tStat,
            tP,
            u1,
            uP,
            ksP < SIGNIFICANCE));
    }

    // commons reports max(U1, U2)
    private static double firstSampleU(double[] x, double[] y) {
        double[] pooled = new double[x.length + y.length];
        System.arraycopy(x, 0, pooled, 0, x.length);
        System.arraycopy(y, 0, pooled, x.length, y.length);
        double[] ranks = new NaturalRanking(NaNStrategy.FIXED, TiesStrategy.AVERAGE).rank(pooled);
        double r1 = 0;
        for (int i = 0; i < x.length; i++) {
            r1 += ranks[i];
        }
        return r1 - x.length * (x.length + 1) / 2.0;
    }
}
