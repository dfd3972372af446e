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
import io.vegstats.spatial.model.GaussianCDF;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Optional;

/// # Global Moran's I
///
/// Measures whether similar values sit next to each other across the grid.
///
/// ## Mathematical Definition
///
/// ```text
///   d_i  = x_i − mean(x)                  over the N valid cells
///   W    = Σ_i Σ_j w_ij                   ordered neighbor pairs, both valid
///
///          N     Σ_i Σ_j w_ij · d_i · d_j
///   I  =  ─── · ─────────────────────────
///          W          Σ_i d_i²
///
///   E[I] = −1 / (N − 1)
///   Var  =  1 / (N − 1)
///   z    = (I − E[I]) / √Var
///   p    = 2 · (1 − Φ(|z|))
/// ```
///
/// The variance is the simplified approximation rather than the randomization variance,
/// which also depends on the kurtosis of the values. p-values are comparable across runs
/// of this measure but not with textbook implementations.
///
/// ## Interpretation
///
/// - `I > E[I]`, significant: similar values cluster ([AutocorrelationPattern#CLUSTERED])
/// - `I < E[I]`, significant: neighbors tend to differ ([AutocorrelationPattern#DISPERSED])
/// - otherwise: no detectable spatial structure ([AutocorrelationPattern#RANDOM])
///
/// No result is produced when there are no neighbor pairs or all valid values are equal.
public class MoranAutocorrelation extends AbstractGridMeasure<MoranAutocorrelation.MoranResult> {

    private static final Logger logger = LogManager.getLogger(MoranAutocorrelation.class);

    /// Mnemonic under which this measure registers
    public static final String MNEMONIC = "Moran";

    /// Default significance level
    public static final double DEFAULT_ALPHA = 0.05;

    private final Neighborhood neighborhood;
    private final double alpha;

    /// Creates the measure.
    ///
    /// @param neighborhood the contiguity weights
    /// @param alpha significance level in `(0, 1)`
    public MoranAutocorrelation(Neighborhood neighborhood, double alpha) {
        if (neighborhood == null) {
            throw new IllegalArgumentException("Neighborhood must not be null");
        }
        if (!(alpha > 0.0 && alpha < 1.0)) {
            throw new IllegalArgumentException("Significance level must be in (0, 1), got " + alpha);
        }
        this.neighborhood = neighborhood;
        this.alpha = alpha;
    }

    /// Creates the measure with the given weights at the 5% level.
    ///
    /// @param neighborhood the contiguity weights
    public MoranAutocorrelation(Neighborhood neighborhood) {
        this(neighborhood, DEFAULT_ALPHA);
    }

    /// Creates a queen-contiguity measure at the 5% level.
    public MoranAutocorrelation() {
        this(Neighborhood.QUEEN);
    }

    @Override
    public String getMnemonic() {
        return MNEMONIC;
    }

    @Override
    public String[] getDependencies() {
        return new String[0];
    }

    @Override
    protected Class<MoranResult> getResultClass() {
        return MoranResult.class;
    }

    /// @return the contiguity weights
    public Neighborhood getNeighborhood() {
        return neighborhood;
    }

    /// @return the significance level
    public double getAlpha() {
        return alpha;
    }

    @Override
    protected Optional<MoranResult> computeImpl(Grid grid, Map<String, Object> dependencyResults) {
        int rows = grid.rows();
        int cols = grid.cols();
        int n = grid.validCount();
        if (n < 2) {
            logger.debug("Moran's I skipped for {}: {} valid cells", grid.getId(), n);
            return Optional.empty();
        }

        GridUtils.Statistics stats = GridUtils.computeStatistics(grid.validValues());
        if (stats.stdDev == 0) {
            logger.debug("Moran's I undefined for {}: constant surface", grid.getId());
            return Optional.empty();
        }
        double mean = stats.mean;

        double numerator = 0;
        double denominator = 0;
        long pairs = 0;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                if (!grid.isValid(r, c)) {
                    continue;
                }
                double d = grid.get(r, c) - mean;
                denominator += d * d;
                for (int dr = -1; dr <= 1; dr++) {
                    for (int dc = -1; dc <= 1; dc++) {
                        if (!neighborhood.isNeighbor(dr, dc)) {
                            continue;
                        }
                        int nr = r + dr;
                        int nc = c + dc;
                        if (nr < 0 || nr >= rows || nc < 0 || nc >= cols || !grid.isValid(nr, nc)) {
                            continue;
                        }
                        numerator += d * (grid.get(nr, nc) - mean);
                        pairs++;
                    }
                }
            }
        }

        if (pairs == 0 || denominator == 0) {
            logger.debug("Moran's I undefined for {}: pairs={}, denominator={}", grid.getId(), pairs, denominator);
            return Optional.empty();
        }

        double moranI = ((double) n / pairs) * (numerator / denominator);
        double expectedI = -1.0 / (n - 1);
        double variance = 1.0 / (n - 1);
        double z = (moranI - expectedI) / Math.sqrt(variance);
        double p = GaussianCDF.twoTailedPValue(z);
        boolean significant = p < alpha;

        AutocorrelationPattern pattern = AutocorrelationPattern.RANDOM;
        if (significant) {
            if (moranI > expectedI) {
                pattern = AutocorrelationPattern.CLUSTERED;
            } else if (moranI < expectedI) {
                pattern = AutocorrelationPattern.DISPERSED;
            }
        }

        return Optional.of(new MoranResult(moranI, expectedI, z, p, n, pairs, significant, pattern, neighborhood));
    }

    /// Spatial arrangement implied by a Moran's I test.
    public enum AutocorrelationPattern {
        /// Similar values are adjacent more often than by chance
        CLUSTERED,
        /// Dissimilar values are adjacent more often than by chance
        DISPERSED,
        /// No significant departure from spatial randomness
        RANDOM
    }

    /// Result of a global Moran's I test.
    ///
    /// @param moranI the statistic
    /// @param expectedI its expectation under spatial randomness
    /// @param zScore standardized statistic
    /// @param pValue two-tailed p-value
    /// @param validCells number of valid cells `N`
    /// @param neighborPairs number of ordered neighbor pairs `W`
    /// @param significant whether `pValue` is below the significance level
    /// @param pattern the implied arrangement
    /// @param neighborhood the weights used
    public record MoranResult(
        double moranI,
        double expectedI,
        double zScore,
        double pValue,
        int validCells,
        long neighborPairs,
        boolean significant,
        AutocorrelationPattern pattern,
        Neighborhood neighborhood
    ) {
        @Override
        public String toString() {
            return String.format("MoranResult{I=%.4f, E[I]=%.4f, z=%.3f, p=%.4f, N=%d, W=%d, %s}",
                moranI, expectedI, zScore, pValue, validCells, neighborPairs, pattern);
        }
    }
}
