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

package io.vegstats.spatial.filter;

import io.vegstats.spatial.Grid;
import io.vegstats.spatial.GridUtils;

/// # Gaussian Smoothing
///
/// Separable Gaussian blur that leaves the validity mask untouched.
///
/// ```text
/// 1. Fill invalid cells with the median of the valid cells
/// 2. Convolve rows, then columns, with a normalized 1D kernel
///      radius = floor(4σ + 0.5), w(x) ∝ exp(−x² / 2σ²)
///    Out-of-range taps mirror about the edge, repeating the edge cell:
///      … c b a | a b c … x y z | z y x …
/// 3. Put NaN back on the originally invalid cells
/// ```
///
/// A constant grid comes back unchanged. A grid without valid cells is returned as is.
public final class Smoother {

    private Smoother() {
    }

    /// Smooths a grid.
    ///
    /// @param grid the grid to smooth
    /// @param sigma kernel standard deviation in cells, positive
    /// @return a new grid with the same id and validity mask
    /// @throws IllegalArgumentException if `sigma` is not positive and finite
    public static Grid smooth(Grid grid, double sigma) {
        if (!(sigma > 0.0) || Double.isInfinite(sigma)) {
            throw new IllegalArgumentException("Smoothing sigma must be positive and finite, got " + sigma);
        }
        if (!grid.hasValidCells()) {
            return grid;
        }

        int rows = grid.rows();
        int cols = grid.cols();
        double fill = GridUtils.median(grid.validValues());
        double[] filled = grid.toRowMajor();
        for (int i = 0; i < filled.length; i++) {
            if (!grid.isValid(i)) {
                filled[i] = fill;
            }
        }

        double[] kernel = gaussianKernel(sigma);
        int radius = kernel.length / 2;

        double[] horizontal = new double[filled.length];
        for (int r = 0; r < rows; r++) {
            int base = r * cols;
            for (int c = 0; c < cols; c++) {
                double sum = 0.0;
                for (int k = -radius; k <= radius; k++) {
                    sum += kernel[k + radius] * filled[base + reflect(c + k, cols)];
                }
                horizontal[base + c] = sum;
            }
        }

        double[] out = new double[filled.length];
        for (int c = 0; c < cols; c++) {
            for (int r = 0; r < rows; r++) {
                double sum = 0.0;
                for (int k = -radius; k <= radius; k++) {
                    sum += kernel[k + radius] * horizontal[reflect(r + k, rows) * cols + c];
                }
                out[r * cols + c] = grid.isValid(r, c) ? sum : Double.NaN;
            }
        }
        return Grid.of(grid.getId(), rows, cols, out);
    }

    /// Normalized Gaussian weights over `[-radius, radius]`.
    ///
    /// @param sigma standard deviation in cells
    /// @return `2 * radius + 1` weights summing to one
    static double[] gaussianKernel(double sigma) {
        int radius = (int) (4.0 * sigma + 0.5);
        double[] kernel = new double[2 * radius + 1];
        double sum = 0.0;
        for (int i = 0; i < kernel.length; i++) {
            double x = i - radius;
            kernel[i] = Math.exp(-(x * x) / (2 * sigma * sigma));
            sum += kernel[i];
        }
        for (int i = 0; i < kernel.length; i++) {
            kernel[i] /= sum;
        }
        return kernel;
    }

    /// Maps any index onto `[0, n)` by half-sample symmetric reflection, period `2n`.
    static int reflect(int i, int n) {
        int period = 2 * n;
        int m = i % period;
        if (m < 0) {
            m += period;
        }
        return m < n ? m : period - 1 - m;
    }
}
