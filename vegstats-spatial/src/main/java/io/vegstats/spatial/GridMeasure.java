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

import java.util.Map;
import java.util.Optional;

/// # GridMeasure Interface
///
/// Base interface for spatial analysis measures computed over a single [Grid].
///
/// ## Purpose
/// Defines the contract for all grid measures including:
/// - **Computation**: Core analysis algorithm implementation
/// - **Dependencies**: Dependency management between measures
/// - **Identification**: Unique mnemonics for measure registration
///
/// ## Lifecycle
/// 1. **Check Dependencies**: Ensure required measures are computed first
/// 2. **Compute**: Execute the analysis over the grid
/// 3. **Report**: Return the result, or empty when the grid cannot support the analysis
///
/// ## Implementation Guide
/// ```java
/// public class MyMeasure extends AbstractGridMeasure<MyResult> {
///     @Override
///     public String getMnemonic() { return "My"; }
///
///     @Override
///     public String[] getDependencies() { return new String[0]; }
///
///     @Override
///     protected Optional<MyResult> computeImpl(Grid grid, Map<String, Object> dependencies) {
///         // Your analysis logic here
///         return Optional.of(new MyResult(...));
///     }
/// }
/// ```
///
/// ## No-Result Convention
/// Grids routinely contain regions without a single valid cell. Empty input, too few
/// cells for an algorithm's minimum, and degenerate statistics (zero variance, no
/// neighbor pairs) are reported as [Optional#empty()], never thrown. Invalid arguments
/// are programming errors and are thrown as [IllegalArgumentException].
///
/// Implementations must be immutable so a single instance can serve concurrent analyses.
///
/// @param <T> the type of result produced by this measure
public interface GridMeasure<T> {

    /// Gets the mnemonic identifier for this measure.
    /// Must be unique across all measures registered with one analyzer.
    ///
    /// @return a short, unique identifier (e.g., "Stats", "Moran", "Hotspots")
    String getMnemonic();

    /// Gets the dependencies required for this measure.
    /// Dependencies are computed before this measure and their results
    /// are passed to the compute method.
    ///
    /// @return array of measure mnemonics this depends on (empty array if none)
    String[] getDependencies();

    /// Computes this measure for the given grid.
    ///
    /// @param grid the grid to analyze
    /// @param dependencyResults results from dependency measures (keyed by mnemonic);
    ///     a dependency that produced no result is absent from the map
    /// @return the computed result, or empty when the grid cannot support this analysis
    Optional<T> compute(Grid grid, Map<String, Object> dependencyResults);

    /// Computes this measure without precomputed dependencies.
    ///
    /// @param grid the grid to analyze
    /// @return the computed result, or empty when the grid cannot support this analysis
    default Optional<T> compute(Grid grid) {
        return compute(grid, Map.of());
    }
}
