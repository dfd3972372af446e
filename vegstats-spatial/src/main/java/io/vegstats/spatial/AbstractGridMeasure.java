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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Optional;

/// # AbstractGridMeasure
///
/// Base implementation of [GridMeasure] that wraps each computation with argument
/// checks, timing and logging.
///
/// ## Features
/// - **Template Method**: Separates bookkeeping from computation logic
/// - **Logging**: Debug-level timing, and a debug line whenever a grid yields no result
/// - **Dependency Access**: Typed lookup of dependency results
/// - **Type Safety**: Results are checked against [#getResultClass()]
///
/// ## Implementation Pattern
/// ```java
/// public class MyMeasure extends AbstractGridMeasure<MyResult> {
///     @Override
///     protected Optional<MyResult> computeImpl(Grid grid, Map<String, Object> deps) {
///         // Your computation logic here
///         return Optional.of(new MyResult(...));
///     }
///
///     @Override
///     protected Class<MyResult> getResultClass() {
///         return MyResult.class;
///     }
/// }
/// ```
///
/// @param <T> the result type for this measure
public abstract class AbstractGridMeasure<T> implements GridMeasure<T> {

    private static final Logger logger = LogManager.getLogger(AbstractGridMeasure.class);

    /// Creates a new AbstractGridMeasure.
    /// Default constructor for subclasses.
    public AbstractGridMeasure() {
        // Default constructor
    }

    @Override
    public final Optional<T> compute(Grid grid, Map<String, Object> dependencyResults) {
        if (grid == null) {
            throw new IllegalArgumentException("grid must not be null for measure " + getMnemonic());
        }
        Map<String, Object> deps = dependencyResults != null ? dependencyResults : Map.of();

        long start = System.nanoTime();
        Optional<T> result = computeImpl(grid, deps);
        long elapsedMicros = (System.nanoTime() - start) / 1_000L;

        if (result.isPresent()) {
            Object value = result.get();
            if (!getResultClass().isInstance(value)) {
                throw new IllegalStateException("Measure " + getMnemonic() + " produced "
                    + value.getClass().getName() + ", expected " + getResultClass().getName());
            }
            logger.debug("{} on {} computed in {} us", getMnemonic(), grid, elapsedMicros);
        } else {
            logger.debug("{} on {} produced no result ({} us)", getMnemonic(), grid, elapsedMicros);
        }
        return result;
    }

    /**
     * Performs the actual computation for this measure.
     * Subclasses implement this method with their specific logic.
     *
     * @param grid the grid to analyze
     * @param dependencyResults results from dependency measures, never null
     * @return the computed result, or empty for no-result conditions
     */
    protected abstract Optional<T> computeImpl(Grid grid, Map<String, Object> dependencyResults);

    /**
     * Gets the Java class representing the result type.
     * Every result is checked against it before it reaches an analysis report.
     * @return the result class
     */
    protected abstract Class<T> getResultClass();

    /// Looks up a dependency result by mnemonic with type checking.
    ///
    /// @param dependencyResults the dependency map handed to [#computeImpl]
    /// @param mnemonic the dependency mnemonic
    /// @param type the expected result type
    /// @param <D> the result type
    /// @return the dependency result, or empty if absent or of another type
    protected static <D> Optional<D> dependency(Map<String, Object> dependencyResults, String mnemonic, Class<D> type) {
        Object value = dependencyResults.get(mnemonic);
        if (type.isInstance(value)) {
            return Optional.of(type.cast(value));
        }
        return Optional.empty();
    }
}
