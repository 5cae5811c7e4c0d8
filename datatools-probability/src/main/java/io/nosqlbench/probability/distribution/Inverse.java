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

package io.nosqlbench.probability.distribution;

/// A continuous distribution whose cumulative function can be inverted.
///
/// ```
///   inverse(0) = support infimum, or -∞ when unbounded below
///   inverse(1) = support supremum, or +∞ when unbounded above
///   cdf(inverse(p)) ≈ p for p in (0, 1)
/// ```
public interface Inverse extends Distribution {

    /// Computes the quantile: the x with cdf(x) = p.
    ///
    /// @param p a probability in [0, 1]
    /// @return the quantile
    /// @throws IllegalArgumentException if p is NaN or outside [0, 1]
    double inverse(double p);
}
