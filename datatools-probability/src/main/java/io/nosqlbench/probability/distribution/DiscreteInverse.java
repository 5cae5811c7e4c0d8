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

/// A discrete distribution whose cumulative function can be inverted.
public interface DiscreteInverse extends Distribution {

    /// Computes the smallest outcome k with cdf(k) ≥ p.
    ///
    /// @param p a probability in [0, 1]
    /// @return the quantile; the smallest outcome of the support for p = 0
    /// @throws IllegalArgumentException if p is NaN or outside [0, 1]
    long inverse(double p);
}
