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

/// A probability distribution over the real line.
///
/// # Capabilities
///
/// Cumulative evaluation is the one operation every distribution supports.
/// Everything else is an optional capability interface, implemented only where
/// the mathematics gives it meaning:
///
/// ```
///                        Distribution (cdf)
///                              ▲
///   ┌───────────┬─────────┬────┴────┬─────────┬──────────────┐
///   Continuous  Discrete  Inverse   Sample    Mean, Variance, Skewness,
///   (density)   (mass)    Discrete- Discrete- Kurtosis, Median, Modes,
///                         Inverse   Sample    DiscreteModes, Entropy
/// ```
///
/// Code that needs several capabilities states them as an intersection bound,
/// for example `<D extends Continuous & Inverse>`.
///
/// # Contract
///
/// - [#cdf(double)] is defined for every real argument, including values
///   outside the support, and returns a value in [0, 1].
/// - It is non-decreasing, tends to 0 at -∞ and to 1 at +∞.
/// - For discrete distributions it is right-continuous: `cdf(k)` includes the
///   mass at `k`.
///
/// Implementations are immutable and safe to share between threads.
public interface Distribution {

    /// Computes P(X ≤ x).
    ///
    /// @param x any real value
    /// @return the cumulative probability in [0, 1]
    double cdf(double x);
}
