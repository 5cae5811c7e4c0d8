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

package io.nosqlbench.probability.source;

/// A stream of raw 64-bit pseudorandom words.
///
/// # Contract
///
/// ```
///   read()     ──► next 64-bit word, advances state by one step
///   uniform()  ──► top 53 bits of read() scaled into [0, 1)
/// ```
///
/// A source is mutable and exclusively owned: every call advances its state,
/// so one instance must never be used by two threads at once. Distributions
/// borrow a source for the duration of a single sample call and never keep it.
///
/// Reproducibility follows from the state alone. Two sources of the same
/// algorithm seeded with the same state yield identical sequences.
///
/// @see Xorshift128Plus
/// @see Sources
@FunctionalInterface
public interface Source {

    /// One unit in the last place of a 53-bit fraction (2^-53).
    double DOUBLE_UNIT = 0x1.0p-53;

    /// Returns the next raw 64-bit word and advances the state.
    ///
    /// @return a word with all 64 bits significant
    long read();

    /// Returns the next word converted to a double in `[0, 1)`.
    ///
    /// The conversion keeps the 53 most significant bits of the word, which is
    /// the word divided by 2^64 truncated to double precision. Truncation rather
    /// than rounding keeps the result strictly below 1.
    ///
    /// @return a uniform value in `[0, 1)`
    default double uniform() {
        return (read() >>> 11) * DOUBLE_UNIT;
    }
}
