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

import java.util.Arrays;

/// Xorshift128+ pseudorandom generator.
///
/// # Algorithm
///
/// ```
///   x = s0, y = s1
///   s0 = y
///   x ^= x << 23
///   x ^= x >>> 17
///   x ^= y ^ (y >>> 26)
///   s1 = x
///   return x + y          (wrapping 64-bit addition)
/// ```
///
/// Two 64-bit state words give a period of 2^128 - 1. The words must not both
/// be zero, since the all-zero state is a fixed point.
///
/// # Quality
///
/// Statistically good and very fast. It is **not** cryptographically secure:
/// the state can be recovered from a handful of outputs.
///
/// Instances are not thread-safe. See [Sources#defaultSource()] for the
/// per-thread default instance.
public final class Xorshift128Plus implements Source {

    private long s0;
    private long s1;

    /// Creates a generator from two state words.
    ///
    /// @param s0 first state word
    /// @param s1 second state word
    /// @throws IllegalArgumentException if both words are zero
    public Xorshift128Plus(long s0, long s1) {
        seed(s0, s1);
    }

    /// Creates a generator from a saved state.
    ///
    /// @param state two state words, as returned by [#state()]
    /// @throws IllegalArgumentException if the array does not hold exactly two words, or both are zero
    public Xorshift128Plus(long[] state) {
        restore(state);
    }

    /// Replaces the state of this generator.
    ///
    /// @param s0 first state word
    /// @param s1 second state word
    /// @throws IllegalArgumentException if both words are zero
    public void seed(long s0, long s1) {
        if (s0 == 0L && s1 == 0L) {
            throw new IllegalArgumentException("Xorshift128+ state must not be all zero");
        }
        this.s0 = s0;
        this.s1 = s1;
    }

    @Override
    public long read() {
        long x = s0;
        final long y = s1;
        s0 = y;
        x ^= x << 23;
        x ^= x >>> 17;
        x ^= y ^ (y >>> 26);
        s1 = x;
        return x + y;
    }

    /// Returns a copy of the current state.
    ///
    /// @return a new two-element array
    public long[] state() {
        return new long[]{s0, s1};
    }

    /// Restores a state previously returned by [#state()].
    ///
    /// @param state two state words
    /// @throws IllegalArgumentException if the array does not hold exactly two words, or both are zero
    public void restore(long[] state) {
        if (state == null || state.length != 2) {
            throw new IllegalArgumentException("State must hold exactly 2 words, got: "
                + Arrays.toString(state));
        }
        seed(state[0], state[1]);
    }

    @Override
    public String toString() {
        return "Xorshift128Plus[s0=" + s0 + ", s1=" + s1 + "]";
    }
}
