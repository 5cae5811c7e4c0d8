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

package io.nosqlbench.probability.sampling;

import io.nosqlbench.probability.distribution.Sample;
import io.nosqlbench.probability.source.Source;

import java.util.Objects;
import java.util.PrimitiveIterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.DoubleStream;
import java.util.stream.StreamSupport;

/// An unbounded sequence of independent samples from a continuous distribution.
///
/// # Usage
///
/// ```java
/// Gaussian gaussian = new Gaussian(0.0, 1.0);
/// Source source = Sources.xorshift(42L, 69L);
/// double[] draws = Independent.of(gaussian, source).stream().limit(1000).toArray();
/// ```
///
/// The sequence borrows both the distribution and the source; it owns neither
/// and holds no buffer. Each [#nextDouble()] performs exactly one
/// [Sample#sample(Source)] call. The sequence never ends and cannot be rewound:
/// to replay it, build a new one over a source restored to the same state.
///
/// Not thread-safe, since the source is not.
public final class Independent implements PrimitiveIterator.OfDouble {

    private final Sample distribution;
    private final Source source;

    private Independent(Sample distribution, Source source) {
        this.distribution = Objects.requireNonNull(distribution, "distribution");
        this.source = Objects.requireNonNull(source, "source");
    }

    /// @param distribution the distribution to sample
    /// @param source the random source to read from
    /// @return a new sequence
    public static Independent of(Sample distribution, Source source) {
        return new Independent(distribution, source);
    }

    /// Always true: the sequence is unbounded.
    @Override
    public boolean hasNext() {
        return true;
    }

    @Override
    public double nextDouble() {
        return distribution.sample(source);
    }

    /// Returns the remaining samples as an ordered, sequential, infinite stream.
    /// Callers bound it with `limit`.
    ///
    /// @return a sequential stream over this sequence
    public DoubleStream stream() {
        return StreamSupport.doubleStream(
            Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL),
            false);
    }
}
