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

import io.nosqlbench.probability.distribution.DiscreteSample;
import io.nosqlbench.probability.source.Source;

import java.util.Objects;
import java.util.PrimitiveIterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.LongStream;
import java.util.stream.StreamSupport;

/// An unbounded sequence of independent samples from a discrete distribution.
///
/// Same contract as [Independent]: borrowed distribution and source, one
/// sample call per element, no buffering, no end.
public final class DiscreteIndependent implements PrimitiveIterator.OfLong {

    private final DiscreteSample distribution;
    private final Source source;

    private DiscreteIndependent(DiscreteSample distribution, Source source) {
        this.distribution = Objects.requireNonNull(distribution, "distribution");
        this.source = Objects.requireNonNull(source, "source");
    }

    /// @param distribution the distribution to sample
    /// @param source the random source to read from
    /// @return a new sequence
    public static DiscreteIndependent of(DiscreteSample distribution, Source source) {
        return new DiscreteIndependent(distribution, source);
    }

    @Override
    public boolean hasNext() {
        return true;
    }

    @Override
    public long nextLong() {
        return distribution.sample(source);
    }

    /// @return an ordered, sequential, infinite stream over this sequence
    public LongStream stream() {
        return StreamSupport.longStream(
            Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL),
            false);
    }
}
