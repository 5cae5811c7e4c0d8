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

import io.nosqlbench.probability.distribution.Bernoulli;
import io.nosqlbench.probability.distribution.Exponential;
import io.nosqlbench.probability.distribution.Gaussian;
import io.nosqlbench.probability.distribution.Uniform;
import io.nosqlbench.probability.source.Source;
import io.nosqlbench.probability.source.Sources;
import io.nosqlbench.probability.source.Xorshift128Plus;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class IndependentTest {

    @Test
    void testNothingIsDrawnUntilConsumed() {
        AtomicLong reads = new AtomicLong();
        Xorshift128Plus delegate = Sources.xorshift(42L, 69L);
        Source counting = () -> {
            reads.incrementAndGet();
            return delegate.read();
        };

        Independent sequence = Independent.of(new Uniform(0.0, 1.0), counting);
        assertEquals(0L, reads.get());
        assertTrue(sequence.hasNext());
        assertEquals(0L, reads.get());

        sequence.nextDouble();
        assertEquals(1L, reads.get());

        sequence.stream().limit(10).toArray();
        assertEquals(11L, reads.get());
    }

    @Test
    void testMatchesDirectSampling() {
        Exponential exponential = new Exponential(3.0);
        Source direct = Sources.xorshift(7L, 11L);
        double[] expected = new double[100];
        for (int i = 0; i < expected.length; i++) {
            expected[i] = exponential.sample(direct);
        }
        double[] actual = Independent.of(exponential, Sources.xorshift(7L, 11L)).stream().limit(100).toArray();
        assertArrayEquals(expected, actual);
    }

    @Test
    void testSameStateSameSequence() {
        Gaussian gaussian = Gaussian.standard();
        Xorshift128Plus source = Sources.xorshift(42L, 69L);
        long[] saved = source.state();
        double[] first = Independent.of(gaussian, source).stream().limit(50).toArray();
        source.restore(saved);
        double[] second = Independent.of(gaussian, source).stream().limit(50).toArray();
        assertArrayEquals(first, second);
    }

    @Test
    void testStreamIsOrderedAndSequential() {
        assertFalse(Independent.of(Gaussian.standard(), Sources.xorshift(1L, 2L)).stream().isParallel());
    }

    @Test
    void testDiscreteSequence() {
        AtomicLong reads = new AtomicLong();
        Xorshift128Plus delegate = Sources.xorshift(42L, 69L);
        Source counting = () -> {
            reads.incrementAndGet();
            return delegate.read();
        };
        DiscreteIndependent sequence = DiscreteIndependent.of(new Bernoulli(0.25), counting);
        assertTrue(sequence.hasNext());
        assertEquals(0L, reads.get());

        long[] draws = sequence.stream().limit(1000).toArray();
        assertEquals(1000L, reads.get());
        assertThat(draws).containsOnly(0L, 1L);
    }

    @Test
    void testRejectsNulls() {
        assertThrows(NullPointerException.class, () -> Independent.of(null, Sources.xorshift(1L, 2L)));
        assertThrows(NullPointerException.class, () -> Independent.of(Gaussian.standard(), null));
        assertThrows(NullPointerException.class, () -> DiscreteIndependent.of(new Bernoulli(0.5), null));
    }
}
