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

import io.nosqlbench.probability.sampling.Independent;
import io.nosqlbench.probability.source.Sources;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class UniformTest {

    @Test
    void testFunctions() {
        Uniform uniform = new Uniform(-1.0, 3.0);
        assertEquals(0.0, uniform.cdf(-1.0));
        assertEquals(0.25, uniform.cdf(0.0));
        assertEquals(1.0, uniform.cdf(3.0));
        assertEquals(0.25, uniform.density(0.0));
        assertEquals(0.0, uniform.density(3.5));
        assertEquals(1.0, uniform.inverse(0.5));
    }

    @Test
    void testSummaries() {
        Uniform uniform = new Uniform(-1.0, 3.0);
        assertEquals(1.0, uniform.mean());
        assertEquals(16.0 / 12.0, uniform.variance(), 1e-15);
        assertEquals(0.0, uniform.skewness());
        assertEquals(-1.2, uniform.kurtosis());
        assertEquals(1.0, uniform.median());
        assertEquals(Math.log(4.0), uniform.entropy(), 1e-15);
        assertFalse(Modes.class.isInstance(uniform), "a uniform distribution has no distinguished mode");
    }

    @Test
    void testSamplesStayInRange() {
        double[] draws = Independent.of(new Uniform(7.0, 42.0), Sources.xorshift(42L, 69L))
            .stream().limit(10_000).toArray();
        assertThat(draws).hasSize(10_000);
        for (double x : draws) {
            assertThat(x).isBetween(7.0, 42.0);
        }
    }

    @Test
    void testInvalidBounds() {
        assertThrows(IllegalArgumentException.class, () -> new Uniform(1.0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new Uniform(2.0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new Uniform(0.0, Double.POSITIVE_INFINITY));
    }
}
