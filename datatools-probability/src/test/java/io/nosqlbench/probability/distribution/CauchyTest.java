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

import io.nosqlbench.probability.source.Source;
import io.nosqlbench.probability.source.Sources;
import org.apache.commons.math3.distribution.CauchyDistribution;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class CauchyTest {

    private static final double TOLERANCE = 1e-14;

    @ParameterizedTest
    @CsvSource({
        "-1.0, 0.3857997487800918",
        "2.0, 0.5",
        "4.0, 0.5779791303773694"
    })
    void testCdf(double x, double expected) {
        assertEquals(expected, new Cauchy(2.0, 8.0).cdf(x), TOLERANCE);
    }

    @ParameterizedTest
    @CsvSource({
        "0.1, -7.2330506115257585",
        "0.5, 2.0",
        "0.75, 5.0"
    })
    void testInverse(double p, double expected) {
        assertEquals(expected, new Cauchy(2.0, 3.0).inverse(p), 1e-12);
    }

    @Test
    void testAgreesWithCommonsMath() {
        Cauchy cauchy = new Cauchy(2.0, 8.0);
        CauchyDistribution reference = new CauchyDistribution(null, 2.0, 8.0);
        for (double x = -100.0; x <= 100.0; x += 2.5) {
            assertEquals(reference.density(x), cauchy.density(x), TOLERANCE, "density at " + x);
            assertEquals(reference.cumulativeProbability(x), cauchy.cdf(x), TOLERANCE, "cdf at " + x);
        }
    }

    @Test
    void testSummaries() {
        Cauchy cauchy = new Cauchy(2.0, 3.0);
        assertEquals(2.0, cauchy.median());
        assertArrayEquals(new double[]{2.0}, cauchy.modes());
        assertEquals(Math.log(12.0 * Math.PI), cauchy.entropy(), TOLERANCE);
        assertFalse(Mean.class.isInstance(cauchy), "the Cauchy mean is undefined");
        assertFalse(Variance.class.isInstance(cauchy), "the Cauchy variance is undefined");
    }

    /**
     * Bins samples into equal-probability cells and checks the
     * Kullback-Leibler divergence of the empirical cell frequencies from the
     * uniform cell probabilities.
     */
    @Test
    void testSampleDivergence() {
        Cauchy cauchy = new Cauchy(35.4, 12.3);
        Source source = Sources.xorshift(42L, 69L);
        int samples = 100_000;
        int cells = 100;
        int[] counts = new int[cells];
        for (int i = 0; i < samples; i++) {
            double x = cauchy.sample(source);
            assertTrue(Double.isFinite(x));
            int cell = (int) Math.floor(cauchy.cdf(x) * cells);
            counts[Math.min(Math.max(cell, 0), cells - 1)]++;
        }
        double expected = 1.0 / cells;
        double divergence = 0.0;
        for (int count : counts) {
            if (count > 0) {
                double observed = (double) count / samples;
                divergence += observed * Math.log(observed / expected);
            }
        }
        assertTrue(divergence < 0.01, "divergence too large: " + divergence);
    }

    @Test
    void testInvalidScale() {
        assertThrows(IllegalArgumentException.class, () -> new Cauchy(0.0, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new Cauchy(Double.NEGATIVE_INFINITY, 1.0));
    }
}
