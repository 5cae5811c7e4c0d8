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
import org.apache.commons.math3.distribution.LaplaceDistribution;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class LaplaceTest {

    private static final double TOLERANCE = 1e-14;

    @ParameterizedTest
    @CsvSource({
        "0.1, -2.8283137373023006",
        "0.5, 2.0",
        "0.75, 4.079441541679836"
    })
    void testInverse(double p, double expected) {
        assertEquals(expected, new Laplace(2.0, 3.0).inverse(p), TOLERANCE);
    }

    @Test
    void testAgreesWithCommonsMath() {
        Laplace laplace = new Laplace(2.0, 3.0);
        LaplaceDistribution reference = new LaplaceDistribution(null, 2.0, 3.0);
        for (double x = -10.0; x <= 14.0; x += 0.75) {
            assertEquals(reference.density(x), laplace.density(x), TOLERANCE, "density at " + x);
            assertEquals(reference.cumulativeProbability(x), laplace.cdf(x), TOLERANCE, "cdf at " + x);
        }
        assertEquals(0.5, laplace.cdf(2.0));
        assertEquals(1.0 / 6.0, laplace.density(2.0), TOLERANCE);
    }

    @Test
    void testSummaries() {
        Laplace laplace = new Laplace(2.0, 3.0);
        assertEquals(2.0, laplace.mean());
        assertEquals(18.0, laplace.variance());
        assertEquals(0.0, laplace.skewness());
        assertEquals(3.0, laplace.kurtosis());
        assertEquals(2.0, laplace.median());
        assertArrayEquals(new double[]{2.0}, laplace.modes());
        assertEquals(1.0 + Math.log(6.0), laplace.entropy(), TOLERANCE);
    }

    @Test
    void testSamplesAreFiniteWithExpectedSpread() {
        SummaryStatistics stats = new SummaryStatistics();
        Independent.of(new Laplace(2.0, 3.0), Sources.xorshift(42L, 69L)).stream().limit(100_000)
            .forEach(x -> {
                assertTrue(Double.isFinite(x));
                stats.addValue(x);
            });
        assertEquals(2.0, stats.getMean(), 0.1);
        assertEquals(18.0, stats.getVariance(), 0.7);
    }

    @Test
    void testInvalidScale() {
        assertThrows(IllegalArgumentException.class, () -> new Laplace(0.0, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new Laplace(Double.NaN, 1.0));
    }
}
