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
import org.apache.commons.math3.distribution.GammaDistribution;
import org.apache.commons.math3.stat.inference.KolmogorovSmirnovTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class GammaTest {

    private static final double TOLERANCE = 1e-12;

    @Test
    void testCdf() {
        Gamma gamma = new Gamma(9.0, 0.5);
        assertEquals(0.4074526585624087, gamma.cdf(4.0), TOLERANCE);
        assertEquals(0.0, gamma.cdf(0.0));
        assertEquals(0.0, gamma.cdf(-1.0));
    }

    @Test
    void testAgreesWithCommonsMath() {
        Gamma gamma = new Gamma(2.5, 1.5);
        GammaDistribution reference = new GammaDistribution(null, 2.5, 1.5);
        for (double x = 0.1; x <= 15.0; x += 0.1) {
            assertEquals(reference.density(x), gamma.density(x), TOLERANCE, "density at " + x);
            assertEquals(reference.cumulativeProbability(x), gamma.cdf(x), TOLERANCE, "cdf at " + x);
        }
    }

    @Test
    void testDensityAtZero() {
        assertEquals(Double.POSITIVE_INFINITY, new Gamma(0.5, 1.0).density(0.0));
        assertEquals(0.5, new Gamma(1.0, 2.0).density(0.0));
        assertEquals(0.0, new Gamma(3.0, 2.0).density(0.0));
        assertEquals(0.0, new Gamma(3.0, 2.0).density(-1.0));
    }

    @Test
    void testSummaries() {
        Gamma gamma = new Gamma(9.0, 0.5);
        assertEquals(4.5, gamma.mean());
        assertEquals(2.25, gamma.variance());
        assertEquals(2.0 / 3.0, gamma.skewness(), TOLERANCE);
        assertEquals(6.0 / 9.0, gamma.kurtosis(), TOLERANCE);
        assertArrayEquals(new double[]{4.0}, gamma.modes());
        assertArrayEquals(new double[]{0.0}, new Gamma(0.5, 1.0).modes());
    }

    @Test
    void testEntropyReducesToExponential() {
        // Gamma(1, θ) is the exponential distribution with rate 1/θ
        assertEquals(new Exponential(0.5).entropy(), new Gamma(1.0, 2.0).entropy(), TOLERANCE);
    }

    @Test
    void testChiSquared() {
        Gamma chiSquared = Gamma.chiSquared(4);
        assertEquals(2.0, chiSquared.getShape());
        assertEquals(2.0, chiSquared.getScale());
        assertEquals(4.0, chiSquared.mean());
        assertThrows(IllegalArgumentException.class, () -> Gamma.chiSquared(0));
    }

    @ParameterizedTest
    @CsvSource({
        "9.0, 0.5",
        "2.0, 1.0",
        "1.0, 3.0",
        "0.5, 2.0",
        "0.1, 1.0"
    })
    void testSamplesMatchDistribution(double shape, double scale) {
        Gamma gamma = new Gamma(shape, scale);
        double[] samples = Independent.of(gamma, Sources.xorshift(42L, 69L)).stream().limit(10_000).toArray();
        for (double x : samples) {
            assertTrue(x >= 0.0 && Double.isFinite(x), "sample out of range: " + x);
        }
        double statistic = new KolmogorovSmirnovTest()
            .kolmogorovSmirnovStatistic(new GammaDistribution(null, shape, scale), samples);
        assertTrue(statistic < 0.03, "KS statistic too large: " + statistic);
    }

    @Test
    void testSampleMean() {
        double sum = Independent.of(new Gamma(9.0, 0.5), Sources.xorshift(42L, 69L)).stream().limit(100_000).sum();
        assertEquals(4.5, sum / 100_000, 0.05);
    }

    @Test
    void testInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> new Gamma(0.0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new Gamma(1.0, -1.0));
    }
}
