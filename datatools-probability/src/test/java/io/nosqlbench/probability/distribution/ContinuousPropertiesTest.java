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

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Properties every continuous distribution with an inverse must satisfy.
 */
class ContinuousPropertiesTest {

    private static final double[] PROBABILITIES = {0.001, 0.01, 0.1, 0.25, 0.5, 0.75, 0.9, 0.99, 0.999};

    static Stream<Arguments> distributions() {
        double inf = Double.POSITIVE_INFINITY;
        return Stream.of(
            Arguments.of(new Gaussian(-1.0, 0.25), -inf, inf),
            Arguments.of(new Exponential(2.0), 0.0, inf),
            Arguments.of(new Beta(2.0, 3.0, -1.0, 2.0), -1.0, 2.0),
            Arguments.of(new Beta(5.0, 1.5), 0.0, 1.0),
            Arguments.of(new Cauchy(2.0, 8.0), -inf, inf),
            Arguments.of(new Laplace(2.0, 3.0), -inf, inf),
            Arguments.of(new Logistic(1.0, 2.0), -inf, inf),
            Arguments.of(new Lognormal(1.0, 0.5), 0.0, inf),
            Arguments.of(new Pert(-1.0, 0.5, 2.0), -1.0, 2.0),
            Arguments.of(new Triangular(0.0, 4.0, 1.0), 0.0, 4.0),
            Arguments.of(new Triangular(0.0, 1.0, 0.0), 0.0, 1.0),
            Arguments.of(new Uniform(-1.0, 3.0), -1.0, 3.0)
        );
    }

    @ParameterizedTest
    @MethodSource("distributions")
    void testCdfOfInverseRoundTrip(Object distribution) {
        Continuous continuous = (Continuous) distribution;
        Inverse inverse = (Inverse) distribution;
        for (double p : PROBABILITIES) {
            double x = inverse.inverse(p);
            assertEquals(p, continuous.cdf(x), 1e-10, distribution + " at p=" + p);
        }
    }

    @ParameterizedTest
    @MethodSource("distributions")
    void testInverseIsMonotone(Object distribution) {
        Inverse inverse = (Inverse) distribution;
        double previous = Double.NEGATIVE_INFINITY;
        for (int i = 1; i < 1000; i++) {
            double x = inverse.inverse(i / 1000.0);
            assertThat(x).as("%s at %d", distribution, i).isGreaterThanOrEqualTo(previous);
            previous = x;
        }
    }

    @ParameterizedTest
    @MethodSource("distributions")
    void testCdfIsMonotone(Object distribution) {
        Continuous continuous = (Continuous) distribution;
        Inverse inverse = (Inverse) distribution;
        double lo = inverse.inverse(0.001);
        double hi = inverse.inverse(0.999);
        double previous = 0.0;
        for (int i = 0; i <= 1000; i++) {
            double c = continuous.cdf(lo + (hi - lo) * i / 1000.0);
            assertThat(c).isBetween(0.0, 1.0);
            assertThat(c).isGreaterThanOrEqualTo(previous);
            previous = c;
        }
    }

    @ParameterizedTest
    @MethodSource("distributions")
    void testDensityIntegratesToCdf(Object distribution) {
        Continuous continuous = (Continuous) distribution;
        Inverse inverse = (Inverse) distribution;
        double lo = inverse.inverse(0.001);
        double hi = inverse.inverse(0.999);
        int steps = 200_000;
        double h = (hi - lo) / steps;
        double sum = 0.5 * (continuous.density(lo) + continuous.density(hi));
        for (int i = 1; i < steps; i++) {
            sum += continuous.density(lo + h * i);
        }
        assertEquals(continuous.cdf(hi) - continuous.cdf(lo), sum * h, 1e-4, distribution.toString());
    }

    @ParameterizedTest
    @MethodSource("distributions")
    void testInverseBoundaries(Object distribution, double lower, double upper) {
        Inverse inverse = (Inverse) distribution;
        assertEquals(lower, inverse.inverse(0.0), 0.0);
        assertEquals(upper, inverse.inverse(1.0), 0.0);
    }

    @ParameterizedTest
    @MethodSource("distributions")
    void testCdfLimits(Object distribution) {
        Continuous continuous = (Continuous) distribution;
        assertEquals(0.0, continuous.cdf(Double.NEGATIVE_INFINITY), 0.0);
        assertEquals(1.0, continuous.cdf(Double.POSITIVE_INFINITY), 0.0);
        assertEquals(0.0, continuous.density(Double.NEGATIVE_INFINITY), 0.0);
        assertEquals(0.0, continuous.density(Double.POSITIVE_INFINITY), 0.0);
    }

    @ParameterizedTest
    @MethodSource("distributions")
    void testInverseRejectsInvalidProbability(Object distribution) {
        Inverse inverse = (Inverse) distribution;
        assertThrows(IllegalArgumentException.class, () -> inverse.inverse(-0.1));
        assertThrows(IllegalArgumentException.class, () -> inverse.inverse(1.1));
        assertThrows(IllegalArgumentException.class, () -> inverse.inverse(Double.NaN));
    }
}
