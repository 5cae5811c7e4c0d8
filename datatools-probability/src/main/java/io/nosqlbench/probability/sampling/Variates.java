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

import io.nosqlbench.probability.numeric.GaussianQuantile;
import io.nosqlbench.probability.source.Source;

/**
 * Standard normal and gamma variates drawn from a {@link Source}.
 *
 * <h2>Gamma: Marsaglia and Tsang</h2>
 *
 * <pre>{@code
 *   k < 1:   Gamma(k) = Gamma(1 + k) · U^(1/k), U > 0
 *
 *   k >= 1:  d = k - 1/3,  c = 1 / sqrt(9d)
 *            repeat
 *              x ~ N(0,1);  v = 1 + c·x        (retry while v <= 0)
 *              v = v³;      u ~ U(0,1), u > 0
 *            until u < 1 - 0.0331·x⁴
 *               or ln u < x²/2 + d·(1 - v + ln v)
 *            return d·v
 * }</pre>
 *
 * <p>The squeeze test accepts about 98% of candidates without a logarithm.
 * Acceptance is random, so a draw consumes a variable number of words.
 *
 * <h2>Normal</h2>
 *
 * <p>Standard normal variates use the inverse transform through
 * {@link GaussianQuantile}, one word per variate. A zero uniform is redrawn so
 * the result is always finite.
 *
 * <h2>Reference</h2>
 *
 * <p>G. Marsaglia and W. W. Tsang, "A simple method for generating gamma
 * variables," ACM Transactions on Mathematical Software, vol. 26, no. 3,
 * pp. 363-372, 2000.
 */
public final class Variates {

    private static final double ONE_THIRD = 1.0 / 3.0;
    private static final double SQUEEZE = 0.0331;

    private Variates() {
        // Utility class, no instantiation
    }

    /**
     * Draws a uniform value in the open interval (0, 1).
     *
     * @param source the random source
     * @return a uniform value, never zero
     */
    public static double openUniform(Source source) {
        double u;
        do {
            u = source.uniform();
        } while (u == 0.0);
        return u;
    }

    /**
     * Draws a standard normal variate N(0, 1).
     *
     * @param source the random source
     * @return a finite normal variate
     */
    public static double standardNormal(Source source) {
        return GaussianQuantile.standard(openUniform(source));
    }

    /**
     * Draws a gamma variate with unit scale.
     *
     * @param shape the shape k; must be positive
     * @param source the random source
     * @return a variate of Gamma(k, 1)
     */
    public static double standardGamma(double shape, Source source) {
        if (shape < 1.0) {
            return Math.exp(logStandardGamma(shape, source));
        }

        double d = shape - ONE_THIRD;
        double c = ONE_THIRD / Math.sqrt(d);
        while (true) {
            double x = standardNormal(source);
            double v = 1.0 + c * x;
            if (v <= 0.0) {
                continue;
            }
            x = x * x;
            v = v * v * v;
            double u = openUniform(source);
            if (u < 1.0 - SQUEEZE * x * x) {
                return d * v;
            }
            if (Math.log(u) < 0.5 * x + d * (1.0 - v + Math.log(v))) {
                return d * v;
            }
        }
    }

    /**
     * Draws the logarithm of a gamma variate with unit scale.
     *
     * <p>For shapes below one the boost factor U^(1/k) is applied as
     * ln(U)/k, so the result stays finite where the variate itself would
     * underflow to zero.
     *
     * @param shape the shape k; must be positive
     * @param source the random source
     * @return ln X for X ~ Gamma(k, 1)
     */
    public static double logStandardGamma(double shape, Source source) {
        if (shape < 1.0) {
            double boosted = standardGamma(1.0 + shape, source);
            return Math.log(boosted) + Math.log(openUniform(source)) / shape;
        }
        return Math.log(standardGamma(shape, source));
    }

    /**
     * Draws a gamma variate.
     *
     * @param shape the shape k; must be positive
     * @param scale the scale θ; must be positive
     * @param source the random source
     * @return a variate of Gamma(k, θ)
     */
    public static double gamma(double shape, double scale, Source source) {
        return scale * standardGamma(shape, source);
    }
}
