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

import io.nosqlbench.probability.numeric.SpecialFunctions;
import io.nosqlbench.probability.sampling.Variates;
import io.nosqlbench.probability.source.Source;

import java.util.Objects;

/**
 * Gamma distribution with shape k and scale θ.
 *
 * <h2>Parameters</h2>
 *
 * <ul>
 *   <li><b>shape (k)</b>: k &gt; 0. Controls the distribution shape.</li>
 *   <li><b>scale (θ)</b>: θ &gt; 0. Stretches the distribution. Rate is 1/θ.</li>
 * </ul>
 *
 * <h2>Functions</h2>
 *
 * <pre>{@code
 * density(x) = x^(k-1)·e^(-x/θ) / (Γ(k)·θ^k)      x > 0
 * cdf(x)     = P(k, x/θ)                          regularized lower incomplete gamma
 * }</pre>
 *
 * <h2>Special Cases</h2>
 *
 * <ul>
 *   <li>k = 1: Exponential with rate 1/θ</li>
 *   <li>k = n/2, θ = 2: Chi-squared with n degrees of freedom</li>
 * </ul>
 *
 * <h2>Moments</h2>
 *
 * <pre>{@code
 * Mean = kθ
 * Variance = kθ²
 * Skewness = 2/√k
 * Kurtosis (excess) = 6/k
 * Entropy = k + ln θ + ln Γ(k) + (1-k)·ψ(k)
 * }</pre>
 *
 * <p>Sampling uses the Marsaglia-Tsang rejection method, see {@link Variates}.
 */
public final class Gamma implements Continuous, Sample,
    Mean, Variance, Skewness, Kurtosis, Modes, Entropy {

    private final double shape;     // k
    private final double scale;     // θ
    private final double logNorm;   // ln Γ(k) + k ln θ

    /**
     * Constructs a gamma distribution.
     *
     * @param shape the shape parameter (k); must be positive
     * @param scale the scale parameter (θ); must be positive
     * @throws IllegalArgumentException if shape or scale is not positive
     */
    public Gamma(double shape, double scale) {
        this.shape = Checks.positive("Shape", shape);
        this.scale = Checks.positive("Scale", scale);
        this.logNorm = SpecialFunctions.logGamma(shape) + shape * Math.log(scale);
    }

    /**
     * Creates a chi-squared distribution, Gamma(n/2, 2).
     *
     * @param degreesOfFreedom the degrees of freedom; must be positive
     * @return the chi-squared distribution
     */
    public static Gamma chiSquared(int degreesOfFreedom) {
        if (degreesOfFreedom <= 0) {
            throw new IllegalArgumentException("Degrees of freedom must be positive, got: " + degreesOfFreedom);
        }
        return new Gamma(degreesOfFreedom / 2.0, 2.0);
    }

    /**
     * Returns the shape parameter k.
     * @return the shape
     */
    public double getShape() {
        return shape;
    }

    /**
     * Returns the scale parameter θ.
     * @return the scale
     */
    public double getScale() {
        return scale;
    }

    @Override
    public double cdf(double x) {
        if (x <= 0.0) {
            return 0.0;
        }
        return SpecialFunctions.regularizedGammaP(shape, x / scale);
    }

    @Override
    public double density(double x) {
        if (x < 0.0) {
            return 0.0;
        }
        if (x == 0.0) {
            if (shape < 1.0) {
                return Double.POSITIVE_INFINITY;
            }
            return shape == 1.0 ? 1.0 / scale : 0.0;
        }
        return Math.exp((shape - 1.0) * Math.log(x) - x / scale - logNorm);
    }

    @Override
    public double sample(Source source) {
        return Variates.gamma(shape, scale, source);
    }

    @Override
    public double mean() {
        return shape * scale;
    }

    @Override
    public double variance() {
        return shape * scale * scale;
    }

    @Override
    public double skewness() {
        return 2.0 / Math.sqrt(shape);
    }

    @Override
    public double kurtosis() {
        return 6.0 / shape;
    }

    /**
     * Returns the mode, (k - 1)θ for k ≥ 1 and 0 below.
     *
     * @return a single mode
     */
    @Override
    public double[] modes() {
        return new double[]{shape < 1.0 ? 0.0 : (shape - 1.0) * scale};
    }

    @Override
    public double entropy() {
        return shape + Math.log(scale) + SpecialFunctions.logGamma(shape)
            + (1.0 - shape) * SpecialFunctions.digamma(shape);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Gamma)) return false;
        Gamma that = (Gamma) o;
        return Double.compare(that.shape, shape) == 0 &&
               Double.compare(that.scale, scale) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(shape, scale);
    }

    @Override
    public String toString() {
        return "Gamma[shape=" + shape + ", scale=" + scale + "]";
    }
}
