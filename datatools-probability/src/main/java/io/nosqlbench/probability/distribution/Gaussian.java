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

import io.nosqlbench.probability.numeric.GaussianQuantile;
import io.nosqlbench.probability.numeric.SpecialFunctions;
import io.nosqlbench.probability.sampling.Variates;
import io.nosqlbench.probability.source.Source;

import java.util.Objects;

/**
 * Gaussian (normal) distribution N(μ, σ²).
 *
 * <h2>Functions</h2>
 *
 * <pre>{@code
 * density(x) = exp(-(x-μ)²/(2σ²)) / (σ√(2π))
 * cdf(x)     = erfc(-(x-μ)/(σ√2)) / 2
 * inverse(p) = μ + σ·Φ⁻¹(p)          (AS 241, see GaussianQuantile)
 * }</pre>
 *
 * <p>The complementary error function keeps the lower tail accurate far below
 * the point where {@code 1 + erf} would cancel to zero.
 *
 * <h2>Moments</h2>
 *
 * <pre>{@code
 * Mean = Median = Mode = μ
 * Variance = σ²
 * Skewness = 0, excess Kurtosis = 0
 * Entropy = ln(2πeσ²)/2
 * }</pre>
 */
public final class Gaussian implements Continuous, Inverse, Sample,
    Mean, Variance, Skewness, Kurtosis, Median, Modes, Entropy {

    private static final double SQRT_2 = Math.sqrt(2.0);
    private static final double SQRT_2PI = Math.sqrt(2.0 * Math.PI);

    private final double mu;
    private final double sigma;

    /**
     * Constructs a Gaussian distribution.
     *
     * @param mu the mean μ
     * @param sigma the standard deviation σ; must be positive
     * @throws IllegalArgumentException if sigma is not positive or mu is not finite
     */
    public Gaussian(double mu, double sigma) {
        this.mu = Checks.finite("Mean", mu);
        this.sigma = Checks.positive("Standard deviation", sigma);
    }

    /**
     * Returns the standard normal distribution N(0, 1).
     *
     * @return the standard normal
     */
    public static Gaussian standard() {
        return new Gaussian(0.0, 1.0);
    }

    public double getMu() {
        return mu;
    }

    public double getSigma() {
        return sigma;
    }

    @Override
    public double cdf(double x) {
        return 0.5 * SpecialFunctions.erfc(-(x - mu) / (sigma * SQRT_2));
    }

    @Override
    public double density(double x) {
        double z = (x - mu) / sigma;
        return Math.exp(-0.5 * z * z) / (sigma * SQRT_2PI);
    }

    @Override
    public double inverse(double p) {
        return GaussianQuantile.quantile(Checks.probability(p), mu, sigma);
    }

    @Override
    public double sample(Source source) {
        return mu + sigma * Variates.standardNormal(source);
    }

    @Override
    public double mean() {
        return mu;
    }

    @Override
    public double variance() {
        return sigma * sigma;
    }

    @Override
    public double deviation() {
        return sigma;
    }

    @Override
    public double skewness() {
        return 0.0;
    }

    @Override
    public double kurtosis() {
        return 0.0;
    }

    @Override
    public double median() {
        return mu;
    }

    @Override
    public double[] modes() {
        return new double[]{mu};
    }

    @Override
    public double entropy() {
        return 0.5 * Math.log(2.0 * Math.PI * Math.E * sigma * sigma);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Gaussian)) return false;
        Gaussian that = (Gaussian) o;
        return Double.compare(that.mu, mu) == 0 &&
               Double.compare(that.sigma, sigma) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mu, sigma);
    }

    @Override
    public String toString() {
        return "Gaussian[mu=" + mu + ", sigma=" + sigma + "]";
    }
}
