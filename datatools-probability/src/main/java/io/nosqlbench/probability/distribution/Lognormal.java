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

/// Log-normal distribution: X = e^Y with Y ~ N(μ, σ²).
///
/// Cumulative, inverse and sampling go through the underlying Gaussian:
///
/// ```
///   cdf(x)     = Φ((ln x - μ)/σ)        x > 0
///   inverse(p) = exp(μ + σ·Φ⁻¹(p))
/// ```
///
/// # Moments
///
/// ```
///   Mean     = e^(μ + σ²/2)
///   Variance = (e^(σ²) - 1)·e^(2μ + σ²)
///   Median   = e^μ,  Mode = e^(μ - σ²)
/// ```
public final class Lognormal implements Continuous, Inverse, Sample,
    Mean, Variance, Skewness, Kurtosis, Median, Modes, Entropy {

    private static final double SQRT_2 = Math.sqrt(2.0);
    private static final double SQRT_2PI = Math.sqrt(2.0 * Math.PI);

    private final double mu;
    private final double sigma;

    /// @param mu the mean of the logarithm
    /// @param sigma the standard deviation of the logarithm; must be positive
    /// @throws IllegalArgumentException if sigma is not positive or mu is not finite
    public Lognormal(double mu, double sigma) {
        this.mu = Checks.finite("Log mean", mu);
        this.sigma = Checks.positive("Log standard deviation", sigma);
    }

    public double getMu() {
        return mu;
    }

    public double getSigma() {
        return sigma;
    }

    @Override
    public double cdf(double x) {
        if (x <= 0.0) {
            return 0.0;
        }
        return 0.5 * SpecialFunctions.erfc(-(Math.log(x) - mu) / (sigma * SQRT_2));
    }

    @Override
    public double density(double x) {
        if (x <= 0.0) {
            return 0.0;
        }
        double z = (Math.log(x) - mu) / sigma;
        return Math.exp(-0.5 * z * z) / (x * sigma * SQRT_2PI);
    }

    @Override
    public double inverse(double p) {
        return Math.exp(GaussianQuantile.quantile(Checks.probability(p), mu, sigma));
    }

    @Override
    public double sample(Source source) {
        return Math.exp(mu + sigma * Variates.standardNormal(source));
    }

    @Override
    public double mean() {
        return Math.exp(mu + 0.5 * sigma * sigma);
    }

    @Override
    public double variance() {
        double s2 = sigma * sigma;
        return Math.expm1(s2) * Math.exp(2.0 * mu + s2);
    }

    @Override
    public double skewness() {
        double e = Math.exp(sigma * sigma);
        return (e + 2.0) * Math.sqrt(e - 1.0);
    }

    @Override
    public double kurtosis() {
        double s2 = sigma * sigma;
        return Math.exp(4.0 * s2) + 2.0 * Math.exp(3.0 * s2) + 3.0 * Math.exp(2.0 * s2) - 6.0;
    }

    @Override
    public double median() {
        return Math.exp(mu);
    }

    @Override
    public double[] modes() {
        return new double[]{Math.exp(mu - sigma * sigma)};
    }

    @Override
    public double entropy() {
        return mu + 0.5 * Math.log(2.0 * Math.PI * Math.E * sigma * sigma);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Lognormal)) return false;
        Lognormal that = (Lognormal) o;
        return Double.compare(that.mu, mu) == 0 &&
               Double.compare(that.sigma, sigma) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mu, sigma);
    }

    @Override
    public String toString() {
        return "Lognormal[mu=" + mu + ", sigma=" + sigma + "]";
    }
}
