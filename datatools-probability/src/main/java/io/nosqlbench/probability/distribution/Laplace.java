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

import io.nosqlbench.probability.sampling.Variates;
import io.nosqlbench.probability.source.Source;

import java.util.Objects;

/// Laplace (double exponential) distribution with location μ and scale b.
///
/// ```
///   density(x) = exp(-|x-μ|/b) / 2b
///   cdf(x)     = exp((x-μ)/b)/2          x < μ
///              = 1 - exp(-(x-μ)/b)/2     x >= μ
///   inverse(p) = μ + b·ln(2p)            p < 1/2
///              = μ - b·ln(2 - 2p)        p >= 1/2
/// ```
public final class Laplace implements Continuous, Inverse, Sample,
    Mean, Variance, Skewness, Kurtosis, Median, Modes, Entropy {

    private final double mu;
    private final double b;

    /// @param mu the location μ
    /// @param b the scale; must be positive
    /// @throws IllegalArgumentException if b is not positive or mu is not finite
    public Laplace(double mu, double b) {
        this.mu = Checks.finite("Location", mu);
        this.b = Checks.positive("Scale", b);
    }

    public double getMu() {
        return mu;
    }

    public double getB() {
        return b;
    }

    @Override
    public double cdf(double x) {
        if (x < mu) {
            return 0.5 * Math.exp((x - mu) / b);
        }
        return 1.0 - 0.5 * Math.exp(-(x - mu) / b);
    }

    @Override
    public double density(double x) {
        return Math.exp(-Math.abs(x - mu) / b) / (2.0 * b);
    }

    @Override
    public double inverse(double p) {
        Checks.probability(p);
        if (p == 0.0) {
            return Double.NEGATIVE_INFINITY;
        }
        if (p == 1.0) {
            return Double.POSITIVE_INFINITY;
        }
        if (p < 0.5) {
            return mu + b * Math.log(2.0 * p);
        }
        return mu - b * Math.log(2.0 - 2.0 * p);
    }

    @Override
    public double sample(Source source) {
        return inverse(Variates.openUniform(source));
    }

    @Override
    public double mean() {
        return mu;
    }

    @Override
    public double variance() {
        return 2.0 * b * b;
    }

    @Override
    public double skewness() {
        return 0.0;
    }

    @Override
    public double kurtosis() {
        return 3.0;
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
        return 1.0 + Math.log(2.0 * b);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Laplace)) return false;
        Laplace that = (Laplace) o;
        return Double.compare(that.mu, mu) == 0 &&
               Double.compare(that.b, b) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mu, b);
    }

    @Override
    public String toString() {
        return "Laplace[mu=" + mu + ", b=" + b + "]";
    }
}
