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

/**
 * Logistic distribution with location μ and scale s.
 *
 * <pre>{@code
 * cdf(x)     = 1 / (1 + e^(-(x-μ)/s))
 * density(x) = e^(-z) / (s·(1 + e^(-z))²),  z = |x-μ|/s
 * inverse(p) = μ - s·ln(1/p - 1)
 * }</pre>
 *
 * <p>The density is symmetric, so it is evaluated at |x-μ| to keep the
 * exponential from overflowing in the far tails.
 */
public final class Logistic implements Continuous, Inverse, Sample,
    Mean, Variance, Skewness, Kurtosis, Median, Modes, Entropy {

    private final double mu;
    private final double s;

    /**
     * @param mu the location μ
     * @param s the scale; must be positive
     * @throws IllegalArgumentException if s is not positive or mu is not finite
     */
    public Logistic(double mu, double s) {
        this.mu = Checks.finite("Location", mu);
        this.s = Checks.positive("Scale", s);
    }

    public double getMu() {
        return mu;
    }

    public double getS() {
        return s;
    }

    @Override
    public double cdf(double x) {
        return 1.0 / (1.0 + Math.exp(-(x - mu) / s));
    }

    @Override
    public double density(double x) {
        double e = Math.exp(-Math.abs(x - mu) / s);
        double denominator = 1.0 + e;
        return e / (s * denominator * denominator);
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
        return mu - s * Math.log(1.0 / p - 1.0);
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
        return Math.PI * Math.PI * s * s / 3.0;
    }

    @Override
    public double skewness() {
        return 0.0;
    }

    @Override
    public double kurtosis() {
        return 1.2;
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
        return Math.log(s) + 2.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Logistic)) return false;
        Logistic that = (Logistic) o;
        return Double.compare(that.mu, mu) == 0 &&
               Double.compare(that.s, s) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mu, s);
    }

    @Override
    public String toString() {
        return "Logistic[mu=" + mu + ", s=" + s + "]";
    }
}
