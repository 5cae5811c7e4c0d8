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

import java.util.Objects;

/**
 * Exponential distribution with rate λ.
 *
 * <pre>{@code
 * density(x) = λ·e^(-λx)           x >= 0
 * cdf(x)     = 1 - e^(-λx)         computed as -expm1(-λx)
 * inverse(p) = -ln(1-p)/λ          computed as -log1p(-p)/λ
 * }</pre>
 *
 * <p>Sampling uses the inverse transform; with a uniform in [0, 1) the result
 * is always finite.
 */
public final class Exponential implements Continuous, Inverse, Sample,
    Mean, Variance, Skewness, Kurtosis, Median, Modes, Entropy {

    private final double lambda;

    /**
     * @param lambda the rate λ; must be positive
     * @throws IllegalArgumentException if lambda is not positive
     */
    public Exponential(double lambda) {
        this.lambda = Checks.positive("Rate", lambda);
    }

    public double getLambda() {
        return lambda;
    }

    @Override
    public double cdf(double x) {
        return x <= 0.0 ? 0.0 : -Math.expm1(-lambda * x);
    }

    @Override
    public double density(double x) {
        return x < 0.0 ? 0.0 : lambda * Math.exp(-lambda * x);
    }

    @Override
    public double inverse(double p) {
        if (Checks.probability(p) == 0.0) {
            return 0.0;
        }
        return -Math.log1p(-p) / lambda;
    }

    @Override
    public double sample(Source source) {
        return -Math.log1p(-source.uniform()) / lambda;
    }

    @Override
    public double mean() {
        return 1.0 / lambda;
    }

    @Override
    public double variance() {
        return 1.0 / (lambda * lambda);
    }

    @Override
    public double skewness() {
        return 2.0;
    }

    @Override
    public double kurtosis() {
        return 6.0;
    }

    @Override
    public double median() {
        return Math.log(2.0) / lambda;
    }

    @Override
    public double[] modes() {
        return new double[]{0.0};
    }

    @Override
    public double entropy() {
        return 1.0 - Math.log(lambda);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Exponential)) return false;
        Exponential that = (Exponential) o;
        return Double.compare(that.lambda, lambda) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lambda);
    }

    @Override
    public String toString() {
        return "Exponential[lambda=" + lambda + "]";
    }
}
