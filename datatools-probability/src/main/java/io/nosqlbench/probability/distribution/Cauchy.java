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

/// Cauchy distribution with location x₀ and scale γ.
///
/// ```
///   density(x) = γ / (π·(γ² + (x-x₀)²))
///   cdf(x)     = 1/2 + atan((x-x₀)/γ)/π
///   inverse(p) = x₀ + γ·tan(π(p - 1/2))
/// ```
///
/// Mean, variance and higher moments do not exist, so only the median, mode
/// and entropy are offered as summaries.
///
/// Samples are the ratio of two standard normal variates, `x₀ + γ·a/(|b| + ε)`.
public final class Cauchy implements Continuous, Inverse, Sample, Median, Modes, Entropy {

    private final double x0;
    private final double gamma;

    /// @param x0 the location x₀
    /// @param gamma the scale γ; must be positive
    /// @throws IllegalArgumentException if gamma is not positive or x0 is not finite
    public Cauchy(double x0, double gamma) {
        this.x0 = Checks.finite("Location", x0);
        this.gamma = Checks.positive("Scale", gamma);
    }

    public double getX0() {
        return x0;
    }

    public double getGamma() {
        return gamma;
    }

    @Override
    public double cdf(double x) {
        return 0.5 + Math.atan((x - x0) / gamma) / Math.PI;
    }

    @Override
    public double density(double x) {
        double d = x - x0;
        return gamma / (Math.PI * (gamma * gamma + d * d));
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
        return x0 + gamma * Math.tan(Math.PI * (p - 0.5));
    }

    @Override
    public double sample(Source source) {
        double a = Variates.standardNormal(source);
        double b = Variates.standardNormal(source);
        return x0 + gamma * a / (Math.abs(b) + Math.ulp(1.0));
    }

    @Override
    public double median() {
        return x0;
    }

    @Override
    public double[] modes() {
        return new double[]{x0};
    }

    @Override
    public double entropy() {
        return Math.log(4.0 * Math.PI * gamma);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Cauchy)) return false;
        Cauchy that = (Cauchy) o;
        return Double.compare(that.x0, x0) == 0 &&
               Double.compare(that.gamma, gamma) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x0, gamma);
    }

    @Override
    public String toString() {
        return "Cauchy[x0=" + x0 + ", gamma=" + gamma + "]";
    }
}
