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

/// Continuous uniform distribution on `[a, b]`.
///
/// ```
///   density(x) = 1/(b-a)            for a <= x <= b
///   cdf(x)     = (x-a)/(b-a)        clamped to [0, 1]
///   inverse(p) = a + (b-a)·p
/// ```
///
/// The density is flat, so no modes are reported.
public final class Uniform implements Continuous, Inverse, Sample,
    Mean, Variance, Skewness, Kurtosis, Median, Entropy {

    private final double a;
    private final double b;

    /// @param a the lower bound
    /// @param b the upper bound; must exceed a
    /// @throws IllegalArgumentException if the bounds are not finite or a >= b
    public Uniform(double a, double b) {
        Checks.finite("Lower bound", a);
        Checks.finite("Upper bound", b);
        if (!(a < b)) {
            throw new IllegalArgumentException("Lower bound must be below upper bound, got: [" + a + ", " + b + "]");
        }
        this.a = a;
        this.b = b;
    }

    public double getA() {
        return a;
    }

    public double getB() {
        return b;
    }

    @Override
    public double cdf(double x) {
        if (x <= a) {
            return 0.0;
        }
        if (x >= b) {
            return 1.0;
        }
        return (x - a) / (b - a);
    }

    @Override
    public double density(double x) {
        return x < a || x > b ? 0.0 : 1.0 / (b - a);
    }

    @Override
    public double inverse(double p) {
        return a + (b - a) * Checks.probability(p);
    }

    @Override
    public double sample(Source source) {
        return a + (b - a) * source.uniform();
    }

    @Override
    public double mean() {
        return 0.5 * (a + b);
    }

    @Override
    public double variance() {
        double width = b - a;
        return width * width / 12.0;
    }

    @Override
    public double skewness() {
        return 0.0;
    }

    @Override
    public double kurtosis() {
        return -1.2;
    }

    @Override
    public double median() {
        return 0.5 * (a + b);
    }

    @Override
    public double entropy() {
        return Math.log(b - a);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Uniform)) return false;
        Uniform that = (Uniform) o;
        return Double.compare(that.a, a) == 0 &&
               Double.compare(that.b, b) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(a, b);
    }

    @Override
    public String toString() {
        return "Uniform[a=" + a + ", b=" + b + "]";
    }
}
