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

/// PERT distribution: a Beta on [a, c] whose shape is set by a most likely value b.
///
/// # Shape parameters
///
/// ```
///   α = (4b + c - 5a) / (c - a)
///   β = (5c - a - 4b) / (c - a)
///   α + β = 6
/// ```
///
/// The three-point estimate (minimum, most likely, maximum) puts four times the
/// weight on the most likely value: the mean is `(a + 4b + c) / 6`.
///
/// All functions delegate to the underlying [Beta].
public final class Pert implements Continuous, Inverse, Sample,
    Mean, Variance, Skewness, Kurtosis, Median, Modes, Entropy {

    private final double a;
    private final double b;
    private final double c;
    private final Beta beta;

    /// @param a the minimum
    /// @param b the most likely value; must lie strictly between a and c
    /// @param c the maximum
    /// @throws IllegalArgumentException unless a < b < c with all values finite
    public Pert(double a, double b, double c) {
        Checks.finite("Minimum", a);
        Checks.finite("Most likely value", b);
        Checks.finite("Maximum", c);
        if (!(a < b && b < c)) {
            throw new IllegalArgumentException("PERT requires a < b < c, got: a=" + a + ", b=" + b + ", c=" + c);
        }
        this.a = a;
        this.b = b;
        this.c = c;
        double alpha = (4.0 * b + c - 5.0 * a) / (c - a);
        double betaShape = (5.0 * c - a - 4.0 * b) / (c - a);
        this.beta = new Beta(alpha, betaShape, a, c);
    }

    public double getA() {
        return a;
    }

    public double getB() {
        return b;
    }

    public double getC() {
        return c;
    }

    /// @return the shape α of the underlying beta
    public double getAlpha() {
        return beta.getAlpha();
    }

    /// @return the shape β of the underlying beta
    public double getBeta() {
        return beta.getBeta();
    }

    @Override
    public double cdf(double x) {
        return beta.cdf(x);
    }

    @Override
    public double density(double x) {
        return beta.density(x);
    }

    @Override
    public double inverse(double p) {
        return beta.inverse(p);
    }

    @Override
    public double sample(Source source) {
        return beta.sample(source);
    }

    @Override
    public double mean() {
        return (a + 4.0 * b + c) / 6.0;
    }

    @Override
    public double variance() {
        double mean = mean();
        return (mean - a) * (c - mean) / 7.0;
    }

    @Override
    public double skewness() {
        return beta.skewness();
    }

    @Override
    public double kurtosis() {
        return beta.kurtosis();
    }

    @Override
    public double median() {
        return beta.median();
    }

    @Override
    public double[] modes() {
        return new double[]{b};
    }

    @Override
    public double entropy() {
        return beta.entropy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Pert)) return false;
        Pert that = (Pert) o;
        return Double.compare(that.a, a) == 0 &&
               Double.compare(that.b, b) == 0 &&
               Double.compare(that.c, c) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(a, b, c);
    }

    @Override
    public String toString() {
        return "Pert[a=" + a + ", b=" + b + ", c=" + c + "]";
    }
}
