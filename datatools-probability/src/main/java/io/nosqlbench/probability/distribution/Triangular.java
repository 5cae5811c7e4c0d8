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
 * Triangular distribution on [a, b] with mode c.
 *
 * <pre>{@code
 *              density
 *   2/(b-a) ┤        /\
 *           │       /  \
 *           │      /    \
 *           │     /      \
 *         0 ┼────┴───┴────┴────
 *                a   c    b
 *
 * cdf(x) = (x-a)² / ((b-a)(c-a))          a <= x <= c
 *        = 1 - (b-x)² / ((b-a)(b-c))      c <  x <= b
 * }</pre>
 *
 * <p>The mode may coincide with either bound, giving a right or left
 * triangle.
 */
public final class Triangular implements Continuous, Inverse, Sample,
    Mean, Variance, Skewness, Kurtosis, Median, Modes, Entropy {

    private final double a;
    private final double b;
    private final double c;

    /**
     * @param a the lower bound
     * @param b the upper bound; must exceed a
     * @param c the mode; must lie in [a, b]
     * @throws IllegalArgumentException if the parameters are not finite or not ordered
     */
    public Triangular(double a, double b, double c) {
        Checks.finite("Lower bound", a);
        Checks.finite("Upper bound", b);
        Checks.finite("Mode", c);
        if (!(a < b)) {
            throw new IllegalArgumentException("Lower bound must be below upper bound, got: [" + a + ", " + b + "]");
        }
        if (c < a || c > b) {
            throw new IllegalArgumentException("Mode must lie in [" + a + ", " + b + "], got: " + c);
        }
        this.a = a;
        this.b = b;
        this.c = c;
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

    @Override
    public double cdf(double x) {
        if (x <= a) {
            return 0.0;
        }
        if (x >= b) {
            return 1.0;
        }
        if (x <= c) {
            return (x - a) * (x - a) / ((b - a) * (c - a));
        }
        return 1.0 - (b - x) * (b - x) / ((b - a) * (b - c));
    }

    @Override
    public double density(double x) {
        if (x < a || x > b) {
            return 0.0;
        }
        if (x == c) {
            return 2.0 / (b - a);
        }
        if (x < c) {
            return 2.0 * (x - a) / ((b - a) * (c - a));
        }
        return 2.0 * (b - x) / ((b - a) * (b - c));
    }

    @Override
    public double inverse(double p) {
        Checks.probability(p);
        double split = (c - a) / (b - a);
        if (p <= split) {
            return a + Math.sqrt(p * (b - a) * (c - a));
        }
        return b - Math.sqrt((1.0 - p) * (b - a) * (b - c));
    }

    @Override
    public double sample(Source source) {
        return inverse(source.uniform());
    }

    @Override
    public double mean() {
        return (a + b + c) / 3.0;
    }

    @Override
    public double variance() {
        return spread() / 18.0;
    }

    @Override
    public double skewness() {
        return Math.sqrt(2.0) * (a + b - 2.0 * c) * (2.0 * a - b - c) * (a - 2.0 * b + c)
            / (5.0 * Math.pow(spread(), 1.5));
    }

    @Override
    public double kurtosis() {
        return -0.6;
    }

    @Override
    public double median() {
        if (c >= 0.5 * (a + b)) {
            return a + Math.sqrt(0.5 * (b - a) * (c - a));
        }
        return b - Math.sqrt(0.5 * (b - a) * (b - c));
    }

    @Override
    public double[] modes() {
        return new double[]{c};
    }

    @Override
    public double entropy() {
        return 0.5 + Math.log(0.5 * (b - a));
    }

    private double spread() {
        return a * a + b * b + c * c - a * b - a * c - b * c;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Triangular)) return false;
        Triangular that = (Triangular) o;
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
        return "Triangular[a=" + a + ", b=" + b + ", c=" + c + "]";
    }
}
