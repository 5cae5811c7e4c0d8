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

/// Bernoulli distribution: outcome 1 with probability p, 0 with probability q = 1 - p.
///
/// Both p and q are kept so that a distribution built from a tiny failure
/// probability ([#withFailure(double)]) does not lose it to `1 - p` rounding.
public final class Bernoulli implements Discrete, DiscreteInverse, DiscreteSample,
    Mean, Variance, Skewness, Kurtosis, Median, DiscreteModes, Entropy {

    private final double p;
    private final double q;

    /// @param p the success probability, in (0, 1)
    /// @throws IllegalArgumentException if p is not in (0, 1)
    public Bernoulli(double p) {
        this(p, 1.0 - p);
    }

    private Bernoulli(double p, double q) {
        if (!(p > 0.0 && p <= 1.0 && q > 0.0 && q <= 1.0)) {
            throw new IllegalArgumentException("Success probability must be in (0, 1), got: " + p);
        }
        this.p = p;
        this.q = q;
    }

    /// Creates a Bernoulli distribution from its failure probability.
    ///
    /// @param q the failure probability, in (0, 1)
    /// @return the distribution
    /// @throws IllegalArgumentException if q is not in (0, 1)
    public static Bernoulli withFailure(double q) {
        if (!(q > 0.0 && q < 1.0)) {
            throw new IllegalArgumentException("Failure probability must be in (0, 1), got: " + q);
        }
        return new Bernoulli(1.0 - q, q);
    }

    public double getP() {
        return p;
    }

    public double getQ() {
        return q;
    }

    @Override
    public double cdf(double x) {
        if (x < 0.0) {
            return 0.0;
        }
        return x < 1.0 ? q : 1.0;
    }

    @Override
    public double mass(long k) {
        if (k == 0) {
            return q;
        }
        return k == 1 ? p : 0.0;
    }

    @Override
    public long inverse(double u) {
        return Checks.probability(u) <= q ? 0L : 1L;
    }

    @Override
    public long sample(Source source) {
        return source.uniform() < q ? 0L : 1L;
    }

    @Override
    public double mean() {
        return p;
    }

    @Override
    public double variance() {
        return p * q;
    }

    @Override
    public double skewness() {
        return (1.0 - 2.0 * p) / Math.sqrt(p * q);
    }

    @Override
    public double kurtosis() {
        return (1.0 - 6.0 * p * q) / (p * q);
    }

    @Override
    public double median() {
        if (p < 0.5) {
            return 0.0;
        }
        return p > 0.5 ? 1.0 : 0.5;
    }

    @Override
    public long[] modes() {
        if (p < 0.5) {
            return new long[]{0L};
        }
        return p > 0.5 ? new long[]{1L} : new long[]{0L, 1L};
    }

    @Override
    public double entropy() {
        return -(q * Math.log(q) + p * Math.log(p));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bernoulli)) return false;
        Bernoulli that = (Bernoulli) o;
        return Double.compare(that.p, p) == 0 &&
               Double.compare(that.q, q) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(p, q);
    }

    @Override
    public String toString() {
        return "Bernoulli[p=" + p + "]";
    }
}
