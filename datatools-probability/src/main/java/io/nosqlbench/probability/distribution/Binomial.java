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

import io.nosqlbench.probability.numeric.BinomialMass;
import io.nosqlbench.probability.numeric.BinomialQuantile;
import io.nosqlbench.probability.source.Source;

import java.util.Objects;

/**
 * Binomial distribution: the number of successes in n independent trials with
 * success probability p.
 *
 * <h2>Evaluation</h2>
 *
 * <table>
 *   <caption>Algorithms</caption>
 *   <tr><th>Operation</th><th>Method</th><th>Cost</th></tr>
 *   <tr><td>mass</td><td>Loader saddle point</td><td>O(1)</td></tr>
 *   <tr><td>cdf</td><td>regularized incomplete beta I_q(n-k, k+1)</td><td>O(1) in n</td></tr>
 *   <tr><td>inverse</td><td>summation, normal series or Newton, then exact correction</td><td>O(n) below the summation limit, otherwise O(log n)</td></tr>
 * </table>
 *
 * <p>Trial counts are {@code long}: a billion trials is an ordinary input. See
 * {@link BinomialQuantile} for how the inverse picks its algorithm.
 *
 * <h2>Moments</h2>
 *
 * <pre>{@code
 * Mean = np
 * Variance = npq
 * Skewness = (1 - 2p)/√(npq)
 * Kurtosis (excess) = (1 - 6pq)/(npq)
 * }</pre>
 */
public final class Binomial implements Discrete, DiscreteInverse, DiscreteSample,
    Mean, Variance, Skewness, Kurtosis, Median, DiscreteModes, Entropy {

    private static final double LN_2 = Math.log(2.0);

    private final long n;
    private final double p;
    private final double q;
    private final double np;
    private final double npq;
    private final BinomialQuantile.Options options;

    /**
     * Constructs a binomial distribution with default quantile options.
     *
     * @param n the number of trials; must be non-negative
     * @param p the success probability, in (0, 1)
     * @throws IllegalArgumentException if n is negative or p is not in (0, 1)
     */
    public Binomial(long n, double p) {
        this(n, p, BinomialQuantile.Options.defaults());
    }

    /**
     * Constructs a binomial distribution.
     *
     * @param n the number of trials; must be non-negative
     * @param p the success probability, in (0, 1)
     * @param options thresholds for the quantile algorithm
     * @throws IllegalArgumentException if n is negative or p is not in (0, 1)
     */
    public Binomial(long n, double p, BinomialQuantile.Options options) {
        this(n, p, 1.0 - p, options);
    }

    private Binomial(long n, double p, double q, BinomialQuantile.Options options) {
        if (n < 0) {
            throw new IllegalArgumentException("Number of trials must be non-negative, got: " + n);
        }
        if (!(p > 0.0 && p <= 1.0 && q > 0.0 && q <= 1.0)) {
            throw new IllegalArgumentException("Success probability must be in (0, 1), got: " + p);
        }
        this.n = n;
        this.p = p;
        this.q = q;
        this.np = n * p;
        this.npq = np * q;
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Creates a binomial distribution from its failure probability.
     *
     * @param n the number of trials; must be non-negative
     * @param q the failure probability, in (0, 1)
     * @return the distribution
     * @throws IllegalArgumentException if n is negative or q is not in (0, 1)
     */
    public static Binomial withFailure(long n, double q) {
        if (!(q > 0.0 && q < 1.0)) {
            throw new IllegalArgumentException("Failure probability must be in (0, 1), got: " + q);
        }
        return new Binomial(n, 1.0 - q, q, BinomialQuantile.Options.defaults());
    }

    public long getN() {
        return n;
    }

    public double getP() {
        return p;
    }

    public double getQ() {
        return q;
    }

    public BinomialQuantile.Options getOptions() {
        return options;
    }

    @Override
    public double cdf(double x) {
        if (x < 0.0) {
            return 0.0;
        }
        if (x >= n) {
            return 1.0;
        }
        return BinomialMass.cumulative(n, p, q, (long) Math.floor(x));
    }

    @Override
    public double mass(long k) {
        return BinomialMass.mass(n, p, q, k);
    }

    @Override
    public long inverse(double u) {
        return BinomialQuantile.inverse(n, p, q, Checks.probability(u), options);
    }

    @Override
    public long sample(Source source) {
        return BinomialQuantile.inverse(n, p, q, source.uniform(), options);
    }

    @Override
    public double mean() {
        return np;
    }

    @Override
    public double variance() {
        return npq;
    }

    @Override
    public double skewness() {
        return (1.0 - 2.0 * p) / Math.sqrt(npq);
    }

    @Override
    public double kurtosis() {
        return (1.0 - 6.0 * p * q) / npq;
    }

    /**
     * Returns the median.
     *
     * <p>Closed forms apply when np is integral, when p is far enough from 1/2,
     * or when np is within min(p, q) of an integer. Large, well-spread
     * distributions use ⌊np⌋. Anything else falls back to {@code inverse(0.5)}.
     *
     * @return the median
     */
    @Override
    public double median() {
        if (np == Math.floor(np) || (p == 0.5 && n % 2 != 0)) {
            return np;
        }
        double rounded = Math.floor(np + 0.5);
        if (p <= 1.0 - LN_2 || p >= LN_2 || Math.abs(rounded - np) <= Math.min(p, q)) {
            return rounded;
        }
        if (n > 1000 && npq > 80.0) {
            return Math.floor(np);
        }
        return inverse(0.5);
    }

    /**
     * Returns the mode ⌊(n+1)p⌋, or both (n+1)p - 1 and (n+1)p when (n+1)p is
     * an integer.
     *
     * @return one or two modes
     */
    @Override
    public long[] modes() {
        if (p == 1.0) {
            return new long[]{n};
        }
        double r = p * (n + 1);
        double floor = Math.floor(r);
        if (r == floor) {
            long upper = Math.min((long) r, n);
            return new long[]{upper - 1, upper};
        }
        return new long[]{(long) floor};
    }

    /**
     * Returns the entropy, by summation outward from the mode or, for large well-spread
     * distributions, by the normal approximation ½·ln(2πe·npq).
     *
     * @return the entropy in nats
     */
    @Override
    public double entropy() {
        if (n > 10000 && npq > 80.0) {
            return 0.5 * (Math.log(2.0 * Math.PI * npq) + 1.0);
        }
        // the mass is unimodal, so each walk ends where it underflows
        long mode = modes()[0];
        double sum = 0.0;
        for (long k = mode; k >= 0; k--) {
            double m = mass(k);
            if (m == 0.0) {
                break;
            }
            sum -= m * Math.log(m);
        }
        for (long k = mode + 1; k <= n; k++) {
            double m = mass(k);
            if (m == 0.0) {
                break;
            }
            sum -= m * Math.log(m);
        }
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Binomial)) return false;
        Binomial that = (Binomial) o;
        return n == that.n &&
               Double.compare(that.p, p) == 0 &&
               Double.compare(that.q, q) == 0 &&
               options.equals(that.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(n, p, q, options);
    }

    @Override
    public String toString() {
        return "Binomial[n=" + n + ", p=" + p + "]";
    }
}
