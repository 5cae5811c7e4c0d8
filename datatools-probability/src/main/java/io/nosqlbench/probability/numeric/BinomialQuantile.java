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

package io.nosqlbench.probability.numeric;

import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Inverse of the Binomial CDF: the smallest k with P(X <= k) >= u.
///
/// # Regime selection
///
/// ```
///                         n < summationLimit ?
///                        ┌─────────┴─────────┐
///                       yes                  no
///                        │                    │
///                   SUMMATION        npq > normalVarianceThreshold ?
///              (from 0 or from n,     ┌───────┴───────┐
///               whichever side       yes              no
///               u falls on)           │                │
///                               NORMAL SERIES     SAFEGUARDED
///                               (Moorhead, O(1))  NEWTON from mode
///                        │                │                │
///                        └────────────────┼────────────────┘
///                                         ▼
///                               LOCAL REFINEMENT
///                   exponential search + bisection on the cdf
/// ```
///
/// Every regime produces a guess that the refinement step turns into the
/// exact answer, so the result is always consistent with
/// [BinomialMass#cumulative(long, double, double, long)].
///
/// # Termination
///
/// Newton keeps a bracket `lo < answer <= hi`. A step that is not finite,
/// leaves the bracket, or fails to halve it twice in a row is replaced by
/// bisection, so the loop ends in O(log n) iterations. The iteration cap in
/// [Options] only guards against a broken cdf.
///
/// # Reference
///
/// R. Moorhead, "Efficient evaluation of the inverse binomial cumulative
/// distribution function where the number of trials is large," 2013.
public final class BinomialQuantile {

    private static final Logger logger = LogManager.getLogger(BinomialQuantile.class);

    /// Regime that produced the initial guess.
    public enum Regime {
        SUMMATION,
        NORMAL_SERIES,
        NEWTON
    }

    private BinomialQuantile() {
        // Utility class, no instantiation
    }

    /// Smallest k in [0, n] with cdf(k) >= u.
    ///
    /// @param n number of trials
    /// @param p success probability, in (0, 1)
    /// @param q failure probability, 1 - p
    /// @param u target probability in [0, 1]
    /// @param options regime thresholds and iteration cap
    /// @return the quantile; 0 for u = 0 and n for u = 1
    /// @throws TooManyIterationsException if the Newton regime exceeds its cap
    public static long inverse(long n, double p, double q, double u, Options options) {
        if (u <= 0.0) {
            return 0L;
        }
        if (u >= 1.0) {
            return n;
        }
        long guess;
        switch (regime(n, p, q, options)) {
            case SUMMATION:
                guess = summation(n, p, q, u, options);
                break;
            case NORMAL_SERIES:
                guess = normalSeries(n, p, q, u);
                break;
            default:
                guess = newton(n, p, q, u, options);
                break;
        }
        return refine(n, p, q, u, guess);
    }

    /// Returns the regime used for the initial guess.
    ///
    /// @param n number of trials
    /// @param p success probability
    /// @param q failure probability
    /// @param options regime thresholds
    /// @return the regime
    public static Regime regime(long n, double p, double q, Options options) {
        if (n < options.summationLimit()) {
            return Regime.SUMMATION;
        }
        if (n * p * q > options.normalVarianceThreshold()) {
            return Regime.NORMAL_SERIES;
        }
        return Regime.NEWTON;
    }

    /// Direct summation of the mass, walking from whichever end u is closer to.
    ///
    /// Successive masses follow the ratio `(p/q)(n-k+1)/k`, so each step is one
    /// multiply. The walk stops at the end of the support if rounding keeps the
    /// running sum from crossing u.
    static long summation(long n, double p, double q, double u, Options options) {
        long k = 1;
        if (u <= BinomialMass.cumulative(n, p, q, n / 2)) {
            double a = Math.pow(q, n);
            if (a == 0.0) {
                logger.debug("q^n underflows for n={}, q={}; using Newton instead of summation", n, q);
                return newton(n, p, q, u, options);
            }
            double ratio = p / q;
            double sum = a - u;
            while (sum < 0.0 && k <= n) {
                a *= ratio * (double) (n - k + 1) / (double) k;
                sum += a;
                k++;
            }
            return k - 1;
        }
        double a = Math.pow(p, n);
        if (a == 0.0) {
            logger.debug("p^n underflows for n={}, p={}; using Newton instead of summation", n, p);
            return newton(n, p, q, u, options);
        }
        double ratio = q / p;
        double sum = (1.0 - u) - a;
        while (sum >= 0.0 && k <= n) {
            a *= ratio * (double) (n - k + 1) / (double) k;
            sum -= a;
            k++;
        }
        return n - k + 1;
    }

    /// Cornish-Fisher style correction series around the normal approximation,
    /// through the σ⁻⁴ term.
    static long normalSeries(long n, double p, double q, double u) {
        double w = GaussianQuantile.standard(u);
        double w2 = w * w;
        double w3 = w2 * w;
        double w4 = w2 * w2;
        double w5 = w4 * w;
        double w6 = w3 * w3;

        double sd = Math.sqrt(n * p * q);
        double sdm1 = 1.0 / sd;
        double sdm2 = sdm1 * sdm1;
        double sdm3 = sdm2 * sdm1;
        double sdm4 = sdm2 * sdm2;

        double p2 = p * p;
        double p3 = p2 * p;
        double p4 = p2 * p2;
        double s = 2.0 * p - 1.0;

        double x = n * p + sd * w
            + ((p + 1.0) / 3.0 - s * w2 / 6.0)
            + sdm1 * (w3 * (2.0 * p2 - 2.0 * p - 1.0) / 72.0
                - w * (7.0 * p2 - 7.0 * p + 1.0) / 36.0)
            + sdm2 * s * (p + 1.0) * (p - 2.0) * (3.0 * w4 + 7.0 * w2 - 16.0) / 1620.0
            + sdm3 * (w5 * (4.0 * p4 - 8.0 * p3 - 48.0 * p2 + 52.0 * p - 23.0) / 17280.0
                + w3 * (256.0 * p4 - 512.0 * p3 - 147.0 * p2 + 403.0 * p - 137.0) / 38880.0
                - w * (433.0 * p4 - 866.0 * p3 - 921.0 * p2 + 1354.0 * p - 671.0) / 38880.0)
            + sdm4 * (w6 * s * (p2 - p + 1.0) * (p2 - p + 19.0) / 34020.0
                + w4 * s * (9.0 * p4 - 18.0 * p3 - 35.0 * p2 + 44.0 * p - 25.0) / 15120.0
                + w2 * s * (923.0 * p4 - 1846.0 * p3 + 5271.0 * p2 - 4348.0 * p + 5189.0) / 408240.0
                - 4.0 * s * (p + 1.0) * (p - 2.0) * (23.0 * p2 - 23.0 * p + 2.0) / 25515.0);

        return clamp(Math.floor(x), n);
    }

    /// Newton iteration on the cdf from the mode, safeguarded by bisection.
    static long newton(long n, double p, double q, double u, Options options) {
        long lo = -1L;
        long hi = n;
        long x = clamp(Math.floor((n + 1) * p), n);
        boolean slow = false;

        for (int i = 0; i < options.maxIterations(); i++) {
            long width = hi - lo;
            double c = BinomialMass.cumulative(n, p, q, x);
            if (c >= u) {
                hi = Math.min(hi, x);
            } else {
                lo = Math.max(lo, x);
            }
            if (hi - lo <= 1) {
                return hi;
            }

            double step = (u - c) / BinomialMass.mass(n, p, q, x);
            if (Math.abs(step) < 0.5) {
                return x;
            }
            boolean halved = 2 * (hi - lo) <= width;
            long next = Double.isFinite(step) ? x + Math.round(step) : lo;
            if (next <= lo || next >= hi || (slow && !halved)) {
                logger.debug("Bisecting [{}, {}] for n={}, p={}, u={} (newton step {})", lo, hi, n, p, u, step);
                next = lo + (hi - lo) / 2;
            }
            slow = !halved;
            x = next;
        }
        logger.warn("Binomial quantile did not converge in {} iterations: n={}, p={}, u={}",
            options.maxIterations(), n, p, u);
        throw new TooManyIterationsException(options.maxIterations());
    }

    /// Moves a guess to the smallest k with cdf(k) >= u.
    static long refine(long n, double p, double q, double u, long guess) {
        long x = Math.max(0L, Math.min(n, guess));
        long lo;
        long hi;
        if (BinomialMass.cumulative(n, p, q, x) >= u) {
            hi = x;
            long step = 1L;
            lo = x - step;
            while (lo >= 0 && BinomialMass.cumulative(n, p, q, lo) >= u) {
                hi = lo;
                step <<= 1;
                lo = hi - step;
            }
            lo = Math.max(lo, -1L);
        } else {
            lo = x;
            long step = 1L;
            hi = x + step;
            while (hi < n && BinomialMass.cumulative(n, p, q, hi) < u) {
                lo = hi;
                step <<= 1;
                hi = lo + step;
            }
            hi = Math.min(hi, n);
        }
        while (hi - lo > 1) {
            long mid = lo + (hi - lo) / 2;
            if (BinomialMass.cumulative(n, p, q, mid) >= u) {
                hi = mid;
            } else {
                lo = mid;
            }
        }
        return hi;
    }

    private static long clamp(double x, long n) {
        if (!(x > 0.0)) {
            return 0L;
        }
        if (x >= n) {
            return n;
        }
        return (long) x;
    }

    /// Thresholds and limits for [BinomialQuantile].
    ///
    /// ```java
    /// BinomialQuantile.Options options = BinomialQuantile.Options.builder()
    ///     .summationLimit(500)
    ///     .normalVarianceThreshold(120.0)
    ///     .build();
    /// ```
    public static final class Options {

        private static final Options DEFAULTS = new Builder().build();

        private final long summationLimit;
        private final double normalVarianceThreshold;
        private final int maxIterations;

        private Options(Builder builder) {
            this.summationLimit = builder.summationLimit;
            this.normalVarianceThreshold = builder.normalVarianceThreshold;
            this.maxIterations = builder.maxIterations;
        }

        /// Trial counts below this limit use direct summation (default 1000).
        ///
        /// @return the summation limit
        public long summationLimit() {
            return summationLimit;
        }

        /// Above this value of n·p·q the normal series is used (default 80).
        ///
        /// @return the variance threshold
        public double normalVarianceThreshold() {
            return normalVarianceThreshold;
        }

        /// Newton iteration cap (default 200).
        ///
        /// @return the iteration cap
        public int maxIterations() {
            return maxIterations;
        }

        /// Returns the default options.
        ///
        /// @return the default options
        public static Options defaults() {
            return DEFAULTS;
        }

        /// Returns a new builder.
        ///
        /// @return a new builder instance
        public static Builder builder() {
            return new Builder();
        }

        /// Returns a builder initialized with these options' values.
        ///
        /// @return a builder pre-populated with current values
        public Builder toBuilder() {
            return new Builder()
                .summationLimit(this.summationLimit)
                .normalVarianceThreshold(this.normalVarianceThreshold)
                .maxIterations(this.maxIterations);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Options)) return false;
            Options that = (Options) o;
            return summationLimit == that.summationLimit
                && Double.compare(normalVarianceThreshold, that.normalVarianceThreshold) == 0
                && maxIterations == that.maxIterations;
        }

        @Override
        public int hashCode() {
            int result = Long.hashCode(summationLimit);
            result = 31 * result + Double.hashCode(normalVarianceThreshold);
            result = 31 * result + maxIterations;
            return result;
        }

        @Override
        public String toString() {
            return "Options{" +
                "summationLimit=" + summationLimit +
                ", normalVarianceThreshold=" + normalVarianceThreshold +
                ", maxIterations=" + maxIterations +
                '}';
        }

        /// Builder for Options.
        public static final class Builder {
            private long summationLimit = 1000L;
            private double normalVarianceThreshold = 80.0;
            private int maxIterations = 200;

            Builder() {
            }

            /// @param limit trial count below which summation is used; must be >= 0
            /// @return this builder
            public Builder summationLimit(long limit) {
                if (limit < 0) {
                    throw new IllegalArgumentException("Summation limit must be non-negative, got: " + limit);
                }
                this.summationLimit = limit;
                return this;
            }

            /// @param threshold n·p·q above which the normal series is used; must be positive
            /// @return this builder
            public Builder normalVarianceThreshold(double threshold) {
                if (!(threshold > 0.0)) {
                    throw new IllegalArgumentException("Variance threshold must be positive, got: " + threshold);
                }
                this.normalVarianceThreshold = threshold;
                return this;
            }

            /// @param iterations Newton iteration cap; must be >= 1
            /// @return this builder
            public Builder maxIterations(int iterations) {
                if (iterations < 1) {
                    throw new IllegalArgumentException("Iteration cap must be at least 1, got: " + iterations);
                }
                this.maxIterations = iterations;
                return this;
            }

            /// Builds the Options.
            ///
            /// @return the configured options
            public Options build() {
                return new Options(this);
            }
        }
    }
}
