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

/// Binomial probability mass by Loader's saddle-point expansion, and its
/// cumulative sum through the regularized incomplete beta function.
///
/// # Why not the textbook formula
///
/// `C(n, k) p^k q^(n-k)` overflows the binomial coefficient and underflows the
/// powers long before the product leaves double range. The saddle-point form
/// works entirely with small correction terms:
///
/// ```
///   ln c = stirlerr(n) - stirlerr(k) - stirlerr(n-k)
///        - d0(k, np) - d0(n-k, nq)
///
///   mass = e^(ln c) · sqrt(n / (2π · k · (n-k)))
/// ```
///
/// where `stirlerr(m) = ln m! - ln(sqrt(2πm) (m/e)^m)` is the Stirling error and
/// `d0(x, y) = x ln(x/y) + y - x` is the deviance.
///
/// # Reference
///
/// C. Loader, "Fast and accurate computation of binomial probabilities," 2000.
public final class BinomialMass {

    private static final double TWO_PI = 2.0 * Math.PI;

    private static final double S0 = 1.0 / 12.0;
    private static final double S1 = 1.0 / 360.0;
    private static final double S2 = 1.0 / 1260.0;
    private static final double S3 = 1.0 / 1680.0;
    private static final double S4 = 1.0 / 1188.0;

    // stirlerr(m) for m = 0..15
    private static final double[] SFE = {
        0.0, 8.106146679532725822e-02, 4.134069595540929409e-02,
        2.767792568499833915e-02, 2.079067210376509311e-02, 1.664469118982119216e-02,
        1.387612882307074800e-02, 1.189670994589177010e-02, 1.041126526197209650e-02,
        9.255462182712732918e-03, 8.330563433362871256e-03, 7.573675487951840794e-03,
        6.942840107209529866e-03, 6.408994188004207068e-03, 5.951370112758847736e-03,
        5.554733551962801371e-03,
    };

    private BinomialMass() {
        // Utility class, no instantiation
    }

    /// Probability of exactly `k` successes in `n` trials.
    ///
    /// @param n number of trials, non-negative
    /// @param p success probability
    /// @param q failure probability, 1 - p
    /// @param k number of successes
    /// @return P(X = k), zero outside [0, n]
    public static double mass(long n, double p, double q, long k) {
        if (k < 0 || k > n) {
            return 0.0;
        }
        if (p == 0.0) {
            return k == 0 ? 1.0 : 0.0;
        }
        if (q == 0.0) {
            return k == n ? 1.0 : 0.0;
        }
        if (k == 0) {
            return Math.exp(n * Math.log(q));
        }
        if (k == n) {
            return Math.exp(n * Math.log(p));
        }
        double dn = n;
        double dk = k;
        double rest = n - k;
        double lc = stirlerr(dn) - stirlerr(dk) - stirlerr(rest)
            - deviance(dk, dn * p) - deviance(rest, dn * q);
        return Math.exp(lc) * Math.sqrt(dn / (TWO_PI * dk * rest));
    }

    /// Probability of at most `k` successes in `n` trials.
    ///
    /// ```
    ///   k < 0    → 0
    ///   k >= n   → 1
    ///   k == 0   → q^n
    ///   else     → I_q(n - k, k + 1)
    /// ```
    ///
    /// The incomplete beta form costs the same for any n.
    ///
    /// @param n number of trials, non-negative
    /// @param p success probability
    /// @param q failure probability, 1 - p
    /// @param k number of successes
    /// @return P(X <= k)
    public static double cumulative(long n, double p, double q, long k) {
        if (k < 0) {
            return 0.0;
        }
        if (k >= n) {
            return 1.0;
        }
        if (k == 0) {
            return Math.exp(n * Math.log(q));
        }
        return SpecialFunctions.regularizedBeta(q, (double) (n - k), (double) (k + 1));
    }

    /// Stirling error `ln m! - ln(sqrt(2πm) (m/e)^m)` for a non-negative integer m.
    static double stirlerr(double m) {
        if (m < 16.0) {
            return SFE[(int) m];
        }
        double m2 = m * m;
        if (m > 500.0) {
            return (S0 - S1 / m2) / m;
        }
        if (m > 80.0) {
            return (S0 - (S1 - S2 / m2) / m2) / m;
        }
        if (m > 35.0) {
            return (S0 - (S1 - (S2 - S3 / m2) / m2) / m2) / m;
        }
        return (S0 - (S1 - (S2 - (S3 - S4 / m2) / m2) / m2) / m2) / m;
    }

    /// Deviance `x ln(x/np) + np - x`, by series when x is close to np.
    static double deviance(double x, double np) {
        double diff = x - np;
        double sum = x + np;
        if (Math.abs(diff) < 0.1 * sum) {
            double v = diff / sum;
            double s = diff * v;
            double ej = 2.0 * x * v;
            double v2 = v * v;
            for (int j = 1; ; j++) {
                ej *= v2;
                double next = s + ej / (2 * j + 1);
                if (next == s) {
                    return next;
                }
                s = next;
            }
        }
        return x * Math.log(x / np) + np - x;
    }
}
