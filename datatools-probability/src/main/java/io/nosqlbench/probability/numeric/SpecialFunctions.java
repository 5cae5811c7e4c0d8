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

import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.special.Beta;
import org.apache.commons.math3.special.Erf;
import org.apache.commons.math3.special.Gamma;

/// Special mathematical functions used by the distributions.
///
/// Every function delegates to Apache Commons Math (`org.apache.commons.math3.special`).
/// This class is the single seam between the distributions and that library.
///
/// | Function | Definition |
/// |---|---|
/// | [#erf(double)] | (2/√π) ∫₀ˣ e^(-t²) dt |
/// | [#erfc(double)] | 1 - erf(x), accurate in the upper tail |
/// | [#logGamma(double)] | ln Γ(x) |
/// | [#digamma(double)] | ψ(x) = d/dx ln Γ(x) |
/// | [#logBeta(double, double)] | ln B(a, b) |
/// | [#regularizedBeta(double, double, double)] | I_x(a, b) |
/// | [#inverseRegularizedBeta(double, double, double)] | x such that I_x(a, b) = p |
/// | [#regularizedGammaP(double, double)] | P(a, x) = γ(a, x) / Γ(a) |
public final class SpecialFunctions {

    /// Absolute accuracy requested from the bracketing solver before polishing.
    private static final double SOLVER_ACCURACY = 1e-15;

    /// Newton steps applied after the bracketing solve.
    private static final int POLISH_STEPS = 3;

    private SpecialFunctions() {
        // Utility class, no instantiation
    }

    /// Error function erf(x).
    ///
    /// @param x the argument
    /// @return erf(x) in [-1, 1]
    public static double erf(double x) {
        return Erf.erf(x);
    }

    /// Complementary error function 1 - erf(x), accurate in the upper tail.
    ///
    /// @param x the argument
    /// @return erfc(x) in [0, 2]
    public static double erfc(double x) {
        return Erf.erfc(x);
    }

    /// Natural logarithm of the gamma function.
    ///
    /// @param x the argument, positive
    /// @return ln Γ(x), or NaN when x is not positive
    public static double logGamma(double x) {
        return Gamma.logGamma(x);
    }

    /// Digamma function ψ(x), the derivative of ln Γ(x).
    ///
    /// Below the asymptotic range the result is accurate to about 1e-8.
    ///
    /// @param x the argument
    /// @return ψ(x)
    public static double digamma(double x) {
        return Gamma.digamma(x);
    }

    /// Natural logarithm of the beta function B(a, b).
    ///
    /// @param a first shape, positive
    /// @param b second shape, positive
    /// @return ln B(a, b)
    public static double logBeta(double a, double b) {
        return Beta.logBeta(a, b);
    }

    /// Regularized incomplete beta function I_x(a, b).
    ///
    /// @param x the evaluation point in [0, 1]
    /// @param a first shape, positive
    /// @param b second shape, positive
    /// @return I_x(a, b) in [0, 1]
    public static double regularizedBeta(double x, double a, double b) {
        if (x <= 0.0) {
            return 0.0;
        }
        if (x >= 1.0) {
            return 1.0;
        }
        return Beta.regularizedBeta(x, a, b);
    }

    /// Inverse of the regularized incomplete beta function in its first argument.
    ///
    /// A Brent solve over [0, 1] through Commons Math brackets the root, then a
    /// few Newton steps on I_x(a, b) - p refine it to near machine precision.
    ///
    /// @param p the target probability in [0, 1]
    /// @param a first shape, positive
    /// @param b second shape, positive
    /// @return x in [0, 1] with I_x(a, b) = p
    public static double inverseRegularizedBeta(double p, double a, double b) {
        if (p <= 0.0) {
            return 0.0;
        }
        if (p >= 1.0) {
            return 1.0;
        }
        BetaDistribution solver = new BetaDistribution(null, a, b, SOLVER_ACCURACY);
        double x = solver.inverseCumulativeProbability(p);
        double lnB = Beta.logBeta(a, b);
        for (int i = 0; i < POLISH_STEPS; i++) {
            if (x <= 0.0 || x >= 1.0) {
                break;
            }
            double error = Beta.regularizedBeta(x, a, b) - p;
            double density = Math.exp((a - 1.0) * Math.log(x) + (b - 1.0) * Math.log1p(-x) - lnB);
            if (error == 0.0 || !(density > 0.0) || Double.isInfinite(density)) {
                break;
            }
            double next = x - error / density;
            if (!(next > 0.0 && next < 1.0)) {
                break;
            }
            x = next;
        }
        return x;
    }

    /// Regularized lower incomplete gamma function P(a, x).
    ///
    /// @param a shape, positive
    /// @param x the evaluation point, non-negative
    /// @return P(a, x) in [0, 1]
    public static double regularizedGammaP(double a, double x) {
        if (x <= 0.0) {
            return 0.0;
        }
        if (Double.isInfinite(x)) {
            return 1.0;
        }
        return Gamma.regularizedGammaP(a, x);
    }
}
