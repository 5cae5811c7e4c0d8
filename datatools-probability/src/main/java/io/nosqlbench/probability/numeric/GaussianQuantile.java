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

/**
 * Inverse of the Gaussian CDF (quantile function), Wichura's algorithm AS 241.
 *
 * <h2>Purpose</h2>
 *
 * <p>Maps a probability p in [0, 1] to the point x with Φ(x) = p without any
 * root finding. Used for Gaussian and log-normal inverses and for drawing
 * standard normal variates by inverse transform.
 *
 * <h2>Regions</h2>
 *
 * <pre>{@code
 *   q = p - 0.5
 *
 *   |q| <= 0.425          central:  q · A(0.180625 - q²) / B(0.180625 - q²)
 *
 *   r = sqrt(-ln(min(p, 1-p)))
 *   r <= 5                near tail: C(r - 1.6) / D(r - 1.6)
 *   r >  5                far tail:  E(r - 5) / F(r - 5)
 *
 *   tails take the sign of q
 * }</pre>
 *
 * <p>Each of A..F is a degree-7 polynomial evaluated by Horner's rule. The
 * approximation is accurate to about 1 part in 10¹⁶.
 *
 * <h2>Boundaries</h2>
 *
 * <p>p ≤ 0 yields exactly {@code -∞} and p ≥ 1 yields exactly {@code +∞}.
 *
 * <h2>Reference</h2>
 *
 * <p>M. J. Wichura, "Algorithm AS 241: The percentage points of the normal
 * distribution," Applied Statistics, vol. 37, no. 3, pp. 477-484, 1988.
 */
public final class GaussianQuantile {

    private static final double CONST1 = 0.180625;
    private static final double CONST2 = 1.6;
    private static final double SPLIT1 = 0.425;
    private static final double SPLIT2 = 5.0;

    private static final double[] A = {
        3.3871328727963666080e+00, 1.3314166789178437745e+02,
        1.9715909503065514427e+03, 1.3731693765509461125e+04,
        4.5921953931549871457e+04, 6.7265770927008700853e+04,
        3.3430575583588128105e+04, 2.5090809287301226727e+03,
    };
    private static final double[] B = {
        1.0, 4.2313330701600911252e+01,
        6.8718700749205790830e+02, 5.3941960214247511077e+03,
        2.1213794301586595867e+04, 3.9307895800092710610e+04,
        2.8729085735721942674e+04, 5.2264952788528545610e+03,
    };
    private static final double[] C = {
        1.42343711074968357734e+00, 4.63033784615654529590e+00,
        5.76949722146069140550e+00, 3.64784832476320460504e+00,
        1.27045825245236838258e+00, 2.41780725177450611770e-01,
        2.27238449892691845833e-02, 7.74545014278341407640e-04,
    };
    private static final double[] D = {
        1.0, 2.05319162663775882187e+00,
        1.67638483018380384940e+00, 6.89767334985100004550e-01,
        1.48103976427480074590e-01, 1.51986665636164571966e-02,
        5.47593808499534494600e-04, 1.05075007164441684324e-09,
    };
    private static final double[] E = {
        6.65790464350110377720e+00, 5.46378491116411436990e+00,
        1.78482653991729133580e+00, 2.96560571828504891230e-01,
        2.65321895265761230930e-02, 1.24266094738807843860e-03,
        2.71155556874348757815e-05, 2.01033439929228813265e-07,
    };
    private static final double[] F = {
        1.0, 5.99832206555887937690e-01,
        1.36929880922735805310e-01, 1.48753612908506148525e-02,
        7.86869131145613259100e-04, 1.84631831751005468180e-05,
        1.42151175831644588870e-07, 2.04426310338993978564e-15,
    };

    private GaussianQuantile() {
        // Utility class, no instantiation
    }

    /**
     * Computes the quantile of the standard normal distribution N(0, 1).
     *
     * <pre>{@code
     *   p=0.025 → x≈-1.96
     *   p=0.50  → x=0.00
     *   p=0.975 → x≈+1.96
     * }</pre>
     *
     * @param p the probability, nominally in [0, 1]
     * @return the standard normal quantile, infinite at the boundaries
     */
    public static double standard(double p) {
        if (p <= 0.0) {
            return Double.NEGATIVE_INFINITY;
        }
        if (p >= 1.0) {
            return Double.POSITIVE_INFINITY;
        }

        double q = p - 0.5;
        if (Math.abs(q) <= SPLIT1) {
            double x = CONST1 - q * q;
            return q * horner(A, x) / horner(B, x);
        }

        double r = Math.sqrt(-Math.log(q < 0.0 ? p : 1.0 - p));
        double x;
        if (r <= SPLIT2) {
            r -= CONST2;
            x = horner(C, r) / horner(D, r);
        } else {
            r -= SPLIT2;
            x = horner(E, r) / horner(F, r);
        }
        return q < 0.0 ? -x : x;
    }

    /**
     * Computes the quantile of N(mu, sigma²).
     *
     * @param p the probability, nominally in [0, 1]
     * @param mu the mean
     * @param sigma the standard deviation
     * @return mu + sigma · Φ⁻¹(p)
     */
    public static double quantile(double p, double mu, double sigma) {
        return mu + sigma * standard(p);
    }

    private static double horner(double[] coefficients, double x) {
        double result = coefficients[coefficients.length - 1];
        for (int i = coefficients.length - 2; i >= 0; i--) {
            result = result * x + coefficients[i];
        }
        return result;
    }
}
