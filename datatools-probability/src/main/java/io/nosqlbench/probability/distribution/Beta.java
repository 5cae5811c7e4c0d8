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

import io.nosqlbench.probability.numeric.SpecialFunctions;
import io.nosqlbench.probability.sampling.Variates;
import io.nosqlbench.probability.source.Source;

import java.util.Objects;

/**
 * Beta distribution with shapes α, β, rescaled to the interval [a, b].
 *
 * <h2>Functions</h2>
 *
 * <pre>{@code
 * z = (x - a)/(b - a)
 *
 * density(x) = z^(α-1)·(1-z)^(β-1) / (B(α,β)·(b-a))
 * cdf(x)     = I_z(α, β)                  regularized incomplete beta
 * inverse(p) = a + (b-a)·I⁻¹_p(α, β)
 * }</pre>
 *
 * <p>ln B(α, β) is computed once at construction.
 *
 * <h2>Sampling</h2>
 *
 * <p>With X ~ Gamma(α, 1) and Y ~ Gamma(β, 1), X/(X+Y) is Beta(α, β). Each
 * draw therefore costs two rejection-sampled gamma variates.
 *
 * <h2>Shapes</h2>
 *
 * <pre>{@code
 *   α, β > 1      unimodal, mode (α-1)/(α+β-2)
 *   α = β = 1     flat (uniform), no modes
 *   α, β < 1      U-shaped, modes at both ends
 *   α <= 1 <= β   J-shaped toward a
 *   β <= 1 <= α   J-shaped toward b
 * }</pre>
 */
public final class Beta implements Continuous, Inverse, Sample,
    Mean, Variance, Skewness, Kurtosis, Median, Modes, Entropy {

    private final double alpha;
    private final double beta;
    private final double a;
    private final double b;
    private final double lnBeta;

    /**
     * Constructs a beta distribution on [0, 1].
     *
     * @param alpha the first shape; must be positive
     * @param beta the second shape; must be positive
     */
    public Beta(double alpha, double beta) {
        this(alpha, beta, 0.0, 1.0);
    }

    /**
     * Constructs a beta distribution on [a, b].
     *
     * @param alpha the first shape; must be positive
     * @param beta the second shape; must be positive
     * @param a the lower bound
     * @param b the upper bound; must exceed a
     * @throws IllegalArgumentException if a shape is not positive or the bounds are not ordered
     */
    public Beta(double alpha, double beta, double a, double b) {
        this.alpha = Checks.positive("Alpha", alpha);
        this.beta = Checks.positive("Beta", beta);
        Checks.finite("Lower bound", a);
        Checks.finite("Upper bound", b);
        if (!(a < b)) {
            throw new IllegalArgumentException("Lower bound must be below upper bound, got: [" + a + ", " + b + "]");
        }
        this.a = a;
        this.b = b;
        this.lnBeta = SpecialFunctions.logBeta(alpha, beta);
    }

    public double getAlpha() {
        return alpha;
    }

    public double getBeta() {
        return beta;
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
        return SpecialFunctions.regularizedBeta((x - a) / (b - a), alpha, beta);
    }

    @Override
    public double density(double x) {
        if (x < a || x > b) {
            return 0.0;
        }
        double z = (x - a) / (b - a);
        // a unit exponent contributes a factor of 1, even at z = 0 or z = 1
        double lower = alpha == 1.0 ? 0.0 : (alpha - 1.0) * Math.log(z);
        double upper = beta == 1.0 ? 0.0 : (beta - 1.0) * Math.log1p(-z);
        return Math.exp(lower + upper - lnBeta) / (b - a);
    }

    @Override
    public double inverse(double p) {
        Checks.probability(p);
        return a + (b - a) * SpecialFunctions.inverseRegularizedBeta(p, alpha, beta);
    }

    @Override
    public double sample(Source source) {
        // X / (X + Y) as 1 / (1 + Y/X), in log space so tiny shapes cannot give 0/0
        double lnX = Variates.logStandardGamma(alpha, source);
        double lnY = Variates.logStandardGamma(beta, source);
        return a + (b - a) / (1.0 + Math.exp(lnY - lnX));
    }

    @Override
    public double mean() {
        return a + (b - a) * alpha / (alpha + beta);
    }

    @Override
    public double variance() {
        double sum = alpha + beta;
        double width = b - a;
        return width * width * alpha * beta / (sum * sum * (sum + 1.0));
    }

    @Override
    public double skewness() {
        double sum = alpha + beta;
        return 2.0 * (beta - alpha) * Math.sqrt(sum + 1.0) / ((sum + 2.0) * Math.sqrt(alpha * beta));
    }

    @Override
    public double kurtosis() {
        double sum = alpha + beta;
        double product = alpha * beta;
        double diff = alpha - beta;
        return 6.0 * (diff * diff * (sum + 1.0) - product * (sum + 2.0))
            / (product * (sum + 2.0) * (sum + 3.0));
    }

    /**
     * Returns the median: the midpoint for symmetric shapes, otherwise
     * {@code inverse(0.5)}.
     *
     * @return the median
     */
    @Override
    public double median() {
        if (alpha == beta) {
            return a + 0.5 * (b - a);
        }
        return inverse(0.5);
    }

    @Override
    public double[] modes() {
        if (alpha == 1.0 && beta == 1.0) {
            return new double[0];
        }
        if (alpha < 1.0 && beta < 1.0) {
            return new double[]{a, b};
        }
        if (alpha <= 1.0 && beta >= 1.0) {
            return new double[]{a};
        }
        if (alpha >= 1.0 && beta <= 1.0) {
            return new double[]{b};
        }
        return new double[]{a + (b - a) * (alpha - 1.0) / (alpha + beta - 2.0)};
    }

    @Override
    public double entropy() {
        return Math.log(b - a) + lnBeta
            - (alpha - 1.0) * SpecialFunctions.digamma(alpha)
            - (beta - 1.0) * SpecialFunctions.digamma(beta)
            + (alpha + beta - 2.0) * SpecialFunctions.digamma(alpha + beta);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Beta)) return false;
        Beta that = (Beta) o;
        return Double.compare(that.alpha, alpha) == 0 &&
               Double.compare(that.beta, beta) == 0 &&
               Double.compare(that.a, a) == 0 &&
               Double.compare(that.b, b) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(alpha, beta, a, b);
    }

    @Override
    public String toString() {
        return "Beta[alpha=" + alpha + ", beta=" + beta + ", a=" + a + ", b=" + b + "]";
    }
}
