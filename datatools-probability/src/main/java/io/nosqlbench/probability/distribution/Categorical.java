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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// Categorical distribution over the outcomes `0 .. k-1`.
///
/// # Representation
///
/// ```
///   p      = [p0,  p1,       p2,            ...,  p(k-1)]
///   cumsum = [p0,  p0 + p1,  p0 + p1 + p2,  ...,  1     ]
/// ```
///
/// The cumulative sums are built once at construction. The last entry is set
/// to exactly 1, so rounding in the running sum can never leave a gap at the
/// top of the cdf.
///
/// # Inverse
///
/// The inverse returns the first outcome with positive probability whose
/// cumulative sum reaches the target, and otherwise the last outcome with
/// positive probability. Zero-probability outcomes are never returned.
public final class Categorical implements Discrete, DiscreteInverse, DiscreteSample,
    Mean, Variance, Skewness, Kurtosis, Median, DiscreteModes, Entropy {

    /// Allowed deviation of the probability sum from 1.
    public static final double SUM_TOLERANCE = 1e-12;

    private final double[] p;
    private final double[] cumsum;

    /// @param p the outcome probabilities, each in [0, 1] and summing to 1
    /// @throws IllegalArgumentException if p is empty, holds a value outside [0, 1], or does not sum to 1
    public Categorical(double... p) {
        if (p == null || p.length == 0) {
            throw new IllegalArgumentException("At least one category is required");
        }
        double sum = 0.0;
        for (int i = 0; i < p.length; i++) {
            if (!(p[i] >= 0.0 && p[i] <= 1.0)) {
                throw new IllegalArgumentException("Probability of category " + i + " must be in [0, 1], got: " + p[i]);
            }
            sum += p[i];
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("Probabilities must sum to 1, got: " + sum);
        }
        this.p = p.clone();
        int k = p.length;
        this.cumsum = new double[k];
        cumsum[0] = p[0];
        for (int i = 1; i < k - 1; i++) {
            cumsum[i] = cumsum[i - 1] + p[i];
        }
        cumsum[k - 1] = 1.0;
    }

    /// @return the number of categories
    public int getK() {
        return p.length;
    }

    /// @return a copy of the outcome probabilities
    public double[] getProbabilities() {
        return p.clone();
    }

    @Override
    public double cdf(double x) {
        if (x < 0.0) {
            return 0.0;
        }
        if (x >= p.length - 1) {
            return 1.0;
        }
        return cumsum[(int) Math.floor(x)];
    }

    @Override
    public double mass(long k) {
        if (k < 0 || k >= p.length) {
            return 0.0;
        }
        return p[(int) k];
    }

    @Override
    public long inverse(double u) {
        Checks.probability(u);
        int last = -1;
        for (int i = 0; i < p.length; i++) {
            if (p[i] > 0.0) {
                if (cumsum[i] >= u) {
                    return i;
                }
                last = i;
            }
        }
        return last;
    }

    @Override
    public long sample(Source source) {
        return inverse(source.uniform());
    }

    @Override
    public double mean() {
        double sum = 0.0;
        for (int i = 0; i < p.length; i++) {
            sum += i * p[i];
        }
        return sum;
    }

    @Override
    public double variance() {
        return centralMoment(2);
    }

    @Override
    public double skewness() {
        return centralMoment(3) / Math.pow(variance(), 1.5);
    }

    @Override
    public double kurtosis() {
        double variance = variance();
        return centralMoment(4) / (variance * variance) - 3.0;
    }

    /// Returns the median. When a cumulative sum is exactly 1/2 the median is
    /// the midpoint between that outcome and the next one with positive
    /// probability.
    @Override
    public double median() {
        for (int i = 0; i < p.length; i++) {
            if (cumsum[i] == 0.5) {
                for (int j = i + 1; j < p.length; j++) {
                    if (p[j] > 0.0) {
                        return 0.5 * (i + j);
                    }
                }
                return i;
            }
            if (cumsum[i] > 0.5) {
                return i;
            }
        }
        return p.length - 1;
    }

    @Override
    public long[] modes() {
        double max = Arrays.stream(p).max().orElse(0.0);
        List<Long> modes = new ArrayList<>();
        for (int i = 0; i < p.length; i++) {
            if (p[i] == max) {
                modes.add((long) i);
            }
        }
        return modes.stream().mapToLong(Long::longValue).toArray();
    }

    @Override
    public double entropy() {
        double sum = 0.0;
        for (double pi : p) {
            if (pi > 0.0) {
                sum -= pi * Math.log(pi);
            }
        }
        return sum;
    }

    private double centralMoment(int order) {
        double mean = mean();
        double sum = 0.0;
        for (int i = 0; i < p.length; i++) {
            sum += Math.pow(i - mean, order) * p[i];
        }
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Categorical)) return false;
        Categorical that = (Categorical) o;
        return Arrays.equals(p, that.p);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(p);
    }

    @Override
    public String toString() {
        return "Categorical[p=" + Arrays.toString(p) + "]";
    }
}
