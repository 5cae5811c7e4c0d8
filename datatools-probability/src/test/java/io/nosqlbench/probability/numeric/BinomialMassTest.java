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

import org.apache.commons.math3.distribution.BinomialDistribution;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class BinomialMassTest {

    private static final double TOLERANCE = 1e-14;

    @ParameterizedTest
    @CsvSource({
        "0, 1.002259575761855e-02",
        "1, 5.345384404063225e-02",
        "2, 1.336346101015806e-01",
        "3, 2.078760601580143e-01",
        "4, 2.251990651711822e-01",
        "5, 1.801592521369457e-01",
        "6, 1.100973207503557e-01",
        "7, 5.242729559540749e-02",
        "8, 1.966023584827781e-02",
        "9, 5.825255066156387e-03",
        "10, 1.359226182103157e-03",
        "11, 2.471320331096649e-04",
        "12, 3.432389348745346e-05",
        "13, 3.520399332046509e-06",
        "14, 2.514570951461792e-07",
        "15, 1.117587089538574e-08",
        "16, 2.328306436538696e-10"
    })
    void testMassTable(long k, double expected) {
        assertEquals(expected, BinomialMass.mass(16, 0.25, 0.75, k), TOLERANCE);
    }

    @ParameterizedTest
    @CsvSource({
        "0, 2.328306436538696e-10",
        "1, 1.140870153903961e-08",
        "2, 2.628657966852188e-07",
        "3, 3.783265128731728e-06",
        "4, 3.810715861618519e-05",
        "5, 2.852391917258501e-04",
        "6, 1.644465373829007e-03",
        "7, 7.469720439985394e-03",
        "8, 2.712995628826320e-02",
        "9, 7.955725188367069e-02",
        "10, 1.896545726340264e-01",
        "11, 3.698138247709721e-01",
        "12, 5.950128899421543e-01",
        "13, 8.028889501001686e-01",
        "14, 9.365235602017492e-01",
        "15, 9.899774042423815e-01",
        "16, 1.0"
    })
    void testCumulativeTable(long k, double expected) {
        assertEquals(expected, BinomialMass.cumulative(16, 0.75, 0.25, k), TOLERANCE);
    }

    @Test
    void testOutsideSupport() {
        assertEquals(0.0, BinomialMass.mass(10, 0.3, 0.7, -1));
        assertEquals(0.0, BinomialMass.mass(10, 0.3, 0.7, 11));
        assertEquals(0.0, BinomialMass.cumulative(10, 0.3, 0.7, -1));
        assertEquals(1.0, BinomialMass.cumulative(10, 0.3, 0.7, 10));
        assertEquals(1.0, BinomialMass.cumulative(10, 0.3, 0.7, 25));
    }

    @Test
    void testAgreesWithCommonsMath() {
        int n = 400;
        double p = 0.37;
        BinomialDistribution reference = new BinomialDistribution(null, n, p);
        for (int k = 100; k <= 200; k += 5) {
            double expected = reference.probability(k);
            assertEquals(expected, BinomialMass.mass(n, p, 1.0 - p, k), expected * 1e-12);
        }
    }

    @Test
    void testMassSumsToOne() {
        long n = 1000;
        double p = 0.3;
        double sum = 0.0;
        for (long k = 0; k <= n; k++) {
            sum += BinomialMass.mass(n, p, 1.0 - p, k);
        }
        assertEquals(1.0, sum, 1e-12);
    }

    @Test
    void testCumulativeMatchesRunningSum() {
        long n = 60;
        double p = 0.42;
        double sum = 0.0;
        for (long k = 0; k < n; k++) {
            sum += BinomialMass.mass(n, p, 1.0 - p, k);
            assertEquals(sum, BinomialMass.cumulative(n, p, 1.0 - p, k), 1e-13, "k=" + k);
        }
    }

    @Test
    void testDegenerateProbabilities() {
        assertEquals(1.0, BinomialMass.mass(5, 0.0, 1.0, 0));
        assertEquals(0.0, BinomialMass.mass(5, 0.0, 1.0, 3));
        assertEquals(1.0, BinomialMass.mass(5, 1.0, 0.0, 5));
        assertEquals(0.0, BinomialMass.mass(5, 1.0, 0.0, 4));
    }

    @Test
    void testStirlingErrorTableIsExact() {
        // ln(m!) - (m + 1/2) ln m + m - ln(2 pi) / 2, with m! exact in a long
        long factorial = 1L;
        for (int m = 1; m < 16; m++) {
            factorial *= m;
            double expected = Math.log((double) factorial) - (m + 0.5) * Math.log(m) + m
                - 0.5 * Math.log(2.0 * Math.PI);
            assertEquals(expected, BinomialMass.stirlerr(m), 1e-13, "m=" + m);
        }
        assertEquals(0.0, BinomialMass.stirlerr(0.0));
    }

    @Test
    void testMassAtElevenMatchesExactValue() {
        // C(20, 11) / 2^20
        assertEquals(167960.0 / 1048576.0, BinomialMass.mass(20, 0.5, 0.5, 11), 1e-14);
        // C(11, 5) / 2^11
        assertEquals(462.0 / 2048.0, BinomialMass.mass(11, 0.5, 0.5, 5), 1e-14);
    }

    @Test
    void testStirlingErrorJoinsTableSmoothly() {
        // the table ends at 15; the series takes over at 16
        double fromTable = BinomialMass.stirlerr(15.0);
        double fromSeries = BinomialMass.stirlerr(16.0);
        assertTrue(fromSeries < fromTable);
        assertEquals(1.0 / (12.0 * 16.0), fromSeries, 1e-6);
    }

    @Test
    void testDevianceVanishesAtMean() {
        assertEquals(0.0, BinomialMass.deviance(25.0, 25.0), 0.0);
        assertTrue(BinomialMass.deviance(30.0, 25.0) > 0.0);
        assertTrue(BinomialMass.deviance(20.0, 25.0) > 0.0);
    }
}
