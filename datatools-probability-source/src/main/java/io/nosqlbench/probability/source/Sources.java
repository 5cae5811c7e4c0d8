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

package io.nosqlbench.probability.source;

import org.apache.commons.rng.core.source64.SplitMix64;
import org.apache.commons.rng.simple.RandomSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Factory for seeded {@link Source} instances and owner of the per-thread
 * default source.
 *
 * <h2>Default source</h2>
 *
 * <p>Each thread lazily gets its own {@link Xorshift128Plus}, seeded with the
 * fixed pair ({@value #DEFAULT_SEED_0}, {@value #DEFAULT_SEED_1}) on first use.
 * Runs are therefore reproducible per thread without any setup, and threads
 * never contend on shared state. Re-seeding is explicit through
 * {@link #reseedDefault(long, long)}. Callers that need independent streams
 * should create and seed their own source instead.
 *
 * <h2>Other algorithms</h2>
 *
 * <p>Beyond Xorshift128+, any of the Apache Commons RNG generators listed in
 * {@link Algorithm} can back a source through {@link ProviderSource}.
 */
public final class Sources {

    private static final Logger logger = LogManager.getLogger(Sources.class);

    /// First state word of the default source.
    public static final long DEFAULT_SEED_0 = 42L;

    /// Second state word of the default source.
    public static final long DEFAULT_SEED_1 = 69L;

    private static final ThreadLocal<Xorshift128Plus> DEFAULT =
        ThreadLocal.withInitial(() -> new Xorshift128Plus(DEFAULT_SEED_0, DEFAULT_SEED_1));

    /**
     * Available PRNG algorithms.
     * XORSHIFT_128_PLUS is the native algorithm and the default.
     */
    public enum Algorithm {
        /**
         * Xorshift128+ - 128-bit state, very fast, statistically good
         * Period: 2^128 - 1
         */
        XORSHIFT_128_PLUS(null),

        /**
         * XorShiRo256++ - 256-bit state, excellent statistical properties
         * Period: 2^256 - 1
         */
        XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),

        /**
         * XorShiRo128++ - 128-bit state
         * Period: 2^128 - 1
         */
        XO_SHI_RO_128_PP(RandomSource.XO_SHI_RO_128_PP),

        /**
         * SplitMix64 - 64-bit state, minimal footprint
         * Period: 2^64
         */
        SPLIT_MIX_64(RandomSource.SPLIT_MIX_64),

        /**
         * Mersenne Twister - 19937-bit state
         * Period: 2^19937 - 1
         */
        MT(RandomSource.MT),

        /**
         * KISS - 128-bit state
         */
        KISS(RandomSource.KISS);

        private final RandomSource source;

        Algorithm(RandomSource source) {
            this.source = source;
        }

        RandomSource getSource() {
            return source;
        }

        /**
         * Resolves an algorithm by name, ignoring case and accepting '-' for '_'.
         *
         * @param name the algorithm name
         * @return the matching algorithm
         * @throws IllegalArgumentException if no algorithm has that name
         */
        public static Algorithm fromName(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Algorithm name must not be blank");
            }
            String normalized = name.trim().toUpperCase().replace('-', '_');
            for (Algorithm algorithm : values()) {
                if (algorithm.name().equals(normalized)) {
                    return algorithm;
                }
            }
            throw new IllegalArgumentException("Unknown source algorithm: " + name);
        }
    }

    private Sources() {
        // Utility class, no instantiation
    }

    /**
     * Returns the calling thread's default source.
     *
     * <p>The instance is confined to the calling thread; it must not be handed
     * to another thread.
     *
     * @return the default source of this thread
     */
    public static Xorshift128Plus defaultSource() {
        return DEFAULT.get();
    }

    /**
     * Re-seeds the calling thread's default source.
     *
     * @param s0 first state word
     * @param s1 second state word
     * @throws IllegalArgumentException if both words are zero
     */
    public static void reseedDefault(long s0, long s1) {
        DEFAULT.get().seed(s0, s1);
        logger.debug("Reseeded default source of thread {} with ({}, {})",
            Thread.currentThread().getName(), s0, s1);
    }

    /**
     * Restores the calling thread's default source to its initial seed.
     */
    public static void resetDefault() {
        reseedDefault(DEFAULT_SEED_0, DEFAULT_SEED_1);
    }

    /**
     * Creates a Xorshift128+ source from an explicit state pair.
     *
     * @param s0 first state word
     * @param s1 second state word
     * @return a new source
     */
    public static Xorshift128Plus xorshift(long s0, long s1) {
        return new Xorshift128Plus(s0, s1);
    }

    /**
     * Creates a new source with the specified algorithm and seed.
     *
     * <p>For Xorshift128+ the single seed is expanded to two state words with
     * SplitMix64, so nearby seeds still give unrelated streams.
     *
     * @param algorithm the PRNG algorithm to use
     * @param seed the seed for deterministic generation
     * @return a new source
     */
    public static Source create(Algorithm algorithm, long seed) {
        if (algorithm == Algorithm.XORSHIFT_128_PLUS) {
            SplitMix64 mixer = new SplitMix64(seed);
            long s0 = mixer.nextLong();
            long s1 = mixer.nextLong();
            if (s0 == 0L && s1 == 0L) {
                s1 = DEFAULT_SEED_1;
            }
            return new Xorshift128Plus(s0, s1);
        }
        return new ProviderSource(algorithm.getSource().create(seed));
    }

    /**
     * Creates a new Xorshift128+ source from a single seed.
     *
     * @param seed the seed for deterministic generation
     * @return a new source
     */
    public static Source create(long seed) {
        return create(Algorithm.XORSHIFT_128_PLUS, seed);
    }

    /**
     * Creates a new source as described by the options.
     *
     * <p>Without an explicit seed, Xorshift128+ starts from the default pair and
     * other algorithms are seeded with {@value #DEFAULT_SEED_0}.
     *
     * @param options the source options
     * @return a new source
     */
    public static Source create(SourceOptions options) {
        logger.debug("Creating source from {}", options);
        if (options.seed().isPresent()) {
            return create(options.algorithm(), options.seed().getAsLong());
        }
        if (options.algorithm() == Algorithm.XORSHIFT_128_PLUS) {
            return new Xorshift128Plus(DEFAULT_SEED_0, DEFAULT_SEED_1);
        }
        return create(options.algorithm(), DEFAULT_SEED_0);
    }
}
