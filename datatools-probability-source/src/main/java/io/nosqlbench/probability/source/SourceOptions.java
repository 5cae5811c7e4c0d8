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

import java.util.Objects;
import java.util.OptionalLong;
import java.util.Properties;

/// Configuration for creating a [Source].
///
/// # Usage
///
/// ```java
/// // Xorshift128+ from the default seed pair
/// Source source = Sources.create(SourceOptions.defaults());
///
/// // Explicit algorithm and seed
/// SourceOptions options = SourceOptions.builder()
///     .algorithm(Sources.Algorithm.XO_SHI_RO_256_PP)
///     .seed(1234L)
///     .build();
///
/// // From -Dprobability.source.algorithm=mt -Dprobability.source.seed=0x2a
/// SourceOptions fromProps = SourceOptions.fromSystemProperties();
/// ```
///
/// @see Sources#create(SourceOptions)
public final class SourceOptions {

    /// Property naming the algorithm, matched by [Sources.Algorithm#fromName(String)].
    public static final String ALGORITHM_PROPERTY = "probability.source.algorithm";

    /// Property holding the seed, decimal or `0x` hexadecimal.
    public static final String SEED_PROPERTY = "probability.source.seed";

    private final Sources.Algorithm algorithm;
    private final Long seed;

    private SourceOptions(Builder builder) {
        this.algorithm = builder.algorithm;
        this.seed = builder.seed;
    }

    /// Returns the generator algorithm.
    ///
    /// @return the algorithm
    public Sources.Algorithm algorithm() {
        return algorithm;
    }

    /// Returns the seed, if one was configured.
    ///
    /// @return the seed, or empty to use the default seeding
    public OptionalLong seed() {
        return seed == null ? OptionalLong.empty() : OptionalLong.of(seed);
    }

    /// Returns the default options.
    ///
    /// Defaults:
    /// - algorithm: XORSHIFT_128_PLUS
    /// - seed: unset
    ///
    /// @return the default options
    public static SourceOptions defaults() {
        return new Builder().build();
    }

    /// Returns a new builder.
    ///
    /// @return a new builder instance
    public static Builder builder() {
        return new Builder();
    }

    /// Reads options from properties. Missing keys keep their defaults.
    ///
    /// @param properties the properties to read
    /// @return the configured options
    /// @throws IllegalArgumentException if a value cannot be parsed
    public static SourceOptions fromProperties(Properties properties) {
        Builder builder = new Builder();
        String algorithmName = properties.getProperty(ALGORITHM_PROPERTY);
        if (algorithmName != null) {
            builder.algorithm(Sources.Algorithm.fromName(algorithmName));
        }
        String seedText = properties.getProperty(SEED_PROPERTY);
        if (seedText != null) {
            try {
                builder.seed(Long.decode(seedText.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                    "Invalid value for " + SEED_PROPERTY + ": " + seedText, e);
            }
        }
        return builder.build();
    }

    /// Reads options from the JVM system properties.
    ///
    /// @return the configured options
    /// @throws IllegalArgumentException if a value cannot be parsed
    public static SourceOptions fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /// Returns a builder initialized with these options' values.
    ///
    /// @return a builder pre-populated with current values
    public Builder toBuilder() {
        Builder builder = new Builder().algorithm(this.algorithm);
        builder.seed = this.seed;
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceOptions)) return false;
        SourceOptions that = (SourceOptions) o;
        return algorithm == that.algorithm && Objects.equals(seed, that.seed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(algorithm, seed);
    }

    @Override
    public String toString() {
        return "SourceOptions{" +
            "algorithm=" + algorithm +
            ", seed=" + (seed == null ? "default" : seed) +
            '}';
    }

    /// Builder for SourceOptions.
    public static final class Builder {
        private Sources.Algorithm algorithm = Sources.Algorithm.XORSHIFT_128_PLUS;
        private Long seed = null;

        Builder() {
        }

        /// Sets the generator algorithm.
        ///
        /// @param algorithm the algorithm
        /// @return this builder
        public Builder algorithm(Sources.Algorithm algorithm) {
            this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
            return this;
        }

        /// Sets the seed.
        ///
        /// @param seed the seed
        /// @return this builder
        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        /// Builds the SourceOptions.
        ///
        /// @return the configured options
        public SourceOptions build() {
            return new SourceOptions(this);
        }
    }
}
