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

/// Probability distributions with capability-based evaluation.
///
/// # Capability matrix
///
/// ```
///                 cdf density mass inverse sample mean var skew kurt median modes entropy
///   Bernoulli      ●            ●     ●       ●     ●    ●   ●    ●     ●      ●     ●
///   Binomial       ●            ●     ●       ●     ●    ●   ●    ●     ●      ●     ●
///   Categorical    ●            ●     ●       ●     ●    ●   ●    ●     ●      ●     ●
///   Uniform        ●     ●            ●       ●     ●    ●   ●    ●     ●            ●
///   Gaussian       ●     ●            ●       ●     ●    ●   ●    ●     ●      ●     ●
///   Exponential    ●     ●            ●       ●     ●    ●   ●    ●     ●      ●     ●
///   Gamma          ●     ●                    ●     ●    ●   ●    ●            ●     ●
///   Beta           ●     ●            ●       ●     ●    ●   ●    ●     ●      ●     ●
///   Cauchy         ●     ●            ●       ●                         ●      ●     ●
///   Laplace        ●     ●            ●       ●     ●    ●   ●    ●     ●      ●     ●
///   Logistic       ●     ●            ●       ●     ●    ●   ●    ●     ●      ●     ●
///   Lognormal      ●     ●            ●       ●     ●    ●   ●    ●     ●      ●     ●
///   Pert           ●     ●            ●       ●     ●    ●   ●    ●     ●      ●     ●
///   Triangular     ●     ●            ●       ●     ●    ●   ●    ●     ●      ●     ●
/// ```
///
/// A capability is implemented only where it is finite and well defined, so a
/// missing one is a compile-time fact rather than a runtime error.
///
/// # Errors
///
/// Parameters are validated at construction and probabilities at each call.
/// Both violations throw [IllegalArgumentException] naming the offending value.
///
/// # Threading
///
/// All distributions are immutable. Sampling borrows a caller-owned
/// [io.nosqlbench.probability.source.Source] for one call.
package io.nosqlbench.probability.distribution;
