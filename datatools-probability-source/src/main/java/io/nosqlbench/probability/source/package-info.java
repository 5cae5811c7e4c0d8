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

/// Seedable pseudorandom sources feeding the samplers.
///
/// # Layout
///
/// ```
///   ┌──────────────┐      ┌───────────────────┐
///   │    Source    │◄─────┤  Xorshift128Plus  │  native, default
///   │ read()       │      └───────────────────┘
///   │ uniform()    │◄─────┬───────────────────┐
///   └──────────────┘      │  ProviderSource   │  any Commons RNG provider
///          ▲              └───────────────────┘
///          │
///   Sources.create(...) / Sources.defaultSource()
/// ```
///
/// The default source is confined to the calling thread and seeded with
/// (42, 69); see [io.nosqlbench.probability.source.Sources].
package io.nosqlbench.probability.source;
