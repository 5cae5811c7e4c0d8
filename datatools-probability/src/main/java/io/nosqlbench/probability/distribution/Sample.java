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

/// A continuous distribution that can draw samples.
///
/// The source is borrowed for the duration of the call only. The number of
/// words read per sample is not fixed: rejection samplers read until they accept.
public interface Sample extends Distribution {

    /// Draws one sample.
    ///
    /// @param source the random source to read from
    /// @return the sample
    double sample(Source source);
}
