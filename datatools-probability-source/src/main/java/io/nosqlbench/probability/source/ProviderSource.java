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

import org.apache.commons.rng.RandomProviderState;
import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.Objects;

/// Adapts an Apache Commons RNG provider to the [Source] contract.
///
/// Each [#read()] consumes one `nextLong()` from the provider. When the
/// provider is restorable its state can be saved and restored through this
/// adapter.
public final class ProviderSource implements Source {

    private final UniformRandomProvider provider;

    /// @param provider the provider to draw words from
    public ProviderSource(UniformRandomProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    @Override
    public long read() {
        return provider.nextLong();
    }

    /// @return the wrapped provider
    public UniformRandomProvider provider() {
        return provider;
    }

    /// Captures the state of the wrapped provider.
    ///
    /// @return the saved state
    /// @throws UnsupportedOperationException if the provider cannot save its state
    public RandomProviderState saveState() {
        return restorable().saveState();
    }

    /// Restores a state captured by [#saveState()].
    ///
    /// @param state the saved state
    /// @throws UnsupportedOperationException if the provider cannot restore its state
    public void restoreState(RandomProviderState state) {
        restorable().restoreState(state);
    }

    private RestorableUniformRandomProvider restorable() {
        if (provider instanceof RestorableUniformRandomProvider restorable) {
            return restorable;
        }
        throw new UnsupportedOperationException(
            "Provider " + provider.getClass().getSimpleName() + " is not restorable");
    }

    @Override
    public String toString() {
        return "ProviderSource[" + provider + "]";
    }
}
