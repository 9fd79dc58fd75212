/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.episim.propagation;

import io.episim.api.InvalidParameterException;

import java.util.Locale;

/// Propagation models, which differ only in where a recovering vertex goes.
public enum PropagationModel {
    /// Susceptible, infected, recovered: recovery is permanent
    SIR(HealthState.RECOVERED),
    /// Susceptible, infected, susceptible: a recovering vertex can be infected again
    SIS(HealthState.SUSCEPTIBLE);

    private final HealthState afterRecovery;

    PropagationModel(HealthState afterRecovery) {
        this.afterRecovery = afterRecovery;
    }

    /// @throws InvalidParameterException for names other than `SIR` or `SIS` (any case)
    public static PropagationModel fromName(String name) {
        if (name != null) {
            String wanted = name.trim().toUpperCase(Locale.ROOT);
            for (PropagationModel model : values()) {
                if (model.name().equals(wanted)) {
                    return model;
                }
            }
        }
        throw InvalidParameterException.unknownName("model", name, values());
    }

    /// @return the state an infected vertex moves to when it recovers
    public HealthState afterRecovery() {
        return afterRecovery;
    }
}
