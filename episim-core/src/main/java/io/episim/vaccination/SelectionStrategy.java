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

package io.episim.vaccination;

import io.episim.api.InvalidParameterException;

import java.util.Locale;

/// How vaccination candidates are picked from a centrality ranking.
public enum SelectionStrategy {
    /// Take the top k of a single ranking of the full graph
    BATCH("batch"),
    /// Pick one vertex at a time, re-ranking the reduced graph after every removal
    RECURSIVE("recursive");

    private final String label;

    SelectionStrategy(String label) {
        this.label = label;
    }

    /// @throws InvalidParameterException for anything but `batch` or `recursive`
    public static SelectionStrategy fromName(String name) {
        if (name != null) {
            String wanted = name.trim().toLowerCase(Locale.ROOT);
            for (SelectionStrategy strategy : values()) {
                if (strategy.label.equals(wanted)) {
                    return strategy;
                }
            }
        }
        throw InvalidParameterException.unknownName("strategy", name, values());
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
