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

package io.episim.command.common;

import io.episim.simulation.SimulationConfig;
import picocli.CommandLine;

/**
 * Shared top-level random seed option using {@link Seed} record with automatic parsing.
 * Unlike a time-based default, an absent seed falls back to a fixed value so that every
 * run is reproducible.
 */
public class RandomSeedOption {

    /**
     * Immutable random seed specification.
     *
     * @param value the seed value, or null to use {@link SimulationConfig#DEFAULT_SEED}
     */
    public record Seed(Long value) {

        /**
         * Creates a Seed with a specific value.
         */
        public Seed(long value) {
            this(Long.valueOf(value));
        }

        /**
         * Creates a Seed that will use the default value.
         */
        public Seed() {
            this((Long) null);
        }

        /**
         * Gets the effective seed value.
         */
        public long effective() {
            return value != null ? value : SimulationConfig.DEFAULT_SEED;
        }

        /**
         * Checks if this seed was explicitly specified.
         */
        public boolean isExplicit() {
            return value != null;
        }

        @Override
        public String toString() {
            return value != null ? String.valueOf(value) : SimulationConfig.DEFAULT_SEED + " (default)";
        }
    }

    /**
     * Picocli type converter for {@link Seed} specifications.
     */
    public static class SeedConverter implements CommandLine.ITypeConverter<Seed> {

        @Override
        public Seed convert(String value) {
            if (value == null || value.trim().isEmpty()) {
                return new Seed();
            }

            try {
                return new Seed(Long.parseLong(value.trim()));
            } catch (NumberFormatException e) {
                throw new CommandLine.TypeConversionException(
                    "Invalid seed value: " + value + ". Must be a valid long integer."
                );
            }
        }
    }

    @CommandLine.Option(
        names = {"-s", "-z", "--seed"},
        description = "Top-level random seed; every trial derives its own stream from it (default: "
            + SimulationConfig.DEFAULT_SEED + ")",
        converter = SeedConverter.class
    )
    private Seed seed;

    /**
     * Gets the Seed record.
     */
    public Seed getSeedRecord() {
        return seed != null ? seed : new Seed();
    }

    /**
     * Gets the effective seed value.
     */
    public long getSeed() {
        return getSeedRecord().effective();
    }

    /**
     * Checks if a seed was explicitly specified by the user.
     */
    public boolean isSeedSpecified() {
        return seed != null && seed.isExplicit();
    }

    @Override
    public String toString() {
        return getSeedRecord().toString();
    }
}
