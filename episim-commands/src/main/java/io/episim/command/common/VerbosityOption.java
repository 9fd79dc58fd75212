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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

/**
 * Shared verbosity control options.
 * {@code -v/--verbose} raises the episim log level to DEBUG, {@code -q/--quiet} lowers it to ERROR.
 */
public class VerbosityOption {

    private static final String LOGGER_NAME = "io.episim";

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Log selection picks and per-configuration progress"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Log errors only"
    )
    private boolean quiet = false;

    /**
     * Validates that verbose and quiet are not both enabled.
     *
     * @throws IllegalStateException if both verbose and quiet are enabled
     */
    public void validate() {
        if (verbose && quiet) {
            throw new IllegalStateException("Cannot specify both --verbose and --quiet options");
        }
    }

    /**
     * Gets the log level these flags ask for, or null to keep the configured level.
     */
    public Level requestedLevel() {
        if (verbose) {
            return Level.DEBUG;
        }
        if (quiet) {
            return Level.ERROR;
        }
        return null;
    }

    /**
     * Validates the flags and applies the requested level to the episim loggers.
     */
    public void apply() {
        validate();
        Level level = requestedLevel();
        if (level != null) {
            Configurator.setLevel(LOGGER_NAME, level);
        }
    }
}
