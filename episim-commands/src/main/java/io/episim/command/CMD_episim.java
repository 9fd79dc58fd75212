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

package io.episim.command;

import io.episim.command.centrality.CMD_centrality;
import io.episim.command.select.CMD_select;
import io.episim.command.simulate.CMD_simulate;
import picocli.CommandLine;

/// Outbreak simulation on contact graphs under centrality-based vaccination
///
/// This is the top level command which serves as the entry point for all sub-commands
@CommandLine.Command(name = "episim",
    mixinStandardHelpOptions = true,
    subcommands = {
        CommandLine.HelpCommand.class, CMD_simulate.class, CMD_select.class, CMD_centrality.class
    })
public class CMD_episim {

  /// run an episim command
  /// @param args
  ///     command line args
  public static void main(String[] args) {
    System.exit(execute(args));
  }

  /// run an episim command without exiting the JVM
  /// @param args
  ///     command line args
  /// @return the exit code of the sub-command
  public static int execute(String... args) {
    CommandLine commandLine = new CommandLine(new CMD_episim()).setCaseInsensitiveEnumValuesAllowed(true)
        .setOptionsCaseInsensitive(true);
    return commandLine.execute(args);
  }
}
