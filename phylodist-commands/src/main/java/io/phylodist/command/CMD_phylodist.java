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

package io.phylodist.command;

import io.phylodist.command.logging.CustomConfigurationFactory;
import io.phylodist.command.unifrac.CMD_unifrac;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.ConfigurationFactory;
import picocli.CommandLine;

/// Phylogeny-aware distances between biological samples
///
/// This is the top level command which serves as an entry point for all sub-commands
@CommandLine.Command(name = "phylodist",
    mixinStandardHelpOptions = true,
    version = CMD_phylodist.VERSION,
    header = "Phylogeny-aware distances between biological samples",
    description = """
        Computes dissimilarities between samples that take the evolutionary
        relationships of their taxa into account, given a rooted tree and a
        taxa by samples table.
        """,
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0:success", "2:error"},
    subcommands = {CMD_unifrac.class, CommandLine.HelpCommand.class})
public class CMD_phylodist {

  /// Version reported by {@code --version}
  public static final String VERSION = "0.1.0";

  /// Create the default CMD_phylodist command
  public CMD_phylodist() {
  }

  /// Build the command line used by {@link #main(String[])}, with the same parser settings
  /// @return a configured command line
  public static CommandLine commandLine() {
    return new CommandLine(new CMD_phylodist())
        .setCaseInsensitiveEnumValuesAllowed(true)
        .setOptionsCaseInsensitive(true);
  }

  /// run a phylodist command
  /// @param args command line args
  public static void main(String[] args) {
    System.setProperty(
        ConfigurationFactory.CONFIGURATION_FACTORY_PROPERTY,
        CustomConfigurationFactory.class.getCanonicalName()
    );
    Logger logger = LogManager.getLogger(CMD_phylodist.class);

    int exitCode = commandLine().execute(args);
    logger.debug("Exiting main with code: {}", exitCode);
    System.exit(exitCode);
  }
}
