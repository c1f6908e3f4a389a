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


package io.rasterscan.command;

import io.rasterscan.command.generate.CMD_generate;
import io.rasterscan.command.process.CMD_process;
import io.rasterscan.command.verify.CMD_verify;
import picocli.CommandLine;

/// Tools for transforming raw images and checking parallel dispatch strategies
///
/// This is the top level command which serves as an entry point for all sub-commands
@CommandLine.Command(name = "rasterscan",
    mixinStandardHelpOptions = true,
    versionProvider = CMD_rasterscan.VersionProvider.class,
    subcommands = {CMD_process.class, CMD_verify.class, CMD_generate.class, CommandLine.HelpCommand.class})
public class CMD_rasterscan {

  /// run a rasterscan command
  /// @param args command line args
  public static void main(String[] args) {
    int exitCode = commandLine().execute(args);
    System.exit(exitCode);
  }

  /// @return the configured command line, with case insensitive options and enum values
  public static CommandLine commandLine() {
    return new CommandLine(new CMD_rasterscan())
        .setCaseInsensitiveEnumValuesAllowed(true)
        .setOptionsCaseInsensitive(true);
  }

  /// Reports the implementation version from the jar manifest.
  public static class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
      String version = CMD_rasterscan.class.getPackage().getImplementationVersion();
      return new String[]{"rasterscan " + (version != null ? version : "development")};
    }
  }
}
