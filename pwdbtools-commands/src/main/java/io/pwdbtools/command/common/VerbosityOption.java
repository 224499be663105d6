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


package io.pwdbtools.command.common;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

/**
 * Shared verbosity control options.
 * Provides a repeatable {@code -v/--verbose} flag and {@code -q/--quiet} for
 * controlling how much the command logs.
 */
public class VerbosityOption {

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Increase log output, repeat for more (-v info, -vv debug, -vvv trace)"
    )
    private boolean[] verbose = new boolean[0];

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Suppress all log output except errors"
    )
    private boolean quiet = false;

    /**
     * Gets how many times verbose was requested.
     *
     * @return the verbosity count
     */
    public int getVerbosity() {
        return verbose.length;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Maps the flags to a root log level.
     *
     * @return ERROR when quiet, WARN by default, then INFO, DEBUG and TRACE
     */
    public Level getLevel() {
        if (quiet) {
            return Level.ERROR;
        }
        switch (verbose.length) {
            case 0:
                return Level.WARN;
            case 1:
                return Level.INFO;
            case 2:
                return Level.DEBUG;
            default:
                return Level.TRACE;
        }
    }

    /**
     * Validates that verbose and quiet are not both enabled.
     *
     * @throws IllegalStateException if both verbose and quiet are enabled
     */
    public void validate() {
        if (verbose.length > 0 && quiet) {
            throw new IllegalStateException(
                "Cannot specify both --verbose and --quiet options"
            );
        }
    }

    /// Set the root log level from the flags.
    public void apply() {
        Configurator.setRootLevel(getLevel());
    }
}
