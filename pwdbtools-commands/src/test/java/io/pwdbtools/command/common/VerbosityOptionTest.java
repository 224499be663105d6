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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("VerbosityOption")
class VerbosityOptionTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "'', WARN",
        "-v, INFO",
        "-vv, DEBUG",
        "-vvv, TRACE",
        "-q, ERROR"
    })
    @DisplayName("should map flags to a log level")
    void shouldMapLevels(String flags, String level) {
        DummyCommand command = new DummyCommand();
        if (flags.isEmpty()) {
            new CommandLine(command).parseArgs();
        } else {
            new CommandLine(command).parseArgs(flags);
        }

        assertThat(command.verbosityOption.getLevel()).isEqualTo(Level.getLevel(level));
    }

    @Test
    @DisplayName("should reject verbose together with quiet")
    void shouldRejectVerboseAndQuiet() {
        DummyCommand command = new DummyCommand();
        new CommandLine(command).parseArgs("-v", "-q");

        assertThatThrownBy(command.verbosityOption::validate).isInstanceOf(IllegalStateException.class);
    }

    private static final class DummyCommand implements Runnable {
        @CommandLine.Mixin
        final VerbosityOption verbosityOption = new VerbosityOption();

        @Override
        public void run() {
        }
    }
}
