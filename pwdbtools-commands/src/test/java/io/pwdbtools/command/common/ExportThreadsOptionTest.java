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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ExportThreadsOption")
class ExportThreadsOptionTest {

    @Test
    @DisplayName("should export on one worker by default")
    void shouldDefaultToOneWorker() {
        DummyCommand command = parse();

        assertThat(command.exportThreadsOption.isRequested()).isFalse();
        assertThat(command.exportThreadsOption.workersFor(50)).isEqualTo(1);
    }

    @Test
    @DisplayName("should never use more workers than items")
    void shouldCapAtItemCount() {
        DummyCommand command = parse("--threads", "8");

        assertThat(command.exportThreadsOption.workersFor(100)).isEqualTo(8);
        assertThat(command.exportThreadsOption.workersFor(3)).isEqualTo(3);
        assertThat(command.exportThreadsOption.workersFor(0)).isEqualTo(1);
    }

    @Test
    @DisplayName("should size --parallel from the available cores")
    void shouldSizeParallelFromCores() {
        DummyCommand command = parse("--parallel");
        int expected = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);

        assertThat(command.exportThreadsOption.isRequested()).isTrue();
        assertThat(command.exportThreadsOption.workersFor(10_000)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should reject fewer than one thread")
    void shouldRejectZeroThreads() {
        DummyCommand command = parse("--threads", "0");

        assertThatThrownBy(command.exportThreadsOption::validate)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("at least 1");
    }

    @Test
    @DisplayName("should reject --threads together with --parallel")
    void shouldRejectBothOptions() {
        DummyCommand command = parse("--threads", "2", "--parallel");

        assertThatThrownBy(command.exportThreadsOption::validate)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("mutually exclusive");
    }

    private static DummyCommand parse(String... args) {
        DummyCommand command = new DummyCommand();
        new CommandLine(command).parseArgs(args);
        return command;
    }

    private static final class DummyCommand implements Runnable {
        @CommandLine.Mixin
        final ExportThreadsOption exportThreadsOption = new ExportThreadsOption();

        @Override
        public void run() {
        }
    }
}
