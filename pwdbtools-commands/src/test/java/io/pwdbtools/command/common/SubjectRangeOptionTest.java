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

@DisplayName("SubjectRangeOption")
class SubjectRangeOptionTest {

    @Test
    @DisplayName("should parse a range expression")
    void shouldParseRanges() {
        DummyCommand command = new DummyCommand();
        new CommandLine(command).parseArgs("--subjects", "7,1-3,2");

        assertThat(command.subjectRangeOption.getSubjects()).containsExactly(1, 2, 3, 7);
        assertThat(command.subjectRangeOption.isSubjectsSpecified()).isTrue();
        assertThat(command.subjectRangeOption.toString()).isEqualTo("[1, 2, 3, 7]");
    }

    @Test
    @DisplayName("should mean all subjects when absent")
    void shouldDefaultToAll() {
        DummyCommand command = new DummyCommand();
        new CommandLine(command).parseArgs();

        assertThat(command.subjectRangeOption.getSubjects()).isEmpty();
        assertThat(command.subjectRangeOption.toString()).isEqualTo("all");
    }

    @Test
    @DisplayName("should reject a malformed expression")
    void shouldRejectMalformed() {
        DummyCommand command = new DummyCommand();

        assertThatThrownBy(() -> new CommandLine(command).parseArgs("--subjects", "x-2"))
            .isInstanceOf(CommandLine.ParameterException.class)
            .hasMessageContaining("x-2");
    }

    private static final class DummyCommand implements Runnable {
        @CommandLine.Mixin
        final SubjectRangeOption subjectRangeOption = new SubjectRangeOption();

        @Override
        public void run() {
        }
    }
}
