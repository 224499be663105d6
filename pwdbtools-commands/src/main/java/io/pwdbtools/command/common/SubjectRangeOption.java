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

import io.pwdbtools.ranges.MalformedRangeException;
import io.pwdbtools.ranges.RangeParser;
import picocli.CommandLine;

import java.util.List;

/**
 * Shared subject selection option using {@link RangeParser} with automatic parsing.
 * Accepts comma-separated indices and inclusive ranges, e.g. {@code 1,3-5,9}.
 */
public class SubjectRangeOption {

    /**
     * The parsed subject indices.
     *
     * @param indices ascending distinct subject indices
     */
    public record Subjects(List<Integer> indices) {
        public Subjects {
            indices = List.copyOf(indices);
        }

        @Override
        public String toString() {
            return indices.toString();
        }
    }

    /**
     * Picocli type converter for subject range expressions.
     */
    public static class SubjectRangeConverter implements CommandLine.ITypeConverter<Subjects> {

        @Override
        public Subjects convert(String value) {
            try {
                return new Subjects(RangeParser.parse(value));
            } catch (MalformedRangeException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    @CommandLine.Option(
        names = {"--subjects"},
        description = "Subjects to include, e.g. '1,3-5,9' (default: all subjects)",
        converter = SubjectRangeConverter.class
    )
    private Subjects subjects;

    /**
     * Gets the parsed subject indices.
     *
     * @return ascending distinct indices, empty when no subjects were given
     */
    public List<Integer> getSubjects() {
        return subjects == null ? List.of() : subjects.indices();
    }

    public boolean isSubjectsSpecified() {
        return subjects != null && !subjects.indices().isEmpty();
    }

    @Override
    public String toString() {
        return isSubjectsSpecified() ? subjects.toString() : "all";
    }
}
