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

package io.pwdbtools.wfdb;

import io.pwdbtools.PwdbException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * The parts of a WFDB text header ({@code .hea}) needed to know which signals a
 * record holds.
 *
 * <p>The first non-comment line is the record line
 * ({@code name nsig [fs [nsamp ...]]}); each of the next {@code nsig} lines
 * describes one signal, with the signal name in the description field after
 * the eighth column. PWDB exports terminate names with a comma, which is
 * stripped.</p>
 *
 * @param recordName the record name from the record line
 * @param signalNames the signal descriptions, in record order
 */
public record WfdbHeader(String recordName, List<String> signalNames) {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int DESCRIPTION_COLUMN = 8;

    public WfdbHeader {
        signalNames = List.copyOf(signalNames);
    }

    public static WfdbHeader read(Path headerFile) throws IOException {
        return parse(Files.readString(headerFile, StandardCharsets.US_ASCII), headerFile.toString());
    }

    /// @param text the header text
    /// @param source where the text came from, for error messages
    /// @return the parsed header
    public static WfdbHeader parse(String text, String source) {
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\\R")) {
            String stripped = line.strip();
            if (!stripped.isEmpty() && !stripped.startsWith("#")) {
                lines.add(stripped);
            }
        }
        if (lines.isEmpty()) {
            throw new PwdbException("WFDB header " + source + " has no record line");
        }

        String[] record = WHITESPACE.split(lines.get(0));
        if (record.length < 2) {
            throw new PwdbException("WFDB header " + source + " has a malformed record line: " + lines.get(0));
        }
        String recordName = record[0];
        int slash = recordName.indexOf('/');
        if (slash >= 0) {
            recordName = recordName.substring(0, slash);
        }
        int signalCount;
        try {
            signalCount = Integer.parseInt(record[1]);
        } catch (NumberFormatException e) {
            throw new PwdbException("WFDB header " + source + " has a non-integer signal count: " + record[1], e);
        }
        if (lines.size() - 1 < signalCount) {
            throw new PwdbException("WFDB header " + source + " declares " + signalCount
                + " signals but describes " + (lines.size() - 1));
        }

        List<String> names = new ArrayList<>(signalCount);
        for (int i = 1; i <= signalCount; i++) {
            String[] columns = WHITESPACE.split(lines.get(i), DESCRIPTION_COLUMN + 1);
            String description = columns.length > DESCRIPTION_COLUMN ? columns[DESCRIPTION_COLUMN] : "";
            names.add(stripTrailingComma(description.strip()));
        }
        return new WfdbHeader(recordName, names);
    }

    private static String stripTrailingComma(String name) {
        return name.endsWith(",") ? name.substring(0, name.length() - 1) : name;
    }
}
