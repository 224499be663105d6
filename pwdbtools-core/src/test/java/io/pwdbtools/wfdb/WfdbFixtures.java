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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/// Writes small PWDB-style record trees for tests.
public final class WfdbFixtures {

    private WfdbFixtures() {}

    /// @return the header text of a record holding the given signals
    public static String header(String recordName, String... signalNames) {
        StringBuilder sb = new StringBuilder();
        sb.append("# exported from the pulse wave database\n");
        sb.append(recordName).append(' ').append(signalNames.length).append(" 500 1000\n");
        for (String name : signalNames) {
            sb.append(recordName).append(".dat 16 1000(0)/mmHg 12 0 -4919 0 0 ").append(name).append(",\n");
        }
        return sb.toString();
    }

    /// Write `<root>/<topology>/PWs/wfdb/<record>.hea`.
    /// @return the header file
    public static Path writeRecord(Path root, String topology, String recordName, String... signalNames)
        throws IOException {
        Path dir = root.resolve(topology).resolve("PWs").resolve("wfdb");
        Files.createDirectories(dir);
        Path header = dir.resolve(recordName + ".hea");
        Files.writeString(header, header(recordName, signalNames));
        return header;
    }
}
