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

import io.pwdbtools.selection.InMemorySignalCatalog;
import io.pwdbtools.selection.SignalKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("WfdbCatalogScanner")
class WfdbCatalogScannerTest {

    @TempDir
    Path root;

    @Test
    @DisplayName("should build one catalog per record directory, numbering subjects by record order")
    void shouldScanRecordDirectories() throws IOException {
        WfdbFixtures.writeRecord(root, "Complete", "pwdb_0002", "Radial_P", "Radial_U");
        WfdbFixtures.writeRecord(root, "Complete", "pwdb_0001", "AorticRoot_P");
        WfdbFixtures.writeRecord(root, "ACoA", "pwdb_0001", "MCA_P");
        Files.writeString(root.resolve("Complete/PWs/wfdb/notes.hea"), "ignored 0\n");

        List<InMemorySignalCatalog> catalogs = new WfdbCatalogScanner().scan(List.of(root));

        assertThat(catalogs).extracting(InMemorySignalCatalog::label).containsExactly("ACoA", "Complete");
        InMemorySignalCatalog complete = catalogs.get(1);
        assertThat(complete.subjects()).containsExactly(1, 2);
        assertThat(complete.keys(1)).containsExactly(SignalKey.parse("AorticRoot_P"));
        assertThat(complete.keys(2)).extracting(SignalKey::name).containsExactly("Radial_P", "Radial_U");
        assertThat(complete.lookup(2, SignalKey.parse("Radial_U"))).hasValueSatisfying(h -> {
            assertThat(h.recordName()).isEqualTo("pwdb_0002");
            assertThat(h.signalIndex()).isEqualTo(1);
            assertThat(h.source().getFileName().toString()).isEqualTo("pwdb_0002.hea");
        });
        assertThat(complete.root()).contains(root.resolve("Complete/PWs/wfdb"));
    }

    @Test
    @DisplayName("should skip signals whose names are not recognized")
    void shouldSkipUnrecognizedSignals() throws IOException {
        WfdbFixtures.writeRecord(root, "Complete", "pwdb_0001", "ECG_X", "Radial_P", "Heart rate");

        InMemorySignalCatalog catalog = new WfdbCatalogScanner().scanDirectory(root.resolve("Complete/PWs/wfdb"));

        assertThat(catalog.keys(1)).containsExactly(SignalKey.parse("Radial_P"));
        assertThat(catalog.lookup(1, SignalKey.parse("Radial_P"))).hasValueSatisfying(
            h -> assertThat(h.signalIndex()).isEqualTo(1));
    }

    @Test
    @DisplayName("should keep roots in the order given")
    void shouldKeepRootOrder() throws IOException {
        Path first = Files.createDirectories(root.resolve("z-root"));
        Path second = Files.createDirectories(root.resolve("a-root"));
        WfdbFixtures.writeRecord(first, "Complete", "pwdb_0001", "Radial_P");
        WfdbFixtures.writeRecord(second, "ACoA", "pwdb_0001", "Radial_P");

        List<InMemorySignalCatalog> catalogs = new WfdbCatalogScanner().scan(List.of(first, second));

        assertThat(catalogs).extracting(InMemorySignalCatalog::label).containsExactly("Complete", "ACoA");
    }

    @Test
    @DisplayName("should tell the same topology below two roots apart by root name")
    void shouldPrefixRepeatedTopologyWithRootName() throws IOException {
        Path older = Files.createDirectories(root.resolve("pwdb-2019"));
        Path newer = Files.createDirectories(root.resolve("pwdb-2024"));
        WfdbFixtures.writeRecord(older, "Complete", "pwdb_0001", "Radial_P");
        WfdbFixtures.writeRecord(newer, "Complete", "pwdb_0001", "Radial_P");
        WfdbFixtures.writeRecord(newer, "ACoA", "pwdb_0001", "Radial_P");

        List<InMemorySignalCatalog> catalogs = new WfdbCatalogScanner().scan(List.of(older, newer));

        assertThat(catalogs).extracting(InMemorySignalCatalog::label)
            .containsExactly("pwdb-2019-Complete", "ACoA", "pwdb-2024-Complete");
    }

    @Test
    @DisplayName("should number labels when root names do not tell them apart")
    void shouldNumberIndistinguishableLabels() throws IOException {
        WfdbFixtures.writeRecord(root, "Complete", "pwdb_0001", "Radial_P");

        List<InMemorySignalCatalog> catalogs = new WfdbCatalogScanner().scan(List.of(root, root));

        String rootName = root.getFileName().toString();
        assertThat(catalogs).extracting(InMemorySignalCatalog::label)
            .containsExactly(rootName + "-Complete", rootName + "-Complete-2");
    }

    @Test
    @DisplayName("should return nothing for a root without records")
    void shouldReturnNothingWithoutRecords() throws IOException {
        Files.createDirectories(root.resolve("Complete/PWs/wfdb"));

        assertThat(new WfdbCatalogScanner().scan(List.of(root))).isEmpty();
    }

    @Test
    @DisplayName("should fail for a missing root")
    void shouldFailForMissingRoot() {
        assertThatThrownBy(() -> new WfdbCatalogScanner().scan(List.of(root.resolve("missing"))))
            .isInstanceOf(NoSuchFileException.class);
    }
}
