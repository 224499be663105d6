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


package io.pwdbtools.command.plot;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import io.pwdbtools.selection.SelectionItem;
import io.pwdbtools.selection.SeriesHandle;
import io.pwdbtools.selection.SignalKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ManifestRenderer")
class ManifestRendererTest {

    @TempDir
    Path tempDir;

    private final SelectionItem item = new SelectionItem("Complete", 4, SignalKey.parse("LMCA_P"),
        new SeriesHandle("pwdb_0004", Path.of("Complete", "PWs", "wfdb", "pwdb_0004.hea"), 2, "MCA_P"));

    @Test
    @DisplayName("should describe the shown item on one line")
    void shouldDisplay() {
        StringWriter buffer = new StringWriter();
        ManifestRenderer renderer = new ManifestRenderer(new PrintWriter(buffer));

        renderer.display(item, 3, 10);

        assertThat(buffer.toString().strip())
            .isEqualTo("[4/10] Complete #0004 LMCA_P  pressure (mmHg) from pwdb_0004 signal 2");
    }

    @Test
    @DisplayName("should write a JSON manifest, creating the directory")
    void shouldExportManifest() throws IOException {
        ManifestRenderer renderer = new ManifestRenderer(new PrintWriter(new StringWriter()));
        Path target = tempDir.resolve("nested").resolve("Complete_0004_LMCA_P." + renderer.fileExtension());

        renderer.export(item, target);

        JsonObject json = new Gson().fromJson(Files.readString(target), JsonObject.class);
        assertThat(json.get("dataset").getAsString()).isEqualTo("Complete");
        assertThat(json.get("subject").getAsInt()).isEqualTo(4);
        assertThat(json.get("signal").getAsString()).isEqualTo("LMCA_P");
        assertThat(json.get("quantity").getAsString()).isEqualTo("pressure");
        assertThat(json.get("recordedName").getAsString()).isEqualTo("MCA_P");
        assertThat(json.get("signalIndex").getAsInt()).isEqualTo(2);
        assertThat(json.has("direction")).isFalse();
    }
}
