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
import com.google.gson.GsonBuilder;
import io.pwdbtools.navigation.SignalRenderer;
import io.pwdbtools.selection.SelectionItem;
import io.pwdbtools.selection.SeriesHandle;
import io.pwdbtools.selection.SignalKey;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/// The default renderer of the plot command. Display prints a one-line
/// description of the item; export writes a JSON plot manifest naming the
/// record, the signal and its units, which a plotting backend can pick up.
public class ManifestRenderer implements SignalRenderer {

    private static final Logger logger = LogManager.getLogger(ManifestRenderer.class);
    private static final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private final PrintWriter out;

    public ManifestRenderer(PrintWriter out) {
        this.out = out;
    }

    @Override
    public void display(SelectionItem item, int index, int total) {
        SignalKey key = item.key();
        SeriesHandle handle = item.handle();
        out.printf("[%d/%d] %s  %s (%s) from %s signal %d%n",
            index + 1, total, item.describe(), key.type().longName(), key.type().units(),
            handle.recordName(), handle.signalIndex());
        out.flush();
    }

    @Override
    public void export(SelectionItem item, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            gson.toJson(PlotManifest.of(item), writer);
        }
        logger.trace("wrote manifest {}", target);
    }

    @Override
    public String fileExtension() {
        return "json";
    }

    /// The JSON layout of an exported plot.
    record PlotManifest(
        String dataset,
        int subject,
        String signal,
        String site,
        String type,
        String quantity,
        String units,
        String direction,
        String record,
        String source,
        int signalIndex,
        String recordedName
    ) {
        static PlotManifest of(SelectionItem item) {
            SignalKey key = item.key();
            SeriesHandle handle = item.handle();
            return new PlotManifest(
                item.dataset(),
                item.subject(),
                key.name(),
                key.site(),
                key.type().code(),
                key.type().longName(),
                key.type().units(),
                key.direction(),
                handle.recordName(),
                handle.source() == null ? null : handle.source().toString(),
                handle.signalIndex(),
                handle.recordedName()
            );
        }
    }
}
