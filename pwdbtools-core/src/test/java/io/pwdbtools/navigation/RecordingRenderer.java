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


package io.pwdbtools.navigation;

import io.pwdbtools.selection.SelectionItem;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/// A renderer that remembers what it was asked to do and can be told to fail.
class RecordingRenderer implements SignalRenderer {

    final List<Integer> displayed = Collections.synchronizedList(new ArrayList<>());
    final List<SelectionItem> exported = Collections.synchronizedList(new ArrayList<>());
    private final Set<String> failing = new HashSet<>();
    private final boolean writeFiles;

    RecordingRenderer(boolean writeFiles) {
        this.writeFiles = writeFiles;
    }

    RecordingRenderer failOn(String description) {
        failing.add(description);
        return this;
    }

    @Override
    public void display(SelectionItem item, int index, int total) {
        displayed.add(index);
    }

    @Override
    public void export(SelectionItem item, Path target) throws IOException {
        if (failing.contains(item.describe())) {
            throw new IOException("disk full while writing " + target.getFileName());
        }
        if (writeFiles) {
            Files.writeString(target, item.describe());
        }
        exported.add(item);
    }

    @Override
    public String fileExtension() {
        return "txt";
    }
}
