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

import java.nio.file.Path;
import java.util.List;

/// The outcome of a batch export.
/// @param exported the files written, in selection order
/// @param failures the items that could not be exported, in selection order
public record BatchResult(List<Path> exported, List<Failure> failures) {

    public BatchResult {
        exported = List.copyOf(exported);
        failures = List.copyOf(failures);
    }

    /// @param index the position of the item in the selection
    /// @param item the item
    /// @param error why the export failed
    public record Failure(int index, SelectionItem item, Exception error) {}

    public boolean succeeded() {
        return failures.isEmpty();
    }

    public int attempted() {
        return exported.size() + failures.size();
    }
}
