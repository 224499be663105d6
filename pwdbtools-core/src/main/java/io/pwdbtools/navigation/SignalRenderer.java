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
import java.nio.file.Path;

/// Draws and writes out selection items. The navigation engine decides what to
/// show and where to write; how a plot looks is entirely up to the renderer.
/// Export may be called from several threads at once, for distinct items and files.
public interface SignalRenderer {

    /// Show one item in the interactive viewport.
    /// @param item the item
    /// @param index its position in the selection
    /// @param total the selection size
    void display(SelectionItem item, int index, int total);

    /// Write one item to a file.
    /// @param item the item
    /// @param target the file to write
    /// @throws IOException if rendering or writing fails
    void export(SelectionItem item, Path target) throws IOException;

    /// @return the extension of exported files, without the dot
    default String fileExtension() {
        return "pdf";
    }
}
