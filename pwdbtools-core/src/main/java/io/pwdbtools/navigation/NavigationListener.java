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

/// Receives navigation outcomes, e.g. to tell the user about a failed save.
public interface NavigationListener {

    NavigationListener NONE = new NavigationListener() {};

    default void exported(SelectionItem item, Path target) {
    }

    default void exportFailed(SelectionItem item, Exception error) {
    }

    /// called after each batch export, successful or not
    /// @param completed items handled so far
    /// @param total the selection size
    default void progress(int completed, int total) {
    }
}
