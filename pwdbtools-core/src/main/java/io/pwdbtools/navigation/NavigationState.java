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

/// The states of a {@link NavigationStateMachine}.
public sealed interface NavigationState
    permits NavigationState.Ready, NavigationState.Displaying, NavigationState.Exporting, NavigationState.Done {

    /// selection loaded, nothing shown yet
    /// @param index the index that will be shown first
    record Ready(int index) implements NavigationState {}

    /// item `index` is shown and input is awaited
    /// @param index the shown item
    record Displaying(int index) implements NavigationState {}

    /// item `index` is being written out
    /// @param index the exported item
    record Exporting(int index) implements NavigationState {}

    /// navigation finished, the cursor is released
    record Done() implements NavigationState {}
}
