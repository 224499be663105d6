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

package io.pwdbtools.selection;

/// One entry of a {@link Selection}.
/// @param dataset the label of the dataset root the item comes from
/// @param subject the subject index within that dataset
/// @param key the requested signal
/// @param handle where the signal data lives
public record SelectionItem(String dataset, int subject, SignalKey key, SeriesHandle handle) {

    /// @return a short human readable description, e.g. `Complete #0004 Radial_P`
    public String describe() {
        return String.format("%s #%04d %s", dataset, subject, key.name());
    }
}
