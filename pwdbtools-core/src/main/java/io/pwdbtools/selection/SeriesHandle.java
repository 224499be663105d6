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

import java.nio.file.Path;

/// Locates one recorded time series for a renderer.
/// @param recordName the record name, e.g. `pwdb_0001`
/// @param source the file describing the record
/// @param signalIndex the position of the signal within the record
/// @param recordedName the name the signal is recorded under, which can differ from
///     the requested key when a combined series stands in for it
public record SeriesHandle(String recordName, Path source, int signalIndex, String recordedName) {
}
