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

/// A non-fatal problem found while building a selection.
/// @param kind what went wrong
/// @param dataset the dataset label the warning applies to
/// @param message the detail
public record SelectionWarning(Kind kind, String dataset, String message) {

    public enum Kind {
        /// no requested signal is recorded in the dataset
        EMPTY_SELECTION,
        /// some requested subjects are not in the dataset
        UNKNOWN_SUBJECT
    }

    @Override
    public String toString() {
        return kind + " [" + dataset + "]: " + message;
    }
}
