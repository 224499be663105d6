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

/// A site of the effective site order, with the prefix its signals are recorded under.
/// @param name the site as named by the user or the model
/// @param prefix the signal prefix, equal to the name when no alias applies
public record ResolvedSite(String name, String prefix) {
    public boolean isAliased() {
        return !name.equals(prefix);
    }
}
