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

package io.pwdbtools.model;

import java.util.List;

/// Thrown when a topology declares more than one site without a parent.
public class MultipleRootsException extends ModelException {

    private final List<String> roots;

    public MultipleRootsException(List<String> roots) {
        super("Model has " + roots.size() + " root sites, expected exactly one: " + roots);
        this.roots = List.copyOf(roots);
    }

    /// @return every parentless site, in encounter order
    public List<String> getRoots() {
        return roots;
    }
}
