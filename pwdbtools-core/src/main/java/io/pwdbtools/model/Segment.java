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

import java.util.Objects;

/// A directed parent-to-child edge of the model graph.
/// @param parent the upstream site
/// @param child the downstream site
/// @param label the segment label as declared in the model description
public record Segment(Site parent, Site child, String label) {
    public Segment {
        Objects.requireNonNull(parent, "parent");
        Objects.requireNonNull(child, "child");
        Objects.requireNonNull(label, "label");
    }

    @Override
    public String toString() {
        return parent + " -> " + child + " [" + label + "]";
    }
}
