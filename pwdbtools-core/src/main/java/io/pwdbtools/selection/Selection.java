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

import java.util.List;
import java.util.Objects;

/// The ordered result of a selection: the items to display or export, the site
/// order they were resolved in, and any non-fatal warnings. Immutable; a change of
/// filters produces a new selection.
/// @param scope the site scope the selection was made with
/// @param sites the effective sites in resolution order
/// @param items the selected items in canonical order
/// @param warnings problems that did not stop the selection
public record Selection(SiteScope scope, List<ResolvedSite> sites, List<SelectionItem> items, List<SelectionWarning> warnings) {

    public Selection {
        Objects.requireNonNull(scope, "scope");
        sites = List.copyOf(sites);
        items = List.copyOf(items);
        warnings = List.copyOf(warnings);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public SelectionItem get(int index) {
        return items.get(index);
    }

    /// @return the index of the last item
    /// @throws NoSelectionException if the selection is empty
    public int lastIndex() {
        if (items.isEmpty()) {
            throw new NoSelectionException("The selection is empty");
        }
        return items.size() - 1;
    }
}
