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
import java.util.Optional;

/// A named location in an arterial model, e.g. `Radial` or
/// `LeftMiddleCerebralArtery(M1)`. A trailing parenthetical part of the
/// identifier is its qualifier; the remainder is the bare name.
/// @param id the full identifier, unique within one model graph
public record Site(String id) implements Comparable<Site> {

    public Site {
        Objects.requireNonNull(id, "site id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Site id must not be blank");
        }
    }

    /// @return the identifier without its trailing parenthetical qualifier
    public String bareName() {
        int open = qualifierStart();
        return open < 0 ? id : id.substring(0, open).trim();
    }

    /// @return the qualifier without parentheses, e.g. `M1`, if present
    public Optional<String> qualifier() {
        int open = qualifierStart();
        if (open < 0) {
            return Optional.empty();
        }
        return Optional.of(id.substring(open + 1, id.length() - 1).trim());
    }

    private int qualifierStart() {
        if (!id.endsWith(")")) {
            return -1;
        }
        int open = id.lastIndexOf('(');
        return open > 0 ? open : -1;
    }

    @Override
    public int compareTo(Site o) {
        return id.compareTo(o.id);
    }

    @Override
    public String toString() {
        return id;
    }
}
