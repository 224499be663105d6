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

/// Thrown when a partial or unqualified site name matches several sites. The
/// candidates are listed so the user can pick the qualified identifier.
public class AmbiguousSiteException extends ModelException {

    private final String name;
    private final List<String> candidates;

    public AmbiguousSiteException(String name, List<String> candidates) {
        super("Site '" + name + "' is ambiguous, candidates are: " + String.join(", ", candidates));
        this.name = name;
        this.candidates = List.copyOf(candidates);
    }

    public String getName() {
        return name;
    }

    public List<String> getCandidates() {
        return candidates;
    }
}
