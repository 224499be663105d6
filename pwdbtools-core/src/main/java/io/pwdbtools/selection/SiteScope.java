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

import io.pwdbtools.model.Site;

import java.util.List;

/// Which sites a selection draws from. Exactly one variant applies to a request.
public sealed interface SiteScope permits SiteScope.AllSites, SiteScope.ExplicitSites, SiteScope.PathSites {

    /// every site present in each catalog, in catalog order
    record AllSites() implements SiteScope {}

    /// the named sites in the order given; names may be model site names or signal prefixes
    /// @param names the site names
    record ExplicitSites(List<String> names) implements SiteScope {
        public ExplicitSites {
            if (names.isEmpty()) {
                throw new IllegalArgumentException("An explicit site scope needs at least one site");
            }
            names = List.copyOf(names);
        }
    }

    /// the sites along a resolved root-to-target path, in path order
    /// @param target the name the path was resolved for
    /// @param path the sites from the root to the target
    record PathSites(String target, List<Site> path) implements SiteScope {
        public PathSites {
            if (path.isEmpty()) {
                throw new IllegalArgumentException("A path site scope needs at least one site");
            }
            path = List.copyOf(path);
        }
    }

    static SiteScope all() {
        return new AllSites();
    }

    static SiteScope explicit(List<String> names) {
        return names.isEmpty() ? new AllSites() : new ExplicitSites(names);
    }

    static SiteScope path(String target, List<Site> path) {
        return new PathSites(target, path);
    }
}
