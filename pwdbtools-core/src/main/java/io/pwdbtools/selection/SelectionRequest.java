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

import io.pwdbtools.ranges.RangeParser;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The validated filter inputs of one selection.
 *
 * <p>Raw option strings are parsed once by the {@link Builder}; the engine only
 * ever sees typed values. Empty collections mean "unconstrained": no signal-name
 * allow-list, or every subject present in a catalog.</p>
 *
 * @param signals the explicit signal-name allow-list, matched exactly
 * @param siteScope which sites to draw from
 * @param types the signal types, never empty
 * @param subjects the requested subject indices, ascending
 */
public record SelectionRequest(List<SignalKey> signals, SiteScope siteScope, Set<SignalType> types, List<Integer> subjects) {

    public SelectionRequest {
        Objects.requireNonNull(siteScope, "siteScope");
        signals = List.copyOf(signals);
        if (types.isEmpty()) {
            throw new IllegalArgumentException("At least one signal type is required");
        }
        types = Set.copyOf(types);
        subjects = List.copyOf(subjects);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// @return true when the signal passes the explicit allow-list
    public boolean allows(SignalKey key) {
        return signals.isEmpty() || signals.contains(key);
    }

    public static final class Builder {
        private final List<SignalKey> signals = new ArrayList<>();
        private SiteScope siteScope = SiteScope.all();
        private final Set<SignalType> types = EnumSet.noneOf(SignalType.class);
        private final List<Integer> subjects = new ArrayList<>();

        /// @param csv comma-separated signal names, e.g. `Radial_U,Brachial_U`
        public Builder signals(String csv) {
            if (csv != null && !csv.isBlank()) {
                for (String part : csv.split(",")) {
                    signal(SignalKey.parse(part));
                }
            }
            return this;
        }

        public Builder signal(SignalKey key) {
            if (!signals.contains(key)) {
                signals.add(key);
            }
            return this;
        }

        /// @param csv comma-separated site names or prefixes, blank for all sites
        public Builder sites(String csv) {
            if (csv == null || csv.isBlank()) {
                return this;
            }
            LinkedHashSet<String> names = new LinkedHashSet<>();
            for (String part : csv.split(",")) {
                String name = part.strip();
                if (!name.isEmpty()) {
                    names.add(name);
                }
            }
            return siteScope(SiteScope.explicit(new ArrayList<>(names)));
        }

        public Builder siteScope(SiteScope scope) {
            this.siteScope = Objects.requireNonNull(scope);
            return this;
        }

        /// @param csv comma-separated type codes or names, blank for every recognized type
        /// @throws UnknownSignalTypeException for an unrecognized type
        public Builder types(String csv) {
            types.addAll(SignalType.parseList(csv));
            return this;
        }

        public Builder types(Set<SignalType> requested) {
            types.addAll(requested);
            return this;
        }

        /// @param ranges a range expression such as `0,2-4,7`, blank for all subjects
        /// @throws io.pwdbtools.ranges.MalformedRangeException for a malformed token
        public Builder subjects(String ranges) {
            return subjects(RangeParser.parse(ranges));
        }

        public Builder subjects(List<Integer> indices) {
            subjects.addAll(indices);
            return this;
        }

        public SelectionRequest build() {
            Set<SignalType> effectiveTypes = types.isEmpty() ? SignalType.all() : types;
            List<Integer> sortedSubjects = subjects.stream().distinct().sorted().toList();
            return new SelectionRequest(signals, siteScope, effectiveTypes, sortedSubjects);
        }
    }
}
