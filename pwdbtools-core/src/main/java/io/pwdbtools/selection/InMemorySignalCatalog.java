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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * An immutable {@link SignalCatalog} held in memory.
 *
 * <p>Built once by a scanner or a test through {@link #builder(String)}; the
 * insertion order of keys within a subject is the catalog order.</p>
 */
public final class InMemorySignalCatalog implements SignalCatalog {

    private final String label;
    private final Path root;
    private final TreeMap<Integer, Map<SignalKey, SeriesHandle>> bySubject;
    private final SortedSet<Integer> subjects;

    private InMemorySignalCatalog(String label, Path root, TreeMap<Integer, Map<SignalKey, SeriesHandle>> bySubject) {
        this.label = label;
        this.root = root;
        this.bySubject = bySubject;
        this.subjects = Collections.unmodifiableSortedSet(new TreeSet<>(bySubject.keySet()));
    }

    public static Builder builder(String label) {
        return new Builder(label);
    }

    @Override
    public String label() {
        return label;
    }

    /// @return the directory the catalog was scanned from, if any
    public Optional<Path> root() {
        return Optional.ofNullable(root);
    }

    @Override
    public SortedSet<Integer> subjects() {
        return subjects;
    }

    @Override
    public List<SignalKey> keys(int subject) {
        Map<SignalKey, SeriesHandle> keys = bySubject.get(subject);
        return keys == null ? List.of() : List.copyOf(keys.keySet());
    }

    @Override
    public Optional<SeriesHandle> lookup(int subject, SignalKey key) {
        Map<SignalKey, SeriesHandle> keys = bySubject.get(subject);
        return keys == null ? Optional.empty() : Optional.ofNullable(keys.get(key));
    }

    @Override
    public String toString() {
        return "InMemorySignalCatalog{" + label + ", subjects=" + subjects.size() + "}";
    }

    public static final class Builder {
        private final String label;
        private Path root;
        private final TreeMap<Integer, Map<SignalKey, SeriesHandle>> bySubject = new TreeMap<>();

        private Builder(String label) {
            this.label = label;
        }

        public Builder root(Path root) {
            this.root = root;
            return this;
        }

        /// register a subject, even one without any signals
        public Builder subject(int subject) {
            bySubject.computeIfAbsent(subject, s -> new LinkedHashMap<>());
            return this;
        }

        public Builder add(int subject, SignalKey key, SeriesHandle handle) {
            bySubject.computeIfAbsent(subject, s -> new LinkedHashMap<>()).putIfAbsent(key, handle);
            return this;
        }

        /// Add signals by name with handles that only carry the record position.
        /// @param subject the subject index
        /// @param signalNames canonical signal names, e.g. `Radial_P`
        /// @return this builder
        public Builder add(int subject, String... signalNames) {
            Map<SignalKey, SeriesHandle> keys = bySubject.computeIfAbsent(subject, s -> new LinkedHashMap<>());
            for (String name : signalNames) {
                SignalKey key = SignalKey.parse(name);
                keys.putIfAbsent(key, new SeriesHandle(String.format("%s_%04d", label, subject), root, keys.size(), key.name()));
            }
            return this;
        }

        public InMemorySignalCatalog build() {
            TreeMap<Integer, Map<SignalKey, SeriesHandle>> copy = new TreeMap<>();
            bySubject.forEach((subject, keys) -> copy.put(subject, Collections.unmodifiableMap(new LinkedHashMap<>(keys))));
            return new InMemorySignalCatalog(label, root, copy);
        }
    }
}
