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

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;

/// The signals actually recorded in one dataset root. Implementations are the
/// ground truth for selection; nothing absent from a catalog is ever selected.
public interface SignalCatalog {

    /// @return a short label for the dataset root, e.g. the topology name `Complete`
    String label();

    /// @return the subjects present, ascending
    SortedSet<Integer> subjects();

    /// @param subject a subject index
    /// @return the signals recorded for the subject in catalog order, empty for unknown subjects
    List<SignalKey> keys(int subject);

    /// @param subject a subject index
    /// @param key a signal key
    /// @return the handle of the recorded series, if present
    Optional<SeriesHandle> lookup(int subject, SignalKey key);

    default boolean contains(int subject, SignalKey key) {
        return lookup(subject, key).isPresent();
    }

    /// @param subject a subject index
    /// @param site a signal prefix
    /// @param type a signal type
    /// @return the recorded keys at the site and type, every direction, in catalog order
    default List<SignalKey> keysAt(int subject, String site, SignalType type) {
        return keys(subject).stream()
            .filter(k -> k.site().equals(site) && k.type() == type)
            .toList();
    }

    /// @return the distinct sites recorded for any subject, in catalog order
    default List<String> sites() {
        LinkedHashSet<String> sites = new LinkedHashSet<>();
        for (int subject : subjects()) {
            keys(subject).forEach(k -> sites.add(k.site()));
        }
        return List.copyOf(sites);
    }
}
