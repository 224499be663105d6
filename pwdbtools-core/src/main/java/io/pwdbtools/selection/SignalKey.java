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

import java.util.Objects;

/// Identifies one time series within a subject's record.
///
/// The canonical signal name is `site_TYPE` with an optional `_direction`
/// suffix, e.g. `Radial_P`. PWDB records carry no direction.
/// @param site the signal prefix of the recording site, e.g. `Radial`
/// @param type the signal type
/// @param direction the recorded kind at the site, or null when not applicable
public record SignalKey(String site, SignalType type, String direction) {

    public SignalKey {
        Objects.requireNonNull(site, "site");
        Objects.requireNonNull(type, "type");
        if (site.isBlank() || site.indexOf('_') >= 0) {
            throw new IllegalArgumentException("Invalid signal site '" + site + "'");
        }
        if (direction != null && direction.isBlank()) {
            direction = null;
        }
    }

    public SignalKey(String site, SignalType type) {
        this(site, type, null);
    }

    /// Parse a canonical signal name.
    /// @param name e.g. `Radial_U` or `Radial_P_in`
    /// @return the key
    /// @throws UnknownSignalNameException if the name has no site or type part
    /// @throws UnknownSignalTypeException if the type part is not recognized
    public static SignalKey parse(String name) {
        String trimmed = name.strip();
        String[] parts = trimmed.split("_", 3);
        if (parts.length < 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            throw new UnknownSignalNameException(trimmed, "expected <site>_<type>, e.g. Radial_P");
        }
        SignalType type = SignalType.parse(parts[1]);
        return new SignalKey(parts[0], type, parts.length == 3 ? parts[2] : null);
    }

    public boolean hasDirection() {
        return direction != null;
    }

    /// @return the same key recorded at a different site prefix
    public SignalKey atSite(String otherSite) {
        return new SignalKey(otherSite, type, direction);
    }

    /// @return the canonical signal name
    public String name() {
        return direction == null
            ? site + "_" + type.code()
            : site + "_" + type.code() + "_" + direction;
    }

    @Override
    public String toString() {
        return name();
    }
}
