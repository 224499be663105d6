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

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// The recognized kinds of recorded signal. Declaration order is the canonical
/// order used when sorting a selection.
public enum SignalType {
    P("pressure", "mmHg"),
    U("velocity", "m/sec"),
    A("area", "m2"),
    PPG("photoplethysmogram", "au"),
    Q("flow", "m3/sec");

    private final String longName;
    private final String units;

    SignalType(String longName, String units) {
        this.longName = longName;
        this.units = units;
    }

    /// @return the suffix used in signal names, e.g. `P`
    public String code() {
        return name();
    }

    public String longName() {
        return longName;
    }

    public String units() {
        return units;
    }

    /// Parse a type from its code or long name, ignoring case.
    /// @param value e.g. `P`, `ppg`, `flow`
    /// @return the type
    /// @throws UnknownSignalTypeException if the value is not recognized
    public static SignalType parse(String value) {
        String trimmed = value.strip();
        for (SignalType type : values()) {
            if (type.name().equalsIgnoreCase(trimmed) || type.longName.equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        throw new UnknownSignalTypeException(trimmed);
    }

    /// Parse a comma-separated list of types; duplicates are dropped.
    /// @param csv e.g. `P,Q` or `pressure, flow`
    /// @return the types in the order given, or every type for a blank list
    public static List<SignalType> parseList(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of(values());
        }
        Set<SignalType> types = new LinkedHashSet<>();
        for (String part : csv.split(",")) {
            types.add(parse(part));
        }
        return new ArrayList<>(types);
    }

    public static Set<SignalType> all() {
        return EnumSet.allOf(SignalType.class);
    }

    static String[] codes() {
        SignalType[] types = values();
        String[] codes = new String[types.length];
        for (int i = 0; i < types.length; i++) {
            codes[i] = types[i].code();
        }
        return codes;
    }
}
