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

import io.pwdbtools.PwdbException;

import java.util.Arrays;

/// Thrown when a requested signal type is not one of the recognized {@link SignalType}s.
public class UnknownSignalTypeException extends PwdbException {

    private final String type;

    public UnknownSignalTypeException(String type) {
        super("Unrecognized signal type '" + type + "', expected one of " + Arrays.toString(SignalType.codes()));
        this.type = type;
    }

    public String getType() {
        return type;
    }
}
