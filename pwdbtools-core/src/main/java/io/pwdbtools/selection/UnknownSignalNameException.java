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

/// Thrown when a signal name is not of the form `site_TYPE[_direction]`.
public class UnknownSignalNameException extends PwdbException {

    private final String name;

    public UnknownSignalNameException(String name, String reason) {
        super("Unrecognized signal name '" + name + "': " + reason);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
