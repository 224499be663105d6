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

package io.pwdbtools.ranges;

import io.pwdbtools.PwdbException;

/// Thrown when one token of a range expression is neither a non-negative
/// integer nor an inclusive `lo-hi` range with `lo <= hi`.
public class MalformedRangeException extends PwdbException {

    private final String token;

    public MalformedRangeException(String token, String reason) {
        super(String.format("Malformed range token '%s': %s", token, reason));
        this.token = token;
    }

    public MalformedRangeException(String token, String reason, Throwable cause) {
        super(String.format("Malformed range token '%s': %s", token, reason), cause);
        this.token = token;
    }

    /// @return the offending token, as written by the user
    public String getToken() {
        return token;
    }
}
