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

package io.pwdbtools;

/// Root of the unchecked exceptions raised while resolving user input against a
/// model or dataset. Anything extending this is fatal for the current run and
/// carries enough context in its message to fix the input.
public class PwdbException extends RuntimeException {

    /// create an exception with a message
    /// @param message the message
    public PwdbException(String message) {
        super(message);
    }

    /// create an exception with a message and a cause
    /// @param message the message
    /// @param cause the cause
    public PwdbException(String message, Throwable cause) {
        super(message, cause);
    }
}
