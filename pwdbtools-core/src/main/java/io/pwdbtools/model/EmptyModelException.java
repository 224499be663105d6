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

package io.pwdbtools.model;

/// Thrown when a topology description yields no segments at all.
public class EmptyModelException extends ModelException {

    private final int skippedLines;

    public EmptyModelException(int skippedLines) {
        super("No segments could be parsed from the model description"
            + (skippedLines > 0 ? " (" + skippedLines + " malformed lines skipped)" : ""));
        this.skippedLines = skippedLines;
    }

    public int getSkippedLines() {
        return skippedLines;
    }
}
