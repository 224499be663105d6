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

package io.pwdbtools.navigation;

import java.io.IOException;

/// Delivers navigation events in interactive mode. Blocking in {@link #nextEvent()}
/// is the only place an interactive run waits.
public interface NavigationEventSource {

    /// @return the next event; {@link NavigationEvent#QUIT} once input is exhausted
    /// @throws IOException if the input cannot be read
    NavigationEvent nextEvent() throws IOException;
}
