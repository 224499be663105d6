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


package io.pwdbtools.command.plot;

import io.pwdbtools.navigation.NavigationEvent;
import org.jline.utils.NonBlocking;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JLineEventSource")
class JLineEventSourceTest {

    private static List<NavigationEvent> decode(String keys) throws IOException {
        List<NavigationEvent> events = new ArrayList<>();
        try (JLineEventSource source = new JLineEventSource(NonBlocking.nonBlocking("test", new StringReader(keys)))) {
            NavigationEvent event;
            do {
                event = source.nextEvent();
                events.add(event);
            } while (event != NavigationEvent.QUIT);
        }
        return events;
    }

    @Test
    @DisplayName("should map letter keys")
    void shouldMapLetters() throws IOException {
        assertThat(decode("npsN q")).containsExactly(
            NavigationEvent.NEXT, NavigationEvent.PREV, NavigationEvent.SAVE_CURRENT,
            NavigationEvent.NEXT, NavigationEvent.NEXT, NavigationEvent.QUIT);
    }

    @Test
    @DisplayName("should map arrow keys")
    void shouldMapArrows() throws IOException {
        String right = "\u001b[C";
        String left = "\u001b[D";
        String up = "\u001b[A";
        String down = "\u001bOB";
        assertThat(decode(right + left + up + down + "q")).containsExactly(
            NavigationEvent.NEXT, NavigationEvent.PREV, NavigationEvent.PREV, NavigationEvent.NEXT, NavigationEvent.QUIT);
    }

    @Test
    @DisplayName("should ignore other keys and quit at the end of input")
    void shouldQuitAtEndOfInput() throws IOException {
        assertThat(decode("xyz\u001b[Hs")).containsExactly(NavigationEvent.SAVE_CURRENT, NavigationEvent.QUIT);
    }

    @Test
    @DisplayName("a lone escape should quit")
    void loneEscapeShouldQuit() throws IOException {
        assertThat(decode("\u001b")).containsExactly(NavigationEvent.QUIT);
    }
}
