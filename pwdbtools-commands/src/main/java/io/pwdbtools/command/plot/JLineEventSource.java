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
import io.pwdbtools.navigation.NavigationEventSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jline.terminal.Attributes;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.NonBlockingReader;

import java.io.IOException;

/**
 * Reads navigation keys from a JLine terminal in raw mode.
 *
 * <p>Right, down, {@code n} and space go forward; left, up and {@code p} go back;
 * {@code s} saves the shown item; {@code q}, a lone Escape or the end of input
 * quit. Other keys are ignored.</p>
 */
public class JLineEventSource implements NavigationEventSource, AutoCloseable {

    private static final Logger logger = LogManager.getLogger(JLineEventSource.class);

    private static final int ESC = 27;
    private static final int EOF = -1;
    private static final int TIMEOUT = -2;
    private static final long ESCAPE_TIMEOUT_MILLIS = 50;

    private final Terminal terminal;
    private final Attributes savedAttributes;
    private final boolean ownsTerminal;
    private final NonBlockingReader reader;

    /// Open the system terminal.
    /// @return a source reading from the system terminal
    /// @throws IOException if no terminal can be opened
    public static JLineEventSource system() throws IOException {
        Terminal terminal = TerminalBuilder.builder()
            .system(true)
            .build();
        return new JLineEventSource(terminal, true);
    }

    /// Read keys from an existing terminal, which the caller keeps ownership of.
    /// @param terminal the terminal
    public JLineEventSource(Terminal terminal) {
        this(terminal, false);
    }

    private JLineEventSource(Terminal terminal, boolean ownsTerminal) {
        this.terminal = terminal;
        this.ownsTerminal = ownsTerminal;
        this.savedAttributes = terminal.enterRawMode();
        this.reader = terminal.reader();
        logger.debug("reading navigation keys from {} terminal", terminal.getType());
    }

    /// Read keys from a reader that is not attached to a terminal.
    JLineEventSource(NonBlockingReader reader) {
        this.terminal = null;
        this.ownsTerminal = false;
        this.savedAttributes = null;
        this.reader = reader;
    }

    @Override
    public NavigationEvent nextEvent() throws IOException {
        while (true) {
            int c = reader.read();
            if (c == EOF) {
                return NavigationEvent.QUIT;
            }
            NavigationEvent event = decode(c);
            if (event != null) {
                return event;
            }
            logger.trace("ignoring key {}", c);
        }
    }

    private NavigationEvent decode(int c) throws IOException {
        switch (c) {
            case 'n':
            case 'N':
            case ' ':
                return NavigationEvent.NEXT;
            case 'p':
            case 'P':
                return NavigationEvent.PREV;
            case 's':
            case 'S':
                return NavigationEvent.SAVE_CURRENT;
            case 'q':
            case 'Q':
                return NavigationEvent.QUIT;
            case ESC:
                return decodeEscape();
            default:
                return null;
        }
    }

    private NavigationEvent decodeEscape() throws IOException {
        int next = reader.read(ESCAPE_TIMEOUT_MILLIS);
        if (next == TIMEOUT || next == EOF) {
            return NavigationEvent.QUIT;
        }
        if (next != '[' && next != 'O') {
            return null;
        }
        int key = reader.read(ESCAPE_TIMEOUT_MILLIS);
        switch (key) {
            case 'A':
            case 'D':
                return NavigationEvent.PREV;
            case 'B':
            case 'C':
                return NavigationEvent.NEXT;
            default:
                return null;
        }
    }

    @Override
    public void close() throws IOException {
        if (terminal == null) {
            reader.close();
            return;
        }
        terminal.setAttributes(savedAttributes);
        if (ownsTerminal) {
            terminal.close();
        }
    }
}
