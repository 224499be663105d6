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

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The mutable position of one navigation run: the current index, where exports
 * go, and the mode.
 *
 * <p>Only the interactive loop moves the index. Parallel batch workers never use
 * it; they only bump the completion counter, which exists for progress reporting.</p>
 */
public final class NavigationCursor {

    private final NavigationMode mode;
    private final Path outputDirectory;
    private int index;
    private final AtomicInteger completed = new AtomicInteger();

    public NavigationCursor(NavigationMode mode, Path outputDirectory) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.outputDirectory = outputDirectory;
    }

    public static NavigationCursor interactive(Path outputDirectory) {
        return new NavigationCursor(NavigationMode.INTERACTIVE, outputDirectory);
    }

    public static NavigationCursor batch(Path outputDirectory) {
        return new NavigationCursor(NavigationMode.BATCH, Objects.requireNonNull(outputDirectory, "outputDirectory"));
    }

    public NavigationMode mode() {
        return mode;
    }

    public Optional<Path> outputDirectory() {
        return Optional.ofNullable(outputDirectory);
    }

    public int index() {
        return index;
    }

    void moveTo(int newIndex) {
        this.index = newIndex;
    }

    public int completed() {
        return completed.get();
    }

    int markCompleted() {
        return completed.incrementAndGet();
    }

    @Override
    public String toString() {
        return "NavigationCursor{" + mode + ", index=" + index + ", out=" + outputDirectory + "}";
    }
}
