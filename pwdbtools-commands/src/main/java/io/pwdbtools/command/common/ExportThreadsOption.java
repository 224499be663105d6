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

package io.pwdbtools.command.common;

import picocli.CommandLine;

/// Worker count for batch export.
///
/// `--threads N` asks for exactly N export workers, `--parallel` for one per core
/// minus one. Without either, export runs on the calling thread. The count handed
/// to the exporter never exceeds the number of items to export.
public class ExportThreadsOption {

    @CommandLine.Option(
        names = {"--parallel"},
        description = "Export on all cores but one (batch mode only)"
    )
    private boolean parallel = false;

    @CommandLine.Option(
        names = {"--threads"},
        paramLabel = "N",
        description = "Number of export workers (batch mode only, default: 1)"
    )
    private Integer threads;

    public boolean isRequested() {
        return parallel || threads != null;
    }

    public Integer getThreads() {
        return threads;
    }

    /// @param items the number of items about to be exported
    /// @return the number of workers to export them with, between 1 and `items`
    public int workersFor(int items) {
        int requested;
        if (threads != null) {
            requested = threads;
        } else if (parallel) {
            requested = Runtime.getRuntime().availableProcessors() - 1;
        } else {
            requested = 1;
        }
        return Math.max(1, Math.min(requested, items));
    }

    /// @return true if `--threads` asks for at least as many workers as there are cores
    public boolean oversubscribes() {
        return threads != null && threads >= Runtime.getRuntime().availableProcessors();
    }

    /// @throws IllegalStateException if `--threads` is below 1 or both options are given
    public void validate() {
        if (threads != null && threads < 1) {
            throw new IllegalStateException("--threads must be at least 1, got " + threads);
        }
        if (threads != null && parallel) {
            throw new IllegalStateException("--parallel and --threads are mutually exclusive");
        }
    }
}
