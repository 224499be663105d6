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

import io.pwdbtools.PwdbException;
import io.pwdbtools.selection.NoSelectionException;
import io.pwdbtools.selection.Selection;
import io.pwdbtools.selection.SelectionItem;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Steps through a {@link Selection}, showing items on a {@link SignalRenderer}
 * and exporting them to the cursor's output directory.
 *
 * <p>Interactive runs start in {@link NavigationState.Ready}, show the first item
 * and then react to {@link NavigationEvent}s: next and previous are clamped to the
 * selection bounds, a save passes through {@link NavigationState.Exporting} and
 * returns to the same item, and quit ends in {@link NavigationState.Done}. A
 * failed save leaves the state untouched and is reported to the listener.</p>
 *
 * <p>Batch runs export every item exactly once in selection order. A failed item
 * is logged and counted and the batch carries on; {@link #exitCode()} reports
 * whether anything failed.</p>
 */
public class NavigationStateMachine {

    private static final Logger logger = LogManager.getLogger(NavigationStateMachine.class);

    private final Selection selection;
    private final SignalRenderer renderer;
    private final NavigationCursor cursor;
    private final NavigationListener listener;
    private NavigationState state;
    private int failedExports;

    /**
     * @param selection the items to navigate
     * @param renderer the renderer to show and export items with
     * @param cursor the run's cursor
     * @param listener receives export outcomes
     * @throws NoSelectionException if the selection is empty
     */
    public NavigationStateMachine(
        Selection selection,
        SignalRenderer renderer,
        NavigationCursor cursor,
        NavigationListener listener
    ) {
        this.selection = selection;
        this.renderer = renderer;
        this.cursor = cursor;
        this.listener = listener;
        if (selection.isEmpty()) {
            this.state = new NavigationState.Done();
            throw new NoSelectionException("Nothing to display: no signal matches the requested filters in any dataset");
        }
        cursor.moveTo(0);
        this.state = new NavigationState.Ready(0);
    }

    public NavigationStateMachine(Selection selection, SignalRenderer renderer, NavigationCursor cursor) {
        this(selection, renderer, cursor, NavigationListener.NONE);
    }

    public NavigationState state() {
        return state;
    }

    public NavigationCursor cursor() {
        return cursor;
    }

    /// @return 0 when every export attempted so far succeeded, 1 otherwise
    public int exitCode() {
        return failedExports == 0 ? 0 : 1;
    }

    public int failedExports() {
        return failedExports;
    }

    /// Leave {@link NavigationState.Ready} by showing the current item.
    /// @return the new state
    public NavigationState show() {
        requireMode(NavigationMode.INTERACTIVE);
        if (state instanceof NavigationState.Ready ready) {
            display(ready.index());
        }
        return state;
    }

    /**
     * Applies one navigation event.
     *
     * @param event the event
     * @return the state after the event
     */
    public NavigationState handle(NavigationEvent event) {
        requireMode(NavigationMode.INTERACTIVE);
        if (state instanceof NavigationState.Done) {
            logger.debug("ignoring {} after navigation finished", event);
            return state;
        }
        if (state instanceof NavigationState.Ready) {
            show();
        }
        int current = cursor.index();
        int last = selection.lastIndex();
        switch (event) {
            case NEXT -> moveTo(Math.min(current + 1, last));
            case PREV -> moveTo(Math.max(current - 1, 0));
            case SAVE_CURRENT -> {
                state = new NavigationState.Exporting(current);
                export(current);
                state = new NavigationState.Displaying(current);
            }
            case QUIT -> state = new NavigationState.Done();
        }
        return state;
    }

    /**
     * Runs an interactive session until the source delivers {@link NavigationEvent#QUIT}.
     *
     * @param source the event source
     * @return the final state
     * @throws IOException if the source fails
     */
    public NavigationState runInteractive(NavigationEventSource source) throws IOException {
        show();
        while (!(state instanceof NavigationState.Done)) {
            handle(source.nextEvent());
        }
        logger.debug("interactive navigation finished at index {}", cursor.index());
        return state;
    }

    /// Export every item in order on the calling thread.
    /// @return what was exported and what failed
    public BatchResult runBatch() {
        return runBatch(1);
    }

    /**
     * Exports every item exactly once.
     *
     * <p>With more than one thread, items are exported concurrently, each task
     * working from its own index. Results are still reported in selection order.</p>
     *
     * @param threads the number of export workers
     * @return what was exported and what failed
     */
    public BatchResult runBatch(int threads) {
        requireMode(NavigationMode.BATCH);
        if (!(state instanceof NavigationState.Ready)) {
            throw new IllegalStateException("A batch can only run once, from the ready state, not " + state);
        }
        requireDistinctTargets();
        int total = selection.size();
        logger.info("exporting {} items to {} with {} worker(s)",
            total, cursor.outputDirectory().orElse(null), Math.max(1, threads));

        List<Path> exported = new ArrayList<>();
        List<BatchResult.Failure> failures = new ArrayList<>();
        if (threads <= 1) {
            for (int i = 0; i < total; i++) {
                state = new NavigationState.Exporting(i);
                cursor.moveTo(i);
                record(i, exportItem(i), exported, failures);
            }
        } else {
            runParallel(threads, exported, failures);
        }

        state = new NavigationState.Done();
        failedExports = failures.size();
        if (failures.isEmpty()) {
            logger.info("exported {} items", exported.size());
        } else {
            logger.error("exported {} items, {} failed", exported.size(), failures.size());
        }
        return new BatchResult(exported, failures);
    }

    private void runParallel(int threads, List<Path> exported, List<BatchResult.Failure> failures) {
        int total = selection.size();
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<ExportOutcome>> futures = new ArrayList<>(total);
            for (int i = 0; i < total; i++) {
                final int index = i;
                futures.add(executor.submit(() -> exportItem(index)));
            }
            for (int i = 0; i < total; i++) {
                ExportOutcome outcome;
                try {
                    outcome = futures.get(i).get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    Exception error = cause instanceof Exception ex ? ex : e;
                    outcome = ExportOutcome.failed(error);
                }
                record(i, outcome, exported, failures);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
            throw new PwdbException("Batch export interrupted after " + cursor.completed() + " items", e);
        } finally {
            executor.shutdown();
        }
    }

    private void requireDistinctTargets() {
        Map<String, SelectionItem> byName = new HashMap<>();
        for (SelectionItem item : selection.items()) {
            String name = ExportNaming.fileName(item, renderer.fileExtension());
            SelectionItem previous = byName.putIfAbsent(name, item);
            if (previous != null) {
                throw new PwdbException("Both " + previous.describe() + " and " + item.describe()
                    + " would be exported as " + name + ", their dataset labels must differ");
            }
        }
    }

    private void record(int index, ExportOutcome outcome, List<Path> exported, List<BatchResult.Failure> failures) {
        if (outcome.target() != null) {
            exported.add(outcome.target());
        } else {
            failures.add(new BatchResult.Failure(index, selection.get(index), outcome.error()));
        }
    }

    private void moveTo(int index) {
        if (index == cursor.index() && state instanceof NavigationState.Displaying) {
            return;
        }
        display(index);
    }

    private void display(int index) {
        cursor.moveTo(index);
        state = new NavigationState.Displaying(index);
        renderer.display(selection.get(index), index, selection.size());
    }

    private void export(int index) {
        ExportOutcome outcome = exportItem(index);
        if (outcome.error() != null) {
            failedExports++;
        }
    }

    private ExportOutcome exportItem(int index) {
        SelectionItem item = selection.get(index);
        ExportOutcome outcome;
        Optional<Path> outputDirectory = cursor.outputDirectory();
        if (outputDirectory.isEmpty()) {
            outcome = ExportOutcome.failed(new IllegalStateException("No output directory configured for saving"));
        } else {
            Path target = outputDirectory.get().resolve(ExportNaming.fileName(item, renderer.fileExtension()));
            try {
                renderer.export(item, target);
                logger.debug("exported {} to {}", item.describe(), target);
                outcome = ExportOutcome.written(target);
            } catch (IOException | RuntimeException e) {
                outcome = ExportOutcome.failed(e);
            }
        }

        if (outcome.error() != null) {
            logger.error("export of {} failed: {}", item.describe(), outcome.error().getMessage());
            listener.exportFailed(item, outcome.error());
        } else {
            listener.exported(item, outcome.target());
        }
        if (cursor.mode() == NavigationMode.BATCH) {
            listener.progress(cursor.markCompleted(), selection.size());
        }
        return outcome;
    }

    private void requireMode(NavigationMode mode) {
        if (cursor.mode() != mode) {
            throw new IllegalStateException("Operation requires " + mode + " mode but cursor is " + cursor.mode());
        }
    }

    private record ExportOutcome(Path target, Exception error) {
        static ExportOutcome written(Path target) {
            return new ExportOutcome(target, null);
        }

        static ExportOutcome failed(Exception error) {
            return new ExportOutcome(null, error);
        }
    }
}
