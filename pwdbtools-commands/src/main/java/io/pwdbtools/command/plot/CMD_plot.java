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

import io.pwdbtools.PwdbException;
import io.pwdbtools.command.common.ExportThreadsOption;
import io.pwdbtools.command.common.SubjectRangeOption;
import io.pwdbtools.command.common.ToolConfig;
import io.pwdbtools.command.common.VerbosityOption;
import io.pwdbtools.model.ModelGraph;
import io.pwdbtools.model.ModelGraphBuilder;
import io.pwdbtools.model.PathResolver;
import io.pwdbtools.model.Site;
import io.pwdbtools.model.SiteAliases;
import io.pwdbtools.navigation.BatchResult;
import io.pwdbtools.navigation.NavigationCursor;
import io.pwdbtools.navigation.NavigationListener;
import io.pwdbtools.navigation.NavigationStateMachine;
import io.pwdbtools.selection.QueryReport;
import io.pwdbtools.selection.Selection;
import io.pwdbtools.selection.SelectionEngine;
import io.pwdbtools.selection.SelectionItem;
import io.pwdbtools.selection.SelectionRequest;
import io.pwdbtools.selection.SignalCatalog;
import io.pwdbtools.selection.SiteScope;
import io.pwdbtools.selection.UnknownSignalNameException;
import io.pwdbtools.selection.UnknownSignalTypeException;
import io.pwdbtools.wfdb.WfdbCatalogScanner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/// Select pulse wave signals from one or more PWDB dataset roots and step
/// through them, export them all, or just list what is there.
///
/// ```
/// pwdb plot data/Complete --path Digital --model models/Complete.tsv --query
/// pwdb plot data/Complete data/ACoA --types P,U --subjects 1-3
/// pwdb plot data/Complete --sites Radial --batch --dir plots --threads 4
/// ```
@CommandLine.Command(name = "plot",
    header = "Browse or export pulse wave signals from PWDB dataset roots",
    description = "Selects signals by name, site, type, subject or arterial path, then shows them one at a\n"
        + "time (right/n/space next, left/p previous, s save, q quit), exports them all with --batch,\n"
        + "or lists the sites and signal types found with --query.",
    mixinStandardHelpOptions = true)
public class CMD_plot implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_plot.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 1;

    @CommandLine.Parameters(arity = "1..*", paramLabel = "ROOT",
        description = "Dataset roots, each containing <topology>/PWs/wfdb record directories")
    private List<Path> roots;

    @CommandLine.Option(names = {"--signals"},
        description = "Only these signal names, comma separated, e.g. Radial_P,Brachial_U")
    private String signals;

    @CommandLine.Option(names = {"--sites"},
        description = "Only these sites, comma separated model site names or signal prefixes")
    private String sites;

    @CommandLine.Option(names = {"--types"},
        description = "Signal types, comma separated codes or names (default: P,U,A,PPG,Q)")
    private String types;

    @CommandLine.Mixin
    private SubjectRangeOption subjectRangeOption = new SubjectRangeOption();

    @CommandLine.Option(names = {"--path"},
        description = "Use every site on the arterial path from the root to this site (requires --model)")
    private String pathTarget;

    @CommandLine.Option(names = {"--model"},
        description = "Arterial topology file, an edge list or an artery table")
    private Path model;

    @CommandLine.Option(names = {"--query"},
        description = "Print the sites and signal types found, then exit")
    private boolean query = false;

    @CommandLine.Option(names = {"--dir"},
        description = "Directory exported plots are written to")
    private Path dir;

    @CommandLine.Option(names = {"--batch"},
        description = "Export every selected signal to --dir without showing them")
    private boolean batch = false;

    @CommandLine.Option(names = {"--config"},
        description = "YAML file with defaults for model, dir and types (default: ~/.config/pwdbtools/config.yaml)")
    private Path config;

    @CommandLine.Mixin
    private ExportThreadsOption exportThreadsOption = new ExportThreadsOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    /// Create the CMD_plot command
    public CMD_plot() {}

    /// Run the plot command
    /// @param args Command line arguments
    public static void main(String[] args) {
        CMD_plot command = new CMD_plot();
        CommandLine commandLine = new CommandLine(command).setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        try {
            verbosityOption.validate();
            exportThreadsOption.validate();
        } catch (IllegalStateException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage());
        }
        verbosityOption.apply();

        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            ToolConfig toolConfig = loadConfig();
            Path modelFile = model != null ? model : toolConfig.modelPath().orElse(null);
            Path outputDirectory = dir != null ? dir : toolConfig.outputDirectory().orElse(null);
            String typeList = types != null ? types : toolConfig.signalTypes().orElse(null);
            validate(modelFile, outputDirectory);

            SiteAliases aliases = SiteAliases.defaults();
            SelectionRequest request = buildRequest(typeList, modelFile, aliases);
            List<? extends SignalCatalog> catalogs = new WfdbCatalogScanner().scan(roots);
            if (catalogs.isEmpty()) {
                err.println("Error: no PWDB records (PWs/wfdb/" + WfdbCatalogScanner.RECORD_GLOB + ") found below " + roots);
                return EXIT_ERROR;
            }

            Selection selection = new SelectionEngine(aliases).select(request, catalogs);
            if (query) {
                QueryReport.of(selection).print(out);
                return EXIT_SUCCESS;
            }

            ManifestRenderer renderer = new ManifestRenderer(out);
            ConsoleListener listener = new ConsoleListener(out, err);
            if (batch) {
                NavigationStateMachine machine = new NavigationStateMachine(
                    selection, renderer, NavigationCursor.batch(outputDirectory), listener);
                BatchResult result = machine.runBatch(exportThreadsOption.workersFor(selection.size()));
                out.printf("exported %d of %d items to %s%n", result.exported().size(), result.attempted(), outputDirectory);
                for (BatchResult.Failure failure : result.failures()) {
                    err.printf("failed: %s: %s%n", failure.item().describe(), failure.error().getMessage());
                }
                out.flush();
                err.flush();
                return machine.exitCode();
            }

            NavigationStateMachine machine = new NavigationStateMachine(
                selection, renderer, NavigationCursor.interactive(outputDirectory), listener);
            try (JLineEventSource source = JLineEventSource.system()) {
                machine.runInteractive(source);
            }
            return machine.exitCode();
        } catch (PwdbException e) {
            logger.debug("plot failed", e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return EXIT_ERROR;
        } catch (IOException e) {
            logger.error("I/O error: {}", e.getMessage(), e);
            err.println("Error: " + e);
            err.flush();
            return EXIT_ERROR;
        }
    }

    private ToolConfig loadConfig() throws IOException {
        if (config != null) {
            if (!Files.isRegularFile(config)) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                    "Error: configuration file " + config + " does not exist");
            }
            return ToolConfig.load(config);
        }
        return ToolConfig.loadDefault();
    }

    private void validate(Path modelFile, Path outputDirectory) {
        if (pathTarget != null && modelFile == null) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Error: --path requires --model to locate the arterial topology");
        }
        if (pathTarget != null && !Files.isRegularFile(modelFile)) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Error: model file " + modelFile + " does not exist or is not a file");
        }
        if (batch && outputDirectory == null) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Error: --batch requires --dir for the exported plots");
        }
        if (pathTarget == null && model != null) {
            logger.info("--model is only used with --path, ignoring {}", model);
        }
        if (pathTarget != null && sites != null) {
            logger.warn("--path {} supersedes --sites {}", pathTarget, sites);
        }
        if (!batch && exportThreadsOption.isRequested()) {
            logger.info("--threads and --parallel only apply to --batch, ignoring them");
        }
        if (exportThreadsOption.oversubscribes()) {
            logger.warn("{} export threads requested on {} cores", exportThreadsOption.getThreads(),
                Runtime.getRuntime().availableProcessors());
        }
    }

    private SelectionRequest buildRequest(String typeList, Path modelFile, SiteAliases aliases) throws IOException {
        SelectionRequest.Builder builder = SelectionRequest.builder();
        try {
            builder.signals(signals)
                .types(typeList)
                .subjects(subjectRangeOption.getSubjects());
        } catch (UnknownSignalTypeException | UnknownSignalNameException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Error: " + e.getMessage());
        }

        if (pathTarget != null) {
            ModelGraph graph = new ModelGraphBuilder().build(modelFile);
            List<Site> path = new PathResolver(graph, aliases).resolve(pathTarget);
            builder.siteScope(SiteScope.path(pathTarget, path));
        } else {
            builder.sites(sites);
        }
        return builder.build();
    }

    /// Reports saves on the console.
    private static final class ConsoleListener implements NavigationListener {
        private final PrintWriter out;
        private final PrintWriter err;

        ConsoleListener(PrintWriter out, PrintWriter err) {
            this.out = out;
            this.err = err;
        }

        @Override
        public void exported(SelectionItem item, Path target) {
            synchronized (out) {
                out.printf("saved %s%n", target);
                out.flush();
            }
        }

        @Override
        public void exportFailed(SelectionItem item, Exception error) {
            synchronized (err) {
                err.printf("could not save %s: %s%n", item.describe(), error.getMessage());
                err.flush();
            }
        }

        @Override
        public void progress(int completed, int total) {
            if (completed == total || completed % 100 == 0) {
                logger.info("exported {}/{}", completed, total);
            }
        }
    }
}
