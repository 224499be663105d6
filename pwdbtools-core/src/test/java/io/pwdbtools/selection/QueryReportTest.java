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


package io.pwdbtools.selection;

import io.pwdbtools.model.ModelGraph;
import io.pwdbtools.model.ModelGraphBuilder;
import io.pwdbtools.model.PathResolver;
import io.pwdbtools.model.SiteAliases;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("QueryReport")
class QueryReportTest {

    private static String print(QueryReport report) {
        StringWriter buffer = new StringWriter();
        report.print(new PrintWriter(buffer));
        return buffer.toString();
    }

    @Test
    @DisplayName("should print the path with its signal prefixes, then the types found per prefix")
    void shouldReportPath() {
        ModelGraph graph = new ModelGraphBuilder().build(String.join("\n",
            "Ascending Aorta, Left Subclavian Artery",
            "Left Subclavian Artery, Left Brachial Artery",
            "Left Brachial Artery, Left Radial Artery"));
        SiteAliases aliases = SiteAliases.defaults();
        SelectionRequest request = SelectionRequest.builder()
            .siteScope(SiteScope.path("Radial", new PathResolver(graph, aliases).resolve("Radial")))
            .build();

        Selection selection = new SelectionEngine(aliases).select(request, List.of(SelectionEngineTest.complete()));
        QueryReport report = QueryReport.of(selection);

        assertThat(report.typesBySite()).containsEntry(
            new ResolvedSite("Left Radial Artery", "Radial"), EnumSet.of(SignalType.P, SignalType.U, SignalType.PPG));
        assertThat(print(report)).isEqualTo(String.join(System.lineSeparator(),
            "tracing path to Radial:",
            "  Ascending Aorta -> AorticRoot",
            "  Left Subclavian Artery -> -",
            "  Left Brachial Artery -> Brachial",
            "  Left Radial Artery -> Radial",
            "sites:",
            "  AorticRoot: [P, U]",
            "  Left Subclavian Artery: -",
            "  Brachial: [P]",
            "  Radial: [P, U, PPG]",
            "12 items selected across 1 datasets",
            ""));
    }

    @Test
    @DisplayName("should list filtered sites and warnings")
    void shouldReportSitesAndWarnings() {
        SelectionRequest request = SelectionRequest.builder().sites("Radial,Carotid").types("U").build();
        Selection selection = new SelectionEngine().select(request,
            List.of(SelectionEngineTest.complete(), InMemorySignalCatalog.builder("Empty").add(1, "Femoral_P").build()));

        String output = print(QueryReport.of(selection));

        assertThat(output).startsWith("sites:");
        assertThat(output).contains("  Radial: [U]", "  Carotid: -", "2 items selected across 1 datasets");
        assertThat(output).contains("warning: EMPTY_SELECTION [Empty]");
    }
}
