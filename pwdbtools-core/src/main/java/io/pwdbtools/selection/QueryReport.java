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

import java.io.PrintWriter;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/// The site-to-signal-types view of a selection, printed when only a query was
/// asked for. Reads the selection and writes text; nothing else.
public final class QueryReport {

    private final Selection selection;
    private final Map<ResolvedSite, Set<SignalType>> typesBySite;

    private QueryReport(Selection selection, Map<ResolvedSite, Set<SignalType>> typesBySite) {
        this.selection = selection;
        this.typesBySite = typesBySite;
    }

    /// @param selection the selection to summarize
    /// @return the report, sites in path or filter order
    public static QueryReport of(Selection selection) {
        Map<ResolvedSite, Set<SignalType>> typesBySite = new LinkedHashMap<>();
        for (ResolvedSite site : selection.sites()) {
            Set<SignalType> types = EnumSet.noneOf(SignalType.class);
            for (SelectionItem item : selection.items()) {
                if (item.key().site().equals(site.prefix())) {
                    types.add(item.key().type());
                }
            }
            typesBySite.put(site, types);
        }
        return new QueryReport(selection, typesBySite);
    }

    /// @return each resolved site with the signal types present, in report order
    public Map<ResolvedSite, Set<SignalType>> typesBySite() {
        return typesBySite;
    }

    public void print(PrintWriter out) {
        if (selection.scope() instanceof SiteScope.PathSites path) {
            out.printf("tracing path to %s:%n", path.target());
            for (ResolvedSite site : typesBySite.keySet()) {
                out.printf("  %s -> %s%n", site.name(), site.isAliased() ? site.prefix() : "-");
            }
        }
        out.println("sites:");
        typesBySite.forEach((site, types) -> {
            String label;
            if (selection.scope() instanceof SiteScope.PathSites) {
                label = site.prefix();
            } else {
                label = site.isAliased() ? site.name() + " -> " + site.prefix() : site.name();
            }
            String present = types.isEmpty()
                ? "-"
                : types.stream().map(SignalType::code).collect(Collectors.joining(", ", "[", "]"));
            out.printf("  %s: %s%n", label, present);
        });
        long datasets = selection.items().stream().map(SelectionItem::dataset).distinct().count();
        out.printf("%d items selected across %d datasets%n", selection.size(), datasets);
        selection.warnings().forEach(w -> out.printf("warning: %s%n", w));
        out.flush();
    }
}
