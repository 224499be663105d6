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

import io.pwdbtools.model.Site;
import io.pwdbtools.model.SiteAliases;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Combines a {@link SelectionRequest} with the {@link SignalCatalog}s of one or
 * more dataset roots into an ordered {@link Selection}.
 *
 * <p>Candidates are the effective sites crossed with the requested types,
 * expanded to every recorded direction and filtered by the signal-name
 * allow-list. Anything a catalog does not record is dropped silently; a dataset
 * left with nothing only produces a warning. Items are ordered by dataset
 * (input order), subject, site (path, input or catalog order), then type.</p>
 *
 * <p>The engine holds no state between calls, so equal inputs always give equal
 * selections.</p>
 */
public class SelectionEngine {

    private static final Logger logger = LogManager.getLogger(SelectionEngine.class);

    private final SiteAliases aliases;

    public SelectionEngine() {
        this(SiteAliases.empty());
    }

    public SelectionEngine(SiteAliases aliases) {
        this.aliases = aliases;
    }

    /**
     * Builds the selection.
     *
     * @param request the validated filters
     * @param catalogs the dataset catalogs, in the order given by the user
     * @return the selection, possibly empty
     */
    public Selection select(SelectionRequest request, List<? extends SignalCatalog> catalogs) {
        List<SignalType> types = Arrays.stream(SignalType.values())
            .filter(request.types()::contains)
            .toList();
        List<ResolvedSite> scopeSites = resolveScope(request.siteScope());

        LinkedHashMap<String, ResolvedSite> reportedSites = new LinkedHashMap<>();
        List<SelectionItem> items = new ArrayList<>();
        List<SelectionWarning> warnings = new ArrayList<>();

        for (SignalCatalog catalog : catalogs) {
            List<ResolvedSite> sites = scopeSites != null
                ? scopeSites
                : catalog.sites().stream().map(s -> new ResolvedSite(s, s)).toList();
            sites.forEach(s -> reportedSites.putIfAbsent(s.name(), s));
            List<String> prefixes = distinctPrefixes(sites);

            int before = items.size();
            for (int subject : effectiveSubjects(request, catalog, warnings)) {
                for (String prefix : prefixes) {
                    for (SignalType type : types) {
                        collect(catalog, subject, prefix, type, request, items);
                    }
                }
            }

            int selected = items.size() - before;
            if (selected == 0) {
                String message = "none of the requested signals are recorded in this dataset";
                warnings.add(new SelectionWarning(SelectionWarning.Kind.EMPTY_SELECTION, catalog.label(), message));
                logger.warn("{}: {}", catalog.label(), message);
            } else {
                logger.info("{}: selected {} items", catalog.label(), selected);
            }
        }

        return new Selection(request.siteScope(), new ArrayList<>(reportedSites.values()), items, warnings);
    }

    private void collect(
        SignalCatalog catalog,
        int subject,
        String prefix,
        SignalType type,
        SelectionRequest request,
        List<SelectionItem> items
    ) {
        List<SignalKey> recorded = catalog.keysAt(subject, prefix, type);
        if (!recorded.isEmpty()) {
            for (SignalKey key : recorded) {
                if (request.allows(key)) {
                    catalog.lookup(subject, key)
                        .ifPresent(handle -> items.add(new SelectionItem(catalog.label(), subject, key, handle)));
                }
            }
            return;
        }

        // some topologies record several sites under one combined series
        Optional<String> combined = aliases.combinedPrefixFor(prefix);
        if (combined.isEmpty()) {
            return;
        }
        for (SignalKey stored : catalog.keysAt(subject, combined.get(), type)) {
            SignalKey requested = stored.atSite(prefix);
            if (request.allows(requested)) {
                catalog.lookup(subject, stored).ifPresent(handle -> {
                    logger.debug("{} #{}: using {} for {}", catalog.label(), subject, stored, requested);
                    items.add(new SelectionItem(catalog.label(), subject, requested, handle));
                });
            }
        }
    }

    private List<ResolvedSite> resolveScope(SiteScope scope) {
        if (scope instanceof SiteScope.PathSites path) {
            List<ResolvedSite> sites = new ArrayList<>();
            for (Site site : path.path()) {
                sites.add(new ResolvedSite(site.id(), aliases.toPrefix(site.id())));
            }
            return sites;
        } else if (scope instanceof SiteScope.ExplicitSites explicit) {
            return explicit.names().stream()
                .map(name -> new ResolvedSite(name, aliases.toPrefix(name)))
                .toList();
        }
        return null;
    }

    private static List<String> distinctPrefixes(List<ResolvedSite> sites) {
        LinkedHashSet<String> prefixes = new LinkedHashSet<>();
        for (ResolvedSite site : sites) {
            prefixes.add(site.prefix());
        }
        return new ArrayList<>(prefixes);
    }

    private static List<Integer> effectiveSubjects(
        SelectionRequest request,
        SignalCatalog catalog,
        List<SelectionWarning> warnings
    ) {
        if (request.subjects().isEmpty()) {
            return new ArrayList<>(catalog.subjects());
        }
        List<Integer> present = new ArrayList<>();
        List<Integer> missing = new ArrayList<>();
        for (int subject : request.subjects()) {
            if (catalog.subjects().contains(subject)) {
                present.add(subject);
            } else {
                missing.add(subject);
            }
        }
        if (!missing.isEmpty()) {
            String message = "subjects " + missing + " are not present and were skipped";
            warnings.add(new SelectionWarning(SelectionWarning.Kind.UNKNOWN_SUBJECT, catalog.label(), message));
            logger.warn("{}: {}", catalog.label(), message);
        }
        return present;
    }
}
