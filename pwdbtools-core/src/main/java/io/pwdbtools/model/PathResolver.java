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

package io.pwdbtools.model;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;

/**
 * Resolves a possibly partial site name against a {@link ModelGraph} and
 * computes the root-to-site path.
 *
 * <p>Matching runs in this order, stopping at the first step that finds anything:</p>
 * <ol>
 *   <li>a known signal prefix is translated to its model site names through
 *   {@link SiteAliases}, and each is tried as an exact identifier;</li>
 *   <li>exact identifier match;</li>
 *   <li>bare-name match, ignoring parenthetical qualifiers;</li>
 *   <li>prefix match on bare names.</li>
 * </ol>
 * <p>A name that carries a qualifier, e.g. {@code Digital(P3)}, only matches
 * sites with that same qualifier in steps 3 and 4.</p>
 * <p>Steps 3 and 4 must yield exactly one site. Several candidates raise
 * {@link AmbiguousSiteException}; no site is ever picked silently.</p>
 */
public class PathResolver {

    private static final Logger logger = LogManager.getLogger(PathResolver.class);

    private final ModelGraph graph;
    private final SiteAliases aliases;

    public PathResolver(ModelGraph graph) {
        this(graph, SiteAliases.empty());
    }

    public PathResolver(ModelGraph graph, SiteAliases aliases) {
        this.graph = graph;
        this.aliases = aliases;
    }

    /**
     * Finds the site a user-supplied name refers to.
     *
     * @param name the site identifier, bare name, name prefix, or signal prefix
     * @return the matched site
     * @throws SiteNotFoundException if nothing matches
     * @throws AmbiguousSiteException if a bare name or prefix matches more than one site
     */
    public Site match(String name) {
        String target = name.strip();

        for (String aliased : aliases.siteNamesFor(target)) {
            Optional<Site> site = graph.site(aliased);
            if (site.isPresent()) {
                logger.debug("resolved signal prefix '{}' to model site '{}'", target, aliased);
                return site.get();
            }
        }

        Optional<Site> exact = graph.site(target);
        if (exact.isPresent()) {
            return exact.get();
        }

        Site requested = new Site(target);
        String bare = requested.bareName();
        Optional<String> qualifier = requested.qualifier();
        List<Site> sameBareName = graph.sites().stream()
            .filter(s -> s.bareName().equals(bare))
            .filter(s -> qualifier.isEmpty() || s.qualifier().equals(qualifier))
            .toList();
        Optional<Site> unique = requireUnique(target, sameBareName);
        if (unique.isPresent()) {
            return unique.get();
        }

        List<Site> prefixed = graph.sites().stream()
            .filter(s -> s.bareName().startsWith(bare))
            .filter(s -> qualifier.isEmpty() || s.qualifier().equals(qualifier))
            .toList();
        return requireUnique(target, prefixed).orElseThrow(() -> new SiteNotFoundException(target));
    }

    /**
     * Resolves a name and returns the path leading to it.
     *
     * @param name the target site name, see {@link #match(String)}
     * @return every site from the root down to and including the target
     */
    public List<Site> resolve(String name) {
        Site target = match(name);
        List<Site> path = graph.pathFromRoot(target);
        logger.info("path to '{}': {}", target, path);
        return path;
    }

    public ModelGraph graph() {
        return graph;
    }

    private static Optional<Site> requireUnique(String target, List<Site> candidates) {
        if (candidates.size() > 1) {
            throw new AmbiguousSiteException(target, candidates.stream().map(Site::id).toList());
        }
        return candidates.stream().findFirst();
    }
}
