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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A rooted tree of {@link Site}s connected by {@link Segment}s.
 *
 * <p>Sites live in an indexed arena; each site refers to its parent by index and
 * to its children by index list, so the graph holds no object cycles and can be
 * shared read-only between threads. Instances are built by
 * {@link ModelGraphBuilder}, which guarantees a single root and a unique
 * root-to-site path for every site.</p>
 */
public final class ModelGraph {

    private static final int NO_PARENT = -1;

    private final List<Site> sites;
    private final Map<String, Integer> indexById;
    private final int[] parentIndex;
    private final Segment[] inboundSegment;
    private final List<List<Integer>> childIndices;
    private final List<Segment> segments;

    ModelGraph(List<Site> sites, List<Segment> segments) {
        this.sites = List.copyOf(sites);
        this.segments = List.copyOf(segments);
        this.indexById = new LinkedHashMap<>();
        for (int i = 0; i < this.sites.size(); i++) {
            indexById.put(this.sites.get(i).id(), i);
        }
        this.parentIndex = new int[this.sites.size()];
        Arrays.fill(parentIndex, NO_PARENT);
        this.inboundSegment = new Segment[this.sites.size()];
        List<List<Integer>> children = new ArrayList<>(this.sites.size());
        for (int i = 0; i < this.sites.size(); i++) {
            children.add(new ArrayList<>());
        }
        for (Segment segment : this.segments) {
            int p = indexOf(segment.parent());
            int c = indexOf(segment.child());
            parentIndex[c] = p;
            inboundSegment[c] = segment;
            children.get(p).add(c);
        }
        List<List<Integer>> frozen = new ArrayList<>(children.size());
        for (List<Integer> list : children) {
            frozen.add(Collections.unmodifiableList(list));
        }
        this.childIndices = Collections.unmodifiableList(frozen);
    }

    /// @return the single site without a parent
    public Site root() {
        for (int i = 0; i < parentIndex.length; i++) {
            if (parentIndex[i] == NO_PARENT) {
                return sites.get(i);
            }
        }
        throw new IllegalStateException("model graph has no root");
    }

    /// @return all sites in the order they were first declared
    public List<Site> sites() {
        return sites;
    }

    /// @return all segments in declaration order
    public List<Segment> segments() {
        return segments;
    }

    public int siteCount() {
        return sites.size();
    }

    public int segmentCount() {
        return segments.size();
    }

    /// Look up a site by its exact identifier.
    /// @param id the identifier
    /// @return the site, if present
    public Optional<Site> site(String id) {
        Integer index = indexById.get(id);
        return index == null ? Optional.empty() : Optional.of(sites.get(index));
    }

    public boolean contains(Site site) {
        return indexById.containsKey(site.id());
    }

    public Optional<Site> parentOf(Site site) {
        int parent = parentIndex[indexOf(site)];
        return parent == NO_PARENT ? Optional.empty() : Optional.of(sites.get(parent));
    }

    /// @return the segment leading into the site, empty for the root
    public Optional<Segment> inboundSegment(Site site) {
        return Optional.ofNullable(inboundSegment[indexOf(site)]);
    }

    public List<Site> childrenOf(Site site) {
        List<Integer> indices = childIndices.get(indexOf(site));
        List<Site> result = new ArrayList<>(indices.size());
        for (int index : indices) {
            result.add(sites.get(index));
        }
        return result;
    }

    /// Walk parent references from a site back to the root.
    /// @param target a site of this graph
    /// @return the sites from the root down to and including the target
    public List<Site> pathFromRoot(Site target) {
        List<Site> path = new ArrayList<>();
        int index = indexOf(target);
        // the builder rejects cycles; the bound only guards against corrupted input
        int steps = 0;
        while (index != NO_PARENT) {
            if (steps++ > sites.size()) {
                throw new CyclicOrMultiParentException("Cycle detected while walking up from " + target);
            }
            path.add(sites.get(index));
            index = parentIndex[index];
        }
        Collections.reverse(path);
        return List.copyOf(path);
    }

    private int indexOf(Site site) {
        Integer index = indexById.get(site.id());
        if (index == null) {
            throw new IllegalArgumentException("Site '" + site.id() + "' does not belong to this model graph");
        }
        return index;
    }

    @Override
    public String toString() {
        return "ModelGraph{root=" + (sites.isEmpty() ? "none" : root()) + ", sites=" + sites.size()
            + ", segments=" + segments.size() + "}";
    }
}
