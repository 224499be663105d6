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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds a {@link ModelGraph} from a topology description.
 *
 * <p>Two layouts are understood:</p>
 * <ul>
 *   <li>an edge list, one {@code parent, child[, label]} segment per line, with
 *   fields separated by tabs, commas or {@code ->}; any further fields are
 *   ignored, as are blank lines and lines starting with {@code #};</li>
 *   <li>a tab-delimited artery table with {@code Name}, {@code Inlet node} and
 *   {@code Outlet node} columns, where an artery's parent is the first artery
 *   whose outlet node is its inlet node.</li>
 * </ul>
 *
 * <p>Malformed lines are skipped and reported through {@link #getWarnings()}.
 * Structural problems (several roots, multiple parents, cycles, no segments at
 * all) fail the build.</p>
 */
public class ModelGraphBuilder {

    private static final Logger logger = LogManager.getLogger(ModelGraphBuilder.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String NAME_COLUMN = "name";
    private static final String INLET_COLUMN = "inlet node";
    private static final String OUTLET_COLUMN = "outlet node";

    private final List<String> warnings = new ArrayList<>();

    private final Map<String, Site> sitesById = new LinkedHashMap<>();
    private final Map<String, Site> parentById = new HashMap<>();
    private final List<Segment> segments = new ArrayList<>();
    private int skippedLines;

    /// Read and build a model file.
    /// @param modelFile the topology description
    /// @return the model graph
    /// @throws IOException if the file cannot be read
    public ModelGraph build(Path modelFile) throws IOException {
        logger.debug("reading model from {}", modelFile);
        return build(Files.readString(modelFile, StandardCharsets.UTF_8));
    }

    /// Build a model graph from topology text.
    /// @param description the topology description
    /// @return the model graph
    public ModelGraph build(String description) {
        reset();
        String[] lines = description.split("\\R", -1);
        int headerLine = firstMeaningfulLine(lines);
        if (headerLine >= 0 && isArteryTableHeader(lines[headerLine])) {
            parseArteryTable(lines, headerLine);
        } else {
            parseEdgeList(lines);
        }

        if (segments.isEmpty()) {
            throw new EmptyModelException(skippedLines);
        }
        Site root = findRoot();
        requireAllReachable(root);

        ModelGraph graph = new ModelGraph(new ArrayList<>(sitesById.values()), segments);
        logger.info("built model graph rooted at '{}' with {} sites and {} segments ({} lines skipped)",
            root, graph.siteCount(), graph.segmentCount(), skippedLines);
        return graph;
    }

    /// @return recoverable problems found by the last build, one message per problem
    public List<String> getWarnings() {
        return List.copyOf(warnings);
    }

    private void reset() {
        warnings.clear();
        sitesById.clear();
        parentById.clear();
        segments.clear();
        skippedLines = 0;
    }

    private void parseEdgeList(String[] lines) {
        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String line = lines[i].strip();
            if (isIgnorable(line)) {
                continue;
            }
            List<String> fields = splitFields(line);
            if (fields.size() < 2 || fields.get(0).isEmpty() || fields.get(1).isEmpty()) {
                skip(lineNumber, "expected 'parent, child[, label]' but found '" + line + "'");
                continue;
            }
            String parent = fields.get(0);
            String child = fields.get(1);
            String label = fields.size() > 2 && !fields.get(2).isEmpty()
                ? fields.get(2)
                : parent + "->" + child;
            addSegment(parent, child, label, lineNumber);
        }
    }

    private void parseArteryTable(String[] lines, int headerLine) {
        List<String> header = splitTabs(lines[headerLine]);
        int nameCol = columnIndex(header, NAME_COLUMN);
        int inletCol = columnIndex(header, INLET_COLUMN);
        int outletCol = columnIndex(header, OUTLET_COLUMN);
        int required = Math.max(nameCol, Math.max(inletCol, outletCol)) + 1;

        List<Artery> arteries = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = headerLine + 1; i < lines.length; i++) {
            int lineNumber = i + 1;
            if (isIgnorable(lines[i].strip())) {
                continue;
            }
            List<String> row = splitTabs(lines[i]);
            if (row.size() < required || row.get(nameCol).isEmpty()) {
                skip(lineNumber, "artery row has " + row.size() + " columns, expected at least " + required);
                continue;
            }
            String name = row.get(nameCol);
            int inlet;
            int outlet;
            try {
                inlet = Integer.parseInt(row.get(inletCol));
                outlet = Integer.parseInt(row.get(outletCol));
            } catch (NumberFormatException e) {
                skip(lineNumber, "artery '" + name + "' has non-integer inlet/outlet nodes");
                continue;
            }
            if (!seen.add(name)) {
                skip(lineNumber, "artery '" + name + "' is declared more than once");
                continue;
            }
            arteries.add(new Artery(name, inlet, outlet, lineNumber));
            registerSite(name);
        }

        Map<Integer, List<Artery>> byOutlet = new LinkedHashMap<>();
        for (Artery artery : arteries) {
            byOutlet.computeIfAbsent(artery.outlet(), k -> new ArrayList<>()).add(artery);
        }
        for (Artery artery : arteries) {
            List<Artery> feeders = new ArrayList<>(byOutlet.getOrDefault(artery.inlet(), List.of()));
            feeders.remove(artery);
            if (feeders.isEmpty()) {
                continue;
            }
            Artery parent = feeders.get(0);
            if (feeders.size() > 1) {
                warn(artery.line(), "node " + artery.inlet() + " is fed by " + feeders.stream().map(Artery::name).toList()
                    + ", using '" + parent.name() + "' as parent of '" + artery.name() + "'");
            }
            addSegment(parent.name(), artery.name(), "node " + artery.inlet(), artery.line());
        }
    }

    private void addSegment(String parentId, String childId, String label, int lineNumber) {
        if (parentId.equals(childId)) {
            throw new CyclicOrMultiParentException(
                "Line " + lineNumber + ": site '" + childId + "' is declared as its own parent");
        }
        Site parent = registerSite(parentId);
        Site child = registerSite(childId);
        Site existing = parentById.get(childId);
        if (existing != null) {
            if (existing.equals(parent)) {
                warn(lineNumber, "duplicate segment " + parentId + " -> " + childId + " ignored");
                return;
            }
            throw new CyclicOrMultiParentException(
                "Line " + lineNumber + ": site '" + childId + "' already has parent '" + existing.id()
                    + "', cannot also be a child of '" + parentId + "'");
        }
        parentById.put(childId, parent);
        segments.add(new Segment(parent, child, label));
    }

    private Site registerSite(String id) {
        return sitesById.computeIfAbsent(id, Site::new);
    }

    private Site findRoot() {
        List<String> roots = new ArrayList<>();
        for (String id : sitesById.keySet()) {
            if (!parentById.containsKey(id)) {
                roots.add(id);
            }
        }
        if (roots.size() > 1) {
            throw new MultipleRootsException(roots);
        }
        if (roots.isEmpty()) {
            throw new CyclicOrMultiParentException("Every site has a parent, the model contains a cycle");
        }
        return sitesById.get(roots.get(0));
    }

    private void requireAllReachable(Site root) {
        Map<String, List<String>> children = new HashMap<>();
        for (Segment segment : segments) {
            children.computeIfAbsent(segment.parent().id(), k -> new ArrayList<>()).add(segment.child().id());
        }
        Set<String> reached = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.push(root.id());
        while (!pending.isEmpty()) {
            String id = pending.pop();
            if (reached.add(id)) {
                children.getOrDefault(id, List.of()).forEach(pending::push);
            }
        }
        if (reached.size() != sitesById.size()) {
            List<String> unreachable = sitesById.keySet().stream().filter(id -> !reached.contains(id)).toList();
            throw new CyclicOrMultiParentException(
                "Sites " + unreachable + " are not reachable from root '" + root.id() + "', they form a cycle");
        }
    }

    private void skip(int lineNumber, String reason) {
        skippedLines++;
        warn(lineNumber, reason);
    }

    private void warn(int lineNumber, String reason) {
        String message = "line " + lineNumber + ": " + reason;
        warnings.add(message);
        logger.warn("model: {}", message);
    }

    private static int firstMeaningfulLine(String[] lines) {
        for (int i = 0; i < lines.length; i++) {
            if (!isIgnorable(lines[i].strip())) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isIgnorable(String line) {
        return line.isEmpty() || line.startsWith("#");
    }

    private static boolean isArteryTableHeader(String line) {
        if (line.indexOf('\t') < 0) {
            return false;
        }
        List<String> header = splitTabs(line);
        return columnIndex(header, NAME_COLUMN) >= 0
            && columnIndex(header, INLET_COLUMN) >= 0
            && columnIndex(header, OUTLET_COLUMN) >= 0;
    }

    private static int columnIndex(List<String> header, String column) {
        for (int i = 0; i < header.size(); i++) {
            if (header.get(i).toLowerCase(Locale.ROOT).equals(column)) {
                return i;
            }
        }
        return -1;
    }

    private static List<String> splitTabs(String line) {
        List<String> fields = new ArrayList<>();
        for (String field : line.split("\t", -1)) {
            fields.add(field.strip());
        }
        return fields;
    }

    /// Split an edge-list line. An arrow before any tab or comma separates the
    /// parent from the rest (`A -> B, label`); otherwise tabs win over commas,
    /// commas over arrows, and whitespace is the last resort.
    private static List<String> splitFields(String line) {
        int arrow = line.indexOf("->");
        if (arrow >= 0 && isBefore(arrow, line.indexOf('\t')) && isBefore(arrow, line.indexOf(','))) {
            List<String> fields = new ArrayList<>();
            fields.add(line.substring(0, arrow).strip());
            fields.addAll(splitOn(line.substring(arrow + 2), false));
            return fields;
        }
        return splitOn(line, true);
    }

    private static boolean isBefore(int index, int other) {
        return other < 0 || index < other;
    }

    private static List<String> splitOn(String text, boolean splitWhitespace) {
        String[] parts;
        if (text.indexOf('\t') >= 0) {
            parts = text.split("\t", -1);
        } else if (text.indexOf(',') >= 0) {
            parts = text.split(",", -1);
        } else if (text.contains("->")) {
            parts = text.split("->", -1);
        } else if (splitWhitespace) {
            parts = WHITESPACE.split(text);
        } else {
            parts = new String[] {text};
        }
        List<String> fields = new ArrayList<>(parts.length);
        for (String part : parts) {
            fields.add(part.strip());
        }
        return fields;
    }

    private record Artery(String name, int inlet, int outlet, int line) {}
}
