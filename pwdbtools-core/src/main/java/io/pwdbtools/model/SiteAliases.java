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

import io.pwdbtools.PwdbException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Maps model site names (`Left Radial Artery`) to the signal prefixes used in
/// recorded signal names (`Radial`), and back.
///
/// Mappings are grouped in generations, newest first; a lookup uses the first
/// generation that knows the name, which lets the newer dataset layout take
/// precedence while older models still resolve. Some prefixes are also recorded
/// under a combined prefix in certain topologies (`LMCA` and `RMCA` as `MCA`).
///
/// The default tables ship as the `site-aliases.yaml` classpath resource.
public final class SiteAliases {

    private static final Logger logger = LogManager.getLogger(SiteAliases.class);
    private static final String DEFAULT_RESOURCE = "/site-aliases.yaml";

    private final List<Generation> generations;
    private final Map<String, String> combined;

    /// one named site-name-to-prefix table
    /// @param name the generation name, e.g. `v2`
    /// @param prefixBySite the mapping from model site name to signal prefix
    public record Generation(String name, Map<String, String> prefixBySite) {
        public Generation {
            prefixBySite = Collections.unmodifiableMap(new LinkedHashMap<>(prefixBySite));
        }
    }

    public SiteAliases(List<Generation> generations, Map<String, String> combined) {
        this.generations = List.copyOf(generations);
        this.combined = Collections.unmodifiableMap(new LinkedHashMap<>(combined));
    }

    /// @return aliases with no mappings, every name maps to itself
    public static SiteAliases empty() {
        return new SiteAliases(List.of(), Map.of());
    }

    /// @return the bundled PWDB alias tables
    public static SiteAliases defaults() {
        try (InputStream in = SiteAliases.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new PwdbException("Bundled alias resource " + DEFAULT_RESOURCE + " is missing");
            }
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + DEFAULT_RESOURCE, e);
        }
    }

    /// Load alias tables from a YAML file.
    /// @param yamlFile the file
    /// @return the aliases
    /// @throws IOException if the file cannot be read
    public static SiteAliases load(Path yamlFile) throws IOException {
        try (InputStream in = Files.newInputStream(yamlFile)) {
            return load(in);
        }
    }

    /// Load alias tables from YAML with a `generations` list of `{name, sites}`
    /// entries and an optional `combined` map.
    /// @param yaml the YAML stream
    /// @return the aliases
    public static SiteAliases load(InputStream yaml) {
        LoadSettings loadSettings = LoadSettings.builder().build();
        Load load = new Load(loadSettings);
        Object document = load.loadFromInputStream(yaml);
        if (!(document instanceof Map<?, ?> root)) {
            throw new PwdbException("Alias tables must be a YAML mapping");
        }

        List<Generation> generations = new ArrayList<>();
        Object generationList = root.get("generations");
        if (generationList instanceof List<?> entries) {
            for (Object entry : entries) {
                if (!(entry instanceof Map<?, ?> generation)) {
                    throw new PwdbException("Alias generation entries must be mappings, found: " + entry);
                }
                String name = String.valueOf(generation.get("name"));
                generations.add(new Generation(name, stringMap(generation.get("sites"), "sites of " + name)));
            }
        }
        Map<String, String> combined = stringMap(root.get("combined"), "combined");
        logger.debug("loaded {} alias generations and {} combined prefixes", generations.size(), combined.size());
        return new SiteAliases(generations, combined);
    }

    /// @param siteName a model site name
    /// @return the signal prefix for the site, from the newest generation that knows it
    public Optional<String> prefixFor(String siteName) {
        for (Generation generation : generations) {
            String prefix = generation.prefixBySite().get(siteName);
            if (prefix != null) {
                return Optional.of(prefix);
            }
        }
        return Optional.empty();
    }

    /// Map a model site name or signal prefix to the signal prefix; unknown names
    /// are assumed to already be prefixes.
    /// @param name a model site name or a signal prefix
    /// @return the signal prefix
    public String toPrefix(String name) {
        return prefixFor(name).orElse(name);
    }

    /// @param prefix a signal prefix
    /// @return every model site name mapped to the prefix, newest generation first
    public List<String> siteNamesFor(String prefix) {
        LinkedHashSet<String> names = new LinkedHashSet<>();
        for (Generation generation : generations) {
            generation.prefixBySite().forEach((site, p) -> {
                if (p.equals(prefix)) {
                    names.add(site);
                }
            });
        }
        return List.copyOf(names);
    }

    public boolean isKnownPrefix(String prefix) {
        return generations.stream().anyMatch(g -> g.prefixBySite().containsValue(prefix));
    }

    public boolean isKnownSiteName(String siteName) {
        return generations.stream().anyMatch(g -> g.prefixBySite().containsKey(siteName));
    }

    /// @param prefix a signal prefix
    /// @return the prefix under which some topologies record this site combined with others
    public Optional<String> combinedPrefixFor(String prefix) {
        return Optional.ofNullable(combined.get(prefix));
    }

    public List<Generation> generations() {
        return generations;
    }

    private static Map<String, String> stringMap(Object node, String what) {
        Map<String, String> result = new LinkedHashMap<>();
        if (node == null) {
            return result;
        }
        if (!(node instanceof Map<?, ?> map)) {
            throw new PwdbException("Expected a mapping for " + what + ", found: " + node);
        }
        map.forEach((k, v) -> result.put(String.valueOf(k), String.valueOf(v)));
        return result;
    }
}
