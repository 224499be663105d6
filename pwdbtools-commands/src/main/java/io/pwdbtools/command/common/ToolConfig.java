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

import io.pwdbtools.PwdbException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/// Defaults for the plot command read from a YAML file, by default
/// `~/.config/pwdbtools/config.yaml`:
///
/// ```yaml
/// model: /data/pwdb/models/Complete.tsv
/// dir: /tmp/pwdb-plots
/// types: P,U
/// ```
///
/// Every key is optional; command line options always win.
/// @param model the default model file, or null
/// @param dir the default output directory, or null
/// @param types the default comma-separated signal types, or null
public record ToolConfig(Path model, Path dir, String types) {

    private static final Logger logger = LogManager.getLogger(ToolConfig.class);

    /// the default configuration file location
    public static final Path DEFAULT_LOCATION =
        Path.of(System.getProperty("user.home"), ".config", "pwdbtools", "config.yaml");

    public static ToolConfig empty() {
        return new ToolConfig(null, null, null);
    }

    /// Load the default configuration file if there is one.
    /// @return the configuration, empty when the file does not exist
    /// @throws IOException if the file exists but cannot be read
    public static ToolConfig loadDefault() throws IOException {
        if (!Files.isRegularFile(DEFAULT_LOCATION)) {
            return empty();
        }
        return load(DEFAULT_LOCATION);
    }

    /// Load a configuration file.
    /// @param file the YAML file
    /// @return the configuration
    /// @throws IOException if the file cannot be read
    public static ToolConfig load(Path file) throws IOException {
        String text = Files.readString(expandTilde(file));
        LoadSettings loadSettings = LoadSettings.builder().build();
        Load yaml = new Load(loadSettings);
        Object document = yaml.loadFromString(text);
        if (document == null) {
            return empty();
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new PwdbException(file + " must be a YAML mapping of model, dir and types");
        }
        ToolConfig config = new ToolConfig(
            path(map.get("model")),
            path(map.get("dir")),
            map.get("types") == null ? null : String.valueOf(map.get("types"))
        );
        logger.debug("loaded tool configuration from {}: {}", file, config);
        return config;
    }

    public Optional<Path> modelPath() {
        return Optional.ofNullable(model);
    }

    public Optional<Path> outputDirectory() {
        return Optional.ofNullable(dir);
    }

    public Optional<String> signalTypes() {
        return Optional.ofNullable(types);
    }

    private static Path path(Object value) {
        return value == null ? null : expandTilde(Path.of(String.valueOf(value)));
    }

    static Path expandTilde(Path path) {
        String text = path.toString();
        if (text.equals("~") || text.startsWith("~/")) {
            return Path.of(System.getProperty("user.home") + text.substring(1));
        }
        return path;
    }
}
