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

package io.pwdbtools.wfdb;

import io.pwdbtools.PwdbException;
import io.pwdbtools.selection.InMemorySignalCatalog;
import io.pwdbtools.selection.SeriesHandle;
import io.pwdbtools.selection.SignalKey;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Discovers the WFDB record directories below dataset roots and builds one
 * {@link InMemorySignalCatalog} per directory from the record headers.
 *
 * <p>Record directories are the {@code PWs/wfdb} directories anywhere below a
 * root, in sorted path order; roots keep the order they were given in. Within a
 * directory, records {@code pwdb*.hea} are sorted by name and numbered from 1,
 * which is the subject index. The catalog label is the directory holding
 * {@code PWs}, i.e. the topology name such as {@code Complete}; labels stay
 * unique across all scanned roots so export names never collide.</p>
 *
 * <p>Only header text is read; signal values are left to the renderer.</p>
 */
public class WfdbCatalogScanner {

    private static final Logger logger = LogManager.getLogger(WfdbCatalogScanner.class);

    public static final String RECORD_GLOB = "pwdb*.hea";
    private static final Path RECORD_DIR = Path.of("PWs", "wfdb");

    /// Scan dataset roots.
    /// @param roots the dataset roots, in display order
    /// @return one catalog per record directory found
    /// @throws IOException if a root is missing or cannot be walked
    public List<InMemorySignalCatalog> scan(List<Path> roots) throws IOException {
        List<RecordDirectory> found = new ArrayList<>();
        for (Path root : roots) {
            if (!Files.isDirectory(root)) {
                throw new NoSuchFileException(root.toString(), null, "dataset root is not a directory");
            }
            List<Path> recordDirs;
            try (Stream<Path> walk = Files.walk(root)) {
                recordDirs = walk.filter(Files::isDirectory)
                    .filter(p -> p.endsWith(RECORD_DIR))
                    .sorted()
                    .collect(Collectors.toList());
            }
            if (recordDirs.isEmpty()) {
                logger.warn("no {} directories below {}", RECORD_DIR, root);
            }
            for (Path dir : recordDirs) {
                found.add(new RecordDirectory(root, dir));
            }
        }

        List<String> labels = uniqueLabels(found);
        List<InMemorySignalCatalog> catalogs = new ArrayList<>();
        for (int i = 0; i < found.size(); i++) {
            Path dir = found.get(i).dir();
            InMemorySignalCatalog catalog = scanDirectory(dir, labels.get(i));
            if (catalog.subjects().isEmpty()) {
                logger.warn("no {} records in {}", RECORD_GLOB, dir);
            } else {
                catalogs.add(catalog);
            }
        }
        return catalogs;
    }

    /// Labels are topology names. A topology name found more than once, e.g.
    /// `Complete` below two dataset roots, is prefixed with its root's name, and
    /// numbered if that is still not enough to tell the directories apart.
    static List<String> uniqueLabels(List<RecordDirectory> found) {
        List<String> labels = new ArrayList<>();
        for (RecordDirectory entry : found) {
            labels.add(labelFor(entry.dir()));
        }
        Map<String, Long> counts = labels.stream()
            .collect(Collectors.groupingBy(l -> l, Collectors.counting()));
        for (int i = 0; i < labels.size(); i++) {
            if (counts.get(labels.get(i)) > 1) {
                Path rootName = found.get(i).root().toAbsolutePath().normalize().getFileName();
                String prefix = rootName != null ? rootName.toString() : "root";
                labels.set(i, prefix + "-" + labels.get(i));
            }
        }

        Map<String, Integer> seen = new HashMap<>();
        Set<String> taken = new HashSet<>(labels);
        for (int i = 0; i < labels.size(); i++) {
            String label = labels.get(i);
            int occurrence = seen.merge(label, 1, Integer::sum);
            if (occurrence > 1) {
                int n = occurrence;
                String numbered = label + "-" + n;
                while (!taken.add(numbered)) {
                    numbered = label + "-" + (++n);
                }
                logger.warn("dataset label '{}' is used more than once, exporting {} as '{}'",
                    label, found.get(i).dir(), numbered);
                labels.set(i, numbered);
            }
        }
        return labels;
    }

    /// Build the catalog of one record directory.
    /// @param recordDir a directory of WFDB headers
    /// @return the catalog
    /// @throws IOException if a header cannot be read
    public InMemorySignalCatalog scanDirectory(Path recordDir) throws IOException {
        return scanDirectory(recordDir, labelFor(recordDir));
    }

    /// Build the catalog of one record directory under a given label.
    /// @param recordDir a directory of WFDB headers
    /// @param label the dataset label
    /// @return the catalog
    /// @throws IOException if a header cannot be read
    public InMemorySignalCatalog scanDirectory(Path recordDir, String label) throws IOException {
        List<Path> headers = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(recordDir, RECORD_GLOB)) {
            stream.forEach(headers::add);
        }
        headers.sort(null);

        InMemorySignalCatalog.Builder builder = InMemorySignalCatalog.builder(label).root(recordDir);
        int skipped = 0;
        for (int i = 0; i < headers.size(); i++) {
            int subject = i + 1;
            Path headerFile = headers.get(i);
            WfdbHeader header = WfdbHeader.read(headerFile);
            builder.subject(subject);
            List<String> names = header.signalNames();
            for (int index = 0; index < names.size(); index++) {
                String name = names.get(index);
                try {
                    SignalKey key = SignalKey.parse(name);
                    builder.add(subject, key, new SeriesHandle(header.recordName(), headerFile, index, name));
                } catch (PwdbException | IllegalArgumentException e) {
                    skipped++;
                    logger.debug("{}: skipping signal '{}': {}", headerFile.getFileName(), name, e.getMessage());
                }
            }
        }
        logger.info("{}: {} records in {}{}", label, headers.size(), recordDir,
            skipped > 0 ? " (" + skipped + " unrecognized signals skipped)" : "");
        return builder.build();
    }

    static String labelFor(Path recordDir) {
        Path pws = recordDir.toAbsolutePath().normalize().getParent();
        Path topology = pws != null ? pws.getParent() : null;
        if (topology != null && topology.getFileName() != null) {
            return topology.getFileName().toString();
        }
        return recordDir.getFileName().toString();
    }

    record RecordDirectory(Path root, Path dir) {}
}
