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

package io.pwdbtools.navigation;

import io.pwdbtools.selection.SelectionItem;

import java.util.regex.Pattern;

/// Deterministic export file names: `<dataset>_<subject>_<signal>.<ext>`, e.g.
/// `Complete_0004_Radial_P.pdf`. Items get distinct names as long as their
/// dataset labels differ; batch export refuses a selection where two would not.
public final class ExportNaming {

    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9._()-]");

    private ExportNaming() {}

    public static String fileName(SelectionItem item, String extension) {
        return String.format("%s_%04d_%s.%s",
            sanitize(item.dataset()), item.subject(), sanitize(item.key().name()), extension);
    }

    static String sanitize(String part) {
        return UNSAFE.matcher(part).replaceAll("-");
    }
}
