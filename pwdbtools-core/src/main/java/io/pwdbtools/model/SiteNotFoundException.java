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

/// Thrown when a site name matches no site of the model, neither exactly, by bare
/// name, nor by prefix.
public class SiteNotFoundException extends ModelException {

    private final String name;

    public SiteNotFoundException(String name) {
        super("Site '" + name + "' was not found in the model");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
