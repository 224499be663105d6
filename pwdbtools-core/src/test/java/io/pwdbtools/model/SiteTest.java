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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Site")
class SiteTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "Digital(P1), Digital",
        "LeftMiddleCerebralArtery(M1), LeftMiddleCerebralArtery",
        "Left Superior Middle Cerebral Artery (M2), Left Superior Middle Cerebral Artery",
        "Radial, Radial",
        "(odd), (odd)"
    })
    @DisplayName("should strip a trailing qualifier from the bare name")
    void shouldComputeBareName(String id, String bare) {
        assertThat(new Site(id).bareName()).isEqualTo(bare);
    }

    @Test
    @DisplayName("should expose the qualifier")
    void shouldExposeQualifier() {
        assertThat(new Site("Digital(P1)").qualifier()).contains("P1");
        assertThat(new Site("Radial").qualifier()).isEmpty();
    }

    @Test
    @DisplayName("should reject a blank identifier")
    void shouldRejectBlank() {
        assertThatThrownBy(() -> new Site(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
