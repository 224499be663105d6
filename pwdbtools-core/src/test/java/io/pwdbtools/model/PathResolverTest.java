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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PathResolver")
class PathResolverTest {

    private PathResolver resolver;

    @BeforeEach
    void setUp() {
        ModelGraph graph = new ModelGraphBuilder().build(ModelGraphBuilderTest.ARM_MODEL + "\n"
            + "AorticRoot, Carotid(L)\n"
            + "AorticRoot, Carotid(R)\n"
            + "AorticRoot, Femoral\n"
            + "Femoral, Femoral Profunda\n");
        resolver = new PathResolver(graph);
    }

    @Test
    @DisplayName("should resolve a bare name to its qualified site and list the full path")
    void shouldResolveBareName() {
        assertThat(resolver.resolve("Digital"))
            .extracting(Site::id)
            .containsExactly("AorticRoot", "Subclavian", "Axillary", "Brachial", "Radial", "Digital(P1)");
    }

    @Test
    @DisplayName("should trace AorticRoot to Digital")
    void shouldTraceShortArm() {
        ModelGraph graph = new ModelGraphBuilder().build("AorticRoot, Brachial\nBrachial, Radial\nRadial, Digital");

        assertThat(new PathResolver(graph).resolve("Digital"))
            .extracting(Site::id)
            .containsExactly("AorticRoot", "Brachial", "Radial", "Digital");
    }

    @Test
    @DisplayName("should resolve the root to a single-site path")
    void shouldResolveRoot() {
        assertThat(resolver.resolve("AorticRoot")).containsExactly(new Site("AorticRoot"));
    }

    @Test
    @DisplayName("should prefer an exact identifier over a prefix")
    void shouldPreferExactMatch() {
        assertThat(resolver.match("Femoral")).isEqualTo(new Site("Femoral"));
        assertThat(resolver.match("Carotid(R)")).isEqualTo(new Site("Carotid(R)"));
    }

    @Test
    @DisplayName("should resolve a unique prefix of a bare name")
    void shouldResolveUniquePrefix() {
        assertThat(resolver.match("Axil")).isEqualTo(new Site("Axillary"));
        assertThat(resolver.match("Femoral P")).isEqualTo(new Site("Femoral Profunda"));
    }

    @Test
    @DisplayName("should fail for an unknown site")
    void shouldFailForUnknownSite() {
        assertThatThrownBy(() -> resolver.resolve("Unknown"))
            .isInstanceOf(SiteNotFoundException.class)
            .hasMessageContaining("Unknown");
    }

    @Test
    @DisplayName("should not substitute a different qualifier for the one asked for")
    void shouldFailForUnknownQualifier() {
        assertThatThrownBy(() -> resolver.resolve("Digital(P3)"))
            .isInstanceOf(SiteNotFoundException.class)
            .hasMessageContaining("Digital(P3)");
        assertThatThrownBy(() -> resolver.match("Dig(P3)"))
            .isInstanceOf(SiteNotFoundException.class);
    }

    @Test
    @DisplayName("should use the qualifier to choose between sites sharing a bare name")
    void shouldMatchQualifierLoosely() {
        assertThat(resolver.match("Carotid (L)")).isEqualTo(new Site("Carotid(L)"));
        assertThat(resolver.match("Dig(P1)")).isEqualTo(new Site("Digital(P1)"));
    }

    @Test
    @DisplayName("should list every candidate when a bare name is shared")
    void shouldFailForAmbiguousBareName() {
        assertThatThrownBy(() -> resolver.resolve("Carotid"))
            .isInstanceOf(AmbiguousSiteException.class)
            .satisfies(e -> assertThat(((AmbiguousSiteException) e).getCandidates())
                .containsExactlyInAnyOrder("Carotid(L)", "Carotid(R)"));
    }

    @Test
    @DisplayName("should fail when a prefix matches several sites")
    void shouldFailForAmbiguousPrefix() {
        assertThatThrownBy(() -> resolver.match("A"))
            .isInstanceOf(AmbiguousSiteException.class)
            .hasMessageContaining("AorticRoot")
            .hasMessageContaining("Axillary");
    }

    @Nested
    @DisplayName("with site aliases")
    class WithAliases {

        private PathResolver aliased;

        @BeforeEach
        void setUp() {
            ModelGraph graph = new ModelGraphBuilder().build(String.join("\n",
                "Name\tInlet node\tOutlet node",
                "Ascending Aorta\t1\t2",
                "Left Subclavian Artery\t2\t3",
                "Left Brachial Artery\t3\t4",
                "Left Radial Artery\t4\t5",
                "Left Digital Artery 3\t5\t6"
            ));
            aliased = new PathResolver(graph, SiteAliases.defaults());
        }

        @Test
        @DisplayName("should resolve a signal prefix to its model site")
        void shouldResolveSignalPrefix() {
            assertThat(aliased.resolve("Radial"))
                .extracting(Site::id)
                .containsExactly("Ascending Aorta", "Left Subclavian Artery", "Left Brachial Artery", "Left Radial Artery");
        }

        @Test
        @DisplayName("should still accept model site names")
        void shouldAcceptModelNames() {
            assertThat(aliased.match("Left Digital Artery 3")).isEqualTo(new Site("Left Digital Artery 3"));
            assertThat(aliased.match("Digital")).isEqualTo(new Site("Left Digital Artery 3"));
        }
    }
}
