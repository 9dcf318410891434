package com.bomanalyzer.core.analysis;

import com.bomanalyzer.core.BomFixtures;
import com.bomanalyzer.core.model.Catalogue;
import com.bomanalyzer.core.model.DepthResult;
import com.bomanalyzer.core.model.Diagnostic;
import com.bomanalyzer.core.model.ProductId;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.bomanalyzer.core.BomFixtures.bom;
import static com.bomanalyzer.core.BomFixtures.id;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DepthAnalyzer}.
 */
class DepthAnalyzerTest {

    private final DepthAnalyzer analyzer = new DepthAnalyzer();

    @Test
    void computeDepths_leafProduct_isZero() {
        DepthResult result = analyzer.computeDepths(bom().purchased("1", "3.0").build());

        assertThat(result.depthOf(id(1))).isZero();
    }

    @Test
    void computeDepths_multiLevel_countsLongestChain() {
        DepthResult result = analyzer.computeDepths(BomFixtures.multiLevel());

        assertThat(result.depths()).containsExactly(
            entry(1, 2), entry(11, 1), entry(12, 0));
        assertThat(result.maxDepth()).isEqualTo(2);
        assertThat(result.hasDiagnostics()).isFalse();
    }

    @Test
    void computeDepths_quantityDoesNotAffectDepth() {
        Catalogue catalogue = bom()
            .assembly("1", "2", "500")
            .purchased("2", "1.0")
            .build();

        assertThat(analyzer.computeDepths(catalogue).depthOf(id(1))).isEqualTo(1);
    }

    @Test
    void computeDepths_sharedSubassembly_isNotACycle() {
        Catalogue catalogue = bom()
            .assembly("1", "2", "1")
            .assembly("1", "3", "1")
            .assembly("2", "4", "1")
            .assembly("3", "4", "1")
            .assembly("4", "5", "1")
            .purchased("5", "1.0")
            .build();

        DepthResult result = analyzer.computeDepths(catalogue);

        assertThat(result.depthOf(id(1))).isEqualTo(3);
        assertThat(result.depthOf(id(4))).isEqualTo(1);
    }

    @Test
    void computeDepths_longestBranchWins() {
        Catalogue catalogue = bom()
            .assembly("1", "2", "1")
            .assembly("1", "3", "1")
            .assembly("3", "4", "1")
            .purchased("2", "1.0")
            .purchased("4", "1.0")
            .build();

        assertThat(analyzer.computeDepths(catalogue).depthOf(id(1))).isEqualTo(2);
    }

    @Test
    void computeDepths_unresolvedEdge_countsOneAndReports() {
        Catalogue catalogue = bom()
            .assembly("1", "2", "1")
            .assembly("2", "99", "1")
            .build();

        DepthResult result = analyzer.computeDepths(catalogue);

        assertThat(result.depthOf(id(1))).isEqualTo(2);
        assertThat(result.depthOf(id(2))).isEqualTo(1);
        // the edge is crossed once from each root
        assertThat(result.diagnosticsFor(id(2))).containsExactly(
            Diagnostic.unresolvedReference(id(2), id(99)),
            Diagnostic.unresolvedReference(id(2), id(99)));
    }

    @Test
    void computeDepths_cycle_throwsWithPath() {
        Catalogue catalogue = bom()
            .assembly("1", "2", "1")
            .assembly("2", "3", "1")
            .assembly("3", "2", "1")
            .build();

        assertThatThrownBy(() -> analyzer.computeDepths(catalogue))
            .isInstanceOf(CycleDetectedException.class)
            .hasMessage("Cycle detected in product structure: 2 -> 3 -> 2")
            .satisfies(e -> assertThat(((CycleDetectedException) e).cycle())
                .containsExactly(id(2), id(3), id(2)));
    }

    @Test
    void computeDepths_selfReference_throwsCycle() {
        Catalogue catalogue = bom().assembly("1", "1", "1").build();

        assertThatThrownBy(() -> analyzer.computeDepths(catalogue))
            .isInstanceOf(CycleDetectedException.class)
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void computeDepths_repeatedRuns_giveSameDepths() {
        Catalogue catalogue = BomFixtures.multiLevel();

        DepthResult first = analyzer.computeDepths(catalogue);
        DepthResult second = analyzer.computeDepths(catalogue);

        assertThat(second.depths()).isEqualTo(first.depths());
    }

    @Test
    void computeDepth_singleRoot_returnsOnlyThatRoot() {
        DepthResult result = analyzer.computeDepth(BomFixtures.multiLevel(), id(11));

        assertThat(result.depths()).containsOnlyKeys(id(11));
        assertThat(result.depthOf(id(11))).isEqualTo(1);
    }

    @Test
    void computeDepth_unknownRoot_throwsException() {
        assertThatThrownBy(() -> analyzer.computeDepth(BomFixtures.multiLevel(), id(404)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("404");
    }

    @Test
    void depthOf_productNotComputed_throwsException() {
        DepthResult result = analyzer.computeDepths(BomFixtures.singleLevel());

        assertThatThrownBy(() -> result.depthOf(id(404)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void traversal_reused_throwsException() {
        Catalogue catalogue = BomFixtures.singleLevel();
        DepthTraversal traversal = new DepthTraversal(
            catalogue, catalogue.find(id(1)).orElseThrow(), new DiagnosticLog("depth"));

        assertThat(traversal.run()).isEqualTo(1);
        assertThatThrownBy(traversal::run)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already completed");
    }

    private static Map.Entry<ProductId, Integer> entry(long number, int depth) {
        return Map.entry(id(number), depth);
    }
}
