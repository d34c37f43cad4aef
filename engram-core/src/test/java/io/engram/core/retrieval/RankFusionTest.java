package io.engram.core.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.Test;

class RankFusionTest {
    private final RankFusion fusion = new RankFusion();

    @Test
    void candidateInBothListsShouldOutrankSingleListLeader() {
        List<FusedCandidate> fused = fusion.fuse(List.of("a", "b"), List.of("b", "c"));

        assertThat(fused).extracting(FusedCandidate::id).containsExactly("b", "a", "c");
        FusedCandidate both = fused.get(0);
        assertThat(both.score()).isCloseTo(1.0 / 62 + 1.0 / 61, within(1e-12));
        assertThat(both.inBothLists()).isTrue();
        assertThat(fused.get(1).score()).isCloseTo(1.0 / 61, within(1e-12));
    }

    @Test
    void topOfBothListsShouldScoreTwoOverSixtyOne() {
        List<FusedCandidate> fused = fusion.fuse(List.of("x", "y"), List.of("x", "z"));

        assertThat(fused.get(0).id()).isEqualTo("x");
        assertThat(fused.get(0).score()).isCloseTo(2.0 / 61, within(1e-12));
    }

    @Test
    void absentListShouldContributeNothing() {
        List<FusedCandidate> fused = fusion.fuse(List.of(), List.of("s1"));

        assertThat(fused).singleElement().satisfies(candidate -> {
            assertThat(candidate.denseRank()).isZero();
            assertThat(candidate.sparseRank()).isEqualTo(1);
            assertThat(candidate.score()).isCloseTo(1.0 / 61, within(1e-12));
        });
    }

    @Test
    void equalScoresShouldBreakTiesById() {
        List<FusedCandidate> fused = fusion.fuse(List.of("m"), List.of("d"));

        assertThat(fused).extracting(FusedCandidate::id).containsExactly("d", "m");
    }

    @Test
    void duplicateIdShouldKeepItsFirstRank() {
        List<FusedCandidate> fused = fusion.fuse(List.of("a", "b", "a"), List.of());

        assertThat(fused).extracting(FusedCandidate::id).containsExactly("a", "b");
        assertThat(fused.get(0).denseRank()).isEqualTo(1);
        assertThat(fused.get(1).denseRank()).isEqualTo(2);
    }

    @Test
    void emptyInputsShouldFuseToNothing() {
        assertThat(fusion.fuse(List.of(), null)).isEmpty();
    }

    @Test
    void negativeConstantShouldBeRejected() {
        assertThatThrownBy(() -> new RankFusion(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
