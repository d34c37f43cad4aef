package io.engram.core.cluster;

import static org.assertj.core.api.Assertions.assertThat;

import io.engram.core.memory.MemoryUnit;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class KeywordClusterLabelerTest {
    private final KeywordClusterLabeler labeler = new KeywordClusterLabeler();

    @Test
    void themeShouldUseMostFrequentContentWords() {
        MemoryUnit unit = unit("ignored", List.of("User runs marathons", "User runs every morning", "Marathons need training"));

        assertThat(labeler.themeFor(unit)).isEqualTo("Runs Marathons Every");
    }

    @Test
    void themeShouldFallBackToGeneral() {
        assertThat(labeler.themeFor(unit("I am", List.of()))).isEqualTo("General");
    }

    @Test
    void summaryShouldKeepTheMostRecentText() {
        String longSummary = "x".repeat(1_190);

        String merged = labeler.mergeSummary(longSummary, unit("newest narrative", List.of()));

        assertThat(merged).hasSize(1_200).endsWith("newest narrative");
    }

    private static MemoryUnit unit(String narrative, List<String> facts) {
        return new MemoryUnit("u", "c", narrative, facts, List.of(), List.of(), List.of(), Instant.EPOCH, null, List.of(1.0));
    }
}
