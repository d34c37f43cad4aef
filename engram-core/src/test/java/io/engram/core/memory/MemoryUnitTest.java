package io.engram.core.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class MemoryUnitTest {
    private static final Instant NOW = Instant.parse("2025-01-15T09:00:00Z");

    @Test
    void clusterIdShouldBeAssignableExactlyOnce() {
        MemoryUnit unit = new MemoryUnit("u1", "c1", "narrative", List.of("fact"), List.of(), List.of(), List.of(), NOW, null, List.of(1.0));

        MemoryUnit clustered = unit.withClusterId("k1");

        assertThat(clustered.clusterId()).isEqualTo("k1");
        assertThat(unit.clusterId()).isNull();
        assertThatThrownBy(() -> clustered.withClusterId("k2")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void searchableTextShouldCombineNarrativeFactsAndForesights() {
        MemoryUnit unit = new MemoryUnit(
            "u1",
            "c1",
            "User talked about travel",
            List.of("User lives in Lisbon"),
            List.of(Foresight.of("Trip to Tokyo", NOW, null, 0.8)),
            List.of(),
            List.of(),
            NOW,
            null,
            List.of()
        );

        assertThat(unit.searchableText()).isEqualTo("User talked about travel User lives in Lisbon Trip to Tokyo");
        assertThat(unit.lexicalText()).isEqualTo("User lives in Lisbon");
        assertThat(unit.withAtomicFacts(List.of()).lexicalText()).isEqualTo("User talked about travel");
    }

    @Test
    void foresightShouldRejectEndBeforeStart() {
        assertThatThrownBy(() -> Foresight.of("bad", NOW, NOW.minusSeconds(1), 0.5))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
