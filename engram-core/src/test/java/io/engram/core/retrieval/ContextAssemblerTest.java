package io.engram.core.retrieval;

import static org.assertj.core.api.Assertions.assertThat;

import io.engram.core.memory.Foresight;
import io.engram.core.memory.MemoryUnit;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class ContextAssemblerTest {
    private static final Instant T1 = Instant.parse("2025-01-01T00:00:00Z");

    private final ContextAssembler assembler = new ContextAssembler();

    @Test
    void shouldRenderProfileThenNumberedEpisodes() {
        MemoryUnit trip = unit("u1", "User said: I'm off to Lisbon", List.of("User likes trams"),
            List.of(Foresight.of("Trip to Lisbon", T1, Instant.parse("2025-01-08T00:00:00Z"), 0.8)));
        MemoryUnit work = unit("u2", "User said: I work as a nurse", List.of("User occupation is nurse"), List.of());

        String context = assembler.assemble("[Current Profile]\n  - occupation: nurse\n", List.of(retrieved(trip), retrieved(work)));

        assertThat(context).isEqualTo(
            "[Current Profile]\n  - occupation: nurse"
                + "\n\n---\n\n"
                + "[Episode 1]\nUser said: I'm off to Lisbon"
                + "\n\nActive Foresights:\n  - Trip to Lisbon (until 2025-01-08T00:00:00Z)"
                + "\n\nKey Facts:\n  - User likes trams"
                + "\n\n---\n\n"
                + "[Episode 2]\nUser said: I work as a nurse\n\nKey Facts:\n  - User occupation is nurse"
        );
    }

    @Test
    void episodeWithoutNarrativeShouldShowOnlyItsFacts() {
        MemoryUnit unit = unit("u1", "", List.of("User location is Boston"), List.of());

        assertThat(assembler.assemble("", List.of(retrieved(unit))))
            .isEqualTo("[Episode 1]\n\nKey Facts:\n  - User location is Boston");
    }

    @Test
    void onlyFirstFiveFactsShouldBeListed() {
        MemoryUnit unit = unit("u1", "chat", List.of("f1", "f2", "f3", "f4", "f5", "f6"), List.of());

        String context = assembler.assemble(null, List.of(retrieved(unit)));

        assertThat(context).contains("  - f5").doesNotContain("f6");
    }

    private static RetrievedUnit retrieved(MemoryUnit unit) {
        return new RetrievedUnit(unit, 0.5);
    }

    private static MemoryUnit unit(String id, String narrative, List<String> facts, List<Foresight> foresights) {
        return new MemoryUnit(id, "c1", narrative, facts, foresights, List.of(), List.of(), T1, null, List.of(1.0));
    }
}
