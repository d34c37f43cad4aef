package io.engram.core.temporal;

import static org.assertj.core.api.Assertions.assertThat;

import io.engram.core.memory.Foresight;
import io.engram.core.memory.MemoryUnit;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class TemporalFilterTest {
    private static final Instant DAY_1 = Instant.parse("2025-01-01T00:00:00Z");

    private final TemporalFilter filter = new TemporalFilter();

    @Test
    void foresightShouldBeIncludedOnDaySevenAndExcludedOnDayNine() {
        MemoryUnit trip = unit("trip", List.of(), List.of(Foresight.of("travelling in Japan", DAY_1, day(8), 0.8)));

        List<MemoryUnit> daySeven = filter.apply(List.of(trip), day(7));
        List<MemoryUnit> dayNine = filter.apply(List.of(trip), day(9));

        assertThat(daySeven).hasSize(1);
        assertThat(daySeven.get(0).foresights()).extracting(Foresight::content).containsExactly("travelling in Japan");
        assertThat(dayNine).isEmpty();
    }

    @Test
    void unitWithAtomicFactsShouldSurviveWithExpiredForesightsRemoved() {
        MemoryUnit unit = unit("work", List.of("User works as a nurse"), List.of(
            Foresight.of("night shifts", DAY_1, day(3), 0.8),
            Foresight.of("training course", DAY_1, null, 0.8)
        ));

        List<MemoryUnit> result = filter.apply(List.of(unit), day(9));

        assertThat(result).hasSize(1);
        assertThat(result.get(0).atomicFacts()).containsExactly("User works as a nurse");
        assertThat(result.get(0).foresights()).extracting(Foresight::content).containsExactly("training course");
    }

    @Test
    void shouldPreserveInputOrder() {
        MemoryUnit first = unit("b", List.of("fact b"), List.of());
        MemoryUnit expired = unit("x", List.of(), List.of(Foresight.of("gone", DAY_1, day(2), 0.8)));
        MemoryUnit last = unit("a", List.of("fact a"), List.of());

        List<MemoryUnit> result = filter.apply(List.of(first, expired, last), day(5));

        assertThat(result).extracting(MemoryUnit::id).containsExactly("b", "a");
    }

    private static Instant day(int number) {
        return DAY_1.plus(Duration.ofDays(number - 1L));
    }

    private static MemoryUnit unit(String id, List<String> facts, List<Foresight> foresights) {
        return new MemoryUnit(id, "c1", "narrative " + id, facts, foresights, List.of(), List.of(), DAY_1, null, List.of(1.0));
    }
}
