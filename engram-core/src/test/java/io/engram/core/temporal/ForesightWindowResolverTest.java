package io.engram.core.temporal;

import static org.assertj.core.api.Assertions.assertThat;

import io.engram.core.extraction.ForesightCandidate;
import io.engram.core.memory.Foresight;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class ForesightWindowResolverTest {
    private static final Instant NOW = Instant.parse("2025-03-20T10:00:00Z");

    private final ForesightWindowResolver resolver = new ForesightWindowResolver();

    @Test
    void shouldResolveCountedDurations() {
        assertThat(end("for 10 days")).isEqualTo(NOW.plus(Duration.ofDays(10)));
        assertThat(end("two weeks")).isEqualTo(NOW.plus(Duration.ofDays(14)));
        assertThat(end("a year")).isEqualTo(NOW.plus(Duration.ofDays(365)));
    }

    @Test
    void shouldResolveRelativeAndOngoingHints() {
        assertThat(end("next month")).isEqualTo(NOW.plus(Duration.ofDays(30)));
        assertThat(end("tomorrow")).isEqualTo(NOW.plus(Duration.ofDays(1)));
        assertThat(end("ongoing")).isEqualTo(NOW.plus(ForesightWindowResolver.ONGOING_REVIEW));
        assertThat(end("indefinite")).isNull();
        assertThat(end("whenever it feels right")).isNull();
    }

    @Test
    void explicitExpiryShouldRunToEndOfThatDay() {
        ForesightCandidate candidate = new ForesightCandidate("conference trip", "3 days", 0, LocalDate.of(2025, 3, 28), 0.9);

        Foresight foresight = resolver.resolve(candidate, NOW).orElseThrow();

        assertThat(foresight.end()).isEqualTo(Instant.parse("2025-03-28T23:59:59Z"));
        assertThat(foresight.confidence()).isEqualTo(0.9);
    }

    @Test
    void startOffsetShouldShiftTheWholeWindow() {
        ForesightCandidate candidate = new ForesightCandidate("holiday", "a week", 5, null, 0.8);

        Foresight foresight = resolver.resolve(candidate, NOW).orElseThrow();

        assertThat(foresight.start()).isEqualTo(NOW.plus(Duration.ofDays(5)));
        assertThat(foresight.end()).isEqualTo(NOW.plus(Duration.ofDays(12)));
    }

    @Test
    void durationPastTheEndOfTimeShouldLeaveTheWindowOpen() {
        assertThat(end("for 99999999999 years")).isNull();
        assertThat(end("999999999999999999999 days")).isNull();
    }

    @Test
    void expiryBeforeStartShouldCollapseToStart() {
        ForesightCandidate candidate = new ForesightCandidate("stale plan", "", 0, LocalDate.of(2025, 1, 1), 0.8);

        Foresight foresight = resolver.resolve(candidate, NOW).orElseThrow();

        assertThat(foresight.end()).isEqualTo(foresight.start());
    }

    @Test
    void blankContentShouldResolveToNothing() {
        assertThat(resolver.resolve(ForesightCandidate.of("  ", "10 days"), NOW)).isEmpty();
    }

    private Instant end(String hint) {
        return resolver.resolve(ForesightCandidate.of("plan", hint), NOW).orElseThrow().end();
    }
}
