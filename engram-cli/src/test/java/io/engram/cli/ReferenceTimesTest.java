package io.engram.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class ReferenceTimesTest {

    @Test
    void shouldAcceptInstantsDateTimesAndDates() {
        assertThat(ReferenceTimes.parse("2025-03-01T09:30:00Z")).isEqualTo(Instant.parse("2025-03-01T09:30:00Z"));
        assertThat(ReferenceTimes.parse("2025-03-01 09:30")).isEqualTo(Instant.parse("2025-03-01T09:30:00Z"));
        assertThat(ReferenceTimes.parse("2025-03-01")).isEqualTo(Instant.parse("2025-03-01T00:00:00Z"));
        assertThat(ReferenceTimes.parse(" ")).isNull();
    }

    @Test
    void shouldRejectUnknownFormats() {
        assertThatThrownBy(() -> ReferenceTimes.parse("next tuesday"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("next tuesday");
    }
}
