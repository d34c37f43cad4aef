package io.engram.core.retrieval;

import static org.assertj.core.api.Assertions.assertThat;

import io.engram.core.memory.AttributeClaim;
import io.engram.core.memory.MemoryUnit;
import io.engram.core.profile.AttributeObservation;
import io.engram.core.profile.ConflictResolver;
import io.engram.core.profile.UserProfile;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class SupersededFactFilterTest {
    private static final Instant T1 = Instant.parse("2025-01-01T00:00:00Z");
    private static final Instant T2 = Instant.parse("2025-02-01T00:00:00Z");

    @Test
    void factsBehindReplacedValuesShouldBeRemoved() {
        UserProfile profile = UserProfile.create("carol");
        ConflictResolver resolver = new ConflictResolver();
        resolver.resolve(List.of(new AttributeObservation("diet", "vegetarian", T1, "u1")), profile);
        resolver.resolve(List.of(new AttributeObservation("diet", "pescatarian", T2, "u2")), profile);

        MemoryUnit old = unit("u1", "vegetarian", List.of("User diet is vegetarian", "User likes cooking"));
        MemoryUnit current = unit("u2", "pescatarian", List.of("User diet is pescatarian"));

        List<MemoryUnit> filtered = new SupersededFactFilter().apply(List.of(old, current), profile);

        assertThat(filtered.get(0).atomicFacts()).containsExactly("User likes cooking");
        assertThat(filtered.get(0).narrative()).isEmpty();
        assertThat(filtered.get(1)).isSameAs(current);
    }

    @Test
    void claimWithoutStatementShouldStillHideTheNarrative() {
        UserProfile profile = UserProfile.create("erin");
        new ConflictResolver().resolve(List.of(new AttributeObservation("diet", "pescatarian", T2, "u2")), profile);
        AttributeClaim claim = new AttributeClaim("diet", "vegetarian", null, 0.9);
        MemoryUnit unit = new MemoryUnit(
            "u1", "c1", "User said they are vegetarian", List.of("User enjoys hiking"), List.of(), List.of(claim), List.of(), T1, null, List.of(1.0));

        MemoryUnit filtered = new SupersededFactFilter().apply(List.of(unit), profile).get(0);

        assertThat(filtered.narrative()).isEmpty();
        assertThat(filtered.atomicFacts()).containsExactly("User enjoys hiking");
    }

    @Test
    void claimsForUnknownAttributesShouldBeKept() {
        MemoryUnit unit = unit("u1", "vegan", List.of("User diet is vegan"));

        List<MemoryUnit> filtered = new SupersededFactFilter().apply(List.of(unit), UserProfile.create("dave"));

        assertThat(filtered).containsExactly(unit);
    }

    private static MemoryUnit unit(String id, String diet, List<String> facts) {
        AttributeClaim claim = new AttributeClaim("diet", diet, "User diet is " + diet, 0.9);
        return new MemoryUnit(id, "c1", "narrative", facts, List.of(), List.of(claim), List.of(), T1, null, List.of(1.0));
    }
}
