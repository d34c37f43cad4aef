package io.engram.core.retrieval;

import static org.assertj.core.api.Assertions.assertThat;

import io.engram.core.error.GenerationException;
import io.engram.core.generation.GenerationService;
import io.engram.core.generation.SufficiencyVerdict;
import io.engram.core.memory.MemoryUnit;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;

class SufficiencyLoopTest {

    @Test
    void alwaysInsufficientShouldStopAfterMaxRetriesPlusOneCycles() {
        AtomicInteger phrasing = new AtomicInteger();
        ScriptedGeneration generation = new ScriptedGeneration(
            () -> SufficiencyVerdict.insufficient("nothing relevant"),
            question -> List.of(question + " variant " + phrasing.incrementAndGet())
        );
        List<String> searched = new ArrayList<>();

        LoopOutcome outcome = new SufficiencyLoop(generation, new ContextAssembler(), 3)
            .run("where do I live", "", query -> {
                searched.add(query);
                return List.of();
            });

        assertThat(outcome.searchCycles()).isEqualTo(4);
        assertThat(searched).hasSize(4).first().isEqualTo("where do I live");
        assertThat(outcome.queriesUsed()).isEqualTo(searched);
        assertThat(outcome.sufficient()).isFalse();
        assertThat(generation.judgedQuestions).containsOnly("where do I live");
    }

    @Test
    void sufficientFirstVerdictShouldRunOneCycle() {
        ScriptedGeneration generation = new ScriptedGeneration(
            () -> SufficiencyVerdict.sufficient("all there"),
            question -> List.of("unused")
        );

        LoopOutcome outcome = new SufficiencyLoop(generation, new ContextAssembler(), 3)
            .run("diet?", "[Current Profile]\n  - diet: vegan", query -> List.of(retrieved("u1", "User diet is vegan")));

        assertThat(outcome.searchCycles()).isEqualTo(1);
        assertThat(outcome.sufficient()).isTrue();
        assertThat(outcome.context())
            .startsWith("[Current Profile]")
            .contains("[Episode 1]")
            .contains("Key Facts:\n  - User diet is vegan");
        assertThat(generation.reformulations).isZero();
    }

    @Test
    void failingJudgmentShouldCountAsSufficient() {
        ScriptedGeneration generation = new ScriptedGeneration(
            () -> {
                throw new GenerationException("Error calling LLM: timeout");
            },
            question -> List.of("unused")
        );

        LoopOutcome outcome = new SufficiencyLoop(generation, new ContextAssembler(), 3)
            .run("q", "", query -> List.of(retrieved("u1", "fact")));

        assertThat(outcome.searchCycles()).isEqualTo(1);
        assertThat(outcome.sufficient()).isTrue();
        assertThat(outcome.units()).hasSize(1);
    }

    @Test
    void missingVerdictShouldCountAsSufficient() {
        ScriptedGeneration generation = new ScriptedGeneration(() -> null, question -> List.of("unused"));

        LoopOutcome outcome = new SufficiencyLoop(generation, new ContextAssembler(), 3)
            .run("q", "", query -> List.of(retrieved("u1", "fact")));

        assertThat(outcome.searchCycles()).isEqualTo(1);
        assertThat(outcome.sufficient()).isTrue();
        assertThat(outcome.iterations()).singleElement().satisfies(iteration -> {
            assertThat(iteration.sufficient()).isTrue();
            assertThat(iteration.rationale()).isEqualTo("judgment unavailable");
        });
        assertThat(generation.reformulations).isZero();
    }

    @Test
    void emptyReformulationShouldEndWithGatheredContext() {
        ScriptedGeneration generation = new ScriptedGeneration(
            () -> SufficiencyVerdict.insufficient("missing"),
            question -> List.of()
        );

        LoopOutcome outcome = new SufficiencyLoop(generation, new ContextAssembler(), 3)
            .run("q", "", query -> List.of(retrieved("u1", "fact")));

        assertThat(outcome.searchCycles()).isEqualTo(1);
        assertThat(outcome.units()).extracting(unit -> unit.unit().id()).containsExactly("u1");
        assertThat(generation.reformulations).isEqualTo(1);
    }

    @Test
    void alreadySearchedPhrasingsShouldBeSkipped() {
        ScriptedGeneration generation = new ScriptedGeneration(
            () -> SufficiencyVerdict.insufficient("missing"),
            question -> List.of(question, "  ", "alternative")
        );
        List<String> searched = new ArrayList<>();

        LoopOutcome outcome = new SufficiencyLoop(generation, new ContextAssembler(), 1)
            .run("original", "", query -> {
                searched.add(query);
                return List.of();
            });

        assertThat(searched).containsExactly("original", "alternative");
        assertThat(outcome.iterations()).extracting(LoopIteration::query).containsExactly("original", "alternative");
    }

    @Test
    void questionWithSurroundingWhitespaceShouldNotBeSearchedTwice() {
        ScriptedGeneration generation = new ScriptedGeneration(
            () -> SufficiencyVerdict.insufficient("missing"),
            question -> List.of(question.trim(), "alternative")
        );
        List<String> searched = new ArrayList<>();

        new SufficiencyLoop(generation, new ContextAssembler(), 1)
            .run("  where do I live  ", "", query -> {
                searched.add(query);
                return List.of();
            });

        assertThat(searched).containsExactly("where do I live", "alternative");
    }

    @Test
    void lastCycleShouldProvideTheContext() {
        List<SufficiencyVerdict> verdicts = new ArrayList<>(List.of(
            SufficiencyVerdict.insufficient("need more"),
            SufficiencyVerdict.sufficient("ok")
        ));
        ScriptedGeneration generation = new ScriptedGeneration(() -> verdicts.remove(0), question -> List.of("second"));

        LoopOutcome outcome = new SufficiencyLoop(generation, new ContextAssembler(), 3)
            .run("first", "", query -> List.of(retrieved(query, "fact for " + query)));

        assertThat(outcome.searchCycles()).isEqualTo(2);
        assertThat(outcome.units()).extracting(unit -> unit.unit().id()).containsExactly("second");
        assertThat(outcome.context()).contains("fact for second").doesNotContain("fact for first");
        assertThat(outcome.sufficient()).isTrue();
    }

    @Test
    void zeroRetriesShouldNeverReformulate() {
        ScriptedGeneration generation = new ScriptedGeneration(
            () -> SufficiencyVerdict.insufficient("missing"),
            question -> List.of("other")
        );

        LoopOutcome outcome = new SufficiencyLoop(generation, new ContextAssembler(), 0).run("q", "", query -> List.of());

        assertThat(outcome.searchCycles()).isEqualTo(1);
        assertThat(generation.reformulations).isZero();
    }

    private static RetrievedUnit retrieved(String id, String fact) {
        MemoryUnit unit = new MemoryUnit(id, "c1", "Episode " + id, List.of(fact), List.of(), List.of(), List.of(), Instant.EPOCH, null, List.of(1.0));
        return new RetrievedUnit(unit, 0.5);
    }

    private static final class ScriptedGeneration implements GenerationService {
        private final Supplier<SufficiencyVerdict> verdicts;
        private final Function<String, List<String>> phrasings;
        private final List<String> judgedQuestions = new ArrayList<>();
        private int reformulations;

        private ScriptedGeneration(Supplier<SufficiencyVerdict> verdicts, Function<String, List<String>> phrasings) {
            this.verdicts = verdicts;
            this.phrasings = phrasings;
        }

        @Override
        public SufficiencyVerdict judgeSufficiency(String context, String question) {
            judgedQuestions.add(question);
            return verdicts.get();
        }

        @Override
        public List<String> reformulate(String question, String rationale) {
            reformulations++;
            return phrasings.apply(question);
        }

        @Override
        public String answer(String context, String question) {
            return context;
        }
    }
}
