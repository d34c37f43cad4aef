package io.engram.core.retrieval;

import io.engram.core.generation.GenerationService;
import io.engram.core.generation.SufficiencyVerdict;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded retrieve, evaluate, reformulate cycle.
 *
 * <p>Each cycle searches the current query text and asks the generation service whether the
 * resulting context answers the original question. On an insufficient verdict, while retries
 * remain, the loop asks for alternative phrasings and searches the first one not tried yet. The
 * loop therefore runs at most {@code maxRetries + 1} search cycles. A failed judgment counts as
 * sufficient. A failed or empty reformulation ends the loop with the context already gathered.
 * Search failures propagate.
 */
public final class SufficiencyLoop {
    private static final Logger LOG = LoggerFactory.getLogger(SufficiencyLoop.class);
    public static final int DEFAULT_MAX_RETRIES = 3;

    private final GenerationService generation;
    private final ContextAssembler assembler;
    private final int maxRetries;

    public SufficiencyLoop(GenerationService generation, ContextAssembler assembler, int maxRetries) {
        this.generation = Objects.requireNonNull(generation, "generation must not be null");
        this.assembler = Objects.requireNonNull(assembler, "assembler must not be null");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.maxRetries = maxRetries;
    }

    public LoopOutcome run(String question, String profileSection, Retriever retriever) {
        Objects.requireNonNull(question, "question must not be null");
        LoopState state = LoopState.SEARCHING;
        String query = question.trim();
        List<String> queriesUsed = new ArrayList<>();
        List<LoopIteration> iterations = new ArrayList<>();
        List<RetrievedUnit> units = List.of();
        String context = "";
        SufficiencyVerdict verdict = null;
        int retries = 0;

        while (state != LoopState.DONE) {
            switch (state) {
                case SEARCHING -> {
                    queriesUsed.add(query);
                    units = retriever.retrieve(query);
                    context = assembler.assemble(profileSection, units);
                    state = LoopState.EVALUATING;
                }
                case EVALUATING -> {
                    verdict = judge(context, question);
                    iterations.add(new LoopIteration(
                        iterations.size() + 1,
                        query,
                        units.stream().map(unit -> unit.unit().id()).toList(),
                        verdict.sufficient(),
                        verdict.rationale()
                    ));
                    if (verdict.sufficient() || retries >= maxRetries) {
                        state = LoopState.DONE;
                    } else {
                        state = LoopState.REFORMULATING;
                    }
                }
                case REFORMULATING -> {
                    retries++;
                    String next = nextQuery(question, verdict, queriesUsed);
                    if (next == null) {
                        state = LoopState.DONE;
                    } else {
                        LOG.debug("Reformulated '{}' as '{}' (retry {}/{})", question, next, retries, maxRetries);
                        query = next;
                        state = LoopState.SEARCHING;
                    }
                }
                default -> throw new IllegalStateException("Unexpected loop state " + state);
            }
        }

        boolean sufficient = verdict != null && verdict.sufficient();
        return new LoopOutcome(units, context, queriesUsed, iterations, sufficient);
    }

    public int maxRetries() {
        return maxRetries;
    }

    private SufficiencyVerdict judge(String context, String question) {
        SufficiencyVerdict verdict;
        try {
            verdict = generation.judgeSufficiency(context, question);
        } catch (RuntimeException e) {
            LOG.warn("Sufficiency judgment failed, treating context as sufficient: {}", e.getMessage());
            return SufficiencyVerdict.sufficient("judgment unavailable: " + e.getMessage());
        }
        if (verdict == null) {
            LOG.warn("Sufficiency judgment returned no verdict, treating context as sufficient");
            return SufficiencyVerdict.sufficient("judgment unavailable");
        }
        return verdict;
    }

    private String nextQuery(String question, SufficiencyVerdict verdict, List<String> queriesUsed) {
        List<String> alternatives;
        try {
            alternatives = generation.reformulate(question, rationale(verdict));
        } catch (RuntimeException e) {
            LOG.warn("Query reformulation failed, keeping current context: {}", e.getMessage());
            return null;
        }
        if (alternatives == null) {
            return null;
        }
        for (String alternative : alternatives) {
            if (alternative != null && !alternative.isBlank() && !queriesUsed.contains(alternative.trim())) {
                return alternative.trim();
            }
        }
        return null;
    }

    private String rationale(SufficiencyVerdict verdict) {
        if (verdict == null) {
            return "";
        }
        if (verdict.missingInfo().isEmpty()) {
            return verdict.rationale();
        }
        return verdict.rationale() + "\nMissing: " + String.join("; ", verdict.missingInfo());
    }
}
