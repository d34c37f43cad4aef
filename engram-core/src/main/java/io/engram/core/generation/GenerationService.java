package io.engram.core.generation;

import java.util.List;

/**
 * Model-backed judgments used at query time. Every method may throw
 * {@link io.engram.core.error.GenerationException}.
 */
public interface GenerationService {

    /**
     * Decides whether {@code context} is enough to answer {@code question}.
     */
    SufficiencyVerdict judgeSufficiency(String context, String question);

    /**
     * Proposes two or three alternative phrasings of {@code question} aimed at what {@code rationale}
     * reports as missing.
     */
    List<String> reformulate(String question, String rationale);

    String answer(String context, String question);
}
