package io.engram.core.generation;

import java.util.List;

/**
 * Model-free stand-in used when no generation provider is configured. Any non-empty context counts
 * as sufficient and the answer is the assembled context itself.
 */
public final class OfflineGenerationService implements GenerationService {

    @Override
    public SufficiencyVerdict judgeSufficiency(String context, String question) {
        if (context == null || context.isBlank()) {
            return SufficiencyVerdict.insufficient("no memory matched the question");
        }
        return SufficiencyVerdict.sufficient("context is non-empty");
    }

    @Override
    public List<String> reformulate(String question, String rationale) {
        return Reformulations.fallback(question);
    }

    @Override
    public String answer(String context, String question) {
        return "From memory:\n" + context.trim();
    }
}
