package io.engram.core.cluster;

import io.engram.core.memory.MemoryUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Offline labeler: themes are the most frequent content words of the seed unit and summaries
 * accumulate member narratives up to a fixed length.
 */
public final class KeywordClusterLabeler implements ClusterLabeler {
    private static final int THEME_WORDS = 3;
    private static final int MAX_SUMMARY_CHARS = 1_200;
    private static final Set<String> STOP_WORDS = Set.of(
        "a", "an", "the", "and", "or", "is", "are", "was", "were", "to", "of", "in", "for", "on", "with",
        "at", "by", "from", "it", "this", "that", "be", "been", "as", "if", "but", "not", "no", "you", "your",
        "we", "our", "they", "their", "he", "she", "his", "her", "i", "im", "my", "me", "am", "have", "has",
        "had", "do", "did", "so", "just", "user", "assistant", "said", "will", "can", "about", "really", "what"
    );

    @Override
    public String themeFor(MemoryUnit seed) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        String text = seed.atomicFacts().isEmpty() ? seed.narrative() : String.join(" ", seed.atomicFacts());
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (token.length() > 2 && !STOP_WORDS.contains(token)) {
                counts.merge(token, 1, Integer::sum);
            }
        }
        if (counts.isEmpty()) {
            return "General";
        }
        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(counts.entrySet());
        // stable sort keeps first-seen order between equally frequent words
        ranked.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));
        List<String> words = new ArrayList<>();
        for (int i = 0; i < Math.min(THEME_WORDS, ranked.size()); i++) {
            String word = ranked.get(i).getKey();
            words.add(Character.toUpperCase(word.charAt(0)) + word.substring(1));
        }
        return String.join(" ", words);
    }

    @Override
    public String mergeSummary(String currentSummary, MemoryUnit newcomer) {
        String current = currentSummary == null ? "" : currentSummary.trim();
        String addition = newcomer.narrative().trim();
        if (addition.isBlank()) {
            return current;
        }
        String merged = current.isBlank() ? addition : current + "\n" + addition;
        if (merged.length() <= MAX_SUMMARY_CHARS) {
            return merged;
        }
        return merged.substring(merged.length() - MAX_SUMMARY_CHARS);
    }
}
