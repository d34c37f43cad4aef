package io.engram.core.index;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class Tokenizer {

    private Tokenizer() {
    }

    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String[] raw = text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+");
        List<String> out = new ArrayList<>();
        for (String token : raw) {
            if (token.length() > 1 && !STOP_WORDS.contains(token)) {
                out.add(token);
            }
        }
        return out;
    }

    public static boolean isStopWord(String token) {
        return STOP_WORDS.contains(token);
    }

    private static final Set<String> STOP_WORDS = Set.of(
        "a", "an", "the", "and", "or", "is", "are", "was", "were", "to", "of", "in", "for", "on", "with",
        "at", "by", "from", "it", "this", "that", "these", "those", "be", "been", "being", "as", "if", "but",
        "not", "no", "you", "your", "we", "our", "they", "their", "he", "she", "his", "her", "what", "do",
        "does", "did", "now", "me", "my", "i", "am", "so", "just", "about", "user", "has", "have"
    );
}
