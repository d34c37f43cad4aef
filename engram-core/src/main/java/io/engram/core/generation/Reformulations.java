package io.engram.core.generation;

import java.util.List;

final class Reformulations {

    private Reformulations() {
    }

    static List<String> fallback(String question) {
        return List.of(question + " more details", "background information for " + question);
    }
}
