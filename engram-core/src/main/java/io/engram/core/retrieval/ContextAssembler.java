package io.engram.core.retrieval;

import io.engram.core.memory.Foresight;
import io.engram.core.memory.MemoryUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders retrieved units as the text handed to the generation service.
 */
public final class ContextAssembler {
    private static final int KEY_FACTS = 5;

    public String assemble(String profileSection, List<RetrievedUnit> units) {
        List<String> sections = new ArrayList<>();
        if (profileSection != null && !profileSection.isBlank()) {
            sections.add(profileSection.trim());
        }
        for (int i = 0; i < units.size(); i++) {
            sections.add(episode(i + 1, units.get(i).unit()));
        }
        return String.join("\n\n---\n\n", sections);
    }

    private String episode(int number, MemoryUnit unit) {
        StringBuilder section = new StringBuilder("[Episode ").append(number).append(']');
        if (!unit.narrative().isBlank()) {
            section.append('\n').append(unit.narrative());
        }
        if (!unit.foresights().isEmpty()) {
            section.append("\n\nActive Foresights:");
            for (Foresight foresight : unit.foresights()) {
                section.append("\n  - ").append(foresight.content());
                if (foresight.end() != null) {
                    section.append(" (until ").append(foresight.end()).append(')');
                }
            }
        }
        if (!unit.atomicFacts().isEmpty()) {
            section.append("\n\nKey Facts:");
            unit.atomicFacts().stream().limit(KEY_FACTS).forEach(fact -> section.append("\n  - ").append(fact));
        }
        return section.toString();
    }
}
