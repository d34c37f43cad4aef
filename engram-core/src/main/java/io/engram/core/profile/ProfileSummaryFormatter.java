package io.engram.core.profile;

import java.util.List;
import java.util.Locale;

public final class ProfileSummaryFormatter {
    private static final int RECENT_CONFLICTS = 5;

    public String format(UserProfile profile) {
        StringBuilder out = new StringBuilder("User Profile (").append(profile.userId()).append(")\n\n");

        out.append("Explicit attributes:\n");
        if (profile.explicitAttributes().isEmpty()) {
            out.append("  (none)\n");
        }
        profile.explicitAttributes().values().forEach(attribute -> out
            .append("  - ").append(attribute.name()).append(": ").append(attribute.value())
            .append(" (as of ").append(attribute.timestamp()).append(")\n"));

        out.append("\nImplicit traits:\n");
        if (profile.implicitTraits().isEmpty()) {
            out.append("  (none)\n");
        }
        profile.implicitTraits().forEach(trait -> out
            .append("  - [").append(trait.traitType()).append("] ").append(trait.description())
            .append(String.format(Locale.ROOT, " (strength: %.2f)", trait.strength())).append("\n"));

        List<ConflictRecord> history = profile.conflictHistory();
        if (!history.isEmpty()) {
            out.append("\nConflict history:\n");
            for (ConflictRecord conflict : history.subList(Math.max(0, history.size() - RECENT_CONFLICTS), history.size())) {
                out.append("  - ").append(conflict.attributeName()).append(": ")
                    .append(conflict.oldValue()).append(" -> ").append(conflict.newValue())
                    .append(" (").append(conflict.resolutionStrategy().name().toLowerCase(Locale.ROOT))
                    .append(conflict.applied() ? "" : ", kept " + conflict.oldValue()).append(")\n");
            }
        }
        return out.toString();
    }

    /**
     * Compact rendering of live attributes for retrieval context; empty when nothing is known.
     */
    public String formatForContext(UserProfile profile) {
        if (profile.explicitAttributes().isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder("[Current Profile]\n");
        profile.explicitAttributes().values().forEach(attribute -> out
            .append("  - ").append(attribute.name()).append(": ").append(attribute.value()).append("\n"));
        return out.toString().trim();
    }
}
