package io.engram.core.generation;

import java.util.List;

public record SufficiencyVerdict(boolean sufficient, String rationale, List<String> missingInfo) {

    public SufficiencyVerdict {
        rationale = rationale == null ? "" : rationale;
        missingInfo = missingInfo == null ? List.of() : List.copyOf(missingInfo);
    }

    public static SufficiencyVerdict sufficient(String rationale) {
        return new SufficiencyVerdict(true, rationale, List.of());
    }

    public static SufficiencyVerdict insufficient(String rationale) {
        return new SufficiencyVerdict(false, rationale, List.of());
    }
}
