package io.engram.core.extraction;

public record TraitClaim(String traitType, String description, double strength) {

    public TraitClaim {
        traitType = traitType == null || traitType.isBlank() ? "preference" : traitType.trim();
        description = description == null ? "" : description.trim();
        strength = strength <= 0 ? 0.5 : Math.min(1.0, strength);
    }
}
