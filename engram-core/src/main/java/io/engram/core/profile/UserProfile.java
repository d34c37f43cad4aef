package io.engram.core.profile;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-user evolving profile: one live value per attribute name, inferred traits and the
 * append-only conflict audit trail. Only {@link ConflictResolver} and {@link TraitMerger} mutate it.
 */
@JsonAutoDetect(
    fieldVisibility = JsonAutoDetect.Visibility.ANY,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE
)
public final class UserProfile {
    private final String userId;
    private final Map<String, ProfileAttribute> explicitAttributes;
    private final List<ImplicitTrait> implicitTraits;
    private final List<ConflictRecord> conflictHistory;
    private Instant updatedAt;

    @JsonCreator
    UserProfile(
        @JsonProperty("userId") String userId,
        @JsonProperty("explicitAttributes") Map<String, ProfileAttribute> explicitAttributes,
        @JsonProperty("implicitTraits") List<ImplicitTrait> implicitTraits,
        @JsonProperty("conflictHistory") List<ConflictRecord> conflictHistory,
        @JsonProperty("updatedAt") Instant updatedAt
    ) {
        this.userId = Objects.requireNonNull(userId, "userId must not be null");
        this.explicitAttributes = explicitAttributes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(explicitAttributes);
        this.implicitTraits = implicitTraits == null ? new ArrayList<>() : new ArrayList<>(implicitTraits);
        this.conflictHistory = conflictHistory == null ? new ArrayList<>() : new ArrayList<>(conflictHistory);
        this.updatedAt = updatedAt;
    }

    public static UserProfile create(String userId) {
        return new UserProfile(userId, Map.of(), List.of(), List.of(), null);
    }

    public String userId() {
        return userId;
    }

    public Optional<ProfileAttribute> attribute(String name) {
        return Optional.ofNullable(explicitAttributes.get(name));
    }

    public Map<String, ProfileAttribute> explicitAttributes() {
        return Collections.unmodifiableMap(explicitAttributes);
    }

    public List<ImplicitTrait> implicitTraits() {
        return Collections.unmodifiableList(implicitTraits);
    }

    public List<ConflictRecord> conflictHistory() {
        return Collections.unmodifiableList(conflictHistory);
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public UserProfile copy() {
        return new UserProfile(userId, explicitAttributes, implicitTraits, conflictHistory, updatedAt);
    }

    void putAttribute(ProfileAttribute attribute, Instant now) {
        explicitAttributes.put(attribute.name(), attribute);
        updatedAt = now;
    }

    void appendConflict(ConflictRecord record) {
        conflictHistory.add(record);
    }

    void replaceTrait(int index, ImplicitTrait trait, Instant now) {
        implicitTraits.set(index, trait);
        updatedAt = now;
    }

    void addTrait(ImplicitTrait trait, Instant now) {
        implicitTraits.add(trait);
        updatedAt = now;
    }
}
