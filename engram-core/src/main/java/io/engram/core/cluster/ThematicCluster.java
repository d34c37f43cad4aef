package io.engram.core.cluster;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Group of memory units sharing a theme. Membership is append-only and the centroid is the
 * running mean of member embeddings, updated incrementally as members arrive.
 */
@JsonAutoDetect(
    fieldVisibility = JsonAutoDetect.Visibility.ANY,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE
)
public final class ThematicCluster {
    private final String id;
    private final String themeLabel;
    private String summary;
    private final List<String> memberIds;
    private final double[] centroid;
    private final Instant createdAt;
    private Instant updatedAt;

    @JsonCreator
    ThematicCluster(
        @JsonProperty("id") String id,
        @JsonProperty("themeLabel") String themeLabel,
        @JsonProperty("summary") String summary,
        @JsonProperty("memberIds") List<String> memberIds,
        @JsonProperty("centroid") double[] centroid,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt
    ) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.themeLabel = themeLabel == null ? "" : themeLabel;
        this.summary = summary == null ? "" : summary;
        this.memberIds = memberIds == null ? new ArrayList<>() : new ArrayList<>(memberIds);
        this.centroid = centroid == null ? new double[0] : centroid.clone();
        this.createdAt = createdAt == null ? Instant.EPOCH : createdAt;
        this.updatedAt = updatedAt == null ? this.createdAt : updatedAt;
    }

    static ThematicCluster seed(String id, String themeLabel, String summary, String unitId, List<Double> embedding, Instant now) {
        double[] initial = new double[embedding.size()];
        for (int i = 0; i < initial.length; i++) {
            initial[i] = embedding.get(i);
        }
        return new ThematicCluster(id, themeLabel, summary, List.of(unitId), initial, now, now);
    }

    /**
     * Appends a member and moves the centroid by {@code (embedding - centroid) / memberCount}.
     */
    void absorb(String unitId, List<Double> embedding, String mergedSummary, Instant now) {
        if (embedding.size() != centroid.length) {
            throw new IllegalArgumentException(
                "embedding dimension " + embedding.size() + " does not match centroid dimension " + centroid.length
            );
        }
        memberIds.add(unitId);
        int count = memberIds.size();
        for (int i = 0; i < centroid.length; i++) {
            centroid[i] += (embedding.get(i) - centroid[i]) / count;
        }
        summary = mergedSummary == null ? summary : mergedSummary;
        updatedAt = now;
    }

    public double similarityTo(List<Double> embedding) {
        return Vectors.cosine(centroid, embedding);
    }

    public String id() {
        return id;
    }

    public String themeLabel() {
        return themeLabel;
    }

    public String summary() {
        return summary;
    }

    public List<String> memberIds() {
        return List.copyOf(memberIds);
    }

    public int size() {
        return memberIds.size();
    }

    public List<Double> centroid() {
        List<Double> copy = new ArrayList<>(centroid.length);
        for (double value : centroid) {
            copy.add(value);
        }
        return copy;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public ThematicCluster copy() {
        return new ThematicCluster(id, themeLabel, summary, memberIds, centroid, createdAt, updatedAt);
    }
}
