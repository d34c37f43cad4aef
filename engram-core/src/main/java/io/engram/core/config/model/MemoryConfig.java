package io.engram.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MemoryConfig(
    @JsonAlias({"cluster_threshold"}) double clusterThreshold,
    @JsonAlias({"rrf_k"}) int rrfK,
    @JsonAlias({"top_k"}) int topK,
    @JsonAlias({"max_context_units"}) int maxContextUnits,
    @JsonAlias({"max_retries"}) int maxRetries,
    @JsonAlias({"query_timeout_seconds"}) int queryTimeoutSeconds,
    @JsonAlias({"search_threads"}) int searchThreads
) {

    public static MemoryConfig defaults() {
        return new MemoryConfig(0.70, 60, 10, 8, 3, 60, 4);
    }
}
