package io.engram.core.index;

import io.engram.core.cluster.Vectors;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class InMemoryVectorIndex implements VectorIndex {
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    @Override
    public synchronized void upsert(String id, List<Double> vector, Map<String, String> payload) {
        if (id == null || vector == null || vector.isEmpty()) {
            throw new IllegalArgumentException("id and vector must be present");
        }
        entries.put(id, new Entry(List.copyOf(vector), payload == null ? Map.of() : Map.copyOf(payload)));
    }

    /**
     * Ranks every stored vector by cosine similarity; equal scores keep insertion order.
     */
    @Override
    public synchronized List<ScoredId> search(List<Double> vector, int topK) {
        if (vector == null || vector.isEmpty() || topK <= 0) {
            return List.of();
        }
        List<ScoredId> scored = new ArrayList<>(entries.size());
        for (Map.Entry<String, Entry> entry : entries.entrySet()) {
            scored.add(new ScoredId(entry.getKey(), Vectors.cosine(vector, entry.getValue().vector())));
        }
        scored.sort((a, b) -> Double.compare(b.score(), a.score()));
        return List.copyOf(scored.subList(0, Math.min(topK, scored.size())));
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }

    public synchronized Map<String, String> payload(String id) {
        Entry entry = entries.get(id);
        return entry == null ? Map.of() : entry.payload();
    }

    private record Entry(List<Double> vector, Map<String, String> payload) {
    }
}
