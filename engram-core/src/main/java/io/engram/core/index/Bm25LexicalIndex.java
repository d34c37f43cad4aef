package io.engram.core.index;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Okapi BM25 over tokenized text, updated incrementally as documents are indexed.
 */
public final class Bm25LexicalIndex implements LexicalIndex {
    private static final double DEFAULT_K1 = 1.5;
    private static final double DEFAULT_B = 0.75;

    private final double k1;
    private final double b;
    private final Map<String, Map<String, Integer>> termFrequencies = new LinkedHashMap<>();
    private final Map<String, Integer> lengths = new HashMap<>();
    private final Map<String, Integer> documentFrequencies = new HashMap<>();
    private long totalLength;

    public Bm25LexicalIndex() {
        this(DEFAULT_K1, DEFAULT_B);
    }

    public Bm25LexicalIndex(double k1, double b) {
        this.k1 = k1;
        this.b = b;
    }

    @Override
    public synchronized void index(String id, String text) {
        if (id == null) {
            throw new IllegalArgumentException("id must not be null");
        }
        remove(id);
        List<String> tokens = Tokenizer.tokenize(text);
        Map<String, Integer> tf = new HashMap<>();
        for (String token : tokens) {
            tf.merge(token, 1, Integer::sum);
        }
        for (String term : tf.keySet()) {
            documentFrequencies.merge(term, 1, Integer::sum);
        }
        termFrequencies.put(id, tf);
        lengths.put(id, tokens.size());
        totalLength += tokens.size();
    }

    @Override
    public synchronized List<ScoredId> search(String text, int topK) {
        List<String> query = Tokenizer.tokenize(text);
        if (query.isEmpty() || termFrequencies.isEmpty() || topK <= 0) {
            return List.of();
        }
        int documents = termFrequencies.size();
        double averageLength = Math.max(1.0, (double) totalLength / documents);

        List<ScoredId> scored = new ArrayList<>();
        for (Map.Entry<String, Map<String, Integer>> doc : termFrequencies.entrySet()) {
            Map<String, Integer> tf = doc.getValue();
            int length = lengths.getOrDefault(doc.getKey(), 0);
            double score = 0.0;
            for (String term : query) {
                int frequency = tf.getOrDefault(term, 0);
                if (frequency == 0) {
                    continue;
                }
                int df = documentFrequencies.getOrDefault(term, 0);
                double idf = Math.log(1.0 + (documents - df + 0.5) / (df + 0.5));
                score += idf * (frequency * (k1 + 1)) / (frequency + k1 * (1 - b + b * length / averageLength));
            }
            if (score > 0) {
                scored.add(new ScoredId(doc.getKey(), score));
            }
        }
        scored.sort((x, y) -> Double.compare(y.score(), x.score()));
        return List.copyOf(scored.subList(0, Math.min(topK, scored.size())));
    }

    @Override
    public synchronized int size() {
        return termFrequencies.size();
    }

    private void remove(String id) {
        Map<String, Integer> previous = termFrequencies.remove(id);
        if (previous == null) {
            return;
        }
        for (String term : previous.keySet()) {
            documentFrequencies.computeIfPresent(term, (key, count) -> count <= 1 ? null : count - 1);
        }
        totalLength -= lengths.getOrDefault(id, 0);
        lengths.remove(id);
    }
}
