package io.engram.core.cluster;

import java.util.List;

public final class Vectors {

    private Vectors() {
    }

    /**
     * Cosine similarity in [-1, 1]; zero when either vector has no magnitude or the dimensions differ.
     */
    public static double cosine(List<Double> a, List<Double> b) {
        if (a == null || b == null || a.isEmpty() || a.size() != b.size()) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.size(); i++) {
            double x = a.get(i);
            double y = b.get(i);
            dot += x * y;
            normA += x * x;
            normB += y * y;
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /**
     * Same as {@link #cosine(List, List)}, reading the first vector in place.
     */
    public static double cosine(double[] a, List<Double> b) {
        if (a == null || b == null || a.length == 0 || a.length != b.size()) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            double y = b.get(i);
            dot += a[i] * y;
            normA += a[i] * a[i];
            normB += y * y;
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
