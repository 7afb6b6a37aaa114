package io.engram.core.embedding;

import java.util.List;

public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Cosine similarity, i.e. {@code 1 - cosineDistance}. Not clamped: opposed vectors score below zero.
     * Empty, zero-norm or mismatched vectors score 0.
     */
    public static double cosineSimilarity(List<Double> a, List<Double> b) {
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

    public static List<Double> normalize(double[] vector) {
        double norm = 0.0;
        for (double value : vector) {
            norm += value * value;
        }
        norm = Math.sqrt(norm);
        Double[] out = new Double[vector.length];
        for (int i = 0; i < vector.length; i++) {
            out[i] = norm == 0.0 ? 0.0 : vector[i] / norm;
        }
        return List.of(out);
    }
}
