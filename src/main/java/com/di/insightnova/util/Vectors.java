package com.di.insightnova.util;

/**
 * Embedding vector helpers.
 */
public final class Vectors {

    private Vectors() {
    }

    /**
     * Cosine similarity of two vectors; 0 when either is null, empty, zero or the lengths differ.
     */
    public static double cosine(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    public static boolean isPresent(float[] v) {
        return v != null && v.length > 0;
    }
}
