package com.courtrag.util;

public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Calculate cosine similarity between two vectors, clamped to [-1, 1].
     * Mismatched dimensions and zero vectors score 0.
     */
    public static double cosineSimilarity(float[] vec1, float[] vec2) {
        if (vec1 == null || vec2 == null || vec1.length != vec2.length || vec1.length == 0) {
            return 0.0;
        }

        double dotProduct = 0.0;
        double norm1 = 0.0;
        double norm2 = 0.0;

        for (int i = 0; i < vec1.length; i++) {
            dotProduct += (double) vec1[i] * vec2[i];
            norm1 += (double) vec1[i] * vec1[i];
            norm2 += (double) vec2[i] * vec2[i];
        }

        if (norm1 == 0.0 || norm2 == 0.0) {
            return 0.0;
        }

        double similarity = dotProduct / (Math.sqrt(norm1) * Math.sqrt(norm2));
        return Math.max(-1.0, Math.min(1.0, similarity));
    }

    public static float[] toFloatArray(java.util.List<? extends Number> values) {
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(i).floatValue();
        }
        return vector;
    }
}
