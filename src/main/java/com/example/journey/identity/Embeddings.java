package com.example.journey.identity;

/**
 * 外观特征向量工具
 */
public final class Embeddings {

    private static final double EPS = 1e-12;

    private Embeddings() {
    }

    /**
     * L2归一化，零向量归一化后仍为零向量
     */
    public static float[] normalize(float[] vector) {
        if (vector == null) {
            return new float[0];
        }
        double norm = norm(vector);
        double denom = Math.max(norm, EPS);
        float[] out = new float[vector.length];
        for (int i = 0; i < vector.length; i++) {
            out[i] = (float) (vector[i] / denom);
        }
        return out;
    }

    public static double norm(float[] vector) {
        double sum = 0;
        for (float v : vector) {
            sum += (double) v * v;
        }
        return Math.sqrt(sum);
    }

    /**
     * 余弦相似度，两个向量需已归一化；维度不一致或为空时返回0
     */
    public static double cosineSimilarity(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        double dot = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
        }
        return dot;
    }

    /**
     * 指数滑动平均：normalize(alpha * current + (1 - alpha) * normalize(sample))
     */
    public static float[] blend(float[] current, float[] sample, double alpha) {
        float[] normalizedSample = normalize(sample);
        float[] out = new float[current.length];
        for (int i = 0; i < current.length; i++) {
            out[i] = (float) (alpha * current[i] + (1 - alpha) * normalizedSample[i]);
        }
        return normalize(out);
    }
}
