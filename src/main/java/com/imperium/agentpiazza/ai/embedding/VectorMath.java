package com.imperium.agentpiazza.ai.embedding;

/**
 * 向量运算工具。
 */
public final class VectorMath {

    private VectorMath() {}

    /**
     * 点积。两个单位向量的点积即余弦相似度。
     */
    public static double dot(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector dimension mismatch: " + a.length + " vs " + b.length);
        }
        double sum = 0d;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }

    /**
     * 返回 L2 归一化后的新数组；零向量原样返回。
     */
    public static float[] normalize(float[] v) {
        double norm = Math.sqrt(dot(v, v));
        if (norm == 0d) {
            return v.clone();
        }
        float[] out = new float[v.length];
        for (int i = 0; i < v.length; i++) {
            out[i] = (float) (v[i] / norm);
        }
        return out;
    }
}
