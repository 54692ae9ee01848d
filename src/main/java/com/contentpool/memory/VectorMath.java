package com.contentpool.memory;

final class VectorMath {

    private VectorMath() {}

    /**
     * Returns a unit-length copy of {@code vector}. A zero vector is copied
     * unchanged.
     */
    static float[] normalize(float[] vector) {
        double sum = 0;
        for (float v : vector) {
            sum += (double) v * v;
        }
        var copy = vector.clone();
        double norm = Math.sqrt(sum);
        if (norm == 0) return copy;
        for (int i = 0; i < copy.length; i++) {
            copy[i] = (float) (copy[i] / norm);
        }
        return copy;
    }

    static double dot(float[] a, float[] b) {
        double dot = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
        }
        return dot;
    }

    static boolean isFinite(float[] vector) {
        for (float v : vector) {
            if (!Float.isFinite(v)) return false;
        }
        return true;
    }
}
