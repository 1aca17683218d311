package com.openforge.chronicle.memory.index;

import java.util.ArrayList;
import java.util.List;

/**
 * L2 normalization and dot product shared by the index backends. On unit vectors the
 * dot product is the cosine similarity, so scores stay in [-1, 1] on every backend.
 */
final class VectorMath {

    private VectorMath() {}

    static float[] normalize(List<Float> raw) {
        if (raw == null || raw.isEmpty()) {
            throw new IllegalStateException("Embedding vector is empty");
        }
        float[] v = new float[raw.size()];
        double norm = 0.0;
        for (int i = 0; i < v.length; i++) {
            v[i] = raw.get(i);
            norm += (double) v[i] * v[i];
        }
        norm = Math.sqrt(norm);
        if (norm == 0.0) return v;
        for (int i = 0; i < v.length; i++) {
            v[i] = (float) (v[i] / norm);
        }
        return v;
    }

    static List<Float> normalizedList(List<Float> raw) {
        float[] v = normalize(raw);
        List<Float> out = new ArrayList<>(v.length);
        for (float f : v) out.add(f);
        return out;
    }

    static double dot(float[] a, float[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }
}
