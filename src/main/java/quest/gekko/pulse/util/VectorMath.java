package quest.gekko.pulse.util;

public final class VectorMath {
    private static final double MIN_NORM = 1e-9;

    private VectorMath() {}

    public static double[] toDoubles(float[] v) {
        if (v == null) return new double[0];
        double[] out = new double[v.length];
        for (int i = 0; i < v.length; i++) out[i] = v[i];
        return out;
    }

    public static double norm(double[] v) {
        double s = 0;
        for (double x : v) s += x * x;
        return Math.sqrt(s);
    }

    /** Unit vector in the direction of {@code v}; all zeros when the norm is (near) zero. */
    public static double[] normalize(double[] v) {
        double n = norm(v);
        double[] out = new double[v.length];
        if (n <= MIN_NORM) return out;
        for (int i = 0; i < v.length; i++) out[i] = v[i] / n;
        return out;
    }

    /** Cosine similarity, or {@link Double#NaN} when either side is empty, mismatched or zero. */
    public static double cosine(double[] a, double[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) return Double.NaN;
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        if (na <= MIN_NORM || nb <= MIN_NORM) return Double.NaN;
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }

    /**
     * Moves a unit centroid toward ({@code toward=true}) or away from a unit sample and re-normalizes.
     * An empty or mismatched centroid adopts the sample.
     */
    public static double[] shift(double[] centroid, double[] sample, double alpha, boolean toward) {
        if (centroid == null || centroid.length == 0 || centroid.length != sample.length) {
            return sample.clone();
        }
        double[] out = new double[centroid.length];
        for (int i = 0; i < centroid.length; i++) {
            out[i] = toward
                    ? (1 - alpha) * centroid[i] + alpha * sample[i]
                    : centroid[i] - alpha * sample[i];
        }
        return normalize(out);
    }
}
