package com.learningplatform.common.tensor;

import java.util.Arrays;
import java.util.Collection;

/**
 * Vector statistics shared by detection, aggregation and quality scoring.
 * Standard deviations are population (divide by n).
 */
public final class WeightMath {

    private WeightMath() {}

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    public static double mean(Collection<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    public static double stdDev(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double mean = mean(values);
        double sq = 0.0;
        for (double v : values) {
            sq += (v - mean) * (v - mean);
        }
        return Math.sqrt(sq / values.length);
    }

    /** Median; the mean of the two middle values for an even count. */
    public static double median(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[mid];
        }
        return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    public static double l2Norm(double[] v) {
        double sq = 0.0;
        for (double x : v) {
            sq += x * x;
        }
        return Math.sqrt(sq);
    }

    /**
     * Cosine similarity; 0.0 when lengths differ, either vector is empty or has zero norm.
     */
    public static double cosineSimilarity(double[] a, double[] b) {
        if (a.length != b.length || a.length == 0) {
            return 0.0;
        }
        double dot = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
        }
        double na = l2Norm(a);
        double nb = l2Norm(b);
        if (na == 0.0 || nb == 0.0) {
            return 0.0;
        }
        return dot / (na * nb);
    }

    /** Euclidean distance; positive infinity when lengths differ. */
    public static double euclidean(double[] a, double[] b) {
        if (a.length != b.length) {
            return Double.POSITIVE_INFINITY;
        }
        double sq = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sq += d * d;
        }
        return Math.sqrt(sq);
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double clampUnit(double value) {
        return clamp(value, 0.0, 1.0);
    }
}
