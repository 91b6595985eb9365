package com.learningplatform.common.detection.signals;

import com.learningplatform.common.detection.DetectionContext;
import com.learningplatform.common.detection.SignalHit;
import com.learningplatform.common.detection.SuspicionSignal;
import com.learningplatform.common.model.ModelUpdate;
import com.learningplatform.common.tensor.WeightMath;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Distance-based outlier detection over a 10-dimensional statistical summary of
 * each update's weights.
 *
 * <h3>Features</h3>
 * mean, range, variance, positive ratio, near-zero ratio (|w| &lt; 0.01), and the
 * 25th / 50th / 75th / 90th / 95th percentiles (nearest-rank, index {@code (int)(p × n)}).
 *
 * <h3>Rule</h3>
 * For every update the average Euclidean distance to all updates (itself included)
 * is computed; an update whose average exceeds {@code mean + 2 × std} of those
 * averages is an outlier. Requires at least 3 updates.
 */
public class DistanceClusteringSignal implements SuspicionSignal {

    static final double CONTRIBUTION = 0.3;
    static final double STD_MULTIPLIER = 2.0;
    static final int MIN_UPDATES = 3;
    static final int FEATURE_COUNT = 10;

    private static final double[] PERCENTILES = {0.25, 0.5, 0.75, 0.9, 0.95};

    @Override
    public String name() {
        return "distance_clustering";
    }

    @Override
    public List<SignalHit> evaluate(DetectionContext context) {
        List<ModelUpdate> updates = context.updates();
        List<SignalHit> hits = new ArrayList<>();
        int n = updates.size();
        if (n < MIN_UPDATES) {
            return hits;
        }

        double[][] features = new double[n][];
        for (int i = 0; i < n; i++) {
            features[i] = features(context.flat(updates.get(i)));
        }

        double[] avgDistances = new double[n];
        for (int i = 0; i < n; i++) {
            double sum = 0.0;
            for (int j = 0; j < n; j++) {
                sum += WeightMath.euclidean(features[i], features[j]);
            }
            avgDistances[i] = sum / n;
        }

        double mean = WeightMath.mean(avgDistances);
        double std  = WeightMath.stdDev(avgDistances);
        for (int i = 0; i < n; i++) {
            if (avgDistances[i] > mean + STD_MULTIPLIER * std) {
                hits.add(new SignalHit(updates.get(i).agentId(), CONTRIBUTION, "cluster_outlier"));
            }
        }
        return hits;
    }

    static double[] features(double[] flat) {
        if (flat.length == 0) {
            return new double[FEATURE_COUNT];
        }
        int n = flat.length;
        double mean = WeightMath.mean(flat);
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double variance = 0.0;
        int positive = 0;
        int nearZero = 0;
        for (double w : flat) {
            min = Math.min(min, w);
            max = Math.max(max, w);
            variance += (w - mean) * (w - mean);
            if (w > 0) positive++;
            if (Math.abs(w) < 0.01) nearZero++;
        }

        double[] sorted = flat.clone();
        Arrays.sort(sorted);

        double[] out = new double[FEATURE_COUNT];
        out[0] = mean;
        out[1] = max - min;
        out[2] = variance / n;
        out[3] = (double) positive / n;
        out[4] = (double) nearZero / n;
        for (int p = 0; p < PERCENTILES.length; p++) {
            out[5 + p] = sorted[Math.min(n - 1, (int) (PERCENTILES[p] * n))];
        }
        return out;
    }
}
