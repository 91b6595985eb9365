package com.learningplatform.common.selection;

/**
 * Maximum number of agents a round may exclude as Byzantine and still aggregate.
 *
 * <pre>
 *   tolerance(N) = min(floor(N × ratio), floor(N / 3))
 * </pre>
 *
 * The {@code floor(N / 3)} term keeps the bound classical regardless of the
 * configured ratio.
 */
public final class ByzantineTolerance {

    public static final double DEFAULT_RATIO = 0.33;

    private ByzantineTolerance() {}

    public static int count(int participants, double ratio) {
        if (participants <= 0) {
            return 0;
        }
        int byRatio = (int) Math.floor(participants * ratio);
        return Math.max(0, Math.min(byRatio, participants / 3));
    }

    public static int count(int participants) {
        return count(participants, DEFAULT_RATIO);
    }
}
