package com.learningplatform.common.tensor;

/**
 * Combines the values found at one element position across several updates.
 * {@code values[i]} belongs to the i-th input passed to
 * {@link ModelWeights#combine(java.util.List, ElementReducer)}.
 */
@FunctionalInterface
public interface ElementReducer {

    double reduce(double[] values);
}
