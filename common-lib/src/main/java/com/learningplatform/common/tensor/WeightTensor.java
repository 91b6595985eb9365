package com.learningplatform.common.tensor;

import java.util.List;
import java.util.function.DoubleUnaryOperator;

/**
 * One layer of model weights: a scalar, a vector or a (possibly ragged) matrix.
 *
 * <p>The three implementations ({@link ScalarTensor}, {@link VectorTensor},
 * {@link MatrixTensor}) form a closed set, so flattening, hashing and aggregation
 * are total over every layer a {@link ModelWeights} can hold.
 *
 * <p>Element order is row-major and stable: {@link #flatten()} and
 * {@link #reshape(double[])} are inverses for tensors of the same shape.
 */
public interface WeightTensor {

    /** Number of scalar elements. */
    int size();

    /** Row-major copy of every element. */
    double[] flatten();

    /** Returns a tensor of the same shape with {@code op} applied to every element. */
    WeightTensor map(DoubleUnaryOperator op);

    /**
     * Builds a tensor with this tensor's shape from row-major {@code values}.
     *
     * @throws IllegalArgumentException when {@code values.length != size()}
     */
    WeightTensor reshape(double[] values);

    /** {@code true} when {@code other} is the same kind with identical dimensions. */
    boolean sameShape(WeightTensor other);

    /** Plain Java value (Double, List of Double, List of List of Double) used for JSON. */
    Object toPlain();

    /**
     * Parses a plain JSON-decoded value into a tensor.
     *
     * @param layerName used only in error messages
     * @param raw       a {@link Number}, a list of numbers or a list of lists of numbers
     * @throws IllegalArgumentException for any other structure (deeper nesting, strings, nulls)
     */
    static WeightTensor fromPlain(String layerName, Object raw) {
        if (raw instanceof Number n) {
            return new ScalarTensor(n.doubleValue());
        }
        if (raw instanceof List<?> list) {
            if (list.isEmpty()) {
                throw new IllegalArgumentException("Layer " + layerName + " is empty");
            }
            if (list.get(0) instanceof List<?>) {
                return MatrixTensor.fromPlain(layerName, list);
            }
            return VectorTensor.fromPlain(layerName, list);
        }
        throw new IllegalArgumentException("Layer " + layerName + " has unsupported value: " + raw);
    }
}
