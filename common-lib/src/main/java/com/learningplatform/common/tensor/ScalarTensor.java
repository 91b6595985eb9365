package com.learningplatform.common.tensor;

import java.util.function.DoubleUnaryOperator;

public record ScalarTensor(double value) implements WeightTensor {

    @Override
    public int size() {
        return 1;
    }

    @Override
    public double[] flatten() {
        return new double[] {value};
    }

    @Override
    public WeightTensor map(DoubleUnaryOperator op) {
        return new ScalarTensor(op.applyAsDouble(value));
    }

    @Override
    public WeightTensor reshape(double[] values) {
        if (values.length != 1) {
            throw new IllegalArgumentException("Scalar reshape expects 1 value, got " + values.length);
        }
        return new ScalarTensor(values[0]);
    }

    @Override
    public boolean sameShape(WeightTensor other) {
        return other instanceof ScalarTensor;
    }

    @Override
    public Object toPlain() {
        return value;
    }
}
