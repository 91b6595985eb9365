package com.learningplatform.common.tensor;

import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleUnaryOperator;

public record VectorTensor(List<Double> values) implements WeightTensor {

    public VectorTensor {
        values = List.copyOf(values);
    }

    public static VectorTensor of(double... values) {
        List<Double> list = new ArrayList<>(values.length);
        for (double v : values) {
            list.add(v);
        }
        return new VectorTensor(list);
    }

    static VectorTensor fromPlain(String layerName, List<?> raw) {
        List<Double> list = new ArrayList<>(raw.size());
        for (Object item : raw) {
            if (!(item instanceof Number n)) {
                throw new IllegalArgumentException("Layer " + layerName + " contains non-numeric value: " + item);
            }
            list.add(n.doubleValue());
        }
        return new VectorTensor(list);
    }

    @Override
    public int size() {
        return values.size();
    }

    @Override
    public double[] flatten() {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = values.get(i);
        }
        return out;
    }

    @Override
    public WeightTensor map(DoubleUnaryOperator op) {
        List<Double> mapped = new ArrayList<>(values.size());
        for (Double v : values) {
            mapped.add(op.applyAsDouble(v));
        }
        return new VectorTensor(mapped);
    }

    @Override
    public WeightTensor reshape(double[] flat) {
        if (flat.length != values.size()) {
            throw new IllegalArgumentException(
                "Vector reshape expects " + values.size() + " values, got " + flat.length);
        }
        return of(flat);
    }

    @Override
    public boolean sameShape(WeightTensor other) {
        return other instanceof VectorTensor v && v.size() == size();
    }

    @Override
    public Object toPlain() {
        return values;
    }
}
