package com.learningplatform.common.tensor;

import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleUnaryOperator;

/**
 * Two-dimensional layer. Rows may differ in length; shape equality compares
 * every row length.
 */
public record MatrixTensor(List<List<Double>> rows) implements WeightTensor {

    public MatrixTensor {
        List<List<Double>> copy = new ArrayList<>(rows.size());
        for (List<Double> row : rows) {
            copy.add(List.copyOf(row));
        }
        rows = List.copyOf(copy);
    }

    public static MatrixTensor of(double[]... rows) {
        List<List<Double>> list = new ArrayList<>(rows.length);
        for (double[] row : rows) {
            list.add(VectorTensor.of(row).values());
        }
        return new MatrixTensor(list);
    }

    static MatrixTensor fromPlain(String layerName, List<?> raw) {
        List<List<Double>> list = new ArrayList<>(raw.size());
        for (Object row : raw) {
            if (!(row instanceof List<?> cells)) {
                throw new IllegalArgumentException("Layer " + layerName + " mixes rows and scalars");
            }
            list.add(VectorTensor.fromPlain(layerName, cells).values());
        }
        return new MatrixTensor(list);
    }

    @Override
    public int size() {
        int total = 0;
        for (List<Double> row : rows) {
            total += row.size();
        }
        return total;
    }

    @Override
    public double[] flatten() {
        double[] out = new double[size()];
        int i = 0;
        for (List<Double> row : rows) {
            for (Double v : row) {
                out[i++] = v;
            }
        }
        return out;
    }

    @Override
    public WeightTensor map(DoubleUnaryOperator op) {
        List<List<Double>> mapped = new ArrayList<>(rows.size());
        for (List<Double> row : rows) {
            List<Double> out = new ArrayList<>(row.size());
            for (Double v : row) {
                out.add(op.applyAsDouble(v));
            }
            mapped.add(out);
        }
        return new MatrixTensor(mapped);
    }

    @Override
    public WeightTensor reshape(double[] flat) {
        if (flat.length != size()) {
            throw new IllegalArgumentException(
                "Matrix reshape expects " + size() + " values, got " + flat.length);
        }
        List<List<Double>> out = new ArrayList<>(rows.size());
        int i = 0;
        for (List<Double> row : rows) {
            List<Double> rebuilt = new ArrayList<>(row.size());
            for (int j = 0; j < row.size(); j++) {
                rebuilt.add(flat[i++]);
            }
            out.add(rebuilt);
        }
        return new MatrixTensor(out);
    }

    @Override
    public boolean sameShape(WeightTensor other) {
        if (!(other instanceof MatrixTensor m) || m.rows.size() != rows.size()) {
            return false;
        }
        for (int r = 0; r < rows.size(); r++) {
            if (m.rows.get(r).size() != rows.get(r).size()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Object toPlain() {
        return rows;
    }
}
