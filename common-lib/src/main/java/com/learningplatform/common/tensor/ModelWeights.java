package com.learningplatform.common.tensor;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.DoubleUnaryOperator;

/**
 * Named layers of a model, each a {@link WeightTensor}.
 *
 * <p>Layers are kept sorted by name, so {@link #flatten()} yields the same element
 * order for two updates of the same shape regardless of the order the submitter
 * listed the layers in.
 *
 * <p>JSON form is a plain object of layer name → number | number[] | number[][].
 */
public final class ModelWeights {

    private final SortedMap<String, WeightTensor> layers;

    public ModelWeights(Map<String, WeightTensor> layers) {
        this.layers = Collections.unmodifiableSortedMap(new TreeMap<>(layers));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ModelWeights fromPlain(Map<String, Object> raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Weights must not be null");
        }
        Map<String, WeightTensor> parsed = new LinkedHashMap<>();
        raw.forEach((name, value) -> parsed.put(name, WeightTensor.fromPlain(name, value)));
        return new ModelWeights(parsed);
    }

    @JsonValue
    public Map<String, Object> toPlain() {
        Map<String, Object> out = new LinkedHashMap<>();
        layers.forEach((name, tensor) -> out.put(name, tensor.toPlain()));
        return out;
    }

    public SortedMap<String, WeightTensor> layers() {
        return layers;
    }

    public boolean isEmpty() {
        return layers.isEmpty();
    }

    public int size() {
        int total = 0;
        for (WeightTensor t : layers.values()) {
            total += t.size();
        }
        return total;
    }

    /** Every element, layer by layer in name order, row-major inside a layer. */
    public double[] flatten() {
        double[] out = new double[size()];
        int i = 0;
        for (WeightTensor t : layers.values()) {
            double[] part = t.flatten();
            System.arraycopy(part, 0, out, i, part.length);
            i += part.length;
        }
        return out;
    }

    public ModelWeights map(DoubleUnaryOperator op) {
        Map<String, WeightTensor> mapped = new LinkedHashMap<>();
        layers.forEach((name, tensor) -> mapped.put(name, tensor.map(op)));
        return new ModelWeights(mapped);
    }

    public boolean allFinite() {
        for (double v : flatten()) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }

    /** Same layer names and the same shape in every layer. */
    public boolean sameShape(ModelWeights other) {
        if (!layers.keySet().equals(other.layers.keySet())) {
            return false;
        }
        for (Map.Entry<String, WeightTensor> e : layers.entrySet()) {
            if (!e.getValue().sameShape(other.layers.get(e.getKey()))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Element-wise combination of same-shaped weights.
     *
     * @param inputs  non-empty list; every entry must have the shape of the first
     * @param reducer receives the values at one position, in input order
     * @return weights shaped like {@code inputs.get(0)}
     * @throws IllegalArgumentException when inputs are empty or shapes differ
     */
    public static ModelWeights combine(List<ModelWeights> inputs, ElementReducer reducer) {
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("Nothing to combine");
        }
        ModelWeights template = inputs.get(0);
        for (ModelWeights w : inputs) {
            if (!template.sameShape(w)) {
                throw new IllegalArgumentException("Cannot combine weights of different shapes");
            }
        }

        Map<String, WeightTensor> combined = new LinkedHashMap<>();
        for (Map.Entry<String, WeightTensor> e : template.layers.entrySet()) {
            List<double[]> flats = new ArrayList<>(inputs.size());
            for (ModelWeights w : inputs) {
                flats.add(w.layers.get(e.getKey()).flatten());
            }
            int n = e.getValue().size();
            double[] out = new double[n];
            double[] column = new double[inputs.size()];
            for (int i = 0; i < n; i++) {
                for (int k = 0; k < flats.size(); k++) {
                    column[k] = flats.get(k)[i];
                }
                out[i] = reducer.reduce(column.clone());
            }
            combined.put(e.getKey(), e.getValue().reshape(out));
        }
        return new ModelWeights(combined);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ModelWeights other && layers.equals(other.layers);
    }

    @Override
    public int hashCode() {
        return layers.hashCode();
    }

    @Override
    public String toString() {
        return "ModelWeights" + toPlain();
    }
}
