package com.learningplatform.common.tensor;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelWeightsTest {

    private static ModelWeights mixed() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("dense", List.of(List.of(1.0, 2.0), List.of(3.0)));
        raw.put("bias", 0.5);
        raw.put("conv", List.of(4.0, 5.0));
        return ModelWeights.fromPlain(raw);
    }

    @Nested
    @DisplayName("fromPlain() parsing")
    class Parsing {

        @Test
        @DisplayName("scalar, vector and ragged matrix layers are accepted")
        void mixedLayers() {
            ModelWeights w = mixed();
            assertInstanceOf(ScalarTensor.class, w.layers().get("bias"));
            assertInstanceOf(VectorTensor.class, w.layers().get("conv"));
            assertInstanceOf(MatrixTensor.class, w.layers().get("dense"));
            assertEquals(6, w.size());
        }

        @Test
        @DisplayName("strings are rejected")
        void nonNumeric_rejected() {
            assertThrows(IllegalArgumentException.class,
                () -> ModelWeights.fromPlain(Map.of("layer", "oops")));
        }

        @Test
        @DisplayName("empty vector layer is rejected")
        void emptyLayer_rejected() {
            assertThrows(IllegalArgumentException.class,
                () -> ModelWeights.fromPlain(Map.of("layer", List.of())));
        }

        @Test
        @DisplayName("Jackson reads a plain JSON object")
        void jacksonDelegatingCreator() throws Exception {
            ModelWeights w = new ObjectMapper().readValue("{\"b\":[1.0,2.0],\"a\":3}", ModelWeights.class);
            assertArrayEquals(new double[]{3.0, 1.0, 2.0}, w.flatten());
        }
    }

    @Nested
    @DisplayName("flatten() and shape")
    class Shape {

        @Test
        @DisplayName("layers flatten in name order, rows in order")
        void flattenOrder() {
            assertArrayEquals(new double[]{0.5, 4.0, 5.0, 1.0, 2.0, 3.0}, mixed().flatten());
        }

        @Test
        @DisplayName("different vector lengths are not the same shape")
        void lengthMismatch() {
            ModelWeights a = new ModelWeights(Map.of("l", VectorTensor.of(1, 2)));
            ModelWeights b = new ModelWeights(Map.of("l", VectorTensor.of(1, 2, 3)));
            assertFalse(a.sameShape(b));
        }

        @Test
        @DisplayName("scalar and one-element vector are not the same shape")
        void kindMismatch() {
            ModelWeights a = new ModelWeights(Map.of("l", new ScalarTensor(1)));
            ModelWeights b = new ModelWeights(Map.of("l", VectorTensor.of(1)));
            assertFalse(a.sameShape(b));
        }

        @Test
        @DisplayName("NaN is not finite")
        void allFinite() {
            assertTrue(mixed().allFinite());
            assertFalse(mixed().map(v -> Double.NaN).allFinite());
        }
    }

    @Nested
    @DisplayName("combine()")
    class Combine {

        @Test
        @DisplayName("reducer sees the values at each position and the shape is kept")
        void elementWise() {
            ModelWeights a = mixed();
            ModelWeights b = mixed().map(v -> v * 3);
            ModelWeights sum = ModelWeights.combine(List.of(a, b), values -> values[0] + values[1]);
            assertTrue(sum.sameShape(a));
            assertEquals(mixed().map(v -> v * 4), sum);
        }

        @Test
        @DisplayName("different shapes are refused")
        void shapeMismatch() {
            ModelWeights a = new ModelWeights(Map.of("l", VectorTensor.of(1, 2)));
            ModelWeights b = new ModelWeights(Map.of("m", VectorTensor.of(1, 2)));
            assertThrows(IllegalArgumentException.class,
                () -> ModelWeights.combine(List.of(a, b), values -> values[0]));
        }
    }
}
