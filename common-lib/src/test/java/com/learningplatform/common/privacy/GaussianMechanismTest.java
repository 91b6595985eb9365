package com.learningplatform.common.privacy;

import com.learningplatform.common.tensor.ModelWeights;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.learningplatform.common.Fixtures.vector;
import static org.junit.jupiter.api.Assertions.*;

class GaussianMechanismTest {

    @Test
    @DisplayName("sigma is sensitivity / epsilon")
    void noiseScale() {
        GaussianMechanism mechanism = new GaussianMechanism(sigma -> 0.0);
        assertEquals(2.0, mechanism.noiseScale(0.5), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> mechanism.noiseScale(0.0));
    }

    @Test
    @DisplayName("every element receives its own draw and the shape is kept")
    void perturbsEveryElement() {
        GaussianMechanism mechanism = new GaussianMechanism(sigma -> sigma);
        GaussianMechanism.Perturbation p = mechanism.perturb(vector(1, 2, 3), 1.0);
        assertArrayEquals(new double[]{2, 3, 4}, p.weights().flatten(), 1e-12);
        assertEquals(1.0, p.noiseScale(), 1e-12);
        assertEquals(1.0, p.epsilon(), 1e-12);
    }

    @Test
    @DisplayName("same seed → same noisy weights")
    void seededReproducible() {
        ModelWeights a = new GaussianMechanism(new RandomNoiseSource(42)).perturb(vector(1, 2, 3), 0.5).weights();
        ModelWeights b = new GaussianMechanism(new RandomNoiseSource(42)).perturb(vector(1, 2, 3), 0.5).weights();
        assertEquals(a, b);
        assertNotEquals(vector(1, 2, 3), a);
    }
}
