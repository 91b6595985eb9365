package com.learningplatform.common.privacy;

import com.learningplatform.common.tensor.ModelWeights;

/**
 * Gaussian differential-privacy mechanism applied to every scalar of a weight set.
 *
 * <pre>
 *   sigma = sensitivity / epsilon        (sensitivity = {@value #DEFAULT_SENSITIVITY})
 *   w'    = w + N(0, sigma²)             independently per element
 * </pre>
 *
 * <p>The privacy cost recorded for one application is {@code epsilon}; repeated
 * applications compose additively in the agent's ledger.
 */
public final class GaussianMechanism {

    public static final String NAME = "gaussian";
    public static final double DEFAULT_SENSITIVITY = 1.0;

    private final double sensitivity;
    private final NoiseSource noise;

    public GaussianMechanism(double sensitivity, NoiseSource noise) {
        if (sensitivity <= 0.0) {
            throw new IllegalArgumentException("Sensitivity must be positive");
        }
        this.sensitivity = sensitivity;
        this.noise = noise;
    }

    public GaussianMechanism(NoiseSource noise) {
        this(DEFAULT_SENSITIVITY, noise);
    }

    public double noiseScale(double epsilon) {
        if (epsilon <= 0.0) {
            throw new IllegalArgumentException("Epsilon must be positive");
        }
        return sensitivity / epsilon;
    }

    public Perturbation perturb(ModelWeights weights, double epsilon) {
        double sigma = noiseScale(epsilon);
        ModelWeights noisy = weights.map(w -> w + noise.gaussian(sigma));
        return new Perturbation(noisy, sigma, epsilon);
    }

    public record Perturbation(ModelWeights weights, double noiseScale, double epsilon) {}
}
