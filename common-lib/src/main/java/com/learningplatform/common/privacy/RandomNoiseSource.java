package com.learningplatform.common.privacy;

import java.util.Random;

/**
 * {@link NoiseSource} backed by {@link Random}. A fixed seed makes every draw
 * sequence reproducible; {@link Random} is safe for concurrent use.
 */
public final class RandomNoiseSource implements NoiseSource {

    private final Random random;

    public RandomNoiseSource(long seed) {
        this.random = new Random(seed);
    }

    public RandomNoiseSource() {
        this.random = new Random();
    }

    @Override
    public double gaussian(double sigma) {
        if (sigma == 0.0) {
            return 0.0;
        }
        return random.nextGaussian() * sigma;
    }
}
