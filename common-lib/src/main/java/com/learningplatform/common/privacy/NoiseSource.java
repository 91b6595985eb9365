package com.learningplatform.common.privacy;

/**
 * Source of zero-mean Gaussian draws. Injected wherever the coordinator perturbs
 * weights so that tests can pin the randomness.
 */
@FunctionalInterface
public interface NoiseSource {

    /** One draw from N(0, sigma²). A sigma of 0 must return 0. */
    double gaussian(double sigma);
}
