package org.jstats.forecast_api.modules.montecarlo.service;

import java.util.Random;

/**
 * Box-Muller normal draws over a {@link Random}. One instance per simulation run.
 */
final class GaussianSampler {

    private final Random random;

    GaussianSampler(Random random) {
        this.random = random;
    }

    static GaussianSampler of(Long seed) {
        return new GaussianSampler(seed != null ? new Random(seed) : new Random());
    }

    double next(double mean, double stdDev) {
        // 1 - u keeps the log argument in (0,1]
        double u1 = 1.0 - random.nextDouble();
        double u2 = random.nextDouble();
        double z = Math.sqrt(-2 * Math.log(u1)) * Math.cos(2 * Math.PI * u2);
        return mean + z * stdDev;
    }
}
