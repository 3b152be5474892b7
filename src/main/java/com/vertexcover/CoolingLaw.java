package com.vertexcover;

/** Temperature update applied after every iteration. */
public enum CoolingLaw {
    /** {@code T *= rate}. */
    GEOMETRIC {
        @Override
        double next(double temperature, double rate, int iteration, int maxIteration) {
            return temperature * rate;
        }
    },
    /** {@code T *= rate * (1 - i / maxIteration)}; cools faster as the run ages, floored at 0. */
    GEOMETRIC_DECAY {
        @Override
        double next(double temperature, double rate, int iteration, int maxIteration) {
            if (maxIteration <= 0) return 0.0;
            double t = temperature * rate * (1.0 - (double) iteration / maxIteration);
            return t > 0.0 ? t : 0.0;
        }
    };

    abstract double next(double temperature, double rate, int iteration, int maxIteration);
}
