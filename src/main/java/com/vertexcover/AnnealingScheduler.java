package com.vertexcover;

import java.util.Random;

/**
 * Owns the temperature of one run and decides whether a proposed move is taken.
 * Improving moves are always accepted; others with probability
 * {@code exp(delta / T)}, and never once {@code T <= 0}.
 */
public final class AnnealingScheduler {

    private final CoolingLaw law;
    private final double coolingRate;
    private final int maxIteration;
    private double temperature;

    public AnnealingScheduler(double initialTemp, double coolingRate, CoolingLaw law, int maxIteration) {
        this.temperature = initialTemp;
        this.coolingRate = coolingRate;
        this.law = law;
        this.maxIteration = maxIteration;
    }

    public static AnnealingScheduler from(AnnealParams p) {
        return new AnnealingScheduler(p.initialTemp, p.coolingRate, p.coolingLaw, p.maxIteration);
    }

    public double temperature() { return temperature; }

    public boolean accept(int delta, Random rng) {
        return accept(delta, temperature, rng);
    }

    static boolean accept(int delta, double temperature, Random rng) {
        if (delta > 0) return true;
        if (!(temperature > 0.0)) return false;   // also catches NaN
        return rng.nextDouble() < Math.exp(delta / temperature);
    }

    /** Advances the temperature past iteration {@code iteration}. */
    public void cool(int iteration) {
        temperature = law.next(temperature, coolingRate, iteration, maxIteration);
    }
}
