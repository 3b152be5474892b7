package com.vertexcover;

public final class SearchStats {
    public enum StopReason { MAX_ITERATIONS, EARLY_STOP, TIME_LIMIT }

    public int iterations;
    public int accepted;
    public int rejected;
    public int improvements;
    public int noMoveIterations;
    public int stagnation;
    public int initialCovered;
    public double finalTemperature;
    public StopReason stopReason;

    @Override
    public String toString() {
        return "*Totals: iterations=" + iterations +
                " accepted=" + accepted +
                " rejected=" + rejected +
                " improvements=" + improvements +
                " no_move=" + noMoveIterations +
                " stop=" + stopReason;
    }
}
