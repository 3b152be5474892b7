package com.vertexcover;

import java.util.OptionalInt;

/**
 * Immutable parameter bundle for one search run.
 *
 * Defaults are the improved variant: degree-biased moves, geometric cooling
 * with the linear decay term at rate 0.9, early stop after 150 accepted
 * non-improving moves. {@link #baseline(int)} gives the plain variant.
 */
public final class AnnealParams {

    /** What a candidate's coverage is compared against in the acceptance test. */
    public enum DeltaReference { BEST, CURRENT }

    /** Which non-improving iterations count toward the early-stop budget. */
    public enum StagnationPolicy { ACCEPTED_ONLY, ALL_NON_IMPROVING }

    public static final double DEFAULT_INITIAL_TEMP = 1500.0;
    public static final int DEFAULT_MAX_ITERATION = 1500;
    public static final double IMPROVED_COOLING_RATE = 0.9;
    public static final double BASELINE_COOLING_RATE = 0.95;
    public static final int IMPROVED_EARLY_STOP = 150;

    public final int maxNode;
    public final double initialTemp;
    public final double coolingRate;
    public final int maxIteration;
    public final OptionalInt earlyStop;            // empty = disabled
    public final MovePolicy movePolicy;
    public final CoolingLaw coolingLaw;
    public final DeltaReference deltaReference;
    public final StagnationPolicy stagnationPolicy;
    public final long seed;
    public final long timeLimitMillis;             // 0 = no limit

    private AnnealParams(Builder b) {
        this.maxNode = b.maxNode;
        this.initialTemp = b.initialTemp;
        this.coolingRate = b.coolingRate;
        this.maxIteration = b.maxIteration;
        this.earlyStop = b.earlyStop;
        this.movePolicy = b.movePolicy;
        this.coolingLaw = b.coolingLaw;
        this.deltaReference = b.deltaReference;
        this.stagnationPolicy = b.stagnationPolicy;
        this.seed = b.seed;
        this.timeLimitMillis = b.timeLimitMillis;
    }

    public static AnnealParams improved(int maxNode) {
        return new Builder().maxNode(maxNode).build();
    }

    public static AnnealParams baseline(int maxNode) {
        return new Builder().baseline().maxNode(maxNode).build();
    }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        Builder b = new Builder()
                .maxNode(maxNode).initialTemp(initialTemp).coolingRate(coolingRate)
                .maxIteration(maxIteration).movePolicy(movePolicy).coolingLaw(coolingLaw)
                .deltaReference(deltaReference).stagnationPolicy(stagnationPolicy)
                .seed(seed).timeLimitMillis(timeLimitMillis);
        if (earlyStop.isPresent()) b.earlyStop(earlyStop.getAsInt()); else b.noEarlyStop();
        return b;
    }

    @Override
    public String toString() {
        return "AnnealParams{maxNode=" + maxNode +
                ", initialTemp=" + initialTemp +
                ", coolingRate=" + coolingRate +
                ", maxIteration=" + maxIteration +
                ", earlyStop=" + (earlyStop.isPresent() ? String.valueOf(earlyStop.getAsInt()) : "off") +
                ", movePolicy=" + movePolicy +
                ", coolingLaw=" + coolingLaw +
                ", delta=" + deltaReference +
                ", stagnation=" + stagnationPolicy +
                ", seed=" + seed +
                (timeLimitMillis > 0 ? ", timeLimitMillis=" + timeLimitMillis : "") +
                "}";
    }

    public static final class Builder {
        private int maxNode = -1;
        private double initialTemp = DEFAULT_INITIAL_TEMP;
        private double coolingRate = IMPROVED_COOLING_RATE;
        private int maxIteration = DEFAULT_MAX_ITERATION;
        private OptionalInt earlyStop = OptionalInt.of(IMPROVED_EARLY_STOP);
        private MovePolicy movePolicy = MovePolicy.DEGREE_BIASED;
        private CoolingLaw coolingLaw = CoolingLaw.GEOMETRIC_DECAY;
        private DeltaReference deltaReference = DeltaReference.BEST;
        private StagnationPolicy stagnationPolicy = StagnationPolicy.ACCEPTED_ONLY;
        private long seed = 1L;
        private long timeLimitMillis = 0L;

        /** Switches the variant defaults to the baseline: uniform moves, geometric 0.95, no early stop. */
        public Builder baseline() {
            this.movePolicy = MovePolicy.UNIFORM;
            this.coolingLaw = CoolingLaw.GEOMETRIC;
            this.coolingRate = BASELINE_COOLING_RATE;
            this.earlyStop = OptionalInt.empty();
            return this;
        }

        public Builder maxNode(int v){ this.maxNode=v; return this; }
        public Builder initialTemp(double v){ this.initialTemp=v; return this; }
        public Builder coolingRate(double v){ this.coolingRate=v; return this; }
        public Builder maxIteration(int v){ this.maxIteration=v; return this; }
        public Builder earlyStop(int v){ this.earlyStop=OptionalInt.of(v); return this; }
        public Builder noEarlyStop(){ this.earlyStop=OptionalInt.empty(); return this; }
        public Builder movePolicy(MovePolicy v){ this.movePolicy=v; return this; }
        public Builder coolingLaw(CoolingLaw v){ this.coolingLaw=v; return this; }
        public Builder deltaReference(DeltaReference v){ this.deltaReference=v; return this; }
        public Builder stagnationPolicy(StagnationPolicy v){ this.stagnationPolicy=v; return this; }
        public Builder seed(long v){ this.seed=v; return this; }
        public Builder timeLimitMillis(long v){ this.timeLimitMillis=v; return this; }

        public int maxNode() { return maxNode; }

        /** Independent builder with the same settings. */
        public Builder copy() {
            Builder b = new Builder();
            b.maxNode = maxNode;
            b.initialTemp = initialTemp;
            b.coolingRate = coolingRate;
            b.maxIteration = maxIteration;
            b.earlyStop = earlyStop;
            b.movePolicy = movePolicy;
            b.coolingLaw = coolingLaw;
            b.deltaReference = deltaReference;
            b.stagnationPolicy = stagnationPolicy;
            b.seed = seed;
            b.timeLimitMillis = timeLimitMillis;
            return b;
        }

        /**
         * Validates everything that does not depend on the graph.
         * {@code maxNode <= N} is checked when the search starts.
         */
        public AnnealParams build() {
            if (maxNode <= 0)
                throw new InvalidParameterException("Max_Node must be positive, got " + maxNode);
            if (maxIteration < 0)
                throw new InvalidParameterException("max_iteration must be >= 0, got " + maxIteration);
            if (!(initialTemp > 0.0) || Double.isInfinite(initialTemp))
                throw new InvalidParameterException("initial_temp must be a positive number, got " + initialTemp);
            if (!(coolingRate > 0.0 && coolingRate <= 1.0))
                throw new InvalidParameterException("cooling_rate must be in (0, 1], got " + coolingRate);
            if (earlyStop.isPresent() && earlyStop.getAsInt() <= 0)
                throw new InvalidParameterException("early_stop must be positive when enabled, got " + earlyStop.getAsInt());
            if (timeLimitMillis < 0)
                throw new InvalidParameterException("time limit must be >= 0, got " + timeLimitMillis);
            if (movePolicy == null || coolingLaw == null || deltaReference == null || stagnationPolicy == null)
                throw new InvalidParameterException("policy options must not be null");
            return new AnnealParams(this);
        }
    }
}
