package com.vertexcover;

import java.util.*;

public final class OptionsParser {

    public static final class Parsed {
        public final AnnealParams.Builder params;
        public final List<String> inputPaths;
        public final String jobsFile;
        public final int threads;
        public final boolean printCover;
        private Parsed(AnnealParams.Builder b, List<String> in, String jobs, int t, boolean pc){
            params=b; inputPaths=Collections.unmodifiableList(in); jobsFile=jobs; threads=t; printCover=pc;
        }
    }

    public static Parsed parse(String[] args){
        AnnealParams.Builder b = AnnealParams.builder();
        // variant defaults first, so explicit flags win regardless of position
        if (Arrays.asList(args).contains("-baseline")) b.baseline();

        List<String> inputs = new ArrayList<>();
        String jobs = null;
        int threads = 1;
        boolean printCover = false;
        boolean sawMaxNode = false;

        for (int i=0; i<args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-baseline": break;
                case "-maxnode": b.maxNode(parseInt(a, next(args, ++i))); sawMaxNode = true; break;
                case "-temp": b.initialTemp(parseDouble(a, next(args, ++i))); break;
                case "-cooling": b.coolingRate(parseDouble(a, next(args, ++i))); break;
                case "-iterations": b.maxIteration(parseInt(a, next(args, ++i))); break;
                case "-earlystop": {
                    String v = next(args, ++i);
                    if (v.equalsIgnoreCase("off")) b.noEarlyStop(); else b.earlyStop(parseInt(a, v));
                    break;
                }
                case "-policy": {
                    String v = next(args, ++i).toLowerCase(Locale.ROOT);
                    switch (v) {
                        case "degree": b.movePolicy(MovePolicy.DEGREE_BIASED); break;
                        case "uniform": b.movePolicy(MovePolicy.UNIFORM); break;
                        default: throw new IllegalArgumentException("Unknown move policy: " + v);
                    }
                    break;
                }
                case "-law": {
                    String v = next(args, ++i).toLowerCase(Locale.ROOT);
                    switch (v) {
                        case "geometric": b.coolingLaw(CoolingLaw.GEOMETRIC); break;
                        case "decay": b.coolingLaw(CoolingLaw.GEOMETRIC_DECAY); break;
                        default: throw new IllegalArgumentException("Unknown cooling law: " + v);
                    }
                    break;
                }
                case "-delta": {
                    String v = next(args, ++i).toLowerCase(Locale.ROOT);
                    switch (v) {
                        case "best": b.deltaReference(AnnealParams.DeltaReference.BEST); break;
                        case "current": b.deltaReference(AnnealParams.DeltaReference.CURRENT); break;
                        default: throw new IllegalArgumentException("Unknown delta reference: " + v);
                    }
                    break;
                }
                case "-stagnation": {
                    String v = next(args, ++i).toLowerCase(Locale.ROOT);
                    switch (v) {
                        case "accepted": b.stagnationPolicy(AnnealParams.StagnationPolicy.ACCEPTED_ONLY); break;
                        case "all": b.stagnationPolicy(AnnealParams.StagnationPolicy.ALL_NON_IMPROVING); break;
                        default: throw new IllegalArgumentException("Unknown stagnation policy: " + v);
                    }
                    break;
                }
                case "-seed": b.seed(parseLong(a, next(args, ++i))); break;
                case "-timelimit": b.timeLimitMillis(parseLong(a, next(args, ++i))); break;
                case "-threads": threads = Math.max(1, parseInt(a, next(args, ++i))); break;
                case "-printcover": printCover = true; break;
                case "-jobs": {
                    if (jobs != null) throw new IllegalArgumentException("Multiple -jobs files");
                    jobs = next(args, ++i);
                    break;
                }
                default:
                    if (a.startsWith("-")) throw new IllegalArgumentException("Unknown option: " + a);
                    inputs.add(a);
            }
        }
        if (inputs.isEmpty() && jobs == null) throw new IllegalArgumentException("Missing input file");
        if (!inputs.isEmpty() && !sawMaxNode)
            throw new IllegalArgumentException("-maxnode is required for graph files given on the command line");
        return new Parsed(b, inputs, jobs, threads, printCover);
    }

    private static String next(String[] args, int i){
        if (i >= args.length) throw new IllegalArgumentException("Missing value for " + args[i-1]);
        return args[i];
    }

    private static int parseInt(String opt, String v){
        try { return Integer.parseInt(v); }
        catch (NumberFormatException e) { throw new IllegalArgumentException(opt + " expects an integer, got: " + v); }
    }

    private static long parseLong(String opt, String v){
        try { return Long.parseLong(v); }
        catch (NumberFormatException e) { throw new IllegalArgumentException(opt + " expects an integer, got: " + v); }
    }

    private static double parseDouble(String opt, String v){
        try { return Double.parseDouble(v); }
        catch (NumberFormatException e) { throw new IllegalArgumentException(opt + " expects a number, got: " + v); }
    }
}
