package net.littleredcomputer.symmetry;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Options;

import java.util.Locale;

/**
 * Settings of symmetry handling. Instances are immutable; use {@link #builder()} or
 * {@link #fromCommandLine(CommandLine)}.
 */
public final class SymmetryParameters {
    /** Which methods handle the detected symmetries. */
    public enum Usage {
        NONE, CONSTRAINTS, ORBITAL_FIXING, BOTH;

        public boolean constraints() { return this == CONSTRAINTS || this == BOTH; }
        public boolean orbitalFixing() { return this == ORBITAL_FIXING || this == BOTH; }
    }

    /** When, relative to presolving, something happens. */
    public enum Timing { BEFORE, DURING, AFTER }

    private final Usage usage;
    private final int maxGenerators;
    private final boolean checkSymmetries;
    private final boolean displayNOrbitVars;
    private final boolean computeOrbits;
    private final boolean detectOrbitopes;
    private final boolean detectSubgroups;
    private final boolean addWeakSbcs;
    private final boolean addSymresacks;
    private final boolean conssAddLp;
    private final boolean compressSymmetries;
    private final double compressThreshold;
    private final Timing addConssTiming;
    private final Timing ofSymCompTiming;
    private final boolean performPresolving;
    private final boolean recomputeRestart;
    private final boolean colorByConsNum;

    private SymmetryParameters(Builder b) {
        usage = b.usage;
        maxGenerators = b.maxGenerators;
        checkSymmetries = b.checkSymmetries;
        displayNOrbitVars = b.displayNOrbitVars;
        computeOrbits = b.computeOrbits;
        detectOrbitopes = b.detectOrbitopes;
        detectSubgroups = b.detectSubgroups;
        addWeakSbcs = b.addWeakSbcs;
        addSymresacks = b.addSymresacks;
        conssAddLp = b.conssAddLp;
        compressSymmetries = b.compressSymmetries;
        compressThreshold = b.compressThreshold;
        addConssTiming = b.addConssTiming;
        ofSymCompTiming = b.ofSymCompTiming;
        performPresolving = b.performPresolving;
        recomputeRestart = b.recomputeRestart;
        colorByConsNum = b.colorByConsNum;
    }

    public static Builder builder() { return new Builder(); }

    public static SymmetryParameters defaults() { return builder().build(); }

    public Usage usage() { return usage; }
    /** Generator cap handed to the oracle; 0 means no cap other than the memory bound. */
    public int maxGenerators() { return maxGenerators; }
    public boolean checkSymmetries() { return checkSymmetries; }
    public boolean displayNOrbitVars() { return displayNOrbitVars; }
    public boolean computeOrbits() { return computeOrbits; }
    public boolean detectOrbitopes() { return detectOrbitopes; }
    public boolean detectSubgroups() { return detectSubgroups; }
    public boolean addWeakSbcs() { return addWeakSbcs; }
    public boolean addSymresacks() { return addSymresacks; }
    public boolean conssAddLp() { return conssAddLp; }
    public boolean compressSymmetries() { return compressSymmetries; }
    public double compressThreshold() { return compressThreshold; }
    public Timing addConssTiming() { return addConssTiming; }
    public Timing ofSymCompTiming() { return ofSymCompTiming; }
    public boolean performPresolving() { return performPresolving; }
    public boolean recomputeRestart() { return recomputeRestart; }
    public boolean colorByConsNum() { return colorByConsNum; }

    public Builder toBuilder() {
        return new Builder()
                .usage(usage)
                .maxGenerators(maxGenerators)
                .checkSymmetries(checkSymmetries)
                .displayNOrbitVars(displayNOrbitVars)
                .computeOrbits(computeOrbits)
                .detectOrbitopes(detectOrbitopes)
                .detectSubgroups(detectSubgroups)
                .addWeakSbcs(addWeakSbcs)
                .addSymresacks(addSymresacks)
                .conssAddLp(conssAddLp)
                .compressSymmetries(compressSymmetries)
                .compressThreshold(compressThreshold)
                .addConssTiming(addConssTiming)
                .ofSymCompTiming(ofSymCompTiming)
                .performPresolving(performPresolving)
                .recomputeRestart(recomputeRestart)
                .colorByConsNum(colorByConsNum);
    }

    /** Command-line options for every setting, named as in {@link #fromCommandLine(CommandLine)}. */
    public static Options options() {
        return addOptions(new Options());
    }

    public static Options addOptions(Options o) {
        return o.addOption("usage", true, "symmetry handling: none, constraints, orbitalfixing or both")
                .addOption("maxgenerators", true, "limit on the number of generators (0: no limit)")
                .addOption("checksymmetries", true, "verify the generators found")
                .addOption("displaynorbitvars", true, "report the number of variables in nontrivial orbits")
                .addOption("computeorbits", true, "compute the orbits of the group after detection")
                .addOption("detectorbitopes", true, "look for orbitopes in the components")
                .addOption("detectsubgroups", true, "look for orbitopes in subgroups of the components")
                .addOption("addweaksbcs", true, "add a weak ordering inequality for subgroup orbitopes")
                .addOption("addsymresacks", true, "add symresacks for components not otherwise handled")
                .addOption("conssaddlp", true, "flag symmetry-handling constraints for the LP")
                .addOption("compresssymmetries", true, "drop unmoved variables from the group domain")
                .addOption("compressthreshold", true, "compress only if at most this fraction of variables moves")
                .addOption("addconsstiming", true, "when to add constraints: before, during or after presolving")
                .addOption("ofsymcomptiming", true, "when to compute symmetry for orbital fixing: before, during or after presolving")
                .addOption("performpresolving", true, "run orbital fixing during presolving")
                .addOption("recomputerestart", true, "recompute symmetry after a restart")
                .addOption("colorbyconsnum", true, "color variables by the number of constraints containing them");
    }

    public static SymmetryParameters fromCommandLine(CommandLine cmd) {
        Builder b = builder();
        if (cmd.hasOption("usage")) b.usage(usage(cmd.getOptionValue("usage")));
        if (cmd.hasOption("maxgenerators")) b.maxGenerators(integer("maxgenerators", cmd.getOptionValue("maxgenerators")));
        if (cmd.hasOption("checksymmetries")) b.checkSymmetries(bool("checksymmetries", cmd));
        if (cmd.hasOption("displaynorbitvars")) b.displayNOrbitVars(bool("displaynorbitvars", cmd));
        if (cmd.hasOption("computeorbits")) b.computeOrbits(bool("computeorbits", cmd));
        if (cmd.hasOption("detectorbitopes")) b.detectOrbitopes(bool("detectorbitopes", cmd));
        if (cmd.hasOption("detectsubgroups")) b.detectSubgroups(bool("detectsubgroups", cmd));
        if (cmd.hasOption("addweaksbcs")) b.addWeakSbcs(bool("addweaksbcs", cmd));
        if (cmd.hasOption("addsymresacks")) b.addSymresacks(bool("addsymresacks", cmd));
        if (cmd.hasOption("conssaddlp")) b.conssAddLp(bool("conssaddlp", cmd));
        if (cmd.hasOption("compresssymmetries")) b.compressSymmetries(bool("compresssymmetries", cmd));
        if (cmd.hasOption("compressthreshold")) b.compressThreshold(real("compressthreshold", cmd.getOptionValue("compressthreshold")));
        if (cmd.hasOption("addconsstiming")) b.addConssTiming(timing(cmd.getOptionValue("addconsstiming")));
        if (cmd.hasOption("ofsymcomptiming")) b.ofSymCompTiming(timing(cmd.getOptionValue("ofsymcomptiming")));
        if (cmd.hasOption("performpresolving")) b.performPresolving(bool("performpresolving", cmd));
        if (cmd.hasOption("recomputerestart")) b.recomputeRestart(bool("recomputerestart", cmd));
        if (cmd.hasOption("colorbyconsnum")) b.colorByConsNum(bool("colorbyconsnum", cmd));
        return b.build();
    }

    private static Usage usage(String s) {
        switch (s.toLowerCase(Locale.ROOT)) {
            case "none": case "0": return Usage.NONE;
            case "constraints": case "1": return Usage.CONSTRAINTS;
            case "orbitalfixing": case "2": return Usage.ORBITAL_FIXING;
            case "both": case "3": return Usage.BOTH;
            default: throw new IllegalArgumentException("unknown symmetry usage: " + s);
        }
    }

    private static Timing timing(String s) {
        switch (s.toLowerCase(Locale.ROOT)) {
            case "before": case "0": return Timing.BEFORE;
            case "during": case "1": return Timing.DURING;
            case "after": case "2": return Timing.AFTER;
            default: throw new IllegalArgumentException("unknown timing: " + s);
        }
    }

    private static boolean bool(String name, CommandLine cmd) {
        String s = cmd.getOptionValue(name);
        switch (s.toLowerCase(Locale.ROOT)) {
            case "true": case "1": return true;
            case "false": case "0": return false;
            default: throw new IllegalArgumentException(String.format("%s must be true or false, not %s", name, s));
        }
    }

    private static int integer(String name, String s) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("%s must be an integer, not %s", name, s), e);
        }
    }

    private static double real(String name, String s) {
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("%s must be a number, not %s", name, s), e);
        }
    }

    @Override
    public String toString() {
        return String.format("usage=%s maxgenerators=%d checksymmetries=%b detectorbitopes=%b detectsubgroups=%b "
                        + "addweaksbcs=%b addsymresacks=%b compresssymmetries=%b compressthreshold=%.2f "
                        + "addconsstiming=%s ofsymcomptiming=%s performpresolving=%b recomputerestart=%b",
                usage, maxGenerators, checkSymmetries, detectOrbitopes, detectSubgroups, addWeakSbcs, addSymresacks,
                compressSymmetries, compressThreshold, addConssTiming, ofSymCompTiming, performPresolving, recomputeRestart);
    }

    public static final class Builder {
        private Usage usage = Usage.ORBITAL_FIXING;
        private int maxGenerators = 1500;
        private boolean checkSymmetries = false;
        private boolean displayNOrbitVars = false;
        private boolean computeOrbits = false;
        private boolean detectOrbitopes = true;
        private boolean detectSubgroups = true;
        private boolean addWeakSbcs = true;
        private boolean addSymresacks = true;
        private boolean conssAddLp = true;
        private boolean compressSymmetries = true;
        private double compressThreshold = 0.5;
        private Timing addConssTiming = Timing.AFTER;
        private Timing ofSymCompTiming = Timing.AFTER;
        private boolean performPresolving = false;
        private boolean recomputeRestart = true;
        private boolean colorByConsNum = false;

        private Builder() {}

        public Builder usage(Usage u) {
            if (u == null) throw new IllegalArgumentException("usage must not be null");
            usage = u;
            return this;
        }

        public Builder maxGenerators(int n) {
            if (n < 0) throw new IllegalArgumentException("maxgenerators must be nonnegative");
            maxGenerators = n;
            return this;
        }

        public Builder checkSymmetries(boolean b) { checkSymmetries = b; return this; }
        public Builder displayNOrbitVars(boolean b) { displayNOrbitVars = b; return this; }
        public Builder computeOrbits(boolean b) { computeOrbits = b; return this; }
        public Builder detectOrbitopes(boolean b) { detectOrbitopes = b; return this; }
        public Builder detectSubgroups(boolean b) { detectSubgroups = b; return this; }
        public Builder addWeakSbcs(boolean b) { addWeakSbcs = b; return this; }
        public Builder addSymresacks(boolean b) { addSymresacks = b; return this; }
        public Builder conssAddLp(boolean b) { conssAddLp = b; return this; }
        public Builder compressSymmetries(boolean b) { compressSymmetries = b; return this; }

        public Builder compressThreshold(double t) {
            if (!(t >= 0.0 && t <= 1.0)) throw new IllegalArgumentException("compressthreshold must lie in [0, 1]");
            compressThreshold = t;
            return this;
        }

        public Builder addConssTiming(Timing t) {
            if (t == null) throw new IllegalArgumentException("addconsstiming must not be null");
            addConssTiming = t;
            return this;
        }

        public Builder ofSymCompTiming(Timing t) {
            if (t == null) throw new IllegalArgumentException("ofsymcomptiming must not be null");
            ofSymCompTiming = t;
            return this;
        }

        public Builder performPresolving(boolean b) { performPresolving = b; return this; }
        public Builder recomputeRestart(boolean b) { recomputeRestart = b; return this; }
        public Builder colorByConsNum(boolean b) { colorByConsNum = b; return this; }

        public SymmetryParameters build() { return new SymmetryParameters(this); }
    }
}
