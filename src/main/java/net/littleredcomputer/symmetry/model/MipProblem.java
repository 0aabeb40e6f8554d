package net.littleredcomputer.symmetry.model;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * A mixed-integer program as far as symmetry detection needs to see it: the variables (binary
 * variables first), the active constraints, and the solver features that make symmetry unsound.
 */
public class MipProblem {
    private final ImmutableList<Variable> variables;
    private final ImmutableList<Constraint> constraints;
    private final boolean pricersActive;
    private final boolean reoptimization;
    private final int nBinVars;

    private MipProblem(Builder b) {
        this.variables = ImmutableList.copyOf(b.variables);
        this.constraints = ImmutableList.copyOf(b.constraints);
        this.pricersActive = b.pricersActive;
        this.reoptimization = b.reoptimization;
        int n = 0;
        while (n < variables.size() && variables.get(n).isBinary()) ++n;
        for (int i = n; i < variables.size(); ++i) {
            if (variables.get(i).isBinary()) throw new IllegalArgumentException("Binary variable " + variables.get(i) + " follows a non-binary variable");
        }
        this.nBinVars = n;
    }

    public static Builder builder() { return new Builder(); }

    public List<Variable> variables() { return variables; }
    public Variable variable(int i) { return variables.get(i); }
    public int nVariables() { return variables.size(); }
    public int nBinVars() { return nBinVars; }
    public List<Constraint> constraints() { return constraints; }
    public boolean pricersActive() { return pricersActive; }
    public boolean reoptimization() { return reoptimization; }

    public static class Builder {
        private final List<Variable> variables = new ArrayList<>();
        private final List<Constraint> constraints = new ArrayList<>();
        private boolean pricersActive = false;
        private boolean reoptimization = false;

        public Variable addVariable(String name, VarType type, double obj, double lb, double ub) {
            Variable v = new Variable(variables.size(), name, type, obj, lb, ub);
            variables.add(v);
            return v;
        }

        public Variable addBinary(String name, double obj) {
            return addVariable(name, VarType.BINARY, obj, 0, 1);
        }

        public Builder addConstraint(Constraint c) {
            for (Variable v : c.variables()) {
                if (v.index() >= variables.size() || variables.get(v.index()) != v) {
                    throw new IllegalArgumentException("Constraint " + c.name() + " uses variable " + v + " of another problem");
                }
            }
            constraints.add(c);
            return this;
        }

        public Builder pricersActive(boolean active) {
            pricersActive = active;
            return this;
        }

        public Builder reoptimization(boolean enabled) {
            reoptimization = enabled;
            return this;
        }

        public MipProblem build() { return new MipProblem(this); }
    }

    /**
     * Bin packing with identical bins: x[i][b] places item i in bin b, y[b] opens bin b. Item i has
     * size i+1, so the items are pairwise distinguishable and the only symmetry permutes the bins.
     */
    public static MipProblem binPacking(int nItems, int nBins) {
        if (nItems < 1 || nBins < 1) throw new IllegalArgumentException("Need at least one item and one bin");
        Builder b = builder();
        Variable[][] x = new Variable[nItems][nBins];
        for (int i = 0; i < nItems; ++i) {
            for (int j = 0; j < nBins; ++j) x[i][j] = b.addBinary(String.format("x%d_%d", i, j), 0);
        }
        Variable[] y = new Variable[nBins];
        for (int j = 0; j < nBins; ++j) y[j] = b.addBinary("y" + j, 1);
        int total = nItems * (nItems + 1) / 2;
        int capacity = Math.max(nItems, (total + nBins - 1) / nBins);
        for (int i = 0; i < nItems; ++i) {
            b.addConstraint(Constraint.setPartitioning("assign" + i, x[i]));
        }
        for (int j = 0; j < nBins; ++j) {
            Variable[] vars = new Variable[nItems + 1];
            double[] vals = new double[nItems + 1];
            for (int i = 0; i < nItems; ++i) {
                vars[i] = x[i][j];
                vals[i] = i + 1;
            }
            vars[nItems] = y[j];
            vals[nItems] = -capacity;
            b.addConstraint(Constraint.linear("capacity" + j, vars, vals, Double.NEGATIVE_INFINITY, 0));
        }
        return b.build();
    }

    /** x[i][j] puts pigeon i in hole j; every pigeon needs a hole, every hole takes one pigeon. */
    public static MipProblem pigeonhole(int nPigeons, int nHoles) {
        if (nPigeons < 1 || nHoles < 1) throw new IllegalArgumentException("Need at least one pigeon and one hole");
        Builder b = builder();
        Variable[][] x = new Variable[nPigeons][nHoles];
        for (int i = 0; i < nPigeons; ++i) {
            for (int j = 0; j < nHoles; ++j) x[i][j] = b.addBinary(String.format("x%d_%d", i, j), 0);
        }
        for (int i = 0; i < nPigeons; ++i) b.addConstraint(Constraint.setPartitioning("pigeon" + i, x[i]));
        for (int j = 0; j < nHoles; ++j) {
            Variable[] column = new Variable[nPigeons];
            for (int i = 0; i < nPigeons; ++i) column[i] = x[i][j];
            b.addConstraint(Constraint.setPacking("hole" + j, column));
        }
        return b.build();
    }

    /** The single constraint x1 + ... + xn <= n-1 over identical binaries. */
    public static MipProblem sum(int n) {
        if (n < 2) throw new IllegalArgumentException("Need at least two variables");
        Builder b = builder();
        Variable[] x = new Variable[n];
        double[] ones = new double[n];
        for (int i = 0; i < n; ++i) {
            x[i] = b.addBinary("x" + (i + 1), 1);
            ones[i] = 1;
        }
        b.addConstraint(Constraint.linear("sum", x, ones, Double.NEGATIVE_INFINITY, n - 1));
        return b.build();
    }
}
