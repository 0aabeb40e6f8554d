package net.littleredcomputer.symmetry.model;

import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * An active constraint of the model. The set of kinds is closed: every kind knows how to express
 * itself as rows of the colored matrix, except {@link Kind#FOREIGN}, which stands for constraint
 * handlers without a known encoding.
 */
public abstract class Constraint {
    public enum Kind { LINEAR, SETPPC, LOGICOR, KNAPSACK, VARBOUND, XOR, AND, OR, LINKING, BOUNDDISJUNCTION, FOREIGN }

    public enum SetppcType { PARTITIONING, PACKING, COVERING }

    private final String name;
    private final ImmutableList<Variable> variables;

    private Constraint(String name, Variable... variables) {
        this.name = name;
        this.variables = ImmutableList.copyOf(variables);
    }

    public String name() { return name; }
    public List<Variable> variables() { return variables; }
    public abstract Kind kind();

    /**
     * Adds the rows representing this constraint.
     * @return false if this constraint has no encoding; rows may have been added in that case
     */
    abstract boolean encode(RowCollector rows);

    @Override
    public String toString() { return kind() + " " + name + " " + variables; }

    private static double[] ones(int n) {
        double[] a = new double[n];
        Arrays.fill(a, 1.0);
        return a;
    }

    private static Variable[] append(Variable[] vars, Variable v) {
        Variable[] a = Arrays.copyOf(vars, vars.length + 1);
        a[vars.length] = v;
        return a;
    }

    private static double[] append(double[] vals, double d) {
        double[] a = Arrays.copyOf(vals, vals.length + 1);
        a[vals.length] = d;
        return a;
    }

    public static Constraint linear(String name, Variable[] vars, double[] vals, double lhs, double rhs) {
        if (vars.length != vals.length) throw new IllegalArgumentException("Got " + vars.length + " variables and " + vals.length + " coefficients");
        if (lhs > rhs) throw new IllegalArgumentException("Left side exceeds right side in " + name);
        return new Linear(name, vars, vals, lhs, rhs);
    }

    public static Constraint setPartitioning(String name, Variable... vars) { return new Setppc(name, SetppcType.PARTITIONING, vars); }
    public static Constraint setPacking(String name, Variable... vars) { return new Setppc(name, SetppcType.PACKING, vars); }
    public static Constraint setCovering(String name, Variable... vars) { return new Setppc(name, SetppcType.COVERING, vars); }
    public static Constraint logicor(String name, Variable... vars) { return new Logicor(name, vars); }

    public static Constraint knapsack(String name, Variable[] vars, long[] weights, long capacity) {
        if (vars.length != weights.length) throw new IllegalArgumentException("Got " + vars.length + " variables and " + weights.length + " weights");
        return new Knapsack(name, vars, weights, capacity);
    }

    /** lhs <= x + coef * y <= rhs */
    public static Constraint varbound(String name, Variable x, Variable y, double coef, double lhs, double rhs) {
        return new Varbound(name, x, y, coef, lhs, rhs);
    }

    /**
     * The parity of vars equals rhs.
     * @param intVar optional integer variable making the constraint linear, may be null
     */
    public static Constraint xor(String name, boolean rhs, Variable intVar, Variable... vars) { return new Xor(name, rhs, intVar, vars); }

    /** resultant = vars[0] and ... and vars[n-1] */
    public static Constraint and(String name, Variable resultant, Variable... vars) { return new AndOr(name, Kind.AND, resultant, vars); }

    /** resultant = vars[0] or ... or vars[n-1] */
    public static Constraint or(String name, Variable resultant, Variable... vars) { return new AndOr(name, Kind.OR, resultant, vars); }

    /** intVar = sum vals[i] * binVars[i] where exactly one binVars[i] is 1. */
    public static Constraint linking(String name, Variable intVar, Variable[] binVars, int[] vals) {
        if (binVars.length != vals.length) throw new IllegalArgumentException("Got " + binVars.length + " variables and " + vals.length + " values");
        return new Linking(name, intVar, binVars, vals);
    }

    /** The disjunction over i of (vars[i] >= bounds[i]) or (vars[i] <= bounds[i]), by types[i]. */
    public static Constraint boundDisjunction(String name, Variable[] vars, BoundType[] types, double[] bounds) {
        if (vars.length != types.length || vars.length != bounds.length) throw new IllegalArgumentException("Bound disjunction " + name + " has inconsistent literal arrays");
        return new BoundDisjunction(name, vars, types, bounds);
    }

    /** A constraint of a handler the encoder knows nothing about. */
    public static Constraint foreign(String name, String handler, Variable... vars) { return new Foreign(name, handler, vars); }

    private static final class Linear extends Constraint {
        private final Variable[] vars;
        private final double[] vals;
        private final double lhs;
        private final double rhs;

        Linear(String name, Variable[] vars, double[] vals, double lhs, double rhs) {
            super(name, vars);
            this.vars = vars.clone();
            this.vals = vals.clone();
            this.lhs = lhs;
            this.rhs = rhs;
        }

        @Override public Kind kind() { return Kind.LINEAR; }

        @Override
        boolean encode(RowCollector rows) {
            rows.collect(vars, vals, lhs, rhs, RowSense.EQUATION);
            return true;
        }
    }

    private static final class Setppc extends Constraint {
        private final SetppcType type;
        private final Variable[] vars;

        Setppc(String name, SetppcType type, Variable[] vars) {
            super(name, vars);
            this.type = type;
            this.vars = vars.clone();
        }

        @Override public Kind kind() { return Kind.SETPPC; }

        @Override
        boolean encode(RowCollector rows) {
            switch (type) {
                case PARTITIONING: rows.collect(vars, ones(vars.length), 1, 1, RowSense.EQUATION); break;
                case PACKING: rows.collect(vars, ones(vars.length), Double.NEGATIVE_INFINITY, 1, RowSense.EQUATION); break;
                case COVERING: rows.collect(vars, ones(vars.length), 1, Double.POSITIVE_INFINITY, RowSense.EQUATION); break;
            }
            return true;
        }
    }

    private static final class Logicor extends Constraint {
        private final Variable[] vars;

        Logicor(String name, Variable[] vars) {
            super(name, vars);
            this.vars = vars.clone();
        }

        @Override public Kind kind() { return Kind.LOGICOR; }

        @Override
        boolean encode(RowCollector rows) {
            rows.collect(vars, ones(vars.length), 1, Double.POSITIVE_INFINITY, RowSense.EQUATION);
            return true;
        }
    }

    private static final class Knapsack extends Constraint {
        private final Variable[] vars;
        private final long[] weights;
        private final long capacity;

        Knapsack(String name, Variable[] vars, long[] weights, long capacity) {
            super(name, vars);
            this.vars = vars.clone();
            this.weights = weights.clone();
            this.capacity = capacity;
        }

        @Override public Kind kind() { return Kind.KNAPSACK; }

        @Override
        boolean encode(RowCollector rows) {
            double[] vals = new double[weights.length];
            for (int i = 0; i < weights.length; ++i) vals[i] = weights[i];
            rows.collect(vars, vals, Double.NEGATIVE_INFINITY, capacity, RowSense.EQUATION);
            return true;
        }
    }

    private static final class Varbound extends Constraint {
        private final Variable x;
        private final Variable y;
        private final double coef;
        private final double lhs;
        private final double rhs;

        Varbound(String name, Variable x, Variable y, double coef, double lhs, double rhs) {
            super(name, x, y);
            this.x = x;
            this.y = y;
            this.coef = coef;
            this.lhs = lhs;
            this.rhs = rhs;
        }

        @Override public Kind kind() { return Kind.VARBOUND; }

        @Override
        boolean encode(RowCollector rows) {
            rows.collect(new Variable[]{x, y}, new double[]{1.0, coef}, lhs, rhs, RowSense.EQUATION);
            return true;
        }
    }

    private static final class Xor extends Constraint {
        private final boolean rhs;
        private final Variable intVar;
        private final Variable[] vars;

        Xor(String name, boolean rhs, Variable intVar, Variable[] vars) {
            super(name, intVar == null ? vars : append(vars, intVar));
            this.rhs = rhs;
            this.intVar = intVar;
            this.vars = vars.clone();
        }

        @Override public Kind kind() { return Kind.XOR; }

        @Override
        boolean encode(RowCollector rows) {
            double side = rhs ? 1.0 : 0.0;
            if (intVar == null) {
                rows.collect(vars, ones(vars.length), side, side, RowSense.XOR);
            } else {
                rows.collect(append(vars, intVar), append(ones(vars.length), 2.0), side, side, RowSense.XOR);
            }
            return true;
        }
    }

    private static final class AndOr extends Constraint {
        private final Kind kind;
        private final Variable resultant;
        private final Variable[] vars;

        AndOr(String name, Kind kind, Variable resultant, Variable[] vars) {
            super(name, append(vars, resultant));
            this.kind = kind;
            this.resultant = resultant;
            this.vars = vars.clone();
        }

        @Override public Kind kind() { return kind; }

        @Override
        boolean encode(RowCollector rows) {
            rows.collect(append(vars, resultant), append(ones(vars.length), 2.0), 0, 0, kind == Kind.AND ? RowSense.AND : RowSense.OR);
            return true;
        }
    }

    private static final class Linking extends Constraint {
        private final Variable intVar;
        private final Variable[] binVars;
        private final int[] vals;

        Linking(String name, Variable intVar, Variable[] binVars, int[] vals) {
            super(name, append(binVars, intVar));
            this.intVar = intVar;
            this.binVars = binVars.clone();
            this.vals = vals.clone();
        }

        @Override public Kind kind() { return Kind.LINKING; }

        @Override
        boolean encode(RowCollector rows) {
            double[] coefs = new double[binVars.length + 1];
            for (int i = 0; i < binVars.length; ++i) coefs[i] = vals[i];
            coefs[binVars.length] = -1.0;
            rows.collect(append(binVars, intVar), coefs, 0, 0, RowSense.EQUATION);
            rows.collect(binVars, ones(binVars.length), 1, 1, RowSense.EQUATION);
            return true;
        }
    }

    private static final class BoundDisjunction extends Constraint {
        private final Variable[] vars;
        private final BoundType[] types;
        private final double[] bounds;

        BoundDisjunction(String name, Variable[] vars, BoundType[] types, double[] bounds) {
            super(name, vars);
            this.vars = vars.clone();
            this.types = types.clone();
            this.bounds = bounds.clone();
        }

        @Override public Kind kind() { return Kind.BOUNDDISJUNCTION; }

        @Override
        boolean encode(RowCollector rows) {
            for (double b : bounds) {
                if (b != Math.rint(b)) return false;
            }
            Set<Variable> seen = new HashSet<>();
            boolean repeated = false;
            for (Variable v : vars) repeated |= !seen.add(v);
            if (!repeated) {
                // x >= b and x <= b must not share a coefficient; bounds are integral so +-1/4 separates them.
                double[] coefs = new double[vars.length];
                for (int i = 0; i < vars.length; ++i) coefs[i] = types[i] == BoundType.LOWER ? bounds[i] + 0.25 : bounds[i] - 0.25;
                rows.collect(vars, coefs, 0, 0, RowSense.BOUNDDISJ_TYPE1);
                return true;
            }
            if (vars.length != 2 || types[0] == types[1]) return false;
            double below = types[0] == BoundType.UPPER ? bounds[0] : bounds[1];
            double above = types[0] == BoundType.LOWER ? bounds[0] : bounds[1];
            if (above <= below) return true;  // the literals cover the whole line
            rows.collect(new Variable[]{vars[0]}, new double[]{above - below}, below, below, RowSense.BOUNDDISJ_TYPE2);
            return true;
        }
    }

    private static final class Foreign extends Constraint {
        private final String handler;

        Foreign(String name, String handler, Variable[] vars) {
            super(name, vars);
            this.handler = handler;
        }

        @Override public Kind kind() { return Kind.FOREIGN; }

        @Override
        boolean encode(RowCollector rows) { return false; }

        @Override
        public String toString() { return handler + " " + name() + " " + variables(); }
    }
}
