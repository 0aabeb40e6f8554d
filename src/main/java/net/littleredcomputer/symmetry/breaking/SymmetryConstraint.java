package net.littleredcomputer.symmetry.breaking;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.symmetry.model.Variable;

import java.util.Arrays;
import java.util.List;

/**
 * A constraint removing symmetric solutions, as handed to the constraint store. The store owns
 * propagation and separation; this class only describes what to enforce.
 */
public abstract class SymmetryConstraint {
    public enum Kind { ORBITOPE, SYMRESACK, WEAK_ORDERING }

    private final String name;
    private final boolean addToLp;

    private SymmetryConstraint(String name, boolean addToLp) {
        this.name = name;
        this.addToLp = addToLp;
    }

    public String name() { return name; }
    /** Whether the store should add the constraint's inequalities to the LP. */
    public boolean addToLp() { return addToLp; }
    public abstract Kind kind();

    /**
     * Orders the columns of a 0/1 variable matrix lexicographically non-increasingly. Any two
     * adjacent columns are exchanged by one of the generators the orbitope was built from.
     */
    public static final class Orbitope extends SymmetryConstraint {
        // Only full orbitopes are detected; packing and partitioning variants need set constraints on the rows.
        public enum Type { FULL }

        private final Variable[][] vars;
        private final Type type;

        Orbitope(String name, Variable[][] vars, Type type, boolean addToLp) {
            super(name, addToLp);
            this.vars = new Variable[vars.length][];
            for (int i = 0; i < vars.length; ++i) this.vars[i] = vars[i].clone();
            this.type = type;
        }

        @Override public Kind kind() { return Kind.ORBITOPE; }
        public Type type() { return type; }
        public int nRows() { return vars.length; }
        public int nColumns() { return vars.length == 0 ? 0 : vars[0].length; }
        public Variable var(int row, int col) { return vars[row][col]; }
        public List<Variable> row(int i) { return ImmutableList.copyOf(vars[i]); }

        @Override
        public String toString() {
            StringBuilder s = new StringBuilder(name()).append(" orbitope ").append(type);
            for (Variable[] row : vars) s.append("\n  ").append(Arrays.toString(row));
            return s.toString();
        }
    }

    /** vars >=_lex perm(vars) for one generator perm acting on vars by position. */
    public static final class Symresack extends SymmetryConstraint {
        private final int[] perm;
        private final ImmutableList<Variable> vars;

        Symresack(String name, int[] perm, List<Variable> vars, boolean addToLp) {
            super(name, addToLp);
            this.perm = perm.clone();
            this.vars = ImmutableList.copyOf(vars);
        }

        @Override public Kind kind() { return Kind.SYMRESACK; }
        public int[] perm() { return perm.clone(); }
        public List<Variable> vars() { return vars; }

        @Override
        public String toString() {
            StringBuilder s = new StringBuilder(name()).append(" symresack");
            for (int i = 0; i < perm.length; ++i) {
                if (perm[i] > i && perm[perm[i]] == i) s.append(" (").append(vars.get(i)).append(' ').append(vars.get(perm[i])).append(')');
                else if (perm[i] != i) s.append(' ').append(vars.get(i)).append("->").append(vars.get(perm[i]));
            }
            return s.toString();
        }
    }

    /** k * leader - sum followers >= 0, where k is the number of followers. */
    public static final class WeakOrdering extends SymmetryConstraint {
        private final Variable leader;
        private final ImmutableList<Variable> followers;

        WeakOrdering(String name, Variable leader, List<Variable> followers, boolean addToLp) {
            super(name, addToLp);
            if (followers.isEmpty()) throw new IllegalArgumentException("Weak ordering needs at least one follower");
            this.leader = leader;
            this.followers = ImmutableList.copyOf(followers);
        }

        @Override public Kind kind() { return Kind.WEAK_ORDERING; }
        public Variable leader() { return leader; }
        public List<Variable> followers() { return followers; }

        /** Coefficients of the inequality: the leader first, then the followers in order. */
        public double[] coefficients() {
            double[] c = new double[followers.size() + 1];
            c[0] = followers.size();
            Arrays.fill(c, 1, c.length, -1.0);
            return c;
        }

        @Override
        public String toString() { return String.format("%s %d %s >= sum %s", name(), followers.size(), leader, followers); }
    }
}
