package net.littleredcomputer.symmetry;

/** The outcome of a bound tightening request. */
public final class Tightening {
    public static final Tightening APPLIED = new Tightening(true, false);
    public static final Tightening UNCHANGED = new Tightening(false, false);
    public static final Tightening INFEASIBLE = new Tightening(false, true);

    private final boolean applied;
    private final boolean infeasible;

    private Tightening(boolean applied, boolean infeasible) {
        this.applied = applied;
        this.infeasible = infeasible;
    }

    public boolean applied() { return applied; }
    public boolean infeasible() { return infeasible; }

    @Override
    public String toString() { return infeasible ? "infeasible" : applied ? "applied" : "unchanged"; }
}
