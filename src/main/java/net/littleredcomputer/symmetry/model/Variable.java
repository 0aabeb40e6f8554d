package net.littleredcomputer.symmetry.model;

/**
 * A problem variable as seen at the time symmetry is computed. Bounds held here are the global
 * bounds of the model; bounds during the search are owned by the host.
 */
public final class Variable {
    private final int index;
    private final String name;
    private final VarType type;
    private final double obj;
    private final double lb;
    private final double ub;

    Variable(int index, String name, VarType type, double obj, double lb, double ub) {
        if (lb > ub) throw new IllegalArgumentException("Lower bound exceeds upper bound for " + name);
        if (type == VarType.BINARY && (lb < 0 || ub > 1)) throw new IllegalArgumentException("Binary variable " + name + " has bounds outside [0,1]");
        this.index = index;
        this.name = name;
        this.type = type;
        this.obj = obj;
        this.lb = lb;
        this.ub = ub;
    }

    public int index() { return index; }
    public String name() { return name; }
    public VarType type() { return type; }
    public double obj() { return obj; }
    public double lb() { return lb; }
    public double ub() { return ub; }
    public boolean isBinary() { return type == VarType.BINARY; }

    @Override
    public String toString() { return name; }
}
