package net.littleredcomputer.symmetry;

import net.littleredcomputer.symmetry.model.BoundType;
import net.littleredcomputer.symmetry.model.Variable;

/** A bound change recorded at a search node. */
public final class BoundChange {
    private final Variable variable;
    private final BoundType type;
    private final double newBound;
    private final boolean branching;

    public BoundChange(Variable variable, BoundType type, double newBound, boolean branching) {
        this.variable = variable;
        this.type = type;
        this.newBound = newBound;
        this.branching = branching;
    }

    public Variable variable() { return variable; }
    public BoundType type() { return type; }
    public double newBound() { return newBound; }
    /** True if the change is a branching decision rather than a propagation. */
    public boolean branching() { return branching; }

    @Override
    public String toString() {
        return String.format("%s %s %s%s", variable, type == BoundType.LOWER ? ">=" : "<=", newBound, branching ? " (branching)" : "");
    }
}
