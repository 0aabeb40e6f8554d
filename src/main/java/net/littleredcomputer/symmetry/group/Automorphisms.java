package net.littleredcomputer.symmetry.group;

import com.google.common.collect.ImmutableList;

import java.util.List;

public final class Automorphisms {
    private final ImmutableList<int[]> generators;
    private final double log10GroupSize;
    private final boolean complete;

    public Automorphisms(List<int[]> generators, double log10GroupSize, boolean complete) {
        this.generators = ImmutableList.copyOf(generators);
        this.log10GroupSize = log10GroupSize;
        this.complete = complete;
    }

    public List<int[]> generators() { return generators; }
    public int nGenerators() { return generators.size(); }
    public double log10GroupSize() { return log10GroupSize; }
    /** False if the oracle gave up before the generating set was complete. */
    public boolean complete() { return complete; }
}
