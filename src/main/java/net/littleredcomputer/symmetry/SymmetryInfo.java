package net.littleredcomputer.symmetry;

import net.littleredcomputer.symmetry.group.Components;
import net.littleredcomputer.symmetry.group.PermutationGroup;
import net.littleredcomputer.symmetry.model.Variable;

import java.util.Arrays;
import java.util.List;

/** A snapshot of the symmetry data of a session, for use elsewhere in the solver. */
public final class SymmetryInfo {
    private final List<Variable> domain;
    private final List<int[]> generators;
    private final int[][] transposed;
    private final double log10GroupSize;
    private final boolean binaryAffected;
    private final int[] components;
    private final int[] componentBegins;
    private final int[] varToComponent;
    private final boolean[] blocked;

    SymmetryInfo(PermutationGroup g) {
        Components c = g.components();
        domain = g.domain();
        generators = g.generators();
        int[][] t = g.transposed();
        transposed = new int[t.length][];
        for (int v = 0; v < t.length; ++v) transposed[v] = t[v].clone();
        log10GroupSize = g.log10GroupSize();
        binaryAffected = g.binaryAffected();
        int n = 0;
        componentBegins = new int[c.nComponents() + 1];
        components = new int[g.nGenerators()];
        blocked = new boolean[c.nComponents()];
        for (int k = 0; k < c.nComponents(); ++k) {
            componentBegins[k] = n;
            for (int p : c.generators(k)) components[n++] = p;
            blocked[k] = c.isBlocked(k);
        }
        componentBegins[c.nComponents()] = n;
        varToComponent = new int[g.nVars()];
        for (int v = 0; v < g.nVars(); ++v) varToComponent[v] = c.componentOfVariable(v);
    }

    /** The variables the generators act on, by domain index. */
    public List<Variable> domain() { return domain; }
    public List<int[]> generators() { return generators; }
    public int nGenerators() { return generators.size(); }
    /** Image of domain variable v under generator p; non-binary variables are reported as fixed. */
    public int image(int v, int p) { return transposed[v][p]; }
    public double log10GroupSize() { return log10GroupSize; }
    public boolean binaryAffected() { return binaryAffected; }
    public int nComponents() { return blocked.length; }
    /** The generators of component c. */
    public int[] component(int c) { return Arrays.copyOfRange(components, componentBegins[c], componentBegins[c + 1]); }
    public int componentOfVariable(int v) { return varToComponent[v]; }
    public boolean isBlocked(int c) { return blocked[c]; }
}
