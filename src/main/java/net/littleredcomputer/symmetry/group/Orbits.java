package net.littleredcomputer.symmetry.group;

import java.util.Arrays;
import java.util.function.IntPredicate;

/**
 * The nontrivial orbits of the group generated by a subset of the generators, over the variables
 * accepted by a filter. Orbits are ordered by their smallest member and list their members in
 * increasing order. Variables in no listed orbit form singleton orbits.
 */
public final class Orbits {
    private final int[] orbits;
    private final int[] orbitBegins;

    private Orbits(int[] orbits, int[] orbitBegins) {
        this.orbits = orbits;
        this.orbitBegins = orbitBegins;
    }

    public static Orbits compute(int nVars, int[][] perms) {
        return compute(nVars, perms, null, v -> true);
    }

    /**
     * @param inactive generators to ignore, may be null if all are active
     * @param filter variables taking part; pairs with a rejected end are not merged
     */
    public static Orbits compute(int nVars, int[][] perms, boolean[] inactive, IntPredicate filter) {
        UnionFind uf = new UnionFind(nVars);
        for (int p = 0; p < perms.length; ++p) {
            if (inactive != null && inactive[p]) continue;
            int[] perm = perms[p];
            for (int v = 0; v < nVars; ++v) {
                int img = perm[v];
                if (img != v && filter.test(v) && filter.test(img)) uf.union(v, img);
            }
        }
        int[] size = new int[nVars];
        for (int v = 0; v < nVars; ++v) if (filter.test(v)) ++size[uf.find(v)];
        int[] rootToOrbit = new int[nVars];
        Arrays.fill(rootToOrbit, -1);
        int nOrbits = 0;
        int nOrbitVars = 0;
        for (int v = 0; v < nVars; ++v) {
            if (!filter.test(v)) continue;
            int r = uf.find(v);
            if (size[r] < 2) continue;
            if (rootToOrbit[r] < 0) {
                rootToOrbit[r] = nOrbits++;
                nOrbitVars += size[r];
            }
        }
        int[] begins = new int[nOrbits + 1];
        for (int r = 0; r < nVars; ++r) {
            if (rootToOrbit[r] >= 0) begins[rootToOrbit[r] + 1] = size[r];
        }
        for (int i = 0; i < nOrbits; ++i) begins[i + 1] += begins[i];
        int[] fill = Arrays.copyOf(begins, nOrbits);
        int[] orbits = new int[nOrbitVars];
        for (int v = 0; v < nVars; ++v) {
            if (!filter.test(v)) continue;
            int o = rootToOrbit[uf.find(v)];
            if (o >= 0) orbits[fill[o]++] = v;
        }
        return new Orbits(orbits, begins);
    }

    public int nOrbits() { return orbitBegins.length - 1; }
    public int begin(int i) { return orbitBegins[i]; }
    public int end(int i) { return orbitBegins[i + 1]; }
    public int member(int k) { return orbits[k]; }
    public int[] orbit(int i) { return Arrays.copyOfRange(orbits, begin(i), end(i)); }
    /** Number of variables in nontrivial orbits. */
    public int nOrbitVars() { return orbits.length; }
}
