package net.littleredcomputer.symmetry.group;

import java.util.Arrays;

/**
 * The decomposition of a generating set into components: two generators belong to the same
 * component if they are linked by a chain of generators moving common variables. Components are
 * numbered in the order of their smallest generator, and each lists its generators in increasing
 * order, so the numbering depends only on the generator list.
 */
public final class Components {
    private final int[] components;
    private final int[] componentBegins;
    private final int[] generatorToComponent;
    private final int[] varToComponent;
    private final boolean[] blocked;

    private Components(int[] components, int[] componentBegins, int[] generatorToComponent, int[] varToComponent) {
        this.components = components;
        this.componentBegins = componentBegins;
        this.generatorToComponent = generatorToComponent;
        this.varToComponent = varToComponent;
        this.blocked = new boolean[componentBegins.length - 1];
    }

    public static Components compute(int[][] perms, int nVars) {
        final int nPerms = perms.length;
        UnionFind uf = new UnionFind(nPerms);
        int[] firstMover = new int[nVars];
        Arrays.fill(firstMover, -1);
        for (int p = 0; p < nPerms; ++p) {
            int[] perm = perms[p];
            for (int v = 0; v < nVars; ++v) {
                if (perm[v] == v) continue;
                if (firstMover[v] < 0) firstMover[v] = p;
                else uf.union(firstMover[v], p);
            }
        }
        int[] rootToComponent = new int[nPerms];
        Arrays.fill(rootToComponent, -1);
        int[] generatorToComponent = new int[nPerms];
        int nComponents = 0;
        for (int p = 0; p < nPerms; ++p) {
            int r = uf.find(p);
            if (rootToComponent[r] < 0) rootToComponent[r] = nComponents++;
            generatorToComponent[p] = rootToComponent[r];
        }
        int[] begins = new int[nComponents + 1];
        for (int p = 0; p < nPerms; ++p) ++begins[generatorToComponent[p] + 1];
        for (int c = 0; c < nComponents; ++c) begins[c + 1] += begins[c];
        int[] fill = Arrays.copyOf(begins, nComponents);
        int[] components = new int[nPerms];
        for (int p = 0; p < nPerms; ++p) components[fill[generatorToComponent[p]]++] = p;
        int[] varToComponent = new int[nVars];
        for (int v = 0; v < nVars; ++v) varToComponent[v] = firstMover[v] < 0 ? -1 : generatorToComponent[firstMover[v]];
        return new Components(components, begins, generatorToComponent, varToComponent);
    }

    public int nComponents() { return componentBegins.length - 1; }
    public int begin(int c) { return componentBegins[c]; }
    public int end(int c) { return componentBegins[c + 1]; }
    public int size(int c) { return end(c) - begin(c); }
    /** The k-th entry of the component-ordered generator list. */
    public int generatorAt(int k) { return components[k]; }
    public int[] generators(int c) { return Arrays.copyOfRange(components, begin(c), end(c)); }
    public int componentOfGenerator(int p) { return generatorToComponent[p]; }
    /** @return the component moving v, or -1 if no generator moves v */
    public int componentOfVariable(int v) { return varToComponent[v]; }
    public boolean isBlocked(int c) { return blocked[c]; }
    public void block(int c) { blocked[c] = true; }

    public int nBlocked() {
        int n = 0;
        for (boolean b : blocked) if (b) ++n;
        return n;
    }

    /** True if v is moved by a generator whose component is not blocked. */
    public boolean isHandledByPropagation(int v) {
        int c = varToComponent[v];
        return c >= 0 && !blocked[c];
    }
}
