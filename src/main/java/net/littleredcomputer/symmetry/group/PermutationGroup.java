package net.littleredcomputer.symmetry.group;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.symmetry.model.Variable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * A generating set of a symmetry group together with the variables it acts on. Binary variables
 * form a prefix of the domain. The group is read-only once built; only the blocked flags of its
 * components change.
 */
public final class PermutationGroup {
    private static final Logger log = LogManager.getFormatterLogger(PermutationGroup.class);
    /** Smaller domains are never compressed. */
    public static final int MIN_COMPRESSION_DOMAIN = 100;

    private final ImmutableList<Variable> domain;
    private final int nBin;
    private final int[][] perms;
    private final double log10GroupSize;
    private final int[] domainIndex;
    private final int nMovedVars;
    private final boolean binaryAffected;
    private final boolean compressed;
    private Components components = null;
    private int[][] transposed = null;

    private PermutationGroup(List<Variable> domain, int[][] perms, double log10GroupSize, boolean compressed) {
        this.domain = ImmutableList.copyOf(domain);
        this.perms = perms;
        this.log10GroupSize = log10GroupSize;
        this.compressed = compressed;
        int n = 0;
        while (n < domain.size() && domain.get(n).isBinary()) ++n;
        this.nBin = n;
        int maxIndex = -1;
        for (Variable v : domain) maxIndex = Math.max(maxIndex, v.index());
        domainIndex = new int[maxIndex + 1];
        Arrays.fill(domainIndex, -1);
        for (int i = 0; i < domain.size(); ++i) domainIndex[domain.get(i).index()] = i;
        boolean[] moved = movedVariables(perms, domain.size());
        int nMoved = 0;
        boolean affected = false;
        for (int v = 0; v < moved.length; ++v) {
            if (!moved[v]) continue;
            ++nMoved;
            if (v < nBin) affected = true;
        }
        this.nMovedVars = nMoved;
        this.binaryAffected = affected;
    }

    /**
     * @param domain the variables the generators act on, binary variables first
     * @param generators permutations of 0..domain.size()-1, none the identity
     * @param compress whether unmoved variables may be dropped from the domain
     * @param compressThreshold compression happens only if at most this fraction of the domain moves
     */
    public static PermutationGroup build(List<Variable> domain, List<int[]> generators, double log10GroupSize,
                                         boolean compress, double compressThreshold) {
        final int n = domain.size();
        for (int i = 0; i < generators.size(); ++i) {
            int[] perm = generators.get(i);
            if (perm.length != n) throw new IllegalArgumentException(String.format("Generator %d has length %d, domain has %d variables", i, perm.length, n));
            boolean[] hit = new boolean[n];
            boolean identity = true;
            for (int v = 0; v < n; ++v) {
                if (perm[v] < 0 || perm[v] >= n || hit[perm[v]]) throw new IllegalArgumentException(String.format("Generator %d is not a permutation", i));
                hit[perm[v]] = true;
                if (perm[v] != v) identity = false;
            }
            if (identity) throw new IllegalArgumentException(String.format("Generator %d is the identity", i));
        }
        int[][] perms = generators.stream().map(int[]::clone).toArray(int[][]::new);
        boolean[] moved = movedVariables(perms, n);
        int nMoved = 0;
        for (boolean b : moved) if (b) ++nMoved;
        if (compress && perms.length > 0 && n >= MIN_COMPRESSION_DOMAIN && nMoved <= compressThreshold * n) {
            int[] newIndex = new int[n];
            List<Variable> kept = new ArrayList<>(nMoved);
            for (int v = 0; v < n; ++v) {
                if (moved[v]) {
                    newIndex[v] = kept.size();
                    kept.add(domain.get(v));
                } else {
                    newIndex[v] = -1;
                }
            }
            int[][] relabeled = new int[perms.length][nMoved];
            for (int p = 0; p < perms.length; ++p) {
                for (int v = 0; v < n; ++v) {
                    if (moved[v]) relabeled[p][newIndex[v]] = newIndex[perms[p][v]];
                }
            }
            log.debug("Compressed symmetry domain from %d to %d variables", n, nMoved);
            return new PermutationGroup(kept, relabeled, log10GroupSize, true);
        }
        return new PermutationGroup(domain, perms, log10GroupSize, false);
    }

    private static boolean[] movedVariables(int[][] perms, int n) {
        boolean[] moved = new boolean[n];
        for (int[] perm : perms) {
            for (int v = 0; v < n; ++v) if (perm[v] != v) moved[v] = true;
        }
        return moved;
    }

    public List<Variable> domain() { return domain; }
    public Variable variable(int i) { return domain.get(i); }
    public int nVars() { return domain.size(); }
    public int nBinVars() { return nBin; }
    public int nGenerators() { return perms.length; }
    public double log10GroupSize() { return log10GroupSize; }
    /** Number of domain variables moved by some generator. */
    public int nMovedVars() { return nMovedVars; }
    public boolean binaryAffected() { return binaryAffected; }
    public boolean isCompressed() { return compressed; }

    /** The p-th generator; callers must not modify it. */
    public int[] generator(int p) { return perms[p]; }

    public List<int[]> generators() {
        List<int[]> l = new ArrayList<>(perms.length);
        for (int[] perm : perms) l.add(perm.clone());
        return l;
    }

    /** @return the domain index of v, or -1 if v is not in the domain */
    public int domainIndex(Variable v) {
        if (v.index() >= domainIndex.length) return -1;
        int i = domainIndex[v.index()];
        return i >= 0 && domain.get(i) == v ? i : -1;
    }

    public Components components() {
        if (components == null) components = Components.compute(perms, domain.size());
        return components;
    }

    /**
     * The table T[v][p] = image of v under generator p. Rows of non-binary variables are the
     * identity, so that propagation never looks at their images.
     */
    public int[][] transposed() {
        if (transposed == null) {
            transposed = new int[domain.size()][perms.length];
            for (int v = 0; v < domain.size(); ++v) {
                for (int p = 0; p < perms.length; ++p) transposed[v][p] = v < nBin ? perms[p][v] : v;
            }
        }
        return transposed;
    }

    public Orbits orbits() { return Orbits.compute(domain.size(), perms); }

    public Orbits orbits(boolean[] inactive, IntPredicate filter) {
        return Orbits.compute(domain.size(), perms, inactive, filter);
    }
}
