package net.littleredcomputer.symmetry.breaking;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TIntObjectHashMap;
import net.littleredcomputer.symmetry.group.PermutationGroup;
import net.littleredcomputer.symmetry.group.UnionFind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Finds orbitopes among the generators of a component that is not an orbitope as a whole.
 *
 * Involutions are taken greedily, fewest 2-cycles first. The 2-cycles of the accepted generators
 * join variables into blocks, and blocks touched by the same generator share a color. A generator
 * is refused if one of its 2-cycles would close a cycle among the blocks or join two blocks of one
 * color. The generators of each final color then act on disjoint paths of blocks, which is the
 * shape orbitope detection looks for.
 */
final class SubgroupDetector {
    private static final Logger log = LogManager.getFormatterLogger(SubgroupDetector.class);

    private final PermutationGroup group;

    SubgroupDetector(PermutationGroup group) {
        this.group = group;
    }

    /** The accepted generators grouped by color, groups in order of their first accepted generator. */
    List<int[]> subgroups(int[] gens) {
        final int n = group.nVars();
        List<int[]> candidates = new ArrayList<>();
        for (int g : gens) {
            OrbitopeDetector.CycleStructure s = OrbitopeDetector.cycleStructure(group.generator(g), group.nBinVars());
            if (s.isBinaryInvolution()) candidates.add(new int[]{s.nTwoCycles, g});
        }
        candidates.sort(Comparator.<int[]>comparingInt(c -> c[0]).thenComparingInt(c -> c[1]));

        UnionFind blocks = new UnionFind(n);
        UnionFind colors = new UnionFind(n);
        TIntArrayList accepted = new TIntArrayList();
        for (int[] c : candidates) {
            int[] perm = group.generator(c[1]);
            UnionFind tentative = blocks.copy();
            boolean ok = true;
            for (int i = 0; i < n && ok; ++i) {
                int j = perm[i];
                if (j <= i) continue;
                if (colors.same(blocks.find(i), blocks.find(j))) ok = false;
                else if (!tentative.union(i, j)) ok = false;
            }
            if (!ok) {
                log.trace("Generator %d refused by subgroup detection", c[1]);
                continue;
            }
            int first = -1;
            for (int i = 0; i < n; ++i) {
                if (perm[i] <= i) continue;
                if (first < 0) first = blocks.find(i);
                colors.union(first, blocks.find(i));
                colors.union(first, blocks.find(perm[i]));
            }
            blocks = tentative;
            accepted.add(c[1]);
        }

        TIntObjectHashMap<TIntArrayList> byColor = new TIntObjectHashMap<>();
        TIntArrayList colorOrder = new TIntArrayList();
        for (int k = 0; k < accepted.size(); ++k) {
            int g = accepted.get(k);
            int[] perm = group.generator(g);
            int v = 0;
            while (perm[v] == v) ++v;
            int color = colors.find(blocks.find(v));
            TIntArrayList l = byColor.get(color);
            if (l == null) {
                l = new TIntArrayList();
                byColor.put(color, l);
                colorOrder.add(color);
            }
            l.add(g);
        }
        List<int[]> result = new ArrayList<>(colorOrder.size());
        for (int k = 0; k < colorOrder.size(); ++k) result.add(byColor.get(colorOrder.get(k)).toArray());
        return result;
    }

    /**
     * The orbitope variable matrices found among the subgroups of gens. Subgroups of a single
     * generator are passed over.
     */
    List<int[][]> orbitopes(int[] gens) {
        List<int[][]> found = new ArrayList<>();
        for (int[] subgroup : subgroups(gens)) {
            if (subgroup.length < 2) continue;
            int[][] m = OrbitopeDetector.detect(group, subgroup);
            if (m != null) found.add(m);
        }
        return found;
    }
}
