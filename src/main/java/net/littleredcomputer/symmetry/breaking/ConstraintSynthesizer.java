package net.littleredcomputer.symmetry.breaking;

import gnu.trove.list.array.TIntArrayList;
import net.littleredcomputer.symmetry.ConstraintStore;
import net.littleredcomputer.symmetry.SymmetryParameters;
import net.littleredcomputer.symmetry.group.Components;
import net.littleredcomputer.symmetry.group.PermutationGroup;
import net.littleredcomputer.symmetry.model.Variable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Turns the components of a symmetry group into symmetry-breaking constraints. Each component is
 * handled by the first method that applies: an orbitope for the whole component, orbitopes for
 * subgroups, orbital fixing (left to the propagator), or one symresack per generator. Components
 * handled by constraints are blocked so that orbital fixing leaves them alone.
 */
public class ConstraintSynthesizer {
    private static final Logger log = LogManager.getFormatterLogger(ConstraintSynthesizer.class);

    private final PermutationGroup group;
    private final ConstraintStore store;
    private final SymmetryParameters params;

    public ConstraintSynthesizer(PermutationGroup group, ConstraintStore store, SymmetryParameters params) {
        this.group = group;
        this.store = store;
        this.params = params;
    }

    /**
     * @param orbitalFixingActive whether components without orbitopes are left to orbital fixing
     *                            instead of receiving symresacks
     */
    public SynthesisReport synthesize(boolean orbitalFixingActive) {
        Components components = group.components();
        SynthesisReport.Coverage[] coverage = new SynthesisReport.Coverage[group.nGenerators()];
        Arrays.fill(coverage, SynthesisReport.Coverage.NONE);
        List<SymmetryConstraint> emitted = new ArrayList<>();

        for (int c = 0; c < components.nComponents(); ++c) {
            if (components.isBlocked(c)) continue;
            int[] gens = components.generators(c);

            if (params.detectOrbitopes()) {
                int[][] m = OrbitopeDetector.detect(group, gens);
                if (m != null) {
                    String name = String.format("orbitope_component%d_n%d_m%d", c, m.length, m[0].length);
                    emit(new SymmetryConstraint.Orbitope(name, variables(m), SymmetryConstraint.Orbitope.Type.FULL, params.conssAddLp()), emitted);
                    components.block(c);
                    cover(coverage, gens, SynthesisReport.Coverage.ORBITOPE);
                    continue;
                }
            }

            if (params.detectSubgroups() && subgroupOrbitopes(c, gens, emitted)) {
                components.block(c);
                cover(coverage, gens, SynthesisReport.Coverage.SUBGROUP);
                continue;
            }

            if (orbitalFixingActive) {
                cover(coverage, gens, SynthesisReport.Coverage.ORBITAL_FIXING);
                continue;
            }

            if (params.addSymresacks()) {
                for (int p : gens) {
                    String name = String.format("symbreakcons_component%d_perm%d", c, p);
                    emit(new SymmetryConstraint.Symresack(name, group.generator(p), group.domain(), params.conssAddLp()), emitted);
                }
                components.block(c);
                cover(coverage, gens, SynthesisReport.Coverage.SYMRESACK);
            }
        }
        SynthesisReport report = new SynthesisReport(coverage, emitted);
        log.debug("Symmetry-breaking constraints: %s", report);
        return report;
    }

    /** @return true if at least one orbitope was emitted for component c */
    private boolean subgroupOrbitopes(int c, int[] gens, List<SymmetryConstraint> emitted) {
        List<int[][]> orbitopes = new SubgroupDetector(group).orbitopes(gens);
        if (orbitopes.isEmpty()) return false;
        for (int k = 0; k < orbitopes.size(); ++k) {
            String name = String.format("subgroup_orbitope_component%d_%d", c, k);
            emit(new SymmetryConstraint.Orbitope(name, variables(orbitopes.get(k)), SymmetryConstraint.Orbitope.Type.FULL, params.conssAddLp()), emitted);
        }
        if (params.addWeakSbcs()) weakOrdering(c, gens, orbitopes.get(0), emitted);
        return true;
    }

    /**
     * Adds leader >= each member of its orbit (in aggregated form) for the top-left variable of an
     * orbitope, if the orbit reaches beyond the orbitope's first row.
     */
    private void weakOrdering(int c, int[] gens, int[][] orbitope, List<SymmetryConstraint> emitted) {
        int leader = orbitope[0][0];
        boolean[] inOrbit = new boolean[group.nVars()];
        TIntArrayList queue = new TIntArrayList();
        inOrbit[leader] = true;
        queue.add(leader);
        for (int head = 0; head < queue.size(); ++head) {
            int v = queue.get(head);
            for (int p : gens) {
                int w = group.generator(p)[v];
                if (!inOrbit[w]) {
                    inOrbit[w] = true;
                    queue.add(w);
                }
            }
        }
        boolean[] firstRow = new boolean[group.nVars()];
        for (int v : orbitope[0]) firstRow[v] = true;
        boolean beyond = false;
        for (int i = 0; i < queue.size(); ++i) if (!firstRow[queue.get(i)]) beyond = true;
        if (!beyond) return;

        queue.sort();
        List<Variable> followers = new ArrayList<>(queue.size() - 1);
        for (int i = 0; i < queue.size(); ++i) {
            int v = queue.get(i);
            if (v != leader) followers.add(group.variable(v));
        }
        String name = String.format("weak_sbcs_component%d", c);
        emit(new SymmetryConstraint.WeakOrdering(name, group.variable(leader), followers, params.conssAddLp()), emitted);
    }

    private void emit(SymmetryConstraint sc, List<SymmetryConstraint> emitted) {
        log.trace("Adding %s", sc);
        store.add(sc);
        emitted.add(sc);
    }

    private Variable[][] variables(int[][] m) {
        Variable[][] vars = new Variable[m.length][];
        for (int r = 0; r < m.length; ++r) {
            vars[r] = new Variable[m[r].length];
            for (int j = 0; j < m[r].length; ++j) vars[r][j] = group.variable(m[r][j]);
        }
        return vars;
    }

    private static void cover(SynthesisReport.Coverage[] coverage, int[] gens, SynthesisReport.Coverage c) {
        for (int p : gens) coverage[p] = c;
    }
}
