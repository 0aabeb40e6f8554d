package net.littleredcomputer.symmetry.propagate;

import gnu.trove.list.array.TIntArrayList;
import net.littleredcomputer.symmetry.BoundChange;
import net.littleredcomputer.symmetry.BoundChangeListener;
import net.littleredcomputer.symmetry.SearchHost;
import net.littleredcomputer.symmetry.SearchNode;
import net.littleredcomputer.symmetry.SolverStage;
import net.littleredcomputer.symmetry.Tightening;
import net.littleredcomputer.symmetry.group.Components;
import net.littleredcomputer.symmetry.group.Orbits;
import net.littleredcomputer.symmetry.group.PermutationGroup;
import net.littleredcomputer.symmetry.model.Variable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.CheckReturnValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * Orbital fixing on binary variables.
 *
 * At a node, the generators that do not stabilize the set of variables fixed to 0 (bg0) or the set
 * of variables fixed or branched to 1 (bg1) are switched off. In every orbit of the remaining
 * generators, a member fixed to 0 fixes all members to 0 and a member fixed to 1 fixes all members
 * to 1. Components blocked by symmetry-breaking constraints are left alone.
 *
 * Correctness requires that global fixings made elsewhere are strict, i.e. applied to whole orbits.
 * bg0 and the global part of bg1 are fed by the host's bound change notifications.
 */
public class OrbitalFixing implements BoundChangeListener {
    private static final Logger log = LogManager.getFormatterLogger(OrbitalFixing.class);

    private final SearchHost host;
    private final PermutationGroup group;
    private final Components components;
    private final int[][] transposed;
    private final FixingSets fixings;
    private final boolean[] inactive;
    private final TIntArrayList tokens = new TIntArrayList();
    private long lastNode = -1;
    // Called with each generator as it is switched off.
    IntConsumer deactivationTrace = p -> {};

    public OrbitalFixing(SearchHost host, PermutationGroup group) {
        this.host = host;
        this.group = group;
        this.components = group.components();
        this.transposed = group.transposed();
        this.fixings = new FixingSets(group.nVars());
        this.inactive = new boolean[group.nGenerators()];
    }

    /** Number of binary variables this propagator can fix. */
    public int nHandledVars() {
        int n = 0;
        for (int v = 0; v < group.nBinVars(); ++v) if (components.isHandledByPropagation(v)) ++n;
        return n;
    }

    /**
     * Registers for global bound changes of the handled variables and records the fixings already
     * in place.
     */
    public void install() {
        if (!tokens.isEmpty()) throw new IllegalStateException("Orbital fixing is already installed");
        for (int v = 0; v < group.nBinVars(); ++v) {
            if (!components.isHandledByPropagation(v)) continue;
            Variable var = group.variable(v);
            if (host.upperBound(var) < 0.5) fixings.addZero(v);
            else if (host.lowerBound(var) > 0.5) fixings.addOne(v);
            tokens.add(host.addBoundChangeListener(var, this));
        }
        log.debug("Orbital fixing watches %d variables (%d fixed to 0, %d fixed to 1)", tokens.size(), fixings.nZero(), fixings.nOne());
    }

    public void uninstall() {
        for (int i = 0; i < tokens.size(); ++i) host.removeBoundChangeListener(tokens.get(i));
        tokens.clear();
    }

    /** Propagates at the current search node. */
    @CheckReturnValue
    public PropagationResult propagate() {
        SearchNode node = host.currentNode();
        if (node == null || node.depth() <= 0 || host.stage() != SolverStage.SOLVING) return PropagationResult.DID_NOT_RUN;
        if (host.inProbing() || host.inRepropagation()) return PropagationResult.DID_NOT_RUN;
        if (group.nGenerators() == 0) return PropagationResult.DID_NOT_RUN;
        if (node.number() == lastNode) return PropagationResult.DID_NOT_RUN;
        lastNode = node.number();
        return run(node);
    }

    /** Propagates during presolving, where all fixings are global. */
    @CheckReturnValue
    public PropagationResult propagatePresolve() {
        if (group.nGenerators() == 0) return PropagationResult.DID_NOT_RUN;
        return run(host.currentNode());
    }

    private PropagationResult run(SearchNode node) {
        int checkpoint = fixings.checkpoint();
        boolean anyActive;
        try {
            collectBranchingOnes(node);
            anyActive = filterGenerators();
        } finally {
            // Later global fixings must land after the global part of bg1.
            fixings.rollback(checkpoint);
        }
        if (!anyActive) {
            log.trace("No active generators at node %d", node == null ? -1 : node.number());
            return PropagationResult.DID_NOT_FIND;
        }
        Orbits orbits = group.orbits(inactive, v -> v < group.nBinVars() && components.isHandledByPropagation(v));
        if (orbits.nOrbits() == 0) return PropagationResult.DID_NOT_FIND;
        PropagationResult r = applyFixingRule(orbits);
        log.trace("Node %d: %d orbits, %s", node == null ? -1 : node.number(), orbits.nOrbits(), r);
        return r;
    }

    /**
     * Adds the binary variables branched to 1 on the path to the root to bg1. Branching decisions
     * come first in each node's bound changes. Variables created after the symmetry computation
     * are skipped.
     */
    private void collectBranchingOnes(SearchNode node) {
        if (node == null) return;
        for (SearchNode n : host.pathToRoot(node)) {
            for (BoundChange c : n.boundChanges()) {
                if (!c.branching()) break;
                Variable var = c.variable();
                if (!var.isBinary()) continue;
                int v = group.domainIndex(var);
                if (v < 0) continue;
                if (host.lowerBound(var) > 0.5) fixings.addOne(v);
            }
        }
    }

    /**
     * Recomputes the inactive flags from bg0 and bg1.
     * @return true if some generator remains active
     */
    boolean filterGenerators() {
        Arrays.fill(inactive, false);
        int nActive = inactive.length;
        for (int i = 0; i < fixings.nZero() && nActive > 0; ++i) nActive = deactivate(fixings.zero(i), true, nActive);
        for (int i = 0; i < fixings.nOne() && nActive > 0; ++i) nActive = deactivate(fixings.one(i), false, nActive);
        return nActive > 0;
    }

    private int deactivate(int v, boolean zeroSet, int nActive) {
        int c = components.componentOfVariable(v);
        if (c < 0 || components.isBlocked(c)) return nActive;
        for (int k = components.begin(c); k < components.end(c); ++k) {
            int p = components.generatorAt(k);
            if (inactive[p]) continue;
            int img = transposed[v][p];
            if (img == v) continue;
            if (zeroSet ? fixings.isZero(img) : fixings.isOne(img)) continue;
            inactive[p] = true;
            deactivationTrace.accept(p);
            --nActive;
        }
        return nActive;
    }

    /**
     * Fixes each orbit by its fixed members. An orbit with members fixed to both values ends the
     * call with a cutoff before any further tightening.
     */
    PropagationResult applyFixingRule(Orbits orbits) {
        int nZero = 0;
        int nOne = 0;
        ORBITS:
        for (int i = 0; i < orbits.nOrbits(); ++i) {
            boolean haveZero = false;
            boolean haveOne = false;
            for (int k = orbits.begin(i); k < orbits.end(i); ++k) {
                Variable var = group.variable(orbits.member(k));
                if (!var.isBinary()) continue ORBITS;
                if (host.lowerBound(var) > 0.5) haveOne = true;
                if (host.upperBound(var) < 0.5) haveZero = true;
            }
            if (haveOne && haveZero) {
                log.debug("Orbit %d has members fixed to 0 and to 1", i);
                return PropagationResult.cutoff(nZero, nOne);
            }
            if (haveZero) {
                for (int k = orbits.begin(i); k < orbits.end(i); ++k) {
                    Variable var = group.variable(orbits.member(k));
                    if (host.upperBound(var) < 0.5) continue;
                    Tightening t = host.tightenUpperBound(var, 0.0);
                    if (t.infeasible()) return PropagationResult.cutoff(nZero, nOne);
                    if (t.applied()) ++nZero;
                }
            }
            if (haveOne) {
                for (int k = orbits.begin(i); k < orbits.end(i); ++k) {
                    Variable var = group.variable(orbits.member(k));
                    if (host.lowerBound(var) > 0.5) continue;
                    Tightening t = host.tightenLowerBound(var, 1.0);
                    if (t.infeasible()) return PropagationResult.cutoff(nZero, nOne);
                    if (t.applied()) ++nOne;
                }
            }
        }
        return PropagationResult.fixed(nZero, nOne);
    }

    boolean isActive(int p) { return !inactive[p]; }

    private int index(Variable v) {
        int i = group.domainIndex(v);
        if (i < 0) throw new IllegalArgumentException("Variable " + v + " is not acted on by the symmetry group");
        return i;
    }

    @Override
    public void globalLowerBoundChanged(Variable v, double oldBound, double newBound) {
        int i = index(v);
        if (newBound > 0.5 && fixings.addOne(i)) log.trace("%s globally fixed to 1", v);
    }

    @Override
    public void globalUpperBoundChanged(Variable v, double oldBound, double newBound) {
        int i = index(v);
        if (newBound < 0.5 && fixings.addZero(i)) log.trace("%s globally fixed to 0", v);
    }

    public List<Variable> fixedToZero() { return variables(fixings.zeros()); }
    public List<Variable> fixedToOne() { return variables(fixings.ones()); }

    private List<Variable> variables(int[] indices) {
        List<Variable> l = new ArrayList<>(indices.length);
        for (int v : indices) l.add(group.variable(v));
        return l;
    }
}
