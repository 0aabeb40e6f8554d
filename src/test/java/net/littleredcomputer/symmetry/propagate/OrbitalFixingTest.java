package net.littleredcomputer.symmetry.propagate;

import gnu.trove.list.array.TIntArrayList;
import net.littleredcomputer.symmetry.SolverStage;
import net.littleredcomputer.symmetry.SymmetryTestBase;
import net.littleredcomputer.symmetry.TestSearchHost;
import net.littleredcomputer.symmetry.group.PermutationGroup;
import net.littleredcomputer.symmetry.model.MipProblem;
import net.littleredcomputer.symmetry.model.Variable;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertThat;

public class OrbitalFixingTest extends SymmetryTestBase {
    private MipProblem p;
    private TestSearchHost host;
    private PermutationGroup group;
    private OrbitalFixing of;

    private void setUp(int n, int[]... generators) {
        p = binaries(n);
        host = new TestSearchHost(p);
        group = group(p, generators);
        of = new OrbitalFixing(host, group);
        of.install();
    }

    private Variable x(int i) { return p.variable(i); }

    @Test
    public void noFixingsWithoutFixedVariables() {
        setUp(4, swaps(4, 0, 1), swaps(4, 1, 2));
        host.branch(x(3), 1);
        PropagationResult r = of.propagate();
        assertThat(r.status(), is(PropagationResult.Status.DID_NOT_FIND));
        assertThat(r.nFixings(), is(0));
        assertThat(host.tightenings(), is(empty()));
    }

    @Test
    public void locallyFixedZeroSpreadsOverItsOrbit() {
        setUp(3, swaps(3, 0, 1));
        host.branch(x(2), 0);
        host.fixLocally(x(0), 0);
        PropagationResult r = of.propagate();
        assertThat(r.status(), is(PropagationResult.Status.REDUCED_DOMAINS));
        assertThat(r.nFixedZero(), is(1));
        assertThat(r.nFixedOne(), is(0));
        assertThat(r.infeasible(), is(false));
        assertThat(host.upperBound(x(1)), is(0.0));
    }

    @Test
    public void locallyFixedOneSpreadsOverItsOrbit() {
        setUp(3, swaps(3, 0, 1));
        host.branch(x(2), 1);
        host.fixLocally(x(0), 1);
        PropagationResult r = of.propagate();
        assertThat(r.nFixedOne(), is(1));
        assertThat(host.lowerBound(x(1)), is(1.0));
    }

    @Test
    public void globalZeroFixingSwitchesOffTheGenerator() {
        setUp(3, swaps(3, 0, 1));
        host.fixGlobally(x(0), 0);
        host.branch(x(2), 0);
        PropagationResult r = of.propagate();
        assertThat(r.nFixings(), is(0));
        assertThat(of.isActive(0), is(false));
        assertThat(host.upperBound(x(1)), is(1.0));
        assertThat(names(of.fixedToZero()), contains("x0"));
    }

    @Test
    public void branchingDoesNotOverPropagate() {
        setUp(2, swaps(2, 0, 1));
        host.branch(x(0), 1);
        PropagationResult r = of.propagate();
        assertThat(r.nFixings(), is(0));
        assertThat(of.isActive(0), is(false));
        assertThat(host.lowerBound(x(1)), is(0.0));
        assertThat(host.tightenings(), is(empty()));
        // The branching decision is not kept in the 1-set.
        assertThat(of.fixedToOne(), is(empty()));
    }

    @Test
    public void generatorStabilizingTheFixedSetsStaysActive() {
        setUp(5, swaps(5, 0, 1, 2, 3));
        host.fixGlobally(x(0), 1);
        host.fixGlobally(x(1), 1);
        host.branch(x(4), 1);
        host.fixLocally(x(2), 0);
        PropagationResult r = of.propagate();
        assertThat(of.isActive(0), is(true));
        assertThat(r.nFixedZero(), is(1));
        assertThat(r.nFixedOne(), is(0));
        assertThat(host.upperBound(x(3)), is(0.0));
    }

    @Test
    public void conflictingOrbitIsInfeasible() {
        setUp(3, swaps(3, 0, 1));
        host.branch(x(2), 0);
        host.fixLocally(x(0), 1);
        host.fixLocally(x(1), 0);
        PropagationResult r = of.applyFixingRule(group.orbits());
        assertThat(r.infeasible(), is(true));
        assertThat(r.nFixings(), is(0));
        assertThat(host.tightenings(), is(empty()));
    }

    @Test
    public void conflictEndsPropagation() {
        setUp(5, swaps(5, 0, 1), swaps(5, 2, 3));
        host.branch(x(4), 0);
        host.fixLocally(x(0), 1);
        host.fixLocally(x(1), 0);
        host.fixLocally(x(2), 0);
        PropagationResult r = of.propagate();
        assertThat(r.status(), is(PropagationResult.Status.CUTOFF));
        // The orbit {x2, x3} comes after the conflict and is left alone.
        assertThat(host.upperBound(x(3)), is(1.0));
        assertThat(r.infeasible(), is(true));
    }

    @Test
    public void secondCallAtTheSameNodeDoesNothing() {
        setUp(3, swaps(3, 0, 1));
        host.branch(x(2), 0);
        host.fixLocally(x(0), 0);
        assertThat(of.propagate().nFixings(), is(1));
        PropagationResult again = of.propagate();
        assertThat(again.status(), is(PropagationResult.Status.DID_NOT_RUN));
        assertThat(again.nFixings(), is(0));
    }

    @Test
    public void skipConditions() {
        setUp(3, swaps(3, 0, 1));
        host.fixLocally(x(0), 0);
        assertThat(of.propagate().status(), is(PropagationResult.Status.DID_NOT_RUN));
        host.branch(x(2), 0);
        host.setStage(SolverStage.PRESOLVING);
        assertThat(of.propagate().status(), is(PropagationResult.Status.DID_NOT_RUN));
        host.setStage(SolverStage.SOLVING);
        host.setProbing(true);
        assertThat(of.propagate().status(), is(PropagationResult.Status.DID_NOT_RUN));
        host.setProbing(false);
        host.setRepropagation(true);
        assertThat(of.propagate().status(), is(PropagationResult.Status.DID_NOT_RUN));
        host.setRepropagation(false);
        assertThat(of.propagate().nFixedZero(), is(1));
    }

    @Test
    public void deactivationIsMonotone() {
        setUp(6, swaps(6, 0, 1), swaps(6, 1, 2), swaps(6, 2, 3), swaps(6, 4, 5));
        TIntArrayList trace = new TIntArrayList();
        of.deactivationTrace = g -> {
            assertThat(trace.contains(g), is(false));
            trace.add(g);
        };
        host.fixGlobally(x(1), 0);
        host.branch(x(4), 1);
        PropagationResult r = of.propagate();
        assertThat(trace.toArray(), is(new int[]{0, 1, 3}));
        for (int i = 0; i < trace.size(); ++i) assertThat(of.isActive(trace.get(i)), is(false));
        assertThat(of.isActive(2), is(true));
        assertThat(r.nFixings(), is(0));
    }

    @Test
    public void blockedComponentsAreLeftAlone() {
        p = binaries(3);
        host = new TestSearchHost(p);
        group = group(p, swaps(3, 0, 1));
        group.components().block(0);
        of = new OrbitalFixing(host, group);
        of.install();
        assertThat(of.nHandledVars(), is(0));
        assertThat(host.nListeners(), is(0));
        host.branch(x(2), 0);
        host.fixLocally(x(0), 0);
        assertThat(of.propagate().nFixings(), is(0));
        assertThat(host.upperBound(x(1)), is(1.0));
    }

    @Test
    public void listenersFollowInstallation() {
        setUp(4, swaps(4, 0, 1), swaps(4, 1, 2));
        assertThat(of.nHandledVars(), is(3));
        assertThat(host.nListeners(), is(3));
        of.uninstall();
        assertThat(host.nListeners(), is(0));
    }

    @Test
    public void repeatedNotificationsAreRecordedOnce() {
        setUp(2, swaps(2, 0, 1));
        of.globalUpperBoundChanged(x(0), 1, 0);
        of.globalUpperBoundChanged(x(0), 1, 0);
        of.globalLowerBoundChanged(x(1), 0, 1);
        of.globalLowerBoundChanged(x(1), 0, 1);
        assertThat(names(of.fixedToZero()), contains("x0"));
        assertThat(names(of.fixedToOne()), contains("x1"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownVariableIsRejected() {
        setUp(2, swaps(2, 0, 1));
        of.globalUpperBoundChanged(binaries(2).variable(0), 1, 0);
    }

    @Test
    public void installRecordsExistingFixings() {
        p = binaries(3);
        host = new TestSearchHost(p);
        host.fixGlobally(p.variable(0), 0);
        host.fixGlobally(p.variable(1), 1);
        group = group(p, swaps(3, 0, 1));
        of = new OrbitalFixing(host, group);
        of.install();
        assertThat(names(of.fixedToZero()), contains("x0"));
        assertThat(names(of.fixedToOne()), contains("x1"));
    }

    @Test
    public void presolvingFixingsAreGlobal() {
        setUp(4, swaps(4, 0, 1, 2, 3));
        host.setStage(SolverStage.PRESOLVING);
        host.fixLocally(x(2), 0);
        PropagationResult r = of.propagatePresolve();
        assertThat(r.nFixedZero(), is(1));
        assertThat(host.upperBound(x(3)), is(0.0));
        // The tightening was global, so it came back through the listener.
        assertThat(names(of.fixedToZero()), contains("x3"));
    }
}
