package net.littleredcomputer.symmetry;

import net.littleredcomputer.symmetry.breaking.SymmetryConstraint;
import net.littleredcomputer.symmetry.breaking.SynthesisReport;
import net.littleredcomputer.symmetry.model.Constraint;
import net.littleredcomputer.symmetry.model.MipProblem;
import net.littleredcomputer.symmetry.model.VarType;
import net.littleredcomputer.symmetry.model.Variable;
import net.littleredcomputer.symmetry.propagate.PropagationResult;
import org.junit.Before;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresent;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertThat;

public class SymmetrySessionTest {
    private final List<SymmetryConstraint> added = new ArrayList<>();
    private MipProblem p;
    private TestSearchHost host;
    private int nModelCalls;

    @Before
    public void setUp() {
        added.clear();
        p = MipProblem.sum(3);
        host = new TestSearchHost(p);
        nModelCalls = 0;
    }

    private Variable x(int i) { return p.variable(i); }

    private SymmetrySession session(SymmetryParameters params) {
        return session(() -> p, params);
    }

    private SymmetrySession session(Supplier<MipProblem> model, SymmetryParameters params) {
        Supplier<MipProblem> counting = () -> {
            ++nModelCalls;
            return model.get();
        };
        return new SymmetrySession(host, counting, added::add, params);
    }

    private static SymmetryParameters.Builder params() { return SymmetryParameters.builder(); }

    /** Runs presolving as the host would. */
    private static void presolve(SymmetrySession s) {
        s.initPresolve();
        PropagationResult r = s.presolve();
        assertThat(r.infeasible(), is(false));
        s.exitPresolve();
    }

    @Test
    public void orbitalFixingAfterPresolving() {
        SymmetrySession s = session(SymmetryParameters.defaults());
        s.initPresolve();
        assertThat(s.presolve().status(), is(PropagationResult.Status.DID_NOT_RUN));
        assertThat(s.isOrbitalFixingActive(), is(false));
        s.exitPresolve();
        assertThat(s.isOrbitalFixingActive(), is(true));
        assertThat(host.nListeners(), is(3));
        assertThat(added, is(empty()));
        assertThat(s.synthesisReport(), isEmpty());

        SymmetryInfo info = s.symmetryInfo().get();
        assertThat(info.log10GroupSize(), closeTo(Math.log10(6), 1e-9));
        assertThat(info.nComponents(), is(1));
        assertThat(info.isBlocked(0), is(false));
        assertThat(info.componentOfVariable(0), is(0));
    }

    @Test
    public void branchingToZeroFixesTheOrbit() {
        SymmetrySession s = session(SymmetryParameters.defaults());
        presolve(s);
        host.branch(x(0), 0);
        PropagationResult r = s.propagate();
        assertThat(r.status(), is(PropagationResult.Status.REDUCED_DOMAINS));
        assertThat(r.nFixedZero(), is(2));
        assertThat(host.upperBound(x(1)), is(0.0));
        assertThat(host.upperBound(x(2)), is(0.0));
        assertThat(s.nCalls(), is(1L));
        assertThat(s.nFixedZero(), is(2L));
        // once per node
        assertThat(s.propagate().status(), is(PropagationResult.Status.DID_NOT_RUN));
        assertThat(s.nCalls(), is(1L));
    }

    @Test
    public void branchingToOneFixesNothing() {
        SymmetrySession s = session(SymmetryParameters.defaults());
        presolve(s);
        host.branch(x(0), 1);
        PropagationResult r = s.propagate();
        assertThat(r.nFixings(), is(0));
        assertThat(s.nFixedOne(), is(0L));
    }

    @Test
    public void noPropagationAtTheRootOrWhenStopped() {
        SymmetrySession s = session(SymmetryParameters.defaults());
        presolve(s);
        assertThat(s.propagate().status(), is(PropagationResult.Status.DID_NOT_RUN));
        host.branch(x(0), 0);
        host.setStopped(true);
        assertThat(s.propagate().status(), is(PropagationResult.Status.DID_NOT_RUN));
        assertThat(s.nCalls(), is(0L));
    }

    @Test
    public void constraintsCoverEveryGenerator() {
        SymmetrySession s = session(params().usage(SymmetryParameters.Usage.CONSTRAINTS).build());
        presolve(s);
        assertThat(added, is(not(empty())));
        assertThat(s.isOrbitalFixingActive(), is(false));
        SynthesisReport r = s.synthesisReport().get();
        assertThat(r.constraints(), is(added));
        assertThat(r.count(SynthesisReport.Coverage.NONE), is(0L));
        assertThat(r.count(SynthesisReport.Coverage.ORBITAL_FIXING), is(0L));
        assertThat(s.symmetryInfo().get().isBlocked(0), is(true));
    }

    @Test
    public void constraintsAndOrbitalFixing() {
        SymmetrySession s = session(params().usage(SymmetryParameters.Usage.BOTH).build());
        presolve(s);
        SynthesisReport r = s.synthesisReport().get();
        assertThat(r.count(SynthesisReport.Coverage.NONE), is(0L));
        assertThat(r.count(SynthesisReport.Coverage.SYMRESACK), is(0L));
        assertThat(s.isOrbitalFixingActive(), is(true));
    }

    @Test
    public void constraintsBeforePresolving() {
        SymmetrySession s = session(params().usage(SymmetryParameters.Usage.CONSTRAINTS)
                .addConssTiming(SymmetryParameters.Timing.BEFORE).build());
        s.initPresolve();
        assertThat(added, is(not(empty())));
        int n = added.size();
        assertThat(s.presolve().status(), is(PropagationResult.Status.DID_NOT_RUN));
        s.exitPresolve();
        assertThat(added.size(), is(n));
        assertThat(nModelCalls, is(1));
    }

    @Test
    public void constraintsDuringPresolving() {
        SymmetrySession s = session(params().usage(SymmetryParameters.Usage.CONSTRAINTS)
                .addConssTiming(SymmetryParameters.Timing.DURING).build());
        s.initPresolve();
        assertThat(added, is(empty()));
        assertThat(s.presolve().status(), is(PropagationResult.Status.DID_NOT_RUN));
        assertThat(added, is(not(empty())));
    }

    @Test
    public void orbitalFixingBeforePresolving() {
        SymmetrySession s = session(params().ofSymCompTiming(SymmetryParameters.Timing.BEFORE).build());
        s.initPresolve();
        assertThat(s.isOrbitalFixingActive(), is(true));
    }

    @Test
    public void orbitalFixingInPresolving() {
        SymmetrySession s = session(params().performPresolving(true)
                .ofSymCompTiming(SymmetryParameters.Timing.DURING).build());
        host.setStage(SolverStage.PRESOLVING);
        host.fixGlobally(x(0), 0);
        s.initPresolve();
        PropagationResult r = s.presolve();
        assertThat(s.isOrbitalFixingActive(), is(true));
        assertThat(r.status(), is(PropagationResult.Status.DID_NOT_FIND));
        assertThat(s.nCalls(), is(1L));
        assertThat(s.globallyFixedVariables().get(x(0)), is(0));
    }

    @Test
    public void orbitalFixingInPresolvingWithBeforeTiming() {
        SymmetrySession s = session(params().performPresolving(true)
                .ofSymCompTiming(SymmetryParameters.Timing.BEFORE).build());
        host.setStage(SolverStage.PRESOLVING);
        s.initPresolve();
        assertThat(nModelCalls, is(1));
        assertThat(s.presolve().status(), is(PropagationResult.Status.DID_NOT_FIND));
        assertThat(s.nCalls(), is(1L));
        assertThat(nModelCalls, is(1));
    }

    @Test
    public void presolvingDoesNotComputeSymmetryForAfterTiming() {
        SymmetrySession s = session(params().performPresolving(true)
                .ofSymCompTiming(SymmetryParameters.Timing.AFTER).build());
        host.setStage(SolverStage.PRESOLVING);
        s.initPresolve();
        assertThat(s.presolve(), is(PropagationResult.DID_NOT_RUN));
        assertThat(s.isOrbitalFixingActive(), is(false));
        assertThat(s.symmetryInfo(), isEmpty());
        assertThat(s.nCalls(), is(0L));
        assertThat(nModelCalls, is(0));
    }

    @Test
    public void globallyFixedVariables() {
        SymmetrySession s = session(SymmetryParameters.defaults());
        presolve(s);
        assertThat(s.globallyFixedVariables().isEmpty(), is(true));
        host.fixGlobally(x(1), 1);
        assertThat(s.globallyFixedVariables().size(), is(1));
        assertThat(s.globallyFixedVariables().get(x(1)), is(1));
    }

    @Test
    public void modelsWithoutSymmetryHandlingDisableTheSession() {
        MipProblem.Builder b = MipProblem.builder();
        Variable y0 = b.addBinary("y0", 0);
        Variable y1 = b.addBinary("y1", 0);
        b.addConstraint(Constraint.foreign("special", "somehandler", y0, y1));
        p = b.build();
        host = new TestSearchHost(p);
        SymmetrySession s = session(SymmetryParameters.defaults());
        presolve(s);
        assertThat(s.isDisabled(), is(true));
        assertThat(s.isOrbitalFixingActive(), is(false));
        assertThat(s.symmetryInfo(), isEmpty());
        host.branch(y0, 0);
        assertThat(s.propagate().status(), is(PropagationResult.Status.DID_NOT_RUN));
    }

    @Test
    public void noBinariesDisablesTheSession() {
        MipProblem.Builder b = MipProblem.builder();
        Variable i = b.addVariable("i", VarType.INTEGER, 0, 0, 4);
        Variable j = b.addVariable("j", VarType.INTEGER, 0, 0, 4);
        b.addConstraint(Constraint.linear("c", new Variable[]{i, j}, new double[]{1, 1}, Double.NEGATIVE_INFINITY, 4));
        p = b.build();
        host = new TestSearchHost(p);
        SymmetrySession s = session(SymmetryParameters.defaults());
        presolve(s);
        assertThat(s.isDisabled(), is(true));
    }

    @Test
    public void usageNoneDoesNothing() {
        SymmetrySession s = session(params().usage(SymmetryParameters.Usage.NONE).build());
        assertThat(s.isDisabled(), is(true));
        presolve(s);
        assertThat(nModelCalls, is(0));
        assertThat(added, is(empty()));
        assertThat(s.symmetryInfo(), isEmpty());
    }

    @Test
    public void restartRecomputesSymmetry() {
        SymmetrySession s = session(SymmetryParameters.defaults());
        presolve(s);
        assertThat(nModelCalls, is(1));
        host.restart();
        s.initPresolve();
        assertThat(s.isOrbitalFixingActive(), is(false));
        assertThat(host.nListeners(), is(0));
        assertThat(s.symmetryInfo(), isEmpty());
        s.exitPresolve();
        assertThat(s.isOrbitalFixingActive(), is(true));
        assertThat(nModelCalls, is(2));
    }

    @Test
    public void restartWithoutRecomputation() {
        SymmetrySession s = session(params().recomputeRestart(false).build());
        presolve(s);
        host.restart();
        presolve(s);
        assertThat(s.isOrbitalFixingActive(), is(false));
        assertThat(host.nListeners(), is(0));
    }

    @Test
    public void restartAfterConstraints() {
        SymmetrySession s = session(params().usage(SymmetryParameters.Usage.BOTH).build());
        presolve(s);
        int n = added.size();
        host.restart();
        presolve(s);
        assertThat(s.isOrbitalFixingActive(), is(false));
        assertThat(added.size(), is(n));
    }

    @Test
    public void disabledSessionRetriesAfterRestart() {
        MipProblem.Builder b = MipProblem.builder();
        Variable y0 = b.addBinary("y0", 0);
        Variable y1 = b.addBinary("y1", 0);
        b.addConstraint(Constraint.foreign("special", "somehandler", y0, y1));
        MipProblem unsupported = b.build();
        List<MipProblem> models = new ArrayList<>();
        models.add(unsupported);
        models.add(p);
        SymmetrySession s = session(() -> models.get(Math.min(nModelCalls - 1, 1)), SymmetryParameters.defaults());
        presolve(s);
        assertThat(s.isDisabled(), is(true));
        host.restart();
        presolve(s);
        assertThat(s.isDisabled(), is(false));
        assertThat(s.isOrbitalFixingActive(), is(true));
    }

    @Test
    public void closeReleasesEverything() {
        SymmetrySession s = session(SymmetryParameters.defaults());
        presolve(s);
        s.close();
        assertThat(host.nListeners(), is(0));
        assertThat(s.isDisabled(), is(true));
        assertThat(s.symmetryInfo(), isEmpty());
        host.branch(x(0), 0);
        assertThat(s.propagate().status(), is(PropagationResult.Status.DID_NOT_RUN));
    }

    @Test
    public void statistics() {
        SymmetrySession s = session(SymmetryParameters.defaults());
        presolve(s);
        host.branch(x(0), 0);
        assertThat(s.propagate().nFixedZero(), is(2));
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        s.printStatistics(new PrintStream(bytes, true));
        String out = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
        assertThat(out, containsString("symmetry: computed"));
        assertThat(out, containsString("1 calls, 0 cutoffs, 2 fixed to 0, 0 fixed to 1"));
    }

    @Test
    public void symmetryInfoIsASnapshot() {
        SymmetrySession s = session(SymmetryParameters.defaults());
        presolve(s);
        SymmetryInfo info = s.symmetryInfo().get();
        assertThat(s.symmetryInfo(), isPresent());
        for (int q = 0; q < info.nGenerators(); ++q) {
            int[] gamma = info.generators().get(q);
            for (int v = 0; v < 3; ++v) assertThat(info.image(v, q), is(gamma[v]));
        }
        host.restart();
        s.initPresolve();
        assertThat(info.nGenerators() > 0, is(true));
        assertThat(info.domain().size(), is(3));
    }
}
