package net.littleredcomputer.symmetry;

import com.google.common.collect.ImmutableMap;
import net.littleredcomputer.symmetry.breaking.ConstraintSynthesizer;
import net.littleredcomputer.symmetry.breaking.SynthesisReport;
import net.littleredcomputer.symmetry.group.AutomorphismOracle;
import net.littleredcomputer.symmetry.group.Orbits;
import net.littleredcomputer.symmetry.group.PermutationGroup;
import net.littleredcomputer.symmetry.group.RefinementOracle;
import net.littleredcomputer.symmetry.model.MipProblem;
import net.littleredcomputer.symmetry.model.Variable;
import net.littleredcomputer.symmetry.propagate.OrbitalFixing;
import net.littleredcomputer.symmetry.propagate.PropagationResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.CheckReturnValue;
import java.io.PrintStream;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Symmetry handling for one solve. The host calls the lifecycle methods in order: initPresolve,
 * presolve for each presolving round, exitPresolve, propagate at each node, and close when the
 * solve ends. After a restart the host starts over at initPresolve with the run counter advanced.
 *
 * Symmetry is computed at most once per run. If the model does not allow symmetry handling, the
 * session disables itself and does nothing for the rest of the run.
 */
public class SymmetrySession implements AutoCloseable {
    private static final Logger log = LogManager.getFormatterLogger(SymmetrySession.class);

    private final SearchHost host;
    private final Supplier<MipProblem> model;
    private final ConstraintStore store;
    private final SymmetryParameters params;
    private final SymmetryDetector detector;

    private boolean disabled;
    private boolean closed = false;
    private boolean orbitalFixingEnabled;
    private int run = -1;
    private boolean computed = false;
    private PermutationGroup group = null;
    private OrbitalFixing orbitalFixing = null;
    private SynthesisReport report = null;
    private boolean constraintsAdded = false;
    private long nOrbitopes = 0;
    private long nSymresacks = 0;
    private long nWeakInequalities = 0;
    private long nCalls = 0;
    private long nCutoffs = 0;
    private long nFixedZero = 0;
    private long nFixedOne = 0;

    /**
     * @param model supplies the current model; called whenever symmetry is computed, which may
     *              happen again after a restart
     */
    public SymmetrySession(SearchHost host, Supplier<MipProblem> model, ConstraintStore store,
                           SymmetryParameters params, AutomorphismOracle oracle) {
        this.host = host;
        this.model = model;
        this.store = store;
        this.params = params;
        this.detector = new SymmetryDetector(params, oracle);
        this.disabled = params.usage() == SymmetryParameters.Usage.NONE;
        this.orbitalFixingEnabled = params.usage().orbitalFixing();
    }

    public SymmetrySession(SearchHost host, Supplier<MipProblem> model, ConstraintStore store, SymmetryParameters params) {
        this(host, model, store, params, new RefinementOracle());
    }

    public void initPresolve() {
        checkRun();
        if (params.usage().constraints() && params.addConssTiming() == SymmetryParameters.Timing.BEFORE) addConstraints();
        if (orbitalFixingEnabled && params.ofSymCompTiming() == SymmetryParameters.Timing.BEFORE) setUpOrbitalFixing();
    }

    /** One presolving round. Only orbital fixing in presolving changes bounds here. */
    @CheckReturnValue
    public PropagationResult presolve() {
        checkRun();
        if (params.usage().constraints() && params.addConssTiming() == SymmetryParameters.Timing.DURING) addConstraints();
        if (orbitalFixingEnabled && params.ofSymCompTiming() == SymmetryParameters.Timing.DURING) setUpOrbitalFixing();
        // Orbital fixing in presolving only when symmetry is available by now (BEFORE or DURING).
        if (orbitalFixing == null || !params.performPresolving()
                || params.ofSymCompTiming() == SymmetryParameters.Timing.AFTER || host.isStopped()) {
            return PropagationResult.DID_NOT_RUN;
        }
        return count(orbitalFixing.propagatePresolve());
    }

    public void exitPresolve() {
        checkRun();
        if (params.usage().constraints()) addConstraints();
        if (orbitalFixingEnabled) setUpOrbitalFixing();
    }

    /** Orbital fixing at the current node. */
    @CheckReturnValue
    public PropagationResult propagate() {
        checkRun();
        if (orbitalFixing == null || host.isStopped()) return PropagationResult.DID_NOT_RUN;
        return count(orbitalFixing.propagate());
    }

    private PropagationResult count(PropagationResult r) {
        if (r.status() == PropagationResult.Status.DID_NOT_RUN) return r;
        ++nCalls;
        if (r.infeasible()) ++nCutoffs;
        nFixedZero += r.nFixedZero();
        nFixedOne += r.nFixedOne();
        return r;
    }

    /**
     * Drops the symmetry data of an earlier run. Orbital fixing stays on in the new run only if
     * recomputation is enabled and no constraints were added. A session disabled by the old model
     * tries again on the new one.
     */
    private void checkRun() {
        if (host.nRuns() == run) return;
        boolean restart = run >= 0;
        run = host.nRuns();
        if (!restart || closed) return;
        freeSymmetry();
        if (!orbitalFixingEnabled) return;
        if (!params.recomputeRestart() || constraintsAdded) {
            log.debug("Orbital fixing disabled after restart");
            orbitalFixingEnabled = false;
        } else if (disabled) {
            log.debug("Retrying symmetry detection after restart");
            disabled = false;
        }
    }

    private void freeSymmetry() {
        if (orbitalFixing != null) {
            orbitalFixing.uninstall();
            orbitalFixing = null;
        }
        group = null;
        computed = false;
    }

    /** @return the group, or null if none is available */
    private PermutationGroup computeSymmetry() {
        if (disabled) return null;
        if (!computed) {
            computed = true;
            Optional<PermutationGroup> g = detector.detect(model.get());
            if (!g.isPresent()) {
                log.debug("Symmetry handling disabled for this solve");
                disabled = true;
                return null;
            }
            group = g.get();
            if (params.computeOrbits() || params.displayNOrbitVars()) {
                Orbits orbits = group.orbits();
                log.info("%d orbits, %d variables in nontrivial orbits", orbits.nOrbits(), orbits.nOrbitVars());
            }
        }
        return group;
    }

    private void addConstraints() {
        if (constraintsAdded) return;
        PermutationGroup g = computeSymmetry();
        if (g == null) return;
        constraintsAdded = true;
        if (g.nGenerators() == 0) return;
        report = new ConstraintSynthesizer(g, store, params).synthesize(orbitalFixingEnabled);
        nOrbitopes += report.nOrbitopes();
        nSymresacks += report.nSymresacks();
        nWeakInequalities += report.nWeakInequalities();
        log.info("Added symmetry-handling constraints: %s", report);
    }

    private void setUpOrbitalFixing() {
        if (orbitalFixing != null) return;
        PermutationGroup g = computeSymmetry();
        if (g == null || g.nGenerators() == 0 || !g.binaryAffected()) return;
        orbitalFixing = new OrbitalFixing(host, g);
        orbitalFixing.install();
        log.debug("Orbital fixing handles %d binary variables", orbitalFixing.nHandledVars());
    }

    /** True once symmetry handling turned out impossible for the model. */
    public boolean isDisabled() { return disabled; }

    public boolean isOrbitalFixingActive() { return orbitalFixing != null; }

    public Optional<SymmetryInfo> symmetryInfo() {
        return group == null ? Optional.empty() : Optional.of(new SymmetryInfo(group));
    }

    /** The report of the constraints added in this run, if any were. */
    public Optional<SynthesisReport> synthesisReport() { return Optional.ofNullable(report); }

    /** Variables known to be globally fixed, with their values. */
    public Map<Variable, Integer> globallyFixedVariables() {
        if (orbitalFixing == null) return ImmutableMap.of();
        ImmutableMap.Builder<Variable, Integer> b = ImmutableMap.builder();
        for (Variable v : orbitalFixing.fixedToZero()) b.put(v, 0);
        for (Variable v : orbitalFixing.fixedToOne()) b.put(v, 1);
        return b.build();
    }

    public void printStatistics(PrintStream out) {
        out.printf("symmetry: %s%n", disabled ? "disabled" : group == null ? "not computed" : "computed");
        if (group != null) {
            out.printf("  generators       : %d%n", group.nGenerators());
            out.printf("  log10 group size : %.2f%n", group.log10GroupSize());
            out.printf("  components       : %d (%d blocked)%n", group.components().nComponents(), group.components().nBlocked());
        }
        out.printf("  orbitopes        : %d%n", nOrbitopes);
        out.printf("  symresacks       : %d%n", nSymresacks);
        out.printf("  weak inequalities: %d%n", nWeakInequalities);
        out.printf("  orbital fixing   : %d calls, %d cutoffs, %d fixed to 0, %d fixed to 1%n", nCalls, nCutoffs, nFixedZero, nFixedOne);
        out.printf("  time             : %d ms%n", detector.elapsed(TimeUnit.MILLISECONDS));
    }

    public long nCalls() { return nCalls; }
    public long nFixedZero() { return nFixedZero; }
    public long nFixedOne() { return nFixedOne; }

    @Override
    public void close() {
        freeSymmetry();
        report = null;
        disabled = true;
        closed = true;
    }
}
