package net.littleredcomputer.symmetry;

import com.google.common.base.Stopwatch;
import net.littleredcomputer.symmetry.group.AutomorphismOracle;
import net.littleredcomputer.symmetry.group.Automorphisms;
import net.littleredcomputer.symmetry.group.PermutationGroup;
import net.littleredcomputer.symmetry.model.ColoredMatrix;
import net.littleredcomputer.symmetry.model.MipProblem;
import net.littleredcomputer.symmetry.model.ModelEncoder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Computes the symmetry group of a model: encoding, automorphism computation, optional
 * verification and construction of the group store. An empty result means symmetry handling is
 * not possible for the model; the reason is logged.
 */
public class SymmetryDetector {
    private static final Logger log = LogManager.getFormatterLogger(SymmetryDetector.class);
    /** Bound on generators times variables, keeping the generator table in memory. */
    static final long MAX_GENERATOR_ENTRIES = 64_000_000L;

    private final SymmetryParameters params;
    private final AutomorphismOracle oracle;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    public SymmetryDetector(SymmetryParameters params, AutomorphismOracle oracle) {
        this.params = params;
        this.oracle = oracle;
    }

    /** The generator cap for a domain of n variables. */
    int generatorCap(int n) {
        int memoryCap = (int) Math.min(Integer.MAX_VALUE, MAX_GENERATOR_ENTRIES / Math.max(1, n));
        return params.maxGenerators() == 0 ? memoryCap : Math.min(params.maxGenerators(), memoryCap);
    }

    public Optional<PermutationGroup> detect(MipProblem p) {
        if (p.nBinVars() == 0) {
            log.debug("No binary variables; no symmetry handling");
            return Optional.empty();
        }
        stopwatch.start();
        try {
            Optional<ColoredMatrix> encoded = new ModelEncoder(params.colorByConsNum()).encode(p);
            if (!encoded.isPresent()) return Optional.empty();
            ColoredMatrix m = encoded.get();
            List<int[]> generators;
            double log10GroupSize;
            if (m.nUniqueVars() == m.nVars() || m.nUniqueCoefs() == m.nEntries()) {
                log.debug("All variables or all coefficients are distinct; the group is trivial");
                generators = Collections.emptyList();
                log10GroupSize = 0.0;
            } else {
                Automorphisms a = oracle.compute(m, generatorCap(m.nVars()));
                if (!a.complete()) {
                    log.info("Automorphism computation stopped early after %d generators; no symmetry handling", a.nGenerators());
                    return Optional.empty();
                }
                generators = a.generators();
                log10GroupSize = a.log10GroupSize();
                if (params.checkSymmetries()) verify(m, generators);
            }
            PermutationGroup g = PermutationGroup.build(p.variables(), generators, log10GroupSize,
                    params.compressSymmetries(), params.compressThreshold());
            log.info(() -> new FormattedMessage("Symmetry: %d generators, log10 group size %.2f, %d components, %d of %d variables moved (%s)",
                    g.nGenerators(), g.log10GroupSize(), g.components().nComponents(), g.nMovedVars(), p.nVariables(), stopwatch));
            return Optional.of(g);
        } finally {
            stopwatch.stop();
        }
    }

    private static void verify(ColoredMatrix m, List<int[]> generators) {
        for (int i = 0; i < generators.size(); ++i) {
            if (!m.isAutomorphism(generators.get(i))) {
                throw new IllegalStateException(String.format("Internal error: generator %d is not a symmetry", i));
            }
        }
        log.debug("Verified %d generators", generators.size());
    }

    /** Total time spent computing symmetry. */
    public long elapsed(TimeUnit unit) { return stopwatch.elapsed(unit); }
}
