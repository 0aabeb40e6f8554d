package net.littleredcomputer.symmetry.model;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Encodes the active constraints of a model as a {@link ColoredMatrix}. Encoding is refused (an
 * empty result, never an exception) whenever a symmetry of the matrix might not be a symmetry of
 * the model.
 */
public class ModelEncoder {
    private static final Logger log = LogManager.getFormatterLogger(ModelEncoder.class);
    static final double EPSILON = 1e-9;

    private final boolean colorByConstraintCount;

    public ModelEncoder(boolean colorByConstraintCount) {
        this.colorByConstraintCount = colorByConstraintCount;
    }

    public ModelEncoder() { this(false); }

    static boolean isEqual(double a, double b) {
        if (a == b) return true;
        return Math.abs(a - b) <= EPSILON * Math.max(1.0, Math.max(Math.abs(a), Math.abs(b)));
    }

    public Optional<ColoredMatrix> encode(MipProblem p) {
        if (p.pricersActive()) {
            log.debug("Pricers are active; no symmetry handling");
            return Optional.empty();
        }
        if (p.reoptimization()) {
            log.debug("Reoptimization is enabled; no symmetry handling");
            return Optional.empty();
        }
        if (p.constraints().isEmpty()) {
            log.debug("No active constraints; no symmetry handling");
            return Optional.empty();
        }
        RowCollector rows = new RowCollector();
        for (Constraint c : p.constraints()) {
            if (!c.encode(rows)) {
                log.debug("No symmetry encoding for constraint %s", c);
                return Optional.empty();
            }
        }
        int[] varColors = variableColors(p);
        int[] entryVar = rows.entryVar.toArray();
        double[] entryCoef = rows.entryCoef.toArray();
        double[] rhs = rows.rhs.toArray();
        RowSense[] senses = rows.senses.toArray(new RowSense[0]);
        ColoredMatrix m = new ColoredMatrix(p.nVariables(), varColors, entryVar, entryCoef, coefficientColors(entryCoef),
                rows.rowBegin.toArray(), rhs, senses, rowColors(rhs, senses));
        log.debug("Encoded %d variables (%d colors), %d rows (%d colors), %d entries (%d colors)",
                m.nVars(), m.nUniqueVars(), m.nRows(), m.nUniqueRows(), m.nEntries(), m.nUniqueCoefs());
        return Optional.of(m);
    }

    private int[] constraintCounts(MipProblem p) {
        int[] counts = new int[p.nVariables()];
        int[] stamp = new int[p.nVariables()];
        Arrays.fill(stamp, -1);
        List<Constraint> cs = p.constraints();
        for (int c = 0; c < cs.size(); ++c) {
            for (Variable v : cs.get(c).variables()) {
                if (stamp[v.index()] == c) continue;
                stamp[v.index()] = c;
                ++counts[v.index()];
            }
        }
        return counts;
    }

    private int[] variableColors(MipProblem p) {
        final List<Variable> vs = p.variables();
        final int[] counts = colorByConstraintCount ? constraintCounts(p) : new int[vs.size()];
        Comparator<Integer> byKey = Comparator.<Integer>comparingDouble(i -> vs.get(i).obj())
                .thenComparingDouble(i -> vs.get(i).lb())
                .thenComparingDouble(i -> vs.get(i).ub())
                .thenComparing(i -> vs.get(i).type())
                .thenComparingInt(i -> counts[i]);
        Integer[] order = IntStream.range(0, vs.size()).boxed().toArray(Integer[]::new);
        Arrays.sort(order, byKey);
        int[] colors = new int[vs.size()];
        int color = -1;
        for (int k = 0; k < order.length; ++k) {
            Variable v = vs.get(order[k]);
            if (k == 0) {
                color = 0;
            } else {
                Variable u = vs.get(order[k - 1]);
                if (!isEqual(u.obj(), v.obj()) || !isEqual(u.lb(), v.lb()) || !isEqual(u.ub(), v.ub())
                        || u.type() != v.type() || counts[u.index()] != counts[v.index()]) ++color;
            }
            colors[order[k]] = color;
        }
        return colors;
    }

    private static int[] coefficientColors(double[] coefs) {
        Integer[] order = IntStream.range(0, coefs.length).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(i -> coefs[i]));
        int[] colors = new int[coefs.length];
        int color = -1;
        for (int k = 0; k < order.length; ++k) {
            if (k == 0 || !isEqual(coefs[order[k - 1]], coefs[order[k]])) ++color;
            colors[order[k]] = color;
        }
        return colors;
    }

    private static int[] rowColors(double[] rhs, RowSense[] senses) {
        Integer[] order = IntStream.range(0, rhs.length).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.<Integer, RowSense>comparing(i -> senses[i]).thenComparingDouble(i -> rhs[i]));
        int[] colors = new int[rhs.length];
        int color = -1;
        for (int k = 0; k < order.length; ++k) {
            if (k == 0 || senses[order[k - 1]] != senses[order[k]] || !isEqual(rhs[order[k - 1]], rhs[order[k]])) ++color;
            colors[order[k]] = color;
        }
        return colors;
    }
}
