package net.littleredcomputer.symmetry.model;

import gnu.trove.list.array.TDoubleArrayList;
import gnu.trove.list.array.TIntArrayList;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates the rows of the colored matrix. Rows are stored back to back: the entries of row r
 * occupy positions rowBegin[r] until rowBegin[r+1] of the entry arrays.
 */
final class RowCollector {
    static final double INFINITY = 1e20;

    final TIntArrayList entryVar = new TIntArrayList();
    final TDoubleArrayList entryCoef = new TDoubleArrayList();
    final TIntArrayList rowBegin = new TIntArrayList();
    final TDoubleArrayList rhs = new TDoubleArrayList();
    final List<RowSense> senses = new ArrayList<>();

    RowCollector() {
        rowBegin.add(0);
    }

    static boolean isInfinite(double x) { return Math.abs(x) >= INFINITY; }

    /**
     * Adds the rows for lhs <= sum vals[i]*vars[i] <= rhs. Equal sides give one row with the given
     * sense; otherwise each finite side gives an inequality row of the form sum a_i x_i <= b, the
     * left side entering with negated coefficients.
     */
    void collect(Variable[] vars, double[] vals, double lhs, double rhs, RowSense sense) {
        if (vars.length != vals.length) throw new IllegalArgumentException("Got " + vars.length + " variables and " + vals.length + " coefficients");
        if (vars.length == 0) return;
        boolean lhsInfinite = isInfinite(lhs);
        boolean rhsInfinite = isInfinite(rhs);
        if (lhsInfinite && rhsInfinite) return;  // redundant
        if (!lhsInfinite && !rhsInfinite && ModelEncoder.isEqual(lhs, rhs)) {
            addRow(vars, vals, 1, rhs, sense == RowSense.INEQUALITY ? RowSense.EQUATION : sense);
            return;
        }
        if (sense.isSpecial()) throw new IllegalStateException("Internal error: " + sense + " row with distinct sides");
        if (!lhsInfinite) addRow(vars, vals, -1, 0.0 - lhs, RowSense.INEQUALITY);
        if (!rhsInfinite) addRow(vars, vals, 1, rhs, RowSense.INEQUALITY);
    }

    private void addRow(Variable[] vars, double[] vals, double scale, double side, RowSense sense) {
        int before = entryVar.size();
        for (int i = 0; i < vars.length; ++i) {
            if (vals[i] == 0) continue;
            entryVar.add(vars[i].index());
            entryCoef.add(scale * vals[i]);
        }
        if (entryVar.size() == before) return;  // empty row
        rowBegin.add(entryVar.size());
        rhs.add(side);
        senses.add(sense);
    }

    int nRows() { return rhs.size(); }
}
