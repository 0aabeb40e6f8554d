package net.littleredcomputer.symmetry.model;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * The symmetry-invariant image of a model: a sparse matrix whose variables, entries and rows carry
 * colors. A permutation of the variables is a symmetry of the model if it preserves variable colors
 * and maps the set of colored rows onto itself.
 *
 * Rows are stored back to back; the entries of row r are the positions rowBegin(r) until
 * rowBegin(r+1) of the entry arrays.
 */
public final class ColoredMatrix {
    private final int nVars;
    private final int[] varColors;
    private final int[] entryVar;
    private final double[] entryCoef;
    private final int[] entryColors;
    private final int[] rowBegin;
    private final double[] rhs;
    private final RowSense[] senses;
    private final int[] rowColors;
    private final int nUniqueVars;
    private final int nUniqueCoefs;
    private final int nUniqueRows;
    private Set<RowKey> rowKeys = null;

    ColoredMatrix(int nVars, int[] varColors, int[] entryVar, double[] entryCoef, int[] entryColors,
                  int[] rowBegin, double[] rhs, RowSense[] senses, int[] rowColors) {
        this.nVars = nVars;
        this.varColors = varColors;
        this.entryVar = entryVar;
        this.entryCoef = entryCoef;
        this.entryColors = entryColors;
        this.rowBegin = rowBegin;
        this.rhs = rhs;
        this.senses = senses;
        this.rowColors = rowColors;
        this.nUniqueVars = countDistinct(varColors);
        this.nUniqueCoefs = countDistinct(entryColors);
        this.nUniqueRows = countDistinct(rowColors);
    }

    private static int countDistinct(int[] colors) {
        int max = -1;
        for (int c : colors) max = Math.max(max, c);
        return max + 1;
    }

    public int nVars() { return nVars; }
    public int nEntries() { return entryVar.length; }
    public int nRows() { return rhs.length; }
    public int varColor(int v) { return varColors[v]; }
    public int entryVar(int e) { return entryVar[e]; }
    public double entryCoef(int e) { return entryCoef[e]; }
    public int entryColor(int e) { return entryColors[e]; }
    public int rowBegin(int r) { return rowBegin[r]; }
    public int rowEnd(int r) { return rowBegin[r + 1]; }
    public double rhs(int r) { return rhs[r]; }
    public RowSense sense(int r) { return senses[r]; }
    public int rowColor(int r) { return rowColors[r]; }
    /** Number of distinct variable colors. */
    public int nUniqueVars() { return nUniqueVars; }
    /** Number of distinct entry colors. */
    public int nUniqueCoefs() { return nUniqueCoefs; }
    /** Number of distinct right-hand side colors. */
    public int nUniqueRows() { return nUniqueRows; }

    /**
     * Tests whether perm maps this matrix onto itself: every variable keeps its color and every row,
     * with its variables renamed by perm, is identical to some row of the matrix.
     */
    public boolean isAutomorphism(int[] perm) {
        if (perm.length != nVars) throw new IllegalArgumentException("Permutation of length " + perm.length + " applied to " + nVars + " variables");
        for (int v = 0; v < nVars; ++v) {
            if (varColors[perm[v]] != varColors[v]) return false;
        }
        if (rowKeys == null) {
            rowKeys = new HashSet<>();
            for (int r = 0; r < nRows(); ++r) rowKeys.add(rowKey(r, null));
        }
        for (int r = 0; r < nRows(); ++r) {
            if (!rowKeys.contains(rowKey(r, perm))) return false;
        }
        return true;
    }

    private RowKey rowKey(int r, int[] perm) {
        long[] entries = new long[rowEnd(r) - rowBegin(r)];
        for (int e = rowBegin(r); e < rowEnd(r); ++e) {
            int v = perm == null ? entryVar[e] : perm[entryVar[e]];
            entries[e - rowBegin(r)] = ((long) v << 32) | entryColors[e];
        }
        Arrays.sort(entries);
        return new RowKey(rowColors[r], entries);
    }

    private static final class RowKey {
        final int color;
        final long[] entries;

        RowKey(int color, long[] entries) {
            this.color = color;
            this.entries = entries;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof RowKey)) return false;
            RowKey k = (RowKey) o;
            return color == k.color && Arrays.equals(entries, k.entries);
        }

        @Override
        public int hashCode() { return 31 * color + Arrays.hashCode(entries); }
    }
}
