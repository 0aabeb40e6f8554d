package net.littleredcomputer.symmetry.breaking;

import net.littleredcomputer.symmetry.group.PermutationGroup;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Recognizes sets of generators that swap adjacent columns of a 0/1 variable matrix.
 *
 * Every generator must be an involution on binary variables with the same number of 2-cycles, one
 * per row. The 2-cycles of the first generator give two columns. A further generator extends the
 * table if its 2-cycles pair each entry of the current end column with an unused variable; the new
 * column is placed beyond that end. Columns are added to the left first and then to the right. A
 * generator meeting the end column in only some rows, or mapping into used variables, shows the
 * generators do not form an orbitope.
 */
final class OrbitopeDetector {
    private static final Logger log = LogManager.getFormatterLogger(OrbitopeDetector.class);

    private enum Extension { SUCCESS, NO_INTERSECTION, INFEASIBLE }

    private OrbitopeDetector() {}

    static final class CycleStructure {
        final boolean involution;
        final int nTwoCycles;
        final boolean allBinary;

        CycleStructure(boolean involution, int nTwoCycles, boolean allBinary) {
            this.involution = involution;
            this.nTwoCycles = nTwoCycles;
            this.allBinary = allBinary;
        }

        boolean isBinaryInvolution() { return involution && allBinary && nTwoCycles > 0; }
    }

    /** The 2-cycle structure of perm, where variables below nBin are binary. */
    static CycleStructure cycleStructure(int[] perm, int nBin) {
        int n = 0;
        for (int i = 0; i < perm.length; ++i) {
            // fixed points and the second element of a 2-cycle
            if (perm[i] <= i) continue;
            if (perm[perm[i]] != i) return new CycleStructure(false, n, true);
            if (i >= nBin || perm[i] >= nBin) return new CycleStructure(true, n, false);
            ++n;
        }
        return new CycleStructure(true, n, true);
    }

    /**
     * @param gens indices of the generators to arrange
     * @return the variable matrix (domain indices, rows by columns) of the orbitope, or null
     */
    static int[][] detect(PermutationGroup group, int[] gens) {
        if (gens.length == 0) return null;
        int nRows = -1;
        for (int g : gens) {
            CycleStructure s = cycleStructure(group.generator(g), group.nBinVars());
            if (!s.isBinaryInvolution()) return null;
            if (nRows < 0) nRows = s.nTwoCycles;
            else if (s.nTwoCycles != nRows) return null;
        }

        final int nCols = gens.length + 1;
        int[][] table = new int[nRows][nCols];
        int[] columnOrder = new int[nCols];
        int[] nUsed = new int[group.nVars()];
        boolean[] usedGen = new boolean[gens.length];

        int[] first = group.generator(gens[0]);
        int row = 0;
        for (int i = 0; i < first.length; ++i) {
            if (first[i] <= i) continue;
            table[row][0] = i;
            table[row][1] = first[i];
            ++nUsed[i];
            ++nUsed[first[i]];
            ++row;
        }
        usedGen[0] = true;
        columnOrder[0] = 0;
        columnOrder[1] = 1;
        int nFilled = 2;

        for (int direction : new int[]{-1, 1}) {
            int colToExtend = direction < 0 ? 0 : 1;
            for (int j = 1; j < gens.length; ++j) {
                if (usedGen[j]) continue;
                Extension e = extend(table, nRows, nFilled, colToExtend, group.generator(gens[j]), nUsed);
                if (e == Extension.INFEASIBLE) return null;
                if (e == Extension.SUCCESS) {
                    usedGen[j] = true;
                    columnOrder[nFilled] = direction;
                    colToExtend = nFilled++;
                    j = 0;  // earlier generators may fit the new end column
                }
            }
        }
        for (boolean used : usedGen) {
            if (!used) return null;
        }
        return arrange(table, nRows, nCols, columnOrder, nUsed);
    }

    private static Extension extend(int[][] table, int nRows, int nFilled, int col, int[] perm, int[] nUsed) {
        int nIntersections = 0;
        for (int row = 0; row < nRows; ++row) {
            int a = table[row][col];
            int b = perm[a];
            if (b == a) continue;
            if (nUsed[b] > 0) return Extension.INFEASIBLE;
            ++nIntersections;
        }
        if (nIntersections == 0) return Extension.NO_INTERSECTION;
        if (nIntersections < nRows) return Extension.INFEASIBLE;
        for (int row = 0; row < nRows; ++row) {
            int a = table[row][col];
            table[row][nFilled] = perm[a];
            ++nUsed[a];
            ++nUsed[perm[a]];
        }
        return Extension.SUCCESS;
    }

    /**
     * Puts the columns in matrix order: left extensions outermost first, then the two initial
     * columns, then right extensions. The end columns must have been used once and inner columns
     * twice.
     */
    private static int[][] arrange(int[][] table, int nRows, int nCols, int[] columnOrder, int[] nUsed) {
        int[] order = new int[nCols];
        int k = 0;
        for (int c = nCols - 1; c >= 2; --c) if (columnOrder[c] < 0) order[k++] = c;
        order[k++] = 0;
        order[k++] = 1;
        for (int c = 2; c < nCols; ++c) if (columnOrder[c] > 0) order[k++] = c;

        int[][] matrix = new int[nRows][nCols];
        for (int j = 0; j < nCols; ++j) {
            int expected = j == 0 || j == nCols - 1 ? 1 : 2;
            for (int row = 0; row < nRows; ++row) {
                int v = table[row][order[j]];
                if (nUsed[v] != expected) {
                    log.debug("Orbitope column %d uses variable %d %d times", j, v, nUsed[v]);
                    return null;
                }
                matrix[row][j] = v;
            }
        }
        return matrix;
    }
}
