package net.littleredcomputer.symmetry.breaking;

import net.littleredcomputer.symmetry.SymmetryTestBase;
import net.littleredcomputer.symmetry.group.PermutationGroup;
import net.littleredcomputer.symmetry.model.MipProblem;
import net.littleredcomputer.symmetry.model.VarType;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertThat;

public class OrbitopeDetectorTest extends SymmetryTestBase {
    // Variables r*3+c of a 2x3 matrix.
    private static final int[] swap01 = swaps(6, 0, 1, 3, 4);
    private static final int[] swap12 = swaps(6, 1, 2, 4, 5);
    private static final int[] swap02 = swaps(6, 0, 2, 3, 5);

    private static int[][] detect(int n, int[]... gens) {
        PermutationGroup g = group(binaries(n), gens);
        int[] all = new int[gens.length];
        for (int i = 0; i < all.length; ++i) all[i] = i;
        return OrbitopeDetector.detect(g, all);
    }

    @Test
    public void adjacentColumnSwaps() {
        assertThat(detect(6, swap01, swap12), is(new int[][]{{0, 1, 2}, {3, 4, 5}}));
    }

    @Test
    public void columnsAddedOnTheLeftComeFirst() {
        assertThat(detect(6, swap12, swap01), is(new int[][]{{0, 1, 2}, {3, 4, 5}}));
    }

    @Test
    public void columnOrderFollowsTheGenerators() {
        // (c0 c1) and (c0 c2) are adjacent swaps of the column order c2, c0, c1.
        assertThat(detect(6, swap01, swap02), is(new int[][]{{2, 0, 1}, {5, 3, 4}}));
    }

    @Test
    public void longerChain() {
        // Column c of a 2x4 matrix holds 2c and 2c+1.
        int n = 8;
        int[][] m = detect(n, swaps(n, 4, 6, 5, 7), swaps(n, 0, 2, 1, 3), swaps(n, 2, 4, 3, 5));
        assertThat(m, is(new int[][]{{0, 2, 4, 6}, {1, 3, 5, 7}}));
    }

    @Test
    public void singleGenerator() {
        assertThat(detect(6, swap01), is(new int[][]{{0, 1}, {3, 4}}));
    }

    @Test
    public void differentCycleCountsFail() {
        assertThat(detect(6, swap01, swaps(6, 1, 2)), is(nullValue()));
    }

    @Test
    public void longerCyclesFail() {
        assertThat(detect(3, new int[]{1, 2, 0}), is(nullValue()));
    }

    @Test
    public void partialIntersectionFails() {
        assertThat(detect(6, swap01, swaps(6, 1, 2, 3, 5)), is(nullValue()));
    }

    @Test
    public void unusedGeneratorFails() {
        assertThat(detect(10, swaps(10, 0, 1, 2, 3), swaps(10, 6, 7, 8, 9)), is(nullValue()));
    }

    @Test
    public void imageAlreadyInTheMatrixFails() {
        // After (c0 c1) and (c1 c2), (c0 c2) maps the left end column into the matrix.
        assertThat(detect(6, swap01, swap12, swap02), is(nullValue()));
    }

    @Test
    public void nonBinaryVariablesFail() {
        MipProblem.Builder b = MipProblem.builder();
        b.addBinary("b", 0);
        b.addVariable("i0", VarType.INTEGER, 0, 0, 3);
        b.addVariable("i1", VarType.INTEGER, 0, 0, 3);
        PermutationGroup g = group(b.build(), swaps(3, 1, 2));
        assertThat(OrbitopeDetector.detect(g, new int[]{0}), is(nullValue()));
    }

    @Test
    public void cycleStructure() {
        OrbitopeDetector.CycleStructure s = OrbitopeDetector.cycleStructure(swap01, 6);
        assertThat(s.involution, is(true));
        assertThat(s.nTwoCycles, is(2));
        assertThat(s.isBinaryInvolution(), is(true));
        assertThat(OrbitopeDetector.cycleStructure(new int[]{1, 2, 0, 3}, 4).involution, is(false));
        assertThat(OrbitopeDetector.cycleStructure(swap01, 3).allBinary, is(false));
    }
}
