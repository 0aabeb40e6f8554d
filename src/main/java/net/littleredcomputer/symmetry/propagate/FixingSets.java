package net.littleredcomputer.symmetry.propagate;

import gnu.trove.list.array.TIntArrayList;

/**
 * The variables fixed to 0 (bg0) and fixed or branched to 1 (bg1), each as a membership bitset
 * plus an append-only list. The 1-set can be extended temporarily past a checkpoint and rolled
 * back.
 */
final class FixingSets {
    private final boolean[] zero;
    private final boolean[] one;
    private final TIntArrayList zeroList = new TIntArrayList();
    private final TIntArrayList oneList = new TIntArrayList();

    FixingSets(int nVars) {
        zero = new boolean[nVars];
        one = new boolean[nVars];
    }

    /** @return false if v was already present */
    boolean addZero(int v) {
        if (zero[v]) return false;
        zero[v] = true;
        zeroList.add(v);
        return true;
    }

    /** @return false if v was already present */
    boolean addOne(int v) {
        if (one[v]) return false;
        one[v] = true;
        oneList.add(v);
        return true;
    }

    boolean isZero(int v) { return zero[v]; }
    boolean isOne(int v) { return one[v]; }
    int nZero() { return zeroList.size(); }
    int nOne() { return oneList.size(); }
    int zero(int i) { return zeroList.get(i); }
    int one(int i) { return oneList.get(i); }

    int checkpoint() { return oneList.size(); }

    /** Removes the 1-set entries added after the checkpoint. */
    void rollback(int checkpoint) {
        for (int i = checkpoint; i < oneList.size(); ++i) one[oneList.get(i)] = false;
        oneList.remove(checkpoint, oneList.size() - checkpoint);
    }

    int[] zeros() { return zeroList.toArray(); }
    int[] ones() { return oneList.toArray(); }
}
