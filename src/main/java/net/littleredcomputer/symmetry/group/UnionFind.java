package net.littleredcomputer.symmetry.group;

import java.util.Arrays;

/**
 * Disjoint sets over 0..n-1 with path compression and union by rank.
 */
public final class UnionFind {
    private final int[] parent;
    private final int[] rank;
    private int nSets;

    public UnionFind(int n) {
        parent = new int[n];
        rank = new int[n];
        clear();
    }

    private UnionFind(UnionFind other) {
        parent = other.parent.clone();
        rank = other.rank.clone();
        nSets = other.nSets;
    }

    public UnionFind copy() { return new UnionFind(this); }

    public void clear() {
        for (int i = 0; i < parent.length; ++i) parent[i] = i;
        Arrays.fill(rank, 0);
        nSets = parent.length;
    }

    public int nSets() { return nSets; }

    public int find(int x) {
        int root = x;
        while (parent[root] != root) root = parent[root];
        while (parent[x] != root) {
            int next = parent[x];
            parent[x] = root;
            x = next;
        }
        return root;
    }

    /**
     * Merges the sets containing a and b.
     * @return false if they were already the same set
     */
    public boolean union(int a, int b) {
        int ra = find(a);
        int rb = find(b);
        if (ra == rb) return false;
        if (rank[ra] < rank[rb]) {
            parent[ra] = rb;
        } else if (rank[ra] > rank[rb]) {
            parent[rb] = ra;
        } else {
            parent[rb] = ra;
            ++rank[ra];
        }
        --nSets;
        return true;
    }

    public boolean same(int a, int b) { return find(a) == find(b); }
}
