package net.littleredcomputer.symmetry.group;

import gnu.trove.list.array.TIntArrayList;
import net.littleredcomputer.symmetry.model.ColoredMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Automorphisms of a colored matrix by individualization and refinement.
 *
 * The matrix is viewed as a bipartite graph of variable and row vertices joined by edges colored
 * with the entry colors. A partition of the vertices is refined until equitable; cell identifiers
 * are positions in an order derived only from colors and adjacency, so they are preserved by
 * automorphisms. The first path of the search tree individualizes the first vertex of the first
 * nontrivial variable cell until all variables are singletons. Then, from the deepest level up,
 * every other vertex of a level's target cell that is not yet in the orbit of the base point is
 * tried in its place; a leaf of the resulting subtree that maps onto the first leaf and preserves
 * the matrix yields a generator. The generators found stabilize the earlier base points, and the
 * orbit lengths of the base points give the group size.
 */
public class RefinementOracle implements AutomorphismOracle {
    private static final Logger log = LogManager.getFormatterLogger(RefinementOracle.class);
    private final long nodeLimit;

    public RefinementOracle(long nodeLimit) {
        if (nodeLimit < 1) throw new IllegalArgumentException("node limit must be positive");
        this.nodeLimit = nodeLimit;
    }

    public RefinementOracle() { this(1_000_000L); }

    @Override
    public Automorphisms compute(ColoredMatrix matrix, int maxGenerators) {
        if (maxGenerators < 0) throw new IllegalArgumentException("maxGenerators must be nonnegative");
        return new Search(matrix, maxGenerators, nodeLimit).run();
    }

    private static final class Search {
        private final ColoredMatrix m;
        private final int nVars;
        private final int nVertices;
        private final int[][] adj;
        private final int[][] adjColor;
        private final int maxGenerators;
        private final long nodeLimit;
        private long nodes = 0;
        private boolean complete = true;

        private final List<int[]> path = new ArrayList<>();
        private final List<int[]> shapes = new ArrayList<>();
        private final List<int[]> targets = new ArrayList<>();
        private final TIntArrayList base = new TIntArrayList();
        private int[] firstLeaf;

        private final List<int[]> generators = new ArrayList<>();
        private final UnionFind orbits;

        Search(ColoredMatrix m, int maxGenerators, long nodeLimit) {
            this.m = m;
            this.nVars = m.nVars();
            this.nVertices = m.nVars() + m.nRows();
            this.maxGenerators = maxGenerators;
            this.nodeLimit = nodeLimit;
            this.orbits = new UnionFind(nVars);
            int[] degree = new int[nVertices];
            for (int r = 0; r < m.nRows(); ++r) {
                degree[nVars + r] = m.rowEnd(r) - m.rowBegin(r);
                for (int e = m.rowBegin(r); e < m.rowEnd(r); ++e) ++degree[m.entryVar(e)];
            }
            adj = new int[nVertices][];
            adjColor = new int[nVertices][];
            for (int u = 0; u < nVertices; ++u) {
                adj[u] = new int[degree[u]];
                adjColor[u] = new int[degree[u]];
            }
            int[] fill = new int[nVertices];
            for (int r = 0; r < m.nRows(); ++r) {
                int row = nVars + r;
                for (int e = m.rowBegin(r); e < m.rowEnd(r); ++e) {
                    int v = m.entryVar(e);
                    int c = m.entryColor(e);
                    adj[row][fill[row]] = v;
                    adjColor[row][fill[row]++] = c;
                    adj[v][fill[v]] = row;
                    adjColor[v][fill[v]++] = c;
                }
            }
        }

        Automorphisms run() {
            int[] p = refine(initialPartition());
            int t;
            while ((t = targetCell(p)) >= 0) {
                int[] members = cellMembers(p, t);
                path.add(p);
                shapes.add(shape(p));
                targets.add(members);
                base.add(members[0]);
                p = refine(individualize(p, members[0]));
            }
            shapes.add(shape(p));
            firstLeaf = p;

            double log10 = 0;
            LEVELS:
            for (int level = path.size() - 1; level >= 0; --level) {
                int b = base.get(level);
                for (int w : targets.get(level)) {
                    if (w == b || orbits.same(w, b)) continue;
                    int[] gamma = search(refine(individualize(path.get(level), w)), level + 1);
                    if (!complete) break LEVELS;
                    if (gamma == null) continue;
                    if (maxGenerators > 0 && generators.size() >= maxGenerators) {
                        complete = false;
                        break LEVELS;
                    }
                    generators.add(gamma);
                    for (int v = 0; v < nVars; ++v) orbits.union(v, gamma[v]);
                }
                int orbitSize = 0;
                for (int w : targets.get(level)) if (orbits.same(w, b)) ++orbitSize;
                log10 += Math.log10(orbitSize);
            }
            log.debug("Refinement search: %d levels, %d nodes, %d generators, log10 group size %.2f%s",
                    path.size(), nodes, generators.size(), log10, complete ? "" : " (incomplete)");
            return new Automorphisms(generators, log10, complete);
        }

        /** Depth-first search below a node of the given depth for a leaf equivalent to the first leaf. */
        private int[] search(int[] p, int depth) {
            if (++nodes > nodeLimit) {
                complete = false;
                return null;
            }
            if (!Arrays.equals(shape(p), shapes.get(depth))) return null;
            int t = targetCell(p);
            if (t < 0) return leafAutomorphism(p);
            int[] members = cellMembers(p, t);
            int preferred = base.get(depth);
            // Trying the base point first keeps the generators close to transpositions.
            for (int i = -1; i < members.length; ++i) {
                int u;
                if (i < 0) {
                    if (Arrays.binarySearch(members, preferred) < 0) continue;
                    u = preferred;
                } else {
                    u = members[i];
                    if (u == preferred) continue;
                }
                int[] gamma = search(refine(individualize(p, u)), depth + 1);
                if (gamma != null || !complete) return gamma;
            }
            return null;
        }

        private int[] leafAutomorphism(int[] leaf) {
            int[] varAt = new int[nVertices];
            for (int v = 0; v < nVars; ++v) varAt[leaf[v]] = v;
            int[] gamma = new int[nVars];
            for (int v = 0; v < nVars; ++v) gamma[v] = varAt[firstLeaf[v]];
            return m.isAutomorphism(gamma) ? gamma : null;
        }

        private int[] initialPartition() {
            int[] color = new int[nVertices];
            for (int v = 0; v < nVars; ++v) color[v] = m.varColor(v);
            for (int r = 0; r < m.nRows(); ++r) color[nVars + r] = m.nUniqueVars() + m.rowColor(r);
            Integer[] order = IntStream.range(0, nVertices).boxed().toArray(Integer[]::new);
            Arrays.sort(order, Comparator.comparingInt(u -> color[u]));
            int[] cell = new int[nVertices];
            int start = 0;
            for (int k = 0; k < nVertices; ++k) {
                if (k > 0 && color[order[k]] != color[order[k - 1]]) start = k;
                cell[order[k]] = start;
            }
            return cell;
        }

        /** Splits cells by the colored multiset of neighbor cells until nothing changes. */
        private int[] refine(int[] cell) {
            int nCells = countCells(cell);
            while (true) {
                final int[] current = cell;
                final long[][] sig = new long[nVertices][];
                for (int u = 0; u < nVertices; ++u) {
                    long[] s = new long[adj[u].length];
                    for (int k = 0; k < s.length; ++k) s[k] = ((long) adjColor[u][k] << 32) | current[adj[u][k]];
                    Arrays.sort(s);
                    sig[u] = s;
                }
                Integer[] order = IntStream.range(0, nVertices).boxed().toArray(Integer[]::new);
                Arrays.sort(order, (a, b) -> current[a] != current[b] ? Integer.compare(current[a], current[b]) : Arrays.compare(sig[a], sig[b]));
                int[] next = new int[nVertices];
                int start = 0;
                for (int k = 0; k < nVertices; ++k) {
                    int u = order[k];
                    if (k > 0) {
                        int prev = order[k - 1];
                        if (current[prev] != current[u] || !Arrays.equals(sig[prev], sig[u])) start = k;
                    }
                    next[u] = start;
                }
                int n = countCells(next);
                if (n == nCells) return next;
                nCells = n;
                cell = next;
            }
        }

        private int countCells(int[] cell) {
            boolean[] seen = new boolean[nVertices];
            int n = 0;
            for (int c : cell) {
                if (!seen[c]) {
                    seen[c] = true;
                    ++n;
                }
            }
            return n;
        }

        private int[] individualize(int[] cell, int w) {
            int[] next = cell.clone();
            for (int u = 0; u < nVertices; ++u) {
                if (u != w && cell[u] == cell[w]) next[u] = cell[w] + 1;
            }
            return next;
        }

        /** The first variable cell with more than one member, or -1 if all variables are singletons. */
        private int targetCell(int[] cell) {
            int[] size = new int[nVertices];
            for (int v = 0; v < nVars; ++v) ++size[cell[v]];
            int best = -1;
            for (int v = 0; v < nVars; ++v) {
                if (size[cell[v]] > 1 && (best < 0 || cell[v] < best)) best = cell[v];
            }
            return best;
        }

        private int[] cellMembers(int[] cell, int t) {
            TIntArrayList members = new TIntArrayList();
            for (int v = 0; v < nVars; ++v) if (cell[v] == t) members.add(v);
            return members.toArray();
        }

        private static int[] shape(int[] cell) {
            int[] s = cell.clone();
            Arrays.sort(s);
            return s;
        }
    }
}
