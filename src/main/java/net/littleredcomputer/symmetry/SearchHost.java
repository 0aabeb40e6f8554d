package net.littleredcomputer.symmetry;

import net.littleredcomputer.symmetry.model.Variable;

import javax.annotation.CheckReturnValue;
import java.util.ArrayList;
import java.util.List;

/**
 * The parts of the search engine symmetry handling relies on. Bounds are only ever changed
 * through the tightening methods. Tightenings at the root node or during presolving are global.
 */
public interface SearchHost {
    SolverStage stage();

    SearchNode currentNode();

    boolean inProbing();

    /** True while a node is propagated again after its path to the root may have changed. */
    boolean inRepropagation();

    /** Number of runs so far; a restart starts a new run. */
    int nRuns();

    boolean isStopped();

    double lowerBound(Variable v);

    double upperBound(Variable v);

    @CheckReturnValue
    Tightening tightenLowerBound(Variable v, double value);

    @CheckReturnValue
    Tightening tightenUpperBound(Variable v, double value);

    /** @return a token identifying the registration */
    int addBoundChangeListener(Variable v, BoundChangeListener listener);

    void removeBoundChangeListener(int token);

    /** The nodes from n up to, but not including, the root. */
    default List<SearchNode> pathToRoot(SearchNode n) {
        List<SearchNode> path = new ArrayList<>();
        for (SearchNode node = n; node != null && node.depth() > 0; node = node.parent()) path.add(node);
        return path;
    }
}
