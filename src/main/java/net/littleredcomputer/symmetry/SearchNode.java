package net.littleredcomputer.symmetry;

import java.util.List;

public interface SearchNode {
    /** Unique number of the node within the solve. */
    long number();

    /** 0 at the root. */
    int depth();

    /** The parent node, or null at the root. */
    SearchNode parent();

    /**
     * The bound changes applied when the node was created and processed. Branching decisions
     * come first.
     */
    List<BoundChange> boundChanges();
}
