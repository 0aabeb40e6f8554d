package net.littleredcomputer.symmetry.group;

import net.littleredcomputer.symmetry.model.ColoredMatrix;

/**
 * Computes generators of the automorphism group of a colored matrix, as permutations of its
 * variables.
 */
public interface AutomorphismOracle {
    /**
     * @param maxGenerators stop after this many generators; 0 for no limit
     * @return the generators found; incomplete if a limit stopped the computation early
     */
    Automorphisms compute(ColoredMatrix matrix, int maxGenerators);
}
