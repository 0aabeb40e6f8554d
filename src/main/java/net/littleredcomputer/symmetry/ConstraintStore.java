package net.littleredcomputer.symmetry;

import net.littleredcomputer.symmetry.breaking.SymmetryConstraint;

/** Receives the symmetry-handling constraints created for the model. */
public interface ConstraintStore {
    void add(SymmetryConstraint c);
}
