package net.littleredcomputer.symmetry;

import net.littleredcomputer.symmetry.model.Variable;

/**
 * Receives global bound changes of the variables it is registered for. The host calls it
 * synchronously, before the call that changed the bound returns. Implementations only record the
 * change; they must not request bound changes or start propagation from inside the callback.
 */
public interface BoundChangeListener {
    void globalLowerBoundChanged(Variable v, double oldBound, double newBound);

    void globalUpperBoundChanged(Variable v, double oldBound, double newBound);
}
