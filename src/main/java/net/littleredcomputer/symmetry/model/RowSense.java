package net.littleredcomputer.symmetry.model;

/**
 * Relation of a row of the colored matrix. The declaration order is the order in which right-hand
 * sides are sorted before coloring. The last five senses mark rows derived from constraints whose
 * meaning is not that of a plain linear equation.
 */
public enum RowSense {
    EQUATION, INEQUALITY, XOR, AND, OR, BOUNDDISJ_TYPE1, BOUNDDISJ_TYPE2;

    boolean isSpecial() { return ordinal() > INEQUALITY.ordinal(); }
}
