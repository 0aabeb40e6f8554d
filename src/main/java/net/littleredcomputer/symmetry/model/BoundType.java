package net.littleredcomputer.symmetry.model;

public enum BoundType {
    LOWER, UPPER
}
